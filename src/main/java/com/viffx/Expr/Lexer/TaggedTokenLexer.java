package com.viffx.Expr.Lexer;

import com.viffx.Expr.Symbols.Token;
import com.viffx.Expr.Symbols.TokenType;
import com.viffx.Expr.Utils.LexicalCharacterBuffer;

import java.io.IOException;
import java.io.Reader;

import static java.lang.Character.isWhitespace;

/**
 * Scans the output of an earlier scanner stage: whitespace separated pairs of the form
 * {@code <lexeme, TYPE>}, e.g. {@code <2, NUM> <+, PLUS> <3, NUM>}.
 * <p>
 * The type is matched case-insensitively against {@code NUM, PLUS, STAR, LPAREN, RPAREN}.
 * A pair with an unknown type, a pair whose lexeme does not spell its type (e.g.
 * {@code <abc, NUM>}), a pair missing its comma or closing {@code >}, and any text outside
 * a pair all become {@code INVALID} tokens carrying the raw text.
 */
public class TaggedTokenLexer implements TokenSource {
    private final LexicalCharacterBuffer buffer;
    private int line = 1;
    private int column = 1;

    public TaggedTokenLexer(Reader source) throws IOException {
        buffer = new LexicalCharacterBuffer(source) {
            @Override
            public void onNextChar() {
                if (crntChar() == '\n') {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
            }
        };
    }

    @Override
    public Token next() throws IOException {
        while (!buffer.eof() && isWhitespace(buffer.crntChar())) {
            buffer.nextChar();
        }
        if (buffer.eof()) return Token.endOfInput(line, column);

        int startLine = line;
        int startColumn = column;
        if (buffer.crntChar() != '<') {
            return new Token(TokenType.INVALID, word(), startLine, startColumn);
        }

        // Consume through the closing '>' of the pair
        StringBuilder raw = new StringBuilder();
        boolean closed = false;
        while (!buffer.eof() && !closed) {
            char c = buffer.crntChar();
            if (c == '\n') break;
            raw.append(c);
            closed = c == '>' && raw.length() > 1;
            buffer.nextChar();
        }
        String text = raw.toString();
        if (!closed) return new Token(TokenType.INVALID, text, startLine, startColumn);

        String body = text.substring(1, text.length() - 1);
        int comma = body.lastIndexOf(',');
        if (comma < 0) return new Token(TokenType.INVALID, text, startLine, startColumn);

        String lexeme = body.substring(0, comma).trim();
        TokenType type = TokenType.fromTag(body.substring(comma + 1));
        if (!type.spells(lexeme)) {
            return new Token(TokenType.INVALID, text, startLine, startColumn);
        }
        return new Token(type, lexeme, startLine, startColumn);
    }

    private String word() throws IOException {
        StringBuilder builder = new StringBuilder();
        while (!buffer.eof() && !isWhitespace(buffer.crntChar())) {
            builder.append(buffer.crntChar());
            buffer.nextChar();
        }
        return builder.toString();
    }
}
