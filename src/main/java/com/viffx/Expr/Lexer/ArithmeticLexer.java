package com.viffx.Expr.Lexer;

import com.viffx.Expr.Symbols.Token;
import com.viffx.Expr.Symbols.TokenType;
import com.viffx.Expr.Utils.LexicalCharacterBuffer;

import java.io.IOException;
import java.io.Reader;

import static com.viffx.Expr.Symbols.TokenType.*;
import static java.lang.Character.isWhitespace;

/**
 * Scans raw arithmetic text such as {@code 2 + 3 * (4 + 5)}.
 * <p>
 * {@code + * ( )} are single character tokens and a run of ASCII digits is a {@code NUM}.
 * Any other non-blank character becomes a one character {@code INVALID} token, which
 * the parser reports as a syntax error at that position.
 */
public class ArithmeticLexer implements TokenSource {
    private final LexicalCharacterBuffer buffer;
    // Position of buffer.crntChar(), both 1-based
    private int line = 1;
    private int column = 1;

    public ArithmeticLexer(Reader source) throws IOException {
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

        char c = buffer.crntChar();
        return switch (c) {
            case '+' -> single(PLUS);
            case '*' -> single(STAR);
            case '(' -> single(LPAREN);
            case ')' -> single(RPAREN);
            default -> isDigit(c) ? number() : single(INVALID);
        };
    }

    private Token single(TokenType type) throws IOException {
        Token token = new Token(type, String.valueOf(buffer.crntChar()), line, column);
        buffer.nextChar();
        return token;
    }

    private Token number() throws IOException {
        int startLine = line;
        int startColumn = column;
        StringBuilder builder = new StringBuilder();
        while (!buffer.eof() && isDigit(buffer.crntChar())) {
            builder.append(buffer.crntChar());
            buffer.nextChar();
        }
        return new Token(NUM, builder.toString(), startLine, startColumn);
    }

    // ASCII only; other Unicode digits are INVALID
    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
