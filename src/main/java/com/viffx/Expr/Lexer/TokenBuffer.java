package com.viffx.Expr.Lexer;

import com.viffx.Expr.Symbols.Token;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@link TokenStream} over a fully scanned, immutable token list. The parser stack
 * refers to these tokens directly; nothing is copied on shift.
 */
public final class TokenBuffer implements TokenStream {
    private final List<Token> tokens;
    private int index = 0;

    /**
     * @param tokens scanned tokens, the last of which must be the end-of-input token
     */
    public TokenBuffer(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
        if (this.tokens.isEmpty() || !this.tokens.get(this.tokens.size() - 1).isEndOfInput()) {
            throw new IllegalArgumentException("Token sequence must end with an end-of-input token");
        }
        for (int i = 0; i < this.tokens.size() - 1; i++) {
            if (this.tokens.get(i).isEndOfInput()) {
                throw new IllegalArgumentException("End-of-input token at position " + i + " is not last");
            }
        }
    }

    /**
     * Builds a buffer from real tokens, appending an end-of-input token positioned after the last one.
     */
    @NotNull
    public static TokenBuffer terminated(List<Token> tokens) {
        List<Token> all = new ArrayList<>(tokens);
        if (all.isEmpty()) {
            all.add(Token.endOfInput(1, 1));
        } else {
            Token last = all.get(all.size() - 1);
            all.add(Token.endOfInput(last.line(), last.column() + last.lexeme().length()));
        }
        return new TokenBuffer(all);
    }

    @Override
    public boolean hasCurrent() {
        return index < tokens.size();
    }

    @Override
    public Token current() {
        return tokens.get(index);
    }

    @Override
    public void advance() {
        if (!current().isEndOfInput()) index++;
    }

    @Override
    public List<Token> window(int size) {
        int end = Math.min(index + size, tokens.size() - 1);
        return index >= end ? List.of() : tokens.subList(index, end);
    }

    public List<Token> tokens() {
        return tokens;
    }

    public int position() {
        return index;
    }
}
