package com.viffx.Expr.Lexer;

import com.viffx.Expr.Symbols.Token;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * A scanner producing tokens one at a time. After the end-of-input token every
 * further call returns another end-of-input token.
 */
public interface TokenSource {
    Token next() throws IOException;

    /**
     * Scans the whole input, end-of-input token included.
     */
    default List<Token> tokenize() throws IOException {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = next();
            tokens.add(token);
        } while (!token.isEndOfInput());
        return tokens;
    }
}
