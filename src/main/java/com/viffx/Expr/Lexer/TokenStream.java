package com.viffx.Expr.Lexer;

import com.viffx.Expr.Symbols.Token;

import java.util.List;

/**
 * The parser's view of its input: a cursor over tokens that always ends with an
 * end-of-input token. Once the cursor reaches that token it stays there.
 */
public interface TokenStream {
    boolean hasCurrent();

    /**
     * The lookahead token. Never {@code null} while {@link #hasCurrent()} holds.
     */
    Token current();

    void advance();

    /**
     * Returns up to {@code size} real tokens starting at the lookahead. The end-of-input
     * token is never part of the window, so the window is empty once the input is used up.
     */
    List<Token> window(int size);
}
