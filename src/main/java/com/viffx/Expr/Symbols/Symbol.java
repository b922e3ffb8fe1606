package com.viffx.Expr.Symbols;

/**
 * Anything that can sit on the parser stack: a lexical {@link Token} or the
 * {@link PlaceholderSymbol} left behind by a reduction.
 */
public sealed interface Symbol permits Token, PlaceholderSymbol {
    TokenType type();
    String value();

    /**
     * Renders the symbol as {@code <TYPE, "lexeme", line, column>}.
     */
    String render();
}
