package com.viffx.Expr.Symbols;

/**
 * A symbol that may appear on either side of a production: a terminal
 * {@link TokenType} or a {@link NonTerminal}.
 */
public interface GrammarSymbol {
    /**
     * Returns the text used for this symbol inside a rule, e.g. {@code +} or {@code E}.
     */
    String grammarText();
}
