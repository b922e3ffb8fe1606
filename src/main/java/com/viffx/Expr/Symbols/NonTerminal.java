package com.viffx.Expr.Symbols;

/**
 * Nonterminals of the expression grammar, in goto table column order.
 */
public enum NonTerminal implements GrammarSymbol {
    S,
    E,
    T,
    F;

    @Override
    public String grammarText() {
        return name();
    }
}
