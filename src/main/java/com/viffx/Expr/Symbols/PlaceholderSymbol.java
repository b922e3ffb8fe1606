package com.viffx.Expr.Symbols;

import java.util.Objects;

/**
 * Stands in for a reduced nonterminal on the parser stack. Carries no semantic value.
 */
public record PlaceholderSymbol(NonTerminal nonTerminal) implements Symbol {
    public static final String LEXEME = "non-terminal";

    public PlaceholderSymbol {
        Objects.requireNonNull(nonTerminal, "nonTerminal");
    }

    @Override
    public TokenType type() {
        return TokenType.NONTERMINAL_PLACEHOLDER;
    }

    @Override
    public String value() {
        return LEXEME;
    }

    @Override
    public String render() {
        return String.format("<%s, \"%s\", 0, 0>", nonTerminal.name(), LEXEME);
    }

    @Override
    public String toString() {
        return nonTerminal.name();
    }
}
