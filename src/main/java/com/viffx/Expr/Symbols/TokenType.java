package com.viffx.Expr.Symbols;

import java.util.Locale;

public enum TokenType implements GrammarSymbol {
    // Terminals, in action table column order
    NUM("NUM", "NUM"),
    PLUS("PLUS", "+"),
    STAR("STAR", "*"),
    LPAREN("LPAREN", "("),
    RPAREN("RPAREN", ")"),
    END_OF_INPUT("EOF", "$"),

    // Never appear in the action table
    INVALID("INVALID", "?"),
    NONTERMINAL_PLACEHOLDER("NON_TERMINAL", "?");

    private final String displayName;
    private final String grammarText;

    TokenType(String displayName, String grammarText) {
        this.displayName = displayName;
        this.grammarText = grammarText;
    }

    public String displayName() {
        return displayName;
    }

    @Override
    public String grammarText() {
        return grammarText;
    }

    public boolean isTerminal() {
        return ordinal() <= END_OF_INPUT.ordinal();
    }

    /**
     * Checks that a lexeme is a spelling of this terminal: one or more ASCII digits for
     * {@link #NUM}, the symbol itself for the punctuation terminals.
     */
    public boolean spells(String lexeme) {
        return switch (this) {
            case NUM -> !lexeme.isEmpty() && lexeme.chars().allMatch(c -> c >= '0' && c <= '9');
            case PLUS, STAR, LPAREN, RPAREN -> grammarText.equals(lexeme);
            default -> false;
        };
    }

    /**
     * Looks up the type named by a tag in tagged token input, e.g. {@code NUM} in {@code <2, NUM>}.
     * Only the five real terminals can be tagged.
     *
     * @return the matching type, or {@link #INVALID} if the tag names none of them
     */
    public static TokenType fromTag(String tag) {
        String name = tag.trim().toUpperCase(Locale.ROOT);
        for (TokenType type : values()) {
            if (type.isTerminal() && type != END_OF_INPUT && type.name().equals(name)) return type;
        }
        return INVALID;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
