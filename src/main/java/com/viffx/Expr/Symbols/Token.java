package com.viffx.Expr.Symbols;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public record Token(TokenType type, String lexeme, int line, int column) implements Symbol {
    /**
     * The end-of-input marker paired with state 0 at the bottom of every parser stack.
     */
    public static final Token BOTTOM = new Token(TokenType.END_OF_INPUT, "$", 0, 0);

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(lexeme, "lexeme");
        if (type == TokenType.NONTERMINAL_PLACEHOLDER) {
            throw new IllegalArgumentException("Nonterminals are represented by PlaceholderSymbol, not Token");
        }
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("Negative token position: " + line + ":" + column);
        }
    }

    @NotNull
    @Contract("_, _ -> new")
    public static Token endOfInput(int line, int column) {
        return new Token(TokenType.END_OF_INPUT, "EOF", line, column);
    }

    public boolean isEndOfInput() {
        return type == TokenType.END_OF_INPUT;
    }

    @Override
    public String value() {
        return lexeme;
    }

    /**
     * Renders the token as {@code <TYPE, "lexeme", line, column>}. Backslashes and double
     * quotes inside the lexeme are escaped with a backslash.
     */
    @Override
    public String render() {
        return String.format("<%s, \"%s\", %d, %d>", type.displayName(), escape(lexeme), line, column);
    }

    private static String escape(String lexeme) {
        return lexeme.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    @Override
    public String toString() {
        return render();
    }
}
