package com.viffx.Expr.Parser;

import com.viffx.Expr.Symbols.Token;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Outcome of one parse.
 *
 * @param status       {@link ParseStatus#ACCEPTED} or {@link ParseStatus#FAILED}
 * @param errorLine    line of the offending token, 0 if there is none
 * @param errorColumn  column of the offending token, 0 if there is none
 * @param errorLexeme  lexeme of the offending token, {@code null} if there is none
 * @param errorMessage description of the failure, {@code null} on success
 * @param stepsTaken   number of driver iterations, the final accept or error step included
 */
public record ParseResult(ParseStatus status, int errorLine, int errorColumn, String errorLexeme,
                          String errorMessage, int stepsTaken) {
    public ParseResult {
        if (status == ParseStatus.RUNNING) throw new IllegalArgumentException("A result needs a final status");
    }

    @NotNull
    @Contract("_ -> new")
    public static ParseResult accepted(int steps) {
        return new ParseResult(ParseStatus.ACCEPTED, 0, 0, null, null, steps);
    }

    @NotNull
    @Contract("_, _ -> new")
    public static ParseResult syntaxError(Token offending, int steps) {
        String message = String.format("Syntax error at line %d, column %d: unexpected token '%s'",
                offending.line(), offending.column(), offending.lexeme());
        return new ParseResult(ParseStatus.FAILED, offending.line(), offending.column(), offending.lexeme(), message, steps);
    }

    @NotNull
    @Contract("_, _ -> new")
    public static ParseResult failure(String message, int steps) {
        return new ParseResult(ParseStatus.FAILED, 0, 0, null, message, steps);
    }

    public boolean success() {
        return status == ParseStatus.ACCEPTED;
    }
}
