package com.viffx.Expr.Parser;

/**
 * Raised when the parser reaches a configuration that a consistent table and driver
 * can never produce, such as popping the bottom of the stack or a missing goto.
 * It signals a defect, not malformed input.
 */
public class InternalParserError extends RuntimeException {
    public InternalParserError(String message) {
        super(message);
    }
}
