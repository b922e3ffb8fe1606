package com.viffx.Expr.Trace;

import com.viffx.Expr.Automata.ActionType;
import com.viffx.Expr.Symbols.Token;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of one parser step, taken before the step's action is applied.
 *
 * @param step      1-based step number
 * @param state     automaton state on top of the stack
 * @param stack     rendered stack contents, bottom to top
 * @param window    lookahead token followed by at most four more, end-of-input excluded
 * @param operation the kind of action decided for this step
 * @param action    human readable action text
 */
public record TraceRecord(int step, int state, String stack, List<Token> window, ActionType operation, String action) {
    public TraceRecord {
        Objects.requireNonNull(stack, "stack");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(action, "action");
        window = List.copyOf(window);
    }
}
