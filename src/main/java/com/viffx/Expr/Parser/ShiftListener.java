package com.viffx.Expr.Parser;

import com.viffx.Expr.Symbols.Token;

/**
 * Notified of every terminal the parser shifts, in input order.
 */
@FunctionalInterface
public interface ShiftListener {
    ShiftListener NONE = token -> {};

    void onShift(Token token);
}
