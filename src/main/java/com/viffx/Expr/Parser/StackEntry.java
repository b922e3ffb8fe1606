package com.viffx.Expr.Parser;

import com.viffx.Expr.Symbols.Symbol;

import java.util.Objects;

public record StackEntry(int state, Symbol symbol) {
    public StackEntry {
        if (state < 0) throw new IllegalArgumentException("States must be positive");
        Objects.requireNonNull(symbol, "symbol");
    }

    public String render() {
        return "[" + state + " " + symbol.render() + "]";
    }
}
