package com.viffx.Expr.Automata;

public enum ActionType {
    SHIFT,
    REDUCE,
    ACCEPT,
    ERROR
}
