package com.viffx.Expr.Parser;

public enum ParseStatus {
    RUNNING,
    ACCEPTED,
    FAILED
}
