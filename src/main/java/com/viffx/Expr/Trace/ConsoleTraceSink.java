package com.viffx.Expr.Trace;

import java.io.PrintStream;

/**
 * Echoes trace blocks to a console stream, separated by a dashed line.
 */
public class ConsoleTraceSink implements TraceSink {
    static final String SEPARATOR = "--------------------";

    private final PrintStream out;

    public ConsoleTraceSink(PrintStream out) {
        this.out = out;
    }

    @Override
    public void write(TraceRecord record) {
        out.println(TraceRecorder.format(record));
        out.println(SEPARATOR);
    }

    @Override
    public void close() {
        out.flush();
    }
}
