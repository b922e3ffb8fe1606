package com.viffx.Expr.Trace;

import com.viffx.Expr.Symbols.Token;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Formats parser steps and hands each record to every configured sink.
 */
public class TraceRecorder implements Closeable {
    public static final String END_OF_INPUT = "End of Input";

    private final List<TraceSink> sinks;

    public TraceRecorder(List<TraceSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    public TraceRecorder(TraceSink... sinks) {
        this(List.of(sinks));
    }

    public void record(TraceRecord record) throws IOException {
        for (TraceSink sink : sinks) {
            sink.write(record);
        }
    }

    /**
     * Renders one step as the six line block written to trace files, without the
     * trailing blank line.
     */
    public static String format(TraceRecord record) {
        return "Step " + record.step() + ":\n" +
                "Current State: " + record.state() + "\n" +
                "Stack Contents: " + record.stack() + "\n" +
                "Input Position: " + formatWindow(record.window()) + "\n" +
                "Operation: " + record.operation() + "\n" +
                "Action: " + record.action();
    }

    public static String formatWindow(List<Token> window) {
        if (window.isEmpty()) return END_OF_INPUT;
        return window.stream().map(Token::render).collect(Collectors.joining(" "));
    }

    /**
     * Closes every sink, even if an earlier one fails; the first failure is rethrown.
     */
    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (TraceSink sink : sinks) {
            try {
                sink.close();
            } catch (IOException e) {
                if (failure == null) failure = e;
                else failure.addSuppressed(e);
            }
        }
        if (failure != null) throw failure;
    }
}
