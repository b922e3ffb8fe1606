package com.viffx.Expr.Trace;

import java.io.Closeable;
import java.io.IOException;

/**
 * Destination for trace records.
 */
@FunctionalInterface
public interface TraceSink extends Closeable {
    void write(TraceRecord record) throws IOException;

    @Override
    default void close() throws IOException {}
}
