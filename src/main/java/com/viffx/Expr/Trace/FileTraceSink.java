package com.viffx.Expr.Trace;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes trace blocks to a file, each followed by a blank line.
 */
public class FileTraceSink implements TraceSink {
    private final BufferedWriter writer;

    private FileTraceSink(BufferedWriter writer) {
        this.writer = writer;
    }

    /**
     * Creates (or truncates) the trace file.
     *
     * @throws IOException if the file cannot be created
     */
    public static FileTraceSink create(Path path) throws IOException {
        return new FileTraceSink(Files.newBufferedWriter(path, StandardCharsets.UTF_8));
    }

    @Override
    public void write(TraceRecord record) throws IOException {
        writer.write(TraceRecorder.format(record));
        writer.write("\n\n");
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
