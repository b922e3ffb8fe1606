package com.viffx.Expr.Utils;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Naming rules for files derived from an input file.
 */
public final class OutputFiles {
    public static final String TRACE_SUFFIX = "_p3dbg.txt";

    private OutputFiles() {}

    /**
     * Derives the trace file name for an input: the directory part and the final
     * extension are dropped and {@value #TRACE_SUFFIX} is appended, so
     * {@code tests/input1.cscn} becomes {@code input1_p3dbg.txt}.
     * A leading dot (as in {@code .expr}) does not start an extension.
     */
    public static String traceFileName(Path input) {
        Objects.requireNonNull(input, "input");
        Path fileName = input.getFileName();
        if (fileName == null) throw new IllegalArgumentException("Input path has no file name: " + input);
        return stripExtension(fileName.toString()) + TRACE_SUFFIX;
    }

    /**
     * Resolves the trace file for {@code input} inside {@code directory}.
     */
    public static Path traceFileFor(Path input, Path directory) {
        return directory.resolve(traceFileName(input));
    }

    static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
