package com.viffx.Expr.Parser;

import com.viffx.Expr.Lexer.TokenSourceFormat;
import com.viffx.Expr.Utils.OutputFiles;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings for parsing one input file.
 *
 * @param input          file to parse
 * @param traceDirectory directory receiving the trace file
 * @param console        whether trace blocks are echoed to standard output
 * @param format         syntax of the input file
 */
public record ParserOptions(Path input, Path traceDirectory, boolean console, TokenSourceFormat format) {
    public ParserOptions {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(traceDirectory, "traceDirectory");
        Objects.requireNonNull(format, "format");
    }

    public Path traceFile() {
        return OutputFiles.traceFileFor(input, traceDirectory);
    }
}
