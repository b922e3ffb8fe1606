package com.viffx.Expr.Lexer;

import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The input syntaxes the parser accepts.
 */
public enum TokenSourceFormat {
    /** Arithmetic text, e.g. {@code 2 + 3}. */
    RAW,
    /** Tagged pairs, e.g. {@code <2, NUM> <+, PLUS> <3, NUM>}. */
    TAGGED,
    /** {@link #TAGGED} if the first non-blank character is {@code <}, {@link #RAW} otherwise. */
    AUTO;

    /**
     * Reads and scans a whole file.
     *
     * @throws IOException if the file cannot be read
     */
    @NotNull
    public TokenBuffer open(Path file) throws IOException {
        return scan(Files.readString(file, StandardCharsets.UTF_8));
    }

    @NotNull
    public TokenBuffer scan(String text) throws IOException {
        TokenSource source = switch (resolve(text)) {
            case TAGGED -> new TaggedTokenLexer(new StringReader(text));
            default -> new ArithmeticLexer(new StringReader(text));
        };
        return new TokenBuffer(source.tokenize());
    }

    TokenSourceFormat resolve(String text) {
        if (this != AUTO) return this;
        String stripped = text.stripLeading();
        return !stripped.isEmpty() && stripped.charAt(0) == '<' ? TAGGED : RAW;
    }
}
