package com.viffx.Expr.Parser;

import com.viffx.Expr.Lexer.TokenSourceFormat;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.hamcrest.CoreMatchers.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.*;

public class ParserFileTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static Path resource(String name) throws URISyntaxException {
        return Paths.get(ParserFileTest.class.getResource("/" + name).toURI());
    }

    private static String expectedTrace(String name) throws IOException {
        try (InputStream in = ParserFileTest.class.getResourceAsStream("/traces/" + name)) {
            return IOUtils.toString(in, StandardCharsets.UTF_8);
        }
    }

    private ParserOptions options(Path input) {
        return new ParserOptions(input, folder.getRoot().toPath(), false, TokenSourceFormat.AUTO);
    }

    @Test
    public void acceptedParseWritesTheFullTrace() throws Exception {
        ParserOptions options = options(resource("inputs/single_number.cscn"));

        ParseResult result = new Parser().parse(options);

        assertTrue(result.success());
        assertEquals(5, result.stepsTaken());
        File trace = options.traceFile().toFile();
        assertEquals("single_number_p3dbg.txt", trace.getName());
        assertEquals(expectedTrace("single_number_p3dbg.txt"), FileUtils.readFileToString(trace, StandardCharsets.UTF_8));
    }

    @Test
    public void failedParseKeepsTheTraceUpToTheError() throws Exception {
        ParserOptions options = options(resource("inputs/missing_factor.cscn"));

        ParseResult result = new Parser().parse(options);

        assertFalse(result.success());
        assertEquals(1, result.errorLine());
        assertEquals(expectedTrace("missing_factor_p3dbg.txt"),
                FileUtils.readFileToString(options.traceFile().toFile(), StandardCharsets.UTF_8));
    }

    @Test
    public void taggedFileIsDetected() throws Exception {
        ParseResult result = new Parser().parse(options(resource("inputs/tagged_expression.txt")));

        assertTrue(result.success());
        assertEquals(24, result.stepsTaken());
    }

    @Test
    public void missingInputIsReportedWithoutParsing() {
        Path missing = folder.getRoot().toPath().resolve("nope.cscn");
        ParserOptions options = options(missing);

        ParseResult result = new Parser().parse(options);

        assertFalse(result.success());
        assertEquals(0, result.stepsTaken());
        assertEquals("Failed to open input file: " + missing, result.errorMessage());
        assertFalse(options.traceFile().toFile().exists());
    }

    @Test
    public void uncreatableTraceFileIsReported() throws Exception {
        Path input = resource("inputs/single_number.cscn");
        Path noSuchDirectory = folder.getRoot().toPath().resolve("absent").resolve("deeper");
        ParserOptions options = new ParserOptions(input, noSuchDirectory, false, TokenSourceFormat.AUTO);

        ParseResult result = new Parser().parse(options);

        assertFalse(result.success());
        assertThat(result.errorMessage(), startsWith("Failed to open trace file: "));
        assertEquals(0, result.stepsTaken());
    }
}
