package com.viffx.Expr;

import com.viffx.Expr.Automata.ParsingTable;
import com.viffx.Expr.Lexer.TokenSourceFormat;
import com.viffx.Expr.Parser.ParseResult;
import com.viffx.Expr.Parser.Parser;
import com.viffx.Expr.Parser.ParserOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

@Command(
        name = "lrtrace",
        mixinStandardHelpOptions = true,
        version = "lrtrace 1.0",
        description = {
                "Parses an arithmetic expression with a shift-reduce automaton and traces every step.",
                "The trace is written to <input name>_p3dbg.txt."
        })
public class Main implements Callable<Integer> {
    static final int EXIT_FAILURE = 1;

    @Parameters(index = "0", paramLabel = "FILE", description = "Expression to parse, raw text or <lexeme, TYPE> pairs.")
    Path input;

    @Option(names = {"-o", "--trace-dir"}, paramLabel = "DIR", description = "Directory for the trace file (default: working directory).")
    Path traceDirectory = Path.of("");

    @Option(names = {"-q", "--quiet"}, description = "Do not echo trace steps to the console.")
    boolean quiet;

    @Option(names = "--format", paramLabel = "FORMAT", description = "Input syntax: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    TokenSourceFormat format = TokenSourceFormat.AUTO;

    @Option(names = "--table", description = "Print the parsing table before parsing.")
    boolean printTable;

    @Option(names = {"-v", "--verbose"}, description = "Log progress messages.")
    boolean verbose;

    public static void main(String[] args) {
        configureLogging();
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (verbose) Logger.getLogger("").setLevel(Level.INFO);

        ParserOptions options = new ParserOptions(input, traceDirectory, !quiet, format);
        if (printTable) System.out.println(ParsingTable.expressions());

        System.out.println("Starting parser...");
        System.out.println("Input file: " + input);
        System.out.println("Output file: " + options.traceFile());

        ParseResult result = new Parser().parse(options);
        if (result.success()) {
            System.out.println();
            System.out.println("Parsing completed successfully.");
            System.out.println("Steps taken: " + result.stepsTaken());
            System.out.println("Output saved to " + options.traceFile());
            return CommandLine.ExitCode.OK;
        }

        System.err.println();
        System.err.println("Parsing failed!");
        System.err.println("Error: " + result.errorMessage());
        if (result.errorLine() > 0) {
            System.err.println("Error occurred at line " + result.errorLine());
        }
        return EXIT_FAILURE;
    }

    private static void configureLogging() {
        try (InputStream config = Main.class.getResourceAsStream("/logging.properties")) {
            if (config != null) LogManager.getLogManager().readConfiguration(config);
        } catch (IOException e) {
            System.err.println("Could not load logging configuration: " + e.getMessage());
        }
    }
}
