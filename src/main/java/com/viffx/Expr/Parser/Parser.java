package com.viffx.Expr.Parser;

import com.viffx.Expr.Automata.Action;
import com.viffx.Expr.Automata.ActionType;
import com.viffx.Expr.Automata.ParsingTable;
import com.viffx.Expr.Automata.Production;
import com.viffx.Expr.Lexer.TokenStream;
import com.viffx.Expr.Symbols.PlaceholderSymbol;
import com.viffx.Expr.Symbols.Token;
import com.viffx.Expr.Trace.ConsoleTraceSink;
import com.viffx.Expr.Trace.FileTraceSink;
import com.viffx.Expr.Trace.TraceRecord;
import com.viffx.Expr.Trace.TraceRecorder;
import com.viffx.Expr.Trace.TraceSink;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Table-driven shift-reduce parser. Each step reads the state on top of the stack and the
 * lookahead kind, records the configuration, then shifts, reduces, accepts or stops at the
 * first syntax error. There is no error recovery.
 * <p>
 * A parser holds no per-parse state, so one instance can run any number of sequential parses.
 */
public class Parser {
    private static final Logger LOGGER = Logger.getLogger(Parser.class.getName());

    static final int INPUT_WINDOW = 5;
    static final String INVALID_SYNTAX = "Invalid syntax";

    private final ParsingTable table;
    private ShiftListener shiftListener = ShiftListener.NONE;

    public Parser() {
        this(ParsingTable.expressions());
    }

    public Parser(ParsingTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public Parser onShift(ShiftListener listener) {
        this.shiftListener = Objects.requireNonNull(listener, "listener");
        return this;
    }

    // === File driven parse ===
    /**
     * Parses the configured input file, writing the trace file and, if enabled, echoing
     * every step to standard output. Files are closed on every path out of this method.
     *
     * @return the outcome; I/O problems are reported as failed results
     */
    public ParseResult parse(ParserOptions options) {
        Path input = options.input();
        Path traceFile = options.traceFile();

        LOGGER.info("Opening source file " + input);
        TokenStream tokens;
        try {
            tokens = options.format().open(input);
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Failed to open input file: " + input, e);
            return ParseResult.failure("Failed to open input file: " + input, 0);
        }

        List<TraceSink> sinks = new ArrayList<>();
        try {
            sinks.add(FileTraceSink.create(traceFile));
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Failed to open trace file: " + traceFile, e);
            return ParseResult.failure("Failed to open trace file: " + traceFile, 0);
        }
        if (options.console()) sinks.add(new ConsoleTraceSink(System.out));

        LOGGER.info("Writing trace to " + traceFile);
        ParseResult result;
        try (TraceRecorder recorder = new TraceRecorder(sinks)) {
            result = parse(tokens, recorder);
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Failed to close trace file: " + traceFile, e);
            return ParseResult.failure("Failed to write trace: " + e.getMessage(), 0);
        }
        LOGGER.info(result.success() ? "Input accepted" : "Parse failed: " + result.errorMessage());
        return result;
    }

    // === Core parser driver ===
    /**
     * Runs the automaton over {@code input} until it accepts or hits an error.
     *
     * @param input    tokens to parse, positioned at the first token
     * @param recorder receives the pre-action snapshot of every step
     * @return the outcome; syntax, internal and trace write errors are reported as failed results
     */
    public ParseResult parse(TokenStream input, TraceRecorder recorder) {
        ParserStack stack = new ParserStack();
        ParseStatus status = ParseStatus.RUNNING;
        Token lookahead = null;
        int step = 0;

        try {
            while (status == ParseStatus.RUNNING) {
                if (!input.hasCurrent()) throw new InternalParserError("token stream ended without an end-of-input token");
                lookahead = input.current();
                int state = stack.peek().state();
                Action action = table.action(state, lookahead.type());
                step++;

                recorder.record(new TraceRecord(step, state, stack.render(), input.window(INPUT_WINDOW),
                        action.type(), actionText(action)));
                LOGGER.fine(() -> "state " + state + " on " + input.current().render() + ": " + table.describe(action));

                switch (action.type()) {
                    case SHIFT -> {
                        stack.push(action.data(), lookahead);
                        shiftListener.onShift(lookahead);
                        input.advance();
                    }
                    case REDUCE -> reduce(stack, action.data());
                    case ACCEPT -> status = ParseStatus.ACCEPTED;
                    case ERROR -> status = ParseStatus.FAILED;
                }
            }
        } catch (InternalParserError e) {
            LOGGER.log(Level.SEVERE, "Internal parser error at step " + step, e);
            return ParseResult.failure("Internal parser error: " + e.getMessage(), step);
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Failed to write trace at step " + step, e);
            return ParseResult.failure("Failed to write trace: " + e.getMessage(), step);
        }

        return status == ParseStatus.ACCEPTED
                ? ParseResult.accepted(step)
                : ParseResult.syntaxError(lookahead, step);
    }

    /**
     * Pops the handle for {@code productionId} and pushes the goto state for its left-hand side.
     */
    private void reduce(ParserStack stack, int productionId) {
        Production production = production(productionId);

        for (int i = 0; i < production.rhsLength(); i++) {
            stack.pop();
        }

        int state = stack.peek().state();
        int target = table.goTo(state, production.lhs());
        if (target == ParsingTable.NO_TRANSITION) {
            throw new InternalParserError("no goto for " + production.lhs() + " from state " + state);
        }
        stack.push(target, new PlaceholderSymbol(production.lhs()));
    }

    private Production production(int id) {
        try {
            return table.production(id);
        } catch (IllegalArgumentException e) {
            throw new InternalParserError("reduce by unknown rule " + id);
        }
    }

    private String actionText(Action action) {
        if (action.type() == ActionType.ERROR) return INVALID_SYNTAX;
        // an unknown rule is fatal before the step is traced
        if (action.type() == ActionType.REDUCE) production(action.data());
        return table.describe(action);
    }
}
