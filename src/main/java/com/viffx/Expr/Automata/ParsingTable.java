package com.viffx.Expr.Automata;

import com.viffx.Expr.Symbols.NonTerminal;
import com.viffx.Expr.Symbols.TokenType;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

import static com.viffx.Expr.Symbols.NonTerminal.*;
import static com.viffx.Expr.Symbols.TokenType.*;

/**
 * The SLR(1) automaton for the expression grammar
 * <pre>
 *   1. S → E
 *   2. E → E + T
 *   3. E → T
 *   4. T → T * F
 *   5. T → F
 *   6. F → ( E )
 *   7. F → NUM
 * </pre>
 * The table is filled in once from literal data and never changes afterwards, so the
 * shared instance returned by {@link #expressions()} may be used by any number of
 * sequential parses. Other tables over the same symbols can be assembled with
 * {@link #builder(int, Production...)}.
 */
public final class ParsingTable {
    // ====== CONSTANTS ====== //
    public static final int START_STATE = 0;
    public static final int NO_TRANSITION = -1;

    private static final int TERMINAL_COUNT = END_OF_INPUT.ordinal() + 1;
    private static final int NON_TERMINAL_COUNT = NonTerminal.values().length;

    private static final ParsingTable EXPRESSIONS = buildExpressions();

    // ====== INSTANCE FIELDS ====== //
    private final int stateCount;
    private final Action[][] actions;
    private final int[][] gotos;
    // index 0 is unused so that rule numbers match their position
    private final Production[] productions;

    // ====== CONSTRUCTORS ====== //
    private ParsingTable(Builder builder) {
        stateCount = builder.stateCount;
        actions = new Action[stateCount][];
        gotos = new int[stateCount][];
        for (int state = 0; state < stateCount; state++) {
            actions[state] = builder.actions[state].clone();
            gotos[state] = builder.gotos[state].clone();
        }
        productions = builder.productions.clone();
    }

    public static ParsingTable expressions() {
        return EXPRESSIONS;
    }

    /**
     * Starts an empty table: every action is {@link Action#ERROR} and every goto is
     * {@link #NO_TRANSITION}. Productions are numbered from 1 in the order given.
     *
     * @throws IllegalArgumentException if {@code stateCount} is not positive or a production's id
     *                                  does not match its position
     */
    @NotNull
    public static Builder builder(int stateCount, Production... productions) {
        return new Builder(stateCount, productions);
    }

    private static ParsingTable buildExpressions() {
        return builder(12,
                new Production(1, S, E),
                new Production(2, E, E, PLUS, T),
                new Production(3, E, T),
                new Production(4, T, T, STAR, F),
                new Production(5, T, F),
                new Production(6, F, LPAREN, E, RPAREN),
                new Production(7, F, NUM))
                // State 0
                .shift(0, NUM, 5)
                .shift(0, LPAREN, 4)
                .go(0, E, 1)
                .go(0, T, 2)
                .go(0, F, 3)
                // State 1
                .shift(1, PLUS, 6)
                .accept(1, END_OF_INPUT)
                // State 2
                .shift(2, STAR, 7)
                .reduce(2, 3, PLUS, RPAREN, END_OF_INPUT)
                // State 3
                .reduce(3, 5, PLUS, STAR, RPAREN, END_OF_INPUT)
                // State 4
                .shift(4, NUM, 5)
                .shift(4, LPAREN, 4)
                .go(4, E, 8)
                .go(4, T, 2)
                .go(4, F, 3)
                // State 5
                .reduce(5, 7, PLUS, STAR, RPAREN, END_OF_INPUT)
                // State 6
                .shift(6, NUM, 5)
                .shift(6, LPAREN, 4)
                .go(6, T, 9)
                .go(6, F, 3)
                // State 7
                .shift(7, NUM, 5)
                .shift(7, LPAREN, 4)
                .go(7, F, 10)
                // State 8
                .shift(8, PLUS, 6)
                .shift(8, RPAREN, 11)
                // State 9
                .shift(9, STAR, 7)
                .reduce(9, 2, PLUS, RPAREN, END_OF_INPUT)
                // State 10
                .reduce(10, 4, PLUS, STAR, RPAREN, END_OF_INPUT)
                // State 11
                .reduce(11, 6, PLUS, STAR, RPAREN, END_OF_INPUT)
                .build();
    }

    // ====== TABLE CONSTRUCTION ====== //
    /**
     * Fills in a table from literal per-state data. Entries are not cross-checked, so a
     * reduce may name a rule the table lacks or a state may miss a goto the rule needs.
     */
    public static final class Builder {
        private final int stateCount;
        private final Action[][] actions;
        private final int[][] gotos;
        private final Production[] productions;

        private Builder(int stateCount, Production... productions) {
            if (stateCount < 1) throw new IllegalArgumentException("A table needs at least one state, got " + stateCount);
            this.stateCount = stateCount;
            actions = new Action[stateCount][TERMINAL_COUNT];
            gotos = new int[stateCount][NON_TERMINAL_COUNT];
            for (Action[] row : actions) Arrays.fill(row, Action.ERROR);
            for (int[] row : gotos) Arrays.fill(row, NO_TRANSITION);

            this.productions = new Production[productions.length + 1];
            for (int i = 0; i < productions.length; i++) {
                if (productions[i].id() != i + 1) {
                    throw new IllegalArgumentException("Production " + productions[i].ruleText() + " is numbered "
                            + productions[i].id() + " but listed at position " + (i + 1));
                }
                this.productions[i + 1] = productions[i];
            }
        }

        public Builder shift(int state, TokenType terminal, int next) {
            checkState(next);
            return set(state, terminal, Action.shift(next));
        }

        public Builder reduce(int state, int production, TokenType... lookaheads) {
            Action action = Action.reduce(production);
            for (TokenType terminal : lookaheads) set(state, terminal, action);
            return this;
        }

        public Builder accept(int state, TokenType terminal) {
            return set(state, terminal, Action.ACCEPT);
        }

        public Builder go(int state, NonTerminal nonTerminal, int next) {
            checkState(state);
            checkState(next);
            gotos[state][nonTerminal.ordinal()] = next;
            return this;
        }

        public ParsingTable build() {
            return new ParsingTable(this);
        }

        private Builder set(int state, TokenType terminal, Action action) {
            checkState(state);
            if (!terminal.isTerminal()) throw new IllegalArgumentException(terminal + " is not a table column");
            actions[state][terminal.ordinal()] = action;
            return this;
        }

        private void checkState(int state) {
            if (state < 0 || state >= stateCount) {
                throw new IllegalArgumentException("State " + state + " out of range 0.." + (stateCount - 1));
            }
        }
    }

    // ====== PUBLIC API METHODS ====== //
    /**
     * Looks up the action for a state and a lookahead kind.
     * <p>
     * The table is total: any state outside {@code 0..stateCount()-1}, any non-terminal kind such as
     * {@link TokenType#INVALID}, and every undeclared pair yields {@link Action#ERROR}.
     *
     * @param state    the automaton state on top of the stack
     * @param terminal the kind of the lookahead token
     * @return the action to take, never {@code null}
     */
    @NotNull
    public Action action(int state, TokenType terminal) {
        if (state < 0 || state >= stateCount || terminal == null || !terminal.isTerminal()) {
            return Action.ERROR;
        }
        return actions[state][terminal.ordinal()];
    }

    /**
     * Returns the state reached from {@code state} after reducing to {@code nonTerminal},
     * or {@link #NO_TRANSITION} if the automaton has no such edge.
     */
    public int goTo(int state, NonTerminal nonTerminal) {
        if (state < 0 || state >= stateCount || nonTerminal == null) return NO_TRANSITION;
        return gotos[state][nonTerminal.ordinal()];
    }

    @NotNull
    public Production production(int id) {
        if (id < 1 || id >= productions.length) {
            throw new IllegalArgumentException("No production numbered " + id + " (expected 1.." + productionCount() + ")");
        }
        return productions[id];
    }

    @NotNull
    public String describe(Action action) {
        return switch (action.type()) {
            case SHIFT -> "Shift to state " + action.data();
            case REDUCE -> "Reduce by rule " + action.data() + ": " + production(action.data()).ruleText();
            case ACCEPT -> "Accept";
            case ERROR -> "Error";
        };
    }

    public int stateCount() {
        return stateCount;
    }

    public int terminalCount() {
        return TERMINAL_COUNT;
    }

    public int nonTerminalCount() {
        return NON_TERMINAL_COUNT;
    }

    public int productionCount() {
        return productions.length - 1;
    }

    // ====== DEBUG INFO ====== //
    /**
     * Renders the action and goto tables as a grid, one row per state.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(String.format("%-6s", "state"));
        for (int t = 0; t < TERMINAL_COUNT; t++) {
            builder.append(String.format("%-6s", TokenType.values()[t].grammarText()));
        }
        for (NonTerminal nonTerminal : NonTerminal.values()) {
            builder.append(String.format("%-6s", nonTerminal.grammarText()));
        }
        builder.append('\n');
        for (int state = 0; state < stateCount; state++) {
            builder.append(String.format("%-6d", state));
            for (Action action : actions[state]) {
                builder.append(String.format("%-6s", action));
            }
            for (int target : gotos[state]) {
                builder.append(String.format("%-6s", target == NO_TRANSITION ? "" : target));
            }
            builder.append('\n');
        }
        return builder.toString();
    }
}
