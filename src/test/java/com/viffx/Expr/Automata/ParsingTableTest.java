package com.viffx.Expr.Automata;

import com.viffx.Expr.Symbols.NonTerminal;
import com.viffx.Expr.Symbols.TokenType;
import org.junit.Test;

import static com.viffx.Expr.Symbols.TokenType.*;
import static org.hamcrest.CoreMatchers.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertSame;

public class ParsingTableTest {
    private final ParsingTable table = ParsingTable.expressions();

    @Test
    public void countsMatchTheGrammar() {
        assertEquals(12, table.stateCount());
        assertEquals(6, table.terminalCount());
        assertEquals(4, table.nonTerminalCount());
        assertEquals(7, table.productionCount());
    }

    @Test
    public void actionIsTotalOverEveryStateAndTerminal() {
        for (int state = 0; state < table.stateCount(); state++) {
            for (TokenType type : TokenType.values()) {
                assertNotNull("state " + state + " on " + type, table.action(state, type));
            }
        }
    }

    @Test
    public void lastStateReducesParenthesizedExpressions() {
        for (TokenType type : new TokenType[]{PLUS, STAR, RPAREN, END_OF_INPUT}) {
            assertEquals(Action.reduce(6), table.action(11, type));
        }
        assertSame(Action.ERROR, table.action(11, NUM));
        assertSame(Action.ERROR, table.action(11, LPAREN));
    }

    @Test
    public void outOfRangeAndNonTerminalKindsAreErrors() {
        assertSame(Action.ERROR, table.action(-1, NUM));
        assertSame(Action.ERROR, table.action(12, NUM));
        assertSame(Action.ERROR, table.action(0, INVALID));
        assertSame(Action.ERROR, table.action(0, NONTERMINAL_PLACEHOLDER));
        assertSame(Action.ERROR, table.action(0, null));
    }

    @Test
    public void emptyInputHasNoActionInTheStartState() {
        assertSame(Action.ERROR, table.action(ParsingTable.START_STATE, END_OF_INPUT));
    }

    @Test
    public void acceptOnlyAfterACompleteExpression() {
        int accepts = 0;
        for (int state = 0; state < table.stateCount(); state++) {
            for (TokenType type : TokenType.values()) {
                if (table.action(state, type).type() == ActionType.ACCEPT) accepts++;
            }
        }
        assertEquals(1, accepts);
        assertSame(Action.ACCEPT, table.action(1, END_OF_INPUT));
    }

    @Test
    public void gotoTargets() {
        assertEquals(1, table.goTo(0, NonTerminal.E));
        assertEquals(2, table.goTo(0, NonTerminal.T));
        assertEquals(3, table.goTo(0, NonTerminal.F));
        assertEquals(8, table.goTo(4, NonTerminal.E));
        assertEquals(9, table.goTo(6, NonTerminal.T));
        assertEquals(10, table.goTo(7, NonTerminal.F));
    }

    @Test
    public void missingGotoIsTheSentinel() {
        assertEquals(ParsingTable.NO_TRANSITION, table.goTo(0, NonTerminal.S));
        assertEquals(ParsingTable.NO_TRANSITION, table.goTo(6, NonTerminal.E));
        assertEquals(ParsingTable.NO_TRANSITION, table.goTo(11, NonTerminal.F));
        assertEquals(ParsingTable.NO_TRANSITION, table.goTo(12, NonTerminal.F));
    }

    @Test
    public void everyReduceHasAGotoFromEveryStateThatCanExposeIt() {
        // Every state that shifts a handle's first symbol must have a goto for that handle's lhs
        for (int state = 0; state < table.stateCount(); state++) {
            if (table.action(state, NUM).type() == ActionType.SHIFT) {
                assertThat("goto F from " + state, table.goTo(state, NonTerminal.F), not(ParsingTable.NO_TRANSITION));
            }
        }
    }

    @Test
    public void productionsAreNumberedFromOne() {
        assertEquals("S → E", table.production(1).ruleText());
        assertEquals("E → E + T", table.production(2).ruleText());
        assertEquals("E → T", table.production(3).ruleText());
        assertEquals("T → T * F", table.production(4).ruleText());
        assertEquals("T → F", table.production(5).ruleText());
        assertEquals("F → ( E )", table.production(6).ruleText());
        assertEquals("F → NUM", table.production(7).ruleText());
        assertEquals(3, table.production(6).rhsLength());
    }

    @Test(expected = IllegalArgumentException.class)
    public void productionZeroIsReserved() {
        table.production(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void productionPastTheEndIsRejected() {
        table.production(8);
    }

    @Test
    public void describe() {
        assertEquals("Shift to state 5", table.describe(Action.shift(5)));
        assertEquals("Reduce by rule 4: T → T * F", table.describe(Action.reduce(4)));
        assertEquals("Accept", table.describe(Action.ACCEPT));
        assertEquals("Error", table.describe(Action.ERROR));
    }

    @Test
    public void gridListsEveryState() {
        String grid = table.toString();
        assertThat(grid, containsString("acc"));
        assertThat(grid, containsString("s11"));
        assertEquals(13, grid.split("\n").length);
    }

    @Test
    public void builtTableDefaultsToErrorAndNoTransition() {
        ParsingTable built = ParsingTable.builder(3, new Production(1, NonTerminal.F, NUM))
                .shift(0, NUM, 2)
                .go(0, NonTerminal.F, 1)
                .accept(1, END_OF_INPUT)
                .build();

        assertEquals(3, built.stateCount());
        assertEquals(1, built.productionCount());
        assertEquals(Action.shift(2), built.action(0, NUM));
        assertSame(Action.ACCEPT, built.action(1, END_OF_INPUT));
        assertSame(Action.ERROR, built.action(2, PLUS));
        assertEquals(1, built.goTo(0, NonTerminal.F));
        assertEquals(ParsingTable.NO_TRANSITION, built.goTo(1, NonTerminal.F));
    }

    @Test(expected = IllegalArgumentException.class)
    public void builderRejectsMisnumberedProductions() {
        ParsingTable.builder(1, new Production(2, NonTerminal.F, NUM));
    }

    @Test(expected = IllegalArgumentException.class)
    public void builderRejectsStatesOutOfRange() {
        ParsingTable.builder(2).shift(0, NUM, 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void builderRejectsNonTerminalColumns() {
        ParsingTable.builder(2).shift(0, INVALID, 1);
    }
}
