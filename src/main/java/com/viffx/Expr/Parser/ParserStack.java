package com.viffx.Expr.Parser;

import com.viffx.Expr.Automata.ParsingTable;
import com.viffx.Expr.Symbols.Symbol;
import com.viffx.Expr.Symbols.Token;

import java.util.Collections;
import java.util.List;
import java.util.Stack;
import java.util.stream.Collectors;

/**
 * The configuration of the shift-reduce automaton. The bottom entry, state 0 paired with
 * the {@link Token#BOTTOM} marker, is pushed on construction and can never be popped.
 * <p>
 * Entries hold the stream's tokens by reference. Placeholder symbols pushed by reductions
 * belong to the stack alone and are simply dropped when popped.
 */
public class ParserStack {
    private final Stack<StackEntry> entries = new Stack<>();

    public ParserStack() {
        entries.push(new StackEntry(ParsingTable.START_STATE, Token.BOTTOM));
    }

    public void push(int state, Symbol symbol) {
        entries.push(new StackEntry(state, symbol));
    }

    /**
     * Removes the top entry.
     *
     * @throws InternalParserError if only the bottom entry is left
     */
    public StackEntry pop() {
        if (entries.size() <= 1) throw new InternalParserError("stack underflow");
        return entries.pop();
    }

    public StackEntry peek() {
        return entries.peek();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Entries from bottom to top.
     */
    public List<StackEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * Renders the stack bottom to top as {@code [s0 <tok0>] [s1 <tok1>] ...}.
     */
    public String render() {
        return entries.stream().map(StackEntry::render).collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        return render();
    }
}
