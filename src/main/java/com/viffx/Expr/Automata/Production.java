package com.viffx.Expr.Automata;

import com.viffx.Expr.Symbols.GrammarSymbol;
import com.viffx.Expr.Symbols.NonTerminal;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public record Production(int id, NonTerminal lhs, List<GrammarSymbol> rhs) {
    public Production {
        if (id < 1) throw new IllegalArgumentException("Productions are numbered from 1, got " + id);
        Objects.requireNonNull(lhs, "lhs");
        rhs = List.copyOf(rhs);
        if (rhs.isEmpty()) throw new IllegalArgumentException("The expression grammar has no empty productions");
    }

    public Production(int id, NonTerminal lhs, GrammarSymbol... rhs) {
        this(id, lhs, List.of(rhs));
    }

    public int rhsLength() {
        return rhs.size();
    }

    /**
     * Human readable form used in traces, e.g. {@code E → E + T}.
     */
    public String ruleText() {
        return lhs.grammarText() + " → " + rhs.stream()
                .map(GrammarSymbol::grammarText)
                .collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        return "Production{" +
                "id=" + id +
                ", rule=" + ruleText() +
                '}';
    }
}
