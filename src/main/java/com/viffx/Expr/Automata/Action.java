package com.viffx.Expr.Automata;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Represents a parsing action in an LR action table.
 * <p>
 * An action consists of a type (SHIFT, REDUCE, ACCEPT or ERROR) and an integer
 * value whose meaning depends on the action type:
 * <ul>
 *   <li>For {@link ActionType#SHIFT},  {@code data} is the target state to shift to.</li>
 *   <li>For {@link ActionType#REDUCE}, {@code data} is the production number to reduce by.</li>
 *   <li>For {@link ActionType#ACCEPT} and {@link ActionType#ERROR}, {@code data} is always zero.</li>
 * </ul>
 * Instances are obtained through the factory methods, which reject values that make
 * no sense for the type.
 *
 * @param type the kind of action to be performed
 * @param data an integer value whose interpretation depends on {@code type}
 */
public record Action(ActionType type, int data) {
    public static final Action ACCEPT = new Action(ActionType.ACCEPT, 0);
    public static final Action ERROR = new Action(ActionType.ERROR, 0);

    public Action {
        Objects.requireNonNull(type, "type");
        switch (type) {
            case SHIFT -> {
                if (data < 0) throw new IllegalArgumentException("Shift target must be a state, got " + data);
            }
            case REDUCE -> {
                if (data < 1) throw new IllegalArgumentException("Productions are numbered from 1, got " + data);
            }
            case ACCEPT, ERROR -> {
                if (data != 0) throw new IllegalArgumentException(type + " carries no value, got " + data);
            }
        }
    }

    @NotNull
    @Contract("_ -> new")
    public static Action shift(int nextState) {
        return new Action(ActionType.SHIFT, nextState);
    }

    @NotNull
    @Contract("_ -> new")
    public static Action reduce(int production) {
        return new Action(ActionType.REDUCE, production);
    }

    @Override
    public String toString() {
        return switch (type) {
            case SHIFT -> "s" + data;
            case REDUCE -> "r" + data;
            case ACCEPT -> "acc";
            case ERROR -> "";
        };
    }
}
