package com.viffx.WhileLang.Compiler;

import java.util.Objects;

/**
 * Represents a parsing action in an LR action table.
 * <p>
 * An action consists of a type (SHIFT, REDUCE or ACCEPT) and an integer value
 * whose meaning depends on the action type:
 * <ul>
 *   <li>For {@link ActionType#SHIFT},  {@code data} is the target state to shift to.</li>
 *   <li>For {@link ActionType#REDUCE}, {@code data} is the production number to reduce by.</li>
 *   <li>For {@link ActionType#ACCEPT}, {@code data} is unused (always zero).</li>
 * </ul>
 * Transitions on nonterminals are not actions; they live in the goto part of {@link ParseTable}.
 *
 * @param type the kind of action to be performed (SHIFT, REDUCE, ACCEPT)
 * @param data an integer value whose interpretation depends on {@code type}
 */
public record Action(ActionType type, int data) {
    public static final Action ACCEPT = new Action(ActionType.ACCEPT, 0);

    public Action {
        Objects.requireNonNull(type, "type cannot be null");
        if (data < 0) throw new IllegalArgumentException("Action data must not be negative: " + data);
    }

    public static Action shift(int state) {
        return new Action(ActionType.SHIFT, state);
    }

    public static Action reduce(int production) {
        return new Action(ActionType.REDUCE, production);
    }

    @Override
    public String toString() {
        return switch (type) {
            case SHIFT -> "s" + data;
            case REDUCE -> "r" + data;
            case ACCEPT -> "acc";
        };
    }
}
