package com.viffx.WhileLang.Compiler;

import com.viffx.WhileLang.Symbols.NonTerminal;
import com.viffx.WhileLang.Symbols.Terminal;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * An LR automaton as two lookup tables: ACTION on {@code (state, terminal)} and
 * GOTO on {@code (state, nonterminal)}.
 * <p>
 * A table never changes once built, so one instance can be shared by any number of
 * concurrent parses. Each cell holds at most one entry; a missing entry is reported
 * as {@code null} and its meaning is left to the caller.
 */
public final class ParseTable {
    // ====== INSTANCE FIELDS ====== //
    private final Map<Integer, Map<Terminal, Action>> actions;
    private final Map<Integer, Map<NonTerminal, Integer>> gotos;
    private final int stateCount;

    // ====== CONSTRUCTORS ====== //
    private ParseTable(Builder builder) {
        Map<Integer, Map<Terminal, Action>> actions = new HashMap<>();
        builder.actions.forEach((state, row) -> actions.put(state, Collections.unmodifiableMap(new EnumMap<>(row))));
        Map<Integer, Map<NonTerminal, Integer>> gotos = new HashMap<>();
        builder.gotos.forEach((state, row) -> gotos.put(state, Collections.unmodifiableMap(new EnumMap<>(row))));
        this.actions = Collections.unmodifiableMap(actions);
        this.gotos = Collections.unmodifiableMap(gotos);

        int max = -1;
        for (int state : actions.keySet()) max = Math.max(max, state);
        for (int state : gotos.keySet()) max = Math.max(max, state);
        this.stateCount = max + 1;
    }

    @Contract(" -> new")
    public static @NotNull Builder builder() {
        return new Builder();
    }

    // ====== PUBLIC API ====== //
    /**
     * Returns the action for the given state and lookahead terminal.
     *
     * @param state    the state on top of the state stack
     * @param terminal the kind of the current token
     * @return the action, or {@code null} if the table has no entry
     */
    public @Nullable Action action(int state, @NotNull Terminal terminal) {
        Map<Terminal, Action> row = actions.get(state);
        return row == null ? null : row.get(terminal);
    }

    /**
     * Returns the state entered after reducing to {@code nonTerminal} with {@code state} exposed.
     *
     * @param state       the state uncovered by the reduction
     * @param nonTerminal the left hand side of the reduced production
     * @return the target state, or {@code null} if the table has no entry
     */
    public @Nullable Integer gotoState(int state, @NotNull NonTerminal nonTerminal) {
        Map<NonTerminal, Integer> row = gotos.get(state);
        return row == null ? null : row.get(nonTerminal);
    }

    /**
     * Returns the terminals that have an action in the given state.
     *
     * @param state the state to inspect
     * @return the terminals accepted in {@code state}, in declaration order
     */
    public Set<Terminal> expected(int state) {
        Map<Terminal, Action> row = actions.get(state);
        if (row == null || row.isEmpty()) return Collections.emptySet();
        return Collections.unmodifiableSet(EnumSet.copyOf(row.keySet()));
    }

    public int stateCount() {
        return stateCount;
    }

    /**
     * Returns a builder pre-filled with every entry of this table.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        actions.forEach((state, row) -> row.forEach((terminal, action) -> builder.action(state, terminal, action)));
        gotos.forEach((state, row) -> row.forEach((nonTerminal, target) -> builder.gotoState(state, nonTerminal, target)));
        return builder;
    }

    // ====== DEBUG INFO ====== //
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (int state = 0; state < stateCount; state++) {
            builder.append(String.format("%2d:", state));
            Map<Terminal, Action> actionRow = actions.getOrDefault(state, Map.of());
            actionRow.forEach((terminal, action) -> builder.append(' ').append(terminal).append('=').append(action));
            Map<NonTerminal, Integer> gotoRow = gotos.getOrDefault(state, Map.of());
            gotoRow.forEach((nonTerminal, target) -> builder.append(' ').append(nonTerminal).append("->").append(target));
            builder.append('\n');
        }
        return builder.toString();
    }

    // ====== BUILDER ====== //
    /**
     * Collects table entries. Adding a second, different entry to an occupied cell
     * is rejected; {@link #removeAction} and {@link #removeGoto} clear a cell first.
     */
    public static final class Builder {
        private final Map<Integer, EnumMap<Terminal, Action>> actions = new HashMap<>();
        private final Map<Integer, EnumMap<NonTerminal, Integer>> gotos = new HashMap<>();

        private Builder() {}

        public Builder action(int state, @NotNull Terminal terminal, @NotNull Action action) {
            checkState(state);
            Objects.requireNonNull(terminal, "terminal cannot be null");
            Objects.requireNonNull(action, "action cannot be null");
            Action previous = actions.computeIfAbsent(state, s -> new EnumMap<>(Terminal.class)).putIfAbsent(terminal, action);
            if (previous != null && !previous.equals(action)) {
                throw new IllegalStateException("Conflict in state " + state + " on " + terminal + ": " + previous + " / " + action);
            }
            return this;
        }

        public Builder shift(int state, @NotNull Terminal terminal, int target) {
            checkState(target);
            return action(state, terminal, Action.shift(target));
        }

        public Builder reduce(int state, int production, @NotNull Terminal... lookaheads) {
            for (Terminal terminal : lookaheads) {
                action(state, terminal, Action.reduce(production));
            }
            return this;
        }

        /**
         * Makes {@code production} the default reduction of {@code state}: it applies on every terminal.
         * Only valid for states whose sole item is complete.
         */
        public Builder reduceOnAny(int state, int production) {
            return reduce(state, production, Terminal.values());
        }

        public Builder accept(int state, @NotNull Terminal terminal) {
            return action(state, terminal, Action.ACCEPT);
        }

        public Builder gotoState(int state, @NotNull NonTerminal nonTerminal, int target) {
            checkState(state);
            checkState(target);
            Objects.requireNonNull(nonTerminal, "nonTerminal cannot be null");
            Integer previous = gotos.computeIfAbsent(state, s -> new EnumMap<>(NonTerminal.class)).putIfAbsent(nonTerminal, target);
            if (previous != null && previous != target) {
                throw new IllegalStateException("Conflict in goto of state " + state + " on " + nonTerminal + ": " + previous + " / " + target);
            }
            return this;
        }

        public Builder removeAction(int state, @NotNull Terminal terminal) {
            EnumMap<Terminal, Action> row = actions.get(state);
            if (row != null) row.remove(terminal);
            return this;
        }

        public Builder removeGoto(int state, @NotNull NonTerminal nonTerminal) {
            EnumMap<NonTerminal, Integer> row = gotos.get(state);
            if (row != null) row.remove(nonTerminal);
            return this;
        }

        public ParseTable build() {
            return new ParseTable(this);
        }

        private static void checkState(int state) {
            if (state < 0) throw new IllegalArgumentException("States must not be negative: " + state);
        }
    }
}
