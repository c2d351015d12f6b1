package com.viffx.WhileLang.Grammar;

import com.viffx.WhileLang.Symbols.NonTerminal;
import com.viffx.WhileLang.Symbols.Symbol;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A grammar rule {@code lhs -> rhs}.
 *
 * @param index position of the production in its grammar, used as the REDUCE operand
 * @param lhs   the nonterminal produced by a reduction
 * @param rhs   the symbols popped by a reduction, left to right
 */
public record Production(int index, NonTerminal lhs, List<Symbol> rhs) {
    public Production {
        if (index < 0) throw new IllegalArgumentException("Production indexes must not be negative");
        rhs = List.copyOf(rhs);
    }

    public Production(int index, NonTerminal lhs, Symbol... rhs) {
        this(index, lhs, List.of(rhs));
    }

    public int arity() {
        return rhs.size();
    }

    @Override
    public String toString() {
        return lhs.value() + " -> " + rhs.stream().map(Symbol::value).collect(Collectors.joining(" "));
    }
}
