package com.viffx.WhileLang.Grammar;

import com.viffx.WhileLang.Symbols.AstNode;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An immutable list of productions paired with the semantic actions that build
 * AST nodes when a production is reduced.
 * <p>
 * The productions are plain data. The tree construction lives in a single
 * {@link SemanticActions} function that dispatches on the production index.
 */
public final class Grammar {
    // ====== INTERNAL DATATYPES ====== //
    /**
     * Builds the node for a reduction.
     */
    @FunctionalInterface
    public interface SemanticActions {
        /**
         * @param production the production being reduced
         * @param children   the values popped for its right hand side, left to right,
         *                   exactly {@link Production#arity()} of them
         * @return the node pushed in place of the children
         */
        AstNode build(Production production, List<AstNode> children);
    }

    // ====== INSTANCE FIELDS ====== //
    private final List<Production> productions;
    private final SemanticActions actions;

    // ====== CONSTRUCTORS ====== //
    public Grammar(@NotNull List<Production> productions, @NotNull SemanticActions actions) {
        this.productions = List.copyOf(productions);
        this.actions = Objects.requireNonNull(actions, "actions cannot be null");
        for (int i = 0; i < this.productions.size(); i++) {
            if (this.productions.get(i).index() != i) {
                throw new IllegalArgumentException("Production " + this.productions.get(i) + " is stored at " + i);
            }
        }
    }

    // ====== PUBLIC API ====== //
    /**
     * Returns the production with the given index.
     *
     * @param index the production index
     * @return the production
     * @throws IndexOutOfBoundsException if no production has that index
     */
    public Production production(int index) {
        return productions.get(index);
    }

    public boolean hasProduction(int index) {
        return index >= 0 && index < productions.size();
    }

    public int productionsCount() {
        return productions.size();
    }

    public List<Production> productions() {
        return productions;
    }

    public AstNode build(Production production, List<AstNode> children) {
        return actions.build(production, children);
    }

    // ====== DEBUG INFO ====== //
    @Override
    public String toString() {
        return productions.stream()
                .map(production -> String.format("%2d: %s", production.index(), production))
                .collect(Collectors.joining("\n"));
    }
}
