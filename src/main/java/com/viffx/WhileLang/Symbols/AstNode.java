package com.viffx.WhileLang.Symbols;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.Stack;

/**
 * A node of the abstract syntax tree.
 * <p>
 * The children are fixed when the node is constructed and never change afterwards.
 * Two nodes are equal when their kinds, values and children are equal, so
 * {@link #equals(Object)} compares whole subtrees. Statement lists nest one level per
 * statement, so equality and rendering walk the tree with explicit stacks.
 */
public final class AstNode {
    public static final String TOKEN = "Token";

    private final String kind;
    private final String value;
    private final List<AstNode> children;
    // Children are built first, so the subtree hash is known at construction
    private final int hash;

    public AstNode(@NotNull String kind, @Nullable String value, @NotNull List<AstNode> children) {
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.value = value;
        this.children = List.copyOf(children);

        int hash = 31 * kind.hashCode() + Objects.hashCode(value);
        for (AstNode child : this.children) {
            hash = 31 * hash + child.hash;
        }
        this.hash = hash;
    }

    public AstNode(@NotNull String kind, @NotNull AstNode... children) {
        this(kind, null, List.of(children));
    }

    public static AstNode leaf(@NotNull String kind, @Nullable String value) {
        return new AstNode(kind, value, List.of());
    }

    public String kind() {
        return kind;
    }

    public @Nullable String value() {
        return value;
    }

    public List<AstNode> children() {
        return children;
    }

    public AstNode child(int index) {
        return children.get(index);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean hasValue() {
        return value != null && !value.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Stack<AstNode> left = new Stack<>();
        Stack<AstNode> right = new Stack<>();
        left.push(this);
        right.push((AstNode) o);
        while (!left.isEmpty()) {
            AstNode a = left.pop();
            AstNode b = right.pop();
            if (a == b) continue;
            if (a.hash != b.hash
                    || !a.kind.equals(b.kind)
                    || !Objects.equals(a.value, b.value)
                    || a.children.size() != b.children.size()) {
                return false;
            }
            for (int i = 0; i < a.children.size(); i++) {
                left.push(a.children.get(i));
                right.push(b.children.get(i));
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    // Compact form, e.g. Condition(Identifier("x"), RelOp("<"), RomanNumeral("V"))
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        // Holds nodes still to render and the punctuation that closes them
        Stack<Object> pending = new Stack<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Object next = pending.pop();
            if (next instanceof String text) {
                builder.append(text);
                continue;
            }
            AstNode node = (AstNode) next;
            builder.append(node.kind);
            if (node.value != null) {
                builder.append("(\"").append(node.value).append("\")");
                continue;
            }
            builder.append('(');
            pending.push(")");
            for (int i = node.children.size() - 1; i >= 0; i--) {
                pending.push(node.children.get(i));
                if (i > 0) pending.push(", ");
            }
        }
        return builder.toString();
    }
}
