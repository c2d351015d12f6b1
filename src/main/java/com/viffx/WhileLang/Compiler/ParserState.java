package com.viffx.WhileLang.Compiler;

import com.viffx.WhileLang.Symbols.AstNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Stack;

/**
 * The mutable state of one parse: the state stack, the value stack and the input position.
 * <p>
 * Between two engine steps the state stack holds exactly one more entry than the
 * value stack, since the initial state has no value. The position never decreases.
 */
public final class ParserState {
    // ====== INSTANCE FIELDS ====== //
    private final Stack<Integer> stateStack = new Stack<>();
    private final Stack<AstNode> valueStack = new Stack<>();
    private int position = 0;

    // ====== CONSTRUCTORS ====== //
    ParserState(int initialState) {
        stateStack.push(initialState);
    }

    // ====== PUBLIC API ====== //
    public int topState() {
        return stateStack.peek();
    }

    public int stateDepth() {
        return stateStack.size();
    }

    public int valueDepth() {
        return valueStack.size();
    }

    public int position() {
        return position;
    }

    /**
     * Returns the states from bottom to top.
     *
     * @return a copy of the state stack
     */
    public List<Integer> states() {
        return new ArrayList<>(stateStack);
    }

    // ====== ENGINE OPERATIONS ====== //
    void shift(int target, AstNode token) {
        stateStack.push(target);
        valueStack.push(token);
        position++;
    }

    void push(int target, AstNode value) {
        stateStack.push(target);
        valueStack.push(value);
    }

    /**
     * Returns whether {@code count} values can be popped while leaving a state on the stack.
     */
    boolean canPop(int count) {
        return valueStack.size() >= count && stateStack.size() > count;
    }

    /**
     * Pops {@code count} states and values.
     *
     * @return the popped values in the order they were pushed
     */
    List<AstNode> pop(int count) {
        AstNode[] values = new AstNode[count];
        for (int i = count - 1; i >= 0; i--) {
            stateStack.pop();
            values[i] = valueStack.pop();
        }
        return Arrays.asList(values);
    }

    AstNode peekValue() {
        return valueStack.peek();
    }

    @Override
    public String toString() {
        return "ParserState{states=" + stateStack + ", values=" + valueStack.size() + ", position=" + position + '}';
    }
}
