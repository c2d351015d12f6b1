package com.viffx.WhileLang.Utils;

import com.viffx.WhileLang.Symbols.AstNode;

import java.io.PrintStream;
import java.util.List;
import java.util.Stack;

/**
 * Prints a tree in preorder, one node per line, indented by two spaces per level.
 * A node with a non-empty value is printed as {@code Kind (value)}.
 */
public final class AstPrinter {
    private static final String INDENT = "  ";

    private AstPrinter() {}

    public static void print(AstNode root, PrintStream out) {
        out.print(render(root));
    }

    public static String render(AstNode root) {
        StringBuilder builder = new StringBuilder();
        Stack<Integer> depthStack = new Stack<>();
        Stack<AstNode> astStack = new Stack<>();
        depthStack.push(0);
        astStack.push(root);
        while (!astStack.isEmpty()) {
            int depth = depthStack.pop();
            AstNode node = astStack.pop();
            builder.append(INDENT.repeat(depth)).append(node.kind());
            if (node.hasValue()) builder.append(" (").append(node.value()).append(')');
            builder.append('\n');

            // Push in reverse so the first child is printed first
            List<AstNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                depthStack.push(depth + 1);
                astStack.push(children.get(i));
            }
        }
        return builder.toString();
    }
}
