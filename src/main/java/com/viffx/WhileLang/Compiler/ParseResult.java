package com.viffx.WhileLang.Compiler;

import com.viffx.WhileLang.Symbols.AstNode;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * The outcome of a parse: either the root of the tree or the reason there is none.
 */
public sealed interface ParseResult permits ParseResult.Success, ParseResult.Failure {

    record Success(AstNode root) implements ParseResult {
        public Success {
            Objects.requireNonNull(root, "root cannot be null");
        }
    }

    record Failure(ParseError error) implements ParseResult {
        public Failure {
            Objects.requireNonNull(error, "error cannot be null");
        }
    }

    static @NotNull ParseResult success(@NotNull AstNode root) {
        return new Success(root);
    }

    static @NotNull ParseResult failure(@NotNull ParseError error) {
        return new Failure(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * Returns the root of the tree.
     *
     * @return the root node
     * @throws ParseException if the parse failed
     */
    default AstNode orElseThrow() throws ParseException {
        if (this instanceof Success success) return success.root();
        throw new ParseException(((Failure) this).error());
    }
}
