package com.viffx.WhileLang.Compiler;

import com.viffx.WhileLang.Grammar.Token;
import com.viffx.WhileLang.Symbols.Terminal;

import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Why a compilation failed.
 * <p>
 * {@link LexicalError} and {@link SyntaxError} are properties of the input.
 * {@link InternalError} means the parse table does not match the engine and never
 * depends on what was parsed.
 */
public sealed interface ParseError permits ParseError.LexicalError, ParseError.SyntaxError, ParseError.InternalError {
    String message();

    /**
     * A character that starts no token.
     *
     * @param position  zero based source offset of the character
     * @param character the offending character
     */
    record LexicalError(int position, char character) implements ParseError {
        @Override
        public String message() {
            return "Unrecognized character '" + character + "' at " + position;
        }
    }

    /**
     * A token for which the current state has no action.
     *
     * @param unexpected the current token
     * @param state      the state on top of the state stack
     * @param expected   the terminals the state does have actions for
     */
    record SyntaxError(Token unexpected, int state, Set<Terminal> expected) implements ParseError {
        public SyntaxError {
            Objects.requireNonNull(unexpected, "unexpected cannot be null");
            expected = Set.copyOf(expected);
        }

        @Override
        public String message() {
            String message = "Unexpected " + unexpected + " in state " + state;
            if (expected.isEmpty()) return message;
            return message + ", expected one of " + expected.stream()
                    .sorted()
                    .map(Terminal::name)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
    }

    /**
     * An inconsistency between the parse table and the engine.
     *
     * @param kind   what went wrong
     * @param state  the state involved, or {@code -1} when there is none
     * @param detail a human readable description
     */
    record InternalError(Kind kind, int state, String detail) implements ParseError {
        public enum Kind {
            STACK_UNDERFLOW,
            MISSING_GOTO,
            UNKNOWN_PRODUCTION,
            MULTIPLE_ROOTS_AT_ACCEPT,
            NO_ROOT_AT_ACCEPT
        }

        public InternalError {
            Objects.requireNonNull(kind, "kind cannot be null");
        }

        @Override
        public String message() {
            return "Malformed parse table (" + kind + "): " + detail;
        }
    }
}
