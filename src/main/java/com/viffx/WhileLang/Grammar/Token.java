package com.viffx.WhileLang.Grammar;

import com.viffx.WhileLang.Symbols.Terminal;

import java.util.Objects;

/**
 * A lexical token.
 *
 * @param kind     the terminal this token stands for
 * @param text     the source text of the token, empty for {@link Terminal#END}
 * @param position zero based source offset, or {@code -1} when the token was not read from source
 */
public record Token(Terminal kind, String text, int position) {
    public Token {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(text, "text cannot be null");
    }

    public Token(Terminal kind, String text) {
        this(kind, text, -1);
    }

    public static Token end(int position) {
        return new Token(Terminal.END, "", position);
    }

    @Override
    public String toString() {
        String shown = kind == Terminal.END ? "end of input" : "'" + text + "'";
        return position < 0 ? kind + " " + shown : kind + " " + shown + " at " + position;
    }
}
