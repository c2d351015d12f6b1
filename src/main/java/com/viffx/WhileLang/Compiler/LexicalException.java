package com.viffx.WhileLang.Compiler;

public class LexicalException extends Exception {
    private final int position;
    private final char character;

    public LexicalException(int position, char character) {
        super("Unrecognized symbol: '" + character + "' Index: " + position);
        this.position = position;
        this.character = character;
    }

    public int position() {
        return position;
    }

    public char character() {
        return character;
    }

    public ParseError.LexicalError toError() {
        return new ParseError.LexicalError(position, character);
    }
}
