package com.viffx.WhileLang.Symbols;

public enum Terminal implements Symbol {
    WHILE("while"),
    DONE("done"),
    SEMICOLON("';'"),
    LPAREN("'('"),
    RPAREN("')'"),
    IDENTIFIER("IDENTIFIER"),
    ROMAN_NUMERAL("ROMAN_NUMERAL"),
    ASSIGN("':='"),
    LESS("'<'"),
    GREATER("'>'"),
    EQUAL("'='"),
    // End of input sentinel
    END("$");

    private final String value;

    Terminal(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }
}
