package com.viffx.WhileLang.Symbols;

public enum NonTerminal implements Symbol {
    START("START"),
    PROGRAM("Program"),
    STATEMENT_LIST("StatementList"),
    STATEMENT("Statement"),
    CONDITION("Condition"),
    BODY("Body"),
    ASSIGNMENT("Assignment"),
    EXPRESSION("Expression"),
    REL_OP("RelOp");

    private final String value;

    NonTerminal(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
