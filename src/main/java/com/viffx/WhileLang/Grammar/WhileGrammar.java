package com.viffx.WhileLang.Grammar;

import com.viffx.WhileLang.Symbols.AstNode;

import java.util.List;

import static com.viffx.WhileLang.Symbols.NonTerminal.*;
import static com.viffx.WhileLang.Symbols.Terminal.*;

/**
 * The productions of the while language and the AST each one builds.
 * <p>
 * Keywords and punctuation are shifted like every other token but never appear in the tree.
 * Only identifiers, Roman numerals, relational operators and reductions produce nodes.
 */
public final class WhileGrammar {
    // Production indexes
    public static final int START_PROGRAM = 0;
    public static final int PROGRAM_LIST = 1;
    public static final int LIST_SINGLE = 2;
    public static final int LIST_APPEND = 3;
    public static final int WHILE_LOOP = 4;
    public static final int CONDITION_COMPARE = 5;
    public static final int BODY_ASSIGNMENT = 6;
    public static final int ASSIGNMENT_EXPRESSION = 7;
    public static final int EXPRESSION_IDENTIFIER = 8;
    public static final int EXPRESSION_ROMAN = 9;
    public static final int REL_OP_LESS = 10;
    public static final int REL_OP_GREATER = 11;
    public static final int REL_OP_EQUAL = 12;

    public static final Grammar GRAMMAR = new Grammar(List.of(
            new Production(START_PROGRAM, START, PROGRAM),
            new Production(PROGRAM_LIST, PROGRAM, STATEMENT_LIST),
            new Production(LIST_SINGLE, STATEMENT_LIST, STATEMENT),
            new Production(LIST_APPEND, STATEMENT_LIST, STATEMENT_LIST, SEMICOLON, STATEMENT),
            new Production(WHILE_LOOP, STATEMENT, WHILE, LPAREN, CONDITION, RPAREN, BODY, DONE),
            new Production(CONDITION_COMPARE, CONDITION, EXPRESSION, REL_OP, EXPRESSION),
            new Production(BODY_ASSIGNMENT, BODY, ASSIGNMENT),
            new Production(ASSIGNMENT_EXPRESSION, ASSIGNMENT, IDENTIFIER, ASSIGN, EXPRESSION),
            new Production(EXPRESSION_IDENTIFIER, EXPRESSION, IDENTIFIER),
            new Production(EXPRESSION_ROMAN, EXPRESSION, ROMAN_NUMERAL),
            new Production(REL_OP_LESS, REL_OP, LESS),
            new Production(REL_OP_GREATER, REL_OP, GREATER),
            new Production(REL_OP_EQUAL, REL_OP, EQUAL)
    ), WhileGrammar::build);

    private WhileGrammar() {}

    // ====== SEMANTIC ACTIONS ====== //
    static AstNode build(Production production, List<AstNode> children) {
        return switch (production.index()) {
            case START_PROGRAM, BODY_ASSIGNMENT -> children.get(0);
            case PROGRAM_LIST -> new AstNode("Program", children.get(0));
            case LIST_SINGLE -> new AstNode("StatementList", children.get(0));
            case LIST_APPEND -> statementList(children.get(0), children.get(2));
            case WHILE_LOOP -> whileLoop(children.get(2), children.get(4));
            case CONDITION_COMPARE -> new AstNode("Condition", children.get(0), children.get(1), children.get(2));
            case ASSIGNMENT_EXPRESSION -> assignment(children.get(0), children.get(2));
            case EXPRESSION_IDENTIFIER -> promote("Identifier", children.get(0));
            case EXPRESSION_ROMAN -> promote("RomanNumeral", children.get(0));
            case REL_OP_LESS, REL_OP_GREATER, REL_OP_EQUAL -> promote("RelOp", children.get(0));
            default -> throw new IllegalArgumentException("No semantic action for production " + production.index());
        };
    }

    // The list grows to the left: the list built so far becomes the first child.
    private static AstNode statementList(AstNode listSoFar, AstNode statement) {
        return new AstNode("StatementList", listSoFar, statement);
    }

    private static AstNode whileLoop(AstNode condition, AstNode body) {
        return new AstNode("WhileLoop", condition, body);
    }

    private static AstNode assignment(AstNode target, AstNode expression) {
        return new AstNode("Assignment", AstNode.leaf("LValue", target.value()), expression);
    }

    // Turns a shifted token placeholder into a named leaf carrying the token text
    private static AstNode promote(String kind, AstNode token) {
        return AstNode.leaf(kind, token.value());
    }
}
