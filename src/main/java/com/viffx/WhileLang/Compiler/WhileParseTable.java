package com.viffx.WhileLang.Compiler;

import static com.viffx.WhileLang.Grammar.WhileGrammar.*;
import static com.viffx.WhileLang.Symbols.NonTerminal.*;
import static com.viffx.WhileLang.Symbols.Terminal.*;

/**
 * The precomputed SLR(1) table for {@link com.viffx.WhileLang.Grammar.WhileGrammar#GRAMMAR}.
 * <p>
 * States whose only item is complete reduce on every terminal. Such a default
 * reduction never shifts an invalid token, it only postpones the error to the
 * state that really expects something else: a missing {@code done} is reported
 * by state 18 instead of by the expression that precedes it.
 */
public final class WhileParseTable {
    /** State that expects the {@code done} closing a loop. */
    public static final int EXPECT_DONE = 18;

    public static final ParseTable TABLE = ParseTable.builder()
            // 0: START -> . Program
            .shift(0, WHILE, 4)
            .gotoState(0, PROGRAM, 1)
            .gotoState(0, STATEMENT_LIST, 2)
            .gotoState(0, STATEMENT, 3)
            // 1: START -> Program .
            .accept(1, END)
            // 2: Program -> StatementList . | StatementList -> StatementList . ';' Statement
            .reduce(2, PROGRAM_LIST, END)
            .shift(2, SEMICOLON, 5)
            // 3: StatementList -> Statement .
            .reduceOnAny(3, LIST_SINGLE)
            // 4: Statement -> while . '(' Condition ')' Body done
            .shift(4, LPAREN, 6)
            // 5: StatementList -> StatementList ';' . Statement
            .shift(5, WHILE, 4)
            .gotoState(5, STATEMENT, 7)
            // 6: Statement -> while '(' . Condition ')' Body done
            .shift(6, IDENTIFIER, 8)
            .shift(6, ROMAN_NUMERAL, 9)
            .gotoState(6, CONDITION, 10)
            .gotoState(6, EXPRESSION, 11)
            // 7: StatementList -> StatementList ';' Statement .
            .reduceOnAny(7, LIST_APPEND)
            // 8: Expression -> IDENTIFIER .
            .reduceOnAny(8, EXPRESSION_IDENTIFIER)
            // 9: Expression -> ROMAN_NUMERAL .
            .reduceOnAny(9, EXPRESSION_ROMAN)
            // 10: Statement -> while '(' Condition . ')' Body done
            .shift(10, RPAREN, 12)
            // 11: Condition -> Expression . RelOp Expression
            .shift(11, LESS, 13)
            .shift(11, GREATER, 14)
            .shift(11, EQUAL, 15)
            .gotoState(11, REL_OP, 16)
            // 12: Statement -> while '(' Condition ')' . Body done
            .shift(12, IDENTIFIER, 17)
            .gotoState(12, BODY, EXPECT_DONE)
            .gotoState(12, ASSIGNMENT, 19)
            // 13-15: RelOp -> '<' . | '>' . | '=' .
            .reduceOnAny(13, REL_OP_LESS)
            .reduceOnAny(14, REL_OP_GREATER)
            .reduceOnAny(15, REL_OP_EQUAL)
            // 16: Condition -> Expression RelOp . Expression
            .shift(16, IDENTIFIER, 8)
            .shift(16, ROMAN_NUMERAL, 9)
            .gotoState(16, EXPRESSION, 20)
            // 17: Assignment -> IDENTIFIER . ':=' Expression
            .shift(17, ASSIGN, 21)
            // 18: Statement -> while '(' Condition ')' Body . done
            .shift(EXPECT_DONE, DONE, 22)
            // 19: Body -> Assignment .
            .reduceOnAny(19, BODY_ASSIGNMENT)
            // 20: Condition -> Expression RelOp Expression .
            .reduceOnAny(20, CONDITION_COMPARE)
            // 21: Assignment -> IDENTIFIER ':=' . Expression
            .shift(21, IDENTIFIER, 8)
            .shift(21, ROMAN_NUMERAL, 9)
            .gotoState(21, EXPRESSION, 23)
            // 22: Statement -> while '(' Condition ')' Body done .
            .reduceOnAny(22, WHILE_LOOP)
            // 23: Assignment -> IDENTIFIER ':=' Expression .
            .reduceOnAny(23, ASSIGNMENT_EXPRESSION)
            .build();

    private WhileParseTable() {}
}
