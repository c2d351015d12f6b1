package com.viffx.WhileLang.Grammar;

import com.viffx.WhileLang.Symbols.AstNode;
import com.viffx.WhileLang.Symbols.NonTerminal;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.viffx.WhileLang.Symbols.AstNode.leaf;
import static com.viffx.WhileLang.Symbols.Terminal.*;
import static org.junit.jupiter.api.Assertions.*;

class WhileGrammarTest {
    private static final Grammar GRAMMAR = WhileGrammar.GRAMMAR;

    private static AstNode token(String text) {
        return leaf(AstNode.TOKEN, text);
    }

    @Test
    void productionsAreNumberedInOrder() {
        assertEquals(13, GRAMMAR.productionsCount());
        assertEquals(List.of(1, 1, 1, 3, 6, 3, 1, 3, 1, 1, 1, 1, 1),
                GRAMMAR.productions().stream().map(Production::arity).toList());
        assertEquals(NonTerminal.START, GRAMMAR.production(WhileGrammar.START_PROGRAM).lhs());
        assertEquals(NonTerminal.REL_OP, GRAMMAR.production(WhileGrammar.REL_OP_EQUAL).lhs());
    }

    @Test
    void productionsRenderAsRules() {
        assertEquals("Statement -> while '(' Condition ')' Body done",
                GRAMMAR.production(WhileGrammar.WHILE_LOOP).toString());
        assertEquals("Condition -> Expression RelOp Expression",
                GRAMMAR.production(WhileGrammar.CONDITION_COMPARE).toString());
        assertTrue(GRAMMAR.toString().startsWith(" 0: START -> Program\n 1: Program -> StatementList"));
    }

    @Test
    void whileLoopKeepsOnlyConditionAndBody() {
        AstNode condition = new AstNode("Condition");
        AstNode body = new AstNode("Assignment");
        AstNode loop = GRAMMAR.build(GRAMMAR.production(WhileGrammar.WHILE_LOOP),
                List.of(token("while"), token("("), condition, token(")"), body, token("done")));

        assertEquals(new AstNode("WhileLoop", condition, body), loop);
    }

    @Test
    void assignmentSynthesisesItsTarget() {
        AstNode assignment = GRAMMAR.build(GRAMMAR.production(WhileGrammar.ASSIGNMENT_EXPRESSION),
                List.of(token("y"), token(":="), leaf("Identifier", "x")));

        assertEquals(new AstNode("Assignment", leaf("LValue", "y"), leaf("Identifier", "x")), assignment);
    }

    @Test
    void leavesTakeTheTokenText() {
        assertEquals(leaf("RelOp", ">"),
                GRAMMAR.build(GRAMMAR.production(WhileGrammar.REL_OP_GREATER), List.of(token(">"))));
        assertEquals(leaf("RomanNumeral", "XII"),
                GRAMMAR.build(GRAMMAR.production(WhileGrammar.EXPRESSION_ROMAN), List.of(token("XII"))));
        assertEquals(leaf("Identifier", "abc"),
                GRAMMAR.build(GRAMMAR.production(WhileGrammar.EXPRESSION_IDENTIFIER), List.of(token("abc"))));
    }

    @Test
    void bodyPassesItsAssignmentThrough() {
        AstNode assignment = new AstNode("Assignment");
        assertSame(assignment, GRAMMAR.build(GRAMMAR.production(WhileGrammar.BODY_ASSIGNMENT), List.of(assignment)));
    }

    @Test
    void appendPutsTheListFirst() {
        AstNode list = new AstNode("StatementList", new AstNode("WhileLoop"));
        AstNode statement = new AstNode("WhileLoop");

        AstNode appended = GRAMMAR.build(GRAMMAR.production(WhileGrammar.LIST_APPEND),
                List.of(list, token(";"), statement));

        assertEquals(List.of(list, statement), appended.children());
    }

    @Test
    void grammarRejectsMisnumberedProductions() {
        List<Production> productions = List.of(new Production(1, NonTerminal.PROGRAM, NonTerminal.STATEMENT_LIST));
        assertThrows(IllegalArgumentException.class, () -> new Grammar(productions, (production, children) -> children.get(0)));
    }

    @Test
    void tokensDescribeThemselves() {
        assertEquals("IDENTIFIER 'x' at 3", new Token(IDENTIFIER, "x", 3).toString());
        assertEquals("END end of input at 9", Token.end(9).toString());
        assertEquals("DONE 'done'", new Token(DONE, "done").toString());
    }
}
