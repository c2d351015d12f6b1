package com.viffx.WhileLang.Compiler;

import com.viffx.WhileLang.Grammar.WhileGrammar;
import com.viffx.WhileLang.Symbols.NonTerminal;
import com.viffx.WhileLang.Symbols.Terminal;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static com.viffx.WhileLang.Symbols.NonTerminal.*;
import static com.viffx.WhileLang.Symbols.Terminal.*;
import static org.junit.jupiter.api.Assertions.*;

class ParseTableTest {
    private static final ParseTable TABLE = WhileParseTable.TABLE;

    @Test
    void everyEntryPointsInsideTheTable() {
        assertEquals(24, TABLE.stateCount());
        for (int state = 0; state < TABLE.stateCount(); state++) {
            for (Terminal terminal : Terminal.values()) {
                Action action = TABLE.action(state, terminal);
                if (action == null) continue;
                switch (action.type()) {
                    case SHIFT -> assertTrue(action.data() < TABLE.stateCount(), "shift target of " + state);
                    case REDUCE -> assertTrue(WhileGrammar.GRAMMAR.hasProduction(action.data()), "production of " + state);
                    case ACCEPT -> {
                        assertEquals(1, state);
                        assertEquals(END, terminal);
                    }
                }
            }
            for (NonTerminal nonTerminal : NonTerminal.values()) {
                Integer target = TABLE.gotoState(state, nonTerminal);
                if (target != null) assertTrue(target < TABLE.stateCount(), "goto target of " + state);
            }
        }
    }

    @Test
    void startSymbolIsNeverReduced() {
        for (int state = 0; state < TABLE.stateCount(); state++) {
            for (Terminal terminal : Terminal.values()) {
                assertNotEquals(Action.reduce(WhileGrammar.START_PROGRAM), TABLE.action(state, terminal));
            }
        }
    }

    @Test
    void missingEntriesAreNull() {
        assertNull(TABLE.action(0, END));
        assertNull(TABLE.action(500, WHILE));
        assertNull(TABLE.gotoState(1, PROGRAM));
        assertNull(TABLE.gotoState(-3, PROGRAM));
        assertEquals(Integer.valueOf(1), TABLE.gotoState(0, PROGRAM));
        assertEquals(Action.shift(4), TABLE.action(0, WHILE));
    }

    @Test
    void defaultReductionsCoverEveryTerminal() {
        for (Terminal terminal : Terminal.values()) {
            assertEquals(Action.reduce(WhileGrammar.EXPRESSION_ROMAN), TABLE.action(9, terminal));
        }
        assertEquals(EnumSet.allOf(Terminal.class), TABLE.expected(23));
    }

    @Test
    void expectedListsTheTerminalsOfAState() {
        assertEquals(Set.of(DONE), TABLE.expected(WhileParseTable.EXPECT_DONE));
        assertEquals(Set.of(SEMICOLON, END), TABLE.expected(2));
        assertTrue(TABLE.expected(99).isEmpty());
    }

    @Test
    void builderRejectsConflicts() {
        ParseTable.Builder builder = ParseTable.builder().shift(0, WHILE, 1);
        builder.shift(0, WHILE, 1);
        assertThrows(IllegalStateException.class, () -> builder.reduce(0, 2, WHILE));
        builder.gotoState(0, PROGRAM, 3);
        assertThrows(IllegalStateException.class, () -> builder.gotoState(0, PROGRAM, 4));
        assertThrows(IllegalArgumentException.class, () -> builder.shift(-1, WHILE, 1));
    }

    @Test
    void toBuilderCopiesWithoutSharing() {
        ParseTable copy = TABLE.toBuilder().removeAction(0, WHILE).removeGoto(0, PROGRAM).build();

        assertNull(copy.action(0, WHILE));
        assertNull(copy.gotoState(0, PROGRAM));
        assertEquals(Action.shift(4), TABLE.action(0, WHILE));
        assertEquals(Integer.valueOf(1), TABLE.gotoState(0, PROGRAM));
        assertEquals(TABLE.toString(), TABLE.toBuilder().build().toString());
    }

    @Test
    void actionsRenderCompactly() {
        assertEquals("s4", Action.shift(4).toString());
        assertEquals("r7", Action.reduce(7).toString());
        assertEquals("acc", Action.ACCEPT.toString());
        assertEquals(0, Action.reduce(0).data());
        IllegalArgumentException negative = assertThrows(IllegalArgumentException.class, () -> Action.shift(-1));
        assertTrue(negative.getMessage().contains("must not be negative"), negative::getMessage);
        IllegalArgumentException negativeState = assertThrows(IllegalArgumentException.class,
                () -> ParseTable.builder().accept(-1, END));
        assertTrue(negativeState.getMessage().contains("must not be negative"), negativeState::getMessage);
    }
}
