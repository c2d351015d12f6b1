package com.viffx.WhileLang.Utils;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class LexicalCharacterBufferTest {

    @Test
    void emptyInputStartsAtEof() throws IOException {
        LexicalCharacterBuffer buffer = new LexicalCharacterBuffer("");
        assertTrue(buffer.eof());
        assertThrows(IOException.class, buffer::nextChar);
    }

    @Test
    void advancesWithOneCharacterOfLookahead() throws IOException {
        int[] advanced = {0};
        LexicalCharacterBuffer buffer = new LexicalCharacterBuffer("ab") {
            @Override
            public void onNextChar() {
                advanced[0]++;
            }
        };

        assertEquals('a', buffer.crntChar());
        assertTrue(buffer.hasPeek());
        assertEquals('b', buffer.peekChar());
        assertEquals("['a','b']", buffer.buffer());

        assertEquals('b', buffer.nextChar());
        assertFalse(buffer.hasPeek());
        assertFalse(buffer.eof());

        buffer.nextChar();
        assertTrue(buffer.eof());
        assertEquals(2, advanced[0]);
        assertThrows(IOException.class, buffer::nextChar);
    }

    @Test
    void escapesControlCharactersInDebugOutput() throws IOException {
        assertEquals("['\\n','EOF']", new LexicalCharacterBuffer("\n").buffer());
    }
}
