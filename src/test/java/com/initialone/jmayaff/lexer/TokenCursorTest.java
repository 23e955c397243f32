package com.initialone.jmayaff.lexer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenCursorTest {

    @Test
    void cursor_shouldSkipLayoutTokensAndEndWithoutException() throws Exception {
        TokenCursor c = new TokenCursor(PythonSourceParser.tokenize("# note\nif a:\n    b\n", "t.py"));

        assertNull(c.current());
        assertEquals("if", c.peek().text);
        assertTrue(c.advance());
        assertEquals("if", c.current().text);
        assertTrue(c.advance());
        assertTrue(c.advance());
        assertEquals(":", c.current().text);
        assertEquals("b", c.peek().text);
        assertTrue(c.advance());
        assertNull(c.peek());

        assertFalse(c.advance());
        assertNull(c.current());
        assertFalse(c.advance());
    }
}
