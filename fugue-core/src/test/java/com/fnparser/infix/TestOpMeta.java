package com.fnparser.infix;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TestOpMeta {

    @Test
    void testParsesFixityAndPrecedence() throws InfixException {
        assertEquals(new OpMeta(Fixity.LEFT, 6), OpMeta.parse("left, 6"));
        assertEquals(new OpMeta(Fixity.RIGHT, 0), OpMeta.parse("right,0"));
        assertEquals(new OpMeta(Fixity.LEFT, 3), OpMeta.parse(" left ,  3 "));
    }

    @Test
    void testInvalidFixity() {
        InfixException e = assertThrows(InfixException.class, () -> OpMeta.parse("middle, 1"));
        assertEquals(new InfixError.InvalidFixity(), e.error());
        assertThrows(InfixException.class, () -> OpMeta.parse(""));
    }

    @Test
    void testInvalidPrecedence() {
        for (String text : new String[] {"left", "left,", "left, -1", "left, +1", "left, x", "right, 99999999999", "left, \u0663"}) {
            InfixException e = assertThrows(InfixException.class, () -> OpMeta.parse(text), text);
            assertEquals(new InfixError.InvalidPrecedence(), e.error(), text);
        }
    }

    @Test
    void testMessages() {
        assertEquals("infixl 6", new OpMeta(Fixity.LEFT, 6).toString());
        assertEquals("Only `left` or `right` is valid associativity specifications",
            new InfixError.InvalidFixity().message());
        assertEquals("No fixity specified for `<>`. Fixity must be specified with the `#[infix]` attribute",
            new InfixError.UndefinedFixity("<>").message());
    }
}
