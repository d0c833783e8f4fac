package com.texteditor.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TextBufferTest {
    private TextBuffer buffer;

    @BeforeEach
    public void setUp() {
        buffer = new TextBuffer();
    }

    @Test
    public void testEmptyBuffer() {
        assertEquals("", buffer.getText());
        assertEquals(0, buffer.length());
    }

    @Test
    public void testNullInitialTextIsEmpty() {
        assertEquals("", new TextBuffer(null).getText());
    }

    @Test
    public void testInsertAppendsByDefault() {
        buffer.insert("Hello");
        buffer.insert(" World");
        assertEquals("Hello World", buffer.getText());
    }

    @Test
    public void testInsertAtPosition() {
        buffer.insert("Hllo");
        buffer.insert("e", 1);
        buffer.insert(">", 0);
        assertEquals(">Hello", buffer.getText());
    }

    @Test
    public void testInsertOutOfRange() {
        buffer.insert("abc");

        assertThrows(TextRangeException.class, () -> buffer.insert("x", 4));
        assertThrows(TextRangeException.class, () -> buffer.insert("x", -1));

        // Buffer untouched after a rejected insert
        assertEquals("abc", buffer.getText());
    }

    @Test
    public void testDeleteReturnsRemovedText() {
        buffer.insert("Hello World");
        String deleted = buffer.delete(5, 6);

        assertEquals(" World", deleted);
        assertEquals("Hello", buffer.getText());
    }

    @Test
    public void testDeleteLengthIsClamped() {
        buffer.insert("Hello");
        String deleted = buffer.delete(3, 100);

        assertEquals("lo", deleted);
        assertEquals("Hel", buffer.getText());
    }

    @Test
    public void testDeleteAtEndRemovesNothing() {
        buffer.insert("Hello");
        assertEquals("", buffer.delete(5, 3));
        assertEquals("Hello", buffer.getText());
    }

    @Test
    public void testDeleteOutOfRange() {
        buffer.insert("Hello");

        Exception exception = assertThrows(TextRangeException.class, () -> buffer.delete(6, 1));
        assertTrue(exception.getMessage().contains("outside buffer"));

        assertThrows(TextRangeException.class, () -> buffer.delete(-1, 1));
        assertThrows(TextRangeException.class, () -> buffer.delete(0, -2));
        assertEquals("Hello", buffer.getText());
    }

    @Test
    public void testDeleteWithHugeLengthIsClamped() {
        buffer.insert("Hello");

        assertEquals("llo", buffer.delete(2, Integer.MAX_VALUE));
        assertEquals("He", buffer.getText());

        // Same at the very end, where nothing is left to remove
        assertEquals("", buffer.delete(2, Integer.MAX_VALUE));
        assertEquals("He", buffer.getText());
    }
}
