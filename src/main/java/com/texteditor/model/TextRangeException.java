package com.texteditor.model;

/**
 * Thrown when a position or length falls outside the current buffer content.
 */
public class TextRangeException extends IllegalArgumentException {

    public TextRangeException(String message) {
        super(message);
    }
}
