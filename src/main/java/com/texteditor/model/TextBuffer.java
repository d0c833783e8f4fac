package com.texteditor.model;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class TextBuffer {
    private final StringBuilder content;

    public TextBuffer() {
        this("");
    }

    public TextBuffer(String initialText) {
        this.content = new StringBuilder(initialText == null ? "" : initialText);
    }

    public void insert(String text) {
        insert(text, content.length());
    }

    public void insert(String text, int position) {
        if (text == null) {
            throw new IllegalArgumentException("Text to insert must not be null");
        }
        checkPosition(position);

        content.insert(position, text);

        log.info("Inserted '{}' at position {}", text, position);
        log.info("Current text: '{}'", content);
    }

    /**
     * Removes up to {@code length} characters starting at {@code position}.
     * A length running past the end of the buffer is clamped.
     *
     * @return the removed text
     */
    public String delete(int position, int length) {
        checkPosition(position);
        if (length < 0) {
            throw new TextRangeException("Length must not be negative: " + length);
        }

        // Compared against the remaining room so a huge length cannot overflow
        int end = position + Math.min(length, content.length() - position);
        String deleted = content.substring(position, end);
        content.delete(position, end);

        log.info("Deleted '{}' at position {}", deleted, position);
        log.info("Current text: '{}'", content);

        return deleted;
    }

    public String getText() {
        return content.toString();
    }

    public int length() {
        return content.length();
    }

    public void show() {
        log.info("Text: '{}'", content);
    }

    private void checkPosition(int position) {
        if (position < 0 || position > content.length()) {
            throw new TextRangeException("Position " + position +
                    " is outside buffer of length " + content.length());
        }
    }
}
