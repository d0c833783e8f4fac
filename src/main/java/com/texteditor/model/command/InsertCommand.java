package com.texteditor.model.command;

import com.texteditor.model.TextBuffer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Getter
public final class InsertCommand implements EditCommand {
    private final TextBuffer buffer;
    private final String text;
    private final int position;

    // Position defaults to the end of the buffer as it is when the command is built
    public InsertCommand(TextBuffer buffer, String text) {
        this(buffer, text, buffer.length());
    }

    public InsertCommand(TextBuffer buffer, String text, int position) {
        this.buffer = buffer;
        this.text = text;
        this.position = position;
    }

    @Override
    public void apply() {
        log.info("Executing INSERT");
        buffer.insert(text, position);
    }

    @Override
    public void revert() {
        log.info("Undoing INSERT");
        buffer.delete(position, text.length());
    }

    @Override
    public CommandType getType() {
        return CommandType.INSERT;
    }
}
