package com.texteditor.model.command;

import com.texteditor.model.TextBuffer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Getter
public final class DeleteCommand implements EditCommand {
    private final TextBuffer buffer;
    private final int position;
    private final int length;
    private String deletedText; // null until applied

    public DeleteCommand(TextBuffer buffer, int position, int length) {
        this.buffer = buffer;
        this.position = position;
        this.length = length;
    }

    @Override
    public void apply() {
        log.info("Executing DELETE");
        deletedText = buffer.delete(position, length);
    }

    @Override
    public void revert() {
        if (deletedText == null) {
            throw new IllegalStateException("Cannot undo a DELETE that was never executed");
        }
        log.info("Undoing DELETE");
        buffer.insert(deletedText, position);
    }

    @Override
    public CommandType getType() {
        return CommandType.DELETE;
    }
}
