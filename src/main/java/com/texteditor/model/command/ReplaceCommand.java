package com.texteditor.model.command;

import com.texteditor.model.TextBuffer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Macro command: a {@link DeleteCommand} followed by an {@link InsertCommand},
 * both anchored at the same position. Undo runs the two halves in reverse order.
 */
@Slf4j
@Getter
public final class ReplaceCommand implements EditCommand {
    private final DeleteCommand deleteCommand;
    private final InsertCommand insertCommand;

    public ReplaceCommand(TextBuffer buffer, int position, int length, String newText) {
        this.deleteCommand = new DeleteCommand(buffer, position, length);
        this.insertCommand = new InsertCommand(buffer, newText, position);
    }

    @Override
    public void apply() {
        log.info("Executing REPLACE (macro)");
        deleteCommand.apply();
        insertCommand.apply();
    }

    @Override
    public void revert() {
        // Checked up front: the insert half would already have changed the buffer
        if (deleteCommand.getDeletedText() == null) {
            throw new IllegalStateException("Cannot undo a REPLACE that was never executed");
        }
        log.info("Undoing REPLACE (macro)");
        insertCommand.revert();
        deleteCommand.revert();
    }

    @Override
    public CommandType getType() {
        return CommandType.REPLACE;
    }
}
