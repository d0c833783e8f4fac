package com.texteditor.model;

import com.texteditor.model.command.EditCommand;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * One buffer and its command history. All access goes through this object's monitor.
 */
@Getter
public class EditorSession {
    private final String id;
    private final TextBuffer buffer;
    private final CommandHistory history;
    private final LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public EditorSession(String initialText) {
        this.id = UUID.randomUUID().toString();
        this.buffer = new TextBuffer(initialText);
        this.history = new CommandHistory();
        this.createdAt = LocalDateTime.now();
        this.updatedAt = createdAt;
    }

    public synchronized void execute(EditCommand command) {
        try {
            history.executeCommand(command);
        } finally {
            updateTimestamp();
        }
    }

    public synchronized void executeBatch(List<? extends EditCommand> commands) {
        try {
            history.executeBatch(commands);
        } finally {
            updateTimestamp();
        }
    }

    public synchronized boolean undo() {
        try {
            return history.undo();
        } finally {
            updateTimestamp();
        }
    }

    public synchronized List<String> showHistory() {
        return history.showHistory();
    }

    public synchronized List<String> getHistoryListing() {
        return history.getHistoryListing();
    }

    public synchronized String getText() {
        return buffer.getText();
    }

    public synchronized int getUndoDepth() {
        return history.getUndoDepth();
    }

    public synchronized int getLogSize() {
        return history.getLogSize();
    }

    public synchronized LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    private void updateTimestamp() {
        this.updatedAt = LocalDateTime.now();
    }
}
