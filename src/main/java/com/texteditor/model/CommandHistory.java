package com.texteditor.model;

import com.texteditor.model.command.EditCommand;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Stack;

/**
 * Invoker for {@link EditCommand}s.
 * <p>
 * Keeps two sequences: a permanent log of every executed command, and an undo
 * stack that shrinks as commands are undone. Undoing never removes anything from
 * the log. There is no redo.
 */
@Slf4j
public class CommandHistory {
    private final List<EditCommand> commandLog = new ArrayList<>();
    private final Stack<EditCommand> undoStack = new Stack<>();

    /**
     * Applies the command and records it. Nothing is recorded if {@code apply()} throws.
     */
    public void executeCommand(EditCommand command) {
        command.apply();
        commandLog.add(command);
        undoStack.push(command);
    }

    /**
     * Executes the commands one after another. Not atomic: if one fails, the
     * commands before it stay executed and recorded.
     */
    public void executeBatch(List<? extends EditCommand> commands) {
        log.info("Executing batch of {} commands", commands.size());
        for (EditCommand command : commands) {
            executeCommand(command);
        }
    }

    /**
     * Reverts the most recent command still on the undo stack.
     *
     * @return false if there was nothing to undo
     */
    public boolean undo() {
        if (undoStack.isEmpty()) {
            log.info("Nothing to undo!");
            return false;
        }

        EditCommand command = undoStack.pop();
        command.revert();
        return true;
    }

    /**
     * Lists the logged commands as {@code "1. Insert"}, {@code "2. Replace"}, ... and
     * writes the listing to the log.
     */
    public List<String> showHistory() {
        List<String> lines = getHistoryListing();

        log.info("Command History:");
        for (String line : lines) {
            log.info("  {}", line);
        }
        return lines;
    }

    public List<String> getHistoryListing() {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < commandLog.size(); i++) {
            lines.add((i + 1) + ". " + commandLog.get(i).getType().getDisplayName());
        }
        return lines;
    }

    public List<EditCommand> getLog() {
        return Collections.unmodifiableList(commandLog);
    }

    public int getLogSize() {
        return commandLog.size();
    }

    public int getUndoDepth() {
        return undoStack.size();
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }
}
