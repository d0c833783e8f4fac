package com.texteditor.model.command;

/**
 * A reversible edit bound to a {@link com.texteditor.model.TextBuffer}.
 * <p>
 * Implementations are {@link InsertCommand}, {@link DeleteCommand} and the
 * composite {@link ReplaceCommand}. {@link #revert()} may only be called after
 * {@link #apply()}.
 */
public interface EditCommand {

    void apply();

    void revert();

    CommandType getType();
}
