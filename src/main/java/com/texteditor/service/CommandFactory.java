package com.texteditor.service;

import com.texteditor.dto.CommandDTO;
import com.texteditor.model.TextBuffer;
import com.texteditor.model.command.DeleteCommand;
import com.texteditor.model.command.EditCommand;
import com.texteditor.model.command.InsertCommand;
import com.texteditor.model.command.ReplaceCommand;
import org.springframework.stereotype.Component;

/**
 * Builds commands bound to a buffer from incoming requests.
 */
@Component
public class CommandFactory {

    public EditCommand create(TextBuffer buffer, CommandDTO request) {
        if (request == null || request.getType() == null) {
            throw new IllegalArgumentException("Command type is required");
        }

        switch (request.getType()) {
            case INSERT:
                String text = require(request.getText(), "text");
                if (request.getPosition() == null) {
                    return new InsertCommand(buffer, text);
                }
                return new InsertCommand(buffer, text, request.getPosition());
            case DELETE:
                return new DeleteCommand(buffer,
                        require(request.getPosition(), "position"),
                        require(request.getLength(), "length"));
            case REPLACE:
                return new ReplaceCommand(buffer,
                        require(request.getPosition(), "position"),
                        require(request.getLength(), "length"),
                        require(request.getText(), "text"));
            default:
                throw new IllegalArgumentException("Unsupported command type: " + request.getType());
        }
    }

    private static <T> T require(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException("Missing field '" + field + "' for command");
        }
        return value;
    }
}
