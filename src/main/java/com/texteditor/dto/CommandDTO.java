package com.texteditor.dto;

import com.texteditor.model.command.CommandType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommandDTO {
    private CommandType type;
    private String text;
    private Integer position; // null on INSERT means end of buffer
    private Integer length;

    public static CommandDTO insert(String text, Integer position) {
        return new CommandDTO(CommandType.INSERT, text, position, null);
    }

    public static CommandDTO delete(int position, int length) {
        return new CommandDTO(CommandType.DELETE, null, position, length);
    }

    public static CommandDTO replace(int position, int length, String text) {
        return new CommandDTO(CommandType.REPLACE, text, position, length);
    }
}
