package com.texteditor.model.command;

public enum CommandType {
    INSERT("Insert"),
    DELETE("Delete"),
    REPLACE("Replace");

    private final String displayName;

    CommandType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
