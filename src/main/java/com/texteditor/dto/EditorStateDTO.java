package com.texteditor.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
public class EditorStateDTO {
    private String sessionId;
    private String content;
    private int undoDepth;
    private int logSize;
    private List<String> history;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
