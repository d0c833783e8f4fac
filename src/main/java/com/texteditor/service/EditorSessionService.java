package com.texteditor.service;

import com.texteditor.config.EditorProperties;
import com.texteditor.dto.CommandDTO;
import com.texteditor.dto.EditorStateDTO;
import com.texteditor.model.EditorSession;
import com.texteditor.model.command.EditCommand;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
public class EditorSessionService {
    private final Map<String, EditorSession> sessions = new ConcurrentHashMap<>();
    private final CommandFactory commandFactory;
    private final EditorProperties properties;

    @Autowired
    public EditorSessionService(CommandFactory commandFactory, EditorProperties properties) {
        this.commandFactory = commandFactory;
        this.properties = properties;
    }

    /**
     * Creates a session whose buffer starts with {@code initialText}. The seed text is
     * not a command, so it cannot be undone and does not show up in the history.
     */
    public EditorSession createSession(String initialText) {
        EditorSession session = new EditorSession(initialText);
        sessions.put(session.getId(), session);
        log.info("Created editor session {}", session.getId());
        return session;
    }

    public EditorSession getSession(String sessionId) {
        return sessions.get(sessionId);
    }

    public EditorSession requireSession(String sessionId) {
        EditorSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new IllegalArgumentException("Session not found: " + sessionId);
        }
        return session;
    }

    public boolean removeSession(String sessionId) {
        boolean removed = sessions.remove(sessionId) != null;
        if (removed) {
            log.info("Closed editor session {}", sessionId);
        }
        return removed;
    }

    public int getSessionCount() {
        return sessions.size();
    }

    public EditorSession execute(String sessionId, CommandDTO request) {
        EditorSession session = requireSession(sessionId);
        synchronized (session) {
            EditCommand command = commandFactory.create(session.getBuffer(), request);
            session.execute(command);
        }
        return session;
    }

    /**
     * Builds every command first, then runs them in order. Default insert positions are
     * therefore taken from the buffer as it was before the batch started.
     */
    public EditorSession executeBatch(String sessionId, List<CommandDTO> requests) {
        EditorSession session = requireSession(sessionId);
        synchronized (session) {
            List<EditCommand> commands = new ArrayList<>();
            for (CommandDTO request : requests) {
                commands.add(commandFactory.create(session.getBuffer(), request));
            }
            session.executeBatch(commands);
        }
        return session;
    }

    public boolean undo(String sessionId) {
        return requireSession(sessionId).undo();
    }

    public List<String> history(String sessionId) {
        return requireSession(sessionId).showHistory();
    }

    public EditorStateDTO convertToDTO(EditorSession session) {
        synchronized (session) {
            EditorStateDTO dto = new EditorStateDTO();
            dto.setSessionId(session.getId());
            dto.setContent(session.getText());
            dto.setUndoDepth(session.getUndoDepth());
            dto.setLogSize(session.getLogSize());
            dto.setHistory(session.getHistoryListing());
            dto.setCreatedAt(session.getCreatedAt());
            dto.setUpdatedAt(session.getUpdatedAt());
            return dto;
        }
    }

    @Scheduled(fixedRateString = "${editor.session.cleanup-interval-ms:60000}")
    public void evictIdleSessions() {
        evictIdleSessions(LocalDateTime.now());
    }

    int evictIdleSessions(LocalDateTime now) {
        long maxIdle = properties.getSession().getMaxIdleMinutes();
        List<String> expired = new ArrayList<>();

        for (EditorSession session : sessions.values()) {
            if (ChronoUnit.MINUTES.between(session.getUpdatedAt(), now) > maxIdle) {
                expired.add(session.getId());
            }
        }

        for (String sessionId : expired) {
            sessions.remove(sessionId);
            log.info("Evicted idle editor session {}", sessionId);
        }
        return expired.size();
    }
}
