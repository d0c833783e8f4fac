package com.texteditor.Controller;

import com.texteditor.dto.CommandDTO;
import com.texteditor.dto.EditorStateDTO;
import com.texteditor.model.EditorSession;
import com.texteditor.service.EditorSessionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Controller;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Controller
@ConditionalOnWebApplication
public class EditorController {
    private final EditorSessionService sessionService;
    private final SimpMessagingTemplate messagingTemplate;

    @Autowired
    public EditorController(EditorSessionService sessionService,
                            SimpMessagingTemplate messagingTemplate) {
        this.sessionService = sessionService;
        this.messagingTemplate = messagingTemplate;
    }

    @MessageMapping("/sessions/create")
    public void createSession(@Payload Map<String, Object> payload) {
        Object requestId = payload.get("requestId");
        if (!(requestId instanceof String) || ((String) requestId).isEmpty()) {
            // No reply topic to answer on
            log.warn("Rejected session create request without a valid requestId: {}", requestId);
            Map<String, Object> error = new HashMap<>();
            error.put("error", "requestId must be a non-empty string");
            messagingTemplate.convertAndSend("/topic/session/errors", error);
            return;
        }

        Object initialText = payload.get("initialText");
        if (initialText != null && !(initialText instanceof String)) {
            log.warn("Rejected session create request {}: initialText is not a string", requestId);
            Map<String, Object> error = new HashMap<>();
            error.put("requestId", requestId);
            error.put("error", "initialText must be a string");
            messagingTemplate.convertAndSend("/topic/session/error/" + requestId, error);
            return;
        }

        EditorSession session = sessionService.createSession((String) initialText);

        Map<String, Object> response = new HashMap<>();
        response.put("requestId", requestId);
        response.put("session", sessionService.convertToDTO(session));

        messagingTemplate.convertAndSend("/topic/session/response/" + requestId, response);
    }

    @MessageMapping("/session/{sessionId}/command")
    public void handleCommand(@DestinationVariable String sessionId,
                              @Payload CommandDTO command) {
        log.info("Received {} command for session {}", command.getType(), sessionId);
        try {
            EditorSession session = sessionService.execute(sessionId, command);
            broadcastState(session);
        } catch (IllegalArgumentException | IllegalStateException e) {
            sendError(sessionId, e);
        }
    }

    @MessageMapping("/session/{sessionId}/batch")
    public void handleBatch(@DestinationVariable String sessionId,
                            @Payload List<CommandDTO> commands) {
        log.info("Received batch of {} commands for session {}", commands.size(), sessionId);
        try {
            EditorSession session = sessionService.executeBatch(sessionId, commands);
            broadcastState(session);
        } catch (IllegalArgumentException | IllegalStateException e) {
            // Commands that ran before the failure stay applied, so clients still need the new state
            EditorSession session = sessionService.getSession(sessionId);
            if (session != null) {
                broadcastState(session);
            }
            sendError(sessionId, e);
        }
    }

    @MessageMapping("/session/{sessionId}/undo")
    public void handleUndo(@DestinationVariable String sessionId) {
        try {
            boolean undone = sessionService.undo(sessionId);

            Map<String, Object> result = new HashMap<>();
            result.put("type", "UNDO_RESULT");
            result.put("sessionId", sessionId);
            result.put("success", undone);
            if (!undone) {
                result.put("message", "Nothing to undo");
            }
            messagingTemplate.convertAndSend("/topic/session/" + sessionId + "/undo", result);

            broadcastState(sessionService.requireSession(sessionId));
        } catch (IllegalArgumentException | IllegalStateException e) {
            sendError(sessionId, e);
        }
    }

    @MessageMapping("/session/{sessionId}/history")
    public void handleHistory(@DestinationVariable String sessionId) {
        try {
            List<String> history = sessionService.history(sessionId);
            messagingTemplate.convertAndSend("/topic/session/" + sessionId + "/history", history);
        } catch (IllegalArgumentException e) {
            sendError(sessionId, e);
        }
    }

    @MessageMapping("/session/{sessionId}/close")
    public void handleClose(@DestinationVariable String sessionId) {
        if (!sessionService.removeSession(sessionId)) {
            log.warn("Close requested for unknown session {}", sessionId);
        }
    }

    private void broadcastState(EditorSession session) {
        EditorStateDTO state = sessionService.convertToDTO(session);
        messagingTemplate.convertAndSend("/topic/session/" + session.getId() + "/state", state);
    }

    private void sendError(String sessionId, RuntimeException e) {
        log.warn("Rejected request for session {}: {}", sessionId, e.getMessage());

        Map<String, Object> error = new HashMap<>();
        error.put("sessionId", sessionId);
        error.put("error", e.getMessage());

        messagingTemplate.convertAndSend("/topic/session/" + sessionId + "/errors", error);
    }
}
