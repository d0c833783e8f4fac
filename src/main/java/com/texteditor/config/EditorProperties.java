package com.texteditor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "editor")
public class EditorProperties {
    private final WebSocket websocket = new WebSocket();
    private final Session session = new Session();
    private final Demo demo = new Demo();

    @Data
    public static class WebSocket {
        private String endpoint = "/ws";
        private String allowedOriginPatterns = "*";
    }

    @Data
    public static class Session {
        // Sessions untouched for longer than this are dropped by the cleanup job
        private long maxIdleMinutes = 30;
        private long cleanupIntervalMs = 60000;
    }

    @Data
    public static class Demo {
        private boolean enabled = false;
    }
}
