package com.texteditor.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

// Drives idle-session cleanup; absent in the demo profile, which has no web server
@Configuration
@ConditionalOnWebApplication
@EnableScheduling
public class SchedulingConfig {
}
