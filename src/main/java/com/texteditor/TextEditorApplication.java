package com.texteditor;

import com.texteditor.config.EditorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(EditorProperties.class)
public class TextEditorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TextEditorApplication.class, args);
    }
}
