package dev.flowsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Command interpreter selection. mode is one of {@code pattern}, {@code remote}, {@code llm}.
 */
@ConfigurationProperties(prefix = "flowsync.interpreter")
public record InterpreterProperties(String mode, Remote remote, Llm llm) {
    public InterpreterProperties {
        if (mode == null || mode.isBlank()) mode = "pattern";
        if (remote == null) remote = new Remote(null, null);
        if (llm == null) llm = new Llm(null, 0, 0);
    }

    public record Remote(String baseUrl, Duration timeout) {
        public Remote {
            if (baseUrl == null || baseUrl.isBlank()) baseUrl = "http://localhost:8090";
            if (timeout == null) timeout = Duration.ofSeconds(3);
        }
    }

    public record Llm(String model, double temperature, int maxTokens) {
        public Llm {
            if (temperature <= 0) temperature = 0.1;
            if (maxTokens <= 0) maxTokens = 256;
        }
    }
}
