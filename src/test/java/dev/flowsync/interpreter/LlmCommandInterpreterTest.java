package dev.flowsync.interpreter;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowsync.config.InterpreterProperties;
import dev.flowsync.domain.enums.CommandType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LlmCommandInterpreterTest {

    private ChatModel chatModel;
    private LlmCommandInterpreter interpreter;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        interpreter = new LlmCommandInterpreter(chatModel, new ObjectMapper(),
                new InterpreterProperties("llm", null, null));
    }

    @Test
    @DisplayName("reads the command from a fenced JSON answer")
    void fencedAnswer() {
        answer("""
                ```json
                {"type": "MODIFY_BLOCK", "targetEntity": "Fetch",
                 "parameters": {"blockIdentifier": "Fetch", "property": "url", "value": "https://api"}}
                ```
                """);

        ParsedCommand command = interpreter.interpret("point Fetch at https://api").orElseThrow();

        assertThat(command.type()).isEqualTo(CommandType.MODIFY_BLOCK);
        assertThat(command.targetEntity()).isEqualTo("Fetch");
        assertThat(command.parameter("value")).isEqualTo("https://api");
    }

    @Test
    @DisplayName("a null type means ordinary chat")
    void notACommand() {
        answer("{\"type\": null}");

        assertThat(interpreter.interpret("nice weather")).isEmpty();
    }

    @Test
    @DisplayName("prose instead of JSON falls back to the pattern rules")
    void proseFallsBack() {
        answer("Sure! I think you want to pause.");

        assertThat(interpreter.interpret("pause")).map(ParsedCommand::type).contains(CommandType.PAUSE);
    }

    @Test
    @DisplayName("a model error falls back to the pattern rules")
    void modelErrorFallsBack() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("rate limited"));

        assertThat(interpreter.interpret("delete the Fetch block"))
                .map(ParsedCommand::type).contains(CommandType.DELETE_BLOCK);
    }

    // ── Test Fixtures ──────────────────────────────────────────────

    private void answer(String text) {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(new ChatResponse(List.of(new Generation(new AssistantMessage(text)))));
    }
}
