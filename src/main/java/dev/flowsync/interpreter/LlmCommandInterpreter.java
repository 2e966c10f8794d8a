package dev.flowsync.interpreter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowsync.config.InterpreterProperties;
import dev.flowsync.domain.enums.CommandType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Asks a chat model to classify the message into the command vocabulary.
 *
 * <p>The model must answer with a single JSON object. Anything else, including a model
 * error, falls back to {@link PatternCommandInterpreter} so the chat keeps working
 * when the model is slow, down or chatty.
 */
@Component
@ConditionalOnProperty(name = "flowsync.interpreter.mode", havingValue = "llm")
public class LlmCommandInterpreter implements CommandInterpreter {

    private static final Logger log = LoggerFactory.getLogger(LlmCommandInterpreter.class);

    private static final String SYSTEM_PROMPT = """
            You translate chat messages about a visual workflow into commands.
            Answer with exactly one JSON object and nothing else:
            {"type": <one of %s or null>, "targetEntity": <block name or null>, "parameters": {<string keys>}}
            Parameters by type:
            ADD_BLOCK: blockType, name (optional)
            DELETE_BLOCK: blockIdentifier
            CONNECT_BLOCKS: sourceBlock, targetBlock
            MODIFY_BLOCK: blockIdentifier, property, value
            Use {"type": null} when the message is not a command.
            """;

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final InterpreterProperties.Llm properties;
    private final PatternCommandInterpreter fallback = new PatternCommandInterpreter();

    public LlmCommandInterpreter(ChatModel chatModel, ObjectMapper objectMapper, InterpreterProperties properties) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.properties = properties.llm();
    }

    @Override
    public Optional<ParsedCommand> interpret(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        try {
            return parse(ask(text));
        } catch (Exception e) {
            log.warn("LLM interpretation failed, using pattern rules: {}", e.getMessage());
            return fallback.interpret(text);
        }
    }

    // ── Internal ───────────────────────────────────────────────────

    private String ask(String text) {
        String vocabulary = Arrays.stream(CommandType.values()).map(Enum::name).collect(Collectors.joining(", "));
        ChatOptions.Builder options = ChatOptions.builder()
                .temperature(properties.temperature())
                .maxTokens(properties.maxTokens());
        if (properties.model() != null && !properties.model().isBlank()) options.model(properties.model());
        String prompt = SYSTEM_PROMPT.formatted(vocabulary) + "\nMessage: " + text;
        ChatResponse response = chatModel.call(new Prompt(prompt, options.build()));
        return response.getResult().getOutput().getText();
    }

    Optional<ParsedCommand> parse(String answer) throws Exception {
        String json = stripFences(answer);
        JsonNode root = objectMapper.readTree(json);
        JsonNode type = root.get("type");
        if (type == null || type.isNull()) return Optional.empty();
        CommandType commandType = CommandType.valueOf(type.asText().trim().toUpperCase(Locale.ROOT));

        Map<String, Object> parameters = new LinkedHashMap<>();
        JsonNode params = root.get("parameters");
        if (params != null && params.isObject()) {
            params.fields().forEachRemaining(f -> parameters.put(f.getKey(), f.getValue().asText()));
        }
        JsonNode target = root.get("targetEntity");
        String targetEntity = target != null && !target.isNull() ? target.asText() : null;
        return Optional.of(new ParsedCommand(commandType, targetEntity, parameters));
    }

    private static String stripFences(String answer) {
        if (answer == null) throw new IllegalArgumentException("empty model answer");
        String trimmed = answer.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closing = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closing > firstNewline) trimmed = trimmed.substring(firstNewline + 1, closing).trim();
        }
        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (start < 0 || end < start) throw new IllegalArgumentException("no JSON object in model answer");
        return trimmed.substring(start, end + 1);
    }
}
