package dev.flowsync.interpreter;

import dev.flowsync.domain.enums.CommandType;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based interpreter for the small command vocabulary the chat supports:
 * add/create, delete/remove, connect X to Y, set P of B to V, run/execute/start,
 * status, and the execution controls. Matching is case-insensitive; captured names and
 * values keep the user's casing.
 */
@Component
@ConditionalOnProperty(name = "flowsync.interpreter.mode", havingValue = "pattern", matchIfMissing = true)
public class PatternCommandInterpreter implements CommandInterpreter {

    private static final Pattern ADD = Pattern.compile(
            "^(?:add|create)\\s+(?:an?\\s+)?(\\w+)(?:\\s+block)?(?:\\s+(?:named|called)\\s+(.+))?$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DELETE = Pattern.compile(
            "^(?:delete|remove)\\s+(?:the\\s+)?(.+?)(?:\\s+block)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONNECT = Pattern.compile(
            "connect\\s+(?:the\\s+)?(.+?)(?:\\s+block)?\\s+to\\s+(?:the\\s+)?(.+?)(?:\\s+block)?$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MODIFY = Pattern.compile(
            "^(?:set|update)\\s+(.+?)\\s+(?:of|in)\\s+(?:the\\s+)?(.+?)(?:\\s+block)?\\s+to\\s+(.+)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTROL = Pattern.compile(
            "^(pause|resume|continue|stop|cancel|retry|skip|debug)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXECUTE = Pattern.compile("\\b(?:run|execute|start)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern STATUS = Pattern.compile("\\b(?:status|state|info)\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<ParsedCommand> interpret(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String message = text.trim();

        Matcher m = ADD.matcher(message);
        if (m.find()) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("blockType", m.group(1).toLowerCase(Locale.ROOT));
            if (m.group(2) != null) params.put("name", m.group(2).trim());
            return command(CommandType.ADD_BLOCK, m.group(1).toLowerCase(Locale.ROOT), params);
        }

        m = DELETE.matcher(message);
        if (m.find()) {
            String block = m.group(1).trim();
            return command(CommandType.DELETE_BLOCK, block, Map.of("blockIdentifier", block));
        }

        m = CONNECT.matcher(message);
        if (m.find()) {
            String source = m.group(1).trim();
            String target = m.group(2).trim();
            return command(CommandType.CONNECT_BLOCKS, source, Map.of("sourceBlock", source, "targetBlock", target));
        }

        m = MODIFY.matcher(message);
        if (m.find()) {
            String block = m.group(2).trim();
            return command(CommandType.MODIFY_BLOCK, block, Map.of(
                    "blockIdentifier", block,
                    "property", m.group(1).trim(),
                    "value", m.group(3).trim()));
        }

        m = CONTROL.matcher(message);
        if (m.find()) {
            return command(controlType(m.group(1).toLowerCase(Locale.ROOT)), null, Map.of());
        }

        if (EXECUTE.matcher(message).find()) return command(CommandType.EXECUTE_WORKFLOW, null, Map.of());
        if (STATUS.matcher(message).find()) return command(CommandType.GET_STATUS, null, Map.of());
        return Optional.empty();
    }

    private static CommandType controlType(String verb) {
        return switch (verb) {
            case "pause" -> CommandType.PAUSE;
            case "resume", "continue" -> CommandType.RESUME;
            case "stop", "cancel" -> CommandType.STOP;
            case "retry" -> CommandType.RETRY;
            case "skip" -> CommandType.SKIP;
            default -> CommandType.DEBUG;
        };
    }

    private static Optional<ParsedCommand> command(CommandType type, String target, Map<String, Object> params) {
        return Optional.of(new ParsedCommand(type, target, params));
    }
}
