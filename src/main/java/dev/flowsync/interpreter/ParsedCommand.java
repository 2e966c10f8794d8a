package dev.flowsync.interpreter;

import dev.flowsync.domain.enums.CommandType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured reading of one chat message. targetEntity is the block or workflow the
 * command is about, when it names one.
 */
public record ParsedCommand(CommandType type, String targetEntity, Map<String, Object> parameters) {
    public ParsedCommand {
        if (type == null) throw new IllegalArgumentException("command type required");
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public String parameter(String name) {
        Object value = parameters.get(name);
        return value != null ? value.toString() : null;
    }
}
