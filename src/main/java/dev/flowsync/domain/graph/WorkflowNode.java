package dev.flowsync.domain.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A block of the visual workflow. Immutable; modifications replace the node in the graph.
 *
 * <p>{@code name}, {@code description} and {@code enabled} are first-class fields; every
 * other field set through a modification lands in {@code properties}.
 */
public record WorkflowNode(
        String id,
        String name,
        String type,
        String description,
        boolean enabled,
        Map<String, Object> properties
) {
    public WorkflowNode {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("node id required");
        if (name == null || name.isBlank()) name = type != null ? capitalize(type) : id;
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static WorkflowNode of(String id, String name, String type) {
        return new WorkflowNode(id, name, type, null, true, Map.of());
    }

    public WorkflowNode withFields(Map<String, Object> fields) {
        String newName = name;
        String newDescription = description;
        boolean newEnabled = enabled;
        Map<String, Object> newProperties = new LinkedHashMap<>(properties);
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            Object value = field.getValue();
            switch (field.getKey()) {
                case "name" -> newName = value != null ? value.toString() : null;
                case "description" -> newDescription = value != null ? value.toString() : null;
                case "enabled", "isEnabled" -> newEnabled = value == null || Boolean.parseBoolean(value.toString());
                default -> {
                    if (value == null) newProperties.remove(field.getKey());
                    else newProperties.put(field.getKey(), value);
                }
            }
        }
        return new WorkflowNode(id, newName, type, newDescription, newEnabled, newProperties);
    }

    /** Case-insensitive match on id, name or type, as used by chat commands. */
    public boolean matches(String identifier) {
        if (identifier == null) return false;
        String needle = identifier.trim();
        return id.equals(needle)
                || name.equalsIgnoreCase(needle)
                || (type != null && type.equalsIgnoreCase(needle));
    }

    private static String capitalize(String value) {
        if (value.isEmpty()) return value;
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
