package dev.flowsync.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenSessionRequest(String workflowId, List<Block> nodes, List<Connection> edges) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Block(String id, String name, String type, String description, Boolean enabled,
                        Map<String, Object> properties) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Connection(String id, String source, String target) {}
}
