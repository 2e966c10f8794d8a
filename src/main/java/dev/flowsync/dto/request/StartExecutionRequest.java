package dev.flowsync.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Starts a run. Without a journey the enabled blocks of the session's graph become the steps;
 * without an executionId one is generated.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StartExecutionRequest(String executionId, String workspaceId, Journey journey) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Journey(String id, String title, List<Step> steps) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Step(String id, String name, String type, String toolId) {}
}
