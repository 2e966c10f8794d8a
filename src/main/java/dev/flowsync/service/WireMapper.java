package dev.flowsync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowsync.domain.change.ChangeEvent;
import dev.flowsync.domain.change.ChangePayload;
import dev.flowsync.domain.enums.ChangeSource;
import dev.flowsync.domain.enums.ChangeType;
import dev.flowsync.domain.enums.ExecutionEventType;
import dev.flowsync.domain.execution.ExecutionEvent;
import dev.flowsync.domain.execution.ExecutionEventDetail;
import dev.flowsync.domain.execution.JourneyDefinition;
import dev.flowsync.domain.graph.WorkflowEdge;
import dev.flowsync.domain.graph.WorkflowGraph;
import dev.flowsync.domain.graph.WorkflowNode;
import dev.flowsync.dto.request.ChangeRequest;
import dev.flowsync.dto.request.EngineEventRequest;
import dev.flowsync.dto.request.OpenSessionRequest;
import dev.flowsync.dto.request.StartExecutionRequest;
import dev.flowsync.exception.GraphMutationException;
import dev.flowsync.exception.InvalidChangeEventException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Decodes request bodies into domain values. The tagged {@code data}/{@code detail}
 * objects are read into the variant their {@code type} names.
 */
@Component
public class WireMapper {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WireMapper(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /** @throws InvalidChangeEventException when the type is unknown or data does not fit it */
    public ChangeEvent toChange(ChangeRequest request, ChangeSource source) {
        if (request == null) throw new InvalidChangeEventException("change body required");
        ChangeType type = ChangeType.fromWire(request.type());
        if (type == null) throw new InvalidChangeEventException("Unknown change type: " + request.type());
        if (request.data() == null || request.data().isNull())
            throw new InvalidChangeEventException("Change %s has no data".formatted(request.id()));

        ChangePayload payload = read(request.data(), ChangePayload.variantOf(type));
        long timestamp = request.timestamp() != null ? request.timestamp() : clock.millis();
        return new ChangeEvent(request.id(), type, timestamp, payload, source, request.actorId());
    }

    /** @throws IllegalArgumentException when the event is malformed */
    public ExecutionEvent toExecutionEvent(EngineEventRequest request) {
        ExecutionEventType type = ExecutionEventType.fromWire(request.type());
        Class<? extends ExecutionEventDetail> variant = ExecutionEventDetail.variantOf(type);
        ExecutionEventDetail detail;
        try {
            JsonNode node = request.detail() == null || request.detail().isNull()
                    ? objectMapper.createObjectNode()
                    : request.detail();
            detail = objectMapper.treeToValue(node, variant);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed %s detail: %s".formatted(type, e.getOriginalMessage()), e);
        }
        return new ExecutionEvent(request.eventId(), request.executionId(), request.stepId(),
                request.timestamp() != null ? request.timestamp() : clock.instant(),
                request.progress(), request.estimatedTimeRemainingMs(), detail, request.resources());
    }

    public WorkflowGraph toGraph(String sessionId, OpenSessionRequest request) {
        String workflowId = request != null && request.workflowId() != null ? request.workflowId() : sessionId;
        if (request == null) return new WorkflowGraph(workflowId);
        List<WorkflowNode> nodes = request.nodes() == null ? List.of() : request.nodes().stream()
                .map(b -> new WorkflowNode(b.id(), b.name(), b.type(), b.description(),
                        b.enabled() == null || b.enabled(), b.properties()))
                .toList();
        List<WorkflowEdge> edges = request.edges() == null ? List.of() : request.edges().stream()
                .map(c -> new WorkflowEdge(c.id(), c.source(), c.target()))
                .toList();
        try {
            return WorkflowGraph.of(workflowId, nodes, edges);
        } catch (GraphMutationException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    /** The posted journey, or the graph's enabled blocks in order. */
    public JourneyDefinition toJourney(StartExecutionRequest.Journey journey, WorkflowGraph graph) {
        if (journey == null) return JourneyDefinition.fromGraph(graph, graph.getWorkflowId());
        List<JourneyDefinition.Step> steps = journey.steps() == null ? List.of() : journey.steps().stream()
                .map(s -> new JourneyDefinition.Step(s.id(), s.name(), s.type(), s.toolId()))
                .toList();
        return new JourneyDefinition(journey.id() != null ? journey.id() : graph.getWorkflowId(), journey.title(), steps);
    }

    private ChangePayload read(JsonNode data, Class<? extends ChangePayload> variant) {
        try {
            return objectMapper.treeToValue(data, variant);
        } catch (JsonProcessingException e) {
            throw new InvalidChangeEventException("Malformed %s data: %s".formatted(variant.getSimpleName(), e.getOriginalMessage()));
        }
    }
}
