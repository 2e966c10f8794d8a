package dev.flowsync.domain.execution;

import dev.flowsync.domain.graph.WorkflowGraph;
import dev.flowsync.domain.graph.WorkflowNode;

import java.util.List;
import java.util.Optional;

/**
 * Ordered steps an execution walks through. Built by the caller or derived from a graph.
 */
public record JourneyDefinition(String id, String title, List<Step> steps) {
    public JourneyDefinition {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("journey id required");
        if (title == null || title.isBlank()) title = id;
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /** Enabled blocks in graph order become steps. */
    public static JourneyDefinition fromGraph(WorkflowGraph graph, String title) {
        List<Step> steps = graph.getNodes().stream()
                .filter(WorkflowNode::enabled)
                .map(n -> new Step(n.id(), n.name(), n.type(), toolIdOf(n)))
                .toList();
        return new JourneyDefinition(graph.getWorkflowId(), title, steps);
    }

    public Optional<Step> step(String stepId) {
        if (stepId == null) return Optional.empty();
        return steps.stream().filter(s -> s.id().equals(stepId)).findFirst();
    }

    public int indexOf(String stepId) {
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).id().equals(stepId)) return i;
        }
        return -1;
    }

    private static String toolIdOf(WorkflowNode node) {
        Object toolId = node.properties().get("toolId");
        return toolId != null ? toolId.toString() : null;
    }

    public record Step(String id, String name, String type, String toolId) {
        public String displayName() {
            return name != null && !name.isBlank() ? name : id;
        }
    }
}
