package dev.flowsync.interpreter;

import dev.flowsync.domain.change.ChangePayload;
import dev.flowsync.domain.enums.CommandType;
import dev.flowsync.domain.enums.ExecutionCommand;
import dev.flowsync.domain.graph.WorkflowGraph;
import dev.flowsync.domain.graph.WorkflowNode;
import dev.flowsync.exception.InvalidChangeEventException;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Turns edit commands into change payloads against the current graph. Block identifiers
 * resolve by id, then by name or type, case-insensitively.
 */
@Component
public class ChatCommandTranslator {

    public ChangePayload toChange(ParsedCommand command, WorkflowGraph graph) {
        return switch (command.type()) {
            case ADD_BLOCK -> {
                String blockType = required(command, "blockType");
                String name = command.parameter("name");
                yield new ChangePayload.NodeAdded(blockType + "-" + shortId(), name, blockType, null);
            }
            case DELETE_BLOCK -> new ChangePayload.NodeRemoved(resolve(graph, required(command, "blockIdentifier")).id());
            case CONNECT_BLOCKS -> {
                WorkflowNode source = resolve(graph, required(command, "sourceBlock"));
                WorkflowNode target = resolve(graph, required(command, "targetBlock"));
                yield new ChangePayload.EdgeAdded("edge-" + shortId(), source.id(), target.id());
            }
            case MODIFY_BLOCK -> {
                WorkflowNode node = resolve(graph, required(command, "blockIdentifier"));
                yield ChangePayload.NodeModified.of(node.id(), required(command, "property"), command.parameter("value"));
            }
            default -> throw new IllegalArgumentException(command.type() + " is not an edit command");
        };
    }

    public ExecutionCommand toExecutionCommand(CommandType type) {
        return switch (type) {
            case PAUSE -> ExecutionCommand.PAUSE;
            case RESUME -> ExecutionCommand.RESUME;
            case STOP -> ExecutionCommand.STOP;
            case RETRY -> ExecutionCommand.RETRY;
            case SKIP -> ExecutionCommand.SKIP;
            case DEBUG -> ExecutionCommand.DEBUG;
            case GET_STATUS -> ExecutionCommand.STATUS;
            default -> throw new IllegalArgumentException(type + " is not an execution control");
        };
    }

    private static WorkflowNode resolve(WorkflowGraph graph, String identifier) {
        return graph.findNode(identifier)
                .orElseThrow(() -> new InvalidChangeEventException("No block matches \"%s\"".formatted(identifier)));
    }

    private static String required(ParsedCommand command, String name) {
        String value = command.parameter(name);
        if (value == null || value.isBlank())
            throw new InvalidChangeEventException("%s command is missing %s".formatted(command.type(), name));
        return value;
    }

    private static String shortId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
