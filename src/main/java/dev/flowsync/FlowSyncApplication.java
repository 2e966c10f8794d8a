package dev.flowsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * FlowSync: keeps a visual workflow editor and a chat in step, and narrates workflow
 * executions as conversation.
 *
 * <p>Architecture overview:
 * <pre>
 * Editor / Chat → REST + WebSocket → Session lane → WorkflowChatSynchronizer → graph
 *                                                 ↘ WorkflowExecutionStreamer → SQS → Engine
 * Engine → SQS / callback → Session lane → streamer → messages → WebSocket topics
 * </pre>
 *
 * <p>Key design decisions:
 * <ul>
 *   <li>One serial lane per session: no locks in the domain, parallelism across sessions</li>
 *   <li>Conflicts and failures are data: they show up in snapshots and messages, not as errors</li>
 *   <li>Engine delivery is at-least-once: events are deduplicated by id per execution</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class FlowSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowSyncApplication.class, args);
    }
}
