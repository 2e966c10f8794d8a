package dev.flowsync.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowsync.config.StreamingProperties;
import dev.flowsync.config.SyncProperties;
import dev.flowsync.domain.graph.WorkflowGraph;
import dev.flowsync.infrastructure.broadcast.SessionBroadcaster;
import dev.flowsync.infrastructure.engine.ExecutionEngine;
import dev.flowsync.infrastructure.journal.ExecutionJournal;
import dev.flowsync.streaming.ConversationalMessageFactory;
import dev.flowsync.streaming.ExecutionLogExporter;
import dev.flowsync.streaming.WorkflowExecutionStreamer;
import dev.flowsync.sync.ConflictDetector;
import dev.flowsync.sync.ConflictResolver;
import dev.flowsync.sync.WorkflowChatSynchronizer;
import dev.flowsync.sync.WorkflowStateSnapshotBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Assembles a {@link WorkflowSession} from the shared, stateless collaborators.
 */
@Component
public class WorkflowSessionFactory {

    private final WorkflowStateSnapshotBuilder snapshotBuilder;
    private final ConflictDetector detector;
    private final ConflictResolver resolver;
    private final SyncProperties syncProperties;
    private final ExecutionEngine engine;
    private final ConversationalMessageFactory messageFactory;
    private final ExecutionLogExporter exporter;
    private final ExecutionJournal journal;
    private final ObjectMapper objectMapper;
    private final StreamingProperties streamingProperties;
    private final SessionBroadcaster broadcaster;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public WorkflowSessionFactory(WorkflowStateSnapshotBuilder snapshotBuilder,
                                  ConflictDetector detector,
                                  ConflictResolver resolver,
                                  SyncProperties syncProperties,
                                  ExecutionEngine engine,
                                  ConversationalMessageFactory messageFactory,
                                  ExecutionLogExporter exporter,
                                  ExecutionJournal journal,
                                  ObjectMapper objectMapper,
                                  StreamingProperties streamingProperties,
                                  SessionBroadcaster broadcaster,
                                  Clock clock,
                                  MeterRegistry meterRegistry) {
        this.snapshotBuilder = snapshotBuilder;
        this.detector = detector;
        this.resolver = resolver;
        this.syncProperties = syncProperties;
        this.engine = engine;
        this.messageFactory = messageFactory;
        this.exporter = exporter;
        this.journal = journal;
        this.objectMapper = objectMapper;
        this.streamingProperties = streamingProperties;
        this.broadcaster = broadcaster;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public WorkflowSession create(String sessionId, WorkflowGraph graph) {
        WorkflowChatSynchronizer synchronizer = new WorkflowChatSynchronizer(sessionId, graph, snapshotBuilder,
                detector, resolver, syncProperties, meterRegistry);
        WorkflowExecutionStreamer streamer = new WorkflowExecutionStreamer(sessionId, engine, messageFactory,
                exporter, journal, objectMapper, streamingProperties, clock, meterRegistry);
        return new WorkflowSession(sessionId, graph, synchronizer, streamer, broadcaster, clock.instant());
    }
}
