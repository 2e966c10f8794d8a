package dev.flowsync.streaming;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowsync.domain.enums.ExportFormat;
import dev.flowsync.domain.execution.ConversationalMessage;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Serializes an execution's message log.
 *
 * <ul>
 *   <li><b>json</b>: {@code {execution, messages, exportTimestamp, totalMessages}}</li>
 *   <li><b>csv</b>: header {@code Timestamp,Type,Content,StepId,ExecutionTime}, one record per
 *       message, content always quoted with embedded quotes doubled</li>
 *   <li><b>txt</b>: {@code [HH:mm:ss] TYPE: content} per message, UTC</li>
 * </ul>
 */
@Component
public class ExecutionLogExporter {

    static final String CSV_HEADER = "Timestamp,Type,Content,StepId,ExecutionTime";
    private static final DateTimeFormatter TXT_TIME = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;

    public ExecutionLogExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String export(ExecutionSnapshot execution, List<ConversationalMessage> messages, ExportFormat format,
                         Instant exportedAt) {
        return switch (format) {
            case JSON -> json(execution, messages, exportedAt);
            case CSV -> csv(messages);
            case TXT -> txt(messages);
        };
    }

    public record ExportDocument(ExecutionSnapshot execution, List<ConversationalMessage> messages,
                                 Instant exportTimestamp, int totalMessages) {}

    // ── Internal ───────────────────────────────────────────────────

    private String json(ExecutionSnapshot execution, List<ConversationalMessage> messages, Instant exportedAt) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(new ExportDocument(execution, messages, exportedAt, messages.size()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to export execution " + execution.id(), e);
        }
    }

    private static String csv(List<ConversationalMessage> messages) {
        StringBuilder out = new StringBuilder(CSV_HEADER);
        for (ConversationalMessage message : messages) {
            out.append('\n')
                    .append(message.timestamp()).append(',')
                    .append(message.type().name().toLowerCase(Locale.ROOT)).append(',')
                    .append(quote(message.content())).append(',')
                    .append(field(message.metadata().stepId())).append(',')
                    .append(message.metadata().executionTime() != null ? message.metadata().executionTime() : "");
        }
        return out.toString();
    }

    private static String txt(List<ConversationalMessage> messages) {
        StringBuilder out = new StringBuilder();
        for (ConversationalMessage message : messages) {
            if (out.length() > 0) out.append('\n');
            out.append('[').append(TXT_TIME.format(message.timestamp())).append("] ")
                    .append(message.type().name()).append(": ")
                    .append(message.content());
        }
        return out.toString();
    }

    private static String quote(String value) {
        return '"' + (value == null ? "" : value.replace("\"", "\"\"")) + '"';
    }

    private static String field(String value) {
        if (value == null) return "";
        boolean needsQuotes = value.indexOf(',') >= 0 || value.indexOf('"') >= 0
                || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0;
        return needsQuotes ? quote(value) : value;
    }
}
