package dev.flowsync.streaming;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.flowsync.domain.enums.ExecutionStatus;
import dev.flowsync.domain.enums.ExportFormat;
import dev.flowsync.domain.enums.MessageType;
import dev.flowsync.domain.execution.ConversationalMessage;
import dev.flowsync.domain.execution.ConversationalMessage.Metadata;
import dev.flowsync.domain.execution.PerformanceMetrics;
import dev.flowsync.domain.execution.Progress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionLogExporterTest {

    private static final Instant T0 = Instant.parse("2025-01-01T09:15:30Z");

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final ExecutionLogExporter exporter = new ExecutionLogExporter(objectMapper);

    @Nested
    @DisplayName("csv")
    class Csv {

        @Test
        @DisplayName("three messages give a header and three rows whose content survives quoting")
        void roundTrip() {
            List<ConversationalMessage> messages = messages();

            String csv = exporter.export(snapshot(), messages, ExportFormat.CSV, T0);

            List<List<String>> records = parseCsv(csv);
            assertThat(csv.split("\n")).hasSize(4);
            assertThat(records.get(0)).containsExactly("Timestamp", "Type", "Content", "StepId", "ExecutionTime");
            assertThat(records.subList(1, records.size()))
                    .extracting(r -> r.get(2))
                    .containsExactlyElementsOf(messages.stream().map(ConversationalMessage::content).toList());
        }

        @Test
        @DisplayName("rows carry lower-case type, step id and execution time")
        void columns() {
            List<List<String>> records = parseCsv(exporter.export(snapshot(), messages(), ExportFormat.CSV, T0));

            assertThat(records.get(2)).containsExactly(T0.plusSeconds(1).toString(), "result",
                    "Completed \"Fetch, orders\"", "a", "120");
            assertThat(records.get(1).get(3)).isEmpty();
        }

        @Test
        @DisplayName("multi-line content stays inside one quoted record")
        void multiLine() {
            ConversationalMessage message = ConversationalMessage.of(MessageType.ERROR, "line one\nline two", T0,
                    Metadata.step("b"));

            List<List<String>> records = parseCsv(exporter.export(snapshot(), List.of(message), ExportFormat.CSV, T0));

            assertThat(records).hasSize(2);
            assertThat(records.get(1).get(2)).isEqualTo("line one\nline two");
        }
    }

    @Test
    @DisplayName("json wraps the execution, the messages and the export time")
    void json() throws Exception {
        String json = exporter.export(snapshot(), messages(), ExportFormat.JSON, T0);

        JsonNode root = objectMapper.readTree(json);
        assertThat(root.get("execution").get("id").asText()).isEqualTo("x1");
        assertThat(root.get("totalMessages").asInt()).isEqualTo(3);
        assertThat(root.get("messages")).hasSize(3);
        assertThat(root.get("messages").get(1).get("content").asText()).isEqualTo("Completed \"Fetch, orders\"");
        assertThat(root.get("exportTimestamp").asText()).isEqualTo("2025-01-01T09:15:30Z");
    }

    @Test
    @DisplayName("json messages read back equal to the exported ones, in order")
    void jsonRoundTrip() throws Exception {
        List<ConversationalMessage> messages = new ArrayList<>(messages());
        messages.add(ConversationalMessage.of(MessageType.PROGRESS, "Step 2/3", T0.plusMillis(2500),
                Metadata.progress("b", Progress.of(2, 3))));
        messages.add(ConversationalMessage.of(MessageType.ERROR, "Failed at \"Notify\"\nline two", T0.plusSeconds(3),
                Metadata.actionRequired("b", true, false, true)));

        JsonNode root = objectMapper.readTree(exporter.export(snapshot(), messages, ExportFormat.JSON, T0));
        List<ConversationalMessage> read = objectMapper.convertValue(root.get("messages"),
                new TypeReference<List<ConversationalMessage>>() { });

        assertThat(read).containsExactlyElementsOf(messages);
    }

    @Test
    @DisplayName("txt prints one UTC time-stamped line per message")
    void txt() {
        String txt = exporter.export(snapshot(), messages(), ExportFormat.TXT, T0);

        assertThat(txt.split("\n")).containsExactly(
                "[09:15:30] SYSTEM: Starting",
                "[09:15:31] RESULT: Completed \"Fetch, orders\"",
                "[09:15:32] WARNING: Slow step");
    }

    // ── Test Fixtures ──────────────────────────────────────────────

    private static List<ConversationalMessage> messages() {
        return List.of(
                ConversationalMessage.of(MessageType.SYSTEM, "Starting", T0, Metadata.EMPTY),
                ConversationalMessage.of(MessageType.RESULT, "Completed \"Fetch, orders\"", T0.plusSeconds(1),
                        Metadata.completed("a", 120L, null)),
                ConversationalMessage.of(MessageType.WARNING, "Slow step", T0.plusSeconds(2), Metadata.step("b")));
    }

    private static ExecutionSnapshot snapshot() {
        return new ExecutionSnapshot("x1", "wf1", "Import Orders", "ws1", "u1", T0, null, 1, "a", 2,
                ExecutionStatus.RUNNING, PerformanceMetrics.initial(2), null, 3, 200);
    }

    /** Minimal RFC 4180 reader: quoted fields, doubled quotes, line breaks inside quotes. */
    private static List<List<String>> parseCsv(String csv) {
        List<List<String>> records = new ArrayList<>();
        List<String> record = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < csv.length(); i++) {
            char c = csv.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < csv.length() && csv.charAt(i + 1) == '"') {
                    field.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    field.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                record.add(field.toString());
                field.setLength(0);
            } else if (c == '\n') {
                record.add(field.toString());
                field.setLength(0);
                records.add(record);
                record = new ArrayList<>();
            } else {
                field.append(c);
            }
        }
        record.add(field.toString());
        records.add(record);
        return records;
    }
}
