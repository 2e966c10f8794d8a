package dev.flowsync.interpreter;

import dev.flowsync.domain.enums.CommandType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class PatternCommandInterpreterTest {

    private final PatternCommandInterpreter interpreter = new PatternCommandInterpreter();

    @Nested
    @DisplayName("edit commands")
    class Edits {

        @Test
        @DisplayName("add with a name keeps the user's casing for the name")
        void addNamed() {
            ParsedCommand command = interpreter.interpret("Add an Email block named Notify Team").orElseThrow();

            assertThat(command.type()).isEqualTo(CommandType.ADD_BLOCK);
            assertThat(command.parameter("blockType")).isEqualTo("email");
            assertThat(command.parameter("name")).isEqualTo("Notify Team");
        }

        @Test
        @DisplayName("create without a name leaves the name out")
        void createUnnamed() {
            ParsedCommand command = interpreter.interpret("create a http block").orElseThrow();

            assertThat(command.type()).isEqualTo(CommandType.ADD_BLOCK);
            assertThat(command.parameters()).containsOnlyKeys("blockType");
        }

        @Test
        @DisplayName("delete strips the article and the trailing 'block'")
        void delete() {
            ParsedCommand command = interpreter.interpret("delete the Fetch block").orElseThrow();

            assertThat(command.type()).isEqualTo(CommandType.DELETE_BLOCK);
            assertThat(command.parameter("blockIdentifier")).isEqualTo("Fetch");
        }

        @Test
        @DisplayName("connect captures source and target")
        void connect() {
            ParsedCommand command = interpreter.interpret("connect the Fetch block to Notify").orElseThrow();

            assertThat(command.type()).isEqualTo(CommandType.CONNECT_BLOCKS);
            assertThat(command.parameter("sourceBlock")).isEqualTo("Fetch");
            assertThat(command.parameter("targetBlock")).isEqualTo("Notify");
        }

        @Test
        @DisplayName("set P of B to V captures property, block and value")
        void modify() {
            ParsedCommand command = interpreter.interpret("set timeout of the Fetch block to 30s").orElseThrow();

            assertThat(command.type()).isEqualTo(CommandType.MODIFY_BLOCK);
            assertThat(command.parameter("property")).isEqualTo("timeout");
            assertThat(command.parameter("blockIdentifier")).isEqualTo("Fetch");
            assertThat(command.parameter("value")).isEqualTo("30s");
        }
    }

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({
            "pause, PAUSE",
            "Resume please, RESUME",
            "continue, RESUME",
            "cancel it, STOP",
            "retry, RETRY",
            "skip this one, SKIP",
            "debug, DEBUG",
            "please run the workflow, EXECUTE_WORKFLOW",
            "what is the status?, GET_STATUS"
    })
    @DisplayName("control, execute and status phrases")
    void controls(String text, CommandType expected) {
        assertThat(interpreter.interpret(text)).map(ParsedCommand::type).contains(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"hello there", "  ", "thanks!"})
    @DisplayName("ordinary chat is not a command")
    void notACommand(String text) {
        assertThat(interpreter.interpret(text)).isEmpty();
    }
}
