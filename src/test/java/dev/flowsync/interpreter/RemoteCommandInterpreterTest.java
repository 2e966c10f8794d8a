package dev.flowsync.interpreter;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import dev.flowsync.config.InterpreterProperties;
import dev.flowsync.domain.enums.CommandType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

@WireMockTest
class RemoteCommandInterpreterTest {

    private RemoteCommandInterpreter interpreter;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wmInfo) {
        InterpreterProperties properties = new InterpreterProperties("remote",
                new InterpreterProperties.Remote(wmInfo.getHttpBaseUrl(), Duration.ofSeconds(2)), null);
        interpreter = new RemoteCommandInterpreter(WebClient.builder(), properties);
    }

    @Test
    @DisplayName("maps the service's command onto a parsed command")
    void parsesCommand() {
        stubFor(post(urlPathEqualTo("/interpret"))
                .withRequestBody(matchingJsonPath("$.text", equalTo("connect Fetch to Notify")))
                .willReturn(okJson("""
                        {"command": {"type": "connect_blocks", "targetEntity": "Fetch",
                                     "parameters": {"sourceBlock": "Fetch", "targetBlock": "Notify"}}}
                        """)));

        Optional<ParsedCommand> command = interpreter.interpret("connect Fetch to Notify");

        assertThat(command).isPresent();
        assertThat(command.get().type()).isEqualTo(CommandType.CONNECT_BLOCKS);
        assertThat(command.get().parameter("targetBlock")).isEqualTo("Notify");
    }

    @Test
    @DisplayName("a null command means ordinary chat")
    void nullCommand() {
        stubFor(post(urlPathEqualTo("/interpret")).willReturn(okJson("{\"command\": null}")));

        assertThat(interpreter.interpret("good morning")).isEmpty();
    }

    @Test
    @DisplayName("an unknown command type is not a command")
    void unknownType() {
        stubFor(post(urlPathEqualTo("/interpret"))
                .willReturn(okJson("{\"command\": {\"type\": \"teleport\"}}")));

        assertThat(interpreter.interpret("beam me up")).isEmpty();
    }

    @Test
    @DisplayName("a failing service reads as 'not a command' through the adapter")
    void failingService() {
        stubFor(post(urlPathEqualTo("/interpret")).willReturn(serverError()));

        assertThat(new CommandInterpreterAdapter(interpreter).interpret("pause")).isEmpty();
    }
}
