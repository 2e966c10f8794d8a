package dev.flowsync.interpreter;

import dev.flowsync.config.InterpreterProperties;
import dev.flowsync.domain.enums.CommandType;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Delegates interpretation to an external NLP service.
 *
 * <p>Contract: {@code POST /interpret {"text": ...}} answers
 * {@code {"command": {"type", "targetEntity", "parameters"}}} or {@code {"command": null}}.
 * Any transport failure, unknown command type or open circuit degrades to
 * "not a command"; interpretation never fails a chat message.
 */
@Component
@ConditionalOnProperty(name = "flowsync.interpreter.mode", havingValue = "remote")
public class RemoteCommandInterpreter implements CommandInterpreter {

    private static final Logger log = LoggerFactory.getLogger(RemoteCommandInterpreter.class);

    private final WebClient webClient;
    private final InterpreterProperties.Remote properties;

    public RemoteCommandInterpreter(WebClient.Builder builder, InterpreterProperties properties) {
        this.properties = properties.remote();
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(this.properties.timeout())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) this.properties.timeout().toMillis());
        this.webClient = builder.baseUrl(this.properties.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Override
    @CircuitBreaker(name = "command-interpreter", fallbackMethod = "notACommand")
    public Optional<ParsedCommand> interpret(String text) {
        InterpretResponse response = webClient.post()
                .uri("/interpret")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("text", text))
                .retrieve()
                .bodyToMono(InterpretResponse.class)
                .block(properties.timeout());
        if (response == null || response.command() == null || response.command().type() == null)
            return Optional.empty();

        RemoteCommand command = response.command();
        CommandType type;
        try {
            type = CommandType.valueOf(command.type().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Interpreter returned unknown command type '{}'", command.type());
            return Optional.empty();
        }
        return Optional.of(new ParsedCommand(type, command.targetEntity(), command.parameters()));
    }

    @SuppressWarnings("unused")
    private Optional<ParsedCommand> notACommand(String text, Throwable t) {
        log.warn("Command interpreter unavailable, treating message as chat: {}", t.getMessage());
        return Optional.empty();
    }

    record InterpretResponse(RemoteCommand command) {}

    record RemoteCommand(String type, String targetEntity, Map<String, Object> parameters) {}
}
