package dev.flowsync.interpreter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Single entry point to whichever {@link CommandInterpreter} the configured mode selects.
 * Interpreter failures are data: they read as "not a command", never as an error.
 */
@Component
public class CommandInterpreterAdapter {

    private static final Logger log = LoggerFactory.getLogger(CommandInterpreterAdapter.class);

    private final CommandInterpreter interpreter;

    public CommandInterpreterAdapter(CommandInterpreter interpreter) {
        this.interpreter = interpreter;
        log.info("Command interpreter: {}", interpreter.getClass().getSimpleName());
    }

    public Optional<ParsedCommand> interpret(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        try {
            Optional<ParsedCommand> command = interpreter.interpret(text.trim());
            if (command == null) return Optional.empty();
            log.debug("Interpreted '{}' as {}", text, command.map(ParsedCommand::type).orElse(null));
            return command;
        } catch (RuntimeException e) {
            log.warn("Command interpreter failed for message, treating as chat: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
