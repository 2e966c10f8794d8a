package dev.flowsync.interpreter;

import java.util.Optional;

/**
 * Turns free chat text into a structured command. Empty means "not a command".
 */
public interface CommandInterpreter {
    Optional<ParsedCommand> interpret(String text);
}
