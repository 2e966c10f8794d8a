package dev.flowsync.sync;

import dev.flowsync.domain.change.ChangeEvent;
import dev.flowsync.domain.enums.ChangeSource;
import dev.flowsync.exception.InvalidChangeEventException;

/**
 * Structural checks run before a change touches any state.
 */
final class ChangeValidator {

    private ChangeValidator() {}

    static void validate(ChangeEvent change, ChangeSource expectedSource) {
        if (change == null) throw new InvalidChangeEventException("Change event is required");
        if (change.id() == null || change.id().isBlank())
            throw new InvalidChangeEventException("Change event id is required");
        if (change.type() == null)
            throw new InvalidChangeEventException("Change event %s has no type".formatted(change.id()));
        if (change.payload() == null)
            throw new InvalidChangeEventException("Change event %s has no data".formatted(change.id()));
        if (change.payload().type() != change.type())
            throw new InvalidChangeEventException("Change event %s declares %s but carries %s data"
                    .formatted(change.id(), change.type(), change.payload().type()));
        if (!change.payload().hasRequiredFields())
            throw new InvalidChangeEventException("Change event %s is missing required %s fields"
                    .formatted(change.id(), change.type()));
        if (change.source() != expectedSource)
            throw new InvalidChangeEventException("Change event %s has source %s, expected %s"
                    .formatted(change.id(), change.source(), expectedSource));
        if (change.timestamp() < 0)
            throw new InvalidChangeEventException("Change event %s has a negative timestamp".formatted(change.id()));
    }
}
