package at.sv.minihub.automation;

import at.sv.minihub.error.ValidationException;

import java.time.Duration;

/**
 * Suspends the current run for the given duration without blocking the engine. A pending delay does not survive a
 * restart.
 */
public record DelayAction(Duration duration) implements Action {

    @Override
    public void validate() {
        if (duration == null) {
            throw new ValidationException("delay action requires a duration");
        }
        if (duration.isNegative()) {
            throw new ValidationException("delay duration cannot be negative: " + duration);
        }
    }
}
