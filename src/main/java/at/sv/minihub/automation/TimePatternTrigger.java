package at.sv.minihub.automation;

import java.time.ZonedDateTime;

/**
 * Fires whenever the wall clock matches the given {@link TimePattern}, e.g. "/5:0:0" for every five hours.
 */
public record TimePatternTrigger(String schedule) implements Trigger {

    public boolean matches(ZonedDateTime time) {
        return TimePattern.parse(schedule).matches(time);
    }

    @Override
    public void validate() {
        TimePattern.parse(schedule);
    }
}
