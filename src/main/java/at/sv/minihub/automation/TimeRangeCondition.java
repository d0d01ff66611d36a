package at.sv.minihub.automation;

import at.sv.minihub.error.ValidationException;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Satisfied from the minute of {@code after} through the end of the minute of {@code before}, both inclusive. If
 * {@code after} lies later in the day than {@code before}, the range spans midnight. Equal bounds match that single
 * minute.
 */
public record TimeRangeCondition(String after, String before) implements Condition {

    @Override
    public boolean isSatisfied(ConditionContext context) {
        ZonedDateTime now = context.now();
        LocalTime minute = toMinute(now);
        LocalTime start = toMinute(context.resolveTime(after, now));
        LocalTime end = toMinute(context.resolveTime(before, now));
        boolean afterStart = !minute.isBefore(start);
        boolean beforeEnd = !minute.isAfter(end);
        if (start.isAfter(end)) {
            return afterStart || beforeEnd;
        }
        return afterStart && beforeEnd;
    }

    private static LocalTime toMinute(ZonedDateTime dateTime) {
        return dateTime.toLocalTime().truncatedTo(ChronoUnit.MINUTES);
    }

    @Override
    public void validate() {
        if (after == null || after.isBlank() || before == null || before.isBlank()) {
            throw new ValidationException("time_range condition requires both 'after' and 'before'");
        }
    }
}
