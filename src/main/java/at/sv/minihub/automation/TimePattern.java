package at.sv.minihub.automation;

import at.sv.minihub.error.ValidationException;
import lombok.EqualsAndHashCode;

import java.time.ZonedDateTime;

/**
 * A schedule in the form {@code <hours>:<minutes>:<seconds>}. Each field is either {@code *} (every value),
 * a number (exactly this value), or {@code /N} (every value divisible by N). Omitted trailing fields are 0, so
 * {@code "/2"} matches every second hour at :00:00.
 */
@EqualsAndHashCode
public final class TimePattern {

    private final Field hours;
    private final Field minutes;
    private final Field seconds;

    private TimePattern(Field hours, Field minutes, Field seconds) {
        this.hours = hours;
        this.minutes = minutes;
        this.seconds = seconds;
    }

    public static TimePattern parse(String schedule) {
        if (schedule == null || schedule.isBlank()) {
            throw new ValidationException("time_pattern schedule cannot be empty");
        }
        String[] parts = schedule.trim().split(":", -1);
        if (parts.length > 3) {
            throw new ValidationException("Invalid time_pattern schedule '" + schedule +
                                          "'. Expected <hours>:<minutes>:<seconds>");
        }
        return new TimePattern(
                Field.parse(schedule, parts[0], 23),
                parts.length > 1 ? Field.parse(schedule, parts[1], 59) : Field.exactly(0),
                parts.length > 2 ? Field.parse(schedule, parts[2], 59) : Field.exactly(0));
    }

    public boolean matches(ZonedDateTime time) {
        return hours.matches(time.getHour()) && minutes.matches(time.getMinute()) && seconds.matches(time.getSecond());
    }

    @Override
    public String toString() {
        return hours + ":" + minutes + ":" + seconds;
    }

    private record Field(Kind kind, int value) {

        enum Kind {
            ANY,
            EXACT,
            EVERY
        }

        static Field exactly(int value) {
            return new Field(Kind.EXACT, value);
        }

        static Field parse(String schedule, String input, int max) {
            String part = input.trim();
            if (part.equals("*")) {
                return new Field(Kind.ANY, 0);
            }
            boolean every = part.startsWith("/");
            int value;
            try {
                value = Integer.parseInt(every ? part.substring(1) : part);
            } catch (NumberFormatException e) {
                throw new ValidationException("Invalid time_pattern schedule '" + schedule + "': '" + input +
                                              "' is neither '*', a number, nor '/N'");
            }
            if (every && (value <= 0 || value > max)) {
                throw new ValidationException("Invalid time_pattern schedule '" + schedule + "': interval '" + input +
                                              "' must be within [1," + max + "]");
            }
            if (!every && (value < 0 || value > max)) {
                throw new ValidationException("Invalid time_pattern schedule '" + schedule + "': '" + input +
                                              "' must be within [0," + max + "]");
            }
            return new Field(every ? Kind.EVERY : Kind.EXACT, value);
        }

        boolean matches(int actual) {
            return switch (kind) {
                case ANY -> true;
                case EXACT -> actual == value;
                case EVERY -> actual % value == 0;
            };
        }

        @Override
        public String toString() {
            return switch (kind) {
                case ANY -> "*";
                case EXACT -> String.valueOf(value);
                case EVERY -> "/" + value;
            };
        }
    }
}
