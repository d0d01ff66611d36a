package at.sv.minihub.time;

import at.sv.minihub.error.ValidationException;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TimeOfDayResolverImpl implements TimeOfDayResolver {

    private static final Pattern SOLAR_EXPRESSION = Pattern.compile("\\s*([a-zA-Z_]+)\\s*(?:([+-])\\s*(\\d+))?\\s*");

    private final SunTimesProvider sunTimesProvider;
    private final Map<String, LocalTime> timeCache;

    public TimeOfDayResolverImpl(SunTimesProvider sunTimesProvider) {
        this.sunTimesProvider = sunTimesProvider;
        timeCache = new ConcurrentHashMap<>();
    }

    @Override
    public ZonedDateTime resolve(String expression, ZonedDateTime dateTime) {
        LocalTime time = tryParseTime(expression);
        if (time != null) {
            return dateTime.with(time);
        }
        Matcher matcher = matchSolarExpression(expression);
        SolarEvent event = SolarEvent.fromKeyword(matcher.group(1)).orElseThrow();
        ZonedDateTime solarTime = sunTimesProvider.getTime(event, dateTime);
        if (matcher.group(2) == null) {
            return solarTime;
        }
        long offset = Long.parseLong(matcher.group(3));
        return "+".equals(matcher.group(2)) ? solarTime.plusMinutes(offset) : solarTime.minusMinutes(offset);
    }

    @Override
    public void validate(String expression) {
        if (tryParseTime(expression) == null) {
            matchSolarExpression(expression);
        }
    }

    private LocalTime tryParseTime(String expression) {
        if (expression == null || expression.isEmpty()) {
            throw new ValidationException("Time expression cannot be empty");
        }
        if (!Character.isDigit(expression.charAt(0))) {
            return null;
        }
        return timeCache.computeIfAbsent(expression, k -> {
            try {
                return LocalTime.parse(expression);
            } catch (DateTimeParseException e) {
                throw new ValidationException("Invalid time '" + expression + "'. Expected HH:mm or HH:mm:ss");
            }
        });
    }

    private Matcher matchSolarExpression(String expression) {
        Matcher matcher = SOLAR_EXPRESSION.matcher(expression);
        if (!matcher.matches() || SolarEvent.fromKeyword(matcher.group(1)).isEmpty()) {
            throw new ValidationException("Invalid time expression '" + expression + "'. Expected HH:mm, HH:mm:ss " +
                                          "or a sun keyword with optional offset, e.g. 'sunset+30'");
        }
        return matcher;
    }
}
