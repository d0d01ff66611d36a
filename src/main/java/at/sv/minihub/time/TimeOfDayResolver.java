package at.sv.minihub.time;

import java.time.ZonedDateTime;

public interface TimeOfDayResolver {
    /**
     * @param expression an ISO local time ("22:00", "06:30:15"), or a solar keyword with an optional offset in
     *                   minutes ("sunset", "sunrise+30", "civil_dusk-15")
     * @param dateTime   the reference date
     * @return the point in time the expression denotes on the date of {@code dateTime}
     * @throws at.sv.minihub.error.ValidationException if the expression is malformed
     */
    ZonedDateTime resolve(String expression, ZonedDateTime dateTime);

    /**
     * Checks the syntax of the given expression, without resolving any solar time.
     *
     * @throws at.sv.minihub.error.ValidationException if the expression is malformed
     */
    void validate(String expression);
}
