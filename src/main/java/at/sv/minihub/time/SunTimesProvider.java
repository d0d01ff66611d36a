package at.sv.minihub.time;

import java.time.ZonedDateTime;

public interface SunTimesProvider {

    /**
     * @return the time of the given solar event on the date of {@code dateTime}, in the zone of {@code dateTime}
     * @throws IllegalStateException if the event does not happen on that date at the configured location, e.g. during
     *                               polar day
     */
    ZonedDateTime getTime(SolarEvent event, ZonedDateTime dateTime);
}
