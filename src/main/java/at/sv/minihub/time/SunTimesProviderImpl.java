package at.sv.minihub.time;

import org.shredzone.commons.suncalc.SunTimes;

import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class SunTimesProviderImpl implements SunTimesProvider {

    private final double lat;
    private final double lng;
    private final double elevation;

    private final Map<String, SunTimes> cache;

    public SunTimesProviderImpl(double lat, double lng, double elevation) {
        this.lat = lat;
        this.lng = lng;
        this.elevation = elevation;
        cache = new ConcurrentHashMap<>();
    }

    @Override
    public ZonedDateTime getTime(SolarEvent event, ZonedDateTime dateTime) {
        SunTimes sunTimes = sunTimesFor(dateTime, event.getTwilight());
        ZonedDateTime time = switch (event.getPhase()) {
            case RISE -> sunTimes.getRise();
            case NOON -> sunTimes.getNoon();
            case SET -> sunTimes.getSet();
        };
        if (time == null) {
            throw new IllegalStateException("No " + event.name().toLowerCase(Locale.ENGLISH) + " on " + dateTime.toLocalDate() +
                                            " at " + lat + ", " + lng);
        }
        return time.withZoneSameInstant(dateTime.getZone());
    }

    private SunTimes sunTimesFor(ZonedDateTime dateTime, SunTimes.Twilight twilight) {
        String key = dateTime.toLocalDate() + "-" + dateTime.getZone() + "-" + twilight;
        return cache.computeIfAbsent(key, k -> SunTimes.compute()
                                                      .at(lat, lng)
                                                      .elevation(elevation)
                                                      .on(dateTime.with(LocalTime.MIDNIGHT))
                                                      .twilight(twilight)
                                                      .execute());
    }
}
