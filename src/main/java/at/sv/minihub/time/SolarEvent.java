package at.sv.minihub.time;

import org.shredzone.commons.suncalc.SunTimes;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The sun positions usable in time expressions, with their accepted keywords.
 */
public enum SolarEvent {
    ASTRONOMICAL_DAWN(SunTimes.Twilight.ASTRONOMICAL, Phase.RISE, "astronomical_dawn", "astronomical_start"),
    NAUTICAL_DAWN(SunTimes.Twilight.NAUTICAL, Phase.RISE, "nautical_dawn", "nautical_start"),
    CIVIL_DAWN(SunTimes.Twilight.CIVIL, Phase.RISE, "civil_dawn", "civil_start"),
    SUNRISE(SunTimes.Twilight.VISUAL, Phase.RISE, "sunrise"),
    NOON(SunTimes.Twilight.VISUAL, Phase.NOON, "noon"),
    GOLDEN_HOUR(SunTimes.Twilight.GOLDEN_HOUR, Phase.SET, "golden_hour"),
    SUNSET(SunTimes.Twilight.VISUAL, Phase.SET, "sunset"),
    BLUE_HOUR(SunTimes.Twilight.BLUE_HOUR, Phase.SET, "blue_hour"),
    CIVIL_DUSK(SunTimes.Twilight.CIVIL, Phase.SET, "civil_dusk", "civil_end"),
    NAUTICAL_DUSK(SunTimes.Twilight.NAUTICAL, Phase.SET, "nautical_dusk", "nautical_end"),
    ASTRONOMICAL_DUSK(SunTimes.Twilight.ASTRONOMICAL, Phase.SET, "astronomical_dusk", "astronomical_end");

    enum Phase {
        RISE,
        NOON,
        SET
    }

    private final SunTimes.Twilight twilight;
    private final Phase phase;
    private final List<String> keywords;

    SolarEvent(SunTimes.Twilight twilight, Phase phase, String... keywords) {
        this.twilight = twilight;
        this.phase = phase;
        this.keywords = List.of(keywords);
    }

    public static Optional<SolarEvent> fromKeyword(String keyword) {
        String normalized = keyword.trim().toLowerCase(Locale.ENGLISH);
        return Arrays.stream(values())
                     .filter(event -> event.keywords.contains(normalized))
                     .findFirst();
    }

    SunTimes.Twilight getTwilight() {
        return twilight;
    }

    Phase getPhase() {
        return phase;
    }
}
