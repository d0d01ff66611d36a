package at.sv.minihub.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventFactoryTest {

    private ZonedDateTime now;
    private EventFactory eventFactory;

    @BeforeEach
    void setUp() {
        now = ZonedDateTime.of(2024, 1, 1, 12, 0, 0, 0, ZoneId.of("UTC"));
        eventFactory = new EventFactory(() -> now);
    }

    @Test
    void create_clockStandsStill_timestampsStillIncrease() {
        Event first = eventFactory.create(EventType.CUSTOM, Map.of());
        Event second = eventFactory.create(EventType.CUSTOM, Map.of());

        assertThat(first.getTimestamp()).isEqualTo(now);
        assertThat(second.getTimestamp()).isAfter(first.getTimestamp());
    }

    @Test
    void create_clockGoesBack_timestampsStillIncrease() {
        Event first = eventFactory.create(EventType.CUSTOM, Map.of());
        now = now.minusMinutes(1);

        Event second = eventFactory.create(EventType.CUSTOM, Map.of());

        assertThat(second.getTimestamp()).isAfter(first.getTimestamp());
    }

    @Test
    void create_assignsUniqueIds() {
        Event first = eventFactory.create(EventType.CUSTOM, "light.kitchen", Map.of());
        Event second = eventFactory.create(EventType.CUSTOM, "light.kitchen", Map.of());

        assertThat(first.getId()).isNotEqualTo(second.getId());
        assertThat(first.getEntityId()).isEqualTo("light.kitchen");
    }

    @Test
    void create_dataIsImmutable() {
        Event event = eventFactory.create(EventType.CUSTOM, Map.of("key", "value"));

        assertThatThrownBy(() -> event.getData().put("other", "value"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
