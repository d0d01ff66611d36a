package at.sv.minihub.bus;

import at.sv.minihub.model.Event;
import at.sv.minihub.model.EventFactory;
import at.sv.minihub.model.EventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class BusConsumerTest {

    private EventFactory eventFactory;
    private EventBus bus;
    private RecordingConsumer consumer;

    @BeforeEach
    void setUp() {
        eventFactory = new EventFactory(() -> ZonedDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneId.of("UTC")));
        bus = new EventBus(3);
        consumer = new RecordingConsumer(bus);
    }

    private void publish(String entityId) {
        bus.publish(eventFactory.create(EventType.CUSTOM, entityId, Map.of()));
    }

    @Test
    void drain_handlerThrows_continuesWithNextEvent() {
        publish("sensor.fail");
        publish("sensor.ok");

        int handled = consumer.drain();

        assertThat(handled).isEqualTo(2);
        assertThat(consumer.entityIds).containsExactly("sensor.fail", "sensor.ok");
    }

    @Test
    void drain_lagged_reportsMissedEventsAndContinues() {
        for (int i = 0; i < 5; i++) {
            publish("sensor.s" + i);
        }

        consumer.drain();

        assertThat(consumer.missed).containsExactly(2L);
        assertThat(consumer.entityIds).containsExactly("sensor.s2", "sensor.s3", "sensor.s4");
    }

    @Test
    void start_handlesEventsOnWorkerThread_closeStopsWorker() throws Exception {
        consumer.start();

        publish("sensor.async");
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (consumer.entityIds.isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        consumer.close();

        assertThat(consumer.entityIds).containsExactly("sensor.async");
        assertThat(consumer.threadNames).containsExactly("recording");
    }

    private static final class RecordingConsumer extends BusConsumer {

        private final List<String> entityIds = new CopyOnWriteArrayList<>();
        private final List<String> threadNames = new CopyOnWriteArrayList<>();
        private final List<Long> missed = new ArrayList<>();

        RecordingConsumer(EventBus bus) {
            super("recording", bus);
        }

        @Override
        protected void onEvent(Event event) {
            entityIds.add(event.getEntityId());
            threadNames.add(Thread.currentThread().getName());
            if (event.getEntityId().equals("sensor.fail")) {
                throw new IllegalStateException("handler failure");
            }
        }

        @Override
        protected void onLag(long missed) {
            this.missed.add(missed);
        }
    }
}
