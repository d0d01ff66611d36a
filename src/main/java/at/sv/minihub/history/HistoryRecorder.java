package at.sv.minihub.history;

import at.sv.minihub.bus.BusConsumer;
import at.sv.minihub.bus.EventBus;
import at.sv.minihub.model.Entity;
import at.sv.minihub.model.EntityHistory;
import at.sv.minihub.model.Event;
import at.sv.minihub.storage.EntityHistoryRepository;
import at.sv.minihub.storage.EntityRepository;
import at.sv.minihub.storage.EventStore;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Appends every bus event to the event log and records a snapshot of the entity's current state and attributes
 * for each state or attribute change. Missed events are not backfilled.
 */
@Slf4j
public final class HistoryRecorder extends BusConsumer {

    private final EntityRepository entityRepository;
    private final EntityHistoryRepository historyRepository;
    private final EventStore eventStore;

    public HistoryRecorder(EventBus bus, EntityRepository entityRepository, EntityHistoryRepository historyRepository,
                           EventStore eventStore) {
        super("recorder", bus);
        this.entityRepository = entityRepository;
        this.historyRepository = historyRepository;
        this.eventStore = eventStore;
    }

    @Override
    protected void onEvent(Event event) {
        eventStore.append(event);
        if (event.getType().affectsEntityState()) {
            recordSnapshot(event);
        }
    }

    private void recordSnapshot(Event event) {
        Optional<Entity> entity = entityRepository.findByEntityId(event.getEntityId());
        if (entity.isEmpty()) {
            log.debug("{} no longer exists, skipping snapshot.", event.getEntityId());
            return;
        }
        historyRepository.append(EntityHistory.builder()
                                              .id(UUID.randomUUID())
                                              .entityId(event.getEntityId())
                                              .state(entity.get().getState())
                                              .attributes(Map.copyOf(entity.get().getAttributes()))
                                              .recordedAt(event.getTimestamp())
                                              .build());
    }

    @Override
    protected void onLag(long missed) {
        log.warn("Lagging behind, {} events were not recorded.", missed);
    }
}
