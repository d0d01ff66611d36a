package at.sv.minihub.storage.memory;

import at.sv.minihub.model.EntityHistory;
import at.sv.minihub.storage.EntityHistoryRepository;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class InMemoryEntityHistoryRepository implements EntityHistoryRepository {

    private final List<EntityHistory> rows = new ArrayList<>();

    @Override
    public synchronized void append(EntityHistory history) {
        rows.add(history);
    }

    @Override
    public synchronized List<EntityHistory> findByEntityId(String entityId, ZonedDateTime from, ZonedDateTime to) {
        return rows.stream()
                   .filter(row -> row.getEntityId().equals(entityId))
                   .filter(row -> !row.getRecordedAt().isBefore(from) && row.getRecordedAt().isBefore(to))
                   .sorted(Comparator.comparing(EntityHistory::getRecordedAt))
                   .toList();
    }

    @Override
    public synchronized int purgeBefore(ZonedDateTime cutoff) {
        int sizeBefore = rows.size();
        rows.removeIf(row -> row.getRecordedAt().isBefore(cutoff));
        return sizeBefore - rows.size();
    }
}
