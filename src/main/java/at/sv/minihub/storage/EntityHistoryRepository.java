package at.sv.minihub.storage;

import at.sv.minihub.model.EntityHistory;

import java.time.ZonedDateTime;
import java.util.List;

public interface EntityHistoryRepository {

    void append(EntityHistory history);

    /**
     * @return all rows of the given entity recorded within {@code [from, to)}, oldest first
     */
    List<EntityHistory> findByEntityId(String entityId, ZonedDateTime from, ZonedDateTime to);

    /**
     * Deletes every row recorded strictly before the given cutoff.
     *
     * @return the number of deleted rows
     */
    int purgeBefore(ZonedDateTime cutoff);
}
