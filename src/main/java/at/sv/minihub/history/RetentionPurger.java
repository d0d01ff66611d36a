package at.sv.minihub.history;

import at.sv.minihub.storage.EntityHistoryRepository;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.function.Supplier;

/**
 * Deletes history rows older than the retention window.
 */
@Slf4j
public final class RetentionPurger implements Runnable {

    private final EntityHistoryRepository historyRepository;
    private final Duration retention;
    private final Supplier<ZonedDateTime> currentTime;

    public RetentionPurger(EntityHistoryRepository historyRepository, Duration retention,
                           Supplier<ZonedDateTime> currentTime) {
        this.historyRepository = historyRepository;
        this.retention = retention;
        this.currentTime = currentTime;
    }

    @Override
    public void run() {
        MDC.put("context", "purger");
        try {
            ZonedDateTime cutoff = currentTime.get().minus(retention);
            int deleted = historyRepository.purgeBefore(cutoff);
            if (deleted > 0) {
                log.info("Purged {} history rows recorded before {}.", deleted, cutoff);
            } else {
                log.debug("Nothing to purge before {}.", cutoff);
            }
        } finally {
            MDC.remove("context");
        }
    }
}
