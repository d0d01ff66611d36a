package at.sv.minihub;

import java.time.ZonedDateTime;
import java.util.concurrent.TimeUnit;

/**
 * Timer source for delays, purges, ticks and integration tasks. Scheduled tasks run on a worker pool, never on the
 * timer thread itself.
 */
public interface TaskScheduler {
    void schedule(Runnable runnable, ZonedDateTime start);

    void scheduleAtFixedRate(Runnable runnable, long initialDelay, long period, TimeUnit unit);
}
