package at.sv.minihub;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

@Slf4j
public final class TaskSchedulerImpl implements TaskScheduler {

    private final ScheduledExecutorService scheduler;
    private final Supplier<ZonedDateTime> currentTime;
    private final ExecutorService executor;

    public TaskSchedulerImpl(ScheduledExecutorService scheduler, ExecutorService executor,
                             Supplier<ZonedDateTime> currentTime) {
        this.scheduler = scheduler;
        this.currentTime = currentTime;
        this.executor = executor;
    }

    @Override
    public void schedule(Runnable runnable, ZonedDateTime start) {
        long delay = Math.max(0, Duration.between(currentTime.get(), start).toMillis());
        try {
            scheduler.schedule(() -> submit(runnable), delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Dropped task scheduled for {}, scheduler is shut down.", start);
        }
    }

    @Override
    public void scheduleAtFixedRate(Runnable runnable, long initialDelay, long period, TimeUnit unit) {
        scheduler.scheduleAtFixedRate(() -> submit(runnable), initialDelay, period, unit);
    }

    private void submit(Runnable runnable) {
        try {
            executor.submit(logUncaughtException(runnable));
        } catch (RejectedExecutionException e) {
            log.debug("Dropped task, worker pool is shut down.");
        }
    }

    private Runnable logUncaughtException(Runnable runnable) {
        return () -> {
            try {
                runnable.run();
            } catch (Exception e) {
                log.error("Uncaught exception: {}", e.getLocalizedMessage(), e);
            }
        };
    }

    /**
     * Stops the timer thread and waits for running tasks to finish.
     */
    public void shutdown(Duration timeout) {
        scheduler.shutdownNow();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Tasks still running after {}s, interrupting.", timeout.toSeconds());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
