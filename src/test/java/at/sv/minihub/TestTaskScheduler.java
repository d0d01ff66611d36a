package at.sv.minihub;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Records scheduled tasks instead of running them, so tests decide when they run.
 */
public final class TestTaskScheduler implements TaskScheduler {

    private final List<ScheduledRunnable> scheduledRunnables;
    private final List<Runnable> fixedRateRunnables;

    public TestTaskScheduler() {
        scheduledRunnables = new ArrayList<>();
        fixedRateRunnables = new ArrayList<>();
    }

    @Override
    public synchronized void schedule(Runnable runnable, ZonedDateTime start) {
        scheduledRunnables.add(new ScheduledRunnable(start, runnable));
    }

    @Override
    public synchronized void scheduleAtFixedRate(Runnable runnable, long initialDelay, long period, TimeUnit unit) {
        fixedRateRunnables.add(runnable);
    }

    public synchronized List<ScheduledRunnable> getScheduledRunnables() {
        List<ScheduledRunnable> runnables = new ArrayList<>(scheduledRunnables);
        runnables.sort(Comparator.comparing(ScheduledRunnable::getStart));
        return runnables;
    }

    public synchronized List<Runnable> getFixedRateRunnables() {
        return new ArrayList<>(fixedRateRunnables);
    }

    /**
     * Removes and returns the earliest scheduled runnable.
     */
    public synchronized ScheduledRunnable takeNext() {
        ScheduledRunnable next = getScheduledRunnables().get(0);
        scheduledRunnables.remove(next);
        return next;
    }

    public synchronized void clear() {
        scheduledRunnables.clear();
    }
}
