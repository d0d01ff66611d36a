package at.sv.minihub.integration;

import java.time.Duration;

/**
 * A recurring background job of an integration, e.g. a scan cycle. Supervised by the {@link IntegrationManager}:
 * a run that throws is logged and the task is rescheduled.
 *
 * @param interval    pause between the end of one run and the start of the next
 * @param retryPolicy what to do after a failed run
 */
public record IntegrationTask(String name, Duration interval, RetryPolicy retryPolicy, Body body) {

    public enum RetryPolicy {
        /**
         * Retry after the normal interval.
         */
        FIXED_INTERVAL,
        /**
         * Retry after an exponentially growing, capped delay. Used for connection-style tasks.
         */
        EXPONENTIAL_BACKOFF
    }

    @FunctionalInterface
    public interface Body {
        void runOnce(CancellationToken cancellationToken) throws Exception;
    }
}
