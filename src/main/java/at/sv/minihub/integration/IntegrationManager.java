package at.sv.minihub.integration;

import at.sv.minihub.TaskScheduler;
import at.sv.minihub.bus.EventPublisher;
import at.sv.minihub.error.IntegrationFailure;
import at.sv.minihub.error.MiniHubException;
import at.sv.minihub.service.EntityStateAuthority;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Drives the lifecycle of all integrations: setup at startup, supervised background tasks, time-bounded service
 * calls, and teardown at shutdown. A failing integration never affects the others.
 */
@Slf4j
public final class IntegrationManager {

    private final Map<String, Integration> integrations;
    private final Map<String, CancellationToken> cancellationTokens;
    private final Set<String> running;
    private final EntityStateAuthority authority;
    private final EventPublisher publisher;
    private final TaskScheduler scheduler;
    private final ExecutorService serviceCallExecutor;
    private final Supplier<ZonedDateTime> currentTime;
    private final IntegrationSettings settings;
    private boolean started;
    private boolean shutDown;

    public IntegrationManager(List<Integration> integrations, EntityStateAuthority authority, EventPublisher publisher,
                              TaskScheduler scheduler, ExecutorService serviceCallExecutor,
                              Supplier<ZonedDateTime> currentTime, IntegrationSettings settings) {
        this.integrations = new LinkedHashMap<>();
        for (Integration integration : integrations) {
            if (this.integrations.put(integration.getName(), integration) != null) {
                throw new IllegalArgumentException("Duplicate integration name '" + integration.getName() + "'");
            }
        }
        this.cancellationTokens = new ConcurrentHashMap<>();
        this.running = ConcurrentHashMap.newKeySet();
        this.authority = authority;
        this.publisher = publisher;
        this.scheduler = scheduler;
        this.serviceCallExecutor = serviceCallExecutor;
        this.currentTime = currentTime;
        this.settings = settings;
    }

    /**
     * Sets up every integration and schedules its background task. An integration whose setup fails is skipped.
     */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Integrations already started");
        }
        started = true;
        integrations.values().forEach(this::start);
    }

    private void start(Integration integration) {
        String name = integration.getName();
        MDC.put("context", contextName(name));
        cancellationTokens.put(name, new CancellationToken());
        try {
            integration.setup(new ServiceIntegrationContext(name, authority, publisher));
            running.add(name);
            log.info("Set up integration '{}'.", name);
        } catch (Exception e) {
            log.error("Failed to set up integration '{}': {}", name, e.getLocalizedMessage(), e);
            return;
        } finally {
            MDC.remove("context");
        }
        integration.getBackgroundTask().ifPresent(task -> scheduleRun(integration, task, currentTime.get(), 0));
    }

    private void scheduleRun(Integration integration, IntegrationTask task, ZonedDateTime start, int failures) {
        scheduler.schedule(() -> runTask(integration, task, failures), start);
    }

    private void runTask(Integration integration, IntegrationTask task, int previousFailures) {
        CancellationToken token = cancellationTokens.get(integration.getName());
        if (token.isCancelled()) {
            return;
        }
        MDC.put("context", contextName(integration.getName()));
        int failures = 0;
        Duration delay = task.interval();
        try {
            task.body().runOnce(token);
        } catch (Exception e) {
            if (token.isCancelled()) {
                log.debug("Task '{}' aborted on shutdown.", task.name());
                return;
            }
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            failures = previousFailures + 1;
            delay = getDelayAfterFailure(task, failures);
            log.error("Task '{}' failed: {}. Retrying in {}s.", task.name(), e.getLocalizedMessage(), delay.toSeconds(), e);
        } finally {
            MDC.remove("context");
        }
        if (!token.isCancelled()) {
            scheduleRun(integration, task, currentTime.get().plus(delay), failures);
        }
    }

    private Duration getDelayAfterFailure(IntegrationTask task, int failures) {
        if (task.retryPolicy() == IntegrationTask.RetryPolicy.FIXED_INTERVAL) {
            return task.interval();
        }
        Duration delay = settings.retryDelay();
        for (int i = 1; i < failures && delay.compareTo(settings.maxBackoff()) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(settings.maxBackoff()) > 0 ? settings.maxBackoff() : delay;
    }

    /**
     * Forwards the service call to the given integration, waiting at most the configured service call timeout.
     *
     * @throws IntegrationFailure if the integration is not running, failed, or did not answer in time
     */
    public void handleServiceCall(String integrationName, String entityId, String service, Map<String, Object> data) {
        Integration integration = integrations.get(integrationName);
        if (integration == null || !running.contains(integrationName)) {
            throw new IntegrationFailure("Integration '" + integrationName + "' is not available");
        }
        Future<?> call = serviceCallExecutor.submit(() -> {
            MDC.put("context", contextName(integrationName));
            try {
                integration.handleServiceCall(entityId, service, data);
            } finally {
                MDC.remove("context");
            }
            return null;
        });
        try {
            call.get(settings.serviceCallTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new IntegrationFailure("Integration '" + integrationName + "' did not handle " + service + " " +
                                         entityId + " within " + settings.serviceCallTimeout().toSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof MiniHubException miniHubException) {
                throw miniHubException;
            }
            throw new IntegrationFailure("Integration '" + integrationName + "' failed to handle " + service + " " +
                                         entityId + ": " + cause.getLocalizedMessage(), cause);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new IntegrationFailure("Interrupted while waiting for integration '" + integrationName + "'", e);
        }
    }

    public boolean isRunning(String integrationName) {
        return running.contains(integrationName);
    }

    /**
     * Cancels all background tasks and tears down every integration exactly once, including integrations whose
     * setup or task failed.
     */
    public synchronized void shutdown() {
        if (shutDown) {
            return;
        }
        shutDown = true;
        cancellationTokens.values().forEach(CancellationToken::cancel);
        for (Integration integration : integrations.values()) {
            if (!cancellationTokens.containsKey(integration.getName())) {
                continue; // never started
            }
            MDC.put("context", contextName(integration.getName()));
            running.remove(integration.getName());
            try {
                integration.teardown();
                log.info("Tore down integration '{}'.", integration.getName());
            } catch (Exception e) {
                log.error("Failed to tear down integration '{}': {}", integration.getName(), e.getLocalizedMessage(), e);
            } finally {
                MDC.remove("context");
            }
        }
    }

    private static String contextName(String integrationName) {
        return "integration " + integrationName;
    }
}
