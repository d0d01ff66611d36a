package at.sv.minihub.integration;

import at.sv.minihub.error.IntegrationFailure;
import at.sv.minihub.error.MiniHubException;
import at.sv.minihub.error.ValidationException;
import at.sv.minihub.model.DiscoveredDevice;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Periodically scans for devices through a {@link DeviceScanner}, upserts everything found, and then refreshes each
 * device one by one. A device not answering within the connection timeout is disconnected and skipped, so a single
 * stalled device cannot stall the scan cycle.
 */
@Slf4j
public final class ScanningIntegration implements Integration {

    private final String name;
    private final DeviceScanner scanner;
    private final ScanSettings settings;
    private final ExecutorService connectionExecutor;
    private IntegrationContext context;

    public ScanningIntegration(String name, DeviceScanner scanner, ScanSettings settings) {
        this.name = name;
        this.scanner = scanner;
        this.settings = settings;
        this.connectionExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, name + "-connection");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void setup(IntegrationContext context) throws Exception {
        this.context = context;
        scanner.open();
    }

    @Override
    public Optional<IntegrationTask> getBackgroundTask() {
        return Optional.of(new IntegrationTask("scan", settings.scanInterval(),
                IntegrationTask.RetryPolicy.EXPONENTIAL_BACKOFF, this::scanOnce));
    }

    private void scanOnce(CancellationToken token) throws Exception {
        List<DiscoveredDevice> found = scan(token);
        log.debug("Found {} devices.", found.size());
        for (DiscoveredDevice device : found) {
            token.throwIfCancelled();
            upsert(device);
        }
        for (DiscoveredDevice device : found) {
            token.throwIfCancelled();
            refresh(device, token);
        }
    }

    /**
     * Scans on a connection thread. The scanner gets its scan duration plus one connection timeout to answer, and is
     * interrupted on timeout or cancellation.
     */
    private List<DiscoveredDevice> scan(CancellationToken token) throws Exception {
        Future<List<DiscoveredDevice>> scan = connectionExecutor.submit(() -> scanner.scan(settings.scanDuration()));
        Duration timeout = settings.scanDuration().plus(settings.connectionTimeout());
        try (CancellationToken.Registration ignored = token.onCancel(() -> scan.cancel(true))) {
            return scan.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            scan.cancel(true);
            throw new IntegrationFailure("Scan did not finish within " + timeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    private void upsert(DiscoveredDevice device) {
        try {
            context.upsertDiscovered(device);
        } catch (ValidationException e) {
            log.warn("Ignoring invalid device '{}': {}", device.device().getName(), e.getMessage());
        }
    }

    private void refresh(DiscoveredDevice device, CancellationToken token) throws InterruptedException {
        String deviceName = device.device().getName();
        Future<Optional<DiscoveredDevice>> connection = connectionExecutor.submit(() -> scanner.refresh(device));
        try (CancellationToken.Registration ignored = token.onCancel(() -> abort(connection, device))) {
            connection.get(settings.connectionTimeout().toMillis(), TimeUnit.MILLISECONDS)
                      .ifPresent(this::upsert);
        } catch (TimeoutException e) {
            log.warn("'{}' did not respond within {}s, disconnecting.", deviceName, settings.connectionTimeout().toSeconds());
            abort(connection, device);
        } catch (CancellationException e) {
            log.debug("Refresh of '{}' aborted.", deviceName);
        } catch (ExecutionException e) {
            log.warn("Failed to refresh '{}': {}", deviceName, e.getCause().getLocalizedMessage());
            disconnect(device);
        }
    }

    private void abort(Future<?> connection, DiscoveredDevice device) {
        connection.cancel(true);
        disconnect(device);
    }

    private void disconnect(DiscoveredDevice device) {
        try {
            scanner.disconnect(device);
        } catch (Exception e) {
            log.warn("Failed to disconnect '{}': {}", device.device().getName(), e.getLocalizedMessage());
        }
    }

    @Override
    public void handleServiceCall(String entityId, String service, Map<String, Object> data) throws Exception {
        if (!scanner.getSupportedServices().contains(service)) {
            throw new ValidationException("Unknown service '" + service + "' for " + entityId);
        }
        try {
            scanner.execute(entityId, service, data).ifPresent(this::upsert);
        } catch (MiniHubException e) {
            throw e;
        } catch (Exception e) {
            throw new IntegrationFailure("Failed to execute " + service + " on " + entityId, e);
        }
    }

    @Override
    public void teardown() throws Exception {
        connectionExecutor.shutdownNow();
        scanner.close();
    }
}
