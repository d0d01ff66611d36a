package at.sv.minihub.integration;

import at.sv.minihub.model.DiscoveredDevice;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Port implemented by a protocol adapter (e.g. a BLE or mDNS stack) that finds devices in range and talks to them.
 * All byte level parsing stays behind this interface.
 */
public interface DeviceScanner {

    /**
     * Acquires the underlying adapter, e.g. the Bluetooth controller.
     */
    void open() throws Exception;

    /**
     * Listens for advertisements for the given duration.
     *
     * @return every device seen, with the values included in its advertisement
     */
    List<DiscoveredDevice> scan(Duration duration) throws Exception;

    /**
     * Connects to the device and reads its current values. May block; the caller aborts it after its connection
     * timeout by interrupting the thread and calling {@link #disconnect}.
     *
     * @return the refreshed device, or empty if the device has nothing to read
     */
    Optional<DiscoveredDevice> refresh(DiscoveredDevice device) throws Exception;

    /**
     * Drops any connection to the device. Must not fail if not connected.
     */
    void disconnect(DiscoveredDevice device);

    default Set<String> getSupportedServices() {
        return Set.of();
    }

    /**
     * Executes one of the {@link #getSupportedServices() supported services}.
     *
     * @return the device with its new values, or empty if nothing changed
     */
    default Optional<DiscoveredDevice> execute(String entityId, String service, Map<String, Object> data) throws Exception {
        return Optional.empty();
    }

    /**
     * Releases the adapter and all open connections.
     */
    void close() throws Exception;
}
