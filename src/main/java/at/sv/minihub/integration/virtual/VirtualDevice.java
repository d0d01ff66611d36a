package at.sv.minihub.integration.virtual;

import at.sv.minihub.model.DiscoveredDevice;

/**
 * A simulated device with exactly one entity.
 */
public interface VirtualDevice {

    String getEntityId();

    /**
     * @return the device and its entity in their current simulated state
     */
    DiscoveredDevice discover();

    /**
     * Applies one of the local services.
     *
     * @return true, if the simulated state changed
     */
    boolean handleService(String service);
}
