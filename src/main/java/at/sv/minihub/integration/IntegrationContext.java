package at.sv.minihub.integration;

import at.sv.minihub.model.DiscoveredDevice;
import at.sv.minihub.model.Event;
import at.sv.minihub.service.UpsertResult;

/**
 * The only way for an integration to feed the hub.
 */
public interface IntegrationContext {

    /**
     * Creates or updates the discovered device and its entities. The device is always attributed to the calling
     * integration.
     *
     * @throws at.sv.minihub.error.ValidationException if the device or entities are invalid
     */
    UpsertResult upsertDiscovered(DiscoveredDevice discovered);

    void publish(Event event);
}
