package at.sv.minihub.model;

import java.util.List;
import java.util.Map;

/**
 * What an integration reports about a physical or virtual device it found. Translated into device and entity
 * upserts, never persisted as is. An entity with a null state keeps its current state.
 *
 * @param serviceData optional raw protocol data, only for logging. Not null.
 */
public record DiscoveredDevice(Device device, List<Entity> entities, Map<String, Object> serviceData) {

    public DiscoveredDevice {
        if (serviceData == null) {
            serviceData = Map.of();
        }
    }

    public DiscoveredDevice(Device device, List<Entity> entities) {
        this(device, entities, Map.of());
    }
}
