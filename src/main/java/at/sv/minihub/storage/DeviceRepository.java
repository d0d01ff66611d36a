package at.sv.minihub.storage;

import at.sv.minihub.model.Device;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DeviceRepository {

    Device save(Device device);

    Optional<Device> findById(UUID id);

    /**
     * Looks up a device by its deduplication key. Devices without a unique id are never returned.
     */
    Optional<Device> findByIntegrationAndUniqueId(String integration, String uniqueId);

    List<Device> findAll();

    List<Device> findByAreaId(UUID areaId);

    boolean delete(UUID id);
}
