package at.sv.minihub.storage.memory;

import at.sv.minihub.model.Device;
import at.sv.minihub.storage.DeviceRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryDeviceRepository implements DeviceRepository {

    private final Map<UUID, Device> devices = new ConcurrentHashMap<>();

    @Override
    public Device save(Device device) {
        devices.put(device.getId(), device.copy());
        return device;
    }

    @Override
    public Optional<Device> findById(UUID id) {
        return Optional.ofNullable(devices.get(id)).map(Device::copy);
    }

    @Override
    public Optional<Device> findByIntegrationAndUniqueId(String integration, String uniqueId) {
        if (uniqueId == null || uniqueId.isEmpty()) {
            return Optional.empty();
        }
        return devices.values().stream()
                      .filter(device -> Objects.equals(device.getIntegration(), integration))
                      .filter(device -> uniqueId.equals(device.getUniqueId()))
                      .findFirst()
                      .map(Device::copy);
    }

    @Override
    public List<Device> findAll() {
        return devices.values().stream()
                      .map(Device::copy)
                      .sorted(Comparator.comparing(Device::getName))
                      .toList();
    }

    @Override
    public List<Device> findByAreaId(UUID areaId) {
        return devices.values().stream()
                      .filter(device -> Objects.equals(device.getAreaId(), areaId))
                      .map(Device::copy)
                      .toList();
    }

    @Override
    public boolean delete(UUID id) {
        return devices.remove(id) != null;
    }
}
