package at.sv.minihub.service;

import at.sv.minihub.error.NotFoundException;
import at.sv.minihub.error.ValidationException;
import at.sv.minihub.model.Device;
import at.sv.minihub.model.Entity;
import at.sv.minihub.storage.AreaRepository;
import at.sv.minihub.storage.DeviceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.UUID;

/**
 * Administrative device operations. Integrations create their devices through
 * {@link EntityStateAuthority#createOrUpsert} instead.
 */
@Slf4j
@RequiredArgsConstructor
public final class DeviceService {

    private final DeviceRepository deviceRepository;
    private final AreaRepository areaRepository;
    private final EntityStateAuthority authority;

    /**
     * Creates a device without owning integration.
     */
    public Device create(Device device) {
        Device created = device.toBuilder()
                               .id(device.getId() != null ? device.getId() : UUID.randomUUID())
                               .build();
        created.validate();
        if (device.getId() != null && deviceRepository.findById(device.getId()).isPresent()) {
            throw new ValidationException("Device " + device.getId() + " already exists");
        }
        assertAreaExists(created.getAreaId());
        return deviceRepository.save(created);
    }

    public Device get(UUID id) {
        return deviceRepository.findById(id).orElseThrow(() -> new NotFoundException("Device", id));
    }

    public List<Device> list() {
        return deviceRepository.findAll();
    }

    /**
     * Updates name, manufacturer, model and area. The owning integration and unique id cannot be changed.
     */
    public Device update(Device device) {
        Device existing = get(device.getId());
        Device updated = existing.toBuilder()
                                 .name(device.getName())
                                 .manufacturer(device.getManufacturer())
                                 .model(device.getModel())
                                 .areaId(device.getAreaId())
                                 .build();
        updated.validate();
        assertAreaExists(updated.getAreaId());
        return deviceRepository.save(updated);
    }

    /**
     * @param areaId the new area, or null to unassign the device
     */
    public Device assignArea(UUID deviceId, UUID areaId) {
        Device device = get(deviceId);
        assertAreaExists(areaId);
        return deviceRepository.save(device.toBuilder().areaId(areaId).build());
    }

    /**
     * Deletes the device together with all of its entities.
     */
    public void delete(UUID id) {
        Device device = get(id);
        for (Entity entity : authority.listByDevice(device.getId())) {
            authority.delete(entity.getEntityId());
        }
        if (!deviceRepository.delete(id)) {
            throw new NotFoundException("Device", id);
        }
        log.info("Deleted device '{}'.", device.getName());
    }

    private void assertAreaExists(UUID areaId) {
        if (areaId != null && areaRepository.findById(areaId).isEmpty()) {
            throw new NotFoundException("Area", areaId);
        }
    }
}
