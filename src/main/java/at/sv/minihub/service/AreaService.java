package at.sv.minihub.service;

import at.sv.minihub.error.NotFoundException;
import at.sv.minihub.error.ValidationException;
import at.sv.minihub.model.Area;
import at.sv.minihub.model.Device;
import at.sv.minihub.storage.AreaRepository;
import at.sv.minihub.storage.DeviceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Slf4j
@RequiredArgsConstructor
public final class AreaService {

    private final AreaRepository areaRepository;
    private final DeviceRepository deviceRepository;

    public Area create(Area area) {
        Area created = area.toBuilder()
                           .id(area.getId() != null ? area.getId() : UUID.randomUUID())
                           .build();
        validate(created);
        return areaRepository.save(created);
    }

    public Area get(UUID id) {
        return areaRepository.findById(id).orElseThrow(() -> new NotFoundException("Area", id));
    }

    public List<Area> list() {
        return areaRepository.findAll();
    }

    public synchronized Area update(Area area) {
        get(area.getId());
        validate(area);
        return areaRepository.save(area);
    }

    /**
     * Deletes the area. Its child areas become root areas, its devices become unassigned.
     */
    public synchronized void delete(UUID id) {
        get(id);
        areaRepository.findByParentId(id).forEach(child -> areaRepository.save(child.toBuilder().parentId(null).build()));
        for (Device device : deviceRepository.findByAreaId(id)) {
            deviceRepository.save(device.toBuilder().areaId(null).build());
        }
        if (!areaRepository.delete(id)) {
            throw new NotFoundException("Area", id);
        }
        log.info("Deleted area {}.", id);
    }

    private void validate(Area area) {
        area.validate();
        if (area.getParentId() != null) {
            assertNoCycle(area);
        }
    }

    /**
     * Walks up the parent chain of the given area. Reaching the area itself again means it would become its own
     * ancestor.
     */
    private void assertNoCycle(Area area) {
        Set<UUID> visited = new HashSet<>();
        visited.add(area.getId());
        UUID parentId = area.getParentId();
        while (parentId != null) {
            if (!visited.add(parentId)) {
                throw new ValidationException("Area '" + area.getName() + "' would create a cycle in the area tree");
            }
            UUID currentId = parentId;
            Area parent = areaRepository.findById(currentId)
                                        .orElseThrow(() -> new NotFoundException("Area", currentId));
            parentId = parent.getParentId();
        }
    }
}
