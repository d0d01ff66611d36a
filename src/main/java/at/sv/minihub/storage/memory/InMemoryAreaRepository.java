package at.sv.minihub.storage.memory;

import at.sv.minihub.model.Area;
import at.sv.minihub.storage.AreaRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryAreaRepository implements AreaRepository {

    private final Map<UUID, Area> areas = new ConcurrentHashMap<>();

    @Override
    public Area save(Area area) {
        areas.put(area.getId(), area.copy());
        return area;
    }

    @Override
    public Optional<Area> findById(UUID id) {
        return Optional.ofNullable(areas.get(id)).map(Area::copy);
    }

    @Override
    public List<Area> findAll() {
        return areas.values().stream()
                    .map(Area::copy)
                    .sorted(Comparator.comparing(Area::getName))
                    .toList();
    }

    @Override
    public List<Area> findByParentId(UUID parentId) {
        return areas.values().stream()
                    .filter(area -> Objects.equals(area.getParentId(), parentId))
                    .map(Area::copy)
                    .toList();
    }

    @Override
    public boolean delete(UUID id) {
        return areas.remove(id) != null;
    }
}
