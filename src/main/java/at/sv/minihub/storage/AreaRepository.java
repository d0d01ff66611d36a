package at.sv.minihub.storage;

import at.sv.minihub.model.Area;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AreaRepository {

    Area save(Area area);

    Optional<Area> findById(UUID id);

    List<Area> findAll();

    List<Area> findByParentId(UUID parentId);

    boolean delete(UUID id);
}
