package at.sv.minihub.storage.memory;

import at.sv.minihub.model.Entity;
import at.sv.minihub.storage.EntityRepository;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps entities in memory. Stored and returned entities are copies, so callers can never mutate stored state.
 */
public final class InMemoryEntityRepository implements EntityRepository {

    private final Map<UUID, Entity> entities = new ConcurrentHashMap<>();

    @Override
    public Entity save(Entity entity) {
        entities.put(entity.getId(), entity.copy());
        return entity;
    }

    @Override
    public Optional<Entity> findById(UUID id) {
        return Optional.ofNullable(entities.get(id)).map(Entity::copy);
    }

    @Override
    public Optional<Entity> findByEntityId(String entityId) {
        return entities.values().stream()
                       .filter(entity -> entity.getEntityId().equals(entityId))
                       .findFirst()
                       .map(Entity::copy);
    }

    @Override
    public List<Entity> findAll() {
        return entities.values().stream()
                       .map(Entity::copy)
                       .sorted(Comparator.comparing(Entity::getEntityId))
                       .toList();
    }

    @Override
    public List<Entity> findByDeviceId(UUID deviceId) {
        return findByDeviceIds(Set.of(deviceId));
    }

    @Override
    public List<Entity> findByDeviceIds(Collection<UUID> deviceIds) {
        Set<UUID> ids = new HashSet<>(deviceIds);
        return entities.values().stream()
                       .filter(entity -> ids.contains(entity.getDeviceId()))
                       .map(Entity::copy)
                       .sorted(Comparator.comparing(Entity::getEntityId))
                       .toList();
    }

    @Override
    public boolean delete(UUID id) {
        return entities.remove(id) != null;
    }
}
