package at.sv.minihub.storage;

import at.sv.minihub.model.Entity;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface EntityRepository {

    /**
     * Inserts or replaces the entity with the same {@link Entity#getId() id}.
     *
     * @throws at.sv.minihub.error.StorageFailure if the entity could not be persisted
     */
    Entity save(Entity entity);

    Optional<Entity> findById(UUID id);

    Optional<Entity> findByEntityId(String entityId);

    List<Entity> findAll();

    List<Entity> findByDeviceId(UUID deviceId);

    /**
     * Loads the entities of all given devices at once.
     */
    List<Entity> findByDeviceIds(Collection<UUID> deviceIds);

    /**
     * @return true, if an entity was deleted
     */
    boolean delete(UUID id);
}
