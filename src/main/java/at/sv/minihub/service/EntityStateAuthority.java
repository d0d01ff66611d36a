package at.sv.minihub.service;

import at.sv.minihub.bus.EventPublisher;
import at.sv.minihub.error.NotFoundException;
import at.sv.minihub.error.ValidationException;
import at.sv.minihub.model.AttributeValue;
import at.sv.minihub.model.Device;
import at.sv.minihub.model.Entity;
import at.sv.minihub.model.EntityState;
import at.sv.minihub.model.Event;
import at.sv.minihub.model.EventData;
import at.sv.minihub.model.EventFactory;
import at.sv.minihub.model.EventType;
import at.sv.minihub.storage.DeviceRepository;
import at.sv.minihub.storage.EntityRepository;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * The only writer of entity state and attributes. Every write is validated, persisted, and then announced on the
 * event bus with at most one event per changed entity. Writes to the same entity id are serialized, writes to
 * different entities run concurrently.
 */
@Slf4j
public final class EntityStateAuthority {

    private final EntityRepository entityRepository;
    private final DeviceRepository deviceRepository;
    private final EventPublisher publisher;
    private final EventFactory eventFactory;
    private final Supplier<ZonedDateTime> currentTime;
    private final LoadingCache<String, Object> writeMonitors;

    public EntityStateAuthority(EntityRepository entityRepository, DeviceRepository deviceRepository,
                                EventPublisher publisher, EventFactory eventFactory,
                                Supplier<ZonedDateTime> currentTime) {
        this.entityRepository = entityRepository;
        this.deviceRepository = deviceRepository;
        this.publisher = publisher;
        this.eventFactory = eventFactory;
        this.currentTime = currentTime;
        this.writeMonitors = Caffeine.newBuilder()
                                     .weakValues()
                                     .build(key -> new Object());
    }

    /**
     * Inserts or merges the given device and its entities. The device is matched by its integration and unique id, or
     * by id if it has no unique id. Existing entities keep their state unless a state is supplied.
     *
     * @throws ValidationException if the device or any entity is invalid, or an entity id belongs to another device.
     *                             Nothing is written in that case.
     */
    public UpsertResult createOrUpsert(Device device, List<Entity> entities) {
        device.validate();
        validateEntities(entities);
        Device savedDevice;
        synchronized (monitorFor(deviceKey(device))) {
            savedDevice = upsertDevice(device);
        }
        assertEntitiesNotOwnedByOtherDevices(savedDevice, entities);
        List<Entity> savedEntities = new ArrayList<>();
        for (Entity entity : entities) {
            synchronized (monitorFor(entity.getEntityId())) {
                savedEntities.add(upsertEntity(savedDevice, entity));
            }
        }
        return new UpsertResult(savedDevice, savedEntities);
    }

    private void validateEntities(List<Entity> entities) {
        Set<String> entityIds = new HashSet<>();
        for (Entity entity : entities) {
            entity.validate();
            if (!entityIds.add(entity.getEntityId())) {
                throw new ValidationException("Duplicate entity_id '" + entity.getEntityId() + "'");
            }
        }
    }

    private void assertEntitiesNotOwnedByOtherDevices(Device device, List<Entity> entities) {
        for (Entity entity : entities) {
            entityRepository.findByEntityId(entity.getEntityId())
                            .filter(existing -> !existing.getDeviceId().equals(device.getId()))
                            .ifPresent(existing -> {
                                throw new ValidationException("entity_id '" + entity.getEntityId() +
                                                              "' is already owned by device " + existing.getDeviceId());
                            });
        }
    }

    private String deviceKey(Device device) {
        if (device.hasUniqueId()) {
            return "device:" + device.getIntegration() + ":" + device.getUniqueId();
        }
        return "device:" + device.getId();
    }

    private Device upsertDevice(Device device) {
        Device existing = findExistingDevice(device);
        if (existing == null) {
            Device created = device.toBuilder()
                                   .id(device.getId() != null ? device.getId() : UUID.randomUUID())
                                   .build();
            deviceRepository.save(created);
            log.info("New device '{}' ({}).", created.getName(), describeOwner(created));
            publish(deviceDetected(created, true));
            return created;
        }
        String manufacturer = device.getManufacturer() != null ? device.getManufacturer() : existing.getManufacturer();
        String model = device.getModel() != null ? device.getModel() : existing.getModel();
        Device merged = existing.toBuilder()
                                .name(device.getName())
                                .manufacturer(manufacturer)
                                .model(model)
                                .build();
        if (!merged.equals(existing)) {
            deviceRepository.save(merged);
            log.debug("Updated device '{}' ({}).", merged.getName(), describeOwner(merged));
            publish(deviceDetected(merged, false));
        }
        return merged;
    }

    private Device findExistingDevice(Device device) {
        if (device.hasUniqueId()) {
            return deviceRepository.findByIntegrationAndUniqueId(device.getIntegration(), device.getUniqueId())
                                   .orElse(null);
        }
        if (device.getId() == null) {
            return null;
        }
        return deviceRepository.findById(device.getId()).orElse(null);
    }

    private static String describeOwner(Device device) {
        if (!device.isOwnedByIntegration()) {
            return "manual";
        }
        return device.getIntegration() + (device.hasUniqueId() ? " " + device.getUniqueId() : "");
    }

    private Event deviceDetected(Device device, boolean isNew) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(EventData.DEVICE_ID, device.getId());
        data.put(EventData.DEVICE_NAME, device.getName());
        data.put(EventData.INTEGRATION, device.getIntegration());
        data.put(EventData.UNIQUE_ID, device.getUniqueId());
        data.put(EventData.NEW_DEVICE, isNew);
        return eventFactory.create(EventType.DEVICE_DETECTED, data);
    }

    private Entity upsertEntity(Device device, Entity entity) {
        ZonedDateTime now = currentTime.get();
        Entity existing = entityRepository.findByEntityId(entity.getEntityId()).orElse(null);
        if (existing == null) {
            return insert(entity.toBuilder()
                                .id(UUID.randomUUID())
                                .deviceId(device.getId())
                                .state(Objects.requireNonNullElse(entity.getState(), EntityState.UNKNOWN))
                                .attributes(copyOf(entity.getAttributes()))
                                .lastChanged(now)
                                .lastUpdated(now)
                                .build());
        }
        Entity updated = existing.copy();
        updated.setFriendlyName(entity.getFriendlyName());
        EntityState oldState = updated.getState();
        boolean stateChanged = entity.getState() != null && updated.updateState(entity.getState(), now);
        Map<String, AttributeValue> changedAttributes = updated.mergeAttributes(copyOf(entity.getAttributes()), now);
        entityRepository.save(updated);
        if (stateChanged) {
            publish(stateChanged(updated, oldState));
        } else if (!changedAttributes.isEmpty()) {
            publish(attributeChanged(updated, changedAttributes));
        }
        return updated;
    }

    private static Map<String, AttributeValue> copyOf(Map<String, AttributeValue> attributes) {
        return attributes == null ? new HashMap<>() : new HashMap<>(attributes);
    }

    /**
     * Administrative creation of a single entity for an existing device.
     *
     * @throws ValidationException if the entity is invalid or its entity id is already taken
     * @throws NotFoundException   if the device does not exist
     */
    public Entity createEntity(Entity entity) {
        entity.validate();
        if (entity.getDeviceId() == null || deviceRepository.findById(entity.getDeviceId()).isEmpty()) {
            throw new NotFoundException("Device", entity.getDeviceId());
        }
        synchronized (monitorFor(entity.getEntityId())) {
            if (entityRepository.findByEntityId(entity.getEntityId()).isPresent()) {
                throw new ValidationException("entity_id '" + entity.getEntityId() + "' already exists");
            }
            ZonedDateTime now = currentTime.get();
            return insert(entity.toBuilder()
                                .id(entity.getId() != null ? entity.getId() : UUID.randomUUID())
                                .state(Objects.requireNonNullElse(entity.getState(), EntityState.UNKNOWN))
                                .attributes(copyOf(entity.getAttributes()))
                                .lastChanged(now)
                                .lastUpdated(now)
                                .build());
        }
    }

    private Entity insert(Entity entity) {
        entityRepository.save(entity);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(EventData.ENTITY_UUID, entity.getId());
        data.put(EventData.DEVICE_ID, entity.getDeviceId());
        data.put(EventData.FRIENDLY_NAME, entity.getFriendlyName());
        data.put(EventData.STATE, entity.getState());
        publish(eventFactory.create(EventType.ENTITY_ADDED, entity.getEntityId(), data));
        return entity;
    }

    /**
     * Sets the state of the given entity. {@code last_changed} only moves if the state differs, {@code last_updated}
     * always moves. Publishes a state changed event if the value changed.
     *
     * @throws NotFoundException if the entity is unknown
     */
    public Entity updateState(String entityId, EntityState newState) {
        if (newState == null) {
            throw new ValidationException("state cannot be empty");
        }
        synchronized (monitorFor(entityId)) {
            Entity entity = getByEntityId(entityId);
            EntityState oldState = entity.getState();
            boolean changed = entity.updateState(newState, currentTime.get());
            entityRepository.save(entity);
            if (changed) {
                publish(stateChanged(entity, oldState));
            } else {
                log.trace("{} already {}", entityId, newState);
            }
            return entity;
        }
    }

    /**
     * Inserts or overwrites the given attributes. Keys not contained in the patch are kept.
     *
     * @throws NotFoundException if the entity is unknown
     */
    public Entity updateAttributes(String entityId, Map<String, AttributeValue> patch) {
        if (patch == null || patch.values().stream().anyMatch(Objects::isNull)) {
            throw new ValidationException("attribute values cannot be empty");
        }
        synchronized (monitorFor(entityId)) {
            Entity entity = getByEntityId(entityId);
            Map<String, AttributeValue> changed = entity.mergeAttributes(patch, currentTime.get());
            entityRepository.save(entity);
            if (!changed.isEmpty()) {
                publish(attributeChanged(entity, changed));
            }
            return entity;
        }
    }

    private Event stateChanged(Entity entity, EntityState oldState) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(EventData.OLD_STATE, oldState);
        data.put(EventData.NEW_STATE, entity.getState());
        return eventFactory.create(EventType.STATE_CHANGED, entity.getEntityId(), data);
    }

    private Event attributeChanged(Entity entity, Map<String, AttributeValue> changed) {
        return eventFactory.create(EventType.ATTRIBUTE_CHANGED, entity.getEntityId(),
                Map.of(EventData.CHANGED, Map.copyOf(changed)));
    }

    public Entity get(UUID id) {
        return entityRepository.findById(id).orElseThrow(() -> new NotFoundException("Entity", id));
    }

    public Entity getByEntityId(String entityId) {
        return entityRepository.findByEntityId(entityId).orElseThrow(() -> new NotFoundException("Entity", entityId));
    }

    public List<Entity> list() {
        return entityRepository.findAll();
    }

    public List<Entity> listByDevice(UUID deviceId) {
        return entityRepository.findByDeviceId(deviceId);
    }

    /**
     * @throws NotFoundException if the entity is unknown
     */
    public void delete(String entityId) {
        synchronized (monitorFor(entityId)) {
            Entity entity = getByEntityId(entityId);
            if (!entityRepository.delete(entity.getId())) {
                throw new NotFoundException("Entity", entityId);
            }
            publish(eventFactory.create(EventType.ENTITY_REMOVED, entityId,
                    Map.of(EventData.ENTITY_UUID, entity.getId(), EventData.DEVICE_ID, entity.getDeviceId())));
        }
    }

    private Object monitorFor(String key) {
        return writeMonitors.get(key);
    }

    private void publish(Event event) {
        try {
            publisher.publish(event);
        } catch (Exception e) {
            log.warn("Failed to publish {}: {}", event, e.getLocalizedMessage());
        }
    }
}
