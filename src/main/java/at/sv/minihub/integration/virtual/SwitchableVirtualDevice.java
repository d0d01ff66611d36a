package at.sv.minihub.integration.virtual;

import at.sv.minihub.model.Device;
import at.sv.minihub.model.DiscoveredDevice;
import at.sv.minihub.model.Entity;
import at.sv.minihub.model.EntityState;
import at.sv.minihub.service.LocalServices;

import java.util.List;

/**
 * Simulated on/off device, starting in state off.
 */
abstract class SwitchableVirtualDevice implements VirtualDevice {

    private final String uniqueId;
    private final String name;
    private final String model;
    private final String entityId;
    private EntityState state = EntityState.OFF;

    SwitchableVirtualDevice(String uniqueId, String name, String model, String entityId) {
        this.uniqueId = uniqueId;
        this.name = name;
        this.model = model;
        this.entityId = entityId;
    }

    @Override
    public String getEntityId() {
        return entityId;
    }

    public synchronized EntityState getState() {
        return state;
    }

    @Override
    public synchronized DiscoveredDevice discover() {
        Device device = Device.builder()
                              .name(name)
                              .manufacturer(VirtualConstants.MANUFACTURER)
                              .model(model)
                              .uniqueId(uniqueId)
                              .build();
        Entity entity = Entity.builder()
                              .entityId(entityId)
                              .friendlyName(name)
                              .state(state)
                              .build();
        return new DiscoveredDevice(device, List.of(entity));
    }

    @Override
    public synchronized boolean handleService(String service) {
        EntityState newState = LocalServices.apply(service, state);
        boolean changed = newState != state;
        state = newState;
        return changed;
    }
}
