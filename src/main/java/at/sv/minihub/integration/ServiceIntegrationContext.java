package at.sv.minihub.integration;

import at.sv.minihub.bus.EventPublisher;
import at.sv.minihub.model.Device;
import at.sv.minihub.model.DiscoveredDevice;
import at.sv.minihub.model.Event;
import at.sv.minihub.service.EntityStateAuthority;
import at.sv.minihub.service.UpsertResult;
import lombok.extern.slf4j.Slf4j;

@Slf4j
final class ServiceIntegrationContext implements IntegrationContext {

    private final String integrationName;
    private final EntityStateAuthority authority;
    private final EventPublisher publisher;

    ServiceIntegrationContext(String integrationName, EntityStateAuthority authority, EventPublisher publisher) {
        this.integrationName = integrationName;
        this.authority = authority;
        this.publisher = publisher;
    }

    @Override
    public UpsertResult upsertDiscovered(DiscoveredDevice discovered) {
        Device device = discovered.device().toBuilder().integration(integrationName).build();
        if (!discovered.serviceData().isEmpty()) {
            log.trace("Service data of '{}': {}", device.getName(), discovered.serviceData());
        }
        return authority.createOrUpsert(device, discovered.entities());
    }

    @Override
    public void publish(Event event) {
        try {
            publisher.publish(event);
        } catch (Exception e) {
            log.warn("Failed to publish {}: {}", event, e.getLocalizedMessage());
        }
    }
}
