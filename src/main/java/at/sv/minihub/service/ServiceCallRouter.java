package at.sv.minihub.service;

import at.sv.minihub.integration.IntegrationManager;
import at.sv.minihub.model.Device;
import at.sv.minihub.model.Entity;
import at.sv.minihub.storage.DeviceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Routes service calls to the integration owning the entity's device. Entities of manually created devices are
 * switched directly through the {@link EntityStateAuthority}.
 */
@Slf4j
@RequiredArgsConstructor
public final class ServiceCallRouter implements ServiceCallHandler {

    private final EntityStateAuthority authority;
    private final DeviceRepository deviceRepository;
    private final IntegrationManager integrationManager;

    @Override
    public void callService(String entityId, String service, Map<String, Object> data) {
        Entity entity = authority.getByEntityId(entityId);
        Device device = deviceRepository.findById(entity.getDeviceId()).orElse(null);
        if (device != null && device.isOwnedByIntegration()) {
            log.debug("Routing {} {} to integration '{}'", service, entityId, device.getIntegration());
            integrationManager.handleServiceCall(device.getIntegration(), entityId, service, data);
            return;
        }
        authority.updateState(entityId, LocalServices.apply(service, entity.getState()));
    }
}
