package at.sv.minihub.service;

import java.util.Map;

public interface ServiceCallHandler {
    /**
     * Executes the given service, e.g. "turn_on", on the given entity.
     *
     * @throws at.sv.minihub.error.NotFoundException   if the entity is unknown
     * @throws at.sv.minihub.error.ValidationException if the service is unknown for the entity
     * @throws at.sv.minihub.error.IntegrationFailure  if the owning integration failed or did not answer in time
     */
    void callService(String entityId, String service, Map<String, Object> data);
}
