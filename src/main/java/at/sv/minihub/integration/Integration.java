package at.sv.minihub.integration;

import java.util.Map;
import java.util.Optional;

/**
 * A protocol adapter feeding devices into the hub. The set of integrations is closed; the lifecycle is
 * construct, {@link #setup}, optional background task, {@link #teardown}.
 */
public sealed interface Integration permits VirtualIntegration, ScanningIntegration {

    /**
     * Unique name, stored as the owner of every device this integration discovers.
     */
    String getName();

    /**
     * Called once at startup, after the hub is fully wired.
     */
    void setup(IntegrationContext context) throws Exception;

    default Optional<IntegrationTask> getBackgroundTask() {
        return Optional.empty();
    }

    /**
     * Executes a service on an entity owned by this integration. New states are reported back through the
     * {@link IntegrationContext}. A known service that does not apply to the entity is ignored.
     *
     * @throws at.sv.minihub.error.ValidationException if the service is unknown to this integration
     */
    void handleServiceCall(String entityId, String service, Map<String, Object> data) throws Exception;

    /**
     * Called once at shutdown, even if setup or the background task failed. Releases all held resources.
     */
    void teardown() throws Exception;
}
