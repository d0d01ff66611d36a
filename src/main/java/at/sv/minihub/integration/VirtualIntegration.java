package at.sv.minihub.integration;

import at.sv.minihub.error.NotFoundException;
import at.sv.minihub.error.ValidationException;
import at.sv.minihub.integration.virtual.VirtualDevice;
import at.sv.minihub.integration.virtual.VirtualLight;
import at.sv.minihub.integration.virtual.VirtualSensor;
import at.sv.minihub.integration.virtual.VirtualSwitch;
import at.sv.minihub.service.LocalServices;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleSupplier;

/**
 * Simulated light, switch and temperature sensor, for trying out automations without hardware.
 */
@Slf4j
public final class VirtualIntegration implements Integration {

    public static final String NAME = "virtual";

    private final Map<String, VirtualDevice> devices = new LinkedHashMap<>();
    private final VirtualSensor sensor;
    private final Duration sensorInterval;
    private IntegrationContext context;

    public VirtualIntegration(Duration sensorInterval, DoubleSupplier random) {
        this.sensorInterval = sensorInterval;
        this.sensor = new VirtualSensor(random);
        add(new VirtualLight());
        add(new VirtualSwitch());
        add(sensor);
    }

    private void add(VirtualDevice device) {
        devices.put(device.getEntityId(), device);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void setup(IntegrationContext context) {
        this.context = context;
        devices.values().forEach(device -> context.upsertDiscovered(device.discover()));
        log.debug("Discovered {} virtual devices.", devices.size());
    }

    @Override
    public Optional<IntegrationTask> getBackgroundTask() {
        return Optional.of(new IntegrationTask("temperature drift", sensorInterval,
                IntegrationTask.RetryPolicy.FIXED_INTERVAL, token -> {
            sensor.drift();
            context.upsertDiscovered(sensor.discover());
        }));
    }

    @Override
    public void handleServiceCall(String entityId, String service, Map<String, Object> data) {
        if (!LocalServices.isSupported(service)) {
            throw new ValidationException("Unknown service '" + service + "' for " + entityId);
        }
        VirtualDevice device = devices.get(entityId);
        if (device == null) {
            throw new NotFoundException("Entity", entityId);
        }
        if (device.handleService(service)) {
            context.upsertDiscovered(device.discover());
        }
    }

    @Override
    public void teardown() {
        context = null;
    }
}
