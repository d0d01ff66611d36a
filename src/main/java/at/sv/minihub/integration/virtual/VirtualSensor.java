package at.sv.minihub.integration.virtual;

import at.sv.minihub.model.AttributeValue;
import at.sv.minihub.model.Device;
import at.sv.minihub.model.DiscoveredDevice;
import at.sv.minihub.model.Entity;
import at.sv.minihub.model.EntityState;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleSupplier;

/**
 * Simulated temperature sensor. Its reading drifts by up to half a degree per {@link #drift()}, staying within
 * 15 to 30 °C. Accepts no services.
 */
public final class VirtualSensor implements VirtualDevice {

    static final double INITIAL_TEMPERATURE = 21.5;
    private static final double MIN_TEMPERATURE = 15.0;
    private static final double MAX_TEMPERATURE = 30.0;
    private static final double MAX_DRIFT = 0.5;

    private final DoubleSupplier random;
    private double temperature = INITIAL_TEMPERATURE;

    /**
     * @param random source of values in [0, 1)
     */
    public VirtualSensor(DoubleSupplier random) {
        this.random = random;
    }

    @Override
    public String getEntityId() {
        return "sensor.virtual_temperature";
    }

    public synchronized double getTemperature() {
        return temperature;
    }

    public synchronized void drift() {
        double delta = (random.getAsDouble() * 2 - 1) * MAX_DRIFT;
        double next = Math.max(MIN_TEMPERATURE, Math.min(MAX_TEMPERATURE, temperature + delta));
        temperature = Math.round(next * 10) / 10.0;
    }

    @Override
    public synchronized DiscoveredDevice discover() {
        Device device = Device.builder()
                              .name("Virtual Sensor")
                              .manufacturer(VirtualConstants.MANUFACTURER)
                              .model("VSensor-1")
                              .uniqueId("virtual_sensor")
                              .build();
        Map<String, AttributeValue> attributes = new HashMap<>();
        attributes.put("temperature", AttributeValue.of(temperature));
        attributes.put("unit", AttributeValue.of("°C"));
        Entity entity = Entity.builder()
                              .entityId(getEntityId())
                              .friendlyName("Virtual Temperature")
                              .state(EntityState.UNKNOWN)
                              .attributes(attributes)
                              .build();
        return new DiscoveredDevice(device, List.of(entity));
    }

    @Override
    public boolean handleService(String service) {
        return false;
    }
}
