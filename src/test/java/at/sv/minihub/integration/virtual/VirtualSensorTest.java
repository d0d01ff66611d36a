package at.sv.minihub.integration.virtual;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

class VirtualSensorTest {

    @Test
    void drift_maxUpwards_halfDegree() {
        VirtualSensor sensor = new VirtualSensor(() -> 1.0);

        sensor.drift();

        assertThat(sensor.getTemperature(), is(22.0));
    }

    @Test
    void drift_middleValue_unchanged() {
        VirtualSensor sensor = new VirtualSensor(() -> 0.5);

        sensor.drift();

        assertThat(sensor.getTemperature(), is(21.5));
    }

    @Test
    void drift_manyTimesUpwards_cappedAtThirty() {
        VirtualSensor sensor = new VirtualSensor(() -> 1.0);

        for (int i = 0; i < 100; i++) {
            sensor.drift();
        }

        assertThat(sensor.getTemperature(), is(30.0));
    }

    @Test
    void drift_manyTimesDownwards_cappedAtFifteen() {
        VirtualSensor sensor = new VirtualSensor(() -> 0.0);

        for (int i = 0; i < 100; i++) {
            sensor.drift();
        }

        assertThat(sensor.getTemperature(), is(15.0));
    }

    @Test
    void drift_roundedToOneDecimal() {
        VirtualSensor sensor = new VirtualSensor(() -> 0.6234);

        sensor.drift();

        assertThat(sensor.getTemperature(), is(21.6));
    }

    @Test
    void handleService_neverChangesState() {
        VirtualSensor sensor = new VirtualSensor(() -> 0.5);

        assertThat(sensor.handleService("turn_on"), is(false));
    }
}
