package at.sv.minihub.integration;

import at.sv.minihub.model.Device;
import at.sv.minihub.model.DiscoveredDevice;
import at.sv.minihub.model.Entity;
import at.sv.minihub.model.EntityState;
import at.sv.minihub.model.Event;
import at.sv.minihub.model.EventFactory;
import at.sv.minihub.service.EntityStateAuthority;
import at.sv.minihub.service.UpsertResult;
import at.sv.minihub.storage.memory.InMemoryDeviceRepository;
import at.sv.minihub.storage.memory.InMemoryEntityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ServiceIntegrationContextTest {

    private List<Event> published;
    private ServiceIntegrationContext context;

    @BeforeEach
    void setUp() {
        ZonedDateTime now = ZonedDateTime.of(2024, 5, 10, 10, 0, 0, 0, ZoneId.of("UTC"));
        published = new ArrayList<>();
        EntityStateAuthority authority = new EntityStateAuthority(new InMemoryEntityRepository(),
                new InMemoryDeviceRepository(), published::add, new EventFactory(() -> now), () -> now);
        context = new ServiceIntegrationContext("ble", authority, published::add);
    }

    private static DiscoveredDevice plant(Device device) {
        Entity entity = Entity.builder().entityId("sensor.plant").friendlyName("Plant").state(EntityState.ON).build();
        return new DiscoveredDevice(device, List.of(entity), null);
    }

    @Test
    void upsertDiscovered_withoutServiceData_upserted() {
        DiscoveredDevice discovered = plant(Device.builder().name("Plant Sensor").uniqueId("AA:BB").build());

        UpsertResult result = context.upsertDiscovered(discovered);

        assertThat(discovered.serviceData()).isEmpty();
        assertThat(result.entities()).singleElement()
                                     .satisfies(entity -> assertThat(entity.getEntityId()).isEqualTo("sensor.plant"));
    }

    @Test
    void upsertDiscovered_stampsOwnIntegrationName() {
        DiscoveredDevice discovered = plant(Device.builder().name("Plant Sensor").integration("mqtt")
                                                  .uniqueId("AA:BB").build());

        UpsertResult result = context.upsertDiscovered(discovered);

        assertThat(result.device().getIntegration()).isEqualTo("ble");
    }
}
