package at.sv.minihub.automation;

import at.sv.minihub.ScheduledRunnable;
import at.sv.minihub.TestTaskScheduler;
import at.sv.minihub.bus.BusMessage;
import at.sv.minihub.bus.EventBus;
import at.sv.minihub.bus.Subscription;
import at.sv.minihub.error.NotFoundException;
import at.sv.minihub.error.ValidationException;
import at.sv.minihub.integration.IntegrationManager;
import at.sv.minihub.model.Device;
import at.sv.minihub.model.Entity;
import at.sv.minihub.model.EntityState;
import at.sv.minihub.model.Event;
import at.sv.minihub.model.EventData;
import at.sv.minihub.model.EventFactory;
import at.sv.minihub.model.EventType;
import at.sv.minihub.service.EntityStateAuthority;
import at.sv.minihub.service.LocalServices;
import at.sv.minihub.service.ServiceCallRouter;
import at.sv.minihub.storage.memory.InMemoryAutomationRepository;
import at.sv.minihub.storage.memory.InMemoryDeviceRepository;
import at.sv.minihub.storage.memory.InMemoryEntityRepository;
import at.sv.minihub.time.TimeOfDayResolverImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class AutomationEngineTest {

    private ZonedDateTime now;
    private EventBus bus;
    private InMemoryEntityRepository entityRepository;
    private InMemoryAutomationRepository automationRepository;
    private EntityStateAuthority authority;
    private TestTaskScheduler scheduler;
    private AutomationEngine engine;
    private Subscription observer;

    @BeforeEach
    void setUp() {
        now = ZonedDateTime.of(2024, 5, 10, 10, 0, 0, 0, ZoneId.of("Europe/Vienna"));
        bus = new EventBus(256);
        entityRepository = spy(new InMemoryEntityRepository());
        InMemoryDeviceRepository deviceRepository = new InMemoryDeviceRepository();
        automationRepository = new InMemoryAutomationRepository();
        EventFactory eventFactory = new EventFactory(() -> now);
        authority = new EntityStateAuthority(entityRepository, deviceRepository, bus, eventFactory, () -> now);
        scheduler = new TestTaskScheduler();
        ServiceCallRouter router = new ServiceCallRouter(authority, deviceRepository, mock(IntegrationManager.class));
        TimeOfDayResolverImpl resolver = new TimeOfDayResolverImpl((event, dateTime) -> dateTime.with(LocalTime.of(18, 0)));
        engine = new AutomationEngine(bus, automationRepository, entityRepository, router, resolver, scheduler,
                eventFactory, () -> now);

        Device device = deviceRepository.save(Device.builder().id(UUID.randomUUID()).name("Kitchen").build());
        createEntity(device, "light.kitchen");
        createEntity(device, "switch.fan");
        engine.drain();
        observer = bus.subscribe();
    }

    private void createEntity(Device device, String entityId) {
        authority.createEntity(Entity.builder().deviceId(device.getId()).entityId(entityId)
                                     .friendlyName(entityId).state(EntityState.OFF).build());
    }

    private Automation addAutomation(Trigger trigger, List<Condition> conditions, Action... actions) {
        Automation automation = Automation.builder()
                                          .id(UUID.randomUUID())
                                          .name("automation " + automationRepository.findAll().size())
                                          .trigger(trigger)
                                          .conditions(conditions)
                                          .actions(List.of(actions))
                                          .build();
        automationRepository.save(automation);
        return automation;
    }

    private Automation fanFollowsKitchenLight(Action... actions) {
        return addAutomation(StateChangedTrigger.forNewState("light.kitchen", EntityState.ON), List.of(), actions);
    }

    private static CallServiceAction turnOnFan() {
        return new CallServiceAction("switch.fan", LocalServices.TURN_ON);
    }

    private List<Event> observedEvents() {
        List<Event> events = new ArrayList<>();
        Optional<BusMessage> message;
        while ((message = observer.tryNext()).isPresent()) {
            events.add(((BusMessage.Delivered) message.get()).event());
        }
        return events;
    }

    private static List<EventType> types(List<Event> events) {
        return events.stream().map(Event::getType).toList();
    }

    private EntityState stateOf(String entityId) {
        return authority.getByEntityId(entityId).getState();
    }

    private ZonedDateTime lastTriggered(Automation automation) {
        return automationRepository.findById(automation.getId()).orElseThrow().getLastTriggered();
    }

    private void turnOnKitchenLight() {
        authority.updateState("light.kitchen", EntityState.ON);
        engine.drain();
    }

    @Test
    void onEvent_matchingTrigger_callsServiceAndPublishesInOrder() {
        Automation automation = fanFollowsKitchenLight(turnOnFan());

        turnOnKitchenLight();

        List<Event> events = observedEvents();
        assertThat(types(events)).containsExactly(EventType.STATE_CHANGED, EventType.STATE_CHANGED,
                EventType.SERVICE_CALLED, EventType.AUTOMATION_TRIGGERED);
        assertThat(events.get(0).getEntityId()).isEqualTo("light.kitchen");
        assertThat(events.get(1).getEntityId()).isEqualTo("switch.fan");
        assertThat(events.get(3).get(EventData.AUTOMATION_ID)).isEqualTo(automation.getId());
        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.ON);
        assertThat(lastTriggered(automation)).isEqualTo(now);
    }

    @Test
    void onEvent_nonMatchingTrigger_noSideEffects() {
        Automation automation = addAutomation(StateChangedTrigger.forNewState("light.kitchen", EntityState.OFF),
                List.of(), turnOnFan());

        turnOnKitchenLight();

        assertThat(types(observedEvents())).containsExactly(EventType.STATE_CHANGED);
        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.OFF);
        assertThat(lastTriggered(automation)).isNull();
        assertThat(scheduler.getScheduledRunnables()).isEmpty();
    }

    @Test
    void onEvent_fromStateRestriction_respected() {
        addAutomation(new StateChangedTrigger("light.kitchen", EntityState.UNAVAILABLE, EntityState.ON), List.of(),
                turnOnFan());

        turnOnKitchenLight();

        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.OFF);
    }

    @Test
    void onEvent_disabledAutomation_ignored() {
        Automation automation = fanFollowsKitchenLight(turnOnFan());
        automationRepository.save(automation.toBuilder().enabled(false).build());

        turnOnKitchenLight();

        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.OFF);
    }

    @Test
    void onEvent_firstConditionFails_laterConditionsNotEvaluated() {
        Automation automation = addAutomation(StateChangedTrigger.forNewState("light.kitchen", EntityState.ON),
                List.of(new StateIsCondition("switch.fan", EntityState.ON),
                        new StateIsCondition("sensor.never_read", EntityState.ON)),
                turnOnFan());

        turnOnKitchenLight();

        verify(entityRepository, never()).findByEntityId("sensor.never_read");
        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.OFF);
        assertThat(lastTriggered(automation)).isNull();
    }

    @Test
    void onEvent_allConditionsSatisfied_runs() {
        addAutomation(StateChangedTrigger.forNewState("light.kitchen", EntityState.ON),
                List.of(new StateIsCondition("switch.fan", EntityState.OFF), new TimeRangeCondition("08:00", "12:00")),
                turnOnFan());

        turnOnKitchenLight();

        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.ON);
    }

    @Test
    void onEvent_timeRangeWithSunset_evaluatedAgainstResolvedSunTime() {
        addAutomation(StateChangedTrigger.forNewState("light.kitchen", EntityState.ON),
                List.of(new TimeRangeCondition("sunset", "23:00")), turnOnFan());

        turnOnKitchenLight();
        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.OFF);

        authority.updateState("light.kitchen", EntityState.OFF);
        now = now.with(LocalTime.of(19, 0));
        turnOnKitchenLight();
        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.ON);
    }

    @Test
    void onEvent_delay_suspendsRunUntilScheduledContinuation() {
        Automation automation = fanFollowsKitchenLight(new DelayAction(Duration.ofSeconds(5)), turnOnFan());

        turnOnKitchenLight();

        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.OFF);
        assertThat(lastTriggered(automation)).isNull();
        List<ScheduledRunnable> scheduled = scheduler.getScheduledRunnables();
        assertThat(scheduled).hasSize(1);
        assertThat(scheduled.get(0).getStart()).isEqualTo(now.plusSeconds(5));

        now = now.plusSeconds(5);
        scheduler.takeNext().run();

        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.ON);
        assertThat(lastTriggered(automation)).isEqualTo(now);
        assertThat(types(observedEvents())).endsWith(EventType.SERVICE_CALLED, EventType.AUTOMATION_TRIGGERED);
    }

    @Test
    void onEvent_delay_engineKeepsHandlingOtherEventsMeanwhile() {
        fanFollowsKitchenLight(new DelayAction(Duration.ofMinutes(10)), turnOnFan());
        Automation other = addAutomation(StateChangedTrigger.forNewState("switch.fan", EntityState.ON), List.of(),
                new CallServiceAction("light.kitchen", LocalServices.TURN_OFF));

        turnOnKitchenLight();
        authority.updateState("switch.fan", EntityState.ON);
        engine.drain();

        assertThat(lastTriggered(other)).isEqualTo(now);
        assertThat(stateOf("light.kitchen")).isEqualTo(EntityState.OFF);
        assertThat(scheduler.getScheduledRunnables()).hasSize(1);
    }

    @Test
    void onEvent_automationDeletedDuringDelay_remainingActionsSkipped() {
        Automation automation = fanFollowsKitchenLight(new DelayAction(Duration.ofSeconds(5)), turnOnFan());
        turnOnKitchenLight();
        observedEvents();

        automationRepository.delete(automation.getId());
        now = now.plusSeconds(5);
        scheduler.takeNext().run();

        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.OFF);
        assertThat(observedEvents()).isEmpty();
    }

    @Test
    void onEvent_automationDisabledDuringDelay_remainingActionsSkipped() {
        Automation automation = fanFollowsKitchenLight(new DelayAction(Duration.ofSeconds(5)), turnOnFan());
        turnOnKitchenLight();
        automationRepository.save(automation.toBuilder().enabled(false).build());

        now = now.plusSeconds(5);
        scheduler.takeNext().run();

        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.OFF);
        assertThat(lastTriggered(automation)).isNull();
    }

    @Test
    void onEvent_stateIsConditionOnUnknownEntity_notSatisfied() {
        Automation automation = addAutomation(StateChangedTrigger.forNewState("light.kitchen", EntityState.ON),
                List.of(new StateIsCondition("sensor.unknown", EntityState.ON)), turnOnFan());
        Automation other = fanFollowsKitchenLight(new CallServiceAction("light.kitchen", LocalServices.TURN_OFF));

        turnOnKitchenLight();

        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.OFF);
        assertThat(lastTriggered(automation)).isNull();
        assertThat(lastTriggered(other)).isEqualTo(now);
    }

    @Test
    void onEvent_failingAction_abortsOnlyThatRun() {
        Automation failing = fanFollowsKitchenLight(new CallServiceAction("switch.missing", LocalServices.TURN_ON));
        Automation working = fanFollowsKitchenLight(turnOnFan());

        turnOnKitchenLight();

        assertThat(lastTriggered(failing)).isNull();
        assertThat(lastTriggered(working)).isEqualTo(now);
        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.ON);
    }

    @Test
    void onEvent_failingAction_laterActionsNotExecuted_engineKeepsRunning() {
        fanFollowsKitchenLight(new CallServiceAction("light.kitchen", "explode"), turnOnFan());

        turnOnKitchenLight();
        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.OFF);

        Automation next = addAutomation(StateChangedTrigger.forNewState("light.kitchen", EntityState.OFF), List.of(),
                turnOnFan());
        authority.updateState("light.kitchen", EntityState.OFF);
        engine.drain();

        assertThat(lastTriggered(next)).isEqualTo(now);
        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.ON);
    }

    @Test
    void fireManually_enabled_runsActions() {
        Automation automation = addAutomation(new ManualTrigger(), List.of(), turnOnFan());

        engine.fireManually(automation.getId());

        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.ON);
        assertThat(lastTriggered(automation)).isEqualTo(now);
    }

    @Test
    void fireManually_ignoresTriggerButChecksConditions() {
        Automation automation = fanFollowsKitchenLight(turnOnFan());
        Automation guarded = addAutomation(new ManualTrigger(),
                List.of(new StateIsCondition("light.kitchen", EntityState.ON)), turnOnFan());

        engine.fireManually(guarded.getId());
        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.OFF);

        engine.fireManually(automation.getId());
        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.ON);
    }

    @Test
    void fireManually_disabled_validationError() {
        Automation automation = addAutomation(new ManualTrigger(), List.of(), turnOnFan());
        automationRepository.save(automation.toBuilder().enabled(false).build());

        assertThatThrownBy(() -> engine.fireManually(automation.getId())).isInstanceOf(ValidationException.class);
        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.OFF);
    }

    @Test
    void fireManually_unknown_notFound() {
        assertThatThrownBy(() -> engine.fireManually(UUID.randomUUID())).isInstanceOf(NotFoundException.class);
    }

    @Test
    void onTick_timePattern_firesOncePerMatchingSecond() {
        addAutomation(new TimePatternTrigger("*:*:0"), List.of(),
                new CallServiceAction("switch.fan", LocalServices.TOGGLE));

        engine.onTick();
        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.ON);

        now = now.plusSeconds(30);
        engine.onTick();
        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.ON);

        now = now.plusSeconds(35);
        engine.onTick();
        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.OFF);

        assertThat(types(observedEvents())).filteredOn(type -> type == EventType.AUTOMATION_TRIGGERED).hasSize(2);
    }

    @Test
    void onTick_sameSecondTwice_firesOnlyOnce() {
        addAutomation(new TimePatternTrigger("10:0:0"), List.of(),
                new CallServiceAction("switch.fan", LocalServices.TOGGLE));

        engine.onTick();
        now = now.plusNanos(500_000_000);
        engine.onTick();

        assertThat(stateOf("switch.fan")).isEqualTo(EntityState.ON);
    }

    @Test
    void onTick_clockJump_onlyCurrentSecondChecked() {
        addAutomation(new TimePatternTrigger("*:*:*"), List.of(),
                new CallServiceAction("switch.fan", LocalServices.TOGGLE));
        engine.onTick();
        observedEvents();

        now = now.plusHours(3);
        engine.onTick();

        assertThat(types(observedEvents())).filteredOn(type -> type == EventType.AUTOMATION_TRIGGERED).hasSize(1);
    }

    @Test
    void onTick_stateChangedAutomations_notFired() {
        Automation automation = fanFollowsKitchenLight(turnOnFan());

        engine.onTick();

        assertThat(lastTriggered(automation)).isNull();
    }
}
