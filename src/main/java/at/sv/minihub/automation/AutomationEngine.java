package at.sv.minihub.automation;

import at.sv.minihub.TaskScheduler;
import at.sv.minihub.bus.BusConsumer;
import at.sv.minihub.bus.EventBus;
import at.sv.minihub.error.NotFoundException;
import at.sv.minihub.error.ValidationException;
import at.sv.minihub.model.Entity;
import at.sv.minihub.model.EntityState;
import at.sv.minihub.model.Event;
import at.sv.minihub.model.EventData;
import at.sv.minihub.model.EventFactory;
import at.sv.minihub.model.EventType;
import at.sv.minihub.service.ServiceCallHandler;
import at.sv.minihub.storage.AutomationRepository;
import at.sv.minihub.storage.EntityRepository;
import at.sv.minihub.time.TimeOfDayResolver;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Evaluates the enabled automations: state changed triggers against bus events, time pattern triggers on every
 * {@link #onTick() tick}, and manual triggers on request. A run checks all conditions in order, stopping at the
 * first unsatisfied one, and then executes the actions one after the other. A failing run is logged and aborted
 * without affecting any other run.
 */
@Slf4j
public final class AutomationEngine extends BusConsumer {

    /**
     * Upper bound of seconds checked per tick, so a clock jump does not fire thousands of runs.
     */
    private static final int MAX_CATCH_UP_SECONDS = 60;

    private final AutomationRepository automationRepository;
    private final EntityRepository entityRepository;
    private final ServiceCallHandler serviceCallHandler;
    private final TimeOfDayResolver timeOfDayResolver;
    private final TaskScheduler scheduler;
    private final EventBus bus;
    private final EventFactory eventFactory;
    private final Supplier<ZonedDateTime> currentTime;
    private final ConditionContext conditionContext;
    private ZonedDateTime lastTick;

    public AutomationEngine(EventBus bus, AutomationRepository automationRepository, EntityRepository entityRepository,
                            ServiceCallHandler serviceCallHandler, TimeOfDayResolver timeOfDayResolver,
                            TaskScheduler scheduler, EventFactory eventFactory, Supplier<ZonedDateTime> currentTime) {
        super("automation-engine", bus);
        this.bus = bus;
        this.automationRepository = automationRepository;
        this.entityRepository = entityRepository;
        this.serviceCallHandler = serviceCallHandler;
        this.timeOfDayResolver = timeOfDayResolver;
        this.scheduler = scheduler;
        this.eventFactory = eventFactory;
        this.currentTime = currentTime;
        this.conditionContext = new EngineConditionContext();
    }

    @Override
    protected void onEvent(Event event) {
        if (!event.isOfType(EventType.STATE_CHANGED)) {
            return;
        }
        for (Automation automation : automationRepository.findEnabled()) {
            if (automation.getTrigger().matches(event)) {
                run(automation, "trigger " + event);
            }
        }
    }

    @Override
    protected void onLag(long missed) {
        log.warn("Missed {} events, automations triggered by them did not run.", missed);
    }

    /**
     * Fires all enabled time pattern automations matching any full second since the last tick.
     */
    public synchronized void onTick() {
        ZonedDateTime now = currentTime.get().truncatedTo(ChronoUnit.SECONDS);
        ZonedDateTime from = lastTick == null ? now : lastTick.plusSeconds(1);
        if (from.isBefore(now.minusSeconds(MAX_CATCH_UP_SECONDS))) {
            log.warn("Clock jumped from {} to {}, skipping missed time patterns.", lastTick, now);
            from = now;
        }
        lastTick = now;
        List<Automation> automations = automationRepository.findEnabled().stream()
                                                           .filter(automation -> automation.getTrigger() instanceof TimePatternTrigger)
                                                           .toList();
        for (ZonedDateTime second = from; !second.isAfter(now); second = second.plusSeconds(1)) {
            for (Automation automation : automations) {
                if (matchesTimePattern(automation, second)) {
                    run(automation, "time pattern at " + second.toLocalTime());
                }
            }
        }
    }

    private boolean matchesTimePattern(Automation automation, ZonedDateTime time) {
        try {
            return ((TimePatternTrigger) automation.getTrigger()).matches(time);
        } catch (ValidationException e) {
            log.error("Invalid time pattern of automation '{}': {}", automation.getName(), e.getMessage());
            return false;
        }
    }

    /**
     * Runs the given automation now, regardless of its trigger.
     *
     * @throws NotFoundException   if the automation is unknown
     * @throws ValidationException if the automation is disabled
     */
    public void fireManually(UUID automationId) {
        Automation automation = automationRepository.findById(automationId)
                                                    .orElseThrow(() -> new NotFoundException("Automation", automationId));
        if (!automation.isEnabled()) {
            throw new ValidationException("Automation '" + automation.getName() + "' is disabled");
        }
        run(automation, "manual");
    }

    private void run(Automation automation, String cause) {
        String previousContext = MDC.get("context");
        MDC.put("context", automation.getContextName());
        try {
            if (!conditionsSatisfied(automation)) {
                return;
            }
            log.debug("Running ({})", cause);
            executeActions(automation, 0);
        } catch (Exception e) {
            log.error("Automation '{}' failed: {}", automation.getName(), e.getLocalizedMessage(), e);
        } finally {
            restoreContext(previousContext);
        }
    }

    private static void restoreContext(String previousContext) {
        if (previousContext == null) {
            MDC.remove("context");
        } else {
            MDC.put("context", previousContext);
        }
    }

    private boolean conditionsSatisfied(Automation automation) {
        List<Condition> conditions = automation.getConditions();
        for (int i = 0; i < conditions.size(); i++) {
            if (!conditions.get(i).isSatisfied(conditionContext)) {
                log.debug("Condition {} not satisfied: {}", i + 1, conditions.get(i));
                return false;
            }
        }
        return true;
    }

    /**
     * Executes the actions starting at the given index. A delay suspends the run by scheduling the remaining
     * actions as a continuation.
     */
    private void executeActions(Automation automation, int startIndex) {
        List<Action> actions = automation.getActions();
        for (int i = startIndex; i < actions.size(); i++) {
            Action action = actions.get(i);
            if (action instanceof DelayAction delay) {
                int next = i + 1;
                log.debug("Delaying for {}", delay.duration());
                scheduler.schedule(() -> resume(automation, next), currentTime.get().plus(delay.duration()));
                return;
            } else if (action instanceof CallServiceAction call) {
                callService(call);
            }
        }
        complete(automation);
    }

    private void resume(Automation automation, int index) {
        MDC.put("context", automation.getContextName());
        try {
            Automation current = automationRepository.findById(automation.getId()).orElse(null);
            if (current == null || !current.isEnabled()) {
                log.debug("Skipping remaining actions, automation was {} during delay.",
                        current == null ? "deleted" : "disabled");
                return;
            }
            executeActions(automation, index);
        } catch (Exception e) {
            log.error("Automation '{}' failed after delay: {}", automation.getName(), e.getLocalizedMessage(), e);
        } finally {
            MDC.remove("context");
        }
    }

    private void callService(CallServiceAction call) {
        log.debug("Calling {} on {}", call.service(), call.entityId());
        serviceCallHandler.callService(call.entityId(), call.service(), call.data());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(EventData.SERVICE, call.service());
        data.put(EventData.SERVICE_DATA, call.data());
        publish(eventFactory.create(EventType.SERVICE_CALLED, call.entityId(), data));
    }

    private void complete(Automation automation) {
        ZonedDateTime now = currentTime.get();
        automationRepository.findById(automation.getId())
                            .ifPresent(current -> automationRepository.save(current.toBuilder().lastTriggered(now).build()));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(EventData.AUTOMATION_ID, automation.getId());
        data.put(EventData.AUTOMATION_NAME, automation.getName());
        publish(eventFactory.create(EventType.AUTOMATION_TRIGGERED, data));
        log.info("Triggered.");
    }

    private void publish(Event event) {
        try {
            bus.publish(event);
        } catch (Exception e) {
            log.warn("Failed to publish {}: {}", event, e.getLocalizedMessage());
        }
    }

    private final class EngineConditionContext implements ConditionContext {

        @Override
        public Optional<EntityState> getState(String entityId) {
            Optional<EntityState> state = entityRepository.findByEntityId(entityId).map(Entity::getState);
            if (state.isEmpty()) {
                log.debug("Unknown entity '{}' in condition", entityId);
            }
            return state;
        }

        @Override
        public ZonedDateTime now() {
            return currentTime.get();
        }

        @Override
        public ZonedDateTime resolveTime(String expression, ZonedDateTime dateTime) {
            return timeOfDayResolver.resolve(expression, dateTime);
        }
    }
}
