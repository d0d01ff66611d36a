package at.sv.minihub.automation;

import at.sv.minihub.error.NotFoundException;
import at.sv.minihub.storage.AutomationRepository;
import at.sv.minihub.time.TimeOfDayResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.UUID;

/**
 * Administrative CRUD for automations. The engine picks up changes with the next event or tick.
 */
@Slf4j
@RequiredArgsConstructor
public final class AutomationService {

    private final AutomationRepository automationRepository;
    private final TimeOfDayResolver timeOfDayResolver;

    public Automation create(Automation automation) {
        Automation created = automation.toBuilder()
                                       .id(automation.getId() != null ? automation.getId() : UUID.randomUUID())
                                       .lastTriggered(null)
                                       .build();
        validate(created);
        automationRepository.save(created);
        log.info("Created automation '{}'.", created.getName());
        return created;
    }

    public Automation get(UUID id) {
        return automationRepository.findById(id).orElseThrow(() -> new NotFoundException("Automation", id));
    }

    public List<Automation> list() {
        return automationRepository.findAll();
    }

    /**
     * Replaces the definition of an existing automation, keeping its last triggered time.
     */
    public Automation update(Automation automation) {
        Automation existing = get(automation.getId());
        Automation updated = automation.toBuilder()
                                       .lastTriggered(existing.getLastTriggered())
                                       .build();
        validate(updated);
        return automationRepository.save(updated);
    }

    public Automation enable(UUID id) {
        return setEnabled(id, true);
    }

    public Automation disable(UUID id) {
        return setEnabled(id, false);
    }

    private Automation setEnabled(UUID id, boolean enabled) {
        Automation automation = get(id).toBuilder().enabled(enabled).build();
        log.info("{} automation '{}'.", enabled ? "Enabled" : "Disabled", automation.getName());
        return automationRepository.save(automation);
    }

    public void delete(UUID id) {
        if (!automationRepository.delete(id)) {
            throw new NotFoundException("Automation", id);
        }
    }

    private void validate(Automation automation) {
        automation.validate();
        automation.getConditions().stream()
                  .filter(TimeRangeCondition.class::isInstance)
                  .map(TimeRangeCondition.class::cast)
                  .forEach(range -> {
                      timeOfDayResolver.validate(range.after());
                      timeOfDayResolver.validate(range.before());
                  });
    }
}
