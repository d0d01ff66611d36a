package at.sv.minihub.storage.memory;

import at.sv.minihub.automation.Automation;
import at.sv.minihub.storage.AutomationRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryAutomationRepository implements AutomationRepository {

    private final Map<UUID, Automation> automations = new ConcurrentHashMap<>();

    @Override
    public Automation save(Automation automation) {
        automations.put(automation.getId(), automation.toBuilder().build());
        return automation;
    }

    @Override
    public Optional<Automation> findById(UUID id) {
        return Optional.ofNullable(automations.get(id)).map(automation -> automation.toBuilder().build());
    }

    @Override
    public List<Automation> findAll() {
        return automations.values().stream()
                          .map(automation -> automation.toBuilder().build())
                          .sorted(Comparator.comparing(Automation::getName))
                          .toList();
    }

    @Override
    public List<Automation> findEnabled() {
        return findAll().stream()
                        .filter(Automation::isEnabled)
                        .toList();
    }

    @Override
    public boolean delete(UUID id) {
        return automations.remove(id) != null;
    }
}
