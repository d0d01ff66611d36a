package at.sv.minihub.storage;

import at.sv.minihub.automation.Automation;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AutomationRepository {

    Automation save(Automation automation);

    Optional<Automation> findById(UUID id);

    List<Automation> findAll();

    List<Automation> findEnabled();

    boolean delete(UUID id);
}
