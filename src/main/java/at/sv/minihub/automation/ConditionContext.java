package at.sv.minihub.automation;

import at.sv.minihub.model.EntityState;

import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Read-only view on the hub used to evaluate conditions.
 */
public interface ConditionContext {

    /**
     * @return the current state of the entity, or empty if the entity is unknown
     */
    Optional<EntityState> getState(String entityId);

    ZonedDateTime now();

    /**
     * Resolves a time of day expression like "22:00" or "sunset+30" on the date of the given time.
     */
    ZonedDateTime resolveTime(String expression, ZonedDateTime dateTime);
}
