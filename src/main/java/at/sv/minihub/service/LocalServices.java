package at.sv.minihub.service;

import at.sv.minihub.error.ValidationException;
import at.sv.minihub.model.EntityState;

import java.util.Set;

/**
 * The services every switchable entity understands.
 */
public final class LocalServices {
    public static final String TURN_ON = "turn_on";
    public static final String TURN_OFF = "turn_off";
    public static final String TOGGLE = "toggle";

    private static final Set<String> SUPPORTED = Set.of(TURN_ON, TURN_OFF, TOGGLE);

    private LocalServices() {
    }

    public static boolean isSupported(String service) {
        return SUPPORTED.contains(service);
    }

    /**
     * @return the state the entity has after applying the service to its current state
     * @throws ValidationException if the service is unknown
     */
    public static EntityState apply(String service, EntityState current) {
        return switch (service) {
            case TURN_ON -> EntityState.ON;
            case TURN_OFF -> EntityState.OFF;
            case TOGGLE -> current.toggled();
            default -> throw new ValidationException("Unknown service '" + service + "'. Supported services: " +
                                                     String.join(", ", TURN_ON, TURN_OFF, TOGGLE));
        };
    }
}
