package at.sv.minihub.automation;

import at.sv.minihub.error.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Reads automation definitions from JSON, e.g.:
 * <pre>
 * [{
 *   "name": "Fan follows kitchen light",
 *   "trigger": {"type": "state_changed", "entity_id": "light.kitchen", "to": "on"},
 *   "conditions": [{"type": "time_range", "after": "sunset", "before": "23:00"}],
 *   "actions": [{"type": "delay", "duration": "PT5S"},
 *               {"type": "call_service", "entity_id": "switch.fan", "service": "turn_on"}]
 * }]
 * </pre>
 */
public final class AutomationFileParser {

    private final ObjectMapper objectMapper;

    public AutomationFileParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws ValidationException if the input is not a valid list of automations
     */
    public List<Automation> parse(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<List<Automation>>() {
            });
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid automations: " + e.getOriginalMessage());
        }
    }
}
