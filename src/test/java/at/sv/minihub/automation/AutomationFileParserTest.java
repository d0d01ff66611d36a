package at.sv.minihub.automation;

import at.sv.minihub.JsonMappers;
import at.sv.minihub.error.ValidationException;
import at.sv.minihub.model.EntityState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AutomationFileParserTest {

    private AutomationFileParser parser;

    @BeforeEach
    void setUp() {
        parser = new AutomationFileParser(JsonMappers.create());
    }

    @Test
    void parse_fullDefinition_allPartsMapped() {
        List<Automation> automations = parser.parse("""
                [{
                  "name": "Fan follows kitchen light",
                  "trigger": {"type": "state_changed", "entity_id": "light.kitchen", "to": "on"},
                  "conditions": [
                    {"type": "time_range", "after": "sunset", "before": "23:00"},
                    {"type": "state_is", "entity_id": "switch.fan", "state": "off"}
                  ],
                  "actions": [
                    {"type": "delay", "duration": "PT5S"},
                    {"type": "call_service", "entity_id": "switch.fan", "service": "turn_on", "data": {"speed": 2}}
                  ]
                }]
                """);

        assertThat(automations).hasSize(1);
        Automation automation = automations.get(0);
        assertThat(automation.getName()).isEqualTo("Fan follows kitchen light");
        assertThat(automation.isEnabled()).isTrue();
        assertThat(automation.getTrigger()).isEqualTo(StateChangedTrigger.forNewState("light.kitchen", EntityState.ON));
        assertThat(automation.getConditions()).containsExactly(
                new TimeRangeCondition("sunset", "23:00"),
                new StateIsCondition("switch.fan", EntityState.OFF));
        assertThat(automation.getActions()).containsExactly(
                new DelayAction(Duration.ofSeconds(5)),
                new CallServiceAction("switch.fan", "turn_on", Map.of("speed", 2)));
    }

    @Test
    void parse_minimalDefinition_defaults() {
        List<Automation> automations = parser.parse("""
                [{"name": "Hourly", "enabled": false,
                  "trigger": {"type": "time_pattern", "schedule": "*:0:0"},
                  "actions": [{"type": "call_service", "entity_id": "switch.fan", "service": "toggle"}]},
                 {"name": "Button", "trigger": {"type": "manual"},
                  "actions": [{"type": "delay", "duration": 30}]}]
                """);

        assertThat(automations).hasSize(2);
        assertThat(automations.get(0).isEnabled()).isFalse();
        assertThat(automations.get(0).getConditions()).isEmpty();
        assertThat(automations.get(0).getTrigger()).isEqualTo(new TimePatternTrigger("*:0:0"));
        assertThat(automations.get(0).getActions()).containsExactly(new CallServiceAction("switch.fan", "toggle"));
        assertThat(automations.get(1).getTrigger()).isInstanceOf(ManualTrigger.class);
        assertThat(automations.get(1).getActions()).containsExactly(new DelayAction(Duration.ofSeconds(30)));
    }

    @Test
    void parse_unknownTriggerType_validationError() {
        assertThatThrownBy(() -> parser.parse("""
                [{"name": "x", "trigger": {"type": "sunrise"}, "actions": []}]
                """)).isInstanceOf(ValidationException.class);
    }

    @Test
    void parse_unknownState_validationError() {
        assertThatThrownBy(() -> parser.parse("""
                [{"name": "x", "trigger": {"type": "state_changed", "entity_id": "light.a", "to": "dimmed"},
                  "actions": []}]
                """)).isInstanceOf(ValidationException.class);
    }

    @Test
    void parse_malformedJson_validationError() {
        assertThatThrownBy(() -> parser.parse("[{")).isInstanceOf(ValidationException.class);
    }
}
