package at.sv.minihub.automation;

/**
 * Never fires on its own, only through {@link AutomationEngine#fireManually}.
 */
public record ManualTrigger() implements Trigger {

    @Override
    public void validate() {
    }
}
