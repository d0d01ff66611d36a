package at.sv.minihub.model;

/**
 * Keys used in {@link Event#getData()}.
 */
public final class EventData {
    public static final String OLD_STATE = "old_state";
    public static final String NEW_STATE = "new_state";
    public static final String STATE = "state";
    public static final String CHANGED = "changed";
    public static final String FRIENDLY_NAME = "friendly_name";
    public static final String ENTITY_UUID = "id";
    public static final String DEVICE_ID = "device_id";
    public static final String DEVICE_NAME = "name";
    public static final String INTEGRATION = "integration";
    public static final String UNIQUE_ID = "unique_id";
    public static final String NEW_DEVICE = "new";
    public static final String AUTOMATION_ID = "automation_id";
    public static final String AUTOMATION_NAME = "automation_name";
    public static final String SERVICE = "service";
    public static final String SERVICE_DATA = "data";

    private EventData() {
    }
}
