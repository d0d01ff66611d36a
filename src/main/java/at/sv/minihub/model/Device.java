package at.sv.minihub.model;

import at.sv.minihub.error.ValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public final class Device {
    UUID id;
    String name;
    String manufacturer;
    String model;
    UUID areaId;
    /**
     * The name of the owning integration, or empty for manually created devices.
     */
    @Builder.Default
    String integration = "";
    /**
     * Stable identifier assigned by the owning integration (e.g. a MAC address). Together with
     * {@link #integration} this identifies a device across restarts. Empty if not deduplicated.
     */
    @Builder.Default
    String uniqueId = "";

    public boolean hasUniqueId() {
        return uniqueId != null && !uniqueId.isEmpty();
    }

    public boolean isOwnedByIntegration() {
        return integration != null && !integration.isEmpty();
    }

    public Device copy() {
        return toBuilder().build();
    }

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Device name cannot be empty");
        }
        if (hasUniqueId() && !isOwnedByIntegration()) {
            throw new ValidationException("Device '" + name + "' has a unique_id but no integration");
        }
    }
}
