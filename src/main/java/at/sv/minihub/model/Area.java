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
public final class Area {
    UUID id;
    String name;
    UUID parentId;

    public Area copy() {
        return toBuilder().build();
    }

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Area name cannot be empty");
        }
        if (id != null && id.equals(parentId)) {
            throw new ValidationException("Area '" + name + "' cannot be its own parent");
        }
    }
}
