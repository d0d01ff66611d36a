package at.sv.minihub.integration.virtual;

final class VirtualConstants {
    static final String MANUFACTURER = "minihub";

    private VirtualConstants() {
    }
}
