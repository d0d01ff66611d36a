package at.sv.minihub.integration.virtual;

public final class VirtualLight extends SwitchableVirtualDevice {

    public VirtualLight() {
        super("virtual_light", "Virtual Light", "VLight-1", "light.virtual_light");
    }
}
