package at.sv.minihub.integration.virtual;

public final class VirtualSwitch extends SwitchableVirtualDevice {

    public VirtualSwitch() {
        super("virtual_switch", "Virtual Switch", "VSwitch-1", "switch.virtual_switch");
    }
}
