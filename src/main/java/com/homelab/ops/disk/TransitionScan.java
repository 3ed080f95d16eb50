package com.homelab.ops.disk;

import java.util.List;

/**
 * Latest transition per disk within a located window.
 *
 * <p>Disks are split three ways: changed ({@link #getTransitions()}), stable for the whole window
 * ({@link #getStableDevices()}), or with fewer than two samples ({@link #getDevicesWithoutData()}).
 */
public final class TransitionScan {

    private final TransitionWindow window;
    private final List<TransitionEvent> transitions;
    private final List<String> stableDevices;
    private final List<String> devicesWithoutData;

    public TransitionScan(TransitionWindow window, List<TransitionEvent> transitions,
                          List<String> stableDevices, List<String> devicesWithoutData) {
        this.window = window;
        this.transitions = List.copyOf(transitions);
        this.stableDevices = List.copyOf(stableDevices);
        this.devicesWithoutData = List.copyOf(devicesWithoutData);
    }

    public TransitionWindow getWindow() {
        return window;
    }

    public List<TransitionEvent> getTransitions() {
        return transitions;
    }

    public List<String> getStableDevices() {
        return stableDevices;
    }

    public List<String> getDevicesWithoutData() {
        return devicesWithoutData;
    }
}
