package com.homelab.ops.disk;

import java.util.Map;

/**
 * Smallest window in which at least one disk changed state, with per-disk change counts.
 */
public final class TransitionWindowMatch {

    private final TransitionWindow window;
    private final Map<String, Integer> changeCounts;

    public TransitionWindowMatch(TransitionWindow window, Map<String, Integer> changeCounts) {
        this.window = window;
        this.changeCounts = Map.copyOf(changeCounts);
    }

    public TransitionWindow getWindow() {
        return window;
    }

    public Map<String, Integer> getChangeCounts() {
        return changeCounts;
    }
}
