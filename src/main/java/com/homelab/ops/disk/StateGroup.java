package com.homelab.ops.disk;

/**
 * Coarse power-state groups used for transition detection.
 * Moving between raw codes of the same group is not a transition.
 */
public enum StateGroup {
    ACTIVE,
    STANDBY,
    ERROR
}
