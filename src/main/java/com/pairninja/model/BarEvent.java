package com.pairninja.model;

/**
 * Tags attached to a bar outcome describing what happened on that bar.
 */
public enum BarEvent {
    WARMING_UP,
    ENTRY_SIGNAL,
    FUNDING_VETO,
    BELOW_MINIMUM,
    ENTERED,
    ENTRY_FAILED,
    EXIT_SIGNAL,
    EXITED,
    EXIT_FAILED,
    RESIDUAL_REPAIRED,
    RESIDUAL_FLAGGED,
    COOLDOWN_EXPIRED,
    STATE_NOT_SAVED
}
