package com.pairninja.engine.state;

/**
 * What the orchestrator should do after startup recovery.
 */
public enum RecoveryAction {
    /** Close the residual leg recorded on the recovered state. */
    REPAIR_RESIDUAL,
    /** A hedged position stored under a non-position status was adopted as IN_POSITION. */
    RESUME_POSITION
}
