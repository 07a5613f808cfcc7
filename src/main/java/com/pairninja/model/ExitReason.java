package com.pairninja.model;

/**
 * Why a position was closed, in evaluation priority order.
 */
public enum ExitReason {
    STOP_LOSS,
    TAKE_PROFIT,
    TIME_STOP
}
