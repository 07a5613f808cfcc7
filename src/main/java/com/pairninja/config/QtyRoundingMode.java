package com.pairninja.config;

/**
 * Rounding applied when snapping a quantity to the instrument step size.
 */
public enum QtyRoundingMode {
    FLOOR,
    CEIL,
    ROUND
}
