package com.pairninja.config;

/**
 * Sigma floor selection for the z-score denominator.
 */
public enum SigmaFloorMode {
    CONST,
    QUANTILE,
    EWMA_MIX
}
