package com.pairninja.config;

/**
 * How the capital allocated to one pair trade is determined.
 */
public enum CapitalMode {
    FIXED_NOTIONAL,
    EQUITY_RATIO
}
