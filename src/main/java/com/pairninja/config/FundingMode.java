package com.pairninja.config;

/**
 * Funding cost control modes. Applied in declaration order.
 */
public enum FundingMode {
    FILTER,
    THRESHOLD,
    SIZE
}
