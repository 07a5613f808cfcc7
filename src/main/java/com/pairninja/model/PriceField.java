package com.pairninja.model;

/**
 * Which observed price drives the signal. Each field falls back to the others
 * when it is missing on a bar.
 */
public enum PriceField {
    MID,
    MARK,
    CLOSE
}
