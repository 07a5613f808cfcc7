package com.pairninja.config;

/**
 * What to do when a converted quantity is below the instrument minimum.
 */
public enum MinSizePolicy {
    SKIP,
    ADJUST
}
