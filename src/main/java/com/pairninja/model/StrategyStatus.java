package com.pairninja.model;

public enum StrategyStatus {
    FLAT,
    IN_POSITION,
    COOLDOWN
}
