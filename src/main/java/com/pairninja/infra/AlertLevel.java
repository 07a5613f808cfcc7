package com.pairninja.infra;

public enum AlertLevel {
    INFO,
    WARNING,
    CRITICAL
}
