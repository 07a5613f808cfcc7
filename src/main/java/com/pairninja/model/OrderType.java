package com.pairninja.model;

public enum OrderType {
    MARKET,
    LIMIT
}
