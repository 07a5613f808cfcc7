package com.pairninja.model;

/**
 * The two perpetual contracts of the pair. ETH is the numerator of the
 * relative price, BTC the denominator.
 */
public enum Instrument {
    ETH_PERP("ETHUSDT"),
    BTC_PERP("BTCUSDT");

    private final String exchangeSymbol;

    Instrument(String exchangeSymbol) {
        this.exchangeSymbol = exchangeSymbol;
    }

    public String getExchangeSymbol() {
        return exchangeSymbol;
    }
}
