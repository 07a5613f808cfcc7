package com.pairninja.model;

import java.time.Instant;
import java.util.Objects;

/**
 * ETH and BTC bars observed at the same bar close.
 */
public final class PriceSnapshot {

    private final PriceBar eth;
    private final PriceBar btc;

    public PriceSnapshot(PriceBar eth, PriceBar btc) {
        this.eth = Objects.requireNonNull(eth, "eth bar");
        this.btc = Objects.requireNonNull(btc, "btc bar");
        if (eth.getSymbol() != Instrument.ETH_PERP || btc.getSymbol() != Instrument.BTC_PERP) {
            throw new IllegalArgumentException("Snapshot legs must be ETH_PERP and BTC_PERP, got "
                    + eth.getSymbol() + "/" + btc.getSymbol());
        }
        if (!eth.getTimestamp().equals(btc.getTimestamp())) {
            throw new IllegalArgumentException("Snapshot timestamps differ: " + eth.getTimestamp()
                    + " vs " + btc.getTimestamp());
        }
    }

    public static PriceSnapshot ofClose(Instant timestamp, double ethPrice, double btcPrice) {
        return new PriceSnapshot(
                PriceBar.ofClose(Instrument.ETH_PERP, timestamp, ethPrice),
                PriceBar.ofClose(Instrument.BTC_PERP, timestamp, btcPrice));
    }

    public Instant getTimestamp() {
        return eth.getTimestamp();
    }

    public PriceBar getEth() {
        return eth;
    }

    public PriceBar getBtc() {
        return btc;
    }

    public double ethPrice(PriceField field) {
        return eth.requirePrice(field);
    }

    public double btcPrice(PriceField field) {
        return btc.requirePrice(field);
    }

    public double price(Instrument instrument, PriceField field) {
        return instrument == Instrument.ETH_PERP ? ethPrice(field) : btcPrice(field);
    }
}
