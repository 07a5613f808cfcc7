package com.pairninja.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Historical bar used for replay: one price per leg plus optional funding rates.
 */
public final class BacktestBar {

    private final Instant timestamp;
    private final double ethPrice;
    private final double btcPrice;
    private final Double fundingEth;
    private final Double fundingBtc;

    public BacktestBar(Instant timestamp, double ethPrice, double btcPrice, Double fundingEth, Double fundingBtc) {
        if (!(ethPrice > 0) || !(btcPrice > 0)) {
            throw new InvalidPriceException("Backtest bar prices must be > 0 at " + timestamp
                    + " (eth=" + ethPrice + ", btc=" + btcPrice + ")");
        }
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.ethPrice = ethPrice;
        this.btcPrice = btcPrice;
        this.fundingEth = fundingEth;
        this.fundingBtc = fundingBtc;
    }

    public BacktestBar(Instant timestamp, double ethPrice, double btcPrice) {
        this(timestamp, ethPrice, btcPrice, null, null);
    }

    public boolean hasFunding() {
        return fundingEth != null && fundingBtc != null;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getEthPrice() {
        return ethPrice;
    }

    public double getBtcPrice() {
        return btcPrice;
    }

    public Double getFundingEth() {
        return fundingEth;
    }

    public Double getFundingBtc() {
        return fundingBtc;
    }
}
