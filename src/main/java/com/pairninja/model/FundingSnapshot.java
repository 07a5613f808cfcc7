package com.pairninja.model;

import java.util.Objects;

/**
 * Current funding for both legs. Both legs must settle on the same interval.
 */
public final class FundingSnapshot {

    private final FundingRate eth;
    private final FundingRate btc;

    public FundingSnapshot(FundingRate eth, FundingRate btc) {
        this.eth = Objects.requireNonNull(eth, "eth funding");
        this.btc = Objects.requireNonNull(btc, "btc funding");
        if (eth.getIntervalHours() != btc.getIntervalHours()) {
            throw new IllegalArgumentException("Funding intervals differ: ETH " + eth.getIntervalHours()
                    + "h vs BTC " + btc.getIntervalHours() + "h");
        }
    }

    public FundingRate getEth() {
        return eth;
    }

    public FundingRate getBtc() {
        return btc;
    }

    public int getIntervalHours() {
        return eth.getIntervalHours();
    }
}
