package com.pairninja.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Everything the strategy consumes for one bar: paired prices and, when the
 * source has them, funding rates.
 */
public final class MarketSnapshot {

    private final PriceSnapshot prices;
    private final FundingSnapshot funding;

    public MarketSnapshot(PriceSnapshot prices, FundingSnapshot funding) {
        this.prices = Objects.requireNonNull(prices, "prices");
        this.funding = funding;
    }

    public Instant getTimestamp() {
        return prices.getTimestamp();
    }

    public PriceSnapshot getPrices() {
        return prices;
    }

    /**
     * @return funding for both legs, or null when unavailable this bar
     */
    public FundingSnapshot getFunding() {
        return funding;
    }
}
