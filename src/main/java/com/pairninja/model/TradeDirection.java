package com.pairninja.model;

/**
 * Direction of the relative-value trade.
 */
public enum TradeDirection {
    /** Ratio too low: buy ETH, sell BTC. */
    LONG_ETH_SHORT_BTC(OrderSide.BUY, OrderSide.SELL),
    /** Ratio too high: sell ETH, buy BTC. */
    SHORT_ETH_LONG_BTC(OrderSide.SELL, OrderSide.BUY);

    private final OrderSide ethSide;
    private final OrderSide btcSide;

    TradeDirection(OrderSide ethSide, OrderSide btcSide) {
        this.ethSide = ethSide;
        this.btcSide = btcSide;
    }

    public OrderSide getEthSide() {
        return ethSide;
    }

    public OrderSide getBtcSide() {
        return btcSide;
    }

    /**
     * Positive z means ETH is rich relative to BTC.
     */
    public static TradeDirection fromZScore(double zscore) {
        return zscore > 0 ? SHORT_ETH_LONG_BTC : LONG_ETH_SHORT_BTC;
    }
}
