package com.pairninja.model;

import org.json.JSONObject;

import java.time.Instant;
import java.util.Objects;

/**
 * A completed round trip of the pair.
 *
 * realizedPnl is the gross price PnL of both legs; costs are applied by the
 * caller that knows them (the backtest adds fees, slippage and funding).
 */
public final class TradeRecord {

    private final TradeDirection direction;
    private final Instant entryTime;
    private final Instant exitTime;
    private final double entryEthPrice;
    private final double entryBtcPrice;
    private final double exitEthPrice;
    private final double exitBtcPrice;
    private final double notionalEth;
    private final double notionalBtc;
    private final double realizedPnl;
    private final double cumulativePnl;
    private final ExitReason exitReason;

    public TradeRecord(TradeDirection direction, Instant entryTime, Instant exitTime,
            double entryEthPrice, double entryBtcPrice, double exitEthPrice, double exitBtcPrice,
            double notionalEth, double notionalBtc, double realizedPnl, double cumulativePnl,
            ExitReason exitReason) {
        this.direction = direction;
        this.entryTime = entryTime;
        this.exitTime = exitTime;
        this.entryEthPrice = entryEthPrice;
        this.entryBtcPrice = entryBtcPrice;
        this.exitEthPrice = exitEthPrice;
        this.exitBtcPrice = exitBtcPrice;
        this.notionalEth = notionalEth;
        this.notionalBtc = notionalBtc;
        this.realizedPnl = realizedPnl;
        this.cumulativePnl = cumulativePnl;
        this.exitReason = exitReason;
    }

    /**
     * Price PnL of a pair: each leg earns its relative move on its notional,
     * signed by the leg's side.
     */
    public static double pairPnl(TradeDirection direction, double entryEth, double entryBtc,
            double exitEth, double exitBtc, double notionalEth, double notionalBtc) {
        double ethMove = (exitEth - entryEth) / entryEth * notionalEth;
        double btcMove = (exitBtc - entryBtc) / entryBtc * notionalBtc;
        return direction.getEthSide().sign() * ethMove + direction.getBtcSide().sign() * btcMove;
    }

    public double holdingHours() {
        return Math.max(0L, exitTime.getEpochSecond() - entryTime.getEpochSecond()) / 3600.0;
    }

    public TradeDirection getDirection() {
        return direction;
    }

    public Instant getEntryTime() {
        return entryTime;
    }

    public Instant getExitTime() {
        return exitTime;
    }

    public double getEntryEthPrice() {
        return entryEthPrice;
    }

    public double getEntryBtcPrice() {
        return entryBtcPrice;
    }

    public double getExitEthPrice() {
        return exitEthPrice;
    }

    public double getExitBtcPrice() {
        return exitBtcPrice;
    }

    public double getNotionalEth() {
        return notionalEth;
    }

    public double getNotionalBtc() {
        return notionalBtc;
    }

    public double getRealizedPnl() {
        return realizedPnl;
    }

    public double getCumulativePnl() {
        return cumulativePnl;
    }

    public ExitReason getExitReason() {
        return exitReason;
    }

    public JSONObject toJson() {
        return new JSONObject()
                .put("direction", direction.name())
                .put("entryTime", entryTime.toString())
                .put("exitTime", exitTime.toString())
                .put("entryEthPrice", entryEthPrice)
                .put("entryBtcPrice", entryBtcPrice)
                .put("exitEthPrice", exitEthPrice)
                .put("exitBtcPrice", exitBtcPrice)
                .put("notionalEth", notionalEth)
                .put("notionalBtc", notionalBtc)
                .put("realizedPnl", realizedPnl)
                .put("cumulativePnl", cumulativePnl)
                .put("exitReason", exitReason.name())
                .put("holdingHours", holdingHours());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TradeRecord)) {
            return false;
        }
        TradeRecord other = (TradeRecord) o;
        return direction == other.direction
                && entryTime.equals(other.entryTime)
                && exitTime.equals(other.exitTime)
                && Double.compare(entryEthPrice, other.entryEthPrice) == 0
                && Double.compare(entryBtcPrice, other.entryBtcPrice) == 0
                && Double.compare(exitEthPrice, other.exitEthPrice) == 0
                && Double.compare(exitBtcPrice, other.exitBtcPrice) == 0
                && Double.compare(notionalEth, other.notionalEth) == 0
                && Double.compare(notionalBtc, other.notionalBtc) == 0
                && Double.compare(realizedPnl, other.realizedPnl) == 0
                && Double.compare(cumulativePnl, other.cumulativePnl) == 0
                && exitReason == other.exitReason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(direction, entryTime, exitTime, realizedPnl, exitReason);
    }

    @Override
    public String toString() {
        return "Trade{" + direction + " " + entryTime + " -> " + exitTime + ", pnl=" + realizedPnl
                + ", reason=" + exitReason + "}";
    }
}
