package com.pairninja.model;

import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-bar outcome record. Emitted for every processed bar, including bars
 * where nothing happened. Nullable fields are not available on that bar.
 */
public class BarOutcome {

    public Instant timestamp;
    public Double ethPrice;
    public Double btcPrice;

    // Indicators
    public Double r;
    public Double mean;
    public Double sigma;
    public Double sigmaEff;
    public Double zscore;
    public Double volEth;
    public Double volBtc;

    // Sizing
    public Double weightEth;
    public Double weightBtc;
    public Double notionalEth;
    public Double notionalBtc;

    // Funding
    public Double fundingEth;
    public Double fundingBtc;
    public Double fundingCostEstimate;
    public Boolean fundingVeto;
    public Double effectiveEntryZ;

    public StrategyStatus status;
    public PositionSnapshot position;
    public final List<BarEvent> events = new ArrayList<>();

    /** Completed round trip, set on the bar the pair was closed. */
    public TradeRecord trade;

    public BarOutcome(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public boolean hasEvent(BarEvent event) {
        return events.contains(event);
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("timestamp", timestamp.toString());
        json.putOpt("ethPrice", ethPrice);
        json.putOpt("btcPrice", btcPrice);
        json.putOpt("r", r);
        json.putOpt("mean", mean);
        json.putOpt("sigma", sigma);
        json.putOpt("sigmaEff", sigmaEff);
        json.putOpt("zscore", zscore);
        json.putOpt("volEth", volEth);
        json.putOpt("volBtc", volBtc);
        json.putOpt("weightEth", weightEth);
        json.putOpt("weightBtc", weightBtc);
        json.putOpt("notionalEth", notionalEth);
        json.putOpt("notionalBtc", notionalBtc);
        json.putOpt("fundingEth", fundingEth);
        json.putOpt("fundingBtc", fundingBtc);
        json.putOpt("fundingCostEstimate", fundingCostEstimate);
        json.putOpt("fundingVeto", fundingVeto);
        json.putOpt("effectiveEntryZ", effectiveEntryZ);
        json.put("status", status != null ? status.name() : JSONObject.NULL);
        JSONArray tags = new JSONArray();
        for (BarEvent event : events) {
            tags.put(event.name());
        }
        json.put("events", tags);
        return json;
    }
}
