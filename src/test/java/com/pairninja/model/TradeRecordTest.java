package com.pairninja.model;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class TradeRecordTest {

    private static final Instant ENTRY = Instant.parse("2024-03-01T00:00:00Z");

    @Test
    public void testPairPnlSignsEachLeg() {
        // short ETH that fell 1%, long BTC that rose 1%
        double pnl = TradeRecord.pairPnl(TradeDirection.SHORT_ETH_LONG_BTC, 3000.0, 60_000.0, 2970.0, 60_600.0,
                10_000.0, 10_000.0);
        assertEquals(200.0, pnl, 1e-9);
    }

    @Test
    public void testJsonLine() {
        TradeRecord trade = new TradeRecord(TradeDirection.LONG_ETH_SHORT_BTC, ENTRY, ENTRY.plusSeconds(5400),
                3000.0, 60_000.0, 3030.0, 60_000.0, 10_000.0, 10_000.0, 100.0, 150.0, ExitReason.TAKE_PROFIT);

        JSONObject json = trade.toJson();

        assertEquals("LONG_ETH_SHORT_BTC", json.getString("direction"));
        assertEquals("2024-03-01T01:30:00Z", json.getString("exitTime"));
        assertEquals(1.5, json.getDouble("holdingHours"), 1e-12);
        assertEquals("TAKE_PROFIT", json.getString("exitReason"));
        assertEquals(150.0, json.getDouble("cumulativePnl"), 1e-12);
    }
}
