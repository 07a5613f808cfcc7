package com.pairninja.model;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class BarOutcomeTest {

    @Test
    public void testJsonOmitsMissingReadings() {
        BarOutcome outcome = new BarOutcome(Instant.parse("2024-03-01T00:15:00Z"));
        outcome.ethPrice = 3000.0;
        outcome.btcPrice = 60_000.0;
        outcome.r = Math.log(3000.0 / 60_000.0);
        outcome.status = StrategyStatus.FLAT;
        outcome.events.add(BarEvent.WARMING_UP);

        JSONObject json = outcome.toJson();

        assertEquals("2024-03-01T00:15:00Z", json.getString("timestamp"));
        assertEquals("FLAT", json.getString("status"));
        assertFalse(json.has("zscore"));
        assertEquals("WARMING_UP", json.getJSONArray("events").getString(0));
        assertTrue(outcome.hasEvent(BarEvent.WARMING_UP));
        assertFalse(outcome.hasEvent(BarEvent.ENTERED));
    }
}
