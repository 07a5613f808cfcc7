package com.pairninja.infra.repository;

import com.pairninja.model.FundingRate;
import com.pairninja.model.FundingSnapshot;
import com.pairninja.model.Instrument;
import com.pairninja.model.MarketSnapshot;
import com.pairninja.model.PriceBar;
import com.pairninja.model.PriceField;
import com.pairninja.model.PriceSnapshot;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

public class MarketSnapshotMapperTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:15:00Z");

    @Test
    public void testSnapshotWithMarkAndFunding() {
        PriceSnapshot prices = new PriceSnapshot(
                new PriceBar(Instrument.ETH_PERP, T0, null, 3001.2, 3000.5),
                new PriceBar(Instrument.BTC_PERP, T0, null, 60_010.0, 60_000.0));
        FundingSnapshot funding = new FundingSnapshot(
                new FundingRate(Instrument.ETH_PERP, 0.0001, T0.minusSeconds(900), 8),
                new FundingRate(Instrument.BTC_PERP, -0.00002, T0.minusSeconds(900), 8));

        Document doc = MarketSnapshotMapper.toDocument(new MarketSnapshot(prices, funding));
        assertEquals(Date.from(T0), doc.getDate("_id"));

        MarketSnapshot restored = MarketSnapshotMapper.fromDocument(doc);
        assertEquals(T0, restored.getTimestamp());
        assertEquals(prices.getEth(), restored.getPrices().getEth());
        assertEquals(60_010.0, restored.getPrices().btcPrice(PriceField.MARK));
        assertEquals(-0.00002, restored.getFunding().getBtc().getRate());
        assertEquals(8, restored.getFunding().getIntervalHours());
    }

    @Test
    public void testSnapshotWithoutFunding() {
        Document doc = MarketSnapshotMapper.toDocument(
                new MarketSnapshot(PriceSnapshot.ofClose(T0, 3000.0, 60_000.0), null));

        MarketSnapshot restored = MarketSnapshotMapper.fromDocument(doc);
        assertNull(restored.getFunding());
        assertNull(restored.getPrices().getEth().getMark());
        assertEquals(3000.0, restored.getPrices().ethPrice(PriceField.CLOSE));
    }

    @Test
    public void testMissingLegIsRejected() {
        Document doc = new Document("_id", Date.from(T0))
                .append("eth", new Document("close", 3000.0).append("mark", null).append("mid", null));
        assertThrows(IllegalArgumentException.class, () -> MarketSnapshotMapper.fromDocument(doc));
    }
}
