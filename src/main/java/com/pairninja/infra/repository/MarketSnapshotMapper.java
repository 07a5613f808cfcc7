package com.pairninja.infra.repository;

import com.pairninja.model.FundingRate;
import com.pairninja.model.FundingSnapshot;
import com.pairninja.model.Instrument;
import com.pairninja.model.MarketSnapshot;
import com.pairninja.model.PriceBar;
import com.pairninja.model.PriceSnapshot;
import org.bson.Document;

import java.time.Instant;
import java.util.Date;

/**
 * BSON form of a paired bar. The bar close is the document id; absent price
 * fields and funding are stored as null.
 */
public final class MarketSnapshotMapper {

    private MarketSnapshotMapper() {
    }

    public static Document toDocument(MarketSnapshot snapshot) {
        PriceSnapshot prices = snapshot.getPrices();
        Document doc = new Document("_id", Date.from(snapshot.getTimestamp()))
                .append("eth", toDocument(prices.getEth()))
                .append("btc", toDocument(prices.getBtc()));
        FundingSnapshot funding = snapshot.getFunding();
        if (funding != null) {
            doc.append("funding", new Document("eth", funding.getEth().getRate())
                    .append("ethTime", Date.from(funding.getEth().getTimestamp()))
                    .append("btc", funding.getBtc().getRate())
                    .append("btcTime", Date.from(funding.getBtc().getTimestamp()))
                    .append("intervalHours", funding.getIntervalHours()));
        } else {
            doc.append("funding", null);
        }
        return doc;
    }

    public static MarketSnapshot fromDocument(Document doc) {
        Instant timestamp = doc.getDate("_id").toInstant();
        PriceSnapshot prices = new PriceSnapshot(
                barFromDocument(Instrument.ETH_PERP, timestamp, doc.get("eth", Document.class)),
                barFromDocument(Instrument.BTC_PERP, timestamp, doc.get("btc", Document.class)));
        Document fundingDoc = doc.get("funding", Document.class);
        FundingSnapshot funding = null;
        if (fundingDoc != null) {
            int interval = fundingDoc.getInteger("intervalHours");
            funding = new FundingSnapshot(
                    new FundingRate(Instrument.ETH_PERP, fundingDoc.getDouble("eth"),
                            fundingDoc.getDate("ethTime").toInstant(), interval),
                    new FundingRate(Instrument.BTC_PERP, fundingDoc.getDouble("btc"),
                            fundingDoc.getDate("btcTime").toInstant(), interval));
        }
        return new MarketSnapshot(prices, funding);
    }

    private static Document toDocument(PriceBar bar) {
        return new Document("close", bar.getClose())
                .append("mark", bar.getMark())
                .append("mid", bar.getMid());
    }

    private static PriceBar barFromDocument(Instrument symbol, Instant timestamp, Document doc) {
        if (doc == null) {
            throw new IllegalArgumentException("Stored bar " + timestamp + " has no " + symbol + " prices");
        }
        return new PriceBar(symbol, timestamp, doc.getDouble("mid"), doc.getDouble("mark"), doc.getDouble("close"));
    }
}
