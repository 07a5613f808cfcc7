package com.pairninja.infra.repository;

import com.pairninja.model.Instrument;
import com.pairninja.model.PositionLeg;
import com.pairninja.model.PositionSnapshot;
import com.pairninja.model.StrategyState;
import com.pairninja.model.StrategyStatus;
import com.pairninja.model.TradeDirection;
import com.pairninja.model.TradeRecord;
import org.bson.Document;

import java.time.Instant;
import java.util.Date;

/**
 * Converts strategy state and trade records to and from BSON documents.
 * Timestamps are stored as BSON dates (millisecond precision).
 */
public final class StrategyStateMapper {

    private StrategyStateMapper() {
    }

    public static Document toDocument(String strategyId, StrategyState state) {
        Document doc = new Document("_id", strategyId)
                .append("status", state.getStatus().name())
                .append("cooldownUntil", toDate(state.getCooldownUntil()))
                .append("updatedAt", new Date());
        PositionSnapshot position = state.getPosition();
        doc.append("position", position == null ? null : toDocument(position));
        return doc;
    }

    public static StrategyState fromDocument(Document doc) {
        StrategyStatus status = StrategyStatus.valueOf(doc.getString("status"));
        Document positionDoc = doc.get("position", Document.class);
        PositionSnapshot position = positionDoc == null ? null : positionFromDocument(positionDoc);
        return new StrategyState(status, position, toInstant(doc.getDate("cooldownUntil")));
    }

    static Document toDocument(PositionSnapshot position) {
        return new Document("direction", position.getDirection().name())
                .append("entryTime", toDate(position.getEntryTime()))
                .append("eth", toDocument(position.leg(Instrument.ETH_PERP)))
                .append("btc", toDocument(position.leg(Instrument.BTC_PERP)));
    }

    static PositionSnapshot positionFromDocument(Document doc) {
        return new PositionSnapshot(
                TradeDirection.valueOf(doc.getString("direction")),
                toInstant(doc.getDate("entryTime")),
                legFromDocument(doc.get("eth", Document.class)),
                legFromDocument(doc.get("btc", Document.class)));
    }

    private static Document toDocument(PositionLeg leg) {
        return new Document("quantity", leg.getQuantity())
                .append("avgPrice", leg.getAvgPrice())
                .append("notional", leg.getNotional());
    }

    private static PositionLeg legFromDocument(Document doc) {
        if (doc == null) {
            return PositionLeg.flat();
        }
        return new PositionLeg(doc.getDouble("quantity"), doc.getDouble("avgPrice"), doc.getDouble("notional"));
    }

    public static Document toDocument(String strategyId, TradeRecord trade) {
        return new Document("strategyId", strategyId)
                .append("direction", trade.getDirection().name())
                .append("entryTime", toDate(trade.getEntryTime()))
                .append("exitTime", toDate(trade.getExitTime()))
                .append("entryEthPrice", trade.getEntryEthPrice())
                .append("entryBtcPrice", trade.getEntryBtcPrice())
                .append("exitEthPrice", trade.getExitEthPrice())
                .append("exitBtcPrice", trade.getExitBtcPrice())
                .append("notionalEth", trade.getNotionalEth())
                .append("notionalBtc", trade.getNotionalBtc())
                .append("realizedPnl", trade.getRealizedPnl())
                .append("cumulativePnl", trade.getCumulativePnl())
                .append("exitReason", trade.getExitReason().name())
                .append("holdingHours", trade.holdingHours());
    }

    private static Date toDate(Instant instant) {
        return instant == null ? null : Date.from(instant);
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }
}
