package com.pairninja.infra;

import com.pairninja.engine.execution.OrderExecutionException;
import com.pairninja.model.Instrument;
import com.pairninja.model.OrderRequest;
import com.pairninja.model.OrderSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Simulated futures venue for backtesting.
 *
 * Fills every order immediately and completely at the current bar price moved
 * against the order by the slippage allowance. Tracks signed positions per
 * instrument and a virtual balance that the backtest settles after each round
 * trip. Never rejects an order for which a price is known.
 */
public class SimulatedFuturesExchange implements OrderTransport, AccountBalanceSource {
    private static final Logger logger = LoggerFactory.getLogger(SimulatedFuturesExchange.class);

    private final double slippageBps;
    private double virtualBalance;
    private Instant currentTime = Instant.EPOCH;
    private final Map<Instrument, Double> currentPrices = new EnumMap<>(Instrument.class);
    private final Map<Instrument, Double> positions = new EnumMap<>(Instrument.class);
    private final List<Fill> fills = new ArrayList<>();

    /**
     * One executed order.
     */
    public static class Fill {
        public final Instant timestamp;
        public final Instrument symbol;
        public final OrderSide side;
        public final double quantity;
        public final double price;
        public final boolean reduceOnly;

        public Fill(Instant timestamp, Instrument symbol, OrderSide side, double quantity, double price,
                boolean reduceOnly) {
            this.timestamp = timestamp;
            this.symbol = symbol;
            this.side = side;
            this.quantity = quantity;
            this.price = price;
            this.reduceOnly = reduceOnly;
        }
    }

    public SimulatedFuturesExchange(double initialBalance, double slippageBps) {
        this.virtualBalance = initialBalance;
        this.slippageBps = slippageBps;
        for (Instrument instrument : Instrument.values()) {
            positions.put(instrument, 0.0);
        }
        logger.info("Simulated exchange initialized: balance={}, slippage={}bps", initialBalance, slippageBps);
    }

    /**
     * Advance the simulation clock and prices to a new bar.
     */
    public void onBar(Instant timestamp, double ethPrice, double btcPrice) {
        this.currentTime = timestamp;
        currentPrices.put(Instrument.ETH_PERP, ethPrice);
        currentPrices.put(Instrument.BTC_PERP, btcPrice);
    }

    @Override
    public double submit(OrderRequest request) throws OrderExecutionException {
        return fill(request, false);
    }

    @Override
    public double close(OrderRequest request) throws OrderExecutionException {
        return fill(request, true);
    }

    private double fill(OrderRequest request, boolean reduceOnly) throws OrderExecutionException {
        Double price = currentPrices.get(request.getSymbol());
        if (price == null) {
            throw OrderExecutionException.rejected("No simulated price for " + request.getSymbol());
        }
        double slip = slippageBps / 10_000.0;
        double fillPrice = request.getSide() == OrderSide.BUY ? price * (1 + slip) : price * (1 - slip);
        double quantity = request.getQuantity();
        positions.merge(request.getSymbol(), request.getSide().sign() * quantity, Double::sum);
        fills.add(new Fill(currentTime, request.getSymbol(), request.getSide(), quantity, fillPrice, reduceOnly));
        logger.debug("✅ SIM {} {} {} @ {}", request.getSide(), quantity, request.getSymbol(), fillPrice);
        return quantity;
    }

    @Override
    public double fetchEquity() {
        return virtualBalance;
    }

    /**
     * Book realized PnL net of costs into the virtual balance.
     */
    public void settle(double netPnl) {
        virtualBalance += netPnl;
    }

    public double getPosition(Instrument instrument) {
        return positions.get(instrument);
    }

    public List<Fill> getFills() {
        return new ArrayList<>(fills);
    }
}
