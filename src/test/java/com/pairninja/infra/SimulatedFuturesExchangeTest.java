package com.pairninja.infra;

import com.pairninja.engine.execution.OrderExecutionException;
import com.pairninja.model.Instrument;
import com.pairninja.model.OrderRequest;
import com.pairninja.model.OrderSide;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class SimulatedFuturesExchangeTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    @Test
    public void testRejectsBeforeFirstBar() {
        SimulatedFuturesExchange exchange = new SimulatedFuturesExchange(10_000.0, 5.0);
        OrderExecutionException e = assertThrows(OrderExecutionException.class,
                () -> exchange.submit(OrderRequest.market(Instrument.ETH_PERP, OrderSide.BUY, 1.0, 3000.0)));
        assertEquals(OrderExecutionException.Kind.REJECTED, e.getKind());
    }

    @Test
    public void testFillsWithSlippageAgainstTheOrder() throws OrderExecutionException {
        SimulatedFuturesExchange exchange = new SimulatedFuturesExchange(10_000.0, 10.0);
        exchange.onBar(T0, 3000.0, 60_000.0);

        assertEquals(2.0, exchange.submit(OrderRequest.market(Instrument.ETH_PERP, OrderSide.BUY, 2.0, 3000.0)));
        assertEquals(0.1, exchange.submit(OrderRequest.market(Instrument.BTC_PERP, OrderSide.SELL, 0.1, 60_000.0)));

        assertEquals(3003.0, exchange.getFills().get(0).price, 1e-9);
        assertEquals(59_940.0, exchange.getFills().get(1).price, 1e-9);
        assertEquals(2.0, exchange.getPosition(Instrument.ETH_PERP));
        assertEquals(-0.1, exchange.getPosition(Instrument.BTC_PERP));
    }

    @Test
    public void testCloseFlattensAndSettleBooksPnl() throws OrderExecutionException {
        SimulatedFuturesExchange exchange = new SimulatedFuturesExchange(10_000.0, 0.0);
        exchange.onBar(T0, 3000.0, 60_000.0);
        exchange.submit(OrderRequest.market(Instrument.ETH_PERP, OrderSide.SELL, 1.5, 3000.0));
        exchange.onBar(T0.plusSeconds(900), 2990.0, 60_000.0);
        exchange.close(OrderRequest.market(Instrument.ETH_PERP, OrderSide.BUY, 1.5, 2990.0));

        assertEquals(0.0, exchange.getPosition(Instrument.ETH_PERP), 1e-12);
        assertTrue(exchange.getFills().get(1).reduceOnly);

        exchange.settle(15.0);
        assertEquals(10_015.0, exchange.fetchEquity());
    }
}
