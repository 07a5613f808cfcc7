package com.pairninja.engine.execution;

import com.pairninja.infra.MockOrderTransport;
import com.pairninja.model.Instrument;
import com.pairninja.model.OrderRequest;
import com.pairninja.model.OrderSide;
import com.pairninja.model.PositionLeg;
import com.pairninja.model.PositionSnapshot;
import com.pairninja.model.TradeDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class ExecutionCoordinatorTest {

    private MockOrderTransport transport;
    private ExecutionCoordinator coordinator;

    private final OrderRequest ethBuy = OrderRequest.market(Instrument.ETH_PERP, OrderSide.BUY, 8.0, 3000.0);
    private final OrderRequest btcSell = OrderRequest.market(Instrument.BTC_PERP, OrderSide.SELL, 0.4, 60000.0);

    @BeforeEach
    public void setUp() {
        transport = new MockOrderTransport();
        coordinator = new ExecutionCoordinator(transport, new RetryPolicy(3, 1));
    }

    @Test
    public void testOpenPairFillsBothLegsInOrder() throws OrderExecutionException {
        PairFill fill = coordinator.openPair(ethBuy, btcSell);

        assertEquals(8.0, fill.getFirstFilled());
        assertEquals(0.4, fill.getSecondFilled());
        assertEquals(2, transport.getCalls().size());
        assertEquals(Instrument.ETH_PERP, transport.getCalls().get(0).request.getSymbol());
        assertEquals(Instrument.BTC_PERP, transport.getCalls().get(1).request.getSymbol());
    }

    @Test
    public void testFirstLegFailureNeverSendsSecondLeg() {
        transport.failSubmit(Instrument.ETH_PERP, OrderExecutionException.Kind.REJECTED, 1);

        OrderExecutionException e = assertThrows(OrderExecutionException.class,
                () -> coordinator.openPair(ethBuy, btcSell));
        assertEquals(OrderExecutionException.Kind.REJECTED, e.getKind());
        assertEquals(0, transport.countSubmits(Instrument.BTC_PERP));
        assertEquals(1, transport.getCalls().size());
    }

    @Test
    public void testSecondLegFailureRollsBackFirstExactlyOnce() {
        transport.failSubmit(Instrument.BTC_PERP, OrderExecutionException.Kind.REJECTED, 1);

        OrderExecutionException e = assertThrows(OrderExecutionException.class,
                () -> coordinator.openPair(ethBuy, btcSell));
        assertEquals(OrderExecutionException.Kind.PARTIAL_FILL, e.getKind());
        assertTrue(e.isHedgeIntegrityFailure());
        assertEquals(1, transport.countCloses(Instrument.ETH_PERP));

        MockOrderTransport.Call rollback = transport.getCalls().get(2);
        assertTrue(rollback.close);
        assertEquals(OrderSide.SELL, rollback.request.getSide());
        assertEquals(8.0, rollback.request.getQuantity());
    }

    @Test
    public void testFailedRollbackIsResidual() {
        transport.failSubmit(Instrument.BTC_PERP, OrderExecutionException.Kind.REJECTED, 1);
        transport.failClose(Instrument.ETH_PERP, OrderExecutionException.Kind.REJECTED, 1);

        OrderExecutionException e = assertThrows(OrderExecutionException.class,
                () -> coordinator.openPair(ethBuy, btcSell));
        assertEquals(OrderExecutionException.Kind.RESIDUAL, e.getKind());
        assertTrue(e.requiresRepair());
        assertEquals(Instrument.ETH_PERP, e.getResidualSymbol());
        assertEquals(8.0, e.getResidualQuantity());
        assertEquals(1, transport.countCloses(Instrument.ETH_PERP));
    }

    @Test
    public void testTransientFailuresAreRetried() throws OrderExecutionException {
        transport.failSubmit(Instrument.ETH_PERP, OrderExecutionException.Kind.TRANSIENT, 2);

        coordinator.openPair(ethBuy, btcSell);
        assertEquals(3, transport.countSubmits(Instrument.ETH_PERP));
        assertEquals(1, transport.countSubmits(Instrument.BTC_PERP));
    }

    @Test
    public void testRetriesAreBounded() {
        transport.failSubmit(Instrument.ETH_PERP, OrderExecutionException.Kind.TRANSIENT, 5);

        OrderExecutionException e = assertThrows(OrderExecutionException.class,
                () -> coordinator.openPair(ethBuy, btcSell));
        assertEquals(OrderExecutionException.Kind.TRANSIENT, e.getKind());
        assertFalse(e.requiresRepair());
        assertEquals(3, transport.countSubmits(Instrument.ETH_PERP));
    }

    @Test
    public void testRejectionIsNotRetried() {
        transport.failSubmit(Instrument.ETH_PERP, OrderExecutionException.Kind.REJECTED, 1);
        assertThrows(OrderExecutionException.class, () -> coordinator.openPair(ethBuy, btcSell));
        assertEquals(1, transport.countSubmits(Instrument.ETH_PERP));
    }

    @Test
    public void testZeroAttemptsSendsNothing() {
        ExecutionCoordinator none = new ExecutionCoordinator(transport, new RetryPolicy(0, 1));
        OrderExecutionException e = assertThrows(OrderExecutionException.class,
                () -> none.openPair(ethBuy, btcSell));
        assertEquals(OrderExecutionException.Kind.NO_ATTEMPT, e.getKind());
        assertTrue(transport.getCalls().isEmpty());
    }

    @Test
    public void testSecondCloseFailureIsResidualAndFirstLegStaysClosed() {
        OrderRequest closeEth = OrderRequest.market(Instrument.ETH_PERP, OrderSide.SELL, 8.0, 3100.0);
        OrderRequest closeBtc = OrderRequest.market(Instrument.BTC_PERP, OrderSide.BUY, 0.4, 61000.0);
        transport.failClose(Instrument.BTC_PERP, OrderExecutionException.Kind.REJECTED, 1);

        OrderExecutionException e = assertThrows(OrderExecutionException.class,
                () -> coordinator.closePair(closeEth, closeBtc));
        assertEquals(OrderExecutionException.Kind.RESIDUAL, e.getKind());
        assertEquals(Instrument.BTC_PERP, e.getResidualSymbol());
        assertEquals(-0.4, e.getResidualQuantity());
        assertEquals(0, transport.countSubmits(Instrument.ETH_PERP), "closed leg must not be re-opened");
    }

    @Test
    public void testFirstCloseFailureLeavesPositionUntouched() {
        OrderRequest closeEth = OrderRequest.market(Instrument.ETH_PERP, OrderSide.SELL, 8.0, 3100.0);
        OrderRequest closeBtc = OrderRequest.market(Instrument.BTC_PERP, OrderSide.BUY, 0.4, 61000.0);
        transport.failClose(Instrument.ETH_PERP, OrderExecutionException.Kind.REJECTED, 1);

        OrderExecutionException e = assertThrows(OrderExecutionException.class,
                () -> coordinator.closePair(closeEth, closeBtc));
        assertEquals(OrderExecutionException.Kind.REJECTED, e.getKind());
        assertEquals(0, transport.countCloses(Instrument.BTC_PERP));
    }

    @Test
    public void testRepairClosesOnlyOpenLeg() throws OrderExecutionException {
        PositionSnapshot residual = new PositionSnapshot(TradeDirection.LONG_ETH_SHORT_BTC,
                Instant.parse("2024-03-01T00:00:00Z"), PositionLeg.flat(), new PositionLeg(-0.4, 60000.0, 24000.0));

        assertEquals(1, coordinator.repairResidual(residual, 3000.0, 61000.0));
        MockOrderTransport.Call call = transport.getCalls().get(0);
        assertTrue(call.close);
        assertEquals(Instrument.BTC_PERP, call.request.getSymbol());
        assertEquals(OrderSide.BUY, call.request.getSide());
        assertEquals(0.4, call.request.getQuantity());
    }

    @Test
    public void testRepairOfFlatPositionSendsNothing() throws OrderExecutionException {
        PositionSnapshot flat = new PositionSnapshot(TradeDirection.LONG_ETH_SHORT_BTC,
                Instant.parse("2024-03-01T00:00:00Z"), PositionLeg.flat(), PositionLeg.flat());
        assertEquals(0, coordinator.repairResidual(flat, 3000.0, 60000.0));
        assertEquals(0, coordinator.repairResidual(null));
        assertTrue(transport.getCalls().isEmpty());
    }

    @Test
    public void testRetryPolicyWorstCaseDelay() {
        assertEquals(1 + 2 + 4, new RetryPolicy(4, 1).worstCaseDelayMs());
        assertEquals(0, new RetryPolicy(1, 100).worstCaseDelayMs());
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, 1));
    }
}
