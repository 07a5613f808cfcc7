package com.pairninja.engine.execution;

import com.pairninja.infra.OrderTransport;
import com.pairninja.model.Instrument;
import com.pairninja.model.OrderRequest;
import com.pairninja.model.OrderSide;
import com.pairninja.model.OrderType;
import com.pairninja.model.PositionLeg;
import com.pairninja.model.PositionSnapshot;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.core.functions.CheckedSupplier;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Atomic two-leg execution.
 *
 * Guarantees that one leg is never left open without the condition being
 * reported:
 * - openPair: a terminal failure of the first leg aborts before the second is
 *   sent; a terminal failure of the second leg triggers exactly one rollback of
 *   the first (PARTIAL_FILL), or RESIDUAL if the rollback fails too
 * - closePair: a failure of the second close after the first succeeded is
 *   RESIDUAL; the closed leg is never re-opened
 * - repairResidual: closes whatever legs are still open, no-op on a flat position
 *
 * Every single-leg call goes through a resilience4j Retry with exponential
 * backoff that only retries TRANSIENT failures.
 */
public class ExecutionCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private final OrderTransport transport;
    private final RetryPolicy policy;
    private final Retry retry;

    public ExecutionCoordinator(OrderTransport transport, RetryPolicy policy) {
        this.transport = transport;
        this.policy = policy;
        if (policy.getMaxAttempts() > 0) {
            RetryConfig retryConfig = RetryConfig.custom()
                    .maxAttempts(policy.getMaxAttempts())
                    .intervalFunction(IntervalFunction.ofExponentialBackoff(
                            Duration.ofMillis(Math.max(1L, policy.getBaseDelayMs())), 2.0))
                    .retryOnException(e -> e instanceof OrderExecutionException
                            && ((OrderExecutionException) e).isTransient())
                    .build();
            this.retry = Retry.of("pairExecution", retryConfig);
            retry.getEventPublisher()
                    .onRetry(event -> logger.warn("🔄 Order retry {}/{}: {}",
                            event.getNumberOfRetryAttempts(), policy.getMaxAttempts(),
                            event.getLastThrowable().getMessage()));
        } else {
            this.retry = null;
        }
    }

    /**
     * Open both legs of a pair, first leg first.
     *
     * @throws OrderExecutionException the first leg's failure as is (nothing open),
     *                                 PARTIAL_FILL (second failed, first rolled back) or
     *                                 RESIDUAL (second failed and the rollback failed)
     */
    public PairFill openPair(OrderRequest first, OrderRequest second) throws OrderExecutionException {
        double firstFilled;
        try {
            firstFilled = submitWithRetry(first);
        } catch (OrderExecutionException e) {
            logger.warn("⚠️ First leg {} failed, second leg not sent: {}", first, e.getMessage());
            throw e;
        }

        double secondFilled;
        try {
            secondFilled = submitWithRetry(second);
        } catch (OrderExecutionException secondFailure) {
            logger.error("❌ Second leg {} failed after first leg filled {}: {}. Rolling back first leg.",
                    second, firstFilled, secondFailure.getMessage());
            OrderRequest rollback = first.reversed(firstFilled);
            try {
                closeWithRetry(rollback);
            } catch (OrderExecutionException rollbackFailure) {
                double openQuantity = first.getSide().sign() * firstFilled;
                logger.error("🚨 Rollback of {} failed: {}. Residual {} {} left open.",
                        first.getSymbol(), rollbackFailure.getMessage(), openQuantity, first.getSymbol());
                OrderExecutionException residual = OrderExecutionException.residual(
                        "Rollback of " + first.getSymbol() + " failed after second leg failure",
                        first.getSymbol(), openQuantity, rollbackFailure);
                residual.addSuppressed(secondFailure);
                throw residual;
            }
            logger.warn("⚠️ First leg {} rolled back, pair is flat", first.getSymbol());
            throw OrderExecutionException.partialFill(
                    "Second leg " + second.getSymbol() + " failed, first leg rolled back", secondFailure);
        }

        logger.info("✅ Pair opened: {} filled {}, {} filled {}",
                first.getSymbol(), firstFilled, second.getSymbol(), secondFilled);
        return new PairFill(firstFilled, secondFilled);
    }

    /**
     * Close both legs of a pair, first leg first.
     *
     * @throws OrderExecutionException the first close's failure as is (position unchanged), or
     *                                 RESIDUAL when the second close fails after the first succeeded
     */
    public PairFill closePair(OrderRequest first, OrderRequest second) throws OrderExecutionException {
        double firstFilled;
        try {
            firstFilled = closeWithRetry(first);
        } catch (OrderExecutionException e) {
            logger.warn("⚠️ Close of first leg {} failed, position unchanged: {}", first, e.getMessage());
            throw e;
        }

        double secondFilled;
        try {
            secondFilled = closeWithRetry(second);
        } catch (OrderExecutionException secondFailure) {
            double openQuantity = -second.getSide().sign() * second.getQuantity();
            logger.error("🚨 Close of second leg {} failed after first leg closed: {}. Residual {} {} left open.",
                    second, secondFailure.getMessage(), openQuantity, second.getSymbol());
            throw OrderExecutionException.residual(
                    "Second close " + second.getSymbol() + " failed after first leg closed",
                    second.getSymbol(), openQuantity, secondFailure);
        }

        logger.info("✅ Pair closed: {} filled {}, {} filled {}",
                first.getSymbol(), firstFilled, second.getSymbol(), secondFilled);
        return new PairFill(firstFilled, secondFilled);
    }

    /**
     * Close every nonzero leg of the snapshot at the given reference prices.
     * Idempotent: a flat (or null) snapshot sends nothing.
     *
     * @return number of legs closed
     * @throws OrderExecutionException RESIDUAL when a leg could not be closed
     */
    public int repairResidual(PositionSnapshot position, double ethPrice, double btcPrice)
            throws OrderExecutionException {
        if (position == null || position.isFlat()) {
            return 0;
        }
        int closed = 0;
        for (Instrument instrument : Instrument.values()) {
            PositionLeg leg = position.leg(instrument);
            if (leg.isFlat()) {
                continue;
            }
            double price = instrument == Instrument.ETH_PERP ? ethPrice : btcPrice;
            OrderRequest request = new OrderRequest(instrument, OrderSide.closing(leg.getQuantity()),
                    Math.abs(leg.getQuantity()), OrderType.MARKET, price);
            try {
                closeWithRetry(request);
            } catch (OrderExecutionException e) {
                logger.error("🚨 Residual repair of {} failed: {}", instrument, e.getMessage());
                throw OrderExecutionException.residual("Residual repair of " + instrument + " failed",
                        instrument, leg.getQuantity(), e);
            }
            logger.info("🔧 Residual {} {} closed", leg.getQuantity(), instrument);
            closed++;
        }
        return closed;
    }

    /**
     * Repair at the legs' own average prices, used when no current price is known.
     */
    public int repairResidual(PositionSnapshot position) throws OrderExecutionException {
        if (position == null || position.isFlat()) {
            return 0;
        }
        return repairResidual(position, position.getEth().getAvgPrice(), position.getBtc().getAvgPrice());
    }

    private double submitWithRetry(OrderRequest request) throws OrderExecutionException {
        return withRetry(request, () -> checkFill(request, transport.submit(request)));
    }

    private double closeWithRetry(OrderRequest request) throws OrderExecutionException {
        return withRetry(request, () -> checkFill(request, transport.close(request)));
    }

    private double withRetry(OrderRequest request, CheckedSupplier<Double> call) throws OrderExecutionException {
        if (retry == null) {
            throw OrderExecutionException.noAttempt("Retry policy allows no attempts, " + request + " not sent");
        }
        try {
            return retry.executeCheckedSupplier(call);
        } catch (OrderExecutionException e) {
            throw e;
        } catch (Error e) {
            throw e;
        } catch (Throwable t) {
            throw new OrderExecutionException(OrderExecutionException.Kind.REJECTED,
                    "Unexpected failure sending " + request + ": " + t.getMessage(), t);
        }
    }

    private static double checkFill(OrderRequest request, double filled) throws OrderExecutionException {
        if (!(filled > 0)) {
            throw OrderExecutionException.rejected("No fill for " + request);
        }
        return filled;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
