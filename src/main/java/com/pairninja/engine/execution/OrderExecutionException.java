package com.pairninja.engine.execution;

import com.pairninja.model.Instrument;

/**
 * Failure of an order or of a two-leg operation.
 *
 * Kinds:
 * - TRANSIENT: retryable (timeouts, rate limits, 5xx)
 * - REJECTED: terminal, no further attempts
 * - NO_ATTEMPT: the retry policy allows zero attempts, nothing was sent
 * - PARTIAL_FILL: one leg filled, the other failed, the filled leg was rolled back
 * - RESIDUAL: one leg is still open after a failed rollback or a failed second close
 *
 * PARTIAL_FILL and RESIDUAL are hedge-integrity failures and must always be
 * escalated. RESIDUAL carries the leg left open.
 */
public class OrderExecutionException extends Exception {

    public enum Kind {
        TRANSIENT,
        REJECTED,
        NO_ATTEMPT,
        PARTIAL_FILL,
        RESIDUAL
    }

    private final Kind kind;
    private final Instrument residualSymbol;
    private final double residualQuantity;

    public OrderExecutionException(Kind kind, String message) {
        this(kind, message, null, null, 0.0);
    }

    public OrderExecutionException(Kind kind, String message, Throwable cause) {
        this(kind, message, cause, null, 0.0);
    }

    private OrderExecutionException(Kind kind, String message, Throwable cause, Instrument residualSymbol,
            double residualQuantity) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
        this.residualSymbol = residualSymbol;
        this.residualQuantity = residualQuantity;
    }

    public static OrderExecutionException transientError(String message, Throwable cause) {
        return new OrderExecutionException(Kind.TRANSIENT, message, cause);
    }

    public static OrderExecutionException rejected(String message) {
        return new OrderExecutionException(Kind.REJECTED, message);
    }

    public static OrderExecutionException noAttempt(String message) {
        return new OrderExecutionException(Kind.NO_ATTEMPT, message);
    }

    public static OrderExecutionException partialFill(String message, Throwable cause) {
        return new OrderExecutionException(Kind.PARTIAL_FILL, message, cause);
    }

    /**
     * @param residualQuantity signed quantity still open on the symbol
     */
    public static OrderExecutionException residual(String message, Instrument residualSymbol,
            double residualQuantity, Throwable cause) {
        return new OrderExecutionException(Kind.RESIDUAL, message, cause, residualSymbol, residualQuantity);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }

    public boolean isHedgeIntegrityFailure() {
        return kind == Kind.PARTIAL_FILL || kind == Kind.RESIDUAL;
    }

    public boolean requiresRepair() {
        return kind == Kind.RESIDUAL;
    }

    /**
     * Symbol of the leg left open, null unless the kind is RESIDUAL.
     */
    public Instrument getResidualSymbol() {
        return residualSymbol;
    }

    public double getResidualQuantity() {
        return residualQuantity;
    }
}
