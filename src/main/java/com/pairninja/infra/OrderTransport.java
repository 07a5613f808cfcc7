package com.pairninja.infra;

import com.pairninja.engine.execution.OrderExecutionException;
import com.pairninja.model.OrderRequest;

/**
 * Sends single-leg orders to the exchange.
 */
public interface OrderTransport {

    /**
     * Open or increase a position.
     *
     * @return filled quantity (> 0)
     * @throws OrderExecutionException TRANSIENT for retryable failures, REJECTED otherwise
     */
    double submit(OrderRequest request) throws OrderExecutionException;

    /**
     * Reduce or close a position. Implementations send the order reduce-only
     * where the venue supports it.
     *
     * @return filled quantity (> 0)
     */
    double close(OrderRequest request) throws OrderExecutionException;
}
