package com.pairninja.infra;

import com.pairninja.model.OrderRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Paper trading: every order is reported as completely filled and nothing is
 * sent to the venue. Prices, funding and state persistence stay live.
 */
public class PaperOrderTransport implements OrderTransport {
    private static final Logger logger = LoggerFactory.getLogger(PaperOrderTransport.class);

    private final AtomicLong nextOrderId = new AtomicLong(1);

    @Override
    public double submit(OrderRequest request) {
        logger.info("[PAPER] Order #{} filled: {}", nextOrderId.getAndIncrement(), request);
        return request.getQuantity();
    }

    @Override
    public double close(OrderRequest request) {
        logger.info("[PAPER] Reduce-only order #{} filled: {}", nextOrderId.getAndIncrement(), request);
        return request.getQuantity();
    }
}
