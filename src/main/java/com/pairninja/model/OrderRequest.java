package com.pairninja.model;

import java.util.Objects;
import java.util.UUID;

/**
 * One leg's instruction to the exchange. The price is the reference price of
 * the bar (MARKET) or the limit price (LIMIT).
 *
 * Each request carries a client order id that stays the same across retries
 * of that request, so the exchange can tell a resend from a new order.
 */
public final class OrderRequest {

    private final Instrument symbol;
    private final OrderSide side;
    private final double quantity;
    private final OrderType type;
    private final double price;
    private final String clientOrderId;

    public OrderRequest(Instrument symbol, OrderSide side, double quantity, OrderType type, double price) {
        if (!(quantity > 0)) {
            throw new IllegalArgumentException("Order quantity must be > 0, got " + quantity);
        }
        if (!(price > 0)) {
            throw new InvalidPriceException("Order price must be > 0, got " + price);
        }
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.side = Objects.requireNonNull(side, "side");
        this.quantity = quantity;
        this.type = Objects.requireNonNull(type, "type");
        this.price = price;
        this.clientOrderId = "pn" + UUID.randomUUID().toString().replace("-", "");
    }

    public static OrderRequest market(Instrument symbol, OrderSide side, double quantity, double referencePrice) {
        return new OrderRequest(symbol, side, quantity, OrderType.MARKET, referencePrice);
    }

    /**
     * Same instrument and quantity, opposite side. Used to unwind a filled leg.
     */
    public OrderRequest reversed(double filledQuantity) {
        return new OrderRequest(symbol, side.opposite(), filledQuantity, type, price);
    }

    public Instrument getSymbol() {
        return symbol;
    }

    public OrderSide getSide() {
        return side;
    }

    public double getQuantity() {
        return quantity;
    }

    public OrderType getType() {
        return type;
    }

    public double getPrice() {
        return price;
    }

    public String getClientOrderId() {
        return clientOrderId;
    }

    @Override
    public String toString() {
        return side + " " + quantity + " " + symbol.getExchangeSymbol() + " " + type + " @ " + price;
    }
}
