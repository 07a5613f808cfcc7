package com.pairninja.model;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One instrument's observation at a bar close.
 */
public final class PriceBar {

    private final Instrument symbol;
    private final Instant timestamp;
    private final Double mid;
    private final Double mark;
    private final Double close;

    public PriceBar(Instrument symbol, Instant timestamp, Double mid, Double mark, Double close) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.mid = requirePositive(symbol, "mid", mid);
        this.mark = requirePositive(symbol, "mark", mark);
        this.close = requirePositive(symbol, "close", close);
    }

    public static PriceBar ofClose(Instrument symbol, Instant timestamp, double close) {
        return new PriceBar(symbol, timestamp, null, null, close);
    }

    private static Double requirePositive(Instrument symbol, String field, Double value) {
        if (value != null && (!(value > 0) || Double.isInfinite(value))) {
            throw new InvalidPriceException(symbol + " " + field + " price must be > 0, got " + value);
        }
        return value;
    }

    /**
     * Price for the requested field, falling back MID -> mark -> close,
     * MARK -> mid -> close, CLOSE -> mid -> mark.
     */
    public OptionalDouble effectivePrice(PriceField field) {
        Double first;
        Double second;
        Double third;
        switch (field) {
            case MARK:
                first = mark;
                second = mid;
                third = close;
                break;
            case CLOSE:
                first = close;
                second = mid;
                third = mark;
                break;
            case MID:
            default:
                first = mid;
                second = mark;
                third = close;
                break;
        }
        if (first != null) {
            return OptionalDouble.of(first);
        }
        if (second != null) {
            return OptionalDouble.of(second);
        }
        return third != null ? OptionalDouble.of(third) : OptionalDouble.empty();
    }

    /**
     * Like {@link #effectivePrice(PriceField)} but a bar without any price is rejected.
     */
    public double requirePrice(PriceField field) {
        OptionalDouble price = effectivePrice(field);
        if (price.isEmpty()) {
            throw new InvalidPriceException("No " + symbol + " price available at " + timestamp);
        }
        return price.getAsDouble();
    }

    public Instrument getSymbol() {
        return symbol;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Double getMid() {
        return mid;
    }

    public Double getMark() {
        return mark;
    }

    public Double getClose() {
        return close;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PriceBar)) {
            return false;
        }
        PriceBar other = (PriceBar) o;
        return symbol == other.symbol
                && timestamp.equals(other.timestamp)
                && Objects.equals(mid, other.mid)
                && Objects.equals(mark, other.mark)
                && Objects.equals(close, other.close);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbol, timestamp, mid, mark, close);
    }

    @Override
    public String toString() {
        return "PriceBar{" + symbol + " @ " + timestamp + ", mid=" + mid + ", mark=" + mark + ", close=" + close + "}";
    }
}
