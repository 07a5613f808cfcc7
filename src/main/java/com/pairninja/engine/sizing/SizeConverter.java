package com.pairninja.engine.sizing;

import com.pairninja.config.InstrumentConstraints;
import com.pairninja.config.MinSizePolicy;
import com.pairninja.config.QtyRoundingMode;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Converts a notional into an exchange-valid quantity.
 *
 * The raw quantity notional / price is snapped to the step size with the
 * configured rounding mode, then to the quantity precision. Results below the
 * minimum quantity or minimum notional are either rejected (SKIP) or bumped up
 * to the smallest valid quantity (ADJUST).
 */
public class SizeConverter {

    private final InstrumentConstraints constraints;
    private final MinSizePolicy policy;

    public SizeConverter(InstrumentConstraints constraints, MinSizePolicy policy) {
        if (!(constraints.stepSize > 0)) {
            throw new IllegalArgumentException("Step size must be > 0, got " + constraints.stepSize);
        }
        this.constraints = constraints;
        this.policy = policy;
    }

    public double convert(double notional, double price) throws SizingException {
        if (!(price > 0)) {
            throw new SizingException("Price must be > 0, got " + price);
        }
        if (!(notional > 0)) {
            throw new SizingException("Notional must be > 0, got " + notional);
        }
        BigDecimal priceValue = BigDecimal.valueOf(price);
        BigDecimal raw = BigDecimal.valueOf(notional).divide(priceValue, MathContext.DECIMAL64);
        BigDecimal qty = snap(raw, toJavaRounding(constraints.roundingMode));

        if (!isBelowMinimum(qty, priceValue)) {
            return qty.doubleValue();
        }
        if (policy == MinSizePolicy.SKIP) {
            throw new BelowMinimumException(String.format(
                    "Quantity %s (notional %.2f) below minimum qty %s / notional %s",
                    qty.toPlainString(), qty.multiply(priceValue).doubleValue(),
                    constraints.minQty, constraints.minNotional));
        }
        BigDecimal minByNotional = BigDecimal.valueOf(constraints.minNotional)
                .divide(priceValue, MathContext.DECIMAL64);
        BigDecimal target = minByNotional.max(BigDecimal.valueOf(constraints.minQty));
        return snap(target, RoundingMode.CEILING).doubleValue();
    }

    private BigDecimal snap(BigDecimal raw, RoundingMode mode) {
        BigDecimal step = BigDecimal.valueOf(constraints.stepSize);
        BigDecimal steps = raw.divide(step, 0, mode);
        return steps.multiply(step).setScale(constraints.qtyPrecision, mode);
    }

    private boolean isBelowMinimum(BigDecimal qty, BigDecimal price) {
        return qty.compareTo(BigDecimal.valueOf(constraints.minQty)) < 0
                || qty.multiply(price).compareTo(BigDecimal.valueOf(constraints.minNotional)) < 0;
    }

    private static RoundingMode toJavaRounding(QtyRoundingMode mode) {
        return switch (mode) {
            case FLOOR -> RoundingMode.FLOOR;
            case CEIL -> RoundingMode.CEILING;
            case ROUND -> RoundingMode.HALF_UP;
        };
    }
}
