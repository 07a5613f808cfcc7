package com.pairninja.engine.indicator;

import com.pairninja.model.InvalidPriceException;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IndicatorMathTest {

    @Test
    public void testRelativePriceIsLogRatio() {
        double r = IndicatorMath.relativePrice(3000.0, 60000.0);
        assertEquals(Math.log(0.05), r, 1e-12);
    }

    @Test
    public void testRelativePriceRejectsNonPositivePrices() {
        assertThrows(InvalidPriceException.class, () -> IndicatorMath.relativePrice(0.0, 60000.0));
        assertThrows(InvalidPriceException.class, () -> IndicatorMath.relativePrice(3000.0, -1.0));
        assertThrows(InvalidPriceException.class, () -> IndicatorMath.relativePrice(Double.NaN, 60000.0));
    }

    @Test
    public void testLogReturn() {
        assertEquals(Math.log(1.1), IndicatorMath.logReturn(100.0, 110.0), 1e-12);
    }

    @Test
    public void testEwmaStdOfConstantSeriesIsZero() {
        List<Double> values = Collections.nCopies(50, 0.25);
        assertEquals(0.0, IndicatorMath.ewmaStd(values, 10.0).getAsDouble(), 1e-15);
    }

    @Test
    public void testEwmaStdNeedsTwoValues() {
        assertTrue(IndicatorMath.ewmaStd(List.of(1.0), 10.0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> IndicatorMath.ewmaStd(List.of(1.0, 2.0), 0.0));
    }

    @Test
    public void testEwmaStdPositiveForNoisySeries() {
        List<Double> values = List.of(0.0, 1.0, 0.0, 1.0, 0.0, 1.0, 0.0, 1.0);
        double std = IndicatorMath.ewmaStd(values, 3.0).getAsDouble();
        assertTrue(std > 0.1 && std < 1.0, "std was " + std);
    }
}
