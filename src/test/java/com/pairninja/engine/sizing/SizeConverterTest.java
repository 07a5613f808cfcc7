package com.pairninja.engine.sizing;

import com.pairninja.config.InstrumentConstraints;
import com.pairninja.config.MinSizePolicy;
import com.pairninja.config.QtyRoundingMode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SizeConverterTest {

    private static InstrumentConstraints ethRules(QtyRoundingMode mode) {
        InstrumentConstraints constraints = new InstrumentConstraints();
        constraints.minQty = 0.001;
        constraints.minNotional = 20.0;
        constraints.stepSize = 0.001;
        constraints.tickSize = 0.01;
        constraints.qtyPrecision = 3;
        constraints.pricePrecision = 2;
        constraints.roundingMode = mode;
        return constraints;
    }

    @Test
    public void testFloorsToStep() throws SizingException {
        SizeConverter converter = new SizeConverter(ethRules(QtyRoundingMode.FLOOR), MinSizePolicy.SKIP);
        assertEquals(8.333, converter.convert(25_000.0, 3_000.0));
    }

    @Test
    public void testCeilAndRound() throws SizingException {
        assertEquals(0.417, new SizeConverter(ethRules(QtyRoundingMode.CEIL), MinSizePolicy.SKIP)
                .convert(25_000.0, 60_000.0));
        assertEquals(0.417, new SizeConverter(ethRules(QtyRoundingMode.ROUND), MinSizePolicy.SKIP)
                .convert(25_000.0, 60_000.0));
        assertEquals(0.416, new SizeConverter(ethRules(QtyRoundingMode.FLOOR), MinSizePolicy.SKIP)
                .convert(25_000.0, 60_000.0));
    }

    @Test
    public void testBelowMinimumSkipped() {
        SizeConverter converter = new SizeConverter(ethRules(QtyRoundingMode.FLOOR), MinSizePolicy.SKIP);
        assertThrows(BelowMinimumException.class, () -> converter.convert(10.0, 3_000.0));
    }

    @Test
    public void testBelowMinimumAdjustedUp() throws SizingException {
        SizeConverter converter = new SizeConverter(ethRules(QtyRoundingMode.FLOOR), MinSizePolicy.ADJUST);
        // 20 / 3000 = 0.00667 -> next step up
        double qty = converter.convert(10.0, 3_000.0);
        assertEquals(0.007, qty);
        assertTrue(qty * 3_000.0 >= 20.0);
    }

    @Test
    public void testRejectsNonPositiveInputs() {
        SizeConverter converter = new SizeConverter(ethRules(QtyRoundingMode.FLOOR), MinSizePolicy.SKIP);
        assertThrows(SizingException.class, () -> converter.convert(1_000.0, 0.0));
        assertThrows(SizingException.class, () -> converter.convert(-5.0, 3_000.0));
    }
}
