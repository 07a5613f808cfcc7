package com.pairninja.engine.indicator;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RollingWindowTest {

    @Test
    public void testEvictsOldestBeyondCapacity() {
        RollingWindow window = new RollingWindow(3);
        window.push(1.0);
        window.push(2.0);
        window.push(3.0);
        window.push(4.0);

        assertTrue(window.isFull());
        assertEquals(3, window.size());
        assertEquals(List.of(2.0, 3.0, 4.0), window.values());
        assertEquals(3.0, window.mean().getAsDouble(), 1e-12);
    }

    @Test
    public void testSampleStdUsesNMinusOne() {
        RollingWindow window = new RollingWindow(4);
        for (double v : new double[] { 2.0, 4.0, 4.0, 6.0 }) {
            window.push(v);
        }
        // mean 4, squared deviations 4+0+0+4 = 8, 8 / 3
        assertEquals(Math.sqrt(8.0 / 3.0), window.sampleStd().getAsDouble(), 1e-12);
    }

    @Test
    public void testSampleStdNeedsTwoValues() {
        RollingWindow window = new RollingWindow(5);
        assertTrue(window.sampleStd().isEmpty());
        assertTrue(window.mean().isEmpty());
        window.push(1.0);
        assertTrue(window.sampleStd().isEmpty());
    }

    @Test
    public void testLowerQuantile() {
        RollingWindow window = new RollingWindow(10);
        for (int i = 10; i >= 1; i--) {
            window.push(i);
        }
        // floor(9 * 0.1) = 0 -> smallest
        assertEquals(1.0, window.quantile(0.1).getAsDouble());
        // floor(9 * 0.5) = 4 -> fifth smallest
        assertEquals(5.0, window.quantile(0.5).getAsDouble());
        assertEquals(10.0, window.quantile(1.0).getAsDouble());
    }

    @Test
    public void testRejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new RollingWindow(0));
        RollingWindow window = new RollingWindow(2);
        assertThrows(IllegalArgumentException.class, () -> window.quantile(1.5));
    }
}
