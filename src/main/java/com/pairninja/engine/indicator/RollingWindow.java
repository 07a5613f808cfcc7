package com.pairninja.engine.indicator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Fixed-capacity FIFO window of doubles. Statistics cover only the values
 * currently held; pushing beyond capacity evicts the oldest value.
 */
public class RollingWindow {

    private final int capacity;
    private final Deque<Double> values;

    public RollingWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Window capacity must be > 0, got " + capacity);
        }
        this.capacity = capacity;
        this.values = new ArrayDeque<>(capacity);
    }

    public void push(double value) {
        if (values.size() == capacity) {
            values.removeFirst();
        }
        values.addLast(value);
    }

    public int size() {
        return values.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isFull() {
        return values.size() == capacity;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public void clear() {
        values.clear();
    }

    /**
     * Oldest first.
     */
    public List<Double> values() {
        return new ArrayList<>(values);
    }

    public OptionalDouble mean() {
        if (values.isEmpty()) {
            return OptionalDouble.empty();
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return OptionalDouble.of(sum / values.size());
    }

    /**
     * Sample standard deviation (N-1). Empty for fewer than two values.
     */
    public OptionalDouble sampleStd() {
        int n = values.size();
        if (n < 2) {
            return OptionalDouble.empty();
        }
        double mean = mean().getAsDouble();
        double sumSq = 0.0;
        for (double v : values) {
            double diff = v - mean;
            sumSq += diff * diff;
        }
        return OptionalDouble.of(Math.sqrt(sumSq / (n - 1)));
    }

    /**
     * Lower quantile: element at index floor((n - 1) * p) of the sorted values.
     */
    public OptionalDouble quantile(double p) {
        if (p < 0.0 || p > 1.0 || Double.isNaN(p)) {
            throw new IllegalArgumentException("Quantile must be in [0, 1], got " + p);
        }
        if (values.isEmpty()) {
            return OptionalDouble.empty();
        }
        double[] sorted = new double[values.size()];
        int i = 0;
        for (double v : values) {
            sorted[i++] = v;
        }
        Arrays.sort(sorted);
        int index = (int) Math.floor((sorted.length - 1) * p);
        return OptionalDouble.of(sorted[index]);
    }
}
