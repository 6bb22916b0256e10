package com.orthosense.service.diagnostics;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Fixed-capacity FIFO of a scalar metric whose running mean damps single-frame jitter.
 *
 * <p>The oldest value is evicted once capacity is reached. Owned by exactly one evaluator;
 * not thread-safe.
 */
public final class SmoothingBuffer {

    private final int capacity;
    private final Deque<Double> values;

    public SmoothingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
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

    /** Mean of buffered values, or 0 when empty. */
    public double mean() {
        if (values.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (double v : values) {
            total += v;
        }
        return total / values.size();
    }

    public int size() {
        return values.size();
    }

    public int capacity() {
        return capacity;
    }

    public void reset() {
        values.clear();
    }
}
