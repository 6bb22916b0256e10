package com.orthosense.service.window;

import com.orthosense.domain.Frame;
import com.orthosense.domain.Window;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fixed-capacity ring buffer of pose frames for live analysis.
 *
 * <p>Pushing into a full buffer evicts the oldest frame in O(1). Thread-safe for one producer
 * (frame source) and one consumer (analysis tick).
 */
public final class FrameRingBuffer {

    private final Frame[] buffer;
    private final int minFramesForReady;
    private int writePos = 0;
    private int size = 0;

    /**
     * @param capacity          maximum frames kept (the window size)
     * @param minFramesForReady frames required before {@link #ready()} reports true
     */
    public FrameRingBuffer(int capacity, int minFramesForReady) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (minFramesForReady <= 0 || minFramesForReady > capacity) {
            throw new IllegalArgumentException("minFramesForReady must be in [1, capacity]");
        }
        this.buffer = new Frame[capacity];
        this.minFramesForReady = minFramesForReady;
    }

    public int capacity() {
        return buffer.length;
    }

    public synchronized void push(Frame frame) {
        if (frame == null) {
            throw new IllegalArgumentException("frame must not be null");
        }
        buffer[writePos] = frame;
        writePos = (writePos + 1) % buffer.length;
        size = Math.min(size + 1, buffer.length);
    }

    public synchronized int size() {
        return size;
    }

    public synchronized boolean ready() {
        return size >= minFramesForReady;
    }

    /** Buffered frames, oldest first. Does not modify the buffer. */
    public synchronized List<Frame> snapshot() {
        List<Frame> out = new ArrayList<>(size);
        int start = (writePos - size + buffer.length) % buffer.length;
        for (int i = 0; i < size; i++) {
            out.add(buffer[(start + i) % buffer.length]);
        }
        return out;
    }

    /**
     * Snapshot wrapped as a window.
     *
     * @throws IllegalStateException when the buffer is empty
     */
    public Window snapshotWindow(double frameVisibilityThreshold, double windowVisibleRatio) {
        List<Frame> frames = snapshot();
        if (frames.isEmpty()) {
            throw new IllegalStateException("No frames buffered");
        }
        return Window.of(frames, frameVisibilityThreshold, windowVisibleRatio);
    }

    public synchronized void clear() {
        Arrays.fill(buffer, null);
        writePos = 0;
        size = 0;
    }
}
