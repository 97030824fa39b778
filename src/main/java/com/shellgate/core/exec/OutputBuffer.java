package com.shellgate.core.exec;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Byte buffer with a hard capacity. Writes past the capacity are discarded and
 * mark the buffer truncated; they never block or fail, so the producing pipe
 * keeps draining.
 */
final class OutputBuffer {

    private final int capacity;
    private byte[] data = new byte[0];
    private int size;
    private boolean truncated;

    OutputBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    synchronized void write(byte[] chunk, int offset, int length) {
        int accepted = Math.min(length, capacity - size);
        if (accepted < length) {
            truncated = true;
        }
        if (accepted <= 0) {
            return;
        }
        ensureCapacity(size + accepted);
        System.arraycopy(chunk, offset, data, size, accepted);
        size += accepted;
    }

    synchronized boolean isTruncated() {
        return truncated;
    }

    synchronized int size() {
        return size;
    }

    /**
     * Decodes the captured bytes as UTF-8. A truncated buffer drops a trailing
     * partial character so the decoded text never exceeds the capacity in bytes.
     */
    synchronized String toUtf8String() {
        int end = truncated ? completeCharacterBoundary(data, size) : size;
        return new String(data, 0, end, StandardCharsets.UTF_8);
    }

    private void ensureCapacity(int required) {
        if (required <= data.length) {
            return;
        }
        int grown = Math.max(required, Math.min(capacity, Math.max(256, data.length * 2)));
        data = Arrays.copyOf(data, grown);
    }

    static int completeCharacterBoundary(byte[] bytes, int length) {
        int lead = length - 1;
        // walk back over at most three continuation bytes (10xxxxxx)
        while (lead >= 0 && length - lead <= 4 && (bytes[lead] & 0xC0) == 0x80) {
            lead--;
        }
        if (lead < 0) {
            return length;
        }
        int expected = sequenceLength(bytes[lead]);
        return length - lead < expected ? lead : length;
    }

    private static int sequenceLength(byte lead) {
        int b = lead & 0xFF;
        if (b >= 0xF0) {
            return 4;
        }
        if (b >= 0xE0) {
            return 3;
        }
        if (b >= 0xC0) {
            return 2;
        }
        return 1;
    }
}
