package io.surfworks.tsetlin.core.estimate;

import java.util.List;

/**
 * Estimated native memory of one machine, buffer by buffer.
 *
 * @param entries one entry per engine allocation, in allocation order
 */
public record SizeBreakdown(List<Entry> entries) {

    public SizeBreakdown {
        entries = List.copyOf(entries);
    }

    /**
     * Returns the sum of all entries in bytes.
     */
    public long totalBytes() {
        long total = 0;
        for (Entry entry : entries) {
            total += entry.bytes();
        }
        return total;
    }

    /**
     * Returns the bytes of the named buffer, or 0 if it is not part of this breakdown.
     */
    public long bytes(String name) {
        for (Entry entry : entries) {
            if (entry.name().equals(name)) {
                return entry.bytes();
            }
        }
        return 0;
    }

    /**
     * One engine allocation.
     *
     * @param name  buffer name
     * @param bytes size in bytes
     */
    public record Entry(String name, long bytes) {}
}
