package io.surfworks.tsetlin.data.format;

/**
 * Byte positions of the raw model header.
 *
 * <p>Both layouts store, little-endian: threshold, num_literals, num_clauses,
 * num_classes (uint32 at 0, 4, 8, 12), max_state (int8 at 16), min_state
 * (int8 at 17), boost (uint8 at 18), then s in an 8-byte slot.
 */
public enum HeaderLayout {

    /** s at offset 24 after five pad bytes; weights start at 32. */
    ALIGNED(24),

    /** s at offset 19 right after the boost byte; weights start at 27. This is what the engine's loaders read. */
    PACKED(19);

    static final int SCALAR_BYTES = 19;

    private final int sensitivityOffset;

    HeaderLayout(int sensitivityOffset) {
        this.sensitivityOffset = sensitivityOffset;
    }

    public int sensitivityOffset() {
        return sensitivityOffset;
    }

    /**
     * Returns the offset at which the weight tensor starts.
     */
    public int headerBytes() {
        return sensitivityOffset + 8;
    }

    int paddingBytes() {
        return sensitivityOffset - SCALAR_BYTES;
    }
}
