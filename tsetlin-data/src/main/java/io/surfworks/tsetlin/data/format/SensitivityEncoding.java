package io.surfworks.tsetlin.data.format;

/**
 * How the 8-byte s slot of a raw header is filled.
 */
public enum SensitivityEncoding {

    /** IEEE-754 float64. */
    FLOAT64,

    /**
     * float32 in the low four bytes; the high four bytes are ignored on read
     * and zeroed on write. Files saved by the engine's own save primitives use
     * this form because they copy the engine's float field into the slot.
     */
    FLOAT32_LOW_WORD
}
