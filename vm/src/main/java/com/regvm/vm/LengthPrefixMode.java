package com.regvm.vm;

/**
 * How the 16-bit length prefix of strings and register arrays is combined.
 */
public enum LengthPrefixMode {

    /** {@code high * 256 + low}; both bytes are always consumed. */
    BIG_ENDIAN,

    /**
     * {@code (high << 8) || low}, as emitted by the historical producer.
     * A non-zero high byte is the whole length ({@code high << 8}) and the low byte is not read.
     */
    LEGACY_SHORT_CIRCUIT
}
