package org.cexpr.ast;

/**
 * Width and signedness of an integer literal, chosen from its C suffix.
 */
public enum IntKind {
    /** No suffix: signed, target default width. */
    INT(true, 0),
    /** {@code u}: unsigned, target default width. */
    UINT(false, 0),
    /** {@code l} */
    INT32(true, 32),
    /** {@code ul} */
    UINT32(false, 32),
    /** {@code ll} */
    INT64(true, 64),
    /** {@code ull} */
    UINT64(false, 64);

    private final boolean signed;
    private final int bits;

    IntKind(boolean signed, int bits) {
        this.signed = signed;
        this.bits = bits;
    }

    public boolean isSigned() {
        return signed;
    }

    /**
     * @return the explicit width in bits, or 0 for the target's default width
     */
    public int bits() {
        return bits;
    }
}
