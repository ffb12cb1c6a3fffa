package org.cexpr.ast;

/**
 * Width of a floating point literal. There is no 128-bit kind: {@code long double} literals
 * ({@code l} suffix) are emitted as {@link #FLOAT64}, losing precision on targets where it is wider.
 */
public enum FloatKind {
    FLOAT,
    FLOAT64
}
