package org.cexpr.ast;

public enum Radix {
    BINARY(2),
    OCTAL(8),
    DECIMAL(10),
    HEXADECIMAL(16);

    private final int base;

    Radix(int base) {
        this.base = base;
    }

    public int base() {
        return base;
    }
}
