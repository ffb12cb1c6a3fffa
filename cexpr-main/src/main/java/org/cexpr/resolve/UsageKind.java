package org.cexpr.resolve;

/**
 * How an identifier is used at the point it is resolved.
 */
public enum UsageKind {
    TYPE,
    VALUE
}
