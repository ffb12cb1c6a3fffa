package org.cexpr.resolve;

import java.util.Optional;

/**
 * Maps builtin C type names onto target type names.
 */
@FunctionalInterface
public interface TypeNameTable {

    /**
     * @param cTypeName a C type as written, for example {@code "unsigned long"}
     * @return the target type name, or empty if the name is not a builtin
     */
    Optional<String> lookup(String cTypeName);
}
