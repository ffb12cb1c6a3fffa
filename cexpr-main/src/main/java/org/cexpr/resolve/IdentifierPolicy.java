package org.cexpr.resolve;

import java.util.Optional;
import java.util.Set;

/**
 * Decides how C identifiers are named in the target, and which of them exist at all.
 */
public interface IdentifierPolicy {

    /**
     * @param rawIdentifier the identifier as written in the C source
     * @param usage         whether the identifier names a type or a value
     * @param parentKind    CST kind of the node the identifier appears in
     * @return the (possibly renamed or escaped) target identifier, or empty if the identifier has
     *         no value in the target
     */
    Optional<String> resolve(String rawIdentifier, UsageKind usage, String parentKind);

    /**
     * @return resolved names of constants that are qualified with the active qualifier name when
     *         one is set
     */
    Set<String> constantIdentifiers();
}
