package org.cexpr.transpiler;

import java.util.Objects;
import java.util.Optional;

import org.cexpr.ast.AstNode;
import org.cexpr.ast.AstNodes;

/**
 * The type every operand of one top-level translation is coerced to, emulating C's usual
 * arithmetic conversions with the first-evaluated operand as the anchor.
 * <p>
 * A witness starts unset, is bound at most once, and is never shared between translations.
 */
public final class CoercionWitness {

    private AstNode type;

    public boolean isSet() {
        return type != null;
    }

    public Optional<AstNode> current() {
        return Optional.ofNullable(type);
    }

    /**
     * @return true if this call bound the witness, false if it was already bound
     */
    public boolean bindIfUnset(AstNode candidate) {
        Objects.requireNonNull(candidate, "candidate");
        if (candidate.isAbsent()) {
            throw new IllegalArgumentException("Cannot bind the coercion witness to an absent node");
        }
        if (type != null) {
            return false;
        }
        type = candidate;
        return true;
    }

    /**
     * @return {@code witness(value)}
     * @throws IllegalStateException if the witness is unset
     */
    public AstNode coerce(AstNode value) {
        if (type == null) {
            throw new IllegalStateException("Coercion witness is not bound");
        }
        return AstNodes.call(type, value);
    }
}
