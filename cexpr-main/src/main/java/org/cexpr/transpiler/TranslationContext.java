package org.cexpr.transpiler;

import java.util.Objects;
import java.util.Optional;

import org.cexpr.Mode;

/**
 * Per-call inputs of one translation.
 *
 * @param source        the expression being translated
 * @param qualifierName name that constant identifiers are qualified with, or null
 * @param mode          grammar variant
 */
public record TranslationContext(String source, String qualifierName, Mode mode) {

    public TranslationContext {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(mode, "mode");
        if (qualifierName != null && qualifierName.isBlank()) {
            qualifierName = null;
        }
    }

    public Optional<String> qualifier() {
        return Optional.ofNullable(qualifierName);
    }
}
