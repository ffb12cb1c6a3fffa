package org.cexpr;

import java.util.Objects;
import java.util.Optional;

import org.cexpr.ast.AstNode;

/**
 * Outcome of one translation. A {@link Translated} result may still hold {@link AstNode#ABSENT}
 * when the expression contained a placeholder; an {@link Untranslated} result carries the reason.
 */
public sealed interface TranslationResult {

    AstNode node();

    Optional<RuntimeException> failure();

    default boolean isTranslated() {
        return !node().isAbsent();
    }

    static TranslationResult translated(AstNode node) {
        return new Translated(node);
    }

    static TranslationResult untranslated(RuntimeException cause) {
        return new Untranslated(cause);
    }

    record Translated(AstNode node) implements TranslationResult {

        public Translated {
            Objects.requireNonNull(node, "node");
        }

        @Override
        public Optional<RuntimeException> failure() {
            return Optional.empty();
        }
    }

    record Untranslated(RuntimeException cause) implements TranslationResult {

        public Untranslated {
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public AstNode node() {
            return AstNode.ABSENT;
        }

        @Override
        public Optional<RuntimeException> failure() {
            return Optional.of(cause);
        }
    }
}
