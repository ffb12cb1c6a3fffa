package org.cexpr;

import java.util.Objects;

import org.cexpr.ast.AstNode;
import org.cexpr.cst.CstNode;
import org.cexpr.cst.CstProvider;
import org.cexpr.parser.antlr4.Antlr4CstProvider;
import org.cexpr.resolve.BuiltinTypeNames;
import org.cexpr.resolve.DefaultIdentifierPolicy;
import org.cexpr.resolve.IdentifierPolicy;
import org.cexpr.resolve.TypeNameTable;
import org.cexpr.transpiler.CoercionWitness;
import org.cexpr.transpiler.CstWalker;
import org.cexpr.transpiler.TranslationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates standalone C or C++ expressions, such as the bodies of object-like macros, into
 * target syntax trees.
 * <p>
 * Translation never throws for bad input: an expression that cannot be parsed or translated
 * yields {@link AstNode#ABSENT}, and {@link #translateDetailed} reports why. Every call works on
 * its own parse tree and coercion witness, so one translator may be shared between threads as
 * long as its collaborators are thread-safe.
 *
 * <pre>
 * CTranslator translator = CTranslator.builder()
 *         .identifierPolicy(DefaultIdentifierPolicy.builder().constants("FOO").build())
 *         .build();
 * AstNode node = translator.translate("FOO + 1");
 * </pre>
 */
public class CTranslator {

    private static final Logger logger = LoggerFactory.getLogger(CTranslator.class);

    /** System property selecting the default {@link Mode}: {@code c} or {@code cpp}. */
    public static final String MODE_PROPERTY = "cexpr.translator.mode";

    private final Mode defaultMode;
    private final CstProvider cstProvider;
    private final IdentifierPolicy identifierPolicy;
    private final TypeNameTable typeNames;

    private CTranslator(Builder builder) {
        this.defaultMode = builder.mode;
        this.cstProvider = builder.cstProvider;
        this.identifierPolicy = builder.identifierPolicy;
        this.typeNames = builder.typeNames;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Mode getDefaultMode() {
        return defaultMode;
    }

    public AstNode translate(String source) {
        return translate(source, null, defaultMode);
    }

    /**
     * @param qualifierName name appended to constant identifiers as {@code name.qualifier}, or
     *                      null for none
     */
    public AstNode translate(String source, String qualifierName) {
        return translate(source, qualifierName, defaultMode);
    }

    public AstNode translate(String source, String qualifierName, Mode mode) {
        return translateDetailed(source, qualifierName, mode).node();
    }

    public TranslationResult translateDetailed(String source) {
        return translateDetailed(source, null, defaultMode);
    }

    public TranslationResult translateDetailed(String source, String qualifierName, Mode mode) {
        Objects.requireNonNull(source, "source");
        Mode effectiveMode = mode != null ? mode : defaultMode;
        try {
            TranslationContext context = new TranslationContext(source, qualifierName, effectiveMode);
            CstNode root = cstProvider.parse(source, effectiveMode);
            AstNode node = new CstWalker(context, identifierPolicy, typeNames).walk(root, new CoercionWitness());
            logger.debug("Translated \"{}\" to {}", source, node);
            return TranslationResult.translated(node);
        } catch (CExprException e) {
            logger.debug("Could not translate \"{}\": {}", source, e.getMessage());
            return TranslationResult.untranslated(e);
        } catch (RuntimeException e) {
            logger.warn("Unexpected failure translating \"{}\"", source, e);
            return TranslationResult.untranslated(e);
        } catch (StackOverflowError e) {
            logger.debug("Expression too deeply nested to translate: \"{}\"", source);
            return TranslationResult.untranslated(
                    new ExpressionTranslateException("Expression is nested too deeply to translate", source, e));
        }
    }

    public static class Builder {

        private Mode mode = modeFromSystemProperty();
        private CstProvider cstProvider = Antlr4CstProvider.INSTANCE;
        private IdentifierPolicy identifierPolicy = DefaultIdentifierPolicy.builder().build();
        private TypeNameTable typeNames = BuiltinTypeNames.INSTANCE;

        private Builder() {
        }

        public Builder mode(Mode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder cstProvider(CstProvider cstProvider) {
            this.cstProvider = Objects.requireNonNull(cstProvider, "cstProvider");
            return this;
        }

        public Builder identifierPolicy(IdentifierPolicy identifierPolicy) {
            this.identifierPolicy = Objects.requireNonNull(identifierPolicy, "identifierPolicy");
            return this;
        }

        public Builder typeNames(TypeNameTable typeNames) {
            this.typeNames = Objects.requireNonNull(typeNames, "typeNames");
            return this;
        }

        public CTranslator build() {
            return new CTranslator(this);
        }

        private static Mode modeFromSystemProperty() {
            return Mode.of(System.getProperty(MODE_PROPERTY, "c"));
        }
    }
}
