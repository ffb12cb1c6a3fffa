package org.cexpr.resolve;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Default {@link IdentifierPolicy}.
 * <p>
 * Leading and trailing underscores are stripped and names that collide with a reserved word of
 * the target are wrapped in backticks. Value identifiers resolve only when they were declared,
 * as a constant or as a variable; type identifiers resolve whenever they are valid identifiers
 * or pointer types named by {@link BuiltinTypeNames}.
 */
public class DefaultIdentifierPolicy implements IdentifierPolicy {

    /** Reserved words of the target language. */
    public static final Set<String> DEFAULT_RESERVED_WORDS = Set.of((
            "addr and as asm bind block break case cast concept const continue converter "
            + "defer discard distinct div do elif else end enum except export finally for from func "
            + "if import in include interface is isnot iterator let macro method mixin mod "
            + "nil not notin of or out proc ptr raise ref return shl shr static "
            + "template try tuple type using var when while xor yield").split(" "));

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    // Target type expressions from the type table, such as "ptr uint".
    private static final Pattern TYPE_NAME = Pattern.compile("(ptr )*[A-Za-z_][A-Za-z0-9_]*");

    private final Set<String> constants;
    private final Set<String> variables;
    private final Set<String> reservedWords;

    private DefaultIdentifierPolicy(Builder builder) {
        this.reservedWords = Set.copyOf(builder.reservedWords);
        Set<String> resolvedConstants = new HashSet<>();
        for (String constant : builder.constants) {
            resolvedConstants.add(rename(constant));
        }
        Set<String> resolvedVariables = new HashSet<>();
        for (String variable : builder.variables) {
            resolvedVariables.add(rename(variable));
        }
        this.constants = Set.copyOf(resolvedConstants);
        this.variables = Set.copyOf(resolvedVariables);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<String> resolve(String rawIdentifier, UsageKind usage, String parentKind) {
        Pattern syntax = usage == UsageKind.TYPE ? TYPE_NAME : IDENTIFIER;
        if (!syntax.matcher(rawIdentifier).matches()) {
            return Optional.empty();
        }
        String name = rename(rawIdentifier);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        if (usage == UsageKind.TYPE) {
            return Optional.of(name);
        }
        return constants.contains(name) || variables.contains(name) ? Optional.of(name) : Optional.empty();
    }

    @Override
    public Set<String> constantIdentifiers() {
        return constants;
    }

    /**
     * Strips leading and trailing underscores and escapes reserved words.
     */
    public String rename(String rawIdentifier) {
        String name = BuiltinTypeNames.stripUnderscores(rawIdentifier);
        return reservedWords.contains(name) ? "`" + name + "`" : name;
    }

    public static class Builder {

        private final Set<String> constants = new HashSet<>();
        private final Set<String> variables = new HashSet<>();
        private final Set<String> reservedWords = new HashSet<>(DEFAULT_RESERVED_WORDS);

        private Builder() {
        }

        /**
         * Declares constants, as written in C. Constants are qualified when a qualifier is active.
         */
        public Builder constants(String... names) {
            return constants(Arrays.asList(names));
        }

        public Builder constants(Collection<String> names) {
            constants.addAll(names);
            return this;
        }

        /**
         * Declares other value identifiers, as written in C.
         */
        public Builder variables(String... names) {
            return variables(Arrays.asList(names));
        }

        public Builder variables(Collection<String> names) {
            variables.addAll(names);
            return this;
        }

        public Builder reservedWords(Collection<String> words) {
            reservedWords.clear();
            reservedWords.addAll(words);
            return this;
        }

        public DefaultIdentifierPolicy build() {
            return new DefaultIdentifierPolicy(this);
        }
    }
}
