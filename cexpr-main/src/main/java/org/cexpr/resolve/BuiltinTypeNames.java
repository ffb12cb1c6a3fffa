package org.cexpr.resolve;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default {@link TypeNameTable}: the C builtin types, {@code void}, and the fixed-width typedefs
 * from {@code <stdint.h>}.
 */
public class BuiltinTypeNames implements TypeNameTable {

    public static final BuiltinTypeNames INSTANCE = new BuiltinTypeNames();

    /** 64-bit signed integer type of the target. */
    public static final String INT64 = "int64";

    /** Opaque object type that {@code void} maps to. */
    public static final String OPAQUE_OBJECT = "object";

    private static final Map<String, String> TYPE_MAP = Map.ofEntries(
            Map.entry("long", "clong"),
            Map.entry("unsigned long", "culong"),
            Map.entry("char", "cchar"),
            Map.entry("signed char", "cschar"),
            Map.entry("short", "cshort"),
            Map.entry("int", "cint"),
            Map.entry("size_t", "uint"),
            Map.entry("ssize_t", "int"),
            Map.entry("long long", "clonglong"),
            Map.entry("float", "cfloat"),
            Map.entry("double", "cdouble"),
            Map.entry("long double", "clongdouble"),
            Map.entry("unsigned char", "cuchar"),
            Map.entry("unsigned short", "cushort"),
            Map.entry("unsigned int", "cuint"),
            Map.entry("unsigned long long", "culonglong"),

            Map.entry("signed", "cint"),
            Map.entry("signed int", "cint"),
            Map.entry("unsigned", "cuint"),
            Map.entry("short int", "cshort"),
            Map.entry("unsigned short int", "cushort"),
            Map.entry("long int", "clong"),
            Map.entry("unsigned long int", "culong"),
            Map.entry("long long int", "clonglong"),
            Map.entry("unsigned long long int", "culonglong"),
            Map.entry("bool", "bool"),
            Map.entry("_Bool", "bool")
    );

    private static final Pattern FIXED_WIDTH = Pattern.compile("(u?int)(8|16|32|64)_t");
    private static final Pattern POINTER_SIZED = Pattern.compile("(u?int)ptr_t");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public Optional<String> lookup(String cTypeName) {
        String written = WHITESPACE.matcher(cTypeName.strip()).replaceAll(" ");
        if (written.equals("void")) {
            return Optional.of(OPAQUE_OBJECT);
        }

        String mapped = TYPE_MAP.get(written);
        if (mapped != null) {
            return Optional.of(mapped);
        }

        String name = stripUnderscores(written);
        mapped = TYPE_MAP.get(name);
        if (mapped != null) {
            return Optional.of(mapped);
        }

        Matcher fixed = FIXED_WIDTH.matcher(name);
        if (fixed.matches()) {
            return Optional.of(fixed.group(1) + fixed.group(2));
        }
        Matcher pointer = POINTER_SIZED.matcher(name);
        if (pointer.matches()) {
            return Optional.of("ptr " + pointer.group(1));
        }
        return Optional.empty();
    }

    static String stripUnderscores(String name) {
        int start = 0;
        int end = name.length();
        while (start < end && name.charAt(start) == '_') {
            start++;
        }
        while (end > start && name.charAt(end - 1) == '_') {
            end--;
        }
        return name.substring(start, end);
    }
}
