package org.cexpr.resolve;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BuiltinTypeNamesTest {

    private final TypeNameTable table = BuiltinTypeNames.INSTANCE;

    @Test
    void builtinTypes() {
        assertThat(table.lookup("long")).contains("clong");
        assertThat(table.lookup("unsigned long")).contains("culong");
        assertThat(table.lookup("char")).contains("cchar");
        assertThat(table.lookup("signed char")).contains("cschar");
        assertThat(table.lookup("short")).contains("cshort");
        assertThat(table.lookup("int")).contains("cint");
        assertThat(table.lookup("size_t")).contains("uint");
        assertThat(table.lookup("ssize_t")).contains("int");
        assertThat(table.lookup("long long")).contains("clonglong");
        assertThat(table.lookup("float")).contains("cfloat");
        assertThat(table.lookup("double")).contains("cdouble");
        assertThat(table.lookup("long double")).contains("clongdouble");
        assertThat(table.lookup("unsigned char")).contains("cuchar");
        assertThat(table.lookup("unsigned short")).contains("cushort");
        assertThat(table.lookup("unsigned int")).contains("cuint");
        assertThat(table.lookup("unsigned long long")).contains("culonglong");
    }

    @Test
    void voidIsAnOpaqueObject() {
        assertThat(table.lookup("void")).contains(BuiltinTypeNames.OPAQUE_OBJECT);
    }

    @Test
    void whitespaceIsNormalized() {
        assertThat(table.lookup("  unsigned \t long  ")).contains("culong");
    }

    @Test
    void fixedWidthTypedefs() {
        assertThat(table.lookup("int8_t")).contains("int8");
        assertThat(table.lookup("uint64_t")).contains("uint64");
        assertThat(table.lookup("__uint32_t")).contains("uint32");
        assertThat(table.lookup("intptr_t")).contains("ptr int");
        assertThat(table.lookup("uintptr_t")).contains("ptr uint");
        assertThat(table.lookup("int128_t")).isEmpty();
    }

    @Test
    void boolSpellings() {
        assertThat(table.lookup("bool")).contains("bool");
        assertThat(table.lookup("_Bool")).contains("bool");
    }

    @Test
    void unknownNames() {
        assertThat(table.lookup("my_struct")).isEmpty();
        assertThat(table.lookup("struct foo")).isEmpty();
    }

    @Test
    void stripUnderscores() {
        assertThat(BuiltinTypeNames.stripUnderscores("__foo_bar__")).isEqualTo("foo_bar");
        assertThat(BuiltinTypeNames.stripUnderscores("___")).isEmpty();
    }
}
