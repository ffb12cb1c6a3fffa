package org.cexpr;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModeTest {

    @Test
    void parsesModeNames() {
        assertThat(Mode.of("c")).isEqualTo(Mode.C);
        assertThat(Mode.of(" CPP ")).isEqualTo(Mode.CPP);
        assertThat(Mode.of("c++")).isEqualTo(Mode.CPP);
        assertThatThrownBy(() -> Mode.of("objc")).isInstanceOf(IllegalArgumentException.class);
    }
}
