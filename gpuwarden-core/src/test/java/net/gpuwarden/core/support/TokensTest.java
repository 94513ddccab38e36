package net.gpuwarden.core.support;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokensTest {

    @Test
    void tokens_are64HexCharsAndDistinct() {
        String a = Tokens.newSessionToken();
        String b = Tokens.newSessionToken();
        assertThat(a).hasSize(64).matches("[0-9a-f]+");
        assertThat(a).isNotEqualTo(b);
    }
}
