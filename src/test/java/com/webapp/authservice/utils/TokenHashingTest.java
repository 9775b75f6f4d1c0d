package com.webapp.authservice.utils;

import org.junit.jupiter.api.Test;

import java.security.SecureRandom;

import static org.assertj.core.api.Assertions.assertThat;

class TokenHashingTest {

    @Test
    void sha256HexMatchesKnownDigest() {
        assertThat(TokenHashing.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void randomTokenIsUrlSafeWithoutPadding() {
        String token = TokenHashing.randomToken(new SecureRandom(), 64);

        assertThat(token).hasSize(86).matches("[A-Za-z0-9_-]+");
    }
}
