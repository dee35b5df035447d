package dev.contractgate.core.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class HashingTest {

    @Test
    void digestsMatchKnownSha256Values() {
        assertThat(Hashing.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(Hashing.sha256Hex("abc".getBytes(StandardCharsets.UTF_8))).isEqualTo(Hashing.sha256Hex("abc"));
        assertThat(Hashing.shortSha256("abc", 12)).isEqualTo("ba7816bf8f01");
    }
}
