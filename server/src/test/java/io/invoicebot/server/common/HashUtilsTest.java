package io.invoicebot.server.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HashUtilsTest {

    @Test
    @DisplayName("short hashes are prefixes of the full digest")
    void shortHashShouldPrefixFullDigest() {
        String full = HashUtils.sha256Hex("abc");

        assertThat(full).isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(HashUtils.sha256Hex("abc".getBytes(StandardCharsets.UTF_8))).isEqualTo(full);
        assertThat(HashUtils.shortSha256Hex("abc", 16)).isEqualTo(full.substring(0, 16));
        assertThatThrownBy(() -> HashUtils.shortSha256Hex("abc", 65)).isInstanceOf(IllegalArgumentException.class);
    }
}
