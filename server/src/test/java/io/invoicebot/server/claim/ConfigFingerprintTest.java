package io.invoicebot.server.claim;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConfigFingerprintTest {

    private final ConfigFingerprint fingerprint = new ConfigFingerprint(new ObjectMapper());

    @Test
    @DisplayName("nested keys are sorted while array order is kept")
    void canonicalJsonShouldSortNestedKeys() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("z", 1);
        inner.put("a", List.of(3, 1, 2));
        Map<String, Object> outer = new LinkedHashMap<>();
        outer.put("url", "https://portal.example");
        outer.put("options", inner);

        assertThat(fingerprint.canonicalJson(outer))
            .isEqualTo("{\"options\":{\"a\":[3,1,2],\"z\":1},\"url\":\"https://portal.example\"}");
    }

    @Test
    @DisplayName("a missing config and an empty config hash differently")
    void nullConfigShouldRenderAsNull() {
        assertThat(fingerprint.canonicalJson(null)).isEqualTo("null");
        assertThat(fingerprint.hash(null, 16)).isNotEqualTo(fingerprint.hash(Map.of(), 16));
    }

    @Test
    @DisplayName("reordering array elements changes the hash")
    void arrayOrderShouldMatter() {
        String first = fingerprint.hash(Map.of("routes", List.of("header", "footer")), 16);
        String second = fingerprint.hash(Map.of("routes", List.of("footer", "header")), 16);

        assertThat(first).hasSize(16).isNotEqualTo(second);
    }
}
