package io.invoicebot.server.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.invoicebot.server.support.TestObjects;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class StateCodecTest {

    private StateCodec codec;

    @BeforeEach
    void setUp() {
        codec = new StateCodec(TestObjects.objectMapper());
    }

    @ParameterizedTest
    @EnumSource(CompressionType.class)
    @DisplayName("nested state with typed values survives encode and decode")
    void nestedTypedStateShouldRoundTrip(CompressionType compression) {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("amount", new BigDecimal("1249.50"));
        nested.put("issued_on", LocalDate.parse("2024-03-01"));
        nested.put("local_time", LocalDateTime.parse("2024-03-01T10:15:30.123"));
        nested.put("offset_time", OffsetDateTime.parse("2024-03-01T10:15:30-06:00"));
        nested.put("tags", List.of("cfdi", 4, 2.5, true));

        Map<String, Object> state = new LinkedHashMap<>();
        state.put("ticket", 42);
        state.put("small_long", 7L);
        state.put("big_long", 9_000_000_000L);
        state.put("ratio", 0.75);
        state.put("huge", new BigInteger("123456789012345678901234567890"));
        state.put("seen_at", Instant.parse("2024-03-01T16:15:30.123456Z"));
        state.put("missing", null);
        state.put("invoice", nested);
        state.put("history", List.of(Map.of("step", 1), Map.of("step", 2)));

        EncodedState encoded = codec.encode(state, compression);
        Map<String, Object> decoded = codec.decode(encoded.bytes(), compression);

        assertThat(decoded).isEqualTo(state);
        assertThat(decoded.get("small_long")).isInstanceOf(Long.class);
        assertThat(decoded.get("ticket")).isInstanceOf(Integer.class);
        assertThat(encoded.compression()).isEqualTo(compression);
        assertThat(encoded.checksum()).isEqualTo(codec.checksum(encoded.bytes()));
    }

    @Test
    @DisplayName("binary blobs come back byte for byte")
    void binaryBlobShouldRoundTrip() {
        byte[] blob = {0, 1, 2, (byte) 0xFF, 127, -128};
        EncodedState encoded = codec.encode(Map.of("screenshot", blob, "name", "home"), CompressionType.LZMA);

        Map<String, Object> decoded = codec.decode(encoded.bytes(), CompressionType.LZMA);

        assertThat(decoded.get("screenshot")).isInstanceOf(byte[].class);
        assertThat((byte[]) decoded.get("screenshot")).containsExactly(blob);
        assertThat(decoded.get("name")).isEqualTo("home");
    }

    @Test
    @DisplayName("user maps that use the marker key are escaped and restored")
    void userMapWithMarkerKeyShouldRoundTrip() {
        Map<String, Object> state = Map.of(
            "$type", "not-a-tag",
            "inner", Map.of("$type", "decimal", "other", 1));

        EncodedState encoded = codec.encode(state, CompressionType.NONE);

        assertThat(codec.decode(encoded.bytes(), CompressionType.NONE)).isEqualTo(state);
    }

    @Test
    @DisplayName("non-finite doubles and unsupported types are rejected on encode")
    void encodeShouldRejectUnsupportedValues() {
        assertThatThrownBy(() -> codec.encode(Map.of("x", Double.NaN), CompressionType.NONE))
            .isInstanceOf(StateCodecException.class)
            .hasMessageContaining("Non-finite");
        assertThatThrownBy(() -> codec.encode(Map.of("x", new Object()), CompressionType.NONE))
            .isInstanceOf(StateCodecException.class)
            .hasMessageContaining("Unsupported");
        assertThatThrownBy(() -> codec.encode(Map.of("x", Map.of(1, "one")), CompressionType.NONE))
            .isInstanceOf(StateCodecException.class)
            .hasMessageContaining("keys must be strings");
    }

    @Test
    @DisplayName("unknown or malformed markers fail decode instead of passing through")
    void decodeShouldRejectMalformedMarkers() {
        assertThatThrownBy(() -> decodeJson("{\"a\":{\"$type\":\"uuid\",\"$value\":\"x\"}}"))
            .isInstanceOf(StateCodecException.class)
            .hasMessageContaining("Unknown type marker");
        assertThatThrownBy(() -> decodeJson("{\"a\":{\"$type\":\"decimal\"}}"))
            .isInstanceOf(StateCodecException.class)
            .hasMessageContaining("Malformed");
        assertThatThrownBy(() -> decodeJson("{\"a\":{\"$type\":\"instant\",\"$value\":\"yesterday\"}}"))
            .isInstanceOf(StateCodecException.class)
            .hasMessageContaining("instant");
        assertThatThrownBy(() -> decodeJson("[1,2]"))
            .isInstanceOf(StateCodecException.class);
    }

    @Test
    @DisplayName("corrupted compressed bytes surface as a codec error")
    void decodeShouldFailOnCorruptedCompression() {
        byte[] bytes = codec.encode(Map.of("a", 1), CompressionType.GZIP).bytes();
        bytes[bytes.length / 2] ^= 0x5A;

        assertThatThrownBy(() -> codec.decode(bytes, CompressionType.GZIP))
            .isInstanceOf(StateCodecException.class);
    }

    private Map<String, Object> decodeJson(String json) {
        return codec.decode(json.getBytes(StandardCharsets.UTF_8), CompressionType.NONE);
    }
}
