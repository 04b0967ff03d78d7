package io.invoicebot.server.codec;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.invoicebot.server.common.HashUtils;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import org.springframework.stereotype.Component;
import org.tukaani.xz.LZMA2Options;
import org.tukaani.xz.LZMAInputStream;
import org.tukaani.xz.LZMAOutputStream;

/**
 * Lossless codec for automation state. Values JSON cannot represent exactly are written as
 * {@code {"$type": tag, "$value": ...}} objects; maps that themselves use the marker key are
 * wrapped in a {@code map} tag so user data can never be mistaken for a marker.
 */
@Component
public class StateCodec {

    static final String TYPE_FIELD = "$type";
    static final String VALUE_FIELD = "$value";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper objectMapper;

    public StateCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .disable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS);
    }

    public EncodedState encode(Map<String, ?> state, CompressionType compression) {
        if (state == null) {
            throw new StateCodecException("State must not be null");
        }
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(toNode(state));
        } catch (IOException e) {
            throw new StateCodecException("Failed to write state JSON", e);
        }
        byte[] compressed = compress(json, compression);
        return new EncodedState(compressed, checksum(compressed), compression);
    }

    public Map<String, Object> decode(byte[] bytes, CompressionType compression) {
        JsonNode root;
        try {
            root = objectMapper.readTree(decompress(bytes, compression));
        } catch (IOException e) {
            throw new StateCodecException("State payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new StateCodecException("State payload must be a JSON object");
        }
        Object decoded = fromNode(root);
        if (!(decoded instanceof Map<?, ?>)) {
            throw new StateCodecException("State payload must decode to a map");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> state = (Map<String, Object>) decoded;
        return state;
    }

    public String checksum(byte[] bytes) {
        return HashUtils.sha256Hex(bytes);
    }

    private JsonNode toNode(Object value) {
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof String s) {
            return NODES.textNode(s);
        }
        if (value instanceof Boolean b) {
            return NODES.booleanNode(b);
        }
        if (value instanceof Integer i) {
            return NODES.numberNode(i);
        }
        if (value instanceof Long l) {
            // a plain number in int range reads back as Integer
            if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                return tagged("long", NODES.numberNode(l));
            }
            return NODES.numberNode(l);
        }
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                throw new StateCodecException("Non-finite double cannot be encoded: " + d);
            }
            return NODES.numberNode(d);
        }
        if (value instanceof Float f) {
            if (f.isNaN() || f.isInfinite()) {
                throw new StateCodecException("Non-finite float cannot be encoded: " + f);
            }
            return tagged("float", NODES.numberNode(f.doubleValue()));
        }
        if (value instanceof BigDecimal decimal) {
            return tagged("decimal", NODES.textNode(decimal.toString()));
        }
        if (value instanceof BigInteger integer) {
            return tagged("biginteger", NODES.textNode(integer.toString()));
        }
        if (value instanceof byte[] bytes) {
            return tagged("bytes", NODES.textNode(Base64.getEncoder().encodeToString(bytes)));
        }
        if (value instanceof Instant instant) {
            return tagged("instant", NODES.textNode(instant.toString()));
        }
        if (value instanceof OffsetDateTime dateTime) {
            return tagged("offset_datetime", NODES.textNode(dateTime.toString()));
        }
        if (value instanceof LocalDateTime dateTime) {
            return tagged("datetime", NODES.textNode(dateTime.toString()));
        }
        if (value instanceof LocalDate date) {
            return tagged("date", NODES.textNode(date.toString()));
        }
        if (value instanceof Map<?, ?> map) {
            ObjectNode object = NODES.objectNode();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new StateCodecException("State map keys must be strings, got: " + entry.getKey());
                }
                object.set(key, toNode(entry.getValue()));
            }
            return map.containsKey(TYPE_FIELD) ? tagged("map", object) : object;
        }
        if (value instanceof List<?> list) {
            ArrayNode array = NODES.arrayNode();
            for (Object item : list) {
                array.add(toNode(item));
            }
            return array;
        }
        throw new StateCodecException("Unsupported state value type: " + value.getClass().getName());
    }

    private ObjectNode tagged(String tag, JsonNode value) {
        ObjectNode node = NODES.objectNode();
        node.put(TYPE_FIELD, tag);
        node.set(VALUE_FIELD, value);
        return node;
    }

    private Object fromNode(JsonNode node) {
        if (node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isInt()) {
            return node.intValue();
        }
        if (node.isLong()) {
            return node.longValue();
        }
        if (node.isDouble() || node.isFloat()) {
            return node.doubleValue();
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                list.add(fromNode(item));
            }
            return list;
        }
        if (node.isObject()) {
            return isMarker(node) ? fromMarker(node) : readObject(node);
        }
        throw new StateCodecException("Untagged value of unsupported JSON kind: " + node.getNodeType());
    }

    private Map<String, Object> readObject(JsonNode node) {
        Map<String, Object> map = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            map.put(field.getKey(), fromNode(field.getValue()));
        }
        return map;
    }

    private boolean isMarker(JsonNode node) {
        return node.isObject() && node.has(TYPE_FIELD);
    }

    private Object fromMarker(JsonNode node) {
        JsonNode typeNode = node.get(TYPE_FIELD);
        JsonNode value = node.get(VALUE_FIELD);
        if (node.size() != 2 || value == null || !typeNode.isTextual()) {
            throw new StateCodecException("Malformed type marker: " + node);
        }
        String tag = typeNode.textValue();
        try {
            return switch (tag) {
                case "long" -> requireIntegral(tag, value).longValue();
                case "float" -> (float) requireNumber(tag, value).doubleValue();
                case "decimal" -> new BigDecimal(requireText(tag, value));
                case "biginteger" -> new BigInteger(requireText(tag, value));
                case "bytes" -> Base64.getDecoder().decode(requireText(tag, value));
                case "instant" -> Instant.parse(requireText(tag, value));
                case "offset_datetime" -> OffsetDateTime.parse(requireText(tag, value));
                case "datetime" -> LocalDateTime.parse(requireText(tag, value));
                case "date" -> LocalDate.parse(requireText(tag, value));
                case "map" -> {
                    if (!value.isObject()) {
                        throw new StateCodecException("Malformed map marker: " + node);
                    }
                    yield readObject(value);
                }
                default -> throw new StateCodecException("Unknown type marker: " + tag);
            };
        } catch (DateTimeException | IllegalArgumentException e) {
            throw new StateCodecException("Malformed " + tag + " marker value: " + value, e);
        }
    }

    private String requireText(String tag, JsonNode value) {
        if (!value.isTextual()) {
            throw new StateCodecException("Marker " + tag + " expects a string value");
        }
        return value.textValue();
    }

    private JsonNode requireNumber(String tag, JsonNode value) {
        if (!value.isNumber()) {
            throw new StateCodecException("Marker " + tag + " expects a numeric value");
        }
        return value;
    }

    private JsonNode requireIntegral(String tag, JsonNode value) {
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new StateCodecException("Marker " + tag + " expects an integral value");
        }
        return value;
    }

    private byte[] compress(byte[] raw, CompressionType compression) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(32, raw.length / 2));
        try {
            switch (compression) {
                case NONE -> {
                    return raw.clone();
                }
                case GZIP -> {
                    try (OutputStream out = new GZIPOutputStream(buffer)) {
                        out.write(raw);
                    }
                }
                case LZMA -> {
                    try (OutputStream out = new LZMAOutputStream(buffer, new LZMA2Options(), -1L)) {
                        out.write(raw);
                    }
                }
            }
        } catch (IOException e) {
            throw new StateCodecException("Failed to compress state with " + compression, e);
        }
        return buffer.toByteArray();
    }

    private byte[] decompress(byte[] bytes, CompressionType compression) {
        try {
            switch (compression) {
                case NONE -> {
                    return bytes;
                }
                case GZIP -> {
                    try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(bytes))) {
                        return in.readAllBytes();
                    }
                }
                case LZMA -> {
                    try (InputStream in = new LZMAInputStream(new ByteArrayInputStream(bytes))) {
                        return in.readAllBytes();
                    }
                }
                default -> throw new StateCodecException("Unsupported compression: " + compression);
            }
        } catch (IOException e) {
            throw new StateCodecException("Failed to decompress state with " + compression, e);
        }
    }
}
