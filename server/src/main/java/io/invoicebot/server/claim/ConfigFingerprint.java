package io.invoicebot.server.claim;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.invoicebot.server.common.HashUtils;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Stable digest of a job config. Object keys are sorted at every depth, array order is significant.
 */
@Component
public class ConfigFingerprint {

    private final ObjectMapper objectMapper;

    public ConfigFingerprint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String canonicalJson(Map<String, ?> config) {
        JsonNode tree = config == null ? NullNode.instance : objectMapper.valueToTree(config);
        try {
            return objectMapper.writeValueAsString(sortedCopy(tree));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job config cannot be rendered as JSON", e);
        }
    }

    public String hash(Map<String, ?> config, int length) {
        return HashUtils.shortSha256Hex(canonicalJson(config), length);
    }

    private JsonNode sortedCopy(JsonNode node) {
        if (node.isObject()) {
            Map<String, JsonNode> fields = new TreeMap<>();
            node.fields().forEachRemaining(field -> fields.put(field.getKey(), sortedCopy(field.getValue())));
            ObjectNode sorted = objectMapper.createObjectNode();
            sorted.setAll(fields);
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode copy = objectMapper.createArrayNode();
            node.forEach(child -> copy.add(sortedCopy(child)));
            return copy;
        }
        return node;
    }
}
