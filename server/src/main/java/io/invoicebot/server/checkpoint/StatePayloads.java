package io.invoicebot.server.checkpoint;

import java.time.Instant;
import java.util.List;
import java.util.Map;

final class StatePayloads {

    private StatePayloads() {
    }

    static String string(String id, Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value != null && !(value instanceof String)) {
            throw undecodable(id, field);
        }
        return (String) value;
    }

    static Integer integer(String id, Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof Integer i) {
            return i;
        }
        throw undecodable(id, field);
    }

    static Instant instant(String id, Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value != null && !(value instanceof Instant)) {
            throw undecodable(id, field);
        }
        return (Instant) value;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> map(String id, Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value != null && !(value instanceof Map<?, ?>)) {
            throw undecodable(id, field);
        }
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    static <T> List<T> list(String id, Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value != null && !(value instanceof List<?>)) {
            throw undecodable(id, field);
        }
        return (List<T>) value;
    }

    static byte[] bytes(String id, Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value != null && !(value instanceof byte[])) {
            throw undecodable(id, field);
        }
        return (byte[]) value;
    }

    private static CheckpointIntegrityException undecodable(String id, String field) {
        return new CheckpointIntegrityException(id, IntegrityFailure.UNDECODABLE,
            "Payload field '" + field + "' of " + id + " has an unexpected type");
    }
}
