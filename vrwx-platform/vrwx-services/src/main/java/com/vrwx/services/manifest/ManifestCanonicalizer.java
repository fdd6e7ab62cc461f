package com.vrwx.services.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Deterministic JSON form of manifests and other documents: object keys sorted at every level,
 * array order preserved, null fields omitted, no whitespace. Integral floating point values are
 * written as integers so that {@code 2048.0} and {@code 2048} canonicalize identically.
 */
public final class ManifestCanonicalizer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ManifestCanonicalizer() {}

    public static String canonicalize(ExecutionManifest manifest) {
        return canonicalizeObject(manifest);
    }

    /**
     * Canonical JSON of any Jackson-serializable value, including plain maps.
     */
    public static String canonicalizeObject(Object value) {
        return write(sortKeys(MAPPER.valueToTree(value)));
    }

    public static String canonicalizeJson(String json) {
        try {
            return write(sortKeys(MAPPER.readTree(json)));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON document", e);
        }
    }

    public static ExecutionManifest parse(String json) {
        try {
            return MAPPER.readValue(json, ExecutionManifest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed manifest JSON", e);
        }
    }

    private static JsonNode sortKeys(JsonNode node) {
        if (node == null || node.isNull()) {
            return NODES.nullNode();
        }
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);

            ObjectNode sorted = NODES.objectNode();
            for (String name : names) {
                JsonNode child = node.get(name);
                if (!child.isNull() && !child.isMissingNode()) {
                    sorted.set(name, sortKeys(child));
                }
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = NODES.arrayNode();
            node.forEach(element -> array.add(sortKeys(element)));
            return array;
        }
        if (node.isFloatingPointNumber() && isIntegral(node.doubleValue())) {
            return NODES.numberNode(node.longValue());
        }
        return node;
    }

    private static boolean isIntegral(double value) {
        return value == Math.rint(value) && Math.abs(value) < 9.007199254740992E15;
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize canonical JSON", e);
        }
    }
}
