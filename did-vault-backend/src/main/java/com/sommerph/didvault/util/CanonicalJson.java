package com.sommerph.didvault.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Deterministic JSON rendering: object keys sorted recursively, null members
 * dropped, no whitespace. Array order is preserved.
 */
public class CanonicalJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CanonicalJson() {}

    public static String serialize(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(canonicalize(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render canonical JSON", e);
        }
    }

    static JsonNode canonicalize(JsonNode node) {
        if (node == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> it = node.fieldNames();
            while (it.hasNext()) {
                names.add(it.next());
            }
            names.sort(null);
            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                JsonNode child = node.get(name);
                if (child == null || child.isNull()) continue;
                sorted.set(name, canonicalize(child));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            for (JsonNode child : node) {
                array.add(canonicalize(child));
            }
            return array;
        }
        return node;
    }

}
