package io.instancegate.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.instancegate.util.Jsons;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Canonical byte form of a signed request body, schema {@value #VERSION}.
 *
 * <p>Rules: object members sorted by key in UTF-16 code unit order, array order preserved, no
 * insignificant whitespace, integers in plain decimal, UTF-8 output. Floating-point
 * numbers are not representable and are rejected, so two payloads that parse to the same
 * tree always yield the same bytes.
 */
public final class CanonicalPayload {
    public static final String VERSION = "instancegate.canonical.v1";

    private CanonicalPayload() {
    }

    public static byte[] bytes(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("Canonical payload must be a JSON object");
        }
        JsonNode sorted = canonicalize(payload);
        try {
            return Jsons.compactMapper().writeValueAsString(sorted).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Canonical payload is not serializable", e);
        }
    }

    public static String text(JsonNode payload) {
        return new String(bytes(payload), StandardCharsets.UTF_8);
    }

    private static JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            names.sort(String::compareTo);
            ObjectNode out = Jsons.compactMapper().createObjectNode();
            for (String name : names) {
                out.set(name, canonicalize(node.get(name)));
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = Jsons.compactMapper().createArrayNode();
            Iterator<JsonNode> it = node.elements();
            while (it.hasNext()) {
                out.add(canonicalize(it.next()));
            }
            return out;
        }
        if (node.isNumber() && !node.isIntegralNumber()) {
            throw new IllegalArgumentException("Non-integral numbers are not allowed in signed payloads");
        }
        if (node.isBinary() || node.isPojo()) {
            throw new IllegalArgumentException("Unsupported node type in signed payload: " + node.getNodeType());
        }
        return node;
    }
}
