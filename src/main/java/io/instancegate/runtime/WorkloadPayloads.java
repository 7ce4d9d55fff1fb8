package io.instancegate.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.instancegate.model.WorkloadConfig;
import io.instancegate.security.PathSafetyValidator;
import io.instancegate.security.PathSafetyValidator.PathValidation;
import io.instancegate.security.SignatureVerifier;
import io.instancegate.util.HexCodec;

import java.util.ArrayList;
import java.util.List;

final class WorkloadPayloads {
    private WorkloadPayloads() {
    }

    static WorkloadConfig parseConfigure(JsonNode payload, String instancePubkeyHex, String persistRoot) {
        String instancePubkey = requireInstancePubkey(payload, instancePubkeyHex);
        String image = requireImage(payload);

        JsonNode dirsNode = payload.get("persist_dirs");
        if (dirsNode == null || dirsNode.isNull()) {
            throw GatewayException.badRequest("Missing field: persist_dirs");
        }
        if (!dirsNode.isArray()) {
            throw GatewayException.badRequest("Invalid field: persist_dirs must be an array of strings");
        }
        List<String> normalized = new ArrayList<>(dirsNode.size());
        for (JsonNode dir : dirsNode) {
            if (!dir.isTextual()) {
                throw GatewayException.badRequest("Invalid field: persist_dirs must be an array of strings");
            }
            PathValidation validation = PathSafetyValidator.validate(dir.asText(), persistRoot);
            if (!validation.valid()) {
                throw GatewayException.badRequest(PathSafetyValidator.INVALID_PATH);
            }
            normalized.add(validation.normalizedPath());
        }

        JsonNode portNode = payload.get("port");
        if (portNode == null || portNode.isNull()) {
            throw GatewayException.badRequest("Missing field: port");
        }
        if (!portNode.isIntegralNumber() || !portNode.canConvertToInt()
                || portNode.asInt() < WorkloadConfig.MIN_PORT || portNode.asInt() > WorkloadConfig.MAX_PORT) {
            throw GatewayException.badRequest("Invalid field: port must be an integer in ["
                    + WorkloadConfig.MIN_PORT + ", " + WorkloadConfig.MAX_PORT + "]");
        }
        return new WorkloadConfig(instancePubkey, image, normalized, portNode.asInt());
    }

    static ExposeRequest parseExpose(JsonNode payload, String instancePubkeyHex) {
        String instancePubkey = requireInstancePubkey(payload, instancePubkeyHex);
        String image = requireImage(payload);
        return new ExposeRequest(instancePubkey, image);
    }

    private static String requireInstancePubkey(JsonNode payload, String instancePubkeyHex) {
        JsonNode node = payload.get("instance_pubkey");
        if (node == null || node.isNull()) {
            throw GatewayException.badRequest("Missing field: instance_pubkey");
        }
        if (!node.isTextual() || HexCodec.decodeExact(node.asText(), SignatureVerifier.PUBLIC_KEY_LENGTH).isEmpty()) {
            throw GatewayException.badRequest("Invalid field: instance_pubkey must be 32 bytes of hex");
        }
        String value = HexCodec.normalize(node.asText());
        if (!value.equals(HexCodec.normalize(instancePubkeyHex))) {
            throw GatewayException.badRequest("Invalid field: instance_pubkey does not match this instance");
        }
        return value;
    }

    private static String requireImage(JsonNode payload) {
        JsonNode node = payload.get("image");
        if (node == null || node.isNull()) {
            throw GatewayException.badRequest("Missing field: image");
        }
        if (!node.isTextual() || node.asText().isBlank()) {
            throw GatewayException.badRequest("Invalid field: image must be a non-empty string");
        }
        return node.asText();
    }

    record ExposeRequest(String instancePubkey, String image) {
    }
}
