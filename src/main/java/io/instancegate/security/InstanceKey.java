package io.instancegate.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.instancegate.util.HexCodec;
import io.instancegate.util.Jsons;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;
import java.util.Arrays;

public final class InstanceKey {
    private static final String SCHEMA = "instancegate.instance.key.v1";

    private final Ed25519PrivateKeyParameters privateKey;
    private final Ed25519PublicKeyParameters publicKey;
    private final byte[] publicKeyBytes;

    private InstanceKey(Ed25519PrivateKeyParameters privateKey) {
        this.privateKey = privateKey;
        this.publicKey = privateKey.generatePublicKey();
        this.publicKeyBytes = publicKey.getEncoded();
    }

    public static InstanceKey fromSeed(byte[] seed) {
        if (seed == null || seed.length != Ed25519PrivateKeyParameters.KEY_SIZE) {
            throw new IllegalArgumentException("Instance key seed must be "
                    + Ed25519PrivateKeyParameters.KEY_SIZE + " bytes");
        }
        return new InstanceKey(new Ed25519PrivateKeyParameters(seed, 0));
    }

    public static InstanceKey generate(SecureRandom random) {
        return new InstanceKey(new Ed25519PrivateKeyParameters(random));
    }

    public static synchronized InstanceKey loadOrCreate(Path keyFile) {
        if (Files.exists(keyFile)) {
            return load(keyFile);
        }
        InstanceKey created = generate(new SecureRandom());
        created.persist(keyFile);
        return created;
    }

    private static InstanceKey load(Path keyFile) {
        try {
            JsonNode node = Jsons.mapper().readTree(Files.readString(keyFile, StandardCharsets.UTF_8));
            String schema = node.path("schema").asText("");
            if (!SCHEMA.equals(schema)) {
                throw new IllegalStateException("Unsupported instance key schema: " + schema);
            }
            byte[] seed = HexCodec.decodeExact(node.path("seed").asText(""), Ed25519PrivateKeyParameters.KEY_SIZE)
                    .orElseThrow(() -> new IllegalStateException("Instance key seed is malformed"));
            InstanceKey key = fromSeed(seed);
            String recordedPubkey = node.path("pubkey").asText("");
            if (!recordedPubkey.isBlank() && !recordedPubkey.equalsIgnoreCase(key.publicKeyHex())) {
                throw new IllegalStateException("Instance key file pubkey does not match its seed");
            }
            return key;
        } catch (IOException e) {
            throw new RuntimeException("Failed to load instance key: " + keyFile, e);
        }
    }

    private void persist(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            ObjectNode root = Jsons.mapper().createObjectNode();
            root.put("schema", SCHEMA);
            root.put("seed", HexCodec.encode(privateKey.getEncoded()));
            root.put("pubkey", publicKeyHex());
            Path tmp = keyFile.resolveSibling(keyFile.getFileName() + ".tmp");
            Files.writeString(tmp, Jsons.toJson(root), StandardCharsets.UTF_8);
            if (tmp.getFileSystem().supportedFileAttributeViews().contains("posix")) {
                Files.setPosixFilePermissions(tmp, PosixFilePermissions.fromString("rw-------"));
            }
            Files.move(tmp, keyFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new RuntimeException("Failed to persist instance key: " + keyFile, e);
        }
    }

    public byte[] publicKey() {
        return Arrays.copyOf(publicKeyBytes, publicKeyBytes.length);
    }

    public String publicKeyHex() {
        return HexCodec.encode(publicKeyBytes);
    }

    public byte[] sign(byte[] message) {
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, privateKey);
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }
}
