package io.instancegate.security;

import io.instancegate.Principal;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

final class SignatureVerifierTest {

    @Test
    void acceptsSignatureProducedByMatchingKey() {
        Principal signer = Principal.generate();
        byte[] message = "instance-pubkey-bytes".getBytes(StandardCharsets.UTF_8);
        Assertions.assertTrue(SignatureVerifier.verify(signer.publicKey(), message, signer.sign(message)));
    }

    @Test
    void rejectsSignatureFromAnotherKey() {
        Principal signer = Principal.generate();
        Principal other = Principal.generate();
        byte[] message = "hello".getBytes(StandardCharsets.UTF_8);
        Assertions.assertFalse(SignatureVerifier.verify(other.publicKey(), message, signer.sign(message)));
    }

    @Test
    void rejectsTamperedMessageAndSignature() {
        Principal signer = Principal.generate();
        byte[] message = "payload".getBytes(StandardCharsets.UTF_8);
        byte[] signature = signer.sign(message);

        byte[] tamperedMessage = "paylaod".getBytes(StandardCharsets.UTF_8);
        Assertions.assertFalse(SignatureVerifier.verify(signer.publicKey(), tamperedMessage, signature));

        byte[] tamperedSignature = signature.clone();
        tamperedSignature[10] ^= 0x01;
        Assertions.assertFalse(SignatureVerifier.verify(signer.publicKey(), message, tamperedSignature));
    }

    @Test
    void malformedInputsVerifyAsFalse() {
        Principal signer = Principal.generate();
        byte[] message = new byte[]{1, 2, 3};
        byte[] signature = signer.sign(message);

        Assertions.assertFalse(SignatureVerifier.verify(null, message, signature));
        Assertions.assertFalse(SignatureVerifier.verify(new byte[31], message, signature));
        Assertions.assertFalse(SignatureVerifier.verify(signer.publicKey(), message, Arrays.copyOf(signature, 63)));
        Assertions.assertFalse(SignatureVerifier.verify(signer.publicKey(), message, new byte[0]));
        Assertions.assertFalse(SignatureVerifier.verify(signer.publicKey(), null, signature));
        byte[] garbageKey = new byte[SignatureVerifier.PUBLIC_KEY_LENGTH];
        Arrays.fill(garbageKey, (byte) 0xff);
        Assertions.assertFalse(SignatureVerifier.verify(garbageKey, message, signature));
    }
}
