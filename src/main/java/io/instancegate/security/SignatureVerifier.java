package io.instancegate.security;

import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

public final class SignatureVerifier {
    public static final int PUBLIC_KEY_LENGTH = Ed25519PublicKeyParameters.KEY_SIZE;
    public static final int SIGNATURE_LENGTH = 64;

    private SignatureVerifier() {
    }

    public static boolean verify(byte[] publicKey, byte[] message, byte[] signature) {
        if (publicKey == null || publicKey.length != PUBLIC_KEY_LENGTH) {
            return false;
        }
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            return false;
        }
        if (message == null) {
            return false;
        }
        try {
            Ed25519PublicKeyParameters key = new Ed25519PublicKeyParameters(publicKey, 0);
            Ed25519Signer verifier = new Ed25519Signer();
            verifier.init(false, key);
            verifier.update(message, 0, message.length);
            return verifier.verifySignature(signature);
        } catch (IllegalArgumentException | IllegalStateException e) {
            // Point decoding failure on a non-canonical or off-curve key.
            return false;
        }
    }
}
