package io.instancegate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.instancegate.security.SignatureVerifier;
import io.instancegate.util.HexCodec;

public record IdentityInfo(
        @JsonProperty("pubkey") String pubkey,
        @JsonProperty("instance_signature") String instanceSignature,
        @JsonProperty("identity_signature") String identitySignature
) {
    public IdentityInfo {
        pubkey = HexCodec.normalize(pubkey);
        instanceSignature = HexCodec.normalize(instanceSignature);
        identitySignature = HexCodec.normalize(identitySignature);
    }

    public boolean verify(String instancePubkeyHex) {
        byte[] instanceKey = HexCodec.decode(instancePubkeyHex).orElse(null);
        byte[] principalKey = HexCodec.decode(pubkey).orElse(null);
        byte[] principalSig = HexCodec.decode(instanceSignature).orElse(null);
        byte[] instanceSig = HexCodec.decode(identitySignature).orElse(null);
        if (instanceKey == null || principalKey == null || principalSig == null || instanceSig == null) {
            return false;
        }
        return SignatureVerifier.verify(principalKey, instanceKey, principalSig)
                && SignatureVerifier.verify(instanceKey, principalKey, instanceSig);
    }
}
