package io.instancegate.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.instancegate.model.IdentityInfo;
import io.instancegate.model.LifecycleRecord;
import io.instancegate.model.LifecycleState;
import io.instancegate.model.OwnerToken;
import io.instancegate.model.WorkloadConfig;
import io.instancegate.security.CanonicalPayload;
import io.instancegate.security.InstanceKey;
import io.instancegate.security.SignatureVerifier;
import io.instancegate.util.HexCodec;

import java.util.function.Supplier;

public final class LifecycleStateMachine {
    private final InstanceKey instanceKey;
    private final String persistRoot;
    private final Supplier<String> tokenMinter;

    public LifecycleStateMachine(InstanceKey instanceKey, String persistRoot, Supplier<String> tokenMinter) {
        this.instanceKey = instanceKey;
        this.persistRoot = persistRoot;
        this.tokenMinter = tokenMinter;
    }

    public LifecycleRecord registerOperator(LifecycleRecord current, byte[] operatorPubkey, byte[] signature, long nowMs) {
        if (current.state() != LifecycleState.UNREGISTERED) {
            throw GatewayException.conflict("Operator already registered");
        }
        if (!SignatureVerifier.verify(operatorPubkey, instanceKey.publicKey(), signature)) {
            throw GatewayException.unauthorized("Invalid operator signature");
        }
        IdentityInfo operator = counterSign(operatorPubkey, signature);
        return current.withOperator(operator, OwnerToken.fresh(tokenMinter.get()), nowMs);
    }

    public LifecycleRecord registerOwner(
            LifecycleRecord current,
            byte[] ownerPubkey,
            byte[] signature,
            String presentedToken,
            long nowMs
    ) {
        if (current.state() == LifecycleState.UNREGISTERED) {
            throw GatewayException.unauthorized("Operator not registered");
        }
        if (presentedToken == null || presentedToken.isBlank()) {
            throw GatewayException.unauthorized("Missing owner token");
        }
        OwnerToken token = current.ownerToken();
        if (!token.matches(presentedToken)) {
            throw GatewayException.unauthorized("Invalid owner token");
        }
        if (token.consumed() || current.state().atLeast(LifecycleState.OWNER_REGISTERED)) {
            throw GatewayException.unauthorized("Owner token already consumed");
        }
        if (!SignatureVerifier.verify(ownerPubkey, instanceKey.publicKey(), signature)) {
            throw GatewayException.unauthorized("Invalid owner signature");
        }
        return current.withOwner(counterSign(ownerPubkey, signature), nowMs);
    }

    public LifecycleRecord configureWorkload(LifecycleRecord current, JsonNode payload, byte[] signature, long nowMs) {
        if (current.state().before(LifecycleState.OWNER_REGISTERED)) {
            throw GatewayException.unauthorized("Owner not registered");
        }
        verifyOwnerSignature(current, payload, signature);
        WorkloadConfig config = WorkloadPayloads.parseConfigure(payload, instanceKey.publicKeyHex(), persistRoot);
        if (current.state() == LifecycleState.WORKLOAD_EXPOSED) {
            throw GatewayException.conflict("Workload config already finalized");
        }
        return current.withWorkload(config, nowMs);
    }

    public LifecycleRecord exposeWorkload(LifecycleRecord current, JsonNode payload, byte[] signature, long nowMs) {
        if (current.state().before(LifecycleState.WORKLOAD_CONFIGURED)) {
            throw GatewayException.badRequest("Workload not configured");
        }
        verifyOwnerSignature(current, payload, signature);
        WorkloadPayloads.ExposeRequest request = WorkloadPayloads.parseExpose(payload, instanceKey.publicKeyHex());
        if (!request.image().equals(current.workloadConfig().image())) {
            throw GatewayException.unauthorized("Instance image mismatch with stored config");
        }
        if (current.state() == LifecycleState.WORKLOAD_EXPOSED) {
            throw GatewayException.conflict("Workload config already finalized");
        }
        return current.exposed(nowMs);
    }

    private void verifyOwnerSignature(LifecycleRecord current, JsonNode payload, byte[] signature) {
        if (payload == null || !payload.isObject()) {
            throw GatewayException.badRequest("Invalid payload");
        }
        byte[] message;
        try {
            message = CanonicalPayload.bytes(payload);
        } catch (IllegalArgumentException e) {
            throw GatewayException.badRequest("Invalid payload: " + e.getMessage());
        }
        byte[] ownerPubkey = HexCodec.decode(current.owner().pubkey())
                .orElseThrow(() -> new IllegalStateException("stored owner pubkey is not hex"));
        if (!SignatureVerifier.verify(ownerPubkey, message, signature)) {
            throw GatewayException.unauthorized("Invalid signature");
        }
    }

    private IdentityInfo counterSign(byte[] principalPubkey, byte[] principalSignature) {
        return new IdentityInfo(
                HexCodec.encode(principalPubkey),
                HexCodec.encode(principalSignature),
                HexCodec.encode(instanceKey.sign(principalPubkey))
        );
    }
}
