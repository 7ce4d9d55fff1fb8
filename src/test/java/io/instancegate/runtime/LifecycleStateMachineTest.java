package io.instancegate.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.instancegate.Principal;
import io.instancegate.model.LifecycleRecord;
import io.instancegate.model.LifecycleState;
import io.instancegate.security.CanonicalPayload;
import io.instancegate.security.InstanceKey;
import io.instancegate.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

final class LifecycleStateMachineTest {
    private final InstanceKey instanceKey = InstanceKey.generate(new SecureRandom());
    private final AtomicInteger minted = new AtomicInteger();
    private final LifecycleStateMachine machine =
            new LifecycleStateMachine(instanceKey, "/", () -> "token-" + minted.incrementAndGet());
    private final Principal operator = Principal.generate();
    private final Principal owner = Principal.generate();

    @Test
    void operatorRegistrationCounterSignsAndMintsToken() {
        LifecycleRecord next = registerOperator(empty());
        Assertions.assertEquals(LifecycleState.OPERATOR_REGISTERED, next.state());
        Assertions.assertEquals("token-1", next.ownerToken().value());
        Assertions.assertEquals(operator.pubkeyHex(), next.operator().pubkey());
        Assertions.assertTrue(next.operator().verify(instanceKey.publicKeyHex()));
    }

    @Test
    void secondOperatorIsConflict() {
        LifecycleRecord registered = registerOperator(empty());
        Principal intruder = Principal.generate();
        GatewayException e = Assertions.assertThrows(GatewayException.class, () -> machine.registerOperator(
                registered, intruder.publicKey(), intruder.sign(instanceKey.publicKey()), 2L));
        Assertions.assertEquals(FailureKind.CONFLICT, e.kind());
        Assertions.assertEquals("Operator already registered", e.getMessage());
    }

    @Test
    void operatorSignatureOverWrongMessageIsUnauthorized() {
        GatewayException e = Assertions.assertThrows(GatewayException.class, () -> machine.registerOperator(
                empty(), operator.publicKey(), operator.sign(new byte[]{1, 2, 3}), 1L));
        Assertions.assertEquals(FailureKind.UNAUTHORIZED, e.kind());
    }

    @Test
    void ownerBeforeOperatorIsUnauthorized() {
        GatewayException e = Assertions.assertThrows(GatewayException.class, () -> machine.registerOwner(
                empty(), owner.publicKey(), owner.sign(instanceKey.publicKey()), "token-1", 1L));
        Assertions.assertEquals(FailureKind.UNAUTHORIZED, e.kind());
        Assertions.assertEquals("Operator not registered", e.getMessage());
    }

    @Test
    void ownerTokenMustMatchAndIsSpentOnce() {
        LifecycleRecord withOperator = registerOperator(empty());
        byte[] ownerSig = owner.sign(instanceKey.publicKey());

        GatewayException wrong = Assertions.assertThrows(GatewayException.class,
                () -> machine.registerOwner(withOperator, owner.publicKey(), ownerSig, "token-999", 2L));
        Assertions.assertEquals("Invalid owner token", wrong.getMessage());
        GatewayException missing = Assertions.assertThrows(GatewayException.class,
                () -> machine.registerOwner(withOperator, owner.publicKey(), ownerSig, null, 2L));
        Assertions.assertEquals("Missing owner token", missing.getMessage());

        LifecycleRecord withOwner = machine.registerOwner(withOperator, owner.publicKey(), ownerSig, "token-1", 2L);
        Assertions.assertEquals(LifecycleState.OWNER_REGISTERED, withOwner.state());
        Assertions.assertTrue(withOwner.owner().verify(instanceKey.publicKeyHex()));

        Principal second = Principal.generate();
        GatewayException replay = Assertions.assertThrows(GatewayException.class, () -> machine.registerOwner(
                withOwner, second.publicKey(), second.sign(instanceKey.publicKey()), "token-1", 3L));
        Assertions.assertEquals(FailureKind.UNAUTHORIZED, replay.kind());
        Assertions.assertEquals("Owner token already consumed", replay.getMessage());
    }

    @Test
    void configureRequiresOwnerAndValidSignature() {
        ObjectNode config = config(8080);
        GatewayException noOwner = Assertions.assertThrows(GatewayException.class, () -> machine.configureWorkload(
                registerOperator(empty()), config, owner.sign(CanonicalPayload.bytes(config)), 2L));
        Assertions.assertEquals(FailureKind.UNAUTHORIZED, noOwner.kind());

        LifecycleRecord withOwner = ownerRegistered();
        GatewayException badSig = Assertions.assertThrows(GatewayException.class, () -> machine.configureWorkload(
                withOwner, config, operator.sign(CanonicalPayload.bytes(config)), 3L));
        Assertions.assertEquals(FailureKind.UNAUTHORIZED, badSig.kind());

        LifecycleRecord configured = machine.configureWorkload(withOwner, config, owner.sign(CanonicalPayload.bytes(config)), 3L);
        Assertions.assertEquals(LifecycleState.WORKLOAD_CONFIGURED, configured.state());
        Assertions.assertEquals(8080, configured.workloadConfig().port());
    }

    @Test
    void configureValidationFailuresAreBadRequest() {
        LifecycleRecord withOwner = ownerRegistered();

        ObjectNode negativePort = config(-1);
        assertBadRequest(withOwner, negativePort, "Invalid field: port must be an integer in [1, 65535]");

        ObjectNode missingPort = config(8080);
        missingPort.remove("port");
        assertBadRequest(withOwner, missingPort, "Missing field: port");

        ObjectNode unsafe = config(8080);
        unsafe.putArray("persist_dirs").add("/var/log/nginx/../../etc/passwd");
        assertBadRequest(withOwner, unsafe, "Invalid directory path");

        ObjectNode foreign = config(8080);
        foreign.put("instance_pubkey", "bb".repeat(32));
        assertBadRequest(withOwner, foreign, "Invalid field: instance_pubkey does not match this instance");

        ObjectNode fractional = config(8080);
        fractional.put("port", 80.5);
        assertBadRequest(withOwner, fractional, null);
    }

    @Test
    void persistDirsAreNormalizedAndOneBadEntryRejectsAll() {
        LifecycleRecord withOwner = ownerRegistered();

        ObjectNode messy = config(8080);
        messy.putArray("persist_dirs").add("//var/./log//nginx/").add("/etc/nginx/conf.d");
        LifecycleRecord configured = machine.configureWorkload(
                withOwner, messy, owner.sign(CanonicalPayload.bytes(messy)), 3L);
        Assertions.assertEquals(List.of("/var/log/nginx", "/etc/nginx/conf.d"),
                configured.workloadConfig().persistDirs());

        ObjectNode lastBad = config(8080);
        lastBad.putArray("persist_dirs").add("/var/log/nginx").add("/etc/nginx/conf.d").add("../x");
        assertBadRequest(withOwner, lastBad, "Invalid directory path");

        ObjectNode notText = config(8080);
        notText.putArray("persist_dirs").add("/var/log/nginx").add(7);
        assertBadRequest(withOwner, notText, "Invalid field: persist_dirs must be an array of strings");
    }

    @Test
    void reconfigureIsAllowedUntilExposed() {
        LifecycleRecord first = configured(config(8080));
        ObjectNode update = config(9090);
        LifecycleRecord second = machine.configureWorkload(first, update, owner.sign(CanonicalPayload.bytes(update)), 5L);
        Assertions.assertEquals(9090, second.workloadConfig().port());
        Assertions.assertEquals(first.version() + 1, second.version());

        ObjectNode expose = exposeBody("nginx:latest");
        LifecycleRecord exposed = machine.exposeWorkload(second, expose, owner.sign(CanonicalPayload.bytes(expose)), 6L);
        Assertions.assertTrue(exposed.workloadExposed());

        GatewayException finalized = Assertions.assertThrows(GatewayException.class, () -> machine.configureWorkload(
                exposed, update, owner.sign(CanonicalPayload.bytes(update)), 7L));
        Assertions.assertEquals(FailureKind.CONFLICT, finalized.kind());
        GatewayException reExpose = Assertions.assertThrows(GatewayException.class, () -> machine.exposeWorkload(
                exposed, expose, owner.sign(CanonicalPayload.bytes(expose)), 7L));
        Assertions.assertEquals(FailureKind.CONFLICT, reExpose.kind());
    }

    @Test
    void exposeBeforeConfigureIsBadRequest() {
        ObjectNode expose = exposeBody("nginx:latest");
        GatewayException e = Assertions.assertThrows(GatewayException.class, () -> machine.exposeWorkload(
                ownerRegistered(), expose, owner.sign(CanonicalPayload.bytes(expose)), 4L));
        Assertions.assertEquals(FailureKind.BAD_REQUEST, e.kind());
        Assertions.assertEquals("Workload not configured", e.getMessage());
    }

    @Test
    void exposeWithDifferentImageIsUnauthorized() {
        LifecycleRecord configured = configured(config(8080));
        ObjectNode expose = exposeBody("evil:latest");
        GatewayException e = Assertions.assertThrows(GatewayException.class, () -> machine.exposeWorkload(
                configured, expose, owner.sign(CanonicalPayload.bytes(expose)), 5L));
        Assertions.assertEquals(FailureKind.UNAUTHORIZED, e.kind());
    }

    private void assertBadRequest(LifecycleRecord record, ObjectNode body, String message) {
        byte[] signature = body.has("port") && body.get("port").isFloatingPointNumber()
                ? owner.sign(new byte[]{0})
                : owner.sign(CanonicalPayload.bytes(body));
        GatewayException e = Assertions.assertThrows(GatewayException.class,
                () -> machine.configureWorkload(record, body, signature, 3L));
        Assertions.assertEquals(FailureKind.BAD_REQUEST, e.kind());
        if (message != null) {
            Assertions.assertEquals(message, e.getMessage());
        }
    }

    private LifecycleRecord empty() {
        return LifecycleRecord.unregistered(instanceKey.publicKeyHex());
    }

    private LifecycleRecord registerOperator(LifecycleRecord current) {
        return machine.registerOperator(current, operator.publicKey(), operator.sign(instanceKey.publicKey()), 1L);
    }

    private LifecycleRecord ownerRegistered() {
        return machine.registerOwner(registerOperator(empty()), owner.publicKey(), owner.sign(instanceKey.publicKey()),
                "token-" + minted.get(), 2L);
    }

    private LifecycleRecord configured(ObjectNode config) {
        return machine.configureWorkload(ownerRegistered(), config, owner.sign(CanonicalPayload.bytes(config)), 3L);
    }

    private ObjectNode config(int port) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("instance_pubkey", instanceKey.publicKeyHex());
        node.put("image", "nginx:latest");
        node.putArray("persist_dirs").add("/var/log/nginx").add("/etc/nginx/conf.d");
        node.put("port", port);
        return node;
    }

    private ObjectNode exposeBody(String image) {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("instance_pubkey", instanceKey.publicKeyHex());
        node.put("image", image);
        return node;
    }
}
