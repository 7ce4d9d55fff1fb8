package io.instancegate.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.instancegate.config.GatewaySettings;
import io.instancegate.config.InstanceGateConfig;
import io.instancegate.model.InstanceView;
import io.instancegate.model.LifecycleRecord;
import io.instancegate.observability.AuditLogger;
import io.instancegate.security.InstanceKey;
import io.instancegate.security.SignatureVerifier;
import io.instancegate.storage.Database;
import io.instancegate.storage.LifecycleStore;
import io.instancegate.storage.StorageException;
import io.instancegate.util.HexCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Transport-agnostic request gateway for one instance.
 * <p>
 * Every mutating call runs under the instance's lock as read, transition, compare-and-swap.
 * A lost swap re-reads and re-applies the transition against the fresh record, so the
 * precondition is always evaluated against what is actually committed. Storage errors are
 * retried a bounded number of times; after a failed commit the record is re-read, and if it
 * already equals the intended successor the commit is treated as having happened.
 */
public final class InstanceGateRuntime {
    private static final int OWNER_TOKEN_BYTES = 32;
    private static final int MAX_SWAP_ROUNDS = 16;
    private static final String ANONYMOUS = "anonymous";

    private final InstanceGateConfig config;
    private final GatewaySettings settings;
    private final Database database;
    private final LifecycleStore store;
    private final InstanceKey instanceKey;
    private final AuditLogger auditLogger;
    private final LifecycleStateMachine stateMachine;
    private final ConcurrentMap<String, ReentrantLock> instanceLocks;
    private final LongSupplier clock;

    public InstanceGateRuntime(InstanceGateConfig config) {
        this(config, GatewaySettings.load(config.settingsFile()));
    }

    public InstanceGateRuntime(InstanceGateConfig config, GatewaySettings settings) {
        this(config, settings, System::currentTimeMillis);
    }

    InstanceGateRuntime(InstanceGateConfig config, GatewaySettings settings, LongSupplier clock) {
        this(config, settings, clock, LifecycleStore::new);
    }

    InstanceGateRuntime(
            InstanceGateConfig config,
            GatewaySettings settings,
            LongSupplier clock,
            Function<Database, LifecycleStore> storeFactory
    ) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.database = new Database(config);
        this.store = storeFactory.apply(database);
        this.instanceKey = InstanceKey.loadOrCreate(config.instanceKeyFile());
        this.auditLogger = new AuditLogger(config.auditFile(), loadOrCreateAuditSigningSecret(config.auditSigningKeyFile()));
        SecureRandom random = new SecureRandom();
        this.stateMachine = new LifecycleStateMachine(instanceKey, settings.persistRoot(), () -> mintOwnerToken(random));
        this.instanceLocks = new ConcurrentHashMap<>();
    }

    public void init() {
        database.init();
    }

    public InstanceGateConfig config() {
        return config;
    }

    public GatewaySettings settings() {
        return settings;
    }

    public String instancePubkeyHex() {
        return instanceKey.publicKeyHex();
    }

    public String registerOperator(String pubkeyHex, String signatureHex) {
        byte[] pubkey = requireHexField("pubkey", pubkeyHex);
        byte[] signature = signatureBytes(signatureHex);
        LifecycleRecord committed = transition("operator.register", HexCodec.normalize(pubkeyHex),
                (current, now) -> stateMachine.registerOperator(current, pubkey, signature, now));
        return committed.ownerToken().value();
    }

    public InstanceView registerOwner(String pubkeyHex, String signatureHex, String ownerToken) {
        byte[] pubkey = requireHexField("pubkey", pubkeyHex);
        byte[] signature = signatureBytes(signatureHex);
        LifecycleRecord committed = transition("owner.register", HexCodec.normalize(pubkeyHex),
                (current, now) -> stateMachine.registerOwner(current, pubkey, signature, ownerToken, now));
        return InstanceView.of(committed);
    }

    public InstanceView configureWorkload(JsonNode payload, String signatureHex) {
        byte[] signature = requireSignatureHeader(signatureHex);
        LifecycleRecord committed = transition("workload.configure", "owner",
                (current, now) -> stateMachine.configureWorkload(current, payload, signature, now));
        return InstanceView.of(committed);
    }

    public InstanceView exposeWorkload(JsonNode payload, String signatureHex) {
        byte[] signature = requireSignatureHeader(signatureHex);
        LifecycleRecord committed = transition("workload.expose", "owner",
                (current, now) -> stateMachine.exposeWorkload(current, payload, signature, now));
        return InstanceView.of(committed);
    }

    public InstanceView getInstance(String pubkeyHex) {
        if (pubkeyHex == null || HexCodec.decodeExact(pubkeyHex, SignatureVerifier.PUBLIC_KEY_LENGTH).isEmpty()) {
            throw GatewayException.badRequest("Invalid instance pubkey");
        }
        String key = HexCodec.normalize(pubkeyHex);
        try {
            if (key.equals(instancePubkeyHex())) {
                return InstanceView.of(store.get(key));
            }
            return store.find(key)
                    .map(InstanceView::of)
                    .orElseThrow(() -> GatewayException.badRequest("Instance not found"));
        } catch (StorageException e) {
            throw new GatewayException(FailureKind.STORAGE_FAILURE, "Storage failure", e);
        }
    }

    public List<InstanceView> listInstances(int limit) {
        try {
            return store.list(limit).stream().map(InstanceView::of).toList();
        } catch (StorageException e) {
            throw new GatewayException(FailureKind.STORAGE_FAILURE, "Storage failure", e);
        }
    }

    public boolean reset(String pubkeyHex, String actor) {
        String key = pubkeyHex == null || pubkeyHex.isBlank() ? instancePubkeyHex() : HexCodec.normalize(pubkeyHex);
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            boolean deleted = store.delete(key);
            audit("instance.reset", actor, key, "ok", Map.of("deleted", deleted));
            return deleted;
        } finally {
            lock.unlock();
        }
    }

    public List<JsonNode> auditTail(int limit) {
        return auditLogger.tail(limit);
    }

    public AuditLogger.VerifyOutcome auditVerify() {
        return auditLogger.verify();
    }

    public List<Database.SchemaMigrationRow> schemaMigrations(int limit) {
        return database.listSchemaMigrations(limit);
    }

    private LifecycleRecord transition(String action, String actor, Transition step) {
        String key = instancePubkeyHex();
        ReentrantLock lock = lockFor(key);
        lock.lock();
        try {
            for (int round = 1; round <= MAX_SWAP_ROUNDS; round++) {
                LifecycleRecord current = read(key);
                LifecycleRecord next = step.apply(current, clock.getAsLong());
                if (commit(key, current, next)) {
                    audit(action, actor, key, "ok", Map.of(
                            "state", next.state().name(),
                            "version", next.version()
                    ));
                    return next;
                }
            }
            throw new GatewayException(FailureKind.STORAGE_FAILURE,
                    "Storage failure: concurrent modification did not settle");
        } catch (GatewayException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("error", e.getMessage());
            audit(action, actor, key, e.kind().auditResult(), details);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    private LifecycleRecord read(String key) {
        StorageException last = null;
        for (int attempt = 0; attempt < settings.storageRetryAttempts(); attempt++) {
            try {
                return store.get(key);
            } catch (StorageException e) {
                last = e;
            }
        }
        throw new GatewayException(FailureKind.STORAGE_FAILURE, "Storage failure", last);
    }

    private boolean commit(String key, LifecycleRecord current, LifecycleRecord next) {
        StorageException last = null;
        for (int attempt = 0; attempt < settings.storageRetryAttempts(); attempt++) {
            try {
                return store.compareAndSwap(key, current.version(), next);
            } catch (StorageException e) {
                last = e;
                Optional<LifecycleRecord> stored;
                try {
                    stored = store.find(key);
                } catch (StorageException readFailure) {
                    last.addSuppressed(readFailure);
                    continue;
                }
                if (stored.isPresent() && stored.get().equals(next)) {
                    return true;
                }
                if (stored.isPresent() && stored.get().version() != current.version()) {
                    return false;
                }
            }
        }
        throw new GatewayException(FailureKind.STORAGE_FAILURE, "Storage failure", last);
    }

    private ReentrantLock lockFor(String key) {
        return instanceLocks.computeIfAbsent(key, k -> new ReentrantLock());
    }

    // Runs after the outcome is decided. A failed audit write never changes it.
    private void audit(String action, String actor, String resource, String result, Map<String, Object> details) {
        try {
            auditLogger.log(AuditLogger.AuditEvent.of(
                    action,
                    actor == null || actor.isBlank() ? ANONYMOUS : actor,
                    resource,
                    result,
                    details
            ));
        } catch (RuntimeException e) {
            System.err.println("WARN audit write failed for " + action + " (" + result + "): " + e.getMessage());
        }
    }

    private static byte[] requireHexField(String field, String raw) {
        if (raw == null || raw.isBlank()) {
            throw GatewayException.badRequest("Missing field: " + field);
        }
        return HexCodec.decode(raw)
                .orElseThrow(() -> GatewayException.badRequest("Invalid field: " + field + " must be hex"));
    }

    private static byte[] signatureBytes(String raw) {
        if (raw == null || raw.isBlank()) {
            throw GatewayException.badRequest("Missing field: signature");
        }
        // Undecodable signatures fail verification like any other bad signature.
        return HexCodec.decode(raw).orElse(new byte[0]);
    }

    private static byte[] requireSignatureHeader(String raw) {
        if (raw == null || raw.isBlank()) {
            throw GatewayException.unauthorized("Missing signature");
        }
        return HexCodec.decode(raw).orElse(new byte[0]);
    }

    private static String mintOwnerToken(SecureRandom random) {
        byte[] bytes = new byte[OWNER_TOKEN_BYTES];
        random.nextBytes(bytes);
        return HexCodec.encode(bytes);
    }

    private static String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    @FunctionalInterface
    private interface Transition {
        LifecycleRecord apply(LifecycleRecord current, long nowMs);
    }
}
