package io.instancegate.model;

import java.util.Objects;

/**
 * Aggregate root for one instance. Instances are immutable; every transition produces a
 * new record with {@code version + 1}, which the store uses as its compare-and-swap guard.
 * A version of zero means the record has never been persisted.
 */
public record LifecycleRecord(
        String instancePubkey,
        LifecycleState state,
        IdentityInfo operator,
        OwnerToken ownerToken,
        IdentityInfo owner,
        WorkloadConfig workloadConfig,
        boolean workloadExposed,
        long version,
        long updatedAtMs
) {
    public LifecycleRecord {
        Objects.requireNonNull(instancePubkey, "instancePubkey");
        Objects.requireNonNull(state, "state");
        checkConsistency(state, operator, ownerToken, owner, workloadConfig, workloadExposed);
    }

    public static LifecycleRecord unregistered(String instancePubkey) {
        return new LifecycleRecord(instancePubkey, LifecycleState.UNREGISTERED,
                null, null, null, null, false, 0L, 0L);
    }

    public boolean persisted() {
        return version > 0L;
    }

    public LifecycleRecord withOperator(IdentityInfo operator, OwnerToken token, long nowMs) {
        return new LifecycleRecord(instancePubkey, LifecycleState.OPERATOR_REGISTERED,
                operator, token, null, null, false, version + 1L, nowMs);
    }

    public LifecycleRecord withOwner(IdentityInfo owner, long nowMs) {
        return new LifecycleRecord(instancePubkey, LifecycleState.OWNER_REGISTERED,
                operator, ownerToken.consume(), owner, null, false, version + 1L, nowMs);
    }

    public LifecycleRecord withWorkload(WorkloadConfig config, long nowMs) {
        return new LifecycleRecord(instancePubkey, LifecycleState.WORKLOAD_CONFIGURED,
                operator, ownerToken, owner, config, false, version + 1L, nowMs);
    }

    public LifecycleRecord exposed(long nowMs) {
        return new LifecycleRecord(instancePubkey, LifecycleState.WORKLOAD_EXPOSED,
                operator, ownerToken, owner, workloadConfig, true, version + 1L, nowMs);
    }

    private static void checkConsistency(
            LifecycleState state,
            IdentityInfo operator,
            OwnerToken ownerToken,
            IdentityInfo owner,
            WorkloadConfig workloadConfig,
            boolean workloadExposed
    ) {
        boolean hasOperator = state.atLeast(LifecycleState.OPERATOR_REGISTERED);
        boolean hasOwner = state.atLeast(LifecycleState.OWNER_REGISTERED);
        boolean hasWorkload = state.atLeast(LifecycleState.WORKLOAD_CONFIGURED);
        boolean isExposed = state == LifecycleState.WORKLOAD_EXPOSED;
        if (hasOperator != (operator != null)) {
            throw new IllegalStateException("operator must be set iff state >= OPERATOR_REGISTERED, state=" + state);
        }
        if (hasOperator != (ownerToken != null)) {
            throw new IllegalStateException("owner token must exist iff state >= OPERATOR_REGISTERED, state=" + state);
        }
        if (ownerToken != null && hasOwner != ownerToken.consumed()) {
            throw new IllegalStateException("owner token must be consumed iff state >= OWNER_REGISTERED, state=" + state);
        }
        if (hasOwner != (owner != null)) {
            throw new IllegalStateException("owner must be set iff state >= OWNER_REGISTERED, state=" + state);
        }
        if (hasWorkload != (workloadConfig != null)) {
            throw new IllegalStateException("workload must be set iff state >= WORKLOAD_CONFIGURED, state=" + state);
        }
        if (isExposed != workloadExposed) {
            throw new IllegalStateException("exposed flag must match state, state=" + state);
        }
    }
}
