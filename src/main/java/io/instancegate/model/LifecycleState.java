package io.instancegate.model;

public enum LifecycleState {
    UNREGISTERED,
    OPERATOR_REGISTERED,
    OWNER_REGISTERED,
    WORKLOAD_CONFIGURED,
    WORKLOAD_EXPOSED;

    public boolean atLeast(LifecycleState other) {
        return ordinal() >= other.ordinal();
    }

    public boolean before(LifecycleState other) {
        return ordinal() < other.ordinal();
    }

    public static LifecycleState fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNREGISTERED;
        }
        for (LifecycleState value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown lifecycle state: " + raw);
    }
}
