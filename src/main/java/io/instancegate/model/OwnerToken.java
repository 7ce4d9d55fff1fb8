package io.instancegate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.instancegate.util.Hashing;

public record OwnerToken(
        @JsonProperty("value") String value,
        @JsonProperty("consumed") boolean consumed
) {
    public static OwnerToken fresh(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("owner token must not be blank");
        }
        return new OwnerToken(value, false);
    }

    public boolean matches(String presented) {
        return Hashing.constantTimeEquals(value, presented == null ? null : presented.trim());
    }

    public OwnerToken consume() {
        if (consumed) {
            throw new IllegalStateException("owner token already consumed");
        }
        return new OwnerToken(value, true);
    }
}
