package io.instancegate.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record InstanceView(
        @JsonProperty("instance_pubkey") String instancePubkey,
        @JsonProperty("state") String state,
        @JsonProperty("operator") IdentityInfo operator,
        @JsonProperty("owner") IdentityInfo owner,
        @JsonProperty("workload") WorkloadConfig workload,
        @JsonProperty("exposed") boolean exposed,
        @JsonProperty("version") long version,
        @JsonProperty("updated_at_ms") long updatedAtMs
) {
    public static InstanceView of(LifecycleRecord record) {
        return new InstanceView(
                record.instancePubkey(),
                record.state().name(),
                record.operator(),
                record.owner(),
                record.workloadConfig(),
                record.workloadExposed(),
                record.version(),
                record.updatedAtMs()
        );
    }
}
