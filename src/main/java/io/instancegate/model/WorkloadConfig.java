package io.instancegate.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record WorkloadConfig(
        @JsonProperty("instance_pubkey") String instancePubkey,
        @JsonProperty("image") String image,
        @JsonProperty("persist_dirs") List<String> persistDirs,
        @JsonProperty("port") int port
) {
    public static final int MIN_PORT = 1;
    public static final int MAX_PORT = 65535;

    public WorkloadConfig {
        persistDirs = persistDirs == null ? List.of() : List.copyOf(persistDirs);
    }
}
