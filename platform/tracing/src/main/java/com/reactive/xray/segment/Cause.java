package com.reactive.xray.segment;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Snapshot of an entity's error detail.
 */
public record Cause(
    @JsonProperty("working_directory") String workingDirectory,
    @JsonProperty("exceptions") List<ExceptionRecord> exceptions
) {

    public Cause {
        exceptions = List.copyOf(exceptions);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return exceptions.isEmpty();
    }
}
