package me.bechberger.jlongtasks.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * One analysis input: the task forest of a trace and the network records of the same load.
 * The identity is a stable key of the source data, used for caching computed artifacts.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TraceInput(
        String identity,
        TaskForest forest,
        List<NetworkRecord> networkRecords
) {
    public TraceInput {
        Objects.requireNonNull(identity, "identity");
        forest = forest != null ? forest : new TaskForest(List.of());
        networkRecords = networkRecords != null ? List.copyOf(networkRecords) : List.of();
    }

    public TraceInput(String identity, TaskForest forest) {
        this(identity, forest, List.of());
    }
}
