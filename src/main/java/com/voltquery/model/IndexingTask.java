package com.voltquery.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of a background bulk-indexing task. Every update produces a new snapshot.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IndexingTask {

    public enum Status {
        QUEUED, RUNNING, COMPLETED, FAILED
    }

    @JsonProperty("task_id")
    String taskId;

    String domain;
    Status status;
    String message;

    @JsonProperty("locations_total")
    int locationsTotal;

    @JsonProperty("locations_done")
    int locationsDone;

    @JsonProperty("locations_failed")
    int locationsFailed;

    @JsonProperty("records_indexed")
    int recordsIndexed;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    /**
     * Percentage of locations processed, successful or not.
     */
    public int getProgress() {
        if (locationsTotal == 0) {
            return status == Status.COMPLETED ? 100 : 0;
        }
        return (int) Math.round(100.0 * locationsDone / locationsTotal);
    }
}
