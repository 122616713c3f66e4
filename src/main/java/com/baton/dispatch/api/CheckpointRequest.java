package com.baton.dispatch.api;

import com.baton.core.model.Checkpoint;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CheckpointRequest(
    String actor,
    @JsonProperty("work_log") String workLog,
    List<String> completed,
    @JsonProperty("in_progress") List<String> inProgress,
    List<String> pending,
    List<String> changed,
    List<String> commits,
    String branch,
    @JsonProperty("next_action") String nextAction,
    String outcome
) {
    public Checkpoint toCheckpoint() {
        return new Checkpoint(workLog, completed, inProgress, pending, changed, commits, branch, nextAction, outcome);
    }
}
