package com.baton.core.model;

import com.baton.core.marker.MarkerBlock;
import com.baton.core.marker.MarkerType;

import java.io.Serializable;
import java.util.List;

/**
 * Structured status snapshot that lets a different actor resume a work item.
 *
 * @param workLog    what was done since the previous checkpoint
 * @param completed  finished items
 * @param inProgress items underway
 * @param pending    items not started
 * @param changed    resources changed
 * @param commits    commit or change references
 * @param branch     branch or context identifier
 * @param nextAction the single next step
 * @param outcome    terminal phase outcome; required on the final checkpoint before closure
 */
public record Checkpoint(
    String workLog,
    List<String> completed,
    List<String> inProgress,
    List<String> pending,
    List<String> changed,
    List<String> commits,
    String branch,
    String nextAction,
    String outcome
) implements Serializable {

    public static final String WORK_LOG = "work-log";
    public static final String COMPLETED = "completed";
    public static final String IN_PROGRESS = "in-progress";
    public static final String PENDING = "pending";
    public static final String CHANGED = "changed";
    public static final String COMMITS = "commits";
    public static final String BRANCH = "branch";
    public static final String NEXT_ACTION = "next-action";
    public static final String OUTCOME = "outcome";

    public Checkpoint {
        completed = completed == null ? List.of() : List.copyOf(completed);
        inProgress = inProgress == null ? List.of() : List.copyOf(inProgress);
        pending = pending == null ? List.of() : List.copyOf(pending);
        changed = changed == null ? List.of() : List.copyOf(changed);
        commits = commits == null ? List.of() : List.copyOf(commits);
    }

    public static Checkpoint from(MarkerBlock block) {
        return new Checkpoint(
                block.text(WORK_LOG),
                block.list(COMPLETED),
                block.list(IN_PROGRESS),
                block.list(PENDING),
                block.list(CHANGED),
                block.list(COMMITS),
                block.text(BRANCH),
                block.text(NEXT_ACTION),
                block.text(OUTCOME));
    }

    public MarkerBlock toBlock() {
        var builder = MarkerBlock.builder(MarkerType.CHECKPOINT);
        if (workLog != null) builder.field(WORK_LOG, workLog);
        builder.items(COMPLETED, completed)
                .items(IN_PROGRESS, inProgress)
                .items(PENDING, pending)
                .items(CHANGED, changed)
                .items(COMMITS, commits);
        if (branch != null) builder.field(BRANCH, branch);
        if (nextAction != null) builder.field(NEXT_ACTION, nextAction);
        if (outcome != null && !outcome.isBlank()) builder.field(OUTCOME, outcome);
        return builder.build();
    }
}
