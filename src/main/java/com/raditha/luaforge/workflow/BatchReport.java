package com.raditha.luaforge.workflow;

import java.util.List;

/**
 * Outcomes of a batch, in the order the files were given.
 */
public record BatchReport(List<FileOutcome> outcomes) {

    public BatchReport {
        outcomes = List.copyOf(outcomes);
    }

    public List<FileOutcome> failures() {
        return outcomes.stream().filter(outcome -> !outcome.isSuccess()).toList();
    }

    public long successCount() {
        return outcomes.stream().filter(FileOutcome::isSuccess).count();
    }

    public long changedCount() {
        return outcomes.stream().filter(FileOutcome::isChanged).count();
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(outcome -> !outcome.isSuccess());
    }
}
