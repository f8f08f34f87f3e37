package com.ragkit.ingest;

import java.util.List;

public record IngestionReport(List<SourceOutcome> outcomes) {
    public IngestionReport {
        outcomes = List.copyOf(outcomes);
    }

    public int addedRecords() {
        return outcomes.stream().mapToInt(SourceOutcome::added).sum();
    }

    public int skippedRecords() {
        return outcomes.stream().mapToInt(SourceOutcome::skipped).sum();
    }

    public long failedSources() {
        return outcomes.stream().filter(outcome -> outcome.status() == SourceOutcome.Status.FAILED).count();
    }

    public boolean hasFailures() {
        return failedSources() > 0;
    }
}
