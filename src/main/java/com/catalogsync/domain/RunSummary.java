package com.catalogsync.domain;

import java.util.Map;

/**
 * Final result of one operation run.
 *
 * @param operation          operation that ran
 * @param counts             per-category totals (including not-processed)
 * @param apiRequestsMade    WorldCat API requests made during the run
 * @param rowsRead           input rows accounted for by the counts
 * @param halted             true if a fatal error stopped the run early
 * @param haltReason         human-readable reason when halted, otherwise null
 */
public record RunSummary(RecordOperation operation,
                         Map<OutcomeCategory, Integer> counts,
                         int apiRequestsMade,
                         int rowsRead,
                         boolean halted,
                         String haltReason) {

    public int count(OutcomeCategory category) {
        return counts.getOrDefault(category, 0);
    }

    /** Multi-line summary for the end of a run. */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Processed ").append(rowsRead).append(" row(s) from input file with ")
                .append(apiRequestsMade).append(" API request(s):");
        counts.forEach((category, count) -> {
            if (category != OutcomeCategory.NOT_PROCESSED || count > 0) {
                sb.append(System.lineSeparator()).append("- ").append(count).append(' ').append(category.getLabel());
            }
        });
        if (halted) {
            sb.append(System.lineSeparator()).append("Run halted early: ").append(haltReason);
        }
        return sb.toString();
    }
}
