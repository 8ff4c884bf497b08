package com.catalogsync.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-run outcome counts. Mutated only by classification and by batch failure attribution.
 */
public class ResultCounters {

    private final Map<OutcomeCategory, Integer> counts = new EnumMap<>(OutcomeCategory.class);

    public ResultCounters(RecordOperation operation) {
        for (OutcomeCategory category : operation.getCategories()) {
            counts.put(category, 0);
        }
        counts.put(OutcomeCategory.NOT_PROCESSED, 0);
    }

    public void increment(OutcomeCategory category) {
        add(category, 1);
    }

    public void add(OutcomeCategory category, int amount) {
        if (!counts.containsKey(category)) {
            throw new IllegalArgumentException("Category " + category + " is not tracked for this operation");
        }
        counts.merge(category, amount, Integer::sum);
    }

    public int get(OutcomeCategory category) {
        return counts.getOrDefault(category, 0);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Map<OutcomeCategory, Integer> asMap() {
        return Collections.unmodifiableMap(new EnumMap<>(counts));
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
