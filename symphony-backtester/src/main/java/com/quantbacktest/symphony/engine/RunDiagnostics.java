package com.quantbacktest.symphony.engine;

import lombok.Value;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Collects non-fatal observations made during a run, such as filter candidates dropped for
 * missing indicator data or holdings that could not be priced.
 * Instances are confined to a single run and are not thread-safe.
 */
public class RunDiagnostics {

    public static final String FILTER_CANDIDATE_DROPPED = "filter-candidate-dropped";
    public static final String HOLDING_UNPRICED = "holding-unpriced";
    public static final String TARGET_UNPRICED = "target-unpriced";
    public static final String DAY_SKIPPED = "day-skipped";

    private final List<Entry> entries = new ArrayList<>();

    public void record(LocalDate date, String category, String message) {
        entries.add(new Entry(date, category, message));
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public Map<String, Integer> countByCategory() {
        Map<String, Integer> counts = new TreeMap<>();
        for (Entry entry : entries) {
            counts.merge(entry.getCategory(), 1, Integer::sum);
        }
        return counts;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Value
    public static class Entry {
        LocalDate date;
        String category;
        String message;
    }
}
