package com.quantbacktest.symphony.accuracy;

import com.quantbacktest.symphony.engine.TargetAllocation;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Compares the symbols selected each day with a ground-truth table.
 * Only dates present on both sides are validated; a day matches when the symbol sets are equal.
 */
@Slf4j
public class AccuracyValidator {

    public AccuracyReport validate(Map<LocalDate, TargetAllocation> dailySelections, GroundTruth groundTruth) {
        int validated = 0;
        int matches = 0;
        List<SelectionMismatch> mismatches = new ArrayList<>();

        for (Map.Entry<LocalDate, TargetAllocation> entry : new TreeMap<>(dailySelections).entrySet()) {
            Optional<Set<String>> expected = groundTruth.selectionsOn(entry.getKey());
            if (expected.isEmpty()) {
                continue;
            }
            validated++;
            SortedSet<String> evaluatedSymbols = new TreeSet<>(entry.getValue().selectedSymbols());
            SortedSet<String> expectedSymbols = new TreeSet<>(expected.get());
            if (evaluatedSymbols.equals(expectedSymbols)) {
                matches++;
            } else {
                log.debug("Selection mismatch on {}: evaluated {}, expected {}",
                        entry.getKey(), evaluatedSymbols, expectedSymbols);
                mismatches.add(new SelectionMismatch(entry.getKey(), evaluatedSymbols, expectedSymbols));
            }
        }

        if (validated > 0) {
            log.info("Accuracy: {}/{} days matched ground truth", matches, validated);
        }
        return AccuracyReport.builder()
                .daysValidated(validated)
                .matches(matches)
                .mismatches(List.copyOf(mismatches))
                .build();
    }
}
