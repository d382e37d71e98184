package com.quantbacktest.symphony.accuracy;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Set-level comparison of evaluated selections with ground truth.
 */
@Value
@Builder
public class AccuracyReport {

    int daysValidated;
    int matches;
    List<SelectionMismatch> mismatches;

    public int getMismatchCount() {
        return mismatches.size();
    }

    /**
     * Share of validated days that matched, as a percentage. Zero when nothing was validated.
     */
    public double getAccuracyPct() {
        return daysValidated == 0 ? 0.0 : 100.0 * matches / daysValidated;
    }
}
