package com.gradeflow.grading;

import com.gradeflow.models.AccuracyMetrics;
import com.gradeflow.models.ScoreResult;

import java.util.List;

/**
 * Output of {@link AccuracyValidator#validate}
 *
 * @param corrections         every non-fatal adjustment applied to the raw result, in order
 * @param correctionMagnitude absolute difference between the reported and the recomputed total, 0 when within tolerance
 */
public record ValidationResult(
        ScoreResult validated,
        AccuracyMetrics metrics,
        List<String> corrections,
        double correctionMagnitude
) {
    public ValidationResult {
        corrections = List.copyOf(corrections);
    }

    public boolean wasCorrected() {
        return !corrections.isEmpty();
    }
}
