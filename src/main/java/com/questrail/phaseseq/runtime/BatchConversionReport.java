package com.questrail.phaseseq.runtime;

import com.questrail.phaseseq.validation.RangeViolation;

import java.util.List;
import java.util.Objects;

/**
 * Result of a batch run: one report per job plus every range violation found
 * when the containers were checked at the end.
 */
public record BatchConversionReport(
    ConversionOutcome outcome,
    List<ConversionReport> reports,
    List<RangeViolation> violations
) {
    public BatchConversionReport {
        Objects.requireNonNull(outcome, "outcome");
        reports = List.copyOf(reports);
        violations = List.copyOf(violations);
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }
}
