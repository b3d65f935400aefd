package com.questrail.phaseseq.runtime;

import com.questrail.phaseseq.codec.SequenceContainerHeader;
import com.questrail.phaseseq.registration.RegistrationShift;
import com.questrail.phaseseq.validation.ValidationReport;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one sequence conversion.
 */
public record ConversionReport(
    SequenceJob job,
    ConversionOutcome outcome,
    Optional<SequenceContainerHeader> header,
    List<RegistrationShift> shifts,
    Optional<ValidationReport> validation
) {
    public ConversionReport {
        Objects.requireNonNull(job, "job");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(validation, "validation");
        shifts = List.copyOf(shifts);
    }

    static ConversionReport declined(SequenceJob job) {
        return new ConversionReport(job, ConversionOutcome.DECLINED, Optional.empty(), List.of(), Optional.empty());
    }

    static ConversionReport skipped(SequenceJob job) {
        return new ConversionReport(job, ConversionOutcome.SKIPPED, Optional.empty(), List.of(), Optional.empty());
    }

    ConversionReport withValidation(ValidationReport report) {
        return new ConversionReport(job, outcome, header, shifts, Optional.of(report));
    }
}
