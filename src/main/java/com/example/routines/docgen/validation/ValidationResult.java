package com.example.routines.docgen.validation;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of validating one template. Only errors affect validity.
 */
@Value
@Builder
public class ValidationResult {
    List<ValidationIssue> errors;
    List<ValidationIssue> warnings;
    List<ValidationIssue> info;
    double performanceScore;
    double securityScore;

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> errorMessages() {
        return errors.stream().map(ValidationIssue::getMessage).collect(Collectors.toList());
    }

    public List<String> warningMessages() {
        return warnings.stream().map(ValidationIssue::getMessage).collect(Collectors.toList());
    }
}
