package com.example.routines.docgen.validation;

import lombok.Value;

@Value
public class ValidationIssue {
    ValidationSeverity severity;
    String message;
    /** Location in the template, e.g. {@code pages[0].sections[2]}. */
    String path;
    /** Optional hint, null when there is none. */
    String suggestion;
}
