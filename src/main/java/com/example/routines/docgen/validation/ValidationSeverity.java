package com.example.routines.docgen.validation;

public enum ValidationSeverity {
    /** Blocks rendering. */
    ERROR,
    WARNING,
    INFO
}
