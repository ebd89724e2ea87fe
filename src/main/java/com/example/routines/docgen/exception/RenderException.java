package com.example.routines.docgen.exception;

import lombok.Getter;

/**
 * Raised when a document cannot be produced at all. Recoverable problems
 * (bad images, unresolved expressions, unknown sections) never surface here.
 */
@Getter
public class RenderException extends RuntimeException {
    public static final String RENDER_FAILED = "RENDER_FAILED";
    public static final String OUTPUT_WRITE_FAILED = "OUTPUT_WRITE_FAILED";

    private final String code;
    private final String description;

    public RenderException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public RenderException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }
}
