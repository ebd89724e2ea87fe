package com.example.routines.docgen.exception;

import lombok.Getter;

@Getter
public class TemplateLoadingException extends RuntimeException {
    public static final String TEMPLATE_NOT_FOUND = "TEMPLATE_NOT_FOUND";
    public static final String TEMPLATE_PARSE_ERROR = "TEMPLATE_PARSE_ERROR";

    private final String code;
    private final String description;

    public TemplateLoadingException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public TemplateLoadingException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }
}
