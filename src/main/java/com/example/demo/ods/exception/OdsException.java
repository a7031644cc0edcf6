package com.example.demo.ods.exception;

import lombok.Getter;

/**
 * Base type for every failure raised by the spreadsheet engine.
 * Carries a machine readable code plus a human readable description.
 */
@Getter
public class OdsException extends RuntimeException {
    private final String code;
    private final String description;

    public OdsException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public OdsException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }
}
