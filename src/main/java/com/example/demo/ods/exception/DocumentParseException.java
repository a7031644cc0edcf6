package com.example.demo.ods.exception;

/**
 * Reading or writing one of the XML member documents failed.
 */
public class DocumentParseException extends OdsException {

    public static final String PARSE_FAILED = "PARSE_FAILED";
    public static final String WRITE_FAILED = "WRITE_FAILED";

    public DocumentParseException(String code, String description, Throwable cause) {
        super(code, description, cause);
    }
}
