package com.example.demo.ods.exception;

/**
 * A requested style attribute map could not be normalized or validated.
 * The description names the offending key and value.
 */
public class StyleValidationException extends OdsException {

    public static final String UNKNOWN_COLOR = "UNKNOWN_COLOR";
    public static final String MALFORMED_BORDER = "MALFORMED_BORDER";
    public static final String UNDERLINE_STYLE_MISSING = "UNDERLINE_STYLE_MISSING";
    public static final String UNKNOWN_PROPERTY = "UNKNOWN_PROPERTY";
    public static final String GENERATED_NAME = "GENERATED_NAME";
    public static final String MISSING_NAME = "MISSING_NAME";
    public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";

    public StyleValidationException(String code, String description) {
        super(code, description);
    }
}
