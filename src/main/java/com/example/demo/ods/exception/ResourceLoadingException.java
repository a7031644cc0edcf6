package com.example.demo.ods.exception;

/**
 * A bundled classpath resource (palette, built-in styles) could not be read.
 */
public class ResourceLoadingException extends OdsException {

    public static final String RESOURCE_NOT_FOUND = "RESOURCE_NOT_FOUND";
    public static final String RESOURCE_UNREADABLE = "RESOURCE_UNREADABLE";

    public ResourceLoadingException(String code, String description) {
        super(code, description);
    }

    public ResourceLoadingException(String code, String description, Throwable cause) {
        super(code, description, cause);
    }
}
