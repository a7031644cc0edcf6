package com.example.demo.ods.exception;

/**
 * Programmer error: invalid index, unknown table or style, wrong node kind,
 * deleting the current table and the like. Never retried.
 */
public class ContractViolationException extends OdsException {

    public static final String INVALID_INDEX = "INVALID_INDEX";
    public static final String INVALID_NODE = "INVALID_NODE";
    public static final String UNKNOWN_TABLE = "UNKNOWN_TABLE";
    public static final String TABLE_EXISTS = "TABLE_EXISTS";
    public static final String CURRENT_TABLE = "CURRENT_TABLE";
    public static final String UNKNOWN_STYLE = "UNKNOWN_STYLE";
    public static final String UNKNOWN_VALUE_TYPE = "UNKNOWN_VALUE_TYPE";
    public static final String NO_SIBLING = "NO_SIBLING";
    public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";

    public ContractViolationException(String code, String description) {
        super(code, description);
    }
}
