package com.example.demo.ods.model;

/**
 * Value types the facade writes directly. Dates, times, currencies,
 * percentages and formulas need text conversion and are not written here.
 */
public enum CellType {
    STRING("string"),
    FLOAT("float");

    private final String valueType;

    CellType(String valueType) {
        this.valueType = valueType;
    }

    /** The {@code office:value-type} attribute value. */
    public String valueType() {
        return valueType;
    }
}
