package com.example.demo.ods.model;

import lombok.Value;

/**
 * Paragraph text of a cell and its {@code office:value-type} ({@code string} when absent).
 */
@Value
public class CellContent {
    String text;
    String valueType;
}
