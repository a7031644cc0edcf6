package com.example.demo.ods.model;

import com.example.demo.ods.core.TreeNode;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Registry entry for one {@code table:table} element.
 * <p>
 * {@code width} is the highest column index ever materialized; it only grows between
 * pad operations. {@code widthExceeded} is set when it grew and cleared by the pad step.
 */
@Data
@AllArgsConstructor
public class Table {
    private String name;
    private final TreeNode node;
    private int width;
    private boolean widthExceeded;
}
