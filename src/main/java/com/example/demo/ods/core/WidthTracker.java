package com.example.demo.ods.core;

/**
 * Receives horizontal accesses so the owning table's width can be recorded.
 */
@FunctionalInterface
public interface WidthTracker {

    WidthTracker NONE = (table, index) -> { };

    /**
     * @param table the {@code table:table} node that owns the accessed cell or column
     * @param index 1-based column index that was materialized
     */
    void columnTouched(TreeNode table, int index);
}
