package com.example.demo.ods.model;

import com.example.demo.ods.core.TreeNode;
import lombok.Value;

/**
 * A cell whose text matched a search, with its table and 1-based row and column.
 */
@Value
public class CellMatch {
    String table;
    TreeNode cell;
    int row;
    int column;
}
