package com.example.demo.ods.model;

/**
 * What {@code ordinalAndCount} should compute for a node.
 */
public enum PositionQuery {
    ORDINAL,
    COUNT,
    BOTH
}
