package com.example.demo.ods.model;

/**
 * Placement of a new table relative to an existing one.
 */
public enum InsertPosition {
    BEFORE,
    AFTER
}
