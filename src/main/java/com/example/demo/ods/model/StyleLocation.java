package com.example.demo.ods.model;

/**
 * Where a style record lives: the automatic styles of {@code content.xml}
 * or the office styles of {@code styles.xml}.
 */
public enum StyleLocation {
    CONTENT,
    STYLES
}
