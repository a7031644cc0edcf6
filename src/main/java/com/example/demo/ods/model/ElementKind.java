package com.example.demo.ods.model;

/**
 * The three run-length compressed element kinds of a table.
 * Rows repeat vertically, cells and header columns horizontally.
 */
public enum ElementKind {
    ROW("table:table-row", "table:number-rows-repeated"),
    CELL("table:table-cell", "table:number-columns-repeated"),
    COLUMN("table:table-column", "table:number-columns-repeated");

    private final String elementName;
    private final String repetitionAttribute;

    ElementKind(String elementName, String repetitionAttribute) {
        this.elementName = elementName;
        this.repetitionAttribute = repetitionAttribute;
    }

    public String elementName() {
        return elementName;
    }

    public String repetitionAttribute() {
        return repetitionAttribute;
    }

    /** Cells and columns count toward the table width. */
    public boolean isHorizontal() {
        return this != ROW;
    }
}
