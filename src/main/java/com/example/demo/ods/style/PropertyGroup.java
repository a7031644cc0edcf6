package com.example.demo.ods.style;

/**
 * Where a style property lives inside a {@code style:style} record.
 */
public enum PropertyGroup {
    /** Attribute of the style element itself. */
    STYLE(null),
    TABLE_CELL("style:table-cell-properties"),
    TEXT("style:text-properties"),
    PARAGRAPH("style:paragraph-properties");

    private final String elementName;

    PropertyGroup(String elementName) {
        this.elementName = elementName;
    }

    /**
     * @return the child element holding this group, or {@code null} for {@link #STYLE}
     */
    public String elementName() {
        return elementName;
    }
}
