package com.example.demo.ods.style;

import com.example.demo.ods.exception.StyleValidationException;

import java.util.EnumSet;
import java.util.Set;

/**
 * Closed vocabulary of cell style properties accepted by the formatting API.
 * Each entry knows its short convenience name, its qualified attribute name and
 * the property group it is written into.
 */
public enum StyleProperty {
    NAME("name", "style:name", PropertyGroup.STYLE, ValueKind.PLAIN),
    FAMILY("family", "style:family", PropertyGroup.STYLE, ValueKind.PLAIN),
    PARENT_STYLE_NAME("parent-style-name", "style:parent-style-name", PropertyGroup.STYLE, ValueKind.PLAIN),
    DATA_STYLE_NAME("data-style-name", "style:data-style-name", PropertyGroup.STYLE, ValueKind.PLAIN),

    BACKGROUND_COLOR("background-color", "fo:background-color", PropertyGroup.TABLE_CELL, ValueKind.COLOR),
    TEXT_ALIGN_SOURCE("text-align-source", "style:text-align-source", PropertyGroup.TABLE_CELL, ValueKind.PLAIN),
    BORDER("border", "fo:border", PropertyGroup.TABLE_CELL, ValueKind.BORDER),
    BORDER_TOP("border-top", "fo:border-top", PropertyGroup.TABLE_CELL, ValueKind.BORDER),
    BORDER_BOTTOM("border-bottom", "fo:border-bottom", PropertyGroup.TABLE_CELL, ValueKind.BORDER),
    BORDER_LEFT("border-left", "fo:border-left", PropertyGroup.TABLE_CELL, ValueKind.BORDER),
    BORDER_RIGHT("border-right", "fo:border-right", PropertyGroup.TABLE_CELL, ValueKind.BORDER),

    COLOR("color", "fo:color", PropertyGroup.TEXT, ValueKind.COLOR),
    FONT_STYLE("font-style", "fo:font-style", PropertyGroup.TEXT, ValueKind.PLAIN),
    FONT_STYLE_ASIAN("font-style-asian", "style:font-style-asian", PropertyGroup.TEXT, ValueKind.PLAIN),
    FONT_STYLE_COMPLEX("font-style-complex", "style:font-style-complex", PropertyGroup.TEXT, ValueKind.PLAIN),
    FONT_WEIGHT("font-weight", "fo:font-weight", PropertyGroup.TEXT, ValueKind.PLAIN),
    FONT_WEIGHT_ASIAN("font-weight-asian", "style:font-weight-asian", PropertyGroup.TEXT, ValueKind.PLAIN),
    FONT_WEIGHT_COMPLEX("font-weight-complex", "style:font-weight-complex", PropertyGroup.TEXT, ValueKind.PLAIN),
    TEXT_UNDERLINE_STYLE("text-underline-style", "style:text-underline-style", PropertyGroup.TEXT, ValueKind.PLAIN),
    TEXT_UNDERLINE_WIDTH("text-underline-width", "style:text-underline-width", PropertyGroup.TEXT, ValueKind.PLAIN),
    TEXT_UNDERLINE_COLOR("text-underline-color", "style:text-underline-color", PropertyGroup.TEXT, ValueKind.COLOR),

    MARGIN_LEFT("margin-left", "fo:margin-left", PropertyGroup.PARAGRAPH, ValueKind.PLAIN),
    TEXT_ALIGN("text-align", "fo:text-align", PropertyGroup.PARAGRAPH, ValueKind.PLAIN);

    public enum ValueKind { PLAIN, COLOR, BORDER }

    private static final Set<StyleProperty> SIDE_BORDERS =
            EnumSet.of(BORDER_TOP, BORDER_BOTTOM, BORDER_LEFT, BORDER_RIGHT);

    private final String shortName;
    private final String qualifiedName;
    private final PropertyGroup group;
    private final ValueKind valueKind;

    StyleProperty(String shortName, String qualifiedName, PropertyGroup group, ValueKind valueKind) {
        this.shortName = shortName;
        this.qualifiedName = qualifiedName;
        this.group = group;
        this.valueKind = valueKind;
    }

    public String shortName() {
        return shortName;
    }

    public String qualifiedName() {
        return qualifiedName;
    }

    public PropertyGroup group() {
        return group;
    }

    public ValueKind valueKind() {
        return valueKind;
    }

    public boolean isSideBorder() {
        return SIDE_BORDERS.contains(this);
    }

    public static Set<StyleProperty> sideBorders() {
        return EnumSet.copyOf(SIDE_BORDERS);
    }

    /**
     * Accepts either the convenience name ({@code color}) or the qualified one ({@code fo:color}).
     */
    public static StyleProperty fromKey(String key) {
        for (StyleProperty property : values()) {
            if (property.shortName.equals(key) || property.qualifiedName.equals(key)) {
                return property;
            }
        }
        throw new StyleValidationException(StyleValidationException.UNKNOWN_PROPERTY,
                "Invalid or unsupported style attribute '" + key + "'");
    }

    /**
     * Accepts only the qualified name.
     */
    public static StyleProperty fromQualifiedName(String qualifiedName) {
        for (StyleProperty property : values()) {
            if (property.qualifiedName.equals(qualifiedName)) {
                return property;
            }
        }
        throw new StyleValidationException(StyleValidationException.UNKNOWN_PROPERTY,
                "Invalid or unsupported style attribute '" + qualifiedName + "'");
    }
}
