package com.example.demo.ods.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fully qualified description of a style record, written into the document as is.
 *
 * Example YAML (see ods/default-styles.yaml):
 *
 * - location: STYLES
 *   tag: "number:percent-style"
 *   attributes:
 *     "style:name": myPercentFormat
 *   children:
 *     - tag: "number:number"
 *       attributes:
 *         "number:decimal-places": "2"
 *     - tag: "number:text"
 *       text: "%"
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StyleSpec {

    /**
     * Qualified element name, e.g. "style:style" or "number:date-style"
     */
    private String tag;

    /**
     * Qualified attribute names to values. Must contain "style:name" on the top-level spec.
     */
    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();

    /**
     * Optional text content
     */
    private String text;

    @Builder.Default
    private List<StyleSpec> children = new ArrayList<>();

    /**
     * Target collection; only meaningful for top-level specs
     */
    @Builder.Default
    private StyleLocation location = StyleLocation.CONTENT;

    public String name() {
        return attributes == null ? null : attributes.get("style:name");
    }
}
