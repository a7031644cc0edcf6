package com.example.demo.ods.style;

import com.example.demo.ods.core.TreeNode;
import com.example.demo.ods.exception.ContractViolationException;
import com.example.demo.ods.exception.StyleValidationException;
import com.example.demo.ods.model.StyleLocation;
import com.example.demo.ods.model.StyleSpec;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns attribute requests into interned cell styles.
 * <p>
 * Requests are normalized through {@link StyleProperty} and the {@link ColorPalette},
 * completed by the derived-attribute rules, and merged into a clone of the cell's
 * current (or default) style. The clone is kept only when no structurally equal
 * style is archived yet; otherwise the archived name is reused. One instance
 * belongs to one document.
 */
@Slf4j
public class StyleCanonicalizer {

    public static final String CELL_STYLE_ATTRIBUTE = "table:style-name";
    public static final String VALUE_TYPE_ATTRIBUTE = "office:value-type";

    private static final String STYLE_NAME = "style:name";
    private static final Pattern BORDER = Pattern.compile("^\\S+\\s+\\S+\\s+(\\S+)$");

    private final TreeNode automaticStyles;
    private final TreeNode officeStyles;
    private final ColorPalette palette;
    private final Set<String> protectedNames;
    private final StyleNameGenerator names;
    private final StyleArchive archive;

    public StyleCanonicalizer(TreeNode automaticStyles, TreeNode officeStyles, ColorPalette palette,
                              Set<String> protectedNames, StyleNameGenerator names, StyleArchive archive) {
        this.automaticStyles = automaticStyles;
        this.officeStyles = officeStyles;
        this.palette = palette;
        this.protectedNames = protectedNames == null ? Collections.emptySet() : protectedNames;
        this.names = names;
        this.archive = archive;
    }

    /**
     * Resolves keys to {@link StyleProperty} and colors to hex values.
     *
     * @throws StyleValidationException for unknown keys, unknown colors or malformed borders
     */
    public Map<StyleProperty, String> normalize(Map<String, String> attributes) {
        if (attributes == null) {
            throw new StyleValidationException(StyleValidationException.INVALID_ARGUMENT, "Attribute map is absent");
        }
        Map<StyleProperty, String> out = new EnumMap<>(StyleProperty.class);
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            StyleProperty property = StyleProperty.fromKey(entry.getKey());
            String value = requireValue(entry.getKey(), entry.getValue());
            switch (property.valueKind()) {
                case COLOR:
                    value = palette.toHex(value);
                    break;
                case BORDER:
                    value = normalizeBorder(value);
                    break;
                default:
                    break;
            }
            out.put(property, value);
        }
        return out;
    }

    /**
     * Completes or corrects a normalized request in place.
     */
    public static void applyRules(Map<StyleProperty, String> attributes) {
        if (attributes.containsKey(StyleProperty.TEXT_UNDERLINE_STYLE)) {
            attributes.putIfAbsent(StyleProperty.TEXT_UNDERLINE_WIDTH, "auto");
            attributes.putIfAbsent(StyleProperty.TEXT_UNDERLINE_COLOR, "#000000");
        } else if (attributes.containsKey(StyleProperty.TEXT_UNDERLINE_WIDTH)
                || attributes.containsKey(StyleProperty.TEXT_UNDERLINE_COLOR)) {
            throw new StyleValidationException(StyleValidationException.UNDERLINE_STYLE_MISSING,
                    "Underline width or color given without text-underline-style");
        }

        String fontStyle = attributes.get(StyleProperty.FONT_STYLE);
        if (fontStyle != null) {
            attributes.put(StyleProperty.FONT_STYLE_ASIAN, fontStyle);
            attributes.put(StyleProperty.FONT_STYLE_COMPLEX, fontStyle);
        }
        String fontWeight = attributes.get(StyleProperty.FONT_WEIGHT);
        if (fontWeight != null) {
            attributes.put(StyleProperty.FONT_WEIGHT_ASIAN, fontWeight);
            attributes.put(StyleProperty.FONT_WEIGHT_COMPLEX, fontWeight);
        }

        if (attributes.containsKey(StyleProperty.BORDER)
                && StyleProperty.sideBorders().stream().anyMatch(attributes::containsKey)) {
            log.debug("Dropping fo:border since one or more sides were given");
            attributes.remove(StyleProperty.BORDER);
        }

        String marginLeft = attributes.get(StyleProperty.MARGIN_LEFT);
        String textAlign = attributes.get(StyleProperty.TEXT_ALIGN);
        if (marginLeft != null && textAlign != null && !"start".equals(textAlign) && !"0".equals(marginLeft)) {
            log.debug("fo:text-align {} overrides fo:margin-left {}", textAlign, marginLeft);
            attributes.put(StyleProperty.MARGIN_LEFT, "0");
        } else if (marginLeft != null && !"0".equals(marginLeft) && textAlign == null) {
            attributes.put(StyleProperty.TEXT_ALIGN, "start");
        }
    }

    /**
     * Gives {@code cell} a style carrying all requested attributes, reusing an archived
     * style when one with the same content exists.
     */
    public void apply(TreeNode cell, Map<String, String> attributes) {
        requireCell(cell);
        Map<StyleProperty, String> requested = normalize(attributes);
        if (requested.containsKey(StyleProperty.NAME)) {
            throw new StyleValidationException(StyleValidationException.GENERATED_NAME,
                    "style:name cannot be requested as it is generated");
        }
        applyRules(requested);

        String currentName = cell.attribute(CELL_STYLE_ATTRIBUTE);
        TreeNode base;
        if (currentName != null) {
            base = getStyle(currentName);
            if (containsAll(base, requested)) {
                log.debug("Style {} already carries {}", currentName, requested);
                return;
            }
        } else {
            base = getStyle(baseStyleFor(cell.attribute(VALUE_TYPE_ATTRIBUTE), cell));
        }

        TreeNode candidate = base.deepCopy();
        String candidateName = names.next();
        candidate.setAttribute(STYLE_NAME, candidateName);
        merge(candidate, requested);
        String hash = StyleHasher.hash(candidate);

        Optional<String> archived = archive.nameFor(hash);
        if (archived.isPresent()) {
            names.rollback();
            cell.setAttribute(CELL_STYLE_ATTRIBUTE, archived.get());
            log.debug("Archived style {} matches the requested attributes", archived.get());
            return;
        }
        archive.putIfAbsent(hash, candidateName);
        automaticStyles.appendChild(candidate);
        cell.setAttribute(CELL_STYLE_ATTRIBUTE, candidateName);
        log.info("Created automatic style {} (hash {})", candidateName, hash);
    }

    /**
     * Writes a fully qualified style record into the given location.
     * An existing unprotected record of the same name is replaced; a protected one is kept.
     */
    public TreeNode register(StyleSpec spec, StyleLocation location) {
        if (spec == null) {
            throw new StyleValidationException(StyleValidationException.INVALID_ARGUMENT, "Style spec is absent");
        }
        String name = spec.name();
        if (name == null || name.isBlank()) {
            throw new StyleValidationException(StyleValidationException.MISSING_NAME,
                    "Style spec " + spec.getTag() + " has no style:name");
        }
        TreeNode container = containerFor(location);
        Optional<TreeNode> existing = findByName(container, name);
        if (existing.isPresent()) {
            if (protectedNames.contains(name)) {
                log.debug("Keeping built-in style {}", name);
                return existing.get();
            }
            existing.get().detach();
            archive.removeByName(name);
            log.info("Replacing style {} in {}", name, location);
        }

        TreeNode node = container.appendChild(build(container, spec));
        names.reserve(name);
        String hash = StyleHasher.hash(node);
        if (!archive.putIfAbsent(hash, name)) {
            log.debug("Style {} duplicates archived style {}", name, archive.nameFor(hash).orElse(name));
        }
        return node;
    }

    public TreeNode register(StyleSpec spec) {
        return register(spec, spec.getLocation() == null ? StyleLocation.CONTENT : spec.getLocation());
    }

    public void registerAll(List<StyleSpec> specs) {
        for (StyleSpec spec : specs) {
            register(spec);
        }
    }

    /**
     * Registers a cell style from qualified attribute names ({@code fo:color}).
     * {@code style:name} is required; family and parent default to
     * {@code table-cell} and {@code Default}.
     */
    public TreeNode writeStyle(Map<String, String> attributes) {
        if (attributes == null) {
            throw new StyleValidationException(StyleValidationException.INVALID_ARGUMENT, "Attribute map is absent");
        }
        Map<StyleProperty, String> qualified = new EnumMap<>(StyleProperty.class);
        for (Map.Entry<String, String> entry : attributes.entrySet()) {
            qualified.put(StyleProperty.fromQualifiedName(entry.getKey()), requireValue(entry.getKey(), entry.getValue()));
        }
        return writeQualified(qualified);
    }

    /**
     * Like {@link #writeStyle(Map)} with convenience keys and palette colors.
     */
    public TreeNode writeStyleAbbr(Map<String, String> attributes) {
        return writeQualified(normalize(attributes));
    }

    /**
     * Assigns an existing automatic style to a cell.
     */
    public void setStyle(TreeNode cell, String styleName) {
        requireCell(cell);
        if (findByName(automaticStyles, styleName).isEmpty()) {
            throw new ContractViolationException(ContractViolationException.UNKNOWN_STYLE,
                    "Style '" + styleName + "' does not exist among the automatic styles");
        }
        cell.setAttribute(CELL_STYLE_ATTRIBUTE, styleName);
    }

    /**
     * Automatic styles first, then office styles.
     */
    public Optional<TreeNode> findStyle(String styleName) {
        Optional<TreeNode> style = findByName(automaticStyles, styleName);
        return style.isPresent() ? style : findByName(officeStyles, styleName);
    }

    public TreeNode getStyle(String styleName) {
        return findStyle(styleName).orElseThrow(() -> new ContractViolationException(
                ContractViolationException.UNKNOWN_STYLE,
                "Could not find style '" + styleName + "' among automatic or office styles"));
    }

    /**
     * Archives the cell styles a parsed document already carries and keeps the
     * name generator clear of their names.
     */
    public void adoptExisting() {
        int adopted = 0;
        for (TreeNode style : automaticStyles.children("style:style")) {
            String name = style.attribute(STYLE_NAME);
            if (name == null) {
                continue;
            }
            names.reserve(name);
            if (archive.putIfAbsent(StyleHasher.hash(style), name)) {
                adopted++;
            }
        }
        log.debug("Archived {} existing automatic styles", adopted);
    }

    public StyleArchive archive() {
        return archive;
    }

    public StyleNameGenerator names() {
        return names;
    }

    /**
     * Built-in style a cell without a style starts from, chosen by its value type.
     */
    static String baseStyleFor(String valueType, TreeNode cell) {
        if (valueType == null) {
            return "myString";
        }
        switch (valueType) {
            case "string":
                return "myString";
            case "float":
                return "myFloat";
            case "percentage":
                return "myPercent";
            case "currency":
                return "myCurrency";
            case "date":
                return "myDate";
            case "time":
                return "myTime";
            default:
                throw new ContractViolationException(ContractViolationException.UNKNOWN_VALUE_TYPE,
                        "Unknown office:value-type '" + valueType + "' in " + cell);
        }
    }

    private TreeNode writeQualified(Map<StyleProperty, String> attributes) {
        if (!attributes.containsKey(StyleProperty.NAME)) {
            throw new StyleValidationException(StyleValidationException.MISSING_NAME,
                    "Missing attribute style:name");
        }
        applyRules(attributes);

        Map<String, String> styleAttributes = new LinkedHashMap<>();
        styleAttributes.put(STYLE_NAME, attributes.get(StyleProperty.NAME));
        styleAttributes.put(StyleProperty.FAMILY.qualifiedName(), "table-cell");
        styleAttributes.put(StyleProperty.PARENT_STYLE_NAME.qualifiedName(), "Default");
        Map<PropertyGroup, Map<String, String>> groups = new EnumMap<>(PropertyGroup.class);
        for (Map.Entry<StyleProperty, String> entry : attributes.entrySet()) {
            StyleProperty property = entry.getKey();
            if (property.group() == PropertyGroup.STYLE) {
                styleAttributes.put(property.qualifiedName(), entry.getValue());
            } else {
                groups.computeIfAbsent(property.group(), g -> new LinkedHashMap<>())
                        .put(property.qualifiedName(), entry.getValue());
            }
        }

        StyleSpec spec = StyleSpec.builder()
                .tag("style:style")
                .attributes(styleAttributes)
                .location(StyleLocation.CONTENT)
                .build();
        for (Map.Entry<PropertyGroup, Map<String, String>> group : groups.entrySet()) {
            spec.getChildren().add(StyleSpec.builder()
                    .tag(group.getKey().elementName())
                    .attributes(group.getValue())
                    .build());
        }
        return register(spec, StyleLocation.CONTENT);
    }

    private String normalizeBorder(String value) {
        Matcher matcher = BORDER.matcher(value);
        if (!matcher.matches()) {
            throw new StyleValidationException(StyleValidationException.MALFORMED_BORDER,
                    "Wrong format for border '" + value + "', expected '<width> <line-style> <color>'");
        }
        String color = matcher.group(1);
        if (ColorPalette.isHex(color)) {
            return value;
        }
        return value.substring(0, matcher.start(1)) + palette.resolve(color);
    }

    /**
     * Every requested pair is either a direct attribute of the style or sits on one
     * of its property children.
     */
    private static boolean containsAll(TreeNode style, Map<StyleProperty, String> requested) {
        for (Map.Entry<StyleProperty, String> entry : requested.entrySet()) {
            String qualifiedName = entry.getKey().qualifiedName();
            String direct = style.attribute(qualifiedName);
            if (direct != null) {
                if (!direct.equals(entry.getValue())) {
                    return false;
                }
                continue;
            }
            boolean inChild = style.children().stream()
                    .anyMatch(child -> entry.getValue().equals(child.attribute(qualifiedName)));
            if (!inChild) {
                return false;
            }
        }
        return true;
    }

    private static void merge(TreeNode style, Map<StyleProperty, String> attributes) {
        for (Map.Entry<StyleProperty, String> entry : attributes.entrySet()) {
            StyleProperty property = entry.getKey();
            if (property.group() == PropertyGroup.STYLE) {
                style.setAttribute(property.qualifiedName(), entry.getValue());
                continue;
            }
            String groupName = property.group().elementName();
            TreeNode properties = style.firstChild(groupName)
                    .orElseGet(() -> style.appendChild(style.createElement(groupName)));
            if (property.isSideBorder()) {
                properties.removeAttribute(StyleProperty.BORDER.qualifiedName());
            }
            properties.setAttribute(property.qualifiedName(), entry.getValue());
        }
    }

    private TreeNode build(TreeNode context, StyleSpec spec) {
        if (spec.getTag() == null) {
            throw new StyleValidationException(StyleValidationException.INVALID_ARGUMENT,
                    "Style spec without tag: " + spec);
        }
        TreeNode node = context.createElement(spec.getTag());
        if (spec.getAttributes() != null) {
            spec.getAttributes().forEach(node::setAttribute);
        }
        if (spec.getText() != null) {
            node.setText(spec.getText());
        }
        if (spec.getChildren() != null) {
            for (StyleSpec child : spec.getChildren()) {
                node.appendChild(build(context, child));
            }
        }
        return node;
    }

    private TreeNode containerFor(StyleLocation location) {
        if (location == null) {
            throw new StyleValidationException(StyleValidationException.INVALID_ARGUMENT, "Style location is absent");
        }
        return location == StyleLocation.STYLES ? officeStyles : automaticStyles;
    }

    private static Optional<TreeNode> findByName(TreeNode container, String styleName) {
        if (styleName == null) {
            return Optional.empty();
        }
        for (TreeNode child : container.children()) {
            if (styleName.equals(child.attribute(STYLE_NAME))) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    private static String requireValue(String key, String value) {
        if (value == null) {
            throw new StyleValidationException(StyleValidationException.INVALID_ARGUMENT,
                    "Value for style attribute '" + key + "' is absent");
        }
        return value;
    }

    private static void requireCell(TreeNode cell) {
        if (cell == null || !cell.is("table:table-cell")) {
            throw new ContractViolationException(ContractViolationException.INVALID_NODE,
                    "Expected a table:table-cell but got " + cell);
        }
    }
}
