package com.example.demo.ods.style;

import com.example.demo.ods.core.TreeNode;
import com.example.demo.ods.exception.InternalInvariantException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Content hash of a style subtree that ignores its name, whitespace and attribute order.
 */
public final class StyleHasher {

    static final String NAME_PLACEHOLDER = "DUMMY";

    private static final String STYLE_NAME = "style:name";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private StyleHasher() {
    }

    public static String hash(TreeNode style) {
        return digest(canonicalForm(style));
    }

    /**
     * Tag, attributes sorted by name, then the children's forms in document order.
     * The root's {@code style:name} is replaced by a placeholder and whitespace is removed.
     */
    static String canonicalForm(TreeNode style) {
        StringBuilder out = new StringBuilder();
        append(style, true, out);
        return WHITESPACE.matcher(out).replaceAll("");
    }

    private static void append(TreeNode node, boolean root, StringBuilder out) {
        out.append('<').append(node.name());
        Map<String, String> attributes = new TreeMap<>(node.attributes());
        if (root && attributes.containsKey(STYLE_NAME)) {
            attributes.put(STYLE_NAME, NAME_PLACEHOLDER);
        }
        for (Map.Entry<String, String> attribute : attributes.entrySet()) {
            out.append(' ').append(attribute.getKey()).append("=\"").append(quote(attribute.getValue())).append('"');
        }
        out.append('>');
        List<TreeNode> children = node.children();
        if (children.isEmpty()) {
            String text = node.text();
            if (text != null) {
                out.append(quote(text));
            }
        } else {
            for (TreeNode child : children) {
                append(child, false, out);
            }
        }
        out.append("</").append(node.name()).append('>');
    }

    private static String quote(String value) {
        return value.replace("&", "&amp;").replace("<", "&lt;").replace("\"", "&quot;");
    }

    private static String digest(String canonical) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new InternalInvariantException("SHA-256 is not available: " + e.getMessage());
        }
    }
}
