package com.example.demo.ods.core;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Labeled, ordered, mutable tree element the engine works on.
 * <p>
 * Names are qualified with one of the {@link OdsNamespace} prefixes. Only element
 * children are visible through this interface; text content is exposed separately.
 * Two handles are equal when they refer to the same underlying element.
 */
public interface TreeNode {

    /** Qualified element name, e.g. {@code table:table-row}. */
    String name();

    boolean is(String qualifiedName);

    Optional<TreeNode> parent();

    List<TreeNode> children();

    List<TreeNode> children(String qualifiedName);

    Optional<TreeNode> firstChild(String qualifiedName);

    Optional<TreeNode> previousSibling();

    Optional<TreeNode> nextSibling();

    /** @return the attribute value, or {@code null} when absent */
    String attribute(String qualifiedName);

    boolean hasAttribute(String qualifiedName);

    void setAttribute(String qualifiedName, String value);

    void removeAttribute(String qualifiedName);

    /** Qualified attribute name to value, namespace declarations excluded. */
    Map<String, String> attributes();

    void clearAttributes();

    String text();

    void setText(String text);

    /** Creates a detached element owned by the same document as this node. */
    TreeNode createElement(String qualifiedName);

    TreeNode appendChild(TreeNode child);

    /** Inserts {@code node} before {@code reference}, which must be a child of this node. */
    TreeNode insertBefore(TreeNode reference, TreeNode node);

    /** Inserts {@code node} after {@code reference}, which must be a child of this node. */
    TreeNode insertAfter(TreeNode reference, TreeNode node);

    void removeChildren();

    /** Removes this node from its parent. A detached node stays usable. */
    void detach();

    /** Structural recursive copy, detached, in the same document. */
    TreeNode deepCopy();

    /** Flat markup of this subtree without namespace declarations. */
    String serialize();
}
