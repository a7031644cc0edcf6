package com.example.demo.ods.core;

import com.example.demo.ods.exception.ContractViolationException;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link TreeNode} backed by a namespace-aware W3C DOM element.
 */
public final class DomTreeNode implements TreeNode {

    private final Element element;

    private DomTreeNode(Element element) {
        this.element = Objects.requireNonNull(element, "element");
    }

    public static DomTreeNode wrap(Element element) {
        return new DomTreeNode(element);
    }

    /**
     * Unwraps a handle produced by this class. Handles from other implementations
     * are rejected since nodes cannot be moved between tree models.
     */
    public static Element unwrap(TreeNode node) {
        if (!(node instanceof DomTreeNode)) {
            throw new ContractViolationException(ContractViolationException.INVALID_NODE,
                    "Node " + node + " is not backed by a DOM element");
        }
        return ((DomTreeNode) node).element;
    }

    /**
     * Root element of a new document, with every {@link OdsNamespace} declared on it.
     */
    public static DomTreeNode newRoot(Document document, String qualifiedName) {
        Element root = document.createElementNS(OdsNamespace.of(qualifiedName).uri(), qualifiedName);
        for (OdsNamespace ns : OdsNamespace.values()) {
            root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:" + ns.prefix(), ns.uri());
        }
        document.appendChild(root);
        return new DomTreeNode(root);
    }

    public Element element() {
        return element;
    }

    @Override
    public String name() {
        return qualifiedName(element);
    }

    @Override
    public boolean is(String qualifiedName) {
        return matches(element, qualifiedName);
    }

    @Override
    public Optional<TreeNode> parent() {
        Node parent = element.getParentNode();
        if (parent instanceof Element) {
            return Optional.of(new DomTreeNode((Element) parent));
        }
        return Optional.empty();
    }

    @Override
    public List<TreeNode> children() {
        return collectChildren(null);
    }

    @Override
    public List<TreeNode> children(String qualifiedName) {
        return collectChildren(qualifiedName);
    }

    @Override
    public Optional<TreeNode> firstChild(String qualifiedName) {
        for (Node n = element.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element && matches((Element) n, qualifiedName)) {
                return Optional.of(new DomTreeNode((Element) n));
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<TreeNode> previousSibling() {
        for (Node n = element.getPreviousSibling(); n != null; n = n.getPreviousSibling()) {
            if (n instanceof Element) {
                return Optional.of(new DomTreeNode((Element) n));
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<TreeNode> nextSibling() {
        for (Node n = element.getNextSibling(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element) {
                return Optional.of(new DomTreeNode((Element) n));
            }
        }
        return Optional.empty();
    }

    @Override
    public String attribute(String qualifiedName) {
        OdsNamespace ns = OdsNamespace.of(qualifiedName);
        String local = OdsNamespace.localName(qualifiedName);
        if (!element.hasAttributeNS(ns.uri(), local)) {
            return null;
        }
        return element.getAttributeNS(ns.uri(), local);
    }

    @Override
    public boolean hasAttribute(String qualifiedName) {
        return element.hasAttributeNS(OdsNamespace.of(qualifiedName).uri(), OdsNamespace.localName(qualifiedName));
    }

    @Override
    public void setAttribute(String qualifiedName, String value) {
        element.setAttributeNS(OdsNamespace.of(qualifiedName).uri(), qualifiedName, value);
    }

    @Override
    public void removeAttribute(String qualifiedName) {
        element.removeAttributeNS(OdsNamespace.of(qualifiedName).uri(), OdsNamespace.localName(qualifiedName));
    }

    @Override
    public Map<String, String> attributes() {
        Map<String, String> out = new LinkedHashMap<>();
        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr attr = (Attr) attrs.item(i);
            if (isNamespaceDeclaration(attr)) {
                continue;
            }
            out.put(qualifiedName(attr), attr.getValue());
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public void clearAttributes() {
        NamedNodeMap attrs = element.getAttributes();
        List<Attr> doomed = new ArrayList<>();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr attr = (Attr) attrs.item(i);
            if (!isNamespaceDeclaration(attr)) {
                doomed.add(attr);
            }
        }
        for (Attr attr : doomed) {
            element.removeAttributeNode(attr);
        }
    }

    @Override
    public String text() {
        return element.getTextContent();
    }

    @Override
    public void setText(String text) {
        Node n = element.getFirstChild();
        while (n != null) {
            Node next = n.getNextSibling();
            if (n.getNodeType() == Node.TEXT_NODE || n.getNodeType() == Node.CDATA_SECTION_NODE) {
                element.removeChild(n);
            }
            n = next;
        }
        if (text != null && !text.isEmpty()) {
            element.insertBefore(element.getOwnerDocument().createTextNode(text), element.getFirstChild());
        }
    }

    @Override
    public TreeNode createElement(String qualifiedName) {
        Document doc = element.getOwnerDocument();
        return new DomTreeNode(doc.createElementNS(OdsNamespace.of(qualifiedName).uri(), qualifiedName));
    }

    @Override
    public TreeNode appendChild(TreeNode child) {
        element.appendChild(adopt(child));
        return child;
    }

    @Override
    public TreeNode insertBefore(TreeNode reference, TreeNode node) {
        Element ref = requireChild(reference);
        element.insertBefore(adopt(node), ref);
        return node;
    }

    @Override
    public TreeNode insertAfter(TreeNode reference, TreeNode node) {
        Element ref = requireChild(reference);
        element.insertBefore(adopt(node), ref.getNextSibling());
        return node;
    }

    @Override
    public void removeChildren() {
        while (element.getFirstChild() != null) {
            element.removeChild(element.getFirstChild());
        }
    }

    @Override
    public void detach() {
        Node parent = element.getParentNode();
        if (parent != null) {
            parent.removeChild(element);
        }
    }

    @Override
    public TreeNode deepCopy() {
        Document doc = element.getOwnerDocument();
        Element copy = doc.createElementNS(element.getNamespaceURI(), element.getTagName());
        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr attr = (Attr) attrs.item(i);
            if (isNamespaceDeclaration(attr)) {
                continue;
            }
            copy.setAttributeNS(attr.getNamespaceURI(), attr.getName(), attr.getValue());
        }
        for (Node n = element.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element) {
                copy.appendChild(unwrap(new DomTreeNode((Element) n).deepCopy()));
            } else if (n.getNodeType() == Node.TEXT_NODE) {
                copy.appendChild(doc.createTextNode(n.getNodeValue()));
            }
        }
        return new DomTreeNode(copy);
    }

    @Override
    public String serialize() {
        StringBuilder out = new StringBuilder();
        serialize(element, out);
        return out.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DomTreeNode)) return false;
        return element == ((DomTreeNode) o).element;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(element);
    }

    @Override
    public String toString() {
        return "<" + name() + attributes() + ">";
    }

    private List<TreeNode> collectChildren(String qualifiedName) {
        List<TreeNode> out = new ArrayList<>();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n instanceof Element && (qualifiedName == null || matches((Element) n, qualifiedName))) {
                out.add(new DomTreeNode((Element) n));
            }
        }
        return out;
    }

    private Element requireChild(TreeNode reference) {
        Element ref = unwrap(reference);
        if (ref.getParentNode() != element) {
            throw new ContractViolationException(ContractViolationException.INVALID_NODE,
                    "Reference " + reference + " is not a child of " + this);
        }
        return ref;
    }

    private Element adopt(TreeNode node) {
        Element e = unwrap(node);
        Document own = element.getOwnerDocument();
        if (e.getOwnerDocument() != own) {
            own.adoptNode(e);
        }
        return e;
    }

    private static boolean matches(Element e, String qualifiedName) {
        OdsNamespace ns = OdsNamespace.of(qualifiedName);
        return ns.uri().equals(e.getNamespaceURI())
                && OdsNamespace.localName(qualifiedName).equals(e.getLocalName());
    }

    private static boolean isNamespaceDeclaration(Attr attr) {
        return XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI());
    }

    private static String qualifiedName(Node node) {
        String uri = node.getNamespaceURI();
        if (uri != null) {
            for (OdsNamespace ns : OdsNamespace.values()) {
                if (ns.uri().equals(uri)) {
                    return ns.prefix() + ":" + node.getLocalName();
                }
            }
        }
        return node.getNodeName();
    }

    private static void serialize(Element e, StringBuilder out) {
        out.append('<').append(qualifiedName(e));
        NamedNodeMap attrs = e.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr attr = (Attr) attrs.item(i);
            if (isNamespaceDeclaration(attr)) {
                continue;
            }
            out.append(' ').append(qualifiedName(attr)).append("=\"").append(escape(attr.getValue())).append('"');
        }
        out.append('>');
        for (Node n = e.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element) {
                serialize((Element) n, out);
            } else if (n.getNodeType() == Node.TEXT_NODE) {
                out.append(escape(n.getNodeValue()));
            }
        }
        out.append("</").append(qualifiedName(e)).append('>');
    }

    private static String escape(String value) {
        return value.replace("&", "&amp;").replace("<", "&lt;").replace("\"", "&quot;");
    }
}
