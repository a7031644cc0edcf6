package com.example.demo.ods.core;

import com.example.demo.ods.exception.ContractViolationException;

/**
 * XML namespaces used by the Open Document spreadsheet member files.
 * Qualified names throughout the engine are written with these prefixes
 * (e.g. {@code table:number-rows-repeated}).
 */
public enum OdsNamespace {
    OFFICE("office", "urn:oasis:names:tc:opendocument:xmlns:office:1.0"),
    STYLE("style", "urn:oasis:names:tc:opendocument:xmlns:style:1.0"),
    TEXT("text", "urn:oasis:names:tc:opendocument:xmlns:text:1.0"),
    TABLE("table", "urn:oasis:names:tc:opendocument:xmlns:table:1.0"),
    NUMBER("number", "urn:oasis:names:tc:opendocument:xmlns:datastyle:1.0"),
    FO("fo", "urn:oasis:names:tc:opendocument:xmlns:xsl-fo-compatible:1.0");

    private final String prefix;
    private final String uri;

    OdsNamespace(String prefix, String uri) {
        this.prefix = prefix;
        this.uri = uri;
    }

    public String prefix() {
        return prefix;
    }

    public String uri() {
        return uri;
    }

    public static OdsNamespace forPrefix(String prefix) {
        for (OdsNamespace ns : values()) {
            if (ns.prefix.equals(prefix)) {
                return ns;
            }
        }
        throw new ContractViolationException(ContractViolationException.INVALID_NODE,
                "Unknown namespace prefix '" + prefix + "'");
    }

    /**
     * Resolves the namespace of a prefixed name such as {@code style:name}.
     */
    public static OdsNamespace of(String qualifiedName) {
        int colon = qualifiedName.indexOf(':');
        if (colon <= 0) {
            throw new ContractViolationException(ContractViolationException.INVALID_NODE,
                    "Name '" + qualifiedName + "' is not prefixed");
        }
        return forPrefix(qualifiedName.substring(0, colon));
    }

    public static String localName(String qualifiedName) {
        return qualifiedName.substring(qualifiedName.indexOf(':') + 1);
    }
}
