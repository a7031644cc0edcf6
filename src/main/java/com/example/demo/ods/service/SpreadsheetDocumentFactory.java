package com.example.demo.ods.service;

import com.example.demo.ods.aspect.LogExecutionTime;
import com.example.demo.ods.config.OdsProperties;
import com.example.demo.ods.core.DomTreeNode;
import com.example.demo.ods.core.TreeNode;
import com.example.demo.ods.exception.DocumentParseException;
import com.example.demo.ods.style.ColorPalette;
import com.example.demo.ods.style.DefaultStyleCatalog;
import com.example.demo.ods.style.StyleArchive;
import com.example.demo.ods.style.StyleCanonicalizer;
import com.example.demo.ods.style.StyleNameGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates {@link SpreadsheetDocument}s from the {@code content.xml} and {@code styles.xml}
 * members of a spreadsheet and writes them back. The zip container is handled by the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpreadsheetDocumentFactory {

    private static final String DOCUMENT_CONTENT = "office:document-content";
    private static final String DOCUMENT_STYLES = "office:document-styles";
    private static final String AUTOMATIC_STYLES = "office:automatic-styles";
    private static final String OFFICE_STYLES = "office:styles";
    private static final String BODY = "office:body";
    private static final String SPREADSHEET = "office:spreadsheet";

    private final OdsProperties properties;
    private final ColorPalette palette;
    private final DefaultStyleCatalog catalog;

    /**
     * An empty spreadsheet holding the default table.
     */
    @LogExecutionTime("Creating Spreadsheet")
    public SpreadsheetDocument newDocument() {
        DocumentBuilder builder = newBuilder();
        Document content = builder.newDocument();
        TreeNode contentRoot = DomTreeNode.newRoot(content, DOCUMENT_CONTENT);
        contentRoot.setAttribute("office:version", "1.2");
        contentRoot.appendChild(contentRoot.createElement(AUTOMATIC_STYLES));
        TreeNode body = contentRoot.appendChild(contentRoot.createElement(BODY));
        body.appendChild(body.createElement(SPREADSHEET));

        Document styles = builder.newDocument();
        TreeNode stylesRoot = DomTreeNode.newRoot(styles, DOCUMENT_STYLES);
        stylesRoot.setAttribute("office:version", "1.2");
        stylesRoot.appendChild(stylesRoot.createElement(OFFICE_STYLES));
        return assemble(content, styles);
    }

    /**
     * Parses both member documents. {@code stylesXml} may be null, in which case an
     * empty styles document is used.
     */
    @LogExecutionTime("Opening Spreadsheet")
    public SpreadsheetDocument open(InputStream contentXml, InputStream stylesXml) {
        if (contentXml == null) {
            throw new DocumentParseException(DocumentParseException.PARSE_FAILED, "content.xml stream is absent", null);
        }
        Document content = parse(contentXml, "content.xml");
        Document styles;
        if (stylesXml == null) {
            styles = newBuilder().newDocument();
            DomTreeNode.newRoot(styles, DOCUMENT_STYLES);
        } else {
            styles = parse(stylesXml, "styles.xml");
        }
        return assemble(content, styles);
    }

    public SpreadsheetDocument open(Path contentXml, Path stylesXml) {
        try (InputStream content = Files.newInputStream(contentXml);
             InputStream styles = stylesXml == null ? null : Files.newInputStream(stylesXml)) {
            return open(content, styles);
        } catch (IOException e) {
            throw new DocumentParseException(DocumentParseException.PARSE_FAILED,
                    "Failed to read " + contentXml + " / " + stylesXml, e);
        }
    }

    /**
     * Pads every table header to its recorded width, then writes {@code content.xml}.
     */
    @LogExecutionTime("Writing content.xml")
    public void writeContent(SpreadsheetDocument document, OutputStream out) {
        document.padTables();
        serialize(document.contentDocument(), out, "content.xml");
    }

    @LogExecutionTime("Writing styles.xml")
    public void writeStyles(SpreadsheetDocument document, OutputStream out) {
        serialize(document.stylesDocument(), out, "styles.xml");
    }

    public void write(SpreadsheetDocument document, Path contentXml, Path stylesXml) {
        try (OutputStream content = Files.newOutputStream(contentXml);
             OutputStream styles = Files.newOutputStream(stylesXml)) {
            writeContent(document, content);
            writeStyles(document, styles);
        } catch (IOException e) {
            throw new DocumentParseException(DocumentParseException.WRITE_FAILED,
                    "Failed to write " + contentXml + " / " + stylesXml, e);
        }
    }

    private SpreadsheetDocument assemble(Document content, Document styles) {
        TreeNode contentRoot = requireRoot(content, DOCUMENT_CONTENT, "content.xml");
        TreeNode spreadsheet = contentRoot.firstChild(BODY)
                .flatMap(body -> body.firstChild(SPREADSHEET))
                .orElseThrow(() -> new DocumentParseException(DocumentParseException.PARSE_FAILED,
                        "content.xml has no office:body/office:spreadsheet", null));
        TreeNode automaticStyles = contentRoot.firstChild(AUTOMATIC_STYLES).orElseGet(() ->
                contentRoot.insertBefore(contentRoot.firstChild(BODY).orElseThrow(),
                        contentRoot.createElement(AUTOMATIC_STYLES)));

        TreeNode stylesRoot = requireRoot(styles, DOCUMENT_STYLES, "styles.xml");
        TreeNode officeStyles = stylesRoot.firstChild(OFFICE_STYLES).orElseGet(() -> {
            TreeNode created = stylesRoot.createElement(OFFICE_STYLES);
            return stylesRoot.children().isEmpty()
                    ? stylesRoot.appendChild(created)
                    : stylesRoot.insertBefore(stylesRoot.children().get(0), created);
        });

        TableRegistry registry = new TableRegistry(spreadsheet, properties.getDefaultTableName());
        StyleCanonicalizer canonicalizer = new StyleCanonicalizer(automaticStyles, officeStyles, palette,
                catalog.protectedNames(), new StyleNameGenerator(properties.getAutoStylePrefix()), new StyleArchive());
        canonicalizer.adoptExisting();
        if (properties.isRegisterDefaultStyles()) {
            canonicalizer.registerAll(catalog.specs());
        }
        log.info("Spreadsheet ready: {} tables, {} archived styles",
                registry.tableCount(), canonicalizer.archive().size());
        return new SpreadsheetDocument(content, styles, spreadsheet, registry, canonicalizer);
    }

    private static TreeNode requireRoot(Document document, String rootName, String member) {
        if (document.getDocumentElement() == null) {
            throw new DocumentParseException(DocumentParseException.PARSE_FAILED, member + " is empty", null);
        }
        TreeNode root = DomTreeNode.wrap(document.getDocumentElement());
        if (!root.is(rootName)) {
            throw new DocumentParseException(DocumentParseException.PARSE_FAILED,
                    member + " has root " + root.name() + " instead of " + rootName, null);
        }
        return root;
    }

    private static Document parse(InputStream in, String member) {
        try {
            return newBuilder().parse(in);
        } catch (SAXException | IOException e) {
            throw new DocumentParseException(DocumentParseException.PARSE_FAILED,
                    "Failed to parse " + member + ": " + e.getMessage(), e);
        }
    }

    private static void serialize(Document document, OutputStream out, String member) {
        try {
            TransformerFactory factory = TransformerFactory.newInstance();
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
            Transformer transformer = factory.newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
            transformer.setOutputProperty(OutputKeys.INDENT, "no");
            transformer.transform(new DOMSource(document), new StreamResult(out));
        } catch (TransformerException e) {
            throw new DocumentParseException(DocumentParseException.WRITE_FAILED,
                    "Failed to write " + member + ": " + e.getMessage(), e);
        }
    }

    private static DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new DocumentParseException(DocumentParseException.PARSE_FAILED,
                    "XML parser is not available: " + e.getMessage(), e);
        }
    }
}
