package com.example.demo.ods.service;

import com.example.demo.ods.config.OdsProperties;
import com.example.demo.ods.core.RunLengthIndex;
import com.example.demo.ods.core.TreeNode;
import com.example.demo.ods.exception.DocumentParseException;
import com.example.demo.ods.model.CellContent;
import com.example.demo.ods.model.CellType;
import com.example.demo.ods.model.ElementKind;
import com.example.demo.ods.style.ColorPalette;
import com.example.demo.ods.style.DefaultStyleCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SpreadsheetDocumentFactoryTest {

    private SpreadsheetDocumentFactory factory;

    @TempDir
    Path tempDir;

    @BeforeEach
    public void setup() {
        OdsProperties properties = new OdsProperties();
        factory = new SpreadsheetDocumentFactory(properties, new ColorPalette(properties), new DefaultStyleCatalog(properties));
    }

    private SpreadsheetDocument openFixture() throws Exception {
        try (InputStream content = getClass().getResourceAsStream("/fixtures/content.xml");
             InputStream styles = getClass().getResourceAsStream("/fixtures/styles.xml")) {
            return factory.open(content, styles);
        }
    }

    private static InputStream xml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testNewDocument() {
        SpreadsheetDocument document = factory.newDocument();

        assertEquals(List.of("Sheet1"), document.tableNames());
        assertTrue(document.findStyle("myString").isPresent());
        assertTrue(document.findStyle("myPercentFormat").isPresent());
    }

    @Test
    public void testOpenFixture() throws Exception {
        SpreadsheetDocument document = openFixture();

        assertEquals(List.of("Data", "Notes"), document.tableNames());
        assertEquals("Data", document.currentTableName());
        assertEquals(3, document.widthOf("Data"));
        assertEquals(Optional.of(new CellContent("Name", "string")), document.readCell(1, 1));
        assertEquals(Optional.of(new CellContent("3.14", "float")), document.readCell(6, 2));
        assertTrue(document.readCell(3, 2).isEmpty());
        assertEquals(2, document.findCells("^Value").size());
    }

    @Test
    @DisplayName("Styles already in the document are reused and their names are not handed out again")
    public void testAdoptsExistingStyles() throws Exception {
        SpreadsheetDocument document = openFixture();
        TreeNode cell = document.getCell(1, 1);

        document.setAttributes(cell, Map.of("font-weight", "bold"));
        assertEquals("ce1", cell.attribute("table:style-name"));

        document.setAttributes(cell, Map.of("color", "red"));
        assertEquals("myAutoStyle4", cell.attribute("table:style-name"));
    }

    @Test
    public void testMissingStylesMember() throws Exception {
        try (InputStream content = getClass().getResourceAsStream("/fixtures/content.xml")) {
            SpreadsheetDocument document = factory.open(content, null);

            assertTrue(document.findStyle("myCurrencyFormat").isPresent());
        }
    }

    @Test
    @DisplayName("Writing pads the header to the recorded width and survives a reopen")
    public void testWriteAndReopen() throws Exception {
        SpreadsheetDocument document = openFixture();
        document.writeCell(2, 6, CellType.STRING, "far right");
        document.setAttributes(document.getCell(2, 6), Map.of("background-color", "lightgrey"));
        Path content = tempDir.resolve("content.xml");
        Path styles = tempDir.resolve("styles.xml");

        factory.write(document, content, styles);

        assertTrue(Files.size(content) > 0);
        TreeNode data = document.registry().table("Data").getNode();
        assertEquals(6, RunLengthIndex.totalOf(data, ElementKind.COLUMN));
        assertFalse(document.registry().table("Data").isWidthExceeded());

        SpreadsheetDocument reopened = factory.open(content, styles);
        assertEquals(6, reopened.widthOf("Data"));
        assertEquals(Optional.of(new CellContent("far right", "string")), reopened.readCell(2, 6));
        String styleName = reopened.getCell(2, 6).attribute("table:style-name");
        assertTrue(reopened.findStyle(styleName).isPresent());
        assertTrue(reopened.findStyle("myFloatFormat").isPresent());
    }

    @Test
    public void testWrongRoot() {
        String styles = "<office:document-styles xmlns:office=\"urn:oasis:names:tc:opendocument:xmlns:office:1.0\"/>";

        DocumentParseException e = assertThrows(DocumentParseException.class, () -> factory.open(xml(styles), null));
        assertEquals(DocumentParseException.PARSE_FAILED, e.getCode());
    }

    @Test
    public void testMissingSpreadsheetBody() {
        String content = "<office:document-content xmlns:office=\"urn:oasis:names:tc:opendocument:xmlns:office:1.0\">"
                + "<office:body/></office:document-content>";

        DocumentParseException e = assertThrows(DocumentParseException.class, () -> factory.open(xml(content), null));
        assertEquals(DocumentParseException.PARSE_FAILED, e.getCode());
    }

    @Test
    public void testMalformedXml() {
        DocumentParseException e = assertThrows(DocumentParseException.class,
                () -> factory.open(xml("<office:document-content"), null));
        assertEquals(DocumentParseException.PARSE_FAILED, e.getCode());
    }

    @Test
    public void testDoctypeIsRejected() {
        String content = "<?xml version=\"1.0\"?><!DOCTYPE x [<!ENTITY e SYSTEM \"file:///etc/passwd\">]><x>&e;</x>";

        assertThrows(DocumentParseException.class, () -> factory.open(xml(content), null));
    }
}
