package com.example.demo.ods.service;

import com.example.demo.ods.config.OdsProperties;
import com.example.demo.ods.core.RunLengthIndex;
import com.example.demo.ods.core.TreeNode;
import com.example.demo.ods.exception.ContractViolationException;
import com.example.demo.ods.model.CellContent;
import com.example.demo.ods.model.CellMatch;
import com.example.demo.ods.model.CellType;
import com.example.demo.ods.model.ElementKind;
import com.example.demo.ods.style.ColorPalette;
import com.example.demo.ods.style.DefaultStyleCatalog;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SpreadsheetDocumentTest {

    private static SpreadsheetDocumentFactory factory;

    private SpreadsheetDocument document;

    @BeforeAll
    public static void createFactory() {
        OdsProperties properties = new OdsProperties();
        factory = new SpreadsheetDocumentFactory(properties, new ColorPalette(properties), new DefaultStyleCatalog(properties));
    }

    @BeforeEach
    public void setup() {
        document = factory.newDocument();
    }

    private String text(int row, int col) {
        return document.readCell(row, col).map(CellContent::getText).orElse(null);
    }

    private TreeNode currentTable() {
        return document.registry().currentTable().getNode();
    }

    @Nested
    @DisplayName("Cell content")
    class Content {

        @Test
        public void testWriteAndReadString() {
            TreeNode cell = document.writeCell(2, 3, CellType.STRING, "hello");

            assertEquals(Optional.of(new CellContent("hello", "string")), document.readCell(2, 3));
            assertEquals("myString", cell.attribute("table:style-name"));
            assertEquals(3, document.widthOf("Sheet1"));
            assertEquals(3, document.indexOf(cell));
        }

        @Test
        @DisplayName("Floats accept a decimal comma")
        public void testWriteFloat() {
            TreeNode cell = document.writeCell(1, 1, CellType.FLOAT, "3,14");

            assertEquals("3.14", cell.attribute("office:value"));
            assertEquals("float", cell.attribute("office:value-type"));
            assertEquals("myFloat", cell.attribute("table:style-name"));
            assertEquals(Optional.of(new CellContent("3,14", "float")), document.readCell(1, 1));
        }

        @Test
        public void testRewriteReplacesContent() {
            TreeNode cell = document.writeCell(1, 1, CellType.STRING, "old");
            document.setAttributes(cell, Map.of("color", "red"));

            document.writeCellFromRow(document.getRow(1), 1, CellType.STRING, "new");

            assertEquals("new", text(1, 1));
            assertEquals(1, cell.children().size());
            assertEquals("myString", cell.attribute("table:style-name"));
        }

        @Test
        @DisplayName("Reading does not create rows or cells")
        public void testReadMissingCell() {
            int rows = RunLengthIndex.totalOf(currentTable(), ElementKind.ROW);

            assertTrue(document.readCell(9, 9).isEmpty());
            assertTrue(document.getCellIfExists(1, 4).isEmpty());
            assertEquals(rows, RunLengthIndex.totalOf(currentTable(), ElementKind.ROW));
        }

        @Test
        public void testWriteIntoRepeatedCell() {
            TreeNode row = document.getRow(1);
            document.getCellFromRow(row, 5);
            TreeNode gap = document.getCellFromRowIfExists(row, 3).orElseThrow();

            ContractViolationException e = assertThrows(ContractViolationException.class,
                    () -> document.writeText(gap, CellType.STRING, "x"));
            assertEquals(ContractViolationException.INVALID_NODE, e.getCode());
        }

        @Test
        public void testFindCells() {
            document.writeCell(1, 1, CellType.STRING, "apple");
            document.writeCell(4, 2, CellType.STRING, "pineapple");
            document.writeCell(5, 1, CellType.STRING, "pear");
            document.insertTable("Fruit");
            document.setCurrentTable("Fruit");
            document.writeCell(2, 2, CellType.STRING, "crabapple");

            List<CellMatch> matches = document.findCells("apple$");

            assertEquals(3, matches.size());
            assertEquals("Sheet1", matches.get(1).getTable());
            assertEquals(4, matches.get(1).getRow());
            assertEquals(2, matches.get(1).getColumn());
            assertEquals("Fruit", matches.get(2).getTable());
        }

        @Test
        public void testFindCellsInvalidPattern() {
            ContractViolationException e = assertThrows(ContractViolationException.class, () -> document.findCells("(["));
            assertEquals(ContractViolationException.INVALID_ARGUMENT, e.getCode());
        }
    }

    @Nested
    @DisplayName("Styles")
    class Styles {

        @Test
        public void testSetAttributesCreatesAutomaticStyle() {
            TreeNode cell = document.writeCell(1, 1, CellType.STRING, "x");

            document.setAttributes(cell, Map.of("background-color", "yellow", "border", "0.06pt solid black"));

            String name = cell.attribute("table:style-name");
            assertEquals("myAutoStyle1", name);
            assertTrue(document.findStyle(name).isPresent());
        }

        @Test
        public void testNamedStyleAssignment() {
            document.writeStyleAbbr(Map.of("name", "header", "font-weight", "bold"));
            TreeNode cell = document.writeCell(1, 1, CellType.STRING, "Title");

            document.setStyle(cell, "header");

            assertEquals("header", cell.attribute("table:style-name"));
            assertEquals("bold", document.findStyle("header").orElseThrow()
                    .firstChild("style:text-properties").orElseThrow().attribute("style:font-weight-asian"));
        }

        @Test
        public void testWriteStyleQualified() {
            TreeNode style = document.writeStyle(Map.of("style:name", "framed", "fo:border", "0.06pt solid #000000"));

            assertEquals("framed", style.attribute("style:name"));
        }
    }

    @Nested
    @DisplayName("Rows")
    class Rows {

        @Test
        public void testInsertRowShiftsDown() {
            document.writeCell(1, 1, CellType.STRING, "a");

            document.insertRow(1);

            assertNull(text(1, 1));
            assertEquals("a", text(2, 1));
        }

        @Test
        @DisplayName("Inserting below a repeated row adds exactly one position")
        public void testInsertRowBelowRepeated() {
            document.getRow(5);
            TreeNode gap = document.getRowIfExists(2).orElseThrow();
            int before = RunLengthIndex.totalOf(currentTable(), ElementKind.ROW);

            TreeNode inserted = document.insertRowBelow(gap);

            assertEquals(before + 1, RunLengthIndex.totalOf(currentTable(), ElementKind.ROW));
            assertEquals(3, document.indexOf(inserted));
        }

        @Test
        public void testInsertRowAbove() {
            document.writeCell(2, 1, CellType.STRING, "b");

            TreeNode inserted = document.insertRowAbove(document.getRow(2));

            assertEquals(2, document.indexOf(inserted));
            assertEquals("b", text(3, 1));
        }

        @Test
        public void testDeleteRow() {
            document.writeCell(1, 1, CellType.STRING, "a");
            document.writeCell(2, 1, CellType.STRING, "b");

            document.deleteRow(1);

            assertEquals("b", text(1, 1));
        }

        @Test
        public void testDeleteRowNodeDecrementsRun() {
            document.getRow(6);
            TreeNode gap = document.getRowIfExists(3).orElseThrow();
            int repetition = RunLengthIndex.repetitionOf(gap, ElementKind.ROW);

            document.deleteRowNode(gap);

            assertEquals(repetition - 1, RunLengthIndex.repetitionOf(gap, ElementKind.ROW));
        }

        @Test
        public void testDeleteRowAboveAndBelow() {
            document.writeCell(1, 1, CellType.STRING, "a");
            document.writeCell(2, 1, CellType.STRING, "b");
            document.writeCell(3, 1, CellType.STRING, "c");

            document.deleteRowBelow(document.getRow(1));
            assertEquals("c", text(2, 1));

            document.deleteRowAbove(document.getRow(2));
            assertEquals("c", text(1, 1));
        }

        @Test
        public void testDeleteRowAboveFirstRow() {
            ContractViolationException e = assertThrows(ContractViolationException.class,
                    () -> document.deleteRowAbove(document.getRow(1)));
            assertEquals(ContractViolationException.NO_SIBLING, e.getCode());
        }

        @Test
        public void testNeighbours() {
            TreeNode first = document.getRow(1);
            TreeNode second = document.getRow(2);

            assertEquals(Optional.of(second), document.nextRow(first));
            assertEquals(Optional.of(first), document.previousRow(second));
            assertTrue(document.previousRow(first).isEmpty());
        }
    }

    @Nested
    @DisplayName("Cells and columns")
    class CellsAndColumns {

        @Test
        public void testInsertCellShiftsRight() {
            document.writeCell(1, 1, CellType.STRING, "a");

            document.insertCell(1, 1);

            assertEquals("a", text(1, 2));
            assertEquals(2, document.widthOf("Sheet1"));
        }

        @Test
        public void testInsertCellAfterRepeated() {
            TreeNode row = document.getRow(1);
            document.getCellFromRow(row, 4);
            TreeNode gap = document.getCellFromRowIfExists(row, 2).orElseThrow();

            TreeNode inserted = document.insertCellAfter(gap);

            assertEquals(3, document.indexOf(inserted));
            assertEquals(5, document.siblingCountOf(inserted));
            assertEquals(5, document.widthOf("Sheet1"));
        }

        @Test
        public void testDeleteCells() {
            document.writeCell(1, 1, CellType.STRING, "a");
            document.writeCell(1, 2, CellType.STRING, "b");
            document.writeCell(1, 3, CellType.STRING, "c");

            document.deleteCell(1, 1);
            assertEquals("b", text(1, 1));

            document.deleteCellAfter(document.getCell(1, 1));
            assertEquals("b", text(1, 1));
            assertNull(text(1, 2));

            ContractViolationException e = assertThrows(ContractViolationException.class,
                    () -> document.deleteCellBefore(document.getCell(1, 1)));
            assertEquals(ContractViolationException.NO_SIBLING, e.getCode());
        }

        @Test
        public void testCellNeighbours() {
            TreeNode first = document.getCell(1, 1);
            TreeNode second = document.getCell(1, 2);

            assertEquals(Optional.of(second), document.nextCell(first));
            assertEquals(Optional.of(first), document.previousCell(second));
            assertTrue(document.nextCell(second).isEmpty());
        }

        @Test
        public void testInsertColumn() {
            document.writeCell(1, 1, CellType.STRING, "a");
            document.writeCell(1, 2, CellType.STRING, "b");

            document.insertColumn(1);

            assertNull(text(1, 1));
            assertEquals("a", text(1, 2));
            assertEquals("b", text(1, 3));
            assertEquals(3, document.widthOf("Sheet1"));

            document.padTables();
            assertEquals(3, RunLengthIndex.totalOf(currentTable(), ElementKind.COLUMN));
        }

        @Test
        public void testDeleteColumn() {
            document.writeCell(1, 1, CellType.STRING, "a");
            document.writeCell(1, 2, CellType.STRING, "b");

            document.deleteColumn(1);

            assertEquals("b", text(1, 1));
            assertEquals(2, document.widthOf("Sheet1"));
        }

        @Test
        public void testGetColumnGrowsHeaderAndWidth() {
            TreeNode column = document.getColumn(4);

            assertEquals(4, document.indexOf(column));
            assertEquals(4, document.widthOf("Sheet1"));
            assertEquals(4, RunLengthIndex.totalOf(currentTable(), ElementKind.COLUMN));
        }

        @Test
        public void testDeleteColumnOutsideWidth() {
            ContractViolationException e = assertThrows(ContractViolationException.class, () -> document.deleteColumn(4));
            assertEquals(ContractViolationException.INVALID_INDEX, e.getCode());
        }
    }

    @Nested
    @DisplayName("Tables")
    class Tables {

        @Test
        public void testCellsGoToCurrentTable() {
            document.insertTable("Second");
            document.setCurrentTable("Second");
            document.writeCell(1, 1, CellType.STRING, "there");

            assertEquals("there", text(1, 1));
            document.setCurrentTable("Sheet1");
            assertNull(text(1, 1));
        }

        @Test
        public void testTableOperations() {
            document.insertTable("Last");
            document.insertTableBefore("Sheet1", "First");
            document.insertTableAfter("Sheet1", "Middle");
            document.renameTable("Middle", "Centre");

            assertEquals(List.of("First", "Sheet1", "Centre", "Last"), document.tableNames());

            document.deleteTable("Last");
            assertEquals(3, document.tableCount());
            assertEquals("Sheet1", document.currentTableName());
        }

        @Test
        public void testDeleteCurrentTable() {
            ContractViolationException e = assertThrows(ContractViolationException.class,
                    () -> document.deleteTable("Sheet1"));
            assertEquals(ContractViolationException.CURRENT_TABLE, e.getCode());
        }
    }
}
