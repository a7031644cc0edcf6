package com.example.demo.ods.service;

import com.example.demo.ods.core.RunLengthIndex;
import com.example.demo.ods.core.TreeNode;
import com.example.demo.ods.exception.ContractViolationException;
import com.example.demo.ods.model.CellContent;
import com.example.demo.ods.model.CellMatch;
import com.example.demo.ods.model.CellType;
import com.example.demo.ods.model.ElementKind;
import com.example.demo.ods.model.InsertPosition;
import com.example.demo.ods.model.StyleLocation;
import com.example.demo.ods.model.StyleSpec;
import com.example.demo.ods.style.StyleCanonicalizer;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One open spreadsheet: the parsed content and styles documents together with
 * their table registry, positional index and style cache.
 * <p>
 * Row, cell and column addresses are 1-based and refer to the current table.
 * Instances are created by {@link SpreadsheetDocumentFactory} and are not thread safe.
 */
@Slf4j
public class SpreadsheetDocument {

    private static final String PARAGRAPH = "text:p";
    private static final String VALUE = "office:value";

    private final Document contentDocument;
    private final Document stylesDocument;
    private final TreeNode spreadsheet;
    private final TableRegistry registry;
    private final RunLengthIndex index;
    private final StyleCanonicalizer styles;
    private final StructureEditor structure;

    SpreadsheetDocument(Document contentDocument, Document stylesDocument, TreeNode spreadsheet,
                        TableRegistry registry, StyleCanonicalizer styles) {
        this.contentDocument = contentDocument;
        this.stylesDocument = stylesDocument;
        this.spreadsheet = spreadsheet;
        this.registry = registry;
        this.index = new RunLengthIndex(registry);
        this.styles = styles;
        this.structure = new StructureEditor(index, registry);
    }

    public TreeNode getRow(int rowIndex) {
        return index.locateOrCreate(currentTableNode(), ElementKind.ROW, rowIndex);
    }

    public TreeNode getCell(int rowIndex, int colIndex) {
        return getCellFromRow(getRow(rowIndex), colIndex);
    }

    public TreeNode getCellFromRow(TreeNode row, int colIndex) {
        requireKind(row, ElementKind.ROW);
        return index.locateOrCreate(row, ElementKind.CELL, colIndex);
    }

    public TreeNode getColumn(int colIndex) {
        return index.locateOrCreate(currentTableNode(), ElementKind.COLUMN, colIndex);
    }

    public Optional<TreeNode> getRowIfExists(int rowIndex) {
        return index.lookupIfExists(currentTableNode(), ElementKind.ROW, rowIndex);
    }

    public Optional<TreeNode> getCellIfExists(int rowIndex, int colIndex) {
        return getRowIfExists(rowIndex).flatMap(row -> getCellFromRowIfExists(row, colIndex));
    }

    public Optional<TreeNode> getCellFromRowIfExists(TreeNode row, int colIndex) {
        requireKind(row, ElementKind.ROW);
        return index.lookupIfExists(row, ElementKind.CELL, colIndex);
    }

    /** 1-based position of the first logical element of {@code node}'s run. */
    public int indexOf(TreeNode node) {
        return index.ordinalOf(node);
    }

    /** Logical count of {@code node} and its same-kind siblings. */
    public int siblingCountOf(TreeNode node) {
        return index.countOf(node);
    }

    public TreeNode writeCell(int rowIndex, int colIndex, CellType type, String text) {
        TreeNode cell = getCell(rowIndex, colIndex);
        writeText(cell, type, text);
        return cell;
    }

    public TreeNode writeCellFromRow(TreeNode row, int colIndex, CellType type, String text) {
        TreeNode cell = getCellFromRow(row, colIndex);
        writeText(cell, type, text);
        return cell;
    }

    /**
     * Replaces the cell's attributes and content with a typed value and its paragraph.
     * Floats accept a comma as decimal separator.
     */
    public void writeText(TreeNode cell, CellType type, String text) {
        requireKind(cell, ElementKind.CELL);
        if (type == null || text == null) {
            throw new ContractViolationException(ContractViolationException.INVALID_ARGUMENT,
                    "Cell type and text are required");
        }
        if (RunLengthIndex.repetitionOf(cell, ElementKind.CELL) > 1) {
            throw new ContractViolationException(ContractViolationException.INVALID_NODE,
                    "Cell " + cell + " stands for several positions; address a single one");
        }
        cell.clearAttributes();
        cell.removeChildren();
        cell.setAttribute(StyleCanonicalizer.VALUE_TYPE_ATTRIBUTE, type.valueType());
        switch (type) {
            case FLOAT:
                cell.setAttribute(VALUE, text.replaceFirst(",", "."));
                cell.setAttribute(StyleCanonicalizer.CELL_STYLE_ATTRIBUTE, "myFloat");
                break;
            case STRING:
            default:
                cell.setAttribute(StyleCanonicalizer.CELL_STYLE_ATTRIBUTE, "myString");
                break;
        }
        TreeNode paragraph = cell.appendChild(cell.createElement(PARAGRAPH));
        paragraph.setText(text);
    }

    public Optional<CellContent> readCell(int rowIndex, int colIndex) {
        return getRowIfExists(rowIndex).flatMap(row -> readCellFromRow(row, colIndex));
    }

    public Optional<CellContent> readCellFromRow(TreeNode row, int colIndex) {
        return getCellFromRowIfExists(row, colIndex).flatMap(SpreadsheetDocument::contentOf);
    }

    /**
     * Every cell of every table whose paragraph text contains a match of {@code regex}.
     */
    public List<CellMatch> findCells(String regex) {
        if (regex == null) {
            throw new ContractViolationException(ContractViolationException.INVALID_ARGUMENT, "Search pattern is absent");
        }
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ContractViolationException(ContractViolationException.INVALID_ARGUMENT,
                    "Invalid search pattern '" + regex + "': " + e.getDescription());
        }
        List<CellMatch> matches = new ArrayList<>();
        for (TreeNode table : spreadsheet.children("table:table")) {
            String tableName = table.attribute("table:name");
            for (TreeNode row : table.children(ElementKind.ROW.elementName())) {
                for (TreeNode cell : row.children(ElementKind.CELL.elementName())) {
                    for (TreeNode paragraph : cell.children(PARAGRAPH)) {
                        if (pattern.matcher(paragraph.text()).find()) {
                            matches.add(new CellMatch(tableName, cell, index.ordinalOf(row), index.ordinalOf(cell)));
                            break;
                        }
                    }
                }
            }
        }
        log.debug("Search for '{}' matched {} cells", regex, matches.size());
        return matches;
    }

    /**
     * Gives the cell a style with the requested attributes; keys may be short
     * ({@code color}) or qualified ({@code fo:color}), colors may be palette names.
     */
    public void setAttributes(TreeNode cell, Map<String, String> attributes) {
        styles.apply(cell, attributes);
    }

    public void setStyle(TreeNode cell, String styleName) {
        styles.setStyle(cell, styleName);
    }

    public TreeNode writeStyle(Map<String, String> qualifiedAttributes) {
        return styles.writeStyle(qualifiedAttributes);
    }

    public TreeNode writeStyleAbbr(Map<String, String> attributes) {
        return styles.writeStyleAbbr(attributes);
    }

    public TreeNode registerStyle(StyleSpec spec, StyleLocation location) {
        return styles.register(spec, location);
    }

    public Optional<TreeNode> findStyle(String styleName) {
        return styles.findStyle(styleName);
    }

    public void setCurrentTable(String name) {
        registry.select(name);
    }

    public String currentTableName() {
        return registry.currentTableName();
    }

    public void renameTable(String oldName, String newName) {
        registry.rename(oldName, newName);
    }

    public void insertTable(String name) {
        registry.append(name);
    }

    public void insertTableBefore(String relativeName, String name) {
        registry.insert(name, InsertPosition.BEFORE, relativeName);
    }

    public void insertTableAfter(String relativeName, String name) {
        registry.insert(name, InsertPosition.AFTER, relativeName);
    }

    public void deleteTable(String name) {
        registry.delete(name);
    }

    public List<String> tableNames() {
        return registry.tableNames();
    }

    public int tableCount() {
        return registry.tableCount();
    }

    public int widthOf(String name) {
        return registry.widthOf(name);
    }

    public void padTables() {
        registry.padAll();
    }

    public TreeNode insertRow(int rowIndex) {
        return structure.insertRow(rowIndex);
    }

    public TreeNode insertRowAbove(TreeNode row) {
        return structure.insertRowAbove(row);
    }

    public TreeNode insertRowBelow(TreeNode row) {
        return structure.insertRowBelow(row);
    }

    public TreeNode insertCell(int rowIndex, int colIndex) {
        return structure.insertCell(rowIndex, colIndex);
    }

    public TreeNode insertCellFromRow(TreeNode row, int colIndex) {
        return structure.insertCellFromRow(row, colIndex);
    }

    public TreeNode insertCellBefore(TreeNode cell) {
        return structure.insertCellBefore(cell);
    }

    public TreeNode insertCellAfter(TreeNode cell) {
        return structure.insertCellAfter(cell);
    }

    public TreeNode insertColumn(int colIndex) {
        return structure.insertColumn(colIndex);
    }

    public void deleteRow(int rowIndex) {
        structure.deleteRow(rowIndex);
    }

    public void deleteRowAbove(TreeNode row) {
        structure.deleteRowAbove(row);
    }

    public void deleteRowBelow(TreeNode row) {
        structure.deleteRowBelow(row);
    }

    public void deleteRowNode(TreeNode row) {
        structure.deleteRowNode(row);
    }

    public void deleteCell(int rowIndex, int colIndex) {
        structure.deleteCell(rowIndex, colIndex);
    }

    public void deleteCellFromRow(TreeNode row, int colIndex) {
        structure.deleteCellFromRow(row, colIndex);
    }

    public void deleteCellBefore(TreeNode cell) {
        structure.deleteCellBefore(cell);
    }

    public void deleteCellAfter(TreeNode cell) {
        structure.deleteCellAfter(cell);
    }

    public void deleteCellNode(TreeNode cell) {
        structure.deleteCellNode(cell);
    }

    public void deleteColumn(int colIndex) {
        structure.deleteColumn(colIndex);
    }

    public Optional<TreeNode> previousRow(TreeNode row) {
        return structure.previousRow(row);
    }

    public Optional<TreeNode> nextRow(TreeNode row) {
        return structure.nextRow(row);
    }

    public Optional<TreeNode> previousCell(TreeNode cell) {
        return structure.previousCell(cell);
    }

    public Optional<TreeNode> nextCell(TreeNode cell) {
        return structure.nextCell(cell);
    }

    Document contentDocument() {
        return contentDocument;
    }

    Document stylesDocument() {
        return stylesDocument;
    }

    TableRegistry registry() {
        return registry;
    }

    StyleCanonicalizer styles() {
        return styles;
    }

    private TreeNode currentTableNode() {
        return registry.currentTable().getNode();
    }

    private static Optional<CellContent> contentOf(TreeNode cell) {
        return cell.firstChild(PARAGRAPH).map(paragraph -> {
            String valueType = cell.attribute(StyleCanonicalizer.VALUE_TYPE_ATTRIBUTE);
            return new CellContent(paragraph.text(), valueType == null ? "string" : valueType);
        });
    }

    private static void requireKind(TreeNode node, ElementKind kind) {
        if (node == null || !node.is(kind.elementName())) {
            throw new ContractViolationException(ContractViolationException.INVALID_NODE,
                    "Expected " + kind.elementName() + " but got " + node);
        }
    }
}
