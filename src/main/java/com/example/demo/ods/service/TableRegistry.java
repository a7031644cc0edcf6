package com.example.demo.ods.service;

import com.example.demo.ods.core.RunLengthIndex;
import com.example.demo.ods.core.TreeNode;
import com.example.demo.ods.core.WidthTracker;
import com.example.demo.ods.exception.ContractViolationException;
import com.example.demo.ods.model.ElementKind;
import com.example.demo.ods.model.InsertPosition;
import com.example.demo.ods.model.Table;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tables of one spreadsheet by name, the current table and each table's recorded width.
 * <p>
 * Width grows whenever a cell or column past it is materialized; the header is only
 * brought up to that width by {@link #padAll()}, which runs before the document is written.
 */
@Slf4j
public class TableRegistry implements WidthTracker {

    private static final String TABLE = "table:table";
    private static final String TABLE_NAME = "table:name";

    private final TreeNode spreadsheet;
    private final Map<String, Table> tables = new LinkedHashMap<>();
    private String currentTableName;

    /**
     * Registers the tables below {@code office:spreadsheet}; synthesizes
     * {@code defaultTableName} when there are none.
     */
    public TableRegistry(TreeNode spreadsheet, String defaultTableName) {
        this.spreadsheet = spreadsheet;
        for (TreeNode node : spreadsheet.children(TABLE)) {
            String name = node.attribute(TABLE_NAME);
            if (name == null || name.isEmpty()) {
                throw new ContractViolationException(ContractViolationException.INVALID_NODE,
                        "Table without table:name: " + node);
            }
            if (tables.containsKey(name)) {
                throw new ContractViolationException(ContractViolationException.TABLE_EXISTS,
                        "Table '" + name + "' occurs twice");
            }
            tables.put(name, new Table(name, node, headerWidth(node), false));
        }
        if (tables.isEmpty()) {
            log.info("Document has no table, creating '{}'", defaultTableName);
            append(defaultTableName);
        }
        currentTableName = tables.keySet().iterator().next();
        log.info("Registered {} tables, current table '{}'", tables.size(), currentTableName);
    }

    @Override
    public void columnTouched(TreeNode tableNode, int index) {
        for (Table table : tables.values()) {
            if (table.getNode().equals(tableNode)) {
                if (index > table.getWidth()) {
                    table.setWidth(index);
                    table.setWidthExceeded(true);
                    log.debug("Width of '{}' grows to {}", table.getName(), index);
                }
                return;
            }
        }
        log.debug("Column access in unregistered table {}", tableNode);
    }

    public void select(String name) {
        require(name);
        currentTableName = name;
        log.info("Current table is now '{}'", name);
    }

    public void rename(String oldName, String newName) {
        Table table = require(oldName);
        if (newName == null || newName.isEmpty()) {
            throw new ContractViolationException(ContractViolationException.INVALID_ARGUMENT, "New table name is empty");
        }
        if (tables.containsKey(newName)) {
            throw new ContractViolationException(ContractViolationException.TABLE_EXISTS,
                    "Table '" + newName + "' already exists");
        }
        table.getNode().setAttribute(TABLE_NAME, newName);
        table.setName(newName);

        Map<String, Table> rekeyed = new LinkedHashMap<>();
        tables.forEach((name, entry) -> rekeyed.put(name.equals(oldName) ? newName : name, entry));
        tables.clear();
        tables.putAll(rekeyed);
        if (oldName.equals(currentTableName)) {
            currentTableName = newName;
        }
        log.info("Renamed table '{}' to '{}'", oldName, newName);
    }

    /**
     * Creates an empty table next to {@code relativeName}.
     */
    public Table insert(String name, InsertPosition position, String relativeName) {
        Table relative = require(relativeName);
        requireFree(name);
        TreeNode node = newTable(name);
        if (position == InsertPosition.BEFORE) {
            spreadsheet.insertBefore(relative.getNode(), node);
        } else {
            spreadsheet.insertAfter(relative.getNode(), node);
        }
        Table table = register(name, node);
        log.info("Inserted table '{}' {} '{}'", name, position, relativeName);
        return table;
    }

    /**
     * Creates an empty table after the last one.
     */
    public Table append(String name) {
        requireFree(name);
        List<TreeNode> existing = spreadsheet.children(TABLE);
        TreeNode node = newTable(name);
        if (existing.isEmpty()) {
            spreadsheet.appendChild(node);
        } else {
            spreadsheet.insertAfter(existing.get(existing.size() - 1), node);
        }
        Table table = register(name, node);
        log.info("Appended table '{}'", name);
        return table;
    }

    public void delete(String name) {
        if (name != null && name.equals(currentTableName)) {
            throw new ContractViolationException(ContractViolationException.CURRENT_TABLE,
                    "Table '" + name + "' cannot be deleted as it is the current table");
        }
        Table table = require(name);
        table.getNode().detach();
        tables.remove(name);
        log.info("Deleted table '{}'", name);
    }

    /**
     * Extends every table header whose recorded width outgrew it. Idempotent.
     */
    public void padAll() {
        for (Table table : tables.values()) {
            if (!table.isWidthExceeded()) {
                continue;
            }
            TreeNode node = table.getNode();
            int actual = headerWidth(node);
            int difference = table.getWidth() - actual;
            if (difference > 0) {
                List<TreeNode> columns = node.children(ElementKind.COLUMN.elementName());
                if (columns.isEmpty()) {
                    new RunLengthIndex(WidthTracker.NONE).locateOrCreate(node, ElementKind.COLUMN, table.getWidth());
                } else {
                    TreeNode last = columns.get(columns.size() - 1);
                    RunLengthIndex.setRepetition(last, ElementKind.COLUMN,
                            RunLengthIndex.repetitionOf(last, ElementKind.COLUMN) + difference);
                }
                log.info("Padded columns of '{}': {} -> {}", table.getName(), actual, table.getWidth());
            }
            table.setWidthExceeded(false);
        }
    }

    public Table table(String name) {
        return require(name);
    }

    public Table currentTable() {
        return tables.get(currentTableName);
    }

    public String currentTableName() {
        return currentTableName;
    }

    public int widthOf(String name) {
        return require(name).getWidth();
    }

    public int tableCount() {
        return tables.size();
    }

    /** Names in document order. */
    public List<String> tableNames() {
        List<String> names = new ArrayList<>();
        for (TreeNode node : spreadsheet.children(TABLE)) {
            String name = node.attribute(TABLE_NAME);
            if (tables.containsKey(name)) {
                names.add(name);
            }
        }
        return names;
    }

    static int headerWidth(TreeNode table) {
        return RunLengthIndex.totalOf(table, ElementKind.COLUMN);
    }

    private Table register(String name, TreeNode node) {
        Table table = new Table(name, node, headerWidth(node), false);
        tables.put(name, table);
        return table;
    }

    private TreeNode newTable(String name) {
        TreeNode table = spreadsheet.createElement(TABLE);
        table.setAttribute(TABLE_NAME, name);
        table.setAttribute("table:print", "false");
        table.setAttribute("table:style-name", "myTable");

        TreeNode column = RunLengthIndex.createElement(table, ElementKind.COLUMN, 1);
        column.setAttribute("table:style-name", "myColumn");
        table.appendChild(column);

        TreeNode row = table.createElement(ElementKind.ROW.elementName());
        row.setAttribute("table:style-name", "myRow");
        row.appendChild(row.createElement(ElementKind.CELL.elementName()));
        table.appendChild(row);
        return table;
    }

    private Table require(String name) {
        Table table = name == null ? null : tables.get(name);
        if (table == null) {
            throw new ContractViolationException(ContractViolationException.UNKNOWN_TABLE,
                    "Table '" + name + "' does not exist");
        }
        return table;
    }

    private void requireFree(String name) {
        if (name == null || name.isEmpty()) {
            throw new ContractViolationException(ContractViolationException.INVALID_ARGUMENT, "Table name is empty");
        }
        if (tables.containsKey(name)) {
            throw new ContractViolationException(ContractViolationException.TABLE_EXISTS,
                    "Table '" + name + "' already exists");
        }
    }
}
