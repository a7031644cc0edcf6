package com.example.demo.ods.service;

import com.example.demo.ods.core.RunLengthIndex;
import com.example.demo.ods.core.TreeNode;
import com.example.demo.ods.exception.ContractViolationException;
import com.example.demo.ods.model.ElementKind;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Inserts and deletes rows, cells and columns of the current table.
 * <p>
 * Deleting one logical position decrements a run when it is repeated and detaches
 * the element otherwise. Inserting next to a repeated element splits it so the new
 * singleton lands exactly beside the addressed position.
 */
@Slf4j
public class StructureEditor {

    private final RunLengthIndex index;
    private final TableRegistry registry;

    public StructureEditor(RunLengthIndex index, TableRegistry registry) {
        this.index = index;
        this.registry = registry;
    }

    public TreeNode insertRow(int rowIndex) {
        return insertRowAbove(index.locateOrCreate(currentTable(), ElementKind.ROW, rowIndex));
    }

    public TreeNode insertRowAbove(TreeNode row) {
        requireKind(row, ElementKind.ROW);
        TreeNode parent = parentOf(row);
        return parent.insertBefore(row, RunLengthIndex.createElement(row, ElementKind.ROW, 1));
    }

    public TreeNode insertRowBelow(TreeNode row) {
        requireKind(row, ElementKind.ROW);
        return insertAfterSplitting(row, ElementKind.ROW);
    }

    public TreeNode insertCell(int rowIndex, int colIndex) {
        return insertCellFromRow(index.locateOrCreate(currentTable(), ElementKind.ROW, rowIndex), colIndex);
    }

    public TreeNode insertCellFromRow(TreeNode row, int colIndex) {
        requireKind(row, ElementKind.ROW);
        return insertCellBefore(index.locateOrCreate(row, ElementKind.CELL, colIndex));
    }

    public TreeNode insertCellBefore(TreeNode cell) {
        requireKind(cell, ElementKind.CELL);
        TreeNode row = parentOf(cell);
        TreeNode inserted = row.insertBefore(cell, RunLengthIndex.createElement(cell, ElementKind.CELL, 1));
        recordRowLength(row);
        return inserted;
    }

    public TreeNode insertCellAfter(TreeNode cell) {
        requireKind(cell, ElementKind.CELL);
        TreeNode inserted = insertAfterSplitting(cell, ElementKind.CELL);
        recordRowLength(parentOf(cell));
        return inserted;
    }

    /**
     * New header column before {@code colIndex} and a new cell before that index in every row.
     */
    public TreeNode insertColumn(int colIndex) {
        TreeNode table = currentTable();
        TreeNode column = index.locateOrCreate(table, ElementKind.COLUMN, colIndex);
        TreeNode inserted = table.insertBefore(column, RunLengthIndex.createElement(column, ElementKind.COLUMN, 1));
        registry.columnTouched(table, RunLengthIndex.totalOf(table, ElementKind.COLUMN));
        for (TreeNode row : table.children(ElementKind.ROW.elementName())) {
            insertCellBefore(index.locateOrCreate(row, ElementKind.CELL, colIndex));
        }
        log.debug("Inserted column at {} in '{}'", colIndex, registry.currentTableName());
        return inserted;
    }

    public void deleteRow(int rowIndex) {
        deleteRowNode(index.locateOrCreate(currentTable(), ElementKind.ROW, rowIndex));
    }

    public void deleteRowAbove(TreeNode row) {
        requireKind(row, ElementKind.ROW);
        TreeNode previous = previous(row, ElementKind.ROW).orElseThrow(() -> new ContractViolationException(
                ContractViolationException.NO_SIBLING, "Row is already the first row in its table"));
        deleteOne(previous, ElementKind.ROW);
    }

    public void deleteRowBelow(TreeNode row) {
        requireKind(row, ElementKind.ROW);
        if (RunLengthIndex.repetitionOf(row, ElementKind.ROW) > 1) {
            deleteOne(row, ElementKind.ROW);
            return;
        }
        TreeNode next = next(row, ElementKind.ROW).orElseThrow(() -> new ContractViolationException(
                ContractViolationException.NO_SIBLING, "Row is already the last row in its table"));
        deleteOne(next, ElementKind.ROW);
    }

    public void deleteRowNode(TreeNode row) {
        requireKind(row, ElementKind.ROW);
        deleteOne(row, ElementKind.ROW);
    }

    public void deleteCell(int rowIndex, int colIndex) {
        deleteCellFromRow(index.locateOrCreate(currentTable(), ElementKind.ROW, rowIndex), colIndex);
    }

    public void deleteCellFromRow(TreeNode row, int colIndex) {
        requireKind(row, ElementKind.ROW);
        deleteCellNode(index.locateOrCreate(row, ElementKind.CELL, colIndex));
    }

    public void deleteCellBefore(TreeNode cell) {
        requireKind(cell, ElementKind.CELL);
        TreeNode previous = previous(cell, ElementKind.CELL).orElseThrow(() -> new ContractViolationException(
                ContractViolationException.NO_SIBLING, "Cell is already the first cell in its row"));
        deleteOne(previous, ElementKind.CELL);
    }

    public void deleteCellAfter(TreeNode cell) {
        requireKind(cell, ElementKind.CELL);
        if (RunLengthIndex.repetitionOf(cell, ElementKind.CELL) > 1) {
            deleteOne(cell, ElementKind.CELL);
            return;
        }
        TreeNode next = next(cell, ElementKind.CELL).orElseThrow(() -> new ContractViolationException(
                ContractViolationException.NO_SIBLING, "Cell is already the last cell in its row"));
        deleteOne(next, ElementKind.CELL);
    }

    public void deleteCellNode(TreeNode cell) {
        requireKind(cell, ElementKind.CELL);
        deleteOne(cell, ElementKind.CELL);
    }

    /**
     * Removes header column {@code colIndex} and the cell at that index in every row.
     * The recorded width is left as is.
     */
    public void deleteColumn(int colIndex) {
        if (colIndex < 1) {
            throw new ContractViolationException(ContractViolationException.INVALID_INDEX,
                    "Invalid column index " + colIndex);
        }
        int width = registry.currentTable().getWidth();
        if (colIndex > width) {
            throw new ContractViolationException(ContractViolationException.INVALID_INDEX,
                    "Column " + colIndex + " is outside the current table width " + width);
        }
        TreeNode table = currentTable();
        deleteOne(index.locateOrCreate(table, ElementKind.COLUMN, colIndex), ElementKind.COLUMN);
        for (TreeNode row : table.children(ElementKind.ROW.elementName())) {
            deleteCellFromRow(row, colIndex);
        }
        log.debug("Deleted column {} in '{}'", colIndex, registry.currentTableName());
    }

    public Optional<TreeNode> previousRow(TreeNode row) {
        requireKind(row, ElementKind.ROW);
        return previous(row, ElementKind.ROW);
    }

    public Optional<TreeNode> nextRow(TreeNode row) {
        requireKind(row, ElementKind.ROW);
        return next(row, ElementKind.ROW);
    }

    public Optional<TreeNode> previousCell(TreeNode cell) {
        requireKind(cell, ElementKind.CELL);
        return previous(cell, ElementKind.CELL);
    }

    public Optional<TreeNode> nextCell(TreeNode cell) {
        requireKind(cell, ElementKind.CELL);
        return next(cell, ElementKind.CELL);
    }

    /**
     * Singleton after {@code node}; a repetition on {@code node} moves to a run behind it.
     */
    private TreeNode insertAfterSplitting(TreeNode node, ElementKind kind) {
        TreeNode parent = parentOf(node);
        TreeNode inserted = parent.insertAfter(node, RunLengthIndex.createElement(node, kind, 1));
        int repetition = RunLengthIndex.repetitionOf(node, kind);
        if (repetition > 1) {
            RunLengthIndex.setRepetition(node, kind, 1);
            TreeNode rest = node.deepCopy();
            RunLengthIndex.setRepetition(rest, kind, repetition - 1);
            parent.insertAfter(inserted, rest);
        }
        return inserted;
    }

    private static void deleteOne(TreeNode node, ElementKind kind) {
        int repetition = RunLengthIndex.repetitionOf(node, kind);
        if (repetition > 1) {
            RunLengthIndex.setRepetition(node, kind, repetition - 1);
        } else {
            node.detach();
        }
    }

    private void recordRowLength(TreeNode row) {
        RunLengthIndex.owningTable(row, ElementKind.CELL)
                .ifPresent(table -> registry.columnTouched(table, RunLengthIndex.totalOf(row, ElementKind.CELL)));
    }

    private TreeNode currentTable() {
        return registry.currentTable().getNode();
    }

    private static Optional<TreeNode> previous(TreeNode node, ElementKind kind) {
        return node.previousSibling().filter(sibling -> sibling.is(kind.elementName()));
    }

    private static Optional<TreeNode> next(TreeNode node, ElementKind kind) {
        return node.nextSibling().filter(sibling -> sibling.is(kind.elementName()));
    }

    private static TreeNode parentOf(TreeNode node) {
        return node.parent().orElseThrow(() -> new ContractViolationException(
                ContractViolationException.INVALID_NODE, "Node " + node + " is detached"));
    }

    private static void requireKind(TreeNode node, ElementKind kind) {
        if (node == null || !node.is(kind.elementName())) {
            throw new ContractViolationException(ContractViolationException.INVALID_NODE,
                    "Expected " + kind.elementName() + " but got " + node);
        }
    }
}
