package com.example.demo.ods.core;

import com.example.demo.ods.exception.ContractViolationException;
import com.example.demo.ods.exception.InternalInvariantException;
import com.example.demo.ods.model.ElementKind;
import com.example.demo.ods.model.ElementPosition;
import com.example.demo.ods.model.PositionQuery;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Positional access over run-length compressed rows, cells and header columns.
 * <p>
 * A child carrying a repetition count N stands for N consecutive identical logical
 * positions. Callers address positions by 1-based logical index; this class finds,
 * splits or appends children so a single non-repeated element answers each request.
 * A count of 1 is never written: the repetition attribute is removed instead.
 */
@Slf4j
public class RunLengthIndex {

    private static final String COLUMN_DEFAULT_CELL_STYLE = "table:default-cell-style-name";

    private final WidthTracker widthTracker;

    public RunLengthIndex(WidthTracker widthTracker) {
        this.widthTracker = widthTracker == null ? WidthTracker.NONE : widthTracker;
    }

    /**
     * Returns the element at {@code index}, creating or splitting runs as needed.
     * The returned node never carries a repetition attribute.
     */
    public TreeNode locateOrCreate(TreeNode parent, ElementKind kind, int index) {
        validate(parent, kind, index);
        if (kind.isHorizontal()) {
            owningTable(parent, kind).ifPresent(table -> widthTracker.columnTouched(table, index));
        }

        List<TreeNode> siblings = parent.children(kind.elementName());
        int i = 0;
        TreeNode last = null;
        for (TreeNode sibling : siblings) {
            int count = repetitionOf(sibling, kind);
            int before = i;
            i += count;
            last = sibling;
            if (i < index) {
                continue;
            }
            if (before + 1 == index) {
                if (count > 1) {
                    setRepetition(sibling, kind, 1);
                    parent.insertAfter(sibling, copyOfRun(sibling, kind, count - 1));
                    log.debug("Split {} run of {} at its head (index {})", kind, count, index);
                }
                return sibling;
            }
            return splitRun(parent, sibling, kind, before, count, index);
        }

        int gap = index - i - 1;
        TreeNode singleton = createElement(parent, kind, 1);
        if (last == null) {
            TreeNode anchor = placeFirst(parent, kind, singleton);
            if (gap > 0) {
                parent.insertBefore(anchor, createElement(parent, kind, gap));
            }
        } else if (gap > 0) {
            TreeNode filler = parent.insertAfter(last, createElement(parent, kind, gap));
            parent.insertAfter(filler, singleton);
        } else {
            parent.insertAfter(last, singleton);
        }
        log.debug("Appended {} at index {} (gap {})", kind, index, gap);
        return singleton;
    }

    /**
     * Read-only variant of {@link #locateOrCreate}: the element whose run covers
     * {@code index}, or empty when the index lies past the last run.
     */
    public Optional<TreeNode> lookupIfExists(TreeNode parent, ElementKind kind, int index) {
        validate(parent, kind, index);
        int i = 0;
        for (TreeNode sibling : parent.children(kind.elementName())) {
            i += repetitionOf(sibling, kind);
            if (index <= i) {
                return Optional.of(sibling);
            }
        }
        return Optional.empty();
    }

    /**
     * Ordinal (first logical index of the node's run) and/or total logical count
     * of the node's same-kind siblings, the node's own repetition included.
     */
    public ElementPosition ordinalAndCount(TreeNode node, PositionQuery query) {
        if (node == null || query == null) {
            throw new ContractViolationException(ContractViolationException.INVALID_NODE,
                    "ordinalAndCount needs a node and a query");
        }
        ElementKind kind = kindOf(node);
        TreeNode parent = node.parent().orElseThrow(() -> new ContractViolationException(
                ContractViolationException.INVALID_NODE, "Node " + node + " has no parent"));

        Integer ordinal = null;
        int number = 0;
        for (TreeNode sibling : parent.children(kind.elementName())) {
            if (sibling.equals(node)) {
                ordinal = number + 1;
                if (query == PositionQuery.ORDINAL) {
                    return ElementPosition.of(ordinal, null);
                }
            }
            number += repetitionOf(sibling, kind);
        }
        if (ordinal == null) {
            throw new InternalInvariantException("Node " + node + " not found among the children of its parent");
        }
        return query == PositionQuery.COUNT
                ? ElementPosition.of(null, number)
                : ElementPosition.of(ordinal, number);
    }

    public int ordinalOf(TreeNode node) {
        return ordinalAndCount(node, PositionQuery.ORDINAL).ordinal().getAsInt();
    }

    public int countOf(TreeNode node) {
        return ordinalAndCount(node, PositionQuery.COUNT).count().getAsInt();
    }

    /**
     * Total logical count of {@code kind} children under {@code parent}.
     */
    public static int totalOf(TreeNode parent, ElementKind kind) {
        int total = 0;
        for (TreeNode child : parent.children(kind.elementName())) {
            total += repetitionOf(child, kind);
        }
        return total;
    }

    /**
     * New detached element of the given kind; columns get the default cell style.
     */
    public static TreeNode createElement(TreeNode context, ElementKind kind, int repetition) {
        TreeNode element = context.createElement(kind.elementName());
        setRepetition(element, kind, repetition);
        if (kind == ElementKind.COLUMN) {
            element.setAttribute(COLUMN_DEFAULT_CELL_STYLE, "Default");
        }
        return element;
    }

    public static int repetitionOf(TreeNode node, ElementKind kind) {
        String raw = node.attribute(kind.repetitionAttribute());
        if (raw == null) {
            return 1;
        }
        try {
            int n = Integer.parseInt(raw.trim());
            if (n < 1) {
                throw new ContractViolationException(ContractViolationException.INVALID_NODE,
                        "Repetition " + raw + " of " + node + " is below 1");
            }
            return n;
        } catch (NumberFormatException e) {
            throw new ContractViolationException(ContractViolationException.INVALID_NODE,
                    "Repetition '" + raw + "' of " + node + " is not a number");
        }
    }

    /**
     * Writes the repetition count, removing the attribute for a count of 1.
     */
    public static void setRepetition(TreeNode node, ElementKind kind, int repetition) {
        if (repetition < 1) {
            throw new InternalInvariantException("Repetition " + repetition + " for " + kind + " is below 1");
        }
        if (repetition == 1) {
            node.removeAttribute(kind.repetitionAttribute());
        } else {
            node.setAttribute(kind.repetitionAttribute(), Integer.toString(repetition));
        }
    }

    public static ElementKind kindOf(TreeNode node) {
        for (ElementKind kind : ElementKind.values()) {
            if (node.is(kind.elementName())) {
                return kind;
            }
        }
        throw new ContractViolationException(ContractViolationException.INVALID_NODE,
                "Node " + node + " is neither row, cell nor column");
    }

    /**
     * The {@code table:table} that owns a row (cells) or the table itself (columns).
     */
    public static Optional<TreeNode> owningTable(TreeNode parent, ElementKind kind) {
        Optional<TreeNode> current = Optional.of(parent);
        while (current.isPresent()) {
            TreeNode node = current.get();
            if (node.is("table:table")) {
                return current;
            }
            current = node.parent();
        }
        log.debug("No owning table for {} under {}", kind, parent);
        return Optional.empty();
    }

    private TreeNode splitRun(TreeNode parent, TreeNode run, ElementKind kind, int before, int count, int index) {
        int left = index - before - 1;
        int right = before + count - index;
        if (left < 1 || right < 0) {
            throw new InternalInvariantException("Split of " + kind + " run [" + (before + 1) + ", "
                    + (before + count) + "] at " + index + " leaves " + left + "/" + right);
        }
        TreeNode singleton = copyOfRun(run, kind, 1);
        setRepetition(run, kind, left);
        parent.insertAfter(run, singleton);
        if (right > 0) {
            parent.insertAfter(singleton, copyOfRun(run, kind, right));
        }
        log.debug("Split {} run of {} into {} + 1 + {} at index {}", kind, count, left, right, index);
        return singleton;
    }

    /**
     * A structurally identical copy of a run element carrying the given count.
     */
    private static TreeNode copyOfRun(TreeNode run, ElementKind kind, int repetition) {
        TreeNode copy = run.deepCopy();
        setRepetition(copy, kind, repetition);
        return copy;
    }

    /**
     * Inserts the first element of a kind: columns ahead of any rows, rows and cells at the end.
     */
    private static TreeNode placeFirst(TreeNode parent, ElementKind kind, TreeNode element) {
        if (kind == ElementKind.COLUMN) {
            for (TreeNode child : parent.children()) {
                if (child.is("table:table-row") || child.is("table:table-rows")
                        || child.is("table:table-header-rows") || child.is("table:table-row-group")) {
                    return parent.insertBefore(child, element);
                }
            }
        }
        return parent.appendChild(element);
    }

    private static void validate(TreeNode parent, ElementKind kind, int index) {
        if (parent == null) {
            throw new ContractViolationException(ContractViolationException.INVALID_NODE, "Parent element is absent");
        }
        if (kind == null) {
            throw new ContractViolationException(ContractViolationException.INVALID_NODE, "Element kind is absent");
        }
        if (index < 1) {
            throw new ContractViolationException(ContractViolationException.INVALID_INDEX,
                    "Invalid index " + index + " for " + kind);
        }
    }
}
