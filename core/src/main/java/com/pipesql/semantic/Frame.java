package com.pipesql.semantic;

import com.pipesql.rq.ColumnId;
import com.pipesql.rq.RqBuilder;
import com.pipesql.rq.RqExpr;
import com.pipesql.rq.SortKey;
import com.pipesql.rq.WindowFrame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The columns visible at a point of a pipeline, plus the ordering and
 * grouping context transforms inherit.
 *
 * <p>Frames are immutable; every transform produces a new one. Besides the
 * ordered columns a frame records:
 * <ul>
 *   <li>the active sort keys (set by {@code sort}, used by {@code take} and
 *       by window functions)</li>
 *   <li>the partition of an enclosing {@code group}</li>
 *   <li>the bounds of an enclosing {@code window}</li>
 *   <li>inside a join condition, which columns belong to the left
 *       ({@code this}) and right ({@code that}) inputs</li>
 * </ul>
 */
public final class Frame {

    public static final Frame EMPTY = new Frame(List.of(), List.of(), null, null, null, null);

    private final List<FrameColumn> columns;
    private final List<SortKey> sort;
    private final GroupContext group;
    private final WindowFrame window;
    private final Set<ColumnId> thisSide;
    private final Set<ColumnId> thatSide;

    /**
     * Partition established by {@code group}.
     *
     * @param keys the key columns, in order
     */
    public record GroupContext(List<FrameColumn> keys) {
        public GroupContext {
            keys = List.copyOf(keys);
        }

        public List<RqExpr> partition() {
            return keys.stream().map(k -> (RqExpr) new RqExpr.ColumnRef(k.id())).toList();
        }
    }

    private Frame(List<FrameColumn> columns, List<SortKey> sort, GroupContext group,
                  WindowFrame window, Set<ColumnId> thisSide, Set<ColumnId> thatSide) {
        this.columns = List.copyOf(columns);
        this.sort = List.copyOf(sort);
        this.group = group;
        this.window = window;
        this.thisSide = thisSide;
        this.thatSide = thatSide;
    }

    public static Frame of(List<FrameColumn> columns) {
        return new Frame(columns, List.of(), null, null, null, null);
    }

    public List<FrameColumn> columns() {
        return Collections.unmodifiableList(columns);
    }

    public List<ColumnId> columnIds() {
        return columns.stream().map(FrameColumn::id).toList();
    }

    public List<SortKey> sort() {
        return sort;
    }

    public GroupContext group() {
        return group;
    }

    public WindowFrame window() {
        return window;
    }

    public boolean inGroup() {
        return group != null;
    }

    // ==================== Transitions ====================

    /**
     * Returns a frame with new columns. Sort keys that refer to columns no
     * longer visible are dropped.
     */
    public Frame withColumns(List<FrameColumn> newColumns) {
        Set<ColumnId> visible = newColumns.stream().map(FrameColumn::id).collect(Collectors.toSet());
        boolean hasWildcard = newColumns.stream().anyMatch(FrameColumn::wildcard);
        List<SortKey> keptSort = sort.stream()
            .filter(key -> hasWildcard || refersOnlyTo(key.expr(), visible))
            .toList();
        return new Frame(newColumns, keptSort, group, window, null, null);
    }

    public Frame withSort(List<SortKey> newSort) {
        return new Frame(columns, newSort, group, window, thisSide, thatSide);
    }

    public Frame withGroup(GroupContext newGroup) {
        return new Frame(columns, sort, newGroup, window, thisSide, thatSide);
    }

    public Frame withWindow(WindowFrame newWindow) {
        return new Frame(columns, sort, group, newWindow, thisSide, thatSide);
    }

    /**
     * Drops grouping and window context, as when leaving {@code group} or
     * {@code window}.
     */
    public Frame withoutContext() {
        return new Frame(columns, sort, null, null, null, null);
    }

    /**
     * Returns the frame seen by a join condition: the combined columns, with
     * {@code this} and {@code that} bound to the two inputs.
     */
    public static Frame forJoin(Frame left, Frame right) {
        List<FrameColumn> combined = new ArrayList<>(left.columns);
        combined.addAll(right.columns);
        return new Frame(combined, left.sort, null, null,
            new HashSet<>(left.columnIds()), new HashSet<>(right.columnIds()));
    }

    // ==================== Lookup ====================

    /**
     * Finds explicit (non-wildcard) columns matching a possibly qualified
     * name, in frame order.
     */
    public List<FrameColumn> find(String qualifier, String name) {
        List<FrameColumn> result = new ArrayList<>();
        for (FrameColumn column : candidates(qualifier)) {
            if (!column.wildcard() && name.equals(column.name())
                    && (qualifier == null || isSideQualifier(qualifier) || qualifier.equals(column.relation()))) {
                result.add(column);
            }
        }
        return result;
    }

    /**
     * Finds wildcard columns that a qualified or bare name could be inferred
     * through.
     */
    public List<FrameColumn> wildcards(String qualifier) {
        List<FrameColumn> result = new ArrayList<>();
        for (FrameColumn column : candidates(qualifier)) {
            if (column.wildcard()
                    && (qualifier == null || isSideQualifier(qualifier) || qualifier.equals(column.relation()))) {
                result.add(column);
            }
        }
        return result;
    }

    /**
     * Returns whether some column is namespaced by the given relation name.
     */
    public boolean hasRelation(String relation) {
        if (isSideQualifier(relation)) {
            return true;
        }
        return columns.stream().anyMatch(c -> relation.equals(c.relation()));
    }

    public boolean hasWildcard() {
        return columns.stream().anyMatch(FrameColumn::wildcard);
    }

    private List<FrameColumn> candidates(String qualifier) {
        if ("this".equals(qualifier) && thisSide != null) {
            return columns.stream().filter(c -> thisSide.contains(c.id())).toList();
        }
        if ("that".equals(qualifier)) {
            if (thatSide == null) {
                return List.of();
            }
            return columns.stream().filter(c -> thatSide.contains(c.id())).toList();
        }
        return columns;
    }

    private static boolean isSideQualifier(String qualifier) {
        return "this".equals(qualifier) || "that".equals(qualifier);
    }

    private static boolean refersOnlyTo(RqExpr expr, Set<ColumnId> visible) {
        List<ColumnId> referenced = new ArrayList<>();
        RqBuilder.collect(expr, referenced);
        return visible.containsAll(referenced);
    }

    @Override
    public String toString() {
        return columns.stream().map(FrameColumn::toString).collect(Collectors.joining(", ", "Frame[", "]"));
    }
}
