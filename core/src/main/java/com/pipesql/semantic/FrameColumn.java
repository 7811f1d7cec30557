package com.pipesql.semantic;

import com.pipesql.rq.ColumnId;

import java.util.Objects;

/**
 * One column of a {@link Frame}.
 *
 * @param id the RQ column this entry stands for
 * @param name display name, or null for unnamed expressions and wildcards
 * @param relation namespace the column can be qualified with, or null
 * @param key whether the column is a group or join key
 * @param wildcard whether this entry stands for all columns of a relation
 *                 whose column list is unknown
 */
public record FrameColumn(ColumnId id, String name, String relation, boolean key, boolean wildcard) {

    public FrameColumn {
        Objects.requireNonNull(id, "id must not be null");
    }

    public static FrameColumn named(ColumnId id, String name, String relation) {
        return new FrameColumn(id, name, relation, false, false);
    }

    public static FrameColumn wildcard(ColumnId id, String relation) {
        return new FrameColumn(id, null, relation, false, true);
    }

    public FrameColumn withRelation(String newRelation) {
        return new FrameColumn(id, name, newRelation, key, wildcard);
    }

    public FrameColumn asKey() {
        return new FrameColumn(id, name, relation, true, wildcard);
    }

    public FrameColumn withId(ColumnId newId) {
        return new FrameColumn(newId, name, relation, key, wildcard);
    }

    @Override
    public String toString() {
        String base = wildcard ? "*" : (name == null ? "?" + id : name);
        return relation == null ? base : relation + "." + base;
    }
}
