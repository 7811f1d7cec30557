package com.pipesql.rq;

/**
 * Index of a relation in the {@link RqQuery} arena.
 */
public record RelId(int index) {

    @Override
    public String toString() {
        return "r" + index;
    }
}
