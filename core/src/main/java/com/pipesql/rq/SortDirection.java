package com.pipesql.rq;

public enum SortDirection {
    ASC,
    DESC
}
