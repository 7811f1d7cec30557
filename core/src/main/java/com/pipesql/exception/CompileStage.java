package com.pipesql.exception;

/**
 * Compiler stage that raised an error.
 */
public enum CompileStage {
    PARSE,
    RESOLVE,
    GENERATE
}
