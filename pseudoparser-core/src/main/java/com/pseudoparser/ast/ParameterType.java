package com.pseudoparser.ast;

/**
 * Surface shape of a subroutine parameter.
 */
public enum ParameterType {
    /** {@code x} */
    SIMPLE,
    /** {@code A[n][m]} */
    ARRAY,
    /** {@code Point p} */
    OBJECT,
    /** {@code graph g} */
    GRAPH
}
