package com.flow.canvas.service.layout;

/**
 * How row indices are renumbered after row assignment.
 */
public enum RowCompaction {

    /**
     * Rows are renumbered contiguously from 0 within each level.
     */
    PER_LEVEL,

    /**
     * Rows are renumbered over the union of all levels, keeping sequential
     * chains horizontally aligned across columns.
     */
    GLOBAL
}
