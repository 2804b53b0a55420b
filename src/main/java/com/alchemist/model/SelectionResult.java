package com.alchemist.model;

/**
 * Outcome of pushing one element onto a caster's selection.
 */
public enum SelectionResult {
    /** Duplicate input inside the debounce window. */
    IGNORED,
    /** One element held, waiting for the second. */
    PENDING,
    /** Two elements resolved to an effect that is ready to cast. */
    READY,
    /** Two elements with no matching effect; the selection was cleared. */
    INVALID_COMBO
}
