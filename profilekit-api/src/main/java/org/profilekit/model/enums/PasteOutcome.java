package org.profilekit.model.enums;

public enum PasteOutcome {
    FULL,
    CLIPPED,
    /**
     * Portrait fell entirely outside the canvas; the result is the resized banner alone.
     */
    NONE
}
