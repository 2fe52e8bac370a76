package com.connectfour.core;

/**
 * Thrown when {@link Board#undo()} is called before any move has been made.
 */
public final class EmptyHistoryException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public EmptyHistoryException() {
        super("No move to undo");
    }
}
