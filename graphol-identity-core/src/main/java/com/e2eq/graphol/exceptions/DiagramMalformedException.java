package com.e2eq.graphol.exceptions;

/**
 * Thrown when a diagram is structurally inconsistent.
 * <p>
 * Raised eagerly by {@code Diagram} when a node or edge cannot be attached (duplicate id, endpoint
 * belonging to another diagram) and by the validator and fixture loader for broken content.
 * Identity ambiguity is never reported through this exception.
 * </p>
 */
public class DiagramMalformedException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String itemId;

    public DiagramMalformedException(String message) {
        super(message);
        this.itemId = null;
    }

    public DiagramMalformedException(String itemId, String message) {
        super(message);
        this.itemId = itemId;
    }

    public DiagramMalformedException(String itemId, String message, Throwable cause) {
        super(message, cause);
        this.itemId = itemId;
    }

    /**
     * Id of the offending node or edge, if known.
     */
    public String getItemId() {
        return itemId;
    }
}
