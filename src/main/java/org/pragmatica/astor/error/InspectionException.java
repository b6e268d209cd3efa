package org.pragmatica.astor.error;

/**
 * Thrown when a traversal cannot continue without corrupting the tree.
 */
public final class InspectionException extends RuntimeException {
    private final InspectError error;

    public InspectionException(InspectError error) {
        super(error.message());
        this.error = error;
    }

    public InspectError error() {
        return error;
    }
}
