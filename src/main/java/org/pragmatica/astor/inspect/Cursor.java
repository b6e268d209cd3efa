package org.pragmatica.astor.inspect;

import org.jetbrains.annotations.Nullable;
import org.pragmatica.astor.tree.Node;

/**
 * Traversal context of a single visitor call.
 */
public interface Cursor {
    /**
     * The node that will occupy the current slot when the visitor call returns: the presented
     * node, or the latest replacement. {@code null} during a closing call.
     */
    @Nullable Node current();

    /**
     * Install {@code replacement} in place of the presented node once the visitor call returns.
     * Ignored during a closing call.
     *
     * @throws NullPointerException if {@code replacement} is null
     * @throws org.pragmatica.astor.error.InspectionException if the visitor call this cursor
     *         belongs to has already returned
     */
    void replace(Node replacement);
}
