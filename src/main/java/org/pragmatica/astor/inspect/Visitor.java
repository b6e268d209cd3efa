package org.pragmatica.astor.inspect;

import org.jetbrains.annotations.Nullable;
import org.pragmatica.astor.tree.Node;

/**
 * Callback invoked by an {@link Inspector} for each node of a tree.
 *
 * <p>Each node is presented once before its children. If the visitor returns {@code true}, the
 * children of the node (or of its replacement) are inspected, followed by a closing call with a
 * {@code null} node. If it returns {@code false}, the children are skipped and no closing call is
 * made.
 */
@FunctionalInterface
public interface Visitor {
    /**
     * @param cursor handle valid for this call only, used to read or replace the presented node
     * @param node   the presented node, or {@code null} for a closing call
     * @return {@code true} to inspect the children of the node
     */
    boolean visit(Cursor cursor, @Nullable Node node);
}
