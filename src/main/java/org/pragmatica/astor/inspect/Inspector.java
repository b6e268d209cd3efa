package org.pragmatica.astor.inspect;

import org.jetbrains.annotations.Nullable;
import org.pragmatica.astor.tree.Node;

/**
 * Walks a syntax tree depth-first, presenting each node to a {@link Visitor} and installing the
 * replacements it requests.
 *
 * <p>An inspector may be reused for any number of walks, one at a time.
 */
public interface Inspector {

    /**
     * Walk the tree rooted at {@code root} and return the root of the resulting tree, which is
     * the replacement of {@code root} if the visitor replaced it.
     */
    Node inspect(Node root);

    /**
     * Walk the tree rooted at {@code root} and return the resulting root, which must conform to
     * {@code expected}.
     *
     * @throws org.pragmatica.astor.error.InspectionException if the visitor replaced the root
     *         with a node of another type
     */
    <T extends Node> T inspect(T root, Class<T> expected);

    /**
     * Present a single node to the visitor without descending into its children.
     * A {@code null} node performs a closing call.
     */
    Visited visit(@Nullable Node node);

    /**
     * Outcome of a single visitor call.
     *
     * @param node    the presented node or its replacement; {@code null} for a closing call
     * @param recurse whether the visitor asked to inspect the children of {@code node}
     */
    record Visited(@Nullable Node node, boolean recurse) {}
}
