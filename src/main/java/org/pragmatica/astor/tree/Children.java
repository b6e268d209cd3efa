package org.pragmatica.astor.tree;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Slot value checks shared by node constructors and setters.
 */
final class Children {
    private Children() {}

    static <T extends Node> T requiredChild(T child, String slot) {
        return checkNotNull(child, "Required child slot '%s' cannot be null", slot);
    }

    /**
     * Mutable copy of a child list; neither the list nor its elements may be null.
     */
    static <T extends Node> List<T> childList(List<? extends T> children, String slot) {
        checkNotNull(children, "Child list '%s' cannot be null", slot);
        var copy = new ArrayList<T>(children.size());
        for (var child : children) {
            copy.add(checkNotNull(child, "Child list '%s' cannot hold null", slot));
        }
        return copy;
    }
}
