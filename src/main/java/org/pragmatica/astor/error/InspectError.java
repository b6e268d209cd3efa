package org.pragmatica.astor.error;

import org.jetbrains.annotations.Nullable;
import org.pragmatica.astor.tree.Node;
import org.pragmatica.astor.tree.NodeKind;

/**
 * Inspection error with the context needed to locate the offending replacement.
 */
public sealed interface InspectError {
    String message();

    /**
     * A replacement does not fit the child slot it is installed into.
     */
    record SlotMismatch(
    String slot,
    Class<? extends Node> expected,
    NodeKind actual) implements InspectError {
        @Override
        public String message() {
            return "Cannot install " + actual + " into slot " + slot + ", expected " + expected.getSimpleName();
        }
    }

    /**
     * A cursor was asked to replace its node after the visitor call it belongs to returned.
     */
    record StaleCursor(@Nullable NodeKind kind) implements InspectError {
        @Override
        public String message() {
            return kind == null
                   ? "Replacement requested through a cursor of a finished closing call"
                   : "Replacement requested through a cursor of a finished visit of " + kind;
        }
    }
}
