package org.pragmatica.astor.inspect;

import org.jetbrains.annotations.Nullable;
import org.pragmatica.astor.error.InspectError;
import org.pragmatica.astor.error.InspectionException;
import org.pragmatica.astor.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Cursor handed to exactly one visitor call. Closed by the engine as soon as the call returns.
 */
final class VisitCursor implements Cursor {
    private static final Logger LOG = LoggerFactory.getLogger(VisitCursor.class);

    private final @Nullable Node presented;
    private @Nullable Node replacement;
    private boolean closed;

    VisitCursor(@Nullable Node presented) {
        this.presented = presented;
    }

    @Override
    public @Nullable Node current() {
        return replacement != null ? replacement : presented;
    }

    @Override
    public void replace(Node replacement) {
        checkNotNull(replacement, "replacement");

        if (closed) {
            throw new InspectionException(new InspectError.StaleCursor(presented == null ? null : presented.kind()));
        }
        if (presented == null) {
            LOG.debug("Ignoring replacement with {} requested during a closing call", replacement.kind());
            return;
        }
        this.replacement = replacement;
    }

    void close() {
        closed = true;
    }

    boolean replaced() {
        return replacement != null;
    }
}
