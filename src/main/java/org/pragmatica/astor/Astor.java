package org.pragmatica.astor;

import org.pragmatica.astor.inspect.Inspector;
import org.pragmatica.astor.inspect.InspectorConfig;
import org.pragmatica.astor.inspect.InspectorEngine;
import org.pragmatica.astor.inspect.Visitor;
import org.pragmatica.astor.tree.Node;

/**
 * Entry point for inspecting and rewriting Go syntax trees.
 *
 * <p>Example usage:
 * <pre>{@code
 * var inspector = Astor.inspector((cursor, node) -> {
 *     if (node instanceof Decl.FuncDecl decl) {
 *         decl.setName(Expr.Ident.of("Foo" + decl.name().name()));
 *     }
 *     return true;
 * });
 *
 * var result = inspector.inspect(file);
 * }</pre>
 */
public final class Astor {
    private Astor() {}

    /**
     * Create an inspector bound to the visitor.
     */
    public static Inspector inspector(Visitor visitor) {
        return inspector(visitor, InspectorConfig.DEFAULT);
    }

    /**
     * Create an inspector bound to the visitor with custom configuration.
     */
    public static Inspector inspector(Visitor visitor, InspectorConfig config) {
        return InspectorEngine.create(visitor, config);
    }

    /**
     * Walk the tree once with the visitor and return the resulting root.
     */
    public static Node inspect(Node root, Visitor visitor) {
        return inspector(visitor).inspect(root);
    }

    /**
     * Create a builder for inspector configuration.
     */
    public static Builder builder(Visitor visitor) {
        return new Builder(visitor);
    }

    public static final class Builder {
        private final Visitor visitor;
        private boolean serializeVisits = InspectorConfig.DEFAULT.serializeVisits();
        private boolean traceVisits = InspectorConfig.DEFAULT.traceVisits();

        private Builder(Visitor visitor) {
            this.visitor = visitor;
        }

        public Builder serializeVisits(boolean enabled) {
            this.serializeVisits = enabled;
            return this;
        }

        public Builder traceVisits(boolean enabled) {
            this.traceVisits = enabled;
            return this;
        }

        public Inspector build() {
            var config = new InspectorConfig(serializeVisits, traceVisits);
            return inspector(visitor, config);
        }
    }
}
