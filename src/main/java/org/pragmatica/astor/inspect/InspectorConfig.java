package org.pragmatica.astor.inspect;

/**
 * Inspector configuration options.
 *
 * @param serializeVisits guard every visitor call with a lock, for drivers sharing one inspector
 *                        between threads
 * @param traceVisits     log every visitor call at trace level
 */
public record InspectorConfig(
    boolean serializeVisits,
    boolean traceVisits
) {
    public static final InspectorConfig DEFAULT = new InspectorConfig(
        false,
        true
    );
}
