package ai.pulse.graph;

/**
 * What the graph builder does when a step needs a provider step of some kind and none is declared.
 */
public enum AutoInsertMode {
    /**
     * Insert a provider with default options, reading the same texts, right before the first step
     * that needs it.
     */
    INSERT_DEFAULT,
    FAIL
}
