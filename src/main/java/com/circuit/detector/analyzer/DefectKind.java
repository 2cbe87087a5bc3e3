package com.circuit.detector.analyzer;

/**
 * Kinds of open-circuit defects, with the severity each is reported at.
 */
public enum DefectKind {
    /**
     * Node touching nothing, or only an element that touches nothing else.
     */
    FLOATING_NODE(Severity.CRITICAL),

    /**
     * Multi-node island that reaches neither ground nor a top-level port.
     */
    ISOLATED_COMPONENT(Severity.CRITICAL),

    /**
     * Instance port left unbound or bound to a node nothing outside the instance touches,
     * or a top-level port that no element touches.
     */
    FLOATING_PORT(Severity.WARNING),

    /**
     * Node with capacitive connections but no resistive path to ground.
     */
    CAPACITOR_ONLY(Severity.WARNING),

    /**
     * Connected node with no resistive connection at all.
     */
    DC_FLOATING_NODE(Severity.ERROR),

    /**
     * Port that no element inside the instance uses.
     */
    UNUSED_PORT(Severity.INFO);

    private final Severity defaultSeverity;

    DefectKind(Severity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public Severity getDefaultSeverity() {
        return defaultSeverity;
    }
}
