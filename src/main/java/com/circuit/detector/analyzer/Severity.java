package com.circuit.detector.analyzer;

import java.util.Locale;

/**
 * Finding severity, most severe first.
 */
public enum Severity {
    CRITICAL,
    ERROR,
    WARNING,
    INFO;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Critical and error findings make a run fail.
     */
    public boolean isBlocking() {
        return this == CRITICAL || this == ERROR;
    }
}
