package com.circuit.detector.model;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Canonical electrical connection point.
 *
 * Two raw names denote the same node when they are equal ignoring case, or when both are
 * ground aliases. All ground aliases collapse onto {@link #GROUND}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Node implements Comparable<Node> {

    /** Raw names (compared case-insensitively) that denote the reserved ground node. */
    public static final Set<String> GROUND_ALIASES = Set.of("0", "gnd", "vss", "ground");

    public static final Node GROUND = new Node("0");

    String name;

    /**
     * Canonicalize a raw node name. Idempotent: {@code of(of(x).getName())} equals {@code of(x)}.
     */
    public static Node of(String rawName) {
        Objects.requireNonNull(rawName, "rawName");
        String normalized = rawName.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Node name must not be blank");
        }
        if (isGroundAlias(normalized)) {
            return GROUND;
        }
        return new Node(normalized);
    }

    public static boolean isGroundAlias(String rawName) {
        return rawName != null && GROUND_ALIASES.contains(rawName.trim().toLowerCase(Locale.ROOT));
    }

    public boolean isGround() {
        return GROUND.name.equals(name);
    }

    @Override
    public int compareTo(Node other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
