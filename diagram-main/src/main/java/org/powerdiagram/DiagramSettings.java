package org.powerdiagram;

/**
 * Tuning knobs for diagram layout. Defaults come from system properties so a test run can flip
 * them with {@code -D} flags.
 * <ul>
 *   <li>{@value #STRICT_ANCHORS_PROPERTY} - fail with {@link AnchorNotFoundException} instead of
 *   anchoring at column 0 when an operator token is missing from its source (default {@code false})</li>
 * </ul>
 */
public final class DiagramSettings {

    public static final String STRICT_ANCHORS_PROPERTY = "powerdiagram.anchor.strict";

    private static final DiagramSettings DEFAULTS = new DiagramSettings(false);

    private final boolean strictAnchors;

    private DiagramSettings(boolean strictAnchors) {
        this.strictAnchors = strictAnchors;
    }

    public static DiagramSettings defaults() {
        return DEFAULTS;
    }

    public static DiagramSettings fromSystemProperties() {
        return new DiagramSettings(Boolean.getBoolean(STRICT_ANCHORS_PROPERTY));
    }

    public DiagramSettings withStrictAnchors(boolean strictAnchors) {
        return new DiagramSettings(strictAnchors);
    }

    public boolean isStrictAnchors() {
        return strictAnchors;
    }

    @Override
    public String toString() {
        return "DiagramSettings{strictAnchors=" + strictAnchors + '}';
    }
}
