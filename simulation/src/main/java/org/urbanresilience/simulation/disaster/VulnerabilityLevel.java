package org.urbanresilience.simulation.disaster;

/**
 * Collapse-risk class of a tree. Level I is the most fragile.
 */
public enum VulnerabilityLevel {
    I("I", 0.8, 1.0),
    II("II", 0.5, 0.7),
    III("III", 0.1, 0.4);

    private final String code;
    private final double defaultCollapseRate;
    private final double severityMultiplier;

    VulnerabilityLevel(String code, double defaultCollapseRate, double severityMultiplier) {
        this.code = code;
        this.defaultCollapseRate = defaultCollapseRate;
        this.severityMultiplier = severityMultiplier;
    }

    public String getCode() {
        return code;
    }

    public double getDefaultCollapseRate() {
        return defaultCollapseRate;
    }

    public double getSeverityMultiplier() {
        return severityMultiplier;
    }

    /**
     * Parses "I", "II" or "III", ignoring case and surrounding blanks.
     */
    public static VulnerabilityLevel fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("vulnerability level is required");
        }
        String normalized = code.trim().toUpperCase();
        for (VulnerabilityLevel level : values()) {
            if (level.code.equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown vulnerability level: " + code);
    }
}
