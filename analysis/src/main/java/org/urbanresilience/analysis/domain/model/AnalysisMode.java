package org.urbanresilience.analysis.domain.model;

public enum AnalysisMode {
    PRE_DISASTER,
    POST_DISASTER,
    COMPARISON
}
