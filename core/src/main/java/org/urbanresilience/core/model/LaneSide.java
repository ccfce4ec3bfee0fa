package org.urbanresilience.core.model;

public enum LaneSide {
    LEFT,
    RIGHT
}
