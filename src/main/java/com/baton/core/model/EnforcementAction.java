package com.baton.core.model;

/**
 * Dependent actions refused while a violation is at {@link EnforcementLevel#BLOCK}.
 */
public enum EnforcementAction {
    MERGE,
    CLOSE,
    WAVE_ADVANCE
}
