package com.baton.core.model;

/**
 * Per-wave progress within an epic.
 */
public record WaveStatus(Wave wave, int total, int completed, boolean enterable, boolean active) {

    public boolean isComplete() {
        return total > 0 && completed == total;
    }
}
