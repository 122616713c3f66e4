package com.baton.dispatch.api;

import com.baton.core.model.WaveStatus;

public record WaveStatusResponse(String wave, int total, int completed, boolean enterable, boolean active) {

    public static WaveStatusResponse from(WaveStatus status) {
        return new WaveStatusResponse(status.wave().toString(), status.total(), status.completed(),
                status.enterable(), status.active());
    }
}
