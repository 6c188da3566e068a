package com.pmmsentinel.engine.api;

import com.pmmsentinel.core.model.Signal;
import com.pmmsentinel.core.model.SignalStatus;

import java.time.Instant;

/**
 * Signal read-back criteria; null components match everything.
 */
public record SignalFilter(SignalStatus status, Instant since, Instant until) {
    public static SignalFilter all() {
        return new SignalFilter(null, null, null);
    }

    public static SignalFilter active() {
        return new SignalFilter(SignalStatus.ACTIVE, null, null);
    }

    public static SignalFilter since(Instant since) {
        return new SignalFilter(null, since, null);
    }

    public boolean matches(Signal signal) {
        if (status != null && signal.status() != status) {
            return false;
        }
        if (since != null && signal.timestamp().isBefore(since)) {
            return false;
        }
        return until == null || !signal.timestamp().isAfter(until);
    }
}
