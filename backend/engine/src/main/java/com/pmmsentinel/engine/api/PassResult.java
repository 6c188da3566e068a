package com.pmmsentinel.engine.api;

import java.util.Map;

public record PassResult(String task, boolean success, String message, Map<String, Object> stats) {
    public PassResult {
        stats = stats == null ? Map.of() : Map.copyOf(stats);
    }

    public static PassResult success(String task, String message, Map<String, Object> stats) {
        return new PassResult(task, true, message, stats);
    }

    public static PassResult failure(String task, String message, Map<String, Object> stats) {
        return new PassResult(task, false, message, stats);
    }
}
