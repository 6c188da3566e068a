package com.pmmsentinel.engine.trend;

public record Forecast(double nextValue, double next3, double confidence) {
}
