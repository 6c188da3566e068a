package com.pmmsentinel.engine.dashboard;

import com.pmmsentinel.engine.trend.TrendDirection;

public record TrendSummary(TrendDirection direction, Double current) {
}
