package com.pmmsentinel.core.model;

public record MetricSummary(int count, double avg, double min, double max, double std) {
}
