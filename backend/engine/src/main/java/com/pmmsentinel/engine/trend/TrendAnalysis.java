package com.pmmsentinel.engine.trend;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of one trend analysis. When fewer than two points were available only
 * {@code metricName}, {@code status} and {@code dataPoints} are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrendAnalysis(
        String metricName,
        String status,
        int dataPoints,
        Double currentValue,
        Double mean,
        Double std,
        Double min,
        Double max,
        TrendDirection direction,
        Double strength,
        Forecast forecast
) {
    public static final String ANALYZED = "analyzed";
    public static final String INSUFFICIENT_DATA = "insufficient_data";

    public static TrendAnalysis insufficientData(String metricName, int dataPoints) {
        return new TrendAnalysis(metricName, INSUFFICIENT_DATA, dataPoints,
                null, null, null, null, null, null, null, null);
    }

    public boolean hasData() {
        return ANALYZED.equals(status);
    }
}
