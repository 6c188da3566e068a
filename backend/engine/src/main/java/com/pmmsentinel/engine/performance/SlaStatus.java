package com.pmmsentinel.engine.performance;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Service-level compliance over the trailing window. A {@code no_data} status carries only the
 * status and period.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SlaStatus(
        String status,
        String period,
        Map<String, SlaCheck> metrics,
        List<String> breaches,
        Integer samples
) {
    public static final String NO_DATA = "no_data";
    public static final String COMPLIANT = "compliant";
    public static final String BREACH = "breach";

    public static final String RESPONSE_TIME = "response_time";
    public static final String AVAILABILITY = "availability";
    public static final String ERROR_RATE = "error_rate";

    public static SlaStatus noData(String period) {
        return new SlaStatus(NO_DATA, period, null, null, null);
    }
}
