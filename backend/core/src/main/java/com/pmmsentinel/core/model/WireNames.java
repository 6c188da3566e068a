package com.pmmsentinel.core.model;

import java.util.Locale;
import java.util.function.Function;

final class WireNames {
    private WireNames() {
    }

    static <E extends Enum<E>> E parse(E[] values, Function<E, String> wire, String value, String kind) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(kind + " is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (E candidate : values) {
            if (wire.apply(candidate).equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown " + kind + ": " + value);
    }
}
