package com.pmmsentinel.core.model;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

final class PatchFields {
    private PatchFields() {
    }

    static void rejectUnknown(Map<String, Object> fields, Set<String> allowed, String entity) {
        if (fields == null) {
            throw new IllegalArgumentException("No fields given for " + entity + " update");
        }
        Set<String> unknown = new TreeSet<>(fields.keySet());
        unknown.removeAll(allowed);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown " + entity + " fields: " + unknown);
        }
    }

    static String string(Map<String, Object> fields, String key) {
        Object value = fields.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new IllegalArgumentException("Field '" + key + "' must be a string");
        }
        return text;
    }
}
