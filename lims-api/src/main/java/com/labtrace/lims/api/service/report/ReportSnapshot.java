package com.labtrace.lims.api.service.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Frozen data a certificate is rendered from. Holds plain values only, deep-copied and unmodifiable, so later edits
 * to the sample can never reach it.
 *
 * @param version version number the snapshot was taken for
 * @param data nested maps, lists and scalar values
 */
public record ReportSnapshot(int version, Map<String, Object> data) {
    public ReportSnapshot {
        data = freezeMap(data);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> section(String name) {
        Object value = data.get(name);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> tests() {
        Object value = data.get(ReportSnapshotFactory.TESTS);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<Map<String, Object>> rows = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                rows.add((Map<String, Object>) map);
            }
        }
        return rows;
    }

    private static Map<String, Object> freezeMap(Map<?, ?> source) {
        if (source == null) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(String.valueOf(key), freeze(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
