package com.labtrace.lims.common.audit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Field-level difference between two states of one record, keyed by field name.
 * Values are already normalized to plain data (strings, numbers, booleans, lists, maps).
 */
public final class ChangeSet {

    private static final ChangeSet EMPTY = new ChangeSet(Map.of());

    private final Map<String, FieldChange> changes;

    private ChangeSet(Map<String, FieldChange> changes) {
        this.changes = Collections.unmodifiableMap(new LinkedHashMap<>(changes));
    }

    static ChangeSet of(Map<String, FieldChange> changes) {
        if (changes == null || changes.isEmpty()) {
            return EMPTY;
        }
        return new ChangeSet(changes);
    }

    public static ChangeSet empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public int size() {
        return changes.size();
    }

    public boolean contains(String field) {
        return changes.containsKey(field);
    }

    public Optional<FieldChange> get(String field) {
        return Optional.ofNullable(changes.get(field));
    }

    public Map<String, FieldChange> asMap() {
        return changes;
    }

    /**
     * Serializable form: {@code {field: {old: ..., new: ...}}}.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        changes.forEach((field, change) -> map.put(field, change.toMap()));
        return map;
    }

    @Override
    public String toString() {
        return "ChangeSet" + changes;
    }

    /**
     * One field's old and new value; either side is {@code null} when absent.
     */
    public record FieldChange(Object oldValue, Object newValue) {
        public Map<String, Object> toMap() {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("old", oldValue);
            entry.put("new", newValue);
            return entry;
        }
    }
}
