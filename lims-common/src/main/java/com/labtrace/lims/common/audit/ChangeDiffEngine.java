package com.labtrace.lims.common.audit;

import com.labtrace.lims.common.audit.ChangeSet.FieldChange;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes minimal per-field diffs for the audit ledger.
 * <p>
 * {@code null} and a missing key are the same thing. Time values compare by instant, numbers by value
 * ({@code 5} equals {@code 5.00}), maps and collections by deep value. Output values are normalized to plain data so a
 * diff never depends on entity or driver types.
 */
public final class ChangeDiffEngine {

    public static final ChangeDiffEngine DEFAULT = new ChangeDiffEngine("id", "createdDate", "lastModifiedDate");

    private final Set<String> lifecycleExcluded;
    private final Set<String> updateExcluded;

    public ChangeDiffEngine(String idField, String createdField, String modifiedField) {
        this.lifecycleExcluded = Set.of(idField, createdField, modifiedField);
        this.updateExcluded = Set.of(modifiedField);
    }

    /**
     * Every non-system field, null-valued ones included, as {@code {old: null, new: value}}.
     */
    public ChangeSet diffForCreate(Map<String, ?> newFields) {
        Map<String, FieldChange> changes = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : entries(newFields)) {
            if (lifecycleExcluded.contains(entry.getKey())) {
                continue;
            }
            changes.put(entry.getKey(), new FieldChange(null, normalizeValue(entry.getValue())));
        }
        return ChangeSet.of(changes);
    }

    public ChangeSet diffForUpdate(Map<String, ?> oldFields, Map<String, ?> newFields) {
        Map<String, ?> before = oldFields == null ? Map.of() : oldFields;
        Map<String, ?> after = newFields == null ? Map.of() : newFields;
        Set<String> fields = new LinkedHashSet<>();
        fields.addAll(after.keySet());
        fields.addAll(before.keySet());
        Map<String, FieldChange> changes = new LinkedHashMap<>();
        for (String field : fields) {
            if (field == null || updateExcluded.contains(field)) {
                continue;
            }
            Object left = normalizeValue(before.get(field));
            Object right = normalizeValue(after.get(field));
            if (!valuesEqual(left, right)) {
                changes.put(field, new FieldChange(left, right));
            }
        }
        return ChangeSet.of(changes);
    }

    public ChangeSet diffForDelete(Map<String, ?> oldFields) {
        Map<String, FieldChange> changes = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : entries(oldFields)) {
            if (lifecycleExcluded.contains(entry.getKey())) {
                continue;
            }
            changes.put(entry.getKey(), new FieldChange(normalizeValue(entry.getValue()), null));
        }
        return ChangeSet.of(changes);
    }

    private static Iterable<? extends Map.Entry<String, ?>> entries(Map<String, ?> fields) {
        if (fields == null) {
            return List.of();
        }
        List<Map.Entry<String, ?>> result = new ArrayList<>();
        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            if (entry.getKey() != null) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * Converts a value into the plain form stored in the ledger and in report snapshots.
     */
    public static Object normalizeValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getKey() != null) {
                    normalized.put(String.valueOf(entry.getKey()), normalizeValue(entry.getValue()));
                }
            }
            return normalized;
        }
        if (value instanceof Iterable<?> iterable) {
            List<Object> normalized = new ArrayList<>();
            for (Object item : iterable) {
                normalized.add(normalizeValue(item));
            }
            return normalized;
        }
        if (value instanceof String || value instanceof Boolean || value instanceof Number) {
            return value;
        }
        if (value instanceof Instant instant) {
            return instant.toString();
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant().toString();
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.toInstant().toString();
        }
        if (value instanceof LocalDateTime localDateTime) {
            return localDateTime.toInstant(ZoneOffset.UTC).toString();
        }
        if (value instanceof java.sql.Date sqlDate) {
            return sqlDate.toLocalDate().toString();
        }
        if (value instanceof java.sql.Time sqlTime) {
            return sqlTime.toLocalTime().toString();
        }
        if (value instanceof Date date) {
            return date.toInstant().toString();
        }
        if (value instanceof LocalDate || value instanceof LocalTime) {
            return value.toString();
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof Character) {
            return value.toString();
        }
        return String.valueOf(value);
    }

    static boolean valuesEqual(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left instanceof Number a && right instanceof Number b) {
            return compareNumbers(a, b);
        }
        if (left instanceof Map<?, ?> a && right instanceof Map<?, ?> b) {
            if (!a.keySet().equals(b.keySet())) {
                return false;
            }
            for (Map.Entry<?, ?> entry : a.entrySet()) {
                if (!valuesEqual(entry.getValue(), b.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            if (a.size() != b.size()) {
                return false;
            }
            Iterator<?> ia = a.iterator();
            Iterator<?> ib = b.iterator();
            while (ia.hasNext()) {
                if (!valuesEqual(ia.next(), ib.next())) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(left, right);
    }

    private static boolean compareNumbers(Number a, Number b) {
        if (isNonFinite(a) || isNonFinite(b)) {
            return a.doubleValue() == b.doubleValue();
        }
        return toBigDecimal(a).compareTo(toBigDecimal(b)) == 0;
    }

    private static boolean isNonFinite(Number n) {
        return (n instanceof Double d && (d.isNaN() || d.isInfinite())) || (n instanceof Float f && (f.isNaN() || f.isInfinite()));
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal decimal) {
            return decimal;
        }
        return new BigDecimal(n.toString());
    }
}
