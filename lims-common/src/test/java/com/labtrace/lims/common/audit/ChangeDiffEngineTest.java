package com.labtrace.lims.common.audit;

import static org.assertj.core.api.Assertions.assertThat;

import com.labtrace.lims.common.audit.ChangeSet.FieldChange;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ChangeDiffEngineTest {

    private final ChangeDiffEngine engine = ChangeDiffEngine.DEFAULT;

    @Test
    void updateContainsOnlyChangedFields() {
        Map<String, Object> before = fields("sampleCode", "S-001", "temperature", new BigDecimal("5"), "urgent", false);
        Map<String, Object> after = fields("sampleCode", "S-001", "temperature", new BigDecimal("8"), "urgent", false);

        ChangeSet changes = engine.diffForUpdate(before, after);

        assertThat(changes.size()).isEqualTo(1);
        assertThat(changes.get("temperature")).contains(new FieldChange(new BigDecimal("5"), new BigDecimal("8")));
        assertThat(changes.toMap()).containsOnlyKeys("temperature");
    }

    @Test
    void identicalInputsProduceEmptyDiff() {
        Map<String, Object> state = fields("sampleCode", "S-001", "comments", "ok", "tags", List.of("a", "b"));

        assertThat(engine.diffForUpdate(state, new HashMap<>(state)).isEmpty()).isTrue();
    }

    @Test
    void modificationTimestampIsNeverPartOfAnUpdate() {
        Map<String, Object> before = fields("id", "1", "lastModifiedDate", Instant.parse("2025-01-01T00:00:00Z"), "comments", "a");
        Map<String, Object> after = fields("id", "1", "lastModifiedDate", Instant.parse("2025-01-02T00:00:00Z"), "comments", "a");

        assertThat(engine.diffForUpdate(before, after).isEmpty()).isTrue();
    }

    @Test
    void nullAndMissingAreEquivalent() {
        Map<String, Object> before = fields("comments", null);
        Map<String, Object> after = fields();

        assertThat(engine.diffForUpdate(before, after).isEmpty()).isTrue();
    }

    @Test
    void absentToPresentIsAChange() {
        ChangeSet changes = engine.diffForUpdate(fields("comments", null), fields("comments", "late delivery"));

        assertThat(changes.get("comments")).contains(new FieldChange(null, "late delivery"));
    }

    @Test
    void removedKeyIsAChange() {
        ChangeSet changes = engine.diffForUpdate(fields("comments", "x"), fields());

        assertThat(changes.get("comments")).contains(new FieldChange("x", null));
    }

    @Test
    void timestampsCompareByInstant() {
        Instant instant = Instant.parse("2025-03-04T10:15:30Z");
        OffsetDateTime sameInstantOtherZone = instant.atOffset(ZoneOffset.ofHours(8));

        ChangeSet changes = engine.diffForUpdate(fields("dateReceived", Date.from(instant)), fields("dateReceived", sameInstantOtherZone));

        assertThat(changes.isEmpty()).isTrue();
    }

    @Test
    void timestampsAreSerializedAsIsoStrings() {
        ChangeSet changes = engine.diffForUpdate(
            fields("dueDate", Instant.parse("2025-03-04T10:15:30Z")),
            fields("dueDate", Instant.parse("2025-03-05T10:15:30Z"))
        );

        assertThat(changes.get("dueDate")).contains(new FieldChange("2025-03-04T10:15:30Z", "2025-03-05T10:15:30Z"));
    }

    @Test
    void numbersCompareByValue() {
        ChangeSet changes = engine.diffForUpdate(fields("temperature", new BigDecimal("5.00")), fields("temperature", 5));

        assertThat(changes.isEmpty()).isTrue();
    }

    @Test
    void structuredValuesCompareDeeply() {
        Map<String, Object> nestedBefore = new LinkedHashMap<>();
        nestedBefore.put("columns", List.of("section", "test"));
        nestedBefore.put("labels", Map.of("test", "Analysis"));
        Map<String, Object> nestedAfter = new LinkedHashMap<>();
        nestedAfter.put("labels", Map.of("test", "Analysis"));
        nestedAfter.put("columns", List.of("section", "test"));

        assertThat(engine.diffForUpdate(fields("template", nestedBefore), fields("template", nestedAfter)).isEmpty()).isTrue();

        nestedAfter.put("columns", List.of("test", "section"));
        assertThat(engine.diffForUpdate(fields("template", nestedBefore), fields("template", nestedAfter)).contains("template")).isTrue();
    }

    @Test
    void createRecordsEveryNonSystemFieldIncludingNulls() {
        UUID id = UUID.randomUUID();
        Map<String, Object> created = fields(
            "id",
            id,
            "createdDate",
            Instant.now(),
            "lastModifiedDate",
            Instant.now(),
            "status",
            Thread.State.NEW,
            "comments",
            null
        );

        ChangeSet changes = engine.diffForCreate(created);

        assertThat(changes.toMap()).containsOnlyKeys("status", "comments");
        assertThat(changes.get("status")).contains(new FieldChange(null, "NEW"));
        assertThat(changes.get("comments")).contains(new FieldChange(null, null));
    }

    @Test
    void deleteExcludesSystemFieldsAndKeepsOldValues() {
        ChangeSet changes = engine.diffForDelete(fields("id", "42", "createdDate", Instant.now(), "name", "Moisture", "comments", null));

        assertThat(changes.toMap()).containsOnlyKeys("name", "comments");
        assertThat(changes.get("name")).contains(new FieldChange("Moisture", null));
        assertThat(changes.get("comments")).contains(new FieldChange(null, null));
    }

    @Test
    void jdbcDateAndTimeValuesAreSerializedWithoutAnInstant() {
        ChangeSet dates = engine.diffForUpdate(
            fields("dateDue", java.sql.Date.valueOf("2025-01-01")),
            fields("dateDue", java.sql.Date.valueOf("2025-01-02"))
        );
        ChangeSet times = engine.diffForUpdate(
            fields("pickupTime", java.sql.Time.valueOf("08:30:00")),
            fields("pickupTime", java.sql.Time.valueOf("09:00:00"))
        );

        assertThat(dates.get("dateDue")).contains(new FieldChange("2025-01-01", "2025-01-02"));
        assertThat(times.get("pickupTime")).contains(new FieldChange("08:30", "09:00"));
    }

    @Test
    void jdbcDateEqualsSameLocalDate() {
        ChangeSet changes = engine.diffForUpdate(fields("dateDue", java.sql.Date.valueOf("2025-01-01")), fields("dateDue", LocalDate.of(2025, 1, 1)));

        assertThat(changes.isEmpty()).isTrue();
    }

    @Test
    void collectionsNormalizeToPlainLists() {
        assertThat(ChangeDiffEngine.normalizeValue(new LinkedHashSet<>(List.of("micro", "chemistry")))).isEqualTo(List.of("micro", "chemistry"));
        assertThat(ChangeDiffEngine.normalizeValue(List.of(LocalDate.of(2025, 1, 2)))).isEqualTo(List.of("2025-01-02"));
    }

    @Test
    void serializedFormUsesOldAndNewKeys() {
        ChangeSet changes = engine.diffForUpdate(fields("temperature", 5), fields("temperature", 8));

        assertThat(changes.toMap()).isEqualTo(Map.of("temperature", Map.of("old", 5, "new", 8)));
    }

    private static Map<String, Object> fields(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
