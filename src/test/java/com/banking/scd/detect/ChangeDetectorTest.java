package com.banking.scd.detect;

import com.banking.scd.core.model.AttributeType;
import com.banking.scd.core.model.ChangeType;
import com.banking.scd.core.model.DimensionDefinition;
import com.banking.scd.core.model.DimensionId;
import com.banking.scd.core.model.DimensionVersion;
import com.banking.scd.core.model.TrackingPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChangeDetector Tests")
class ChangeDetectorTest {

    private static final DimensionDefinition ACCOUNT = DimensionDefinition.builder(DimensionId.ACCOUNT)
            .type1("account_number", AttributeType.STRING)
            .type2("account_status", AttributeType.CODE)
            .type2("interest_rate", AttributeType.DECIMAL)
            .type1("dormancy_date", AttributeType.DATE)
            .build();

    private final ChangeDetector detector = new ChangeDetector();

    private static DimensionVersion stored(Map<String, Object> attributes) {
        return DimensionVersion.builder()
                .surrogateKey(1)
                .dimension(DimensionId.ACCOUNT)
                .naturalKey("A1")
                .attributes(attributes)
                .effectiveFrom(LocalDate.of(2024, 1, 1))
                .build();
    }

    private static Map<String, Object> attrs(Object... pairs) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], pairs[i + 1]);
        }
        return map;
    }

    private static final Map<String, Object> BASE = attrs(
            "account_number", "001-234",
            "account_status", "ACTIVE",
            "interest_rate", new BigDecimal("1.50"),
            "dormancy_date", null);

    @Test
    @DisplayName("No current version means a new entity")
    void newEntity() {
        ChangeSet changes = detector.detect(ACCOUNT, Optional.empty(), attrs("account_status", "active"));

        assertEquals(ChangeType.NEW_ENTITY, changes.changeType());
        assertFalse(changes.hasChanges());
        assertEquals("ACTIVE", changes.attributes().get("account_status"));
        assertEquals(4, changes.attributes().size());
    }

    @Nested
    @DisplayName("Against a current version")
    class ExistingTests {

        @Test
        @DisplayName("Values equal after normalization are no change")
        void noChange() {
            ChangeSet changes = detector.detect(ACCOUNT, Optional.of(stored(BASE)), attrs(
                    "account_number", " 001-234 ",
                    "account_status", "active",
                    "interest_rate", "1.5"));

            assertEquals(ChangeType.NO_CHANGE, changes.changeType());
            assertTrue(changes.changedAttributeNames().isEmpty());
        }

        @Test
        @DisplayName("Only TYPE1 differences overwrite")
        void type1Only() {
            Map<String, Object> incoming = new HashMap<>(BASE);
            incoming.put("account_number", "001-235");
            incoming.put("dormancy_date", "2024-05-01");

            ChangeSet changes = detector.detect(ACCOUNT, Optional.of(stored(BASE)), incoming);

            assertEquals(ChangeType.TYPE1_UPDATE, changes.changeType());
            assertEquals(List.of("account_number", "dormancy_date"), changes.changedAttributeNames());
            AttributeChange dormancy = changes.changes().get(1);
            assertNull(dormancy.before());
            assertEquals(LocalDate.of(2024, 5, 1), dormancy.after());
        }

        @Test
        @DisplayName("Any TYPE2 difference dominates TYPE1 differences")
        void type2Dominates() {
            Map<String, Object> incoming = new HashMap<>(BASE);
            incoming.put("account_number", "001-999");
            incoming.put("account_status", "DORMANT");

            ChangeSet changes = detector.detect(ACCOUNT, Optional.of(stored(BASE)), incoming);

            assertEquals(ChangeType.TYPE2_VERSION, changes.changeType());
            assertEquals(1, changes.changesOf(TrackingPolicy.TYPE2).size());
            assertEquals(1, changes.changesOf(TrackingPolicy.TYPE1).size());
        }

        @Test
        @DisplayName("A decimal differing only in scale is no change")
        void decimalScale() {
            Map<String, Object> incoming = new HashMap<>(BASE);
            incoming.put("interest_rate", new BigDecimal("1.500"));

            assertEquals(ChangeType.NO_CHANGE,
                    detector.detect(ACCOUNT, Optional.of(stored(BASE)), incoming).changeType());
        }

        @Test
        @DisplayName("A dropped TYPE2 value is a change")
        void droppedValue() {
            Map<String, Object> incoming = new HashMap<>(BASE);
            incoming.remove("interest_rate");

            ChangeSet changes = detector.detect(ACCOUNT, Optional.of(stored(BASE)), incoming);

            assertEquals(ChangeType.TYPE2_VERSION, changes.changeType());
            assertEquals(List.of("interest_rate"), changes.changedAttributeNames());
            assertNull(changes.changes().get(0).after());
        }
    }

    @Test
    @DisplayName("Should reject attributes the dimension does not track")
    void unknownAttribute() {
        assertThrows(IllegalArgumentException.class,
                () -> detector.detect(ACCOUNT, Optional.of(stored(BASE)), attrs("colour", "red")));
    }

    @Test
    @DisplayName("Should reject values that cannot be coerced")
    void badValue() {
        assertThrows(IllegalArgumentException.class,
                () -> detector.detect(ACCOUNT, Optional.empty(), attrs("interest_rate", "one point five")));
    }
}
