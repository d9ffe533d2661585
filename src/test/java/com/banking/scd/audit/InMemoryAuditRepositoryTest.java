package com.banking.scd.audit;

import com.banking.scd.core.model.DimensionId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryAuditRepository Tests")
class InMemoryAuditRepositoryTest {

    private final InMemoryAuditRepository repository = new InMemoryAuditRepository();

    private AuditEntry entry(String nk, Instant at) {
        return AuditEntry.builder()
                .action(AuditAction.VERSION_CREATED)
                .dimension(DimensionId.BRANCH)
                .naturalKey(nk)
                .timestamp(at)
                .build();
    }

    @Test
    @DisplayName("findBetween includes both bounds")
    void findBetween() {
        Instant t0 = Instant.parse("2024-06-01T10:00:00Z");
        repository.save(entry("B1", t0));
        repository.save(entry("B2", t0.plusSeconds(60)));
        repository.save(entry("B3", t0.plusSeconds(120)));

        List<AuditEntry> found = repository.findBetween(t0, t0.plusSeconds(60));

        assertEquals(List.of("B1", "B2"), found.stream().map(AuditEntry::naturalKey).toList());
    }

    @Test
    @DisplayName("Each entry gets its own id")
    void uniqueIds() {
        AuditEntry a = repository.save(entry("B1", Instant.now()));
        AuditEntry b = repository.save(entry("B1", Instant.now()));

        assertNotEquals(a.id(), b.id());
        assertEquals(2, repository.count());
    }
}
