package com.purchasingpower.fanout.backend;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemorySearchBackendTest {

    private final InMemorySearchBackend backend = new InMemorySearchBackend();

    private static IndexedDocument doc(String id, String label, String zone, String type) {
        return IndexedDocument.builder().id(id).label(label).content("").zone(zone).type(type).build();
    }

    @Test
    void searchKeyword_shouldRankByMatchedTermFraction() {
        // Given
        backend.indexDocument(doc("full", "Acme merger approved", "z1", "search_result"));
        backend.indexDocument(doc("half", "Acme quarterly numbers", "z1", "search_result"));
        backend.indexDocument(doc("none", "Unrelated", "z1", "search_result"));

        // When
        List<BackendHit> hits = backend.searchKeyword("acme \"merger\"", "z1", null, 10);

        // Then
        assertThat(hits).extracting(BackendHit::id).containsExactly("full", "half");
        assertThat(hits.get(0).score()).isEqualTo(1.0);
        assertThat(hits.get(1).score()).isEqualTo(0.5);
    }

    @Test
    void searchKeyword_shouldFilterByZoneTypeAndLimit() {
        backend.indexDocument(doc("a", "acme one", "z1", "search_result"));
        backend.indexDocument(doc("b", "acme two", "z2", "search_result"));
        backend.indexDocument(doc("c", "acme three", "z1", "note"));
        backend.indexDocument(doc("d", "acme four", "z1", "search_result"));

        assertThat(backend.searchKeyword("acme", "z1", "search_result", 10)).extracting(BackendHit::id)
                .containsExactlyInAnyOrder("a", "d");
        assertThat(backend.searchKeyword("acme", null, null, 2)).hasSize(2);
        assertThat(backend.count("z1", null)).isEqualTo(3);
    }

    @Test
    void reindex_shouldKeepOriginalCreatedAt() {
        Instant created = Instant.parse("2024-01-01T00:00:00Z");
        backend.indexDocument(doc("a", "first", "z", "t").toBuilder().createdAt(created).build());

        backend.indexDocument(doc("a", "second", "z", "t"));

        IndexedDocument stored = backend.getById("a").orElseThrow();
        assertThat(stored.getLabel()).isEqualTo("second");
        assertThat(stored.getCreatedAt()).isEqualTo(created);
    }

    @Test
    void deleteById_shouldReportWhetherSomethingWasRemoved() {
        backend.indexDocument(doc("a", "x", "z", "t"));

        assertThat(backend.deleteById("a")).isTrue();
        assertThat(backend.deleteById("a")).isFalse();
    }

    @Test
    void unsupportedOperations_shouldThrow() {
        assertThat(backend.capabilities()).containsExactly(BackendCapability.KEYWORD);
        assertThatThrownBy(() -> backend.searchVector(List.of(1f), null, null, 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
