package com.purchasingpower.fanout.backend;

import com.purchasingpower.fanout.configuration.BackendProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Unified backend router")
class UnifiedBackendRouterTest {

    /**
     * In-memory backend whose failures can be switched on per test.
     */
    static class ControllableBackend extends InMemorySearchBackend {

        private final String name;
        volatile boolean failInit;
        volatile boolean failing;

        ControllableBackend(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public void initialize() {
            if (failInit) {
                throw new IllegalStateException(name + " refused connection");
            }
        }

        @Override
        public String indexDocument(IndexedDocument document) {
            check();
            return super.indexDocument(document);
        }

        @Override
        public List<BackendHit> searchKeyword(String query, String zone, String docType, int limit) {
            check();
            return super.searchKeyword(query, zone, docType, limit);
        }

        @Override
        public long count(String zone, String docType) {
            check();
            return super.count(zone, docType);
        }

        private void check() {
            if (failing) {
                throw new IllegalStateException(name + " is down");
            }
        }
    }

    private final BackendProperties properties = new BackendProperties();
    private ControllableBackend primary;
    private ControllableBackend secondary;

    @BeforeEach
    void setUp() {
        primary = new ControllableBackend("graph");
        secondary = new ControllableBackend("memory");
    }

    private UnifiedBackendRouter router() {
        return new UnifiedBackendRouter(primary, secondary, properties, Runnable::run);
    }

    private static IndexedDocument doc(String id, String label) {
        return IndexedDocument.builder().id(id).label(label).content("body of " + label).zone("default").build();
    }

    @Nested
    @DisplayName("failover")
    class Failover {

        @Test
        void failingPrimary_shouldServeFromSecondaryAndCountFallback() {
            // Given
            UnifiedBackendRouter router = router();
            secondary.indexDocument(doc("d1", "acme merger"));
            primary.failing = true;

            // When
            BackendResult<List<BackendHit>> result = router.searchKeyword("acme", "default", null, 10);

            // Then
            assertThat(result.fallback()).isTrue();
            assertThat(result.backend()).isEqualTo("memory");
            assertThat(result.role()).isEqualTo(BackendRole.SECONDARY);
            assertThat(result.value()).extracting(BackendHit::id).containsExactly("d1");
            assertThat(router.getFallbackCount()).isEqualTo(1);
        }

        @Test
        void bothFailing_shouldRaiseAggregatedError() {
            UnifiedBackendRouter router = router();
            primary.failing = true;
            secondary.failing = true;

            assertThatThrownBy(() -> router.searchKeyword("acme", null, null, 10))
                    .isInstanceOf(BackendOperationException.class)
                    .hasMessageContaining("graph is down")
                    .hasMessageContaining("memory is down")
                    .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
        }

        @Test
        void failingPrimaryWithUnavailableSecondary_shouldRethrowOriginal() {
            secondary.failInit = true;
            UnifiedBackendRouter router = router();
            primary.failing = true;

            assertThatThrownBy(() -> router.count(null, null))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("graph is down");
            assertThat(router.getFallbackCount()).isZero();
        }

        @Test
        void successfulWrite_shouldBeMirroredToOtherBackend() {
            UnifiedBackendRouter router = router();

            BackendResult<String> result = router.indexDocument(doc("d1", "acme"));

            assertThat(result.value()).isEqualTo("d1");
            assertThat(primary.getById("d1")).isPresent();
            assertThat(secondary.getById("d1")).isPresent();
            assertThat(router.getDualIndexedCount()).isEqualTo(1);
        }

        @Test
        void documentWithoutZone_shouldGetDefaultZone() {
            UnifiedBackendRouter router = router();

            router.indexDocument(IndexedDocument.builder().id("d2").label("no zone").build());

            assertThat(primary.getById("d2")).get()
                    .extracting(IndexedDocument::getZone).isEqualTo(properties.getDefaultZone());
        }
    }

    @Test
    void construction_withNoInitializableBackend_shouldFail() {
        primary.failInit = true;
        secondary.failInit = true;

        assertThatThrownBy(this::router)
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("No backend available")
                .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
    }

    @Test
    void construction_withFailedPrimary_shouldStartOnSecondary() {
        primary.failInit = true;

        UnifiedBackendRouter router = router();

        assertThat(router.activeBackendName()).isEqualTo("memory");
        assertThat(router.isAvailable(BackendRole.PRIMARY)).isFalse();
    }

    @Test
    void dualParallelWrite_withFailingPrimary_shouldSucceedOnSecondary() {
        // Given
        UnifiedBackendRouter router = router();
        primary.failing = true;

        // When
        DualWriteResult result = router.indexDocumentDualParallel(doc("d1", "acme"), "osint", List.of("osint", "#acme"));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getErrors()).hasSize(1).first().asString().contains("graph indexing failed");
        assertThat(result.getCanonicalRole()).isEqualTo(BackendRole.SECONDARY);
        assertThat(result.getCanonicalBackend()).isEqualTo("memory");
        assertThat(result.getCanonicalId()).isEqualTo("d1");
        assertThat(result.getPrimaryId()).isNull();

        IndexedDocument stored = secondary.getById("d1").orElseThrow();
        assertThat(stored.getZone()).isEqualTo("osint");
        assertThat(stored.getTags()).containsExactly("#osint", "#acme");
        assertThat(stored.getIndexedAt()).isNotNull();
    }

    @Test
    void dualParallelWrite_bothSucceeding_shouldPreferPrimaryId() {
        UnifiedBackendRouter router = router();

        DualWriteResult result = router.indexDocumentDualParallel(doc("d1", "acme"), null, null);

        assertThat(result.getCanonicalRole()).isEqualTo(BackendRole.PRIMARY);
        assertThat(result.getErrors()).isEmpty();
        assertThat(router.getDualIndexedCount()).isEqualTo(1);
    }

    @Test
    void unsupportedCapabilities_shouldDegradeInsteadOfFailing() {
        // Given
        UnifiedBackendRouter router = router();
        router.indexDocument(doc("d1", "acme"));

        // When
        BackendResult<List<BackendHit>> vector = router.searchVector(List.of(0.1f, 0.2f), "default", null, 5);
        BackendResult<GraphTraversal> graph = router.traverseGraph("d1", 2, List.of(), "default");

        // Then
        assertThat(vector.fallback()).isFalse();
        assertThat(vector.value()).extracting(BackendHit::id).containsExactly("d1");
        assertThat(graph.value().degraded()).isTrue();
        assertThat(graph.value().nodes()).extracting(GraphTraversal.Node::id).containsExactly("d1");
    }

    @Nested
    @DisplayName("health")
    class Health {

        @Test
        void failingProbe_shouldDemoteAndLaterRestore() {
            // Given
            UnifiedBackendRouter router = router();
            primary.failing = true;

            // When
            BackendHealthReport demoted = router.healthCheck();

            // Then
            assertThat(demoted.activeBackend()).isEqualTo("memory");
            assertThat(demoted.backends().get("graph").available()).isFalse();

            // When
            primary.failing = false;
            BackendHealthReport recovered = router.healthCheck();

            // Then
            assertThat(recovered.backends().get("graph").status()).isEqualTo("recovered");
            assertThat(recovered.activeBackend()).isEqualTo("graph");
        }

        @Test
        void manualSwitch_shouldStickAcrossProbes() {
            UnifiedBackendRouter router = router();

            router.switchBackend("secondary");
            router.healthCheck();

            assertThat(router.activeBackendName()).isEqualTo("memory");
        }

        @Test
        void switchToUnknownBackend_shouldBeRejected() {
            UnifiedBackendRouter router = router();

            assertThatThrownBy(() -> router.switchBackend("elastic"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void stats_shouldReportCallsAndFallbacks() {
            UnifiedBackendRouter router = router();
            router.count(null, null);
            primary.failing = true;
            router.count(null, null);

            BackendStats stats = router.getStats();

            assertThat(stats.getFallbacks()).isEqualTo(1);
            assertThat(stats.getBackends().get("graph").failures()).isEqualTo(1);
            assertThat(stats.getBackends().get("memory").calls()).isEqualTo(1);
            assertThat(stats.getFallbackRate()).isEqualTo(50.0);
        }
    }
}
