package com.purchasingpower.fanout.indexing;

import com.purchasingpower.fanout.backend.BackendUnavailableException;
import com.purchasingpower.fanout.backend.IndexedDocument;
import com.purchasingpower.fanout.backend.UnifiedBackendRouter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SearchIndexSinkTest {

    private final UnifiedBackendRouter router = mock(UnifiedBackendRouter.class);
    private final SearchIndexSink sink = new SearchIndexSink(router);

    private static IndexedDocument doc(String id) {
        return IndexedDocument.builder().id(id).label(id).build();
    }

    @Test
    void indexBatch_shouldAttemptEveryDocumentAndReportFailuresTogether() {
        // Given
        when(router.indexDocument(argThat(d -> d != null && d.getId().equals("bad"))))
                .thenThrow(new BackendUnavailableException("both backends down"));

        // When / Then
        assertThatThrownBy(() -> sink.indexBatch(List.of(doc("a"), doc("bad"), doc("c"))))
                .isInstanceOf(IndexSinkException.class)
                .hasMessageContaining("1 of 3 documents failed")
                .hasCauseInstanceOf(BackendUnavailableException.class);
        verify(router, times(3)).indexDocument(any());
    }
}
