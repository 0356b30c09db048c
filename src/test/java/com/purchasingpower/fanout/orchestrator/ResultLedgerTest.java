package com.purchasingpower.fanout.orchestrator;

import com.purchasingpower.fanout.model.RawResult;
import com.purchasingpower.fanout.model.SearchResult;
import com.purchasingpower.fanout.query.DefaultPhraseMatcher;
import com.purchasingpower.fanout.query.DomainHeuristicCategorizer;
import com.purchasingpower.fanout.query.ResultCategorizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Result ledger")
class ResultLedgerTest {

    private final List<SearchResult> handedOff = Collections.synchronizedList(new ArrayList<>());

    private ResultLedger ledger(List<String> phrases, int maxDomains) {
        return new ResultLedger(new DefaultPhraseMatcher(), new DomainHeuristicCategorizer(), phrases,
                handedOff::add, maxDomains);
    }

    private static RawResult raw(String url, String title, String snippet) {
        return RawResult.builder().url(url).title(title).snippet(snippet).build();
    }

    @Test
    void merge_sameUrlFromTwoSources_shouldKeepOneEntryWithBothSources() {
        // Given
        ResultLedger ledger = ledger(List.of(), 50);

        // When
        List<SearchResult> first = ledger.merge(List.of(raw("https://Example.com/a/", "Example page A", "short")), "BR");
        List<SearchResult> second = ledger.merge(
                List.of(raw("https://example.com/a", "Example page A", "a much longer snippet than before")), "GO");

        // Then
        assertThat(first).hasSize(1);
        assertThat(second).isEmpty();
        assertThat(ledger.uniqueCount()).isEqualTo(1);
        SearchResult merged = ledger.get("https://example.com/a");
        assertThat(merged.getFoundBy()).containsExactly("BR", "GO");
        assertThat(merged.getSnippet()).isEqualTo("a much longer snippet than before");
        assertThat(merged.getQualityScore()).isEqualTo(QualityScorer.score(merged.getFoundBy(),
                merged.getTitle(), merged.getSnippet()));
        assertThat(handedOff).hasSize(1);
    }

    @Test
    void merge_sameSourceTwice_shouldBeIdempotent() {
        ResultLedger ledger = ledger(List.of(), 50);
        List<RawResult> batch = List.of(raw("https://example.com/a", "Example page A", "Snippet long enough here"));

        ledger.merge(batch, "BR");
        SearchResult before = ledger.get("https://example.com/a");
        ledger.merge(batch, "BR");
        SearchResult after = ledger.get("https://example.com/a");

        assertThat(after).isEqualTo(before);
    }

    @Test
    void merge_shorterSnippet_shouldNotReplaceLongerOne() {
        ResultLedger ledger = ledger(List.of(), 50);
        ledger.merge(List.of(raw("https://example.com/a", "Title", "the longer snippet")), "BR");

        ledger.merge(List.of(raw("https://example.com/a", "Title", "short")), "TV");

        assertThat(ledger.get("https://example.com/a").getSnippet()).isEqualTo("the longer snippet");
    }

    @Test
    void merge_withPhrases_shouldDropResultsWithoutExactOrCloseMatch() {
        // Given
        ResultLedger ledger = ledger(List.of("acme corp"), 50);

        // When
        List<SearchResult> accepted = ledger.merge(List.of(
                raw("https://a.com", "Acme-Corp annual report", ""),
                raw("https://b.com", "Acme holding", "owns a stake in the Corp"),
                raw("https://c.com", "News", "acme industrial corp expands")), "BR");

        // Then
        assertThat(accepted).extracting(SearchResult::getUrl).containsExactly("https://a.com", "https://c.com");
        assertThat(ledger.getFilteredOut()).isEqualTo(1);
    }

    @Test
    void merge_blankUrl_shouldBeSkipped() {
        ResultLedger ledger = ledger(List.of(), 50);

        assertThat(ledger.merge(List.of(raw("  ", "t", "s")), "BR")).isEmpty();
        assertThat(ledger.uniqueCount()).isZero();
    }

    @Test
    void merge_corpusSource_shouldSkipCategorizer() {
        // Given
        ResultCategorizer categorizer = mock(ResultCategorizer.class);
        ResultLedger ledger = new ResultLedger(new DefaultPhraseMatcher(), categorizer, List.of(), r -> { }, 50);

        // When
        List<SearchResult> accepted = ledger.merge(
                List.of(raw("https://example.com/doc", "Indexed doc", "From the local corpus")), CorpusSearcher.SOURCE_CODE);

        // Then
        assertThat(accepted.get(0).getCategory()).isEqualTo(ResultLedger.CORPUS_CATEGORY);
        verify(categorizer, never()).categorize(any());
    }

    @Test
    void merge_categorizerFailure_shouldStillAcceptResult() {
        ResultCategorizer categorizer = mock(ResultCategorizer.class);
        when(categorizer.categorize(any())).thenThrow(new IllegalStateException("model offline"));
        ResultLedger ledger = new ResultLedger(new DefaultPhraseMatcher(), categorizer, List.of(), r -> { }, 50);

        List<SearchResult> accepted = ledger.merge(List.of(raw("https://example.com", "Title here", "s")), "BR");

        assertThat(accepted).hasSize(1);
        assertThat(accepted.get(0).getCategory()).isNull();
    }

    @Test
    void merge_shouldCategorizeNewWebResults() {
        ResultLedger ledger = ledger(List.of(), 50);

        ledger.merge(List.of(raw("https://www.reuters.com/world/1", "Reuters story", "text")), "BR");

        assertThat(ledger.get("https://www.reuters.com/world/1").getCategory()).isEqualTo("news");
    }

    @Test
    void claimDomain_shouldAcceptEachDomainOnceUpToCap() {
        // Given
        ResultLedger ledger = ledger(List.of(), 2);

        // When / Then
        assertThat(ledger.claimDomain("a.com")).isTrue();
        assertThat(ledger.claimDomain("a.com")).isFalse();
        assertThat(ledger.claimDomain("b.com")).isTrue();
        assertThat(ledger.claimDomain("c.com")).isFalse();
        assertThat(ledger.claimDomain("")).isFalse();
        assertThat(ledger.getSkippedDomains()).isEqualTo(1);
    }

    @Test
    void snapshot_shouldOrderByQualityDescending() {
        ResultLedger ledger = ledger(List.of(), 50);
        ledger.merge(List.of(raw("https://low.com", "x", "y")), "ZZ");
        ledger.merge(List.of(raw("https://high.com", "A proper title", "A snippet long enough to count")), "AX");

        assertThat(ledger.snapshot()).extracting(SearchResult::getUrl)
                .containsExactly("https://high.com", "https://low.com");
    }

    @Test
    void concurrentMerges_ofSameUrls_shouldYieldExactlyOneEntryPerUrl() throws Exception {
        // Given
        ResultLedger ledger = ledger(List.of(), 50);
        List<RawResult> batch = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            batch.add(raw("https://example.com/page/" + i, "Shared page " + i, "Snippet for page " + i));
        }
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<SearchResult>>> futures = new ArrayList<>();

        // When
        try {
            for (int t = 0; t < threads; t++) {
                String source = "S" + t;
                futures.add(pool.submit(() -> {
                    start.await();
                    return ledger.merge(batch, source);
                }));
            }
            start.countDown();

            // Then
            int inserted = 0;
            for (Future<List<SearchResult>> future : futures) {
                inserted += future.get(10, TimeUnit.SECONDS).size();
            }
            assertThat(inserted).isEqualTo(20);
            assertThat(ledger.uniqueCount()).isEqualTo(20);
            assertThat(handedOff).hasSize(20);
            assertThat(ledger.snapshot()).allSatisfy(r -> assertThat(r.getFoundBy()).hasSize(threads));
        } finally {
            pool.shutdownNow();
        }
    }
}
