package com.purchasingpower.fanout.indexing;

import com.purchasingpower.fanout.backend.IndexedDocument;
import com.purchasingpower.fanout.model.SearchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Background index writer")
class BackgroundIndexWriterTest {

    private final IndexContext context = new IndexContext("acme", "default", "system", "default");

    private static SearchResult result(int i) {
        return SearchResult.builder().url("https://example.com/" + i).title("Result " + i).build();
    }

    private static final class RecordingSink implements IndexSink {

        final List<List<IndexedDocument>> batches = new CopyOnWriteArrayList<>();

        @Override
        public String name() {
            return "recording";
        }

        @Override
        public void indexBatch(List<IndexedDocument> documents) {
            batches.add(new ArrayList<>(documents));
        }

        int total() {
            return batches.stream().mapToInt(List::size).sum();
        }
    }

    private static BackgroundIndexWriter.Settings settings(int batchSize, Duration flushInterval, int capacity) {
        return new BackgroundIndexWriter.Settings(batchSize, flushInterval, Duration.ofMillis(10), capacity,
                Duration.ofMillis(50));
    }

    @Test
    void close_shouldDrainEverythingQueued() {
        // Given
        RecordingSink sink = new RecordingSink();
        BackgroundIndexWriter writer = new BackgroundIndexWriter(List.of(sink), new DocumentMapper(), context,
                settings(5, Duration.ofMinutes(1), 100)).start();

        // When
        for (int i = 0; i < 12; i++) {
            assertThat(writer.submit(result(i))).isTrue();
        }
        boolean finished = writer.close(Duration.ofSeconds(5));

        // Then
        assertThat(finished).isTrue();
        assertThat(sink.total()).isEqualTo(12);
        assertThat(writer.getIndexedCount()).isEqualTo(12);
        assertThat(sink.batches).allSatisfy(batch -> assertThat(batch).hasSizeLessThanOrEqualTo(5));
    }

    @Test
    void flushInterval_shouldFlushPartialBatch() throws Exception {
        // Given
        CountDownLatch flushed = new CountDownLatch(1);
        IndexSink sink = new IndexSink() {
            @Override
            public String name() {
                return "latch";
            }

            @Override
            public void indexBatch(List<IndexedDocument> documents) {
                flushed.countDown();
            }
        };
        BackgroundIndexWriter writer = new BackgroundIndexWriter(List.of(sink), new DocumentMapper(), context,
                settings(100, Duration.ofMillis(50), 100)).start();

        // When
        writer.submit(result(1));

        // Then
        assertThat(flushed.await(5, TimeUnit.SECONDS)).isTrue();
        writer.close();
    }

    @Test
    void failingSink_shouldNotAffectOtherSinks() {
        // Given
        IndexSink broken = new IndexSink() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public void indexBatch(List<IndexedDocument> documents) {
                throw new IndexSinkException("backend down");
            }
        };
        RecordingSink healthy = new RecordingSink();
        BackgroundIndexWriter writer = new BackgroundIndexWriter(List.of(broken, healthy), new DocumentMapper(),
                context, settings(2, Duration.ofMinutes(1), 100)).start();

        // When
        for (int i = 0; i < 4; i++) {
            writer.submit(result(i));
        }
        writer.close(Duration.ofSeconds(5));

        // Then
        assertThat(healthy.total()).isEqualTo(4);
        assertThat(writer.getDiscardedBatches()).isZero();
    }

    @Test
    void unmappableBatch_shouldBeDiscardedAndWorkerSurvive() {
        // Given
        RecordingSink sink = new RecordingSink();
        BackgroundIndexWriter writer = new BackgroundIndexWriter(List.of(sink), new DocumentMapper(), context,
                settings(1, Duration.ofMinutes(1), 100)).start();

        // When
        writer.submit(new SearchResult());
        writer.submit(result(7));
        writer.close(Duration.ofSeconds(5));

        // Then
        assertThat(writer.getDiscardedBatches()).isEqualTo(1);
        assertThat(sink.total()).isEqualTo(1);
    }

    @Test
    void fullQueue_shouldDropAfterOfferTimeout() {
        // Given: worker never started, so nothing drains
        BackgroundIndexWriter writer = new BackgroundIndexWriter(List.of(), new DocumentMapper(), context,
                settings(5, Duration.ofMinutes(1), 1));

        // When
        boolean first = writer.submit(result(1));
        boolean second = writer.submit(result(2));

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(writer.getDroppedCount()).isEqualTo(1);
        writer.close(Duration.ofMillis(100));
    }

    @Test
    void submitAfterClose_shouldBeRejected() {
        BackgroundIndexWriter writer = new BackgroundIndexWriter(List.of(), new DocumentMapper(), context,
                BackgroundIndexWriter.Settings.defaults()).start();

        writer.close(Duration.ofSeconds(1));

        assertThat(writer.isClosed()).isTrue();
        assertThat(writer.submit(result(1))).isFalse();
    }
}
