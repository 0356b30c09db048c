package com.purchasingpower.fanout.indexing;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.purchasingpower.fanout.backend.IndexedDocument;
import com.purchasingpower.fanout.model.SearchResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single consumer that drains accepted results from a bounded queue and flushes them to every
 * sink in batches.
 *
 * <p>A batch is flushed once it reaches the batch size or once the flush interval has elapsed since
 * the previous flush. Each sink is written independently: a failing sink is logged and skipped.
 * If mapping a batch to documents fails, only that batch is discarded. The worker loop survives
 * any single failure.
 *
 * <p>{@link #close(Duration)} stops intake, lets the worker drain what is queued and waits a bounded
 * time for it to finish.
 *
 * @since 1.0.0
 */
@Slf4j
public class BackgroundIndexWriter implements AutoCloseable {

    private final List<IndexSink> sinks;
    private final DocumentMapper mapper;
    private final IndexContext context;
    private final Settings settings;
    private final BlockingQueue<SearchResult> queue;
    private final ExecutorService worker;

    private final AtomicLong indexedCount = new AtomicLong();
    private final AtomicLong droppedCount = new AtomicLong();
    private final AtomicLong discardedBatches = new AtomicLong();
    private volatile boolean closed;

    /**
     * @param batchSize      flush once this many results are buffered
     * @param flushInterval  flush a non-empty buffer once this much time passed since the last flush
     * @param pollInterval   longest the worker blocks on an empty queue
     * @param queueCapacity  bound of the intake queue
     * @param offerTimeout   how long {@link #submit} waits for room before dropping a result
     */
    public record Settings(int batchSize, Duration flushInterval, Duration pollInterval,
                           int queueCapacity, Duration offerTimeout) {

        public Settings {
            Preconditions.checkArgument(batchSize >= 1, "batchSize must be >= 1");
            Preconditions.checkArgument(queueCapacity >= 1, "queueCapacity must be >= 1");
        }

        public static Settings defaults() {
            return new Settings(5, Duration.ofSeconds(2), Duration.ofMillis(500), 1000, Duration.ofSeconds(1));
        }
    }

    public BackgroundIndexWriter(List<IndexSink> sinks, DocumentMapper mapper, IndexContext context, Settings settings) {
        this.sinks = List.copyOf(sinks);
        this.mapper = mapper;
        this.context = context;
        this.settings = settings;
        this.queue = new ArrayBlockingQueue<>(settings.queueCapacity());
        this.worker = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("index-writer-%d")
                .setDaemon(true)
                .build());
    }

    public BackgroundIndexWriter start() {
        worker.execute(this::drainLoop);
        log.debug("Index writer started with sinks {}", sinks.stream().map(IndexSink::name).toList());
        return this;
    }

    /**
     * Queues a result for indexing. Callers should pass a copy they no longer mutate.
     *
     * @return false if the writer is closed or the queue stayed full past the offer timeout
     */
    public boolean submit(SearchResult result) {
        if (closed) {
            return false;
        }
        try {
            boolean accepted = queue.offer(result, settings.offerTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!accepted) {
                droppedCount.incrementAndGet();
                log.warn("Index queue full, dropping {}", result.getUrl());
            }
            return accepted;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            droppedCount.incrementAndGet();
            return false;
        }
    }

    private void drainLoop() {
        List<SearchResult> batch = new ArrayList<>();
        long lastFlush = System.nanoTime();
        long flushIntervalNanos = settings.flushInterval().toNanos();

        while (!closed || !queue.isEmpty()) {
            try {
                SearchResult item = queue.poll(settings.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
                if (item != null) {
                    batch.add(item);
                }

                long now = System.nanoTime();
                boolean due = batch.size() >= settings.batchSize() || now - lastFlush > flushIntervalNanos;
                if (!batch.isEmpty() && due) {
                    flush(batch);
                    batch = new ArrayList<>();
                    lastFlush = System.nanoTime();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Index writer interrupted with {} results pending", batch.size() + queue.size());
                return;
            } catch (RuntimeException e) {
                discardedBatches.incrementAndGet();
                log.error("Index writer error, discarding batch of {}: {}", batch.size(), e.getMessage());
                batch = new ArrayList<>();
                lastFlush = System.nanoTime();
            }
        }

        if (!batch.isEmpty()) {
            try {
                flush(batch);
            } catch (RuntimeException e) {
                discardedBatches.incrementAndGet();
                log.error("Final flush failed, discarding batch of {}: {}", batch.size(), e.getMessage());
            }
        }
    }

    private void flush(List<SearchResult> batch) {
        List<IndexedDocument> documents = new ArrayList<>(batch.size());
        for (SearchResult result : batch) {
            documents.add(mapper.map(result, context));
        }

        for (IndexSink sink : sinks) {
            try {
                sink.indexBatch(documents);
                log.debug("Indexed {} docs to {}", documents.size(), sink.name());
            } catch (RuntimeException e) {
                log.warn("⚠️ Sink {} failed for batch of {}: {}", sink.name(), documents.size(), e.getMessage());
            }
        }
        indexedCount.addAndGet(batch.size());
    }

    /**
     * Stops intake and waits up to {@code timeout} for queued results to be flushed.
     *
     * @return true if the worker finished within the timeout
     */
    public boolean close(Duration timeout) {
        closed = true;
        worker.shutdown();
        try {
            boolean finished = worker.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("Index writer did not finish within {}ms, {} results still queued",
                        timeout.toMillis(), queue.size());
            }
            return finished;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void close() {
        close(Duration.ofSeconds(2));
    }

    public long getIndexedCount() {
        return indexedCount.get();
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    public long getDiscardedBatches() {
        return discardedBatches.get();
    }

    public boolean isClosed() {
        return closed;
    }
}
