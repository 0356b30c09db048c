package com.purchasingpower.fanout.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.fanout.orchestrator.QuerySyntaxException;
import com.purchasingpower.fanout.orchestrator.SearchCommand;
import com.purchasingpower.fanout.orchestrator.SearchEvent;
import com.purchasingpower.fanout.orchestrator.StreamingSearchOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a search on the stream executor and forwards every run event to an SSE emitter.
 *
 * <p>Failures are reported as an {@code error} event followed by a normal completion, never
 * through {@code completeWithError}. A client that disconnects stops receiving events; the run
 * itself finishes in the background so indexing is not cut short.
 */
@Slf4j
@Service
public class SearchStreamService {

    static final String EVENT_NAME = "search-update";
    private static final long SSE_TIMEOUT_MS = 15 * 60 * 1000;

    private final StreamingSearchOrchestrator orchestrator;
    private final ObjectMapper objectMapper;
    private final Executor streamExecutor;

    public SearchStreamService(StreamingSearchOrchestrator orchestrator,
                               ObjectMapper objectMapper,
                               @Qualifier("streamExecutor") Executor streamExecutor) {
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
        this.streamExecutor = streamExecutor;
    }

    public SseEmitter stream(SearchCommand command) {
        String streamId = UUID.randomUUID().toString();
        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        AtomicBoolean open = new AtomicBoolean(true);

        emitter.onCompletion(() -> open.set(false));
        emitter.onTimeout(() -> {
            log.warn("SSE stream {} timed out", streamId);
            open.set(false);
        });
        emitter.onError(ex -> open.set(false));

        log.info("📡 Search stream {} opened for '{}'", streamId, command.getQuery());
        streamExecutor.execute(() -> {
            try {
                orchestrator.execute(command, event -> send(streamId, emitter, open, event));
            } catch (QuerySyntaxException e) {
                send(streamId, emitter, open, SearchEvent.error(e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Search stream {} failed", streamId, e);
                send(streamId, emitter, open, SearchEvent.error("Search failed: " + e.getMessage()));
            } finally {
                if (open.compareAndSet(true, false)) {
                    emitter.complete();
                }
                log.debug("Search stream {} closed", streamId);
            }
        });
        return emitter;
    }

    /**
     * Emitter that delivers a single {@code error} event and completes.
     */
    public SseEmitter rejected(String message) {
        SseEmitter emitter = new SseEmitter(5000L);
        AtomicBoolean open = new AtomicBoolean(true);
        send("rejected", emitter, open, SearchEvent.error(message));
        emitter.complete();
        return emitter;
    }

    private void send(String streamId, SseEmitter emitter, AtomicBoolean open, SearchEvent event) {
        if (!open.get()) {
            return;
        }
        try {
            emitter.send(SseEmitter.event()
                    .id(UUID.randomUUID().toString())
                    .name(EVENT_NAME)
                    .data(objectMapper.writeValueAsString(event)));
        } catch (IOException | IllegalStateException e) {
            log.warn("SSE stream {} aborted by client ({}), run continues without it", streamId, e.getMessage());
            open.set(false);
        }
    }
}
