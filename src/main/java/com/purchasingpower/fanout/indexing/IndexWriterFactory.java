package com.purchasingpower.fanout.indexing;

import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Creates one started {@link BackgroundIndexWriter} per search run, sharing the configured sinks.
 */
@RequiredArgsConstructor
public class IndexWriterFactory {

    private final List<IndexSink> sinks;
    private final DocumentMapper mapper;
    private final BackgroundIndexWriter.Settings settings;

    public BackgroundIndexWriter start(IndexContext context) {
        return new BackgroundIndexWriter(sinks, mapper, context, settings).start();
    }
}
