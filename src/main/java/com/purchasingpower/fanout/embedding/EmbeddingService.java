package com.purchasingpower.fanout.embedding;

import java.util.List;

/**
 * Turns text into dense vectors for the vector index sink.
 */
public interface EmbeddingService {

    List<Float> embed(String text);

    /**
     * Embeds texts in one batch; the result has the same size and order as the input.
     */
    List<List<Float>> embedAll(List<String> texts);
}
