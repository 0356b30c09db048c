package com.purchasingpower.fanout.recall;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link RecallConfig} as JSON files.
 *
 * <p>Missing keys in a loaded file fall back to the balanced defaults.
 */
@Slf4j
public class RecallConfigStore {

    private final ObjectMapper objectMapper;

    public RecallConfigStore() {
        this(new ObjectMapper());
    }

    public RecallConfigStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void save(RecallConfig config, Path file) {
        Preconditions.checkNotNull(config, "Config cannot be null");
        Preconditions.checkNotNull(file, "File cannot be null");
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            objectMapper.writeValue(file.toFile(), config);
            log.info("Saved recall config ({}) to {}", config.getRecallMode().value(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save recall config to " + file, e);
        }
    }

    public RecallConfig load(Path file) {
        Preconditions.checkNotNull(file, "File cannot be null");
        try {
            RecallConfig config = objectMapper.readValue(file.toFile(), RecallConfig.class);
            log.info("Loaded recall config ({}) from {}", config.getRecallMode().value(), file);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load recall config from " + file, e);
        }
    }

    /**
     * Convenience for building a planner straight from a saved file.
     */
    public RecallStrategyPlanner loadPlanner(Path file) {
        return new RecallStrategyPlanner(load(file));
    }
}
