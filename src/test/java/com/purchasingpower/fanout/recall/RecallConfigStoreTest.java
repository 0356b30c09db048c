package com.purchasingpower.fanout.recall;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecallConfigStoreTest {

    private final RecallConfigStore store = new RecallConfigStore();

    @TempDir
    Path tempDir;

    @Test
    void save_shouldWriteSnakeCaseJsonAndLoadBack() throws Exception {
        // Given
        Path file = tempDir.resolve("configs/precision.json");

        // When
        store.save(RecallConfig.precision(), file);

        // Then
        String json = Files.readString(file);
        assertThat(json).contains("\"recall_mode\"").contains("\"precision\"").contains("\"min_results_threshold\"");
        assertThat(store.load(file)).isEqualTo(RecallConfig.precision());
    }

    @Test
    void load_shouldFillMissingKeysWithBalancedDefaults() throws Exception {
        // Given
        Path file = tempDir.resolve("partial.json");
        Files.writeString(file, "{\"recall_mode\": \"maximum\", \"search_rounds\": 4}");

        // When
        RecallConfig config = store.load(file);

        // Then
        assertThat(config.getRecallMode()).isEqualTo(RecallMode.MAXIMUM);
        assertThat(config.getSearchRounds()).isEqualTo(4);
        assertThat(config.getMinResultsThreshold()).isEqualTo(10);
        assertThat(config.getFilteringLevel()).isEqualTo(FilteringLevel.MINIMAL);
    }

    @Test
    void loadPlanner_shouldUseStoredConfig() {
        Path file = tempDir.resolve("max.json");
        store.save(RecallConfig.maximumRecall(), file);

        RecallStrategyPlanner planner = store.loadPlanner(file);

        assertThat(planner.getConfig().getSearchRounds()).isEqualTo(5);
    }

    @Test
    void load_missingFile_shouldThrow() {
        assertThatThrownBy(() -> store.load(tempDir.resolve("nope.json")))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("nope.json");
    }
}
