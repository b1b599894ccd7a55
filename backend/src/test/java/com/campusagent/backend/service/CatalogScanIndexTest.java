package com.campusagent.backend.service;

import com.campusagent.backend.model.CatalogEntry;
import com.campusagent.backend.model.ScoredEntry;
import com.campusagent.backend.repository.CatalogEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CatalogScanIndexTest {

    private static final double[] QUERY = {1, 0, 0};

    private CatalogEntryRepository repository;
    private TextVectorizer vectorizer;
    private CatalogScanIndex index;

    @BeforeEach
    void setUp() {
        repository = mock(CatalogEntryRepository.class);
        vectorizer = mock(TextVectorizer.class);
        index = new CatalogScanIndex(repository, vectorizer, 0.1);
    }

    @Test
    void ranksByCosineAndDropsLowScores() {
        when(repository.findAll()).thenReturn(List.of(
                entry("c", 0.6, 0.8, 0.0),
                entry("orthogonal", 0.0, 1.0, 0.0),
                entry("a", 1.0, 0.0, 0.0),
                entry("borderline", 0.1, 0.995, 0.0),
                entry("b", 0.8, 0.6, 0.0),
                entry("short", 1.0, 0.0)));

        List<ScoredEntry> results = index.search(QUERY, 5);

        assertThat(results).extracting(r -> r.entry().getTitle()).containsExactly("a", "b", "c");
        assertThat(results.get(0).score()).isCloseTo(1.0, within(1e-9));
        assertThat(results.get(1).score()).isCloseTo(0.8, within(1e-9));
        assertThat(results.get(2).score()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void capsResultsAtLimit() {
        when(repository.findAll()).thenReturn(List.of(
                entry("a", 1.0, 0.0, 0.0),
                entry("b", 0.8, 0.6, 0.0),
                entry("c", 0.6, 0.8, 0.0)));

        assertThat(index.search(QUERY, 2)).extracting(r -> r.entry().getTitle()).containsExactly("a", "b");
        assertThat(index.search(QUERY, 0)).isEmpty();
    }

    @Test
    void emptyCatalogYieldsNoMatches() {
        when(repository.findAll()).thenReturn(List.of());

        assertThat(index.search(QUERY, 3)).isEmpty();
    }

    @Test
    void usesStoredEmbeddingsWithoutReembedding() {
        when(repository.findAll()).thenReturn(List.of(entry("a", 1.0, 0.0, 0.0)));

        index.search(QUERY, 3);

        verify(vectorizer, never()).embed(anyString());
    }

    @Test
    void embedsEntriesThatHaveNoStoredEmbedding() {
        CatalogEntry withoutEmbedding = CatalogEntry.builder()
                .title("Gym")
                .description("Fitness center")
                .category("Recreation")
                .build();
        when(repository.findAll()).thenReturn(List.of(withoutEmbedding));
        when(vectorizer.embed("Gym Fitness center Recreation")).thenReturn(new double[]{0.9, 0.1, 0.0});

        List<ScoredEntry> results = index.search(QUERY, 3);

        assertThat(results).hasSize(1);
        verify(vectorizer).embed("Gym Fitness center Recreation");
    }

    @Test
    void repositoryFailureYieldsEmptyList() {
        when(repository.findAll()).thenThrow(new IllegalStateException("connection reset"));

        assertThat(index.search(QUERY, 3)).isEmpty();
    }

    @Test
    void neverExceedsLimitOrThreshold() {
        Random random = new Random(42);
        for (int size = 0; size <= 40; size += 8) {
            List<CatalogEntry> catalog = new ArrayList<>();
            for (int i = 0; i < size; i++) {
                catalog.add(entry("e" + i, random.nextGaussian(), random.nextGaussian(), random.nextGaussian()));
            }
            when(repository.findAll()).thenReturn(catalog);

            for (int limit = 1; limit <= 5; limit++) {
                List<ScoredEntry> results = index.search(QUERY, limit);

                assertThat(results).hasSizeLessThanOrEqualTo(limit);
                assertThat(results).allSatisfy(r -> assertThat(r.score()).isGreaterThan(0.1));
                for (int i = 1; i < results.size(); i++) {
                    assertThat(results.get(i - 1).score()).isGreaterThanOrEqualTo(results.get(i).score());
                }
            }
        }
    }

    private static CatalogEntry entry(String title, double... embedding) {
        List<Double> vector = new ArrayList<>();
        for (double v : embedding) {
            vector.add(v);
        }
        return CatalogEntry.builder()
                .id(title)
                .title(title)
                .url("https://example.edu/" + title)
                .embedding(vector)
                .build();
    }
}
