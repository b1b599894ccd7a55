package com.campusagent.backend.service;

import com.campusagent.backend.util.VectorMath;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Local, deterministic text embedding.
 * <p>
 * Each text is mapped to hash-seeded noise plus a bias on dimension slices
 * reserved for a small dictionary of campus anchor terms, then L2-normalized.
 * The same text always produces a bit-identical vector. This is a placeholder
 * for a trained model, good enough to group texts that share anchor terms.
 */
@Service
public class TextVectorizer {

    public static final int DIMENSIONS = 384;

    static final List<String> ANCHOR_TERMS = List.of(
            "academic", "research", "library", "gym", "fitness",
            "dining", "food", "hours", "time", "schedule",
            "location", "building", "center", "facility", "service");

    private static final int DIMENSIONS_PER_ANCHOR = 20;
    private static final int MIN_TOKEN_LENGTH = 3;
    private static final double NOISE_AMPLITUDE = 0.1;
    private static final double ANCHOR_WEIGHT = 0.1;
    private static final double FUZZY_MATCH_THRESHOLD = 0.7;

    /**
     * Embed a single text. Blank input yields the zero vector.
     */
    public double[] embed(String text) {
        double[] embedding = new double[DIMENSIONS];
        if (text == null || text.isBlank()) {
            return embedding;
        }

        Random random = new Random(text.hashCode());
        for (int i = 0; i < embedding.length; i++) {
            embedding[i] = (random.nextDouble() * 2 - 1) * NOISE_AMPLITUDE;
        }

        double[] anchorCounts = countAnchors(tokenize(text));
        for (int anchor = 0; anchor < anchorCounts.length; anchor++) {
            if (anchorCounts[anchor] <= 0) {
                continue;
            }
            for (int i = 0; i < DIMENSIONS_PER_ANCHOR; i++) {
                int dimension = (anchor * DIMENSIONS_PER_ANCHOR + i) % DIMENSIONS;
                embedding[dimension] += anchorCounts[anchor] * ANCHOR_WEIGHT;
            }
        }

        return VectorMath.normalize(embedding);
    }

    /**
     * Embed several texts, one after another.
     */
    public List<double[]> embedBatch(List<String> texts) {
        List<double[]> embeddings = new ArrayList<>(texts.size());
        for (String text : texts) {
            embeddings.add(embed(text));
        }
        return embeddings;
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        for (String token : text.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (token.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private double[] countAnchors(List<String> tokens) {
        double[] counts = new double[ANCHOR_TERMS.size()];
        for (String token : tokens) {
            for (int anchor = 0; anchor < ANCHOR_TERMS.size(); anchor++) {
                String term = ANCHOR_TERMS.get(anchor);
                if (token.contains(term) || similarity(token, term) > FUZZY_MATCH_THRESHOLD) {
                    counts[anchor] += 1.0;
                }
            }
        }
        return counts;
    }

    /**
     * Edit-distance similarity in [0, 1]: 1 - distance / longer length.
     */
    static double similarity(String first, String second) {
        if (first.equals(second)) {
            return 1.0;
        }
        int longer = Math.max(first.length(), second.length());
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        return (longer - editDistance(first, second)) / (double) longer;
    }

    static int editDistance(String first, String second) {
        int[] previous = new int[second.length() + 1];
        int[] current = new int[second.length() + 1];
        for (int j = 0; j <= second.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= first.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= second.length(); j++) {
                int cost = first.charAt(i - 1) == second.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                        Math.min(previous[j] + 1, current[j - 1] + 1),
                        previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[second.length()];
    }
}
