package com.campusagent.backend.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Vector helpers shared by the vectorizer and the similarity indexes.
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity of two vectors. Zero when either vector has zero norm
     * or the lengths differ.
     */
    public static double cosineSimilarity(double[] a, double[] b) {
        if (a == null || b == null || a.length != b.length) {
            return 0.0;
        }

        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    public static double norm(double[] vector) {
        double sum = 0.0;
        for (double v : vector) {
            sum += v * v;
        }
        return Math.sqrt(sum);
    }

    /**
     * Scales the vector to unit length in place. A zero vector is left as is.
     */
    public static double[] normalize(double[] vector) {
        double magnitude = norm(vector);
        if (magnitude > 0.0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= magnitude;
            }
        }
        return vector;
    }

    public static List<Double> toList(double[] vector) {
        List<Double> list = new ArrayList<>(vector.length);
        for (double v : vector) {
            list.add(v);
        }
        return list;
    }

    public static double[] toArray(List<Double> vector) {
        if (vector == null) {
            return new double[0];
        }
        double[] array = new double[vector.size()];
        for (int i = 0; i < array.length; i++) {
            Double v = vector.get(i);
            array[i] = v != null ? v : 0.0;
        }
        return array;
    }
}
