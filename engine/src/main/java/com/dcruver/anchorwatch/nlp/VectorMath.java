package com.dcruver.anchorwatch.nlp;

import java.util.List;

/**
 * Plain-array vector arithmetic shared by the compositor and the matcher.
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity in [-1, 1]; zero when either vector has no magnitude
     */
    public static double cosineSimilarity(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                String.format("Vectors must have same dimension (%d vs %d)", a.length, b.length));
        }

        double dotProduct = 0.0;
        double norm1 = 0.0;
        double norm2 = 0.0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            norm1 += a[i] * a[i];
            norm2 += b[i] * b[i];
        }

        if (norm1 == 0.0 || norm2 == 0.0) {
            return 0.0;
        }
        return dotProduct / (Math.sqrt(norm1) * Math.sqrt(norm2));
    }

    /**
     * Arithmetic mean of equally sized vectors, summed in list order.
     */
    public static double[] centroid(List<double[]> vectors) {
        if (vectors == null || vectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot average an empty vector set");
        }

        int dimension = vectors.get(0).length;
        double[] sum = new double[dimension];
        for (double[] vector : vectors) {
            if (vector.length != dimension) {
                throw new IllegalArgumentException(
                    String.format("Vectors must have same dimension (%d vs %d)", dimension, vector.length));
            }
            for (int i = 0; i < dimension; i++) {
                sum[i] += vector[i];
            }
        }

        for (int i = 0; i < dimension; i++) {
            sum[i] /= vectors.size();
        }
        return sum;
    }

    public static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
