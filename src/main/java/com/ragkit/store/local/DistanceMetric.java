package com.ragkit.store.local;

import java.util.Locale;

public enum DistanceMetric {
    COSINE {
        @Override
        double distance(float[] a, float[] b) {
            double dot = 0;
            double aNorm = 0;
            double bNorm = 0;
            for (int i = 0; i < a.length; i++) {
                dot += a[i] * b[i];
                aNorm += a[i] * a[i];
                bNorm += b[i] * b[i];
            }
            if (aNorm == 0 || bNorm == 0) {
                return 1.0;
            }
            return 1.0 - dot / Math.sqrt(aNorm * bNorm);
        }
    },
    // squared euclidean, the same ordering as L2 without the square root
    L2 {
        @Override
        double distance(float[] a, float[] b) {
            double sum = 0;
            for (int i = 0; i < a.length; i++) {
                double diff = a[i] - b[i];
                sum += diff * diff;
            }
            return sum;
        }
    },
    IP {
        @Override
        double distance(float[] a, float[] b) {
            double dot = 0;
            for (int i = 0; i < a.length; i++) {
                dot += a[i] * b[i];
            }
            return 1.0 - dot;
        }
    };

    abstract double distance(float[] a, float[] b);

    public static DistanceMetric parse(String value) {
        if (value == null || value.isBlank()) {
            return COSINE;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "cosine" -> COSINE;
            case "l2" -> L2;
            case "ip" -> IP;
            default -> throw new IllegalArgumentException("Unknown distance metric: " + value + " (expected cosine, l2 or ip)");
        };
    }
}
