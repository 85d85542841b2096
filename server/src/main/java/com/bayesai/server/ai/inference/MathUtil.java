package com.bayesai.server.ai.inference;

public class MathUtil {

    /**
     * Divides every weight by {@code denominator}.
     */
    public static double[] normalize(double[] weights, double denominator) {
        if (denominator <= 0) {
            throw new IllegalArgumentException("Denominator must be positive");
        }
        double[] probs = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            probs[i] = weights[i] / denominator;
        }
        return probs;
    }

    public static double sum(double[] weights) {
        double total = 0.0;
        for (double w : weights) {
            total += w;
        }
        return total;
    }

    /**
     * Shannon entropy in nats. Entries at or below 1e-12 count as zero mass.
     */
    public static double entropy(double[] probs) {
        double h = 0.0;
        for (double p : probs) {
            if (p > 1e-12) {
                h -= p * Math.log(p);
            }
        }
        return h;
    }

    /**
     * Position of the largest entry, -1 for an empty array. Ties go to the lower index.
     */
    public static int argmax(double[] values) {
        int best = -1;
        double bestValue = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < values.length; i++) {
            if (values[i] > bestValue) {
                bestValue = values[i];
                best = i;
            }
        }
        return best;
    }
}
