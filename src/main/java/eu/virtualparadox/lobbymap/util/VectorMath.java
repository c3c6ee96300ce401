package eu.virtualparadox.lobbymap.util;

/**
 * Small dense-vector helpers shared by the chunker and the embedding adapters.
 */
public final class VectorMath {

    private VectorMath() {
        // prevent instantiation
    }

    /**
     * Cosine similarity in [-1, 1]; 0 when either vector has zero norm.
     */
    public static double cosine(final float[] a, final float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        final double cos = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, cos));
    }

    /**
     * Scales {@code vec} to unit length in place. Zero vectors are left untouched.
     */
    public static void normalize(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vec.length; i++) {
                vec[i] /= (float) norm;
            }
        }
    }

    /**
     * Adds {@code source} into {@code target} element-wise.
     */
    public static void addInPlace(final double[] target, final float[] source) {
        if (target.length != source.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + target.length + " vs " + source.length);
        }
        for (int i = 0; i < target.length; i++) {
            target[i] += source[i];
        }
    }

    /**
     * Mean of a running sum over {@code count} vectors.
     */
    public static float[] mean(final double[] sum, final int count) {
        final float[] mean = new float[sum.length];
        for (int i = 0; i < sum.length; i++) {
            mean[i] = (float) (sum[i] / count);
        }
        return mean;
    }
}
