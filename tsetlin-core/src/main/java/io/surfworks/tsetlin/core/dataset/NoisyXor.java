package io.surfworks.tsetlin.core.dataset;

import io.surfworks.tsetlin.core.classifier.BinaryMatrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SplittableRandom;

/**
 * Synthetic benchmark: random binary features whose label is the XOR of the
 * first few, with a fixed fraction of labels flipped.
 *
 * <p>Labels are flipped on distinct rows chosen by a partial Fisher-Yates
 * shuffle, so exactly {@code (int) (noise * samples)} labels are wrong.
 *
 * @param samples     number of rows
 * @param features    number of binary features
 * @param xorFeatures leading features that determine the clean label
 * @param noise       fraction of labels to flip, in [0, 1]
 * @param seed        generator seed
 */
public record NoisyXor(int samples, int features, int xorFeatures, double noise, long seed) {

    public static final int DEFAULT_SAMPLES = 5000;
    public static final int DEFAULT_FEATURES = 12;
    public static final int DEFAULT_XOR_FEATURES = 2;
    public static final double DEFAULT_NOISE = 0.1;
    public static final long DEFAULT_SEED = 42L;

    public NoisyXor {
        if (samples < 1 || features < 1) {
            throw new IllegalArgumentException("samples and features must be positive");
        }
        if (xorFeatures < 1 || xorFeatures > features) {
            throw new IllegalArgumentException(
                    "xorFeatures must be in [1, " + features + "], got " + xorFeatures);
        }
        if (!(noise >= 0.0 && noise <= 1.0)) {
            throw new IllegalArgumentException("noise must be in [0, 1], got " + noise);
        }
    }

    public static NoisyXor defaults() {
        return new NoisyXor(DEFAULT_SAMPLES, DEFAULT_FEATURES, DEFAULT_XOR_FEATURES, DEFAULT_NOISE, DEFAULT_SEED);
    }

    public NoisyXor withSamples(int n) {
        return new NoisyXor(n, features, xorFeatures, noise, seed);
    }

    public NoisyXor withNoise(double level) {
        return new NoisyXor(samples, features, xorFeatures, level, seed);
    }

    public NoisyXor withSeed(long s) {
        return new NoisyXor(samples, features, xorFeatures, noise, s);
    }

    /**
     * Generates the dataset. Equal parameters always yield equal data.
     */
    public Dataset generate() {
        SplittableRandom random = new SplittableRandom(seed);
        byte[] x = new byte[samples * features];
        int[] clean = new int[samples];
        for (int i = 0; i < samples; i++) {
            int label = 0;
            for (int j = 0; j < features; j++) {
                int bit = random.nextInt(2);
                x[i * features + j] = (byte) bit;
                if (j < xorFeatures) {
                    label ^= bit;
                }
            }
            clean[i] = label;
        }

        int[] labels = clean.clone();
        int flips = (int) (noise * samples);
        int[] indices = new int[samples];
        for (int i = 0; i < samples; i++) {
            indices[i] = i;
        }
        for (int i = 0; i < flips; i++) {
            int j = i + random.nextInt(samples - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            labels[indices[i]] = 1 - labels[indices[i]];
        }

        List<Integer> y = new ArrayList<>(samples);
        List<Integer> yClean = new ArrayList<>(samples);
        for (int i = 0; i < samples; i++) {
            y.add(labels[i]);
            yClean.add(clean[i]);
        }
        return new Dataset(BinaryMatrix.wrap(x, samples, features),
                Collections.unmodifiableList(y), Collections.unmodifiableList(yClean));
    }

    /**
     * Generated rows with noisy and clean labels.
     */
    public record Dataset(BinaryMatrix x, List<Integer> y, List<Integer> cleanY) {

        /**
         * Splits rows [0, n) and [n, rows) into train and test parts.
         */
        public Split split(int trainRows) {
            int rows = x.rows();
            if (trainRows < 1 || trainRows >= rows) {
                throw new IllegalArgumentException("trainRows must be in [1, " + (rows - 1) + "]");
            }
            int cols = x.columns();
            byte[] data = x.data();
            byte[] train = new byte[trainRows * cols];
            byte[] test = new byte[(rows - trainRows) * cols];
            System.arraycopy(data, 0, train, 0, train.length);
            System.arraycopy(data, train.length, test, 0, test.length);
            return new Split(
                    new Dataset(BinaryMatrix.wrap(train, trainRows, cols),
                            y.subList(0, trainRows), cleanY.subList(0, trainRows)),
                    new Dataset(BinaryMatrix.wrap(test, rows - trainRows, cols),
                            y.subList(trainRows, rows), cleanY.subList(trainRows, rows)));
        }
    }

    public record Split(Dataset train, Dataset test) {}
}
