package tsforecast.analysis;

import java.util.Arrays;

/**
 * Chronological train/test partition: train is [0, trainSize), test is [trainSize, length).
 */
public final class Split {

    private final int length;
    private final int trainSize;

    private Split(int length, int trainSize) {
        this.length = length;
        this.trainSize = trainSize;
    }

    /** trainSize = ⌊length × trainRatio⌋. */
    public static Split of(int length, double trainRatio) {
        int trainSize = (int) Math.floor(length * trainRatio);
        if (trainSize < 1 || trainSize >= length) {
            throw new IllegalArgumentException(
                "Split of " + length + " observations at ratio " + trainRatio + " leaves an empty segment");
        }
        return new Split(length, trainSize);
    }

    public int getLength() { return length; }
    public int getTrainSize() { return trainSize; }
    public int getTestSize() { return length - trainSize; }

    public double[] train(double[] values) {
        return Arrays.copyOfRange(values, 0, trainSize);
    }

    public double[] test(double[] values) {
        return Arrays.copyOfRange(values, trainSize, length);
    }
}
