package edu.umich.andykong.shiftlocalizer.localization;

import java.util.Arrays;

/**
 * Immutable scores, one per localization hypothesis.
 */
public class ScoreVector {
    private final double[] scores;

    ScoreVector(double[] scores) {
        this.scores = scores;
    }

    public static ScoreVector of(double... scores) {
        return new ScoreVector(scores.clone());
    }

    public double get(int i) {
        return scores[i];
    }

    public int size() {
        return scores.length;
    }

    public double[] toArray() {
        return scores.clone();
    }

    public ScoreVector reverse() {
        double[] out = new double[scores.length];
        for (int i = 0; i < scores.length; i++)
            out[i] = scores[scores.length - 1 - i];
        return new ScoreVector(out);
    }

    /**
     * @return index of the highest score and index of the runner-up; ties go to the lower index
     */
    public int[] topTwo() {
        if (scores.length < 2)
            throw new IllegalStateException("Need at least two scores, got " + scores.length);
        int best = -1;
        int second = -1;
        for (int i = 0; i < scores.length; i++) {
            if (best < 0 || scores[i] > scores[best]) {
                second = best;
                best = i;
            } else if (second < 0 || scores[i] > scores[second]) {
                second = i;
            }
        }
        return new int[]{best, second};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScoreVector))
            return false;
        return Arrays.equals(scores, ((ScoreVector) o).scores);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(scores);
    }

    @Override
    public String toString() {
        return Arrays.toString(scores);
    }
}
