package edu.umich.andykong.shiftlocalizer.localization;

/**
 * Asymmetric fragment tolerance in ppm. An ion matches an observed peak p when it lies strictly between
 * p + p*lowPpm/1e6 and p + p*highPpm/1e6.
 */
public class FragmentTolerance {
    private final double lowPpm;
    private final double highPpm;

    public FragmentTolerance(double lowPpm, double highPpm) {
        if (Double.isNaN(lowPpm) || Double.isNaN(highPpm) || lowPpm > highPpm)
            throw new IllegalArgumentException(String.format("Invalid fragment tolerance [%f, %f] ppm", lowPpm, highPpm));
        this.lowPpm = lowPpm;
        this.highPpm = highPpm;
    }

    public static FragmentTolerance symmetric(double ppm) {
        return new FragmentTolerance(-Math.abs(ppm), Math.abs(ppm));
    }

    public double getLowPpm() {
        return lowPpm;
    }

    public double getHighPpm() {
        return highPpm;
    }

    public double lowerBound(double peakMZ) {
        return peakMZ + (peakMZ * lowPpm) / 1e6;
    }

    public double upperBound(double peakMZ) {
        return peakMZ + (peakMZ * highPpm) / 1e6;
    }

    @Override
    public String toString() {
        return String.format("[%.2f, %.2f] ppm", lowPpm, highPpm);
    }
}
