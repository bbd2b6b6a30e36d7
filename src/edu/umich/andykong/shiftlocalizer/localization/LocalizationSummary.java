package edu.umich.andykong.shiftlocalizer.localization;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.EnumMap;

/**
 * Run statistics of a localization batch.
 */
public class LocalizationSummary {
    private final int total;
    private final int skipped;
    private final DescriptiveStatistics scores;
    private final DescriptiveStatistics deltaScores;
    private final EnumMap<LocalizationFailure.Type, Integer> failureCounts;
    private int ambiguous; // best and runner-up tied

    public LocalizationSummary(BatchResult br) {
        this.total = br.size();
        this.skipped = br.getSkipped();
        this.scores = new DescriptiveStatistics();
        this.deltaScores = new DescriptiveStatistics();
        this.failureCounts = new EnumMap<>(LocalizationFailure.Type.class);
        for (LocalizationFailure.Type t : LocalizationFailure.Type.values())
            failureCounts.put(t, 0);

        for (LocalizationResult r : br.getResults()) {
            scores.addValue(r.getScore());
            deltaScores.addValue(r.getDeltaScore());
            if (r.getDeltaScore() == 0)
                ambiguous++;
        }
        for (LocalizationFailure f : br.getFailures())
            failureCounts.put(f.getType(), failureCounts.get(f.getType()) + 1);
    }

    public int getLocalized() {
        return (int) scores.getN();
    }

    public int getAmbiguous() {
        return ambiguous;
    }

    public int getFailures(LocalizationFailure.Type type) {
        return failureCounts.get(type);
    }

    public double getMeanDeltaScore() {
        return deltaScores.getMean();
    }

    public double getMedianDeltaScore() {
        return deltaScores.getPercentile(50);
    }

    public double getMedianScore() {
        return scores.getPercentile(50);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Localized %d/%d PSMs (%d tied between positions)", getLocalized(), total, ambiguous));
        if (getLocalized() > 0)
            sb.append(String.format("\n\tmedian shifted hyperscore %.3f, median delta %.3f, mean delta %.3f",
                    getMedianScore(), getMedianDeltaScore(), getMeanDeltaScore()));
        for (LocalizationFailure.Type t : failureCounts.keySet())
            if (failureCounts.get(t) > 0)
                sb.append(String.format("\n\t%s: %d", t, failureCounts.get(t)));
        if (skipped > 0)
            sb.append(String.format("\n\tskipped after cancellation: %d", skipped));
        return sb.toString();
    }
}
