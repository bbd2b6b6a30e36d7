package edu.umich.andykong.shiftlocalizer.localization;

public class LocalizationResult {
    private final String recordId;
    private final int position;
    private final double score;
    private final double deltaScore;

    public LocalizationResult(String recordId, int position, double score, double deltaScore) {
        this.recordId = recordId;
        this.position = position;
        this.score = score;
        this.deltaScore = deltaScore;
    }

    public String getRecordId() {
        return recordId;
    }

    /**
     * @return 0 indexed residue carrying the mass shift
     */
    public int getPosition() {
        return position;
    }

    public double getScore() {
        return score;
    }

    /**
     * @return score of the best position minus score of the runner-up, never negative
     */
    public double getDeltaScore() {
        return deltaScore;
    }

    @Override
    public String toString() {
        return String.format("%s\t%d\t%.4f\t%.4f", recordId, position, score, deltaScore);
    }
}
