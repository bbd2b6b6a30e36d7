package edu.umich.andykong.shiftlocalizer.localization;

import com.google.common.collect.ImmutableList;

public class BatchResult {
    private final LocalizationResult[] byIndex;
    private final ImmutableList<LocalizationResult> results;
    private final ImmutableList<LocalizationFailure> failures;
    private final int skipped;
    private final boolean cancelled;

    BatchResult(LocalizationResult[] byIndex, LocalizationFailure[] failuresByIndex, boolean cancelled) {
        this.byIndex = byIndex;
        this.cancelled = cancelled;
        ImmutableList.Builder<LocalizationResult> rb = ImmutableList.builder();
        ImmutableList.Builder<LocalizationFailure> fb = ImmutableList.builder();
        int nSkipped = 0;
        for (int i = 0; i < byIndex.length; i++) {
            if (byIndex[i] != null)
                rb.add(byIndex[i]);
            else if (failuresByIndex[i] != null)
                fb.add(failuresByIndex[i]);
            else
                nSkipped++;
        }
        this.results = rb.build();
        this.failures = fb.build();
        this.skipped = nSkipped;
    }

    /**
     * @return result of the i-th input PSM, null if it failed or was skipped
     */
    public LocalizationResult getResult(int i) {
        return byIndex[i];
    }

    public int size() {
        return byIndex.length;
    }

    /**
     * @return localized PSMs in input order
     */
    public ImmutableList<LocalizationResult> getResults() {
        return results;
    }

    /**
     * @return failed PSMs in input order
     */
    public ImmutableList<LocalizationFailure> getFailures() {
        return failures;
    }

    /**
     * @return number of PSMs never attempted because the batch was cancelled
     */
    public int getSkipped() {
        return skipped;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean hasFatalFailures() {
        for (LocalizationFailure f : failures)
            if (f.isFatal())
                return true;
        return false;
    }
}
