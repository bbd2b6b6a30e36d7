/*
 *    Copyright 2022 University of Michigan
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */

package edu.umich.andykong.shiftlocalizer.localization;

import edu.umich.andykong.shiftlocalizer.core.Spectrum;
import edu.umich.andykong.shiftlocalizer.fragments.IonLadder;
import edu.umich.andykong.shiftlocalizer.fragments.IonSeries;

/**
 * Hyperscore of every shift placement of a peptide against one spectrum:
 * ln(sum of matched sqrt intensities) + ln(nB!) + ln(nY!).
 */
public class ShiftedHyperscore {

    private ShiftedHyperscore() {
    }

    /**
     * ln(n!) as a running sum of logs, stays finite for large n
     */
    public static double logFactorial(int n) {
        if (n < 0)
            throw new IllegalArgumentException("Negative factorial argument " + n);
        double sum = 0;
        for (int i = 1; i <= n; i++)
            sum += Math.log(i);
        return sum;
    }

    public static ScoreVector score(IonLadder bIons, IonLadder yIons, Spectrum spec, double shiftMass,
                                    FragmentTolerance tol) {
        return score(ShiftHypotheses.enumerateShifts(bIons, shiftMass),
                ShiftHypotheses.enumerateShifts(yIons, shiftMass), spec, tol);
    }

    /**
     * Score every hypothesis row.
     * @param bHyp prefix series hypotheses
     * @param yHyp suffix series hypotheses, same row count as bHyp
     * @param spec observed spectrum
     * @param tol fragment tolerance
     * @return scores in hypothesis row order
     */
    public static ScoreVector score(HypothesisMatrix bHyp, HypothesisMatrix yHyp, Spectrum spec, FragmentTolerance tol) {
        if (bHyp.getSeries() != IonSeries.PREFIX || yHyp.getSeries() != IonSeries.SUFFIX)
            throw new IllegalArgumentException("Expected b and y hypotheses, got "
                    + bHyp.getSeries().getIonType() + " and " + yHyp.getSeries().getIonType());
        if (bHyp.getRowCount() != yHyp.getRowCount())
            throw new IllegalArgumentException(String.format("Hypothesis row counts differ: %d b, %d y",
                    bHyp.getRowCount(), yHyp.getRowCount()));

        int nPeaks = spec.size();
        double[] minMZ = new double[nPeaks];
        double[] maxMZ = new double[nPeaks];
        double[] sqrtInt = new double[nPeaks];
        for (int j = 0; j < nPeaks; j++) {
            double mz = spec.getPeakMZ(j);
            minMZ[j] = tol.lowerBound(mz);
            maxMZ[j] = tol.upperBound(mz);
            sqrtInt[j] = Math.sqrt(spec.getPeakInt(j));
        }

        int nRows = bHyp.getRowCount();
        double[] scores = new double[nRows];
        for (int row = 0; row < nRows; row++) {
            double dotSum = 0;
            int nB = 0;
            int nY = 0;
            for (int col = 0; col < bHyp.getColumnCount(); col++) {
                double matched = bestMatch(bHyp.get(row, col), minMZ, maxMZ, sqrtInt);
                if (matched > 0)
                    nB++;
                dotSum += matched;
            }
            for (int col = 0; col < yHyp.getColumnCount(); col++) {
                double matched = bestMatch(yHyp.get(row, col), minMZ, maxMZ, sqrtInt);
                if (matched > 0)
                    nY++;
                dotSum += matched;
            }
            double score = dotSum > 0 ? Math.log(dotSum) : 0;
            scores[row] = score + logFactorial(nB) + logFactorial(nY);
        }
        return new ScoreVector(scores);
    }

    // largest sqrt intensity among the peaks whose band holds the ion, 0 if none
    private static double bestMatch(double ion, double[] minMZ, double[] maxMZ, double[] sqrtInt) {
        double best = 0;
        for (int j = 0; j < minMZ.length; j++) {
            if (ion > minMZ[j] && ion < maxMZ[j] && sqrtInt[j] > best)
                best = sqrtInt[j];
        }
        return best;
    }
}
