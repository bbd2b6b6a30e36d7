package edu.umich.andykong.shiftlocalizer.localization;

import edu.umich.andykong.shiftlocalizer.fragments.IonLadder;
import edu.umich.andykong.shiftlocalizer.fragments.IonSeries;

public class ShiftHypotheses {

    private ShiftHypotheses() {
    }

    /**
     * Place a mass shift at every boundary of an ion ladder.
     * Prefix row k shifts the fragments with index < k, suffix row k shifts the fragments with index >= k,
     * so prefix row 0 and suffix row fragmentCount are the unshifted ladder.
     * @param ladder ion ladder of either series
     * @param shiftMass neutral mass shift, divided by the charge for each charge state
     * @return matrix with fragmentCount+1 rows
     */
    public static HypothesisMatrix enumerateShifts(IonLadder ladder, double shiftMass) {
        int nFrags = ladder.getFragmentCount();
        int nCharges = ladder.getChargeCount();
        boolean prefix = ladder.getSeries() == IonSeries.PREFIX;
        HypothesisMatrix hyp = new HypothesisMatrix(ladder.getSeries(), nFrags, nCharges);

        for (int k = 0; k <= nFrags; k++) {
            for (int c = 0; c < nCharges; c++) {
                double shift = shiftMass / (c + 1);
                for (int i = 0; i < nFrags; i++) {
                    boolean shifted = prefix ? i < k : i >= k;
                    double mz = ladder.get(i, c);
                    if (shifted)
                        mz += shift;
                    hyp.set(k, HypothesisMatrix.columnIndex(i, c, nFrags), mz);
                }
            }
        }
        return hyp;
    }
}
