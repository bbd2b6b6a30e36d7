package edu.umich.andykong.shiftlocalizer.fragments;

/**
 * Fragment m/z values of one ion series, indexed by (fragment, charge).
 * Fragment i of the prefix series holds residues 0..i, fragment i of the suffix series holds the last i+1 residues.
 * Charge index c is charge state c+1.
 */
public class IonLadder {
    private final IonSeries series;
    private final int nFrags;
    private final int nCharges;
    private final double[] mz; // fragment-major

    IonLadder(IonSeries series, int nFrags, int nCharges) {
        this.series = series;
        this.nFrags = nFrags;
        this.nCharges = nCharges;
        this.mz = new double[nFrags * nCharges];
    }

    void set(int frag, int chargeIdx, double value) {
        mz[frag * nCharges + chargeIdx] = value;
    }

    public double get(int frag, int chargeIdx) {
        return mz[frag * nCharges + chargeIdx];
    }

    public IonSeries getSeries() {
        return series;
    }

    public int getFragmentCount() {
        return nFrags;
    }

    public int getChargeCount() {
        return nCharges;
    }

    /**
     * @return all m/z values of one charge state, in fragment order
     */
    public double[] getCharge(int chargeIdx) {
        double[] out = new double[nFrags];
        for (int i = 0; i < nFrags; i++)
            out[i] = get(i, chargeIdx);
        return out;
    }
}
