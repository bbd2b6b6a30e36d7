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

import edu.umich.andykong.shiftlocalizer.fragments.IonSeries;

/**
 * Ion ladders of one series under every placement of a mass shift.
 * Row k is the ladder with the shift anchored at boundary k, flattened charge-major:
 * column = chargeIdx * fragmentCount + fragmentIdx.
 */
public class HypothesisMatrix {
    private final IonSeries series;
    private final int nRows;
    private final int nFrags;
    private final int nCharges;
    private final double[] values;

    HypothesisMatrix(IonSeries series, int nFrags, int nCharges) {
        this.series = series;
        this.nRows = nFrags + 1;
        this.nFrags = nFrags;
        this.nCharges = nCharges;
        this.values = new double[nRows * nFrags * nCharges];
    }

    void set(int row, int col, double value) {
        values[row * getColumnCount() + col] = value;
    }

    public double get(int row, int col) {
        return values[row * getColumnCount() + col];
    }

    public double[] getRow(int row) {
        double[] out = new double[getColumnCount()];
        System.arraycopy(values, row * out.length, out, 0, out.length);
        return out;
    }

    public static int columnIndex(int frag, int chargeIdx, int nFrags) {
        return chargeIdx * nFrags + frag;
    }

    public IonSeries getSeries() {
        return series;
    }

    public int getRowCount() {
        return nRows;
    }

    public int getColumnCount() {
        return nFrags * nCharges;
    }

    public int getFragmentCount() {
        return nFrags;
    }

    public int getChargeCount() {
        return nCharges;
    }
}
