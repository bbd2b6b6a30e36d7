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

package edu.umich.andykong.shiftlocalizer.core;

/**
 * One peptide-spectrum match as read from a PSM table.
 */
public class PsmRecord {
    private final String recordId;
    private final String scanId;
    private final String sequence;
    private final int charge;
    private final double expMass;
    private final double calcMass;

    public PsmRecord(String recordId, String scanId, String sequence, int charge, double expMass, double calcMass) {
        if (charge < 1)
            throw new IllegalArgumentException(String.format("[%s] precursor charge must be positive, got %d",
                    recordId, charge));
        this.recordId = recordId;
        this.scanId = scanId;
        this.sequence = sequence;
        this.charge = charge;
        this.expMass = expMass;
        this.calcMass = calcMass;
    }

    public String getRecordId() {
        return recordId;
    }

    public String getScanId() {
        return scanId;
    }

    public String getSequence() {
        return sequence;
    }

    public int getCharge() {
        return charge;
    }

    public double getExpMass() {
        return expMass;
    }

    public double getCalcMass() {
        return calcMass;
    }

    public double getDeltaMass() {
        return expMass - calcMass;
    }

    @Override
    public String toString() {
        return String.format("%s (%s, %s, +%d, %.4f)", recordId, scanId, sequence, charge, getDeltaMass());
    }
}
