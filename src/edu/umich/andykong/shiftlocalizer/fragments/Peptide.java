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

package edu.umich.andykong.shiftlocalizer.fragments;

import edu.umich.andykong.shiftlocalizer.core.ResidueMasses;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.regex.Pattern;

/**
 * A peptide parsed from an annotated sequence such as "LES[+79.966]LIEK" or "LES+79.966LIEK".
 * Inline modification masses are folded into the residue they follow.
 */
public class Peptide {
    private static final Pattern deltaPattern = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)$");

    public final String pepSeq; // residues only
    public final double[] mods; // summed inline deltas per residue, 0 indexed
    private final double[] residueMasses;

    private Peptide(String pepSeq, double[] mods) {
        this.pepSeq = pepSeq;
        this.mods = mods;
        this.residueMasses = new double[pepSeq.length()];
        for (int i = 0; i < pepSeq.length(); i++)
            this.residueMasses[i] = ResidueMasses.getMass(pepSeq.charAt(i)) + mods[i];
    }

    public static Peptide parse(@NotNull String seq) throws MalformedPeptideException {
        StringBuilder aas = new StringBuilder(seq.length());
        ArrayList<Double> mods = new ArrayList<>(seq.length());

        int i = 0;
        while (i < seq.length()) {
            char c = seq.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                if (!ResidueMasses.isResidue(c))
                    throw new MalformedPeptideException("Unknown residue '" + c + "'", seq, i);
                aas.append(c);
                mods.add(0.0);
                i++;
            } else if (c == '[') {
                int end = seq.indexOf(']', i);
                if (end < 0)
                    throw new MalformedPeptideException("Unterminated modification", seq, i);
                double delta = parseDelta(seq.substring(i + 1, end).trim(), seq, i);
                addMod(mods, delta, seq, i);
                i = end + 1;
            } else if (c == '+' || c == '-') {
                int end = i + 1;
                while (end < seq.length() && (Character.isDigit(seq.charAt(end)) || seq.charAt(end) == '.'))
                    end++;
                double delta = parseDelta(seq.substring(i, end), seq, i);
                addMod(mods, delta, seq, i);
                i = end;
            } else {
                throw new MalformedPeptideException("Unexpected character '" + c + "'", seq, i);
            }
        }
        if (aas.length() == 0)
            throw new MalformedPeptideException("No residues", seq, 0);

        double[] modArr = new double[mods.size()];
        for (int j = 0; j < modArr.length; j++)
            modArr[j] = mods.get(j);
        return new Peptide(aas.toString(), modArr);
    }

    private static double parseDelta(String s, String seq, int pos) throws MalformedPeptideException {
        if (!deltaPattern.matcher(s).matches())
            throw new MalformedPeptideException("Invalid modification mass \"" + s + "\"", seq, pos);
        return Double.parseDouble(s);
    }

    private static void addMod(ArrayList<Double> mods, double delta, String seq, int pos) throws MalformedPeptideException {
        if (mods.isEmpty())
            throw new MalformedPeptideException("Modification before first residue", seq, pos);
        int last = mods.size() - 1;
        mods.set(last, mods.get(last) + delta);
    }

    public int length() {
        return residueMasses.length;
    }

    public double getResidueMass(int i) {
        return residueMasses[i];
    }

    public double[] getResidueMasses() {
        return residueMasses.clone();
    }

    /**
     * Fragment charge states considered for a precursor, 1 for singly charged precursors and 1..2 otherwise
     */
    public static int maxFragmentCharge(int precursorCharge) {
        return Math.min(precursorCharge, 2);
    }

    /**
     * Calculate the b and y ladders of this peptide.
     * @param precursorCharge precursor charge, decides which fragment charge states are included
     * @return b ladder on the left, y ladder on the right, each with length()-1 fragments
     */
    public ImmutablePair<IonLadder, IonLadder> calculateFragments(int precursorCharge) {
        if (precursorCharge < 1)
            throw new IllegalArgumentException("Precursor charge must be positive, got " + precursorCharge);
        int maxCharge = maxFragmentCharge(precursorCharge);
        int nIons = residueMasses.length - 1;

        IonLadder bIons = new IonLadder(IonSeries.PREFIX, nIons, maxCharge);
        IonLadder yIons = new IonLadder(IonSeries.SUFFIX, nIons, maxCharge);

        double bMass = 0;
        double yMass = ResidueMasses.H2O;
        for (int i = 0; i < nIons; i++) {
            bMass += residueMasses[i];
            yMass += residueMasses[residueMasses.length - 1 - i];
            for (int ccharge = 1; ccharge <= maxCharge; ccharge++) {
                bIons.set(i, ccharge - 1, ResidueMasses.neutralMassToMZ(bMass, ccharge));
                yIons.set(i, ccharge - 1, ResidueMasses.neutralMassToMZ(yMass, ccharge));
            }
        }
        return new ImmutablePair<>(bIons, yIons);
    }

    public static ImmutablePair<IonLadder, IonLadder> fragment(@NotNull String seq, int precursorCharge)
            throws MalformedPeptideException {
        return parse(seq).calculateFragments(precursorCharge);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < pepSeq.length(); i++) {
            sb.append(pepSeq.charAt(i));
            if (mods[i] != 0)
                sb.append(String.format("[%+.4f]", mods[i]));
        }
        return sb.toString();
    }
}
