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

import edu.umich.andykong.shiftlocalizer.core.LocalizationException;
import edu.umich.andykong.shiftlocalizer.core.PsmRecord;
import edu.umich.andykong.shiftlocalizer.core.Spectrum;
import edu.umich.andykong.shiftlocalizer.core.SpectrumNotFoundException;
import edu.umich.andykong.shiftlocalizer.core.SpectrumSource;
import edu.umich.andykong.shiftlocalizer.fragments.IonLadder;
import edu.umich.andykong.shiftlocalizer.fragments.MalformedPeptideException;
import edu.umich.andykong.shiftlocalizer.fragments.Peptide;
import org.apache.commons.lang3.tuple.ImmutablePair;

/**
 * Localizes the open search mass shift of single PSMs. Holds no per-PSM state, safe to share between threads.
 */
public class ShiftLocalization {
    private final SpectrumSource spectra;
    private final FragmentTolerance tol;

    public ShiftLocalization(SpectrumSource spectra, FragmentTolerance tol) {
        this.spectra = spectra;
        this.tol = tol;
    }

    public LocalizationResult localize(PsmRecord psm) throws LocalizationException {
        Peptide pep;
        try {
            pep = Peptide.parse(psm.getSequence());
        } catch (MalformedPeptideException e) {
            throw e.forRecord(psm.getRecordId());
        }
        if (pep.length() < 2)
            throw new DegenerateLadderException(psm.getSequence(), pep.length(), psm.getRecordId());

        Spectrum spec = spectra.getSpectrum(psm.getScanId());
        if (spec == null)
            throw new SpectrumNotFoundException(psm.getScanId(), psm.getRecordId());

        ScoreVector scores = scorePositions(pep, psm.getCharge(), spec, psm.getDeltaMass(), tol);
        int[] top = scores.topTwo();
        double best = scores.get(top[0]);
        return new LocalizationResult(psm.getRecordId(), top[0], best, best - scores.get(top[1]));
    }

    /**
     * Score the mass shift on every residue of a peptide.
     * Hypothesis row k places the shift on the suffix ions from boundary k on, which is the shift sitting on
     * residue length-1-k, so rows are reversed to give residue order.
     * @return one score per residue, index 0 = N-terminal residue
     */
    public static ScoreVector scorePositions(Peptide pep, int charge, Spectrum spec, double shiftMass,
                                             FragmentTolerance tol) {
        ImmutablePair<IonLadder, IonLadder> ladders = pep.calculateFragments(charge);
        HypothesisMatrix bHyp = ShiftHypotheses.enumerateShifts(ladders.getLeft(), shiftMass);
        HypothesisMatrix yHyp = ShiftHypotheses.enumerateShifts(ladders.getRight(), shiftMass);
        return ShiftedHyperscore.score(bHyp, yHyp, spec, tol).reverse();
    }

    public FragmentTolerance getTolerance() {
        return tol;
    }
}
