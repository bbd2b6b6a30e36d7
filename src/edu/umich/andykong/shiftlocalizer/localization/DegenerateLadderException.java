package edu.umich.andykong.shiftlocalizer.localization;

import edu.umich.andykong.shiftlocalizer.core.LocalizationException;

public class DegenerateLadderException extends LocalizationException {
    private final String sequence;

    public DegenerateLadderException(String sequence, int residueCount, String recordId) {
        super(String.format("Peptide %s has %d residue(s), at least 2 are needed to fragment", sequence, residueCount),
                recordId);
        this.sequence = sequence;
    }

    public String getSequence() {
        return sequence;
    }
}
