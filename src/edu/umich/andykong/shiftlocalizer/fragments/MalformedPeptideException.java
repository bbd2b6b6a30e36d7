package edu.umich.andykong.shiftlocalizer.fragments;

import edu.umich.andykong.shiftlocalizer.core.LocalizationException;

public class MalformedPeptideException extends LocalizationException {
    private final String reason;
    private final String sequence;
    private final int position;

    public MalformedPeptideException(String reason, String sequence, int position) {
        this(reason, sequence, position, null, null);
    }

    private MalformedPeptideException(String reason, String sequence, int position, String recordId, Throwable cause) {
        super(String.format("%s at position %d of \"%s\"", reason, position, sequence), recordId, cause);
        this.reason = reason;
        this.sequence = sequence;
        this.position = position;
    }

    /**
     * Same failure, tied to the PSM it came from
     */
    public MalformedPeptideException forRecord(String recordId) {
        return new MalformedPeptideException(reason, sequence, position, recordId, this);
    }

    public String getSequence() {
        return sequence;
    }

    public int getPosition() {
        return position;
    }
}
