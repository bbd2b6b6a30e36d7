package edu.umich.andykong.shiftlocalizer.localization;

import edu.umich.andykong.shiftlocalizer.core.LocalizationException;
import edu.umich.andykong.shiftlocalizer.core.PsmRecord;
import edu.umich.andykong.shiftlocalizer.core.SpectrumNotFoundException;
import edu.umich.andykong.shiftlocalizer.fragments.MalformedPeptideException;

public class LocalizationFailure {

    public enum Type {
        MALFORMED_PEPTIDE(true),
        SPECTRUM_NOT_FOUND(true),
        DEGENERATE_LADDER(false);

        private final boolean fatal;

        Type(boolean fatal) {
            this.fatal = fatal;
        }

        public boolean isFatal() {
            return fatal;
        }
    }

    private final PsmRecord psm;
    private final Type type;
    private final LocalizationException cause;

    public LocalizationFailure(PsmRecord psm, LocalizationException cause) {
        this.psm = psm;
        this.cause = cause;
        this.type = classify(cause);
    }

    static Type classify(LocalizationException e) {
        if (e instanceof MalformedPeptideException)
            return Type.MALFORMED_PEPTIDE;
        if (e instanceof SpectrumNotFoundException)
            return Type.SPECTRUM_NOT_FOUND;
        if (e instanceof DegenerateLadderException)
            return Type.DEGENERATE_LADDER;
        throw new IllegalArgumentException("Unhandled localization failure " + e.getClass().getName(), e);
    }

    public PsmRecord getPsm() {
        return psm;
    }

    public String getRecordId() {
        return psm.getRecordId();
    }

    public Type getType() {
        return type;
    }

    public boolean isFatal() {
        return type.isFatal();
    }

    public LocalizationException getCause() {
        return cause;
    }

    public String getMessage() {
        return cause.getMessage();
    }
}
