package edu.umich.andykong.shiftlocalizer.core;

public class SpectrumNotFoundException extends LocalizationException {
    private final String scanId;

    public SpectrumNotFoundException(String scanId, String recordId) {
        super("No spectrum for scan " + scanId, recordId);
        this.scanId = scanId;
    }

    public String getScanId() {
        return scanId;
    }
}
