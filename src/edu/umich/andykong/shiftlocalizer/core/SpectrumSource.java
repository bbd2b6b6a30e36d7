package edu.umich.andykong.shiftlocalizer.core;

import java.util.Map;

/**
 * Lookup from a PSM's scan identifier to its MS/MS spectrum.
 */
public interface SpectrumSource {

    /**
     * @return the spectrum, or null if the scan is not known
     */
    Spectrum getSpectrum(String scanId);

    static SpectrumSource of(Map<String, Spectrum> spectra) {
        return spectra::get;
    }
}
