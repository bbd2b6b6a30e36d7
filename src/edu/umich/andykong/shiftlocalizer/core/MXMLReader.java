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

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import umich.ms.datatypes.LCMSDataSubset;
import umich.ms.datatypes.scan.IScan;
import umich.ms.datatypes.scan.props.PrecursorInfo;
import umich.ms.datatypes.scancollection.impl.ScanCollectionDefault;
import umich.ms.datatypes.spectrum.ISpectrum;
import umich.ms.fileio.exceptions.FileParsingException;
import umich.ms.fileio.filetypes.LCMSDataSource;
import umich.ms.fileio.filetypes.mzml.MZMLFile;
import umich.ms.fileio.filetypes.mzxml.MZXMLFile;

/**
 * MS/MS spectra of an mzML or mzXML run. Spectra are named run.scanNum.scanNum and can be looked up by that name,
 * by the name with a trailing charge state, or by anything holding the scan number, such as the native id.
 */
public class MXMLReader implements SpectrumSource {
	private static final Logger log = LoggerFactory.getLogger(MXMLReader.class);

	final File f;
	final int threads;

	public Spectrum [] specs;
	HashMap<String,Spectrum> specsByName;
	HashMap<Integer,Spectrum> specsByScanNum;

	public MXMLReader(File f, int threads) {
		this.f = f;
		this.threads = threads;
	}

	public static boolean canRead(File f) {
		String fn = f.getName().toLowerCase();
		return fn.endsWith(".mzml") || fn.endsWith(".mzxml");
	}

	@Override
	public Spectrum getSpectrum(String specName) {
		Spectrum spec = specsByName.get(specName);
		if (spec == null)
			spec = specsByName.get(stripChargeState(specName));
		if (spec == null) {
			int scanNum = MGFFile.parseScanNumber(specName);
			if (scanNum >= 0)
				spec = specsByScanNum.get(scanNum);
		}
		return spec;
	}

	// strip off the charge state from spec name of format name.scanNum.scanNum.charge
	public static String stripChargeState(String specName) {
		String [] sp = specName.split("\\.");
		if (sp.length >= 4)
			return specName.substring(0, specName.lastIndexOf('.'));
		return specName;
	}

	public void readFully() throws IOException {
		long t1 = System.currentTimeMillis();
		String fn = f.getName().toLowerCase();
		LCMSDataSource<?> source;
		if (fn.endsWith(".mzml"))
			source = new MZMLFile(f.getAbsolutePath());
		else if (fn.endsWith(".mzxml"))
			source = new MZXMLFile(f.getAbsolutePath());
		else
			throw new IOException("Cannot read mzFile with unrecognized extension: " + f.getName());

		String baseName = f.getName().substring(0, f.getName().lastIndexOf("."));
		try {
			readFully(source, baseName);
		} catch (FileParsingException e) {
			throw new IOException("Could not parse " + f.getName() + ": " + e.getMessage(), e);
		}

		specsByName = new HashMap<>();
		specsByScanNum = new HashMap<>();
		for (Spectrum spec : specs) {
			specsByName.put(spec.scanName, spec);
			specsByScanNum.put(spec.scanNum, spec);
		}
		log.info("Read {} MS/MS spectra from {} ({} ms)", specs.length, f.getName(), System.currentTimeMillis() - t1);
	}

	private void readFully(LCMSDataSource<?> source, String baseName) throws FileParsingException {
		source.setExcludeEmptyScans(false);
		source.setNumThreadsForParsing(threads);

		ScanCollectionDefault scans = new ScanCollectionDefault();
		scans.setDataSource(source);
		scans.loadData(LCMSDataSubset.MS2_WITH_SPECTRA);
		TreeMap<Integer, IScan> num2scan = scans.getMapNum2scan();

		List<Spectrum> cspecs = new ArrayList<>();
		for (Map.Entry<Integer, IScan> scanEntry : num2scan.entrySet()) {
			int scanNum = scanEntry.getKey();
			IScan scan = scanEntry.getValue();
			if (scan.getMsLevel() == null || scan.getMsLevel() != 2)
				continue;
			ISpectrum spectrum = scan.fetchSpectrum();
			double [] mz = (spectrum == null) ? new double[0] : spectrum.getMZs();
			double [] intensity = (spectrum == null) ? new double[0] : spectrum.getIntensities();

			int charge = 0;
			double precursorMZ = 0;
			PrecursorInfo precursor = scan.getPrecursor();
			if (precursor != null) {
				if (precursor.getCharge() != null)
					charge = precursor.getCharge();
				if (precursor.getMzTargetMono() != null)
					precursorMZ = precursor.getMzTargetMono();
				else if (precursor.getMzTarget() != null)
					precursorMZ = precursor.getMzTarget();
			}
			//does not include charge state in scan name
			String scanName = baseName + "." + scanNum + "." + scanNum;
			cspecs.add(new Spectrum(scanName, scanNum, charge, precursorMZ, mz, intensity));
		}
		specs = cspecs.toArray(new Spectrum[0]);
		scans.reset();
	}

	public int size() {
		return specs.length;
	}
}
