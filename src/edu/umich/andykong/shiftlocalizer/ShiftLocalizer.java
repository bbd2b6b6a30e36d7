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

package edu.umich.andykong.shiftlocalizer;

import static java.lang.System.out;

import edu.umich.andykong.shiftlocalizer.core.MGFFile;
import edu.umich.andykong.shiftlocalizer.core.MXMLReader;
import edu.umich.andykong.shiftlocalizer.core.PsmRecord;
import edu.umich.andykong.shiftlocalizer.core.SpectrumSource;
import edu.umich.andykong.shiftlocalizer.localization.BatchLocalizer;
import edu.umich.andykong.shiftlocalizer.localization.BatchResult;
import edu.umich.andykong.shiftlocalizer.localization.FragmentTolerance;
import edu.umich.andykong.shiftlocalizer.localization.LocalizationFailure;
import edu.umich.andykong.shiftlocalizer.localization.LocalizationSummary;
import edu.umich.andykong.shiftlocalizer.localization.ShiftLocalization;
import edu.umich.andykong.shiftlocalizer.paramhandling.BooleanParameter;
import edu.umich.andykong.shiftlocalizer.paramhandling.DoubleParameter;
import edu.umich.andykong.shiftlocalizer.paramhandling.IntegerParameter;
import edu.umich.andykong.shiftlocalizer.paramhandling.ParameterGroup;
import edu.umich.andykong.shiftlocalizer.paramhandling.StringParameter;
import edu.umich.andykong.shiftlocalizer.utils.SageConfig;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ShiftLocalizer {
	private static final Logger log = LoggerFactory.getLogger(ShiftLocalizer.class);

	public static final String name = "Shift-Localizer";
	public static final String version = "1.0.0";

	public static final String localizedName = ".localized.pin";
	public static final String failedName = ".failed.tsv";
	public static final String defaultParamsName = "shiftlocalizer_params.txt";

	public static final int EXIT_OK = 0;
	public static final int EXIT_RECORD_ERRORS = 1;
	public static final int EXIT_SETUP_ERROR = 2;

	public static ParameterGroup defaultParams() {
		ParameterGroup params = new ParameterGroup("localization");
		params.addParam(new StringParameter("psm_file", "", "tab separated PSM table"));
		params.addParam(new StringParameter("spectra_file", "", "MGF, mzML or mzXML file with the MS/MS scans of the PSM table"));
		params.addParam(new StringParameter("sage_config", "", "Sage JSON configuration, its fragment_tol.ppm replaces the tolerances below"));
		params.addParam(new DoubleParameter("fragment_tol_lower_ppm", -1e5, 1e5, -10.0, "lower fragment tolerance (ppm)"));
		params.addParam(new DoubleParameter("fragment_tol_upper_ppm", -1e5, 1e5, 10.0, "upper fragment tolerance (ppm)"));
		params.addParam(new IntegerParameter("threads", 0, 1024, 0, "worker threads, 0 = all processors"));
		params.addParam(new BooleanParameter("fail_fast", false, "stop at the first PSM that cannot be localized"));
		params.addParam(new StringParameter("output_path", "", "output directory"));
		params.addParam(new StringParameter("pin_scanCol", "scannr", "scan identifier column"));
		params.addParam(new StringParameter("pin_peptideCol", "peptide", "peptide column"));
		params.addParam(new StringParameter("pin_chargeCol", "charge", "precursor charge column"));
		params.addParam(new StringParameter("pin_expMassCol", "expmass", "experimental precursor mass column"));
		params.addParam(new StringParameter("pin_calcMassCol", "calcmass", "calculated peptide mass column"));
		params.addParam(new StringParameter("pin_idCol", "SpecId", "PSM identifier column, line numbers are used when absent"));
		return params;
	}

	public static synchronized void print(String s) {
		out.println(s);
	}

	public static void die(String s) {
		System.err.println("Fatal error: " + s);
		System.exit(EXIT_SETUP_ERROR);
	}

	public static void parseParamFile(String fn, ParameterGroup params) throws IOException {
		Path path = Paths.get(fn.replaceAll("['\"]", ""));
		if (!Files.exists(path))
			throw new IOException(String.format("Parameter file does not exist: [%s]", fn));

		try (BufferedReader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			String cline;
			while ((cline = in.readLine()) != null) {
				int comments = cline.indexOf("//");
				if (comments >= 0)
					cline = cline.substring(0, comments);
				cline = cline.trim();
				if (cline.length() == 0 || cline.indexOf("=") < 0)
					continue;
				String key = cline.substring(0, cline.indexOf("=")).trim();
				String value = cline.substring(cline.indexOf("=") + 1).trim();
				if (!params.hasParam(key)) {
					log.warn("Ignoring unknown parameter {} in {}", key, fn);
					continue;
				}
				params.setParamFromString(key, value);
			}
		}
	}

	/**
	 * Build the parameters from parameter files, read in order, then apply --key value overrides.
	 * An override always wins over a parameter file value, wherever it appears on the command line.
	 */
	public static ParameterGroup init(String [] args) throws IOException {
		ParameterGroup params = defaultParams();
		HashMap<String, String> overrides = new HashMap<>();
		for (int i = 0; i < args.length; i++) {
			if (args[i].startsWith("--")) {
				if (i + 1 >= args.length)
					throw new IllegalArgumentException("Missing value for " + args[i]);
				overrides.put(args[i].substring(2), args[i + 1]);
				i++;
			} else
				parseParamFile(args[i].trim(), params);
		}
		for (String key : overrides.keySet()) {
			if (!params.hasParam(key))
				throw new IllegalArgumentException("Unknown parameter --" + key);
			params.setParamFromString(key, overrides.get(key));
		}

		if (params.getString("psm_file").isEmpty())
			throw new IllegalArgumentException("psm_file is not set");
		if (params.getString("spectra_file").isEmpty())
			throw new IllegalArgumentException("spectra_file is not set");
		return params;
	}

	public static FragmentTolerance getTolerance(ParameterGroup params) throws IOException {
		if (!params.getString("sage_config").isEmpty()) {
			FragmentTolerance tol = SageConfig.readFragmentTolerance(Paths.get(params.getString("sage_config")));
			log.info("Using fragment tolerance {} from {}", tol, params.getString("sage_config"));
			return tol;
		}
		return new FragmentTolerance(params.getDouble("fragment_tol_lower_ppm"), params.getDouble("fragment_tol_upper_ppm"));
	}

	/**
	 * Open a spectral file by its extension: MGF peak lists, or mzML and mzXML runs.
	 */
	public static SpectrumSource openSpectra(File f, int threads) throws IOException {
		if (f.getName().toLowerCase().endsWith(".mgf"))
			return new MGFFile(f);
		if (MXMLReader.canRead(f)) {
			MXMLReader mr = new MXMLReader(f, threads);
			mr.readFully();
			return mr;
		}
		throw new IOException("Cannot read spectra with unrecognized extension: " + f.getName());
	}

	/**
	 * Localize every PSM of the configured table and write the localized table next to the failure report.
	 * @return EXIT_RECORD_ERRORS if any PSM had a malformed peptide or a missing spectrum, EXIT_OK otherwise
	 */
	public static int run(ParameterGroup params) throws Exception {
		long t1 = System.currentTimeMillis();
		FragmentTolerance tol = getTolerance(params);
		int nThreads = params.getInt("threads");
		if (nThreads == 0)
			nThreads = Runtime.getRuntime().availableProcessors();

		File outDir = new File(params.getString("output_path").isEmpty() ? "." : params.getString("output_path"));
		if (!outDir.exists() && !outDir.mkdirs())
			throw new IOException("Could not create output directory " + outDir);

		log.info("Reading {}...", params.getString("psm_file"));
		PinFile pf = new PinFile(params.getString("psm_file"));
		List<PsmRecord> psms = pf.getPsms(params.getString("pin_scanCol"), params.getString("pin_peptideCol"),
				params.getString("pin_chargeCol"), params.getString("pin_expMassCol"),
				params.getString("pin_calcMassCol"), params.getString("pin_idCol"));

		log.info("Reading {}...", params.getString("spectra_file"));
		SpectrumSource spectra = openSpectra(new File(params.getString("spectra_file")), nThreads);

		log.info("Localizing modifications on {} PSMs ({} threads, fragment tolerance {})...", psms.size(), nThreads, tol);
		ExecutorService executorService = Executors.newFixedThreadPool(nThreads);
		BatchResult br;
		try {
			BatchLocalizer bl = new BatchLocalizer(new ShiftLocalization(spectra, tol), executorService,
					params.getBoolean("fail_fast"));
			br = bl.localizeAll(psms);
		} finally {
			executorService.shutdown();
		}

		String stem = PinFile.getStem(pf.fname);
		File localizedFile = new File(outDir, stem + localizedName);
		log.info("Writing {}...", localizedFile);
		pf.writeLocalized(localizedFile, br);

		if (!br.getFailures().isEmpty()) {
			File failedFile = new File(outDir, stem + failedName);
			PinFile.writeFailures(failedFile, br.getFailures());
			ArrayList<String> failedIds = new ArrayList<>();
			for (LocalizationFailure f : br.getFailures())
				failedIds.add(f.getRecordId() + " (" + f.getType() + ")");
			int previewSize = Math.min(failedIds.size(), 5);
			log.warn("Could not localize {}/{} PSMs, see {}. First {}: \n\t{}", failedIds.size(), psms.size(),
					failedFile, previewSize, StringUtils.join(failedIds.subList(0, previewSize), "\n\t"));
		}

		print(new LocalizationSummary(br).toString());
		print(String.format("Completed in %.2f min.", (System.currentTimeMillis() - t1) / 60000.0));
		return br.hasFatalFailures() ? EXIT_RECORD_ERRORS : EXIT_OK;
	}

	private static void extractFile(String jarFilePath, String outputName) throws IOException {
		try (InputStream in = ShiftLocalizer.class.getResourceAsStream("/" + jarFilePath)) {
			if (in == null)
				throw new IOException("Missing bundled resource " + jarFilePath);
			Path outPath = Paths.get(outputName).toAbsolutePath().normalize();
			Files.copy(in, outPath, StandardCopyOption.REPLACE_EXISTING);
			print("Wrote " + outPath);
		}
	}

	public static void main(String [] args) {
		Locale.setDefault(Locale.US);
		out.println();
		out.printf("%s version %s\n", name, version);
		out.printf("Using Java %s on %dMB memory\n\n", System.getProperty("java.version"), (int) (Runtime.getRuntime().maxMemory() / Math.pow(2, 20)));

		if (args.length == 0) {
			out.printf("Usage:\n");
			out.printf("\tTo print the parameter file:\n" +
					"\t\tjava -jar shiftlocalizer-%s.jar --config\n", version);
			out.printf("\tTo localize mass shifts:\n" +
					"\t\tjava -jar shiftlocalizer-%s.jar params.txt [--key value ...]\n", version);
			out.printf("\tParameters:\n");
			ParameterGroup defaults = defaultParams();
			for (String key : defaults.getKeys())
				out.printf("\t\t%-24s %s\n", key, defaults.getParam(key).getDescription());
			out.println();
			System.exit(EXIT_OK);
		}

		try {
			if (args.length == 1 && args[0].equals("--config")) {
				extractFile("shiftlocalizer/default_params.txt", defaultParamsName);
				System.exit(EXIT_OK);
			}
			ParameterGroup params = init(args);
			for (String key : params.getKeys())
				log.info("{} = {}", key, params.getString(key));
			System.exit(run(params));
		} catch (IllegalArgumentException | IOException e) {
			die(e.getMessage());
		} catch (Exception e) {
			log.error("Localization failed", e);
			System.exit(EXIT_SETUP_ERROR);
		}
	}
}
