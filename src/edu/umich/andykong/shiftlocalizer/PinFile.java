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

import edu.umich.andykong.shiftlocalizer.core.PsmRecord;
import edu.umich.andykong.shiftlocalizer.localization.BatchResult;
import edu.umich.andykong.shiftlocalizer.localization.LocalizationFailure;
import edu.umich.andykong.shiftlocalizer.localization.LocalizationResult;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;

/**
 * Tab separated PSM table (Percolator input style) with one header row.
 */
public class PinFile {
	private static final Logger log = LoggerFactory.getLogger(PinFile.class);

	public static final String[] localizedColumns = {"mod_position", "shifted_hyperscore", "delta_shifted_hyperscore"};
	public static final String[] failureColumns = {"record_id", "scannr", "peptide", "error", "message"};

	public final File fname;
	String [] headers;
	public ArrayList<String []> data;
	private final HashMap<String, Integer> columns;
	private int ragged;

	public PinFile(String fn) throws IOException {
		this(new File(fn));
	}

	public PinFile(File f) throws IOException {
		this.fname = f;
		this.data = new ArrayList<>();
		this.columns = new HashMap<>();
		try (BufferedReader in = Files.newBufferedReader(f.toPath(), StandardCharsets.UTF_8)) {
			String cline = in.readLine();
			if (cline == null || StringUtils.isBlank(cline))
				throw new IOException("PSM table " + f.getName() + " has no header");
			headers = cline.split("\t", -1);
			for (int i = 0; i < headers.length; i++)
				columns.putIfAbsent(headers[i].trim(), i);

			while ((cline = in.readLine()) != null) {
				if (StringUtils.isBlank(cline))
					continue;
				String [] sp = cline.split("\t", -1);
				if (sp[0].equalsIgnoreCase("DefaultDirection"))
					continue;
				if (sp.length != headers.length) {
					// protein lists spill over into extra columns
					ragged++;
					sp = Arrays.copyOf(sp, headers.length);
					for (int i = 0; i < sp.length; i++)
						if (sp[i] == null)
							sp[i] = "";
				}
				data.add(sp);
			}
		}
		if (ragged > 0)
			log.warn("{} rows of {} did not match the header width and were truncated or padded", ragged, f.getName());
	}

	/**
	 * @return column index, -1 if absent
	 */
	public int getColumn(String col) {
		return columns.getOrDefault(col, -1);
	}

	private int requireColumn(String col) throws IOException {
		int idx = getColumn(col);
		if (idx < 0)
			throw new IOException(String.format("PSM table %s has no column \"%s\"", fname.getName(), col));
		return idx;
	}

	/**
	 * Parse PSMs from the table.
	 * @param idCol column holding a PSM identifier; when empty or absent, the 1-based data line number is used
	 */
	public List<PsmRecord> getPsms(String scanCol, String pepCol, String chargeCol, String expMassCol,
								   String calcMassCol, String idCol) throws IOException {
		int scanIdx = requireColumn(scanCol);
		int pepIdx = requireColumn(pepCol);
		int chargeIdx = requireColumn(chargeCol);
		int expIdx = requireColumn(expMassCol);
		int calcIdx = requireColumn(calcMassCol);
		int idIdx = StringUtils.isEmpty(idCol) ? -1 : getColumn(idCol);

		ArrayList<PsmRecord> psms = new ArrayList<>(data.size());
		for (int i = 0; i < data.size(); i++) {
			String [] sp = data.get(i);
			String recordId = (idIdx >= 0 && !sp[idIdx].isEmpty()) ? sp[idIdx] : String.valueOf(i + 1);
			try {
				psms.add(new PsmRecord(recordId, sp[scanIdx].trim(), sp[pepIdx].trim(),
						Integer.parseInt(sp[chargeIdx].trim()),
						Double.parseDouble(sp[expIdx].trim()),
						Double.parseDouble(sp[calcIdx].trim())));
			} catch (IllegalArgumentException e) {
				throw new IOException(String.format("%s data line %d: %s", fname.getName(), i + 1, e.getMessage()), e);
			}
		}
		return psms;
	}

	/**
	 * Write the rows that were localized, with the localization columns appended.
	 * @param br batch result whose i-th entry belongs to the i-th data row
	 */
	public void writeLocalized(File out, BatchResult br) throws IOException {
		if (br.size() != data.size())
			throw new IllegalArgumentException(String.format("%d results for %d PSM rows", br.size(), data.size()));
		try (PrintWriter pw = new PrintWriter(Files.newBufferedWriter(out.toPath(), StandardCharsets.UTF_8))) {
			pw.print(String.join("\t", headers));
			pw.print("\t" + String.join("\t", localizedColumns) + "\n");
			for (int i = 0; i < data.size(); i++) {
				LocalizationResult r = br.getResult(i);
				if (r == null)
					continue;
				pw.print(String.join("\t", data.get(i)));
				pw.printf("\t%d\t%s\t%s\n", r.getPosition(), r.getScore(), r.getDeltaScore());
			}
		}
	}

	public static void writeFailures(File out, List<LocalizationFailure> failures) throws IOException {
		try (PrintWriter pw = new PrintWriter(Files.newBufferedWriter(out.toPath(), StandardCharsets.UTF_8))) {
			pw.print(String.join("\t", failureColumns) + "\n");
			for (LocalizationFailure f : failures) {
				pw.print(String.join("\t", f.getRecordId(), f.getPsm().getScanId(), f.getPsm().getSequence(),
						f.getType().toString(), StringUtils.normalizeSpace(f.getMessage())) + "\n");
			}
		}
	}

	/**
	 * File name without its last extension, "results.sage.pin" gives "results.sage"
	 */
	public static String getStem(File f) {
		String name = f.getName();
		int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(0, dot) : name;
	}

	public int size() {
		return data.size();
	}
}
