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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads MS/MS spectra from a Mascot Generic Format peak list.
 */
public class MGFFile implements SpectrumSource {
    private static final Logger log = LoggerFactory.getLogger(MGFFile.class);

    private static final Pattern nativeScanPattern = Pattern.compile("scan=(\\d+)");
    private static final Pattern dottedScanPattern = Pattern.compile("^(.+?)\\.(\\d+)\\.(\\d+)(\\.\\d+)?$");
    private static final Pattern numericPattern = Pattern.compile("^\\d+$");

    public final File f;
    private final List<Spectrum> specs;
    private final HashMap<String, Spectrum> byTitle;
    private final HashMap<Integer, Spectrum> byScanNum;

    public MGFFile(String filePath) throws IOException {
        this(new File(filePath));
    }

    public MGFFile(File f) throws IOException {
        this.f = f;
        this.specs = new ArrayList<>();
        this.byTitle = new HashMap<>();
        this.byScanNum = new HashMap<>();
        readMGF();
    }

    private void readMGF() throws IOException {
        long t1 = System.currentTimeMillis();
        try (BufferedReader br = Files.newBufferedReader(f.toPath(), StandardCharsets.UTF_8)) {
            String cline;
            int lineC = 0;
            boolean inIons = false;
            String title = null;
            int scanNum = -1;
            int charge = 0;
            double precursorMZ = 0;
            ArrayList<double[]> peaks = new ArrayList<>();

            while ((cline = br.readLine()) != null) {
                lineC++;
                cline = cline.trim();
                if (cline.isEmpty() || cline.startsWith("#"))
                    continue;
                if (cline.equals("BEGIN IONS")) {
                    inIons = true;
                    title = null;
                    scanNum = -1;
                    charge = 0;
                    precursorMZ = 0;
                    peaks = new ArrayList<>();
                } else if (cline.equals("END IONS")) {
                    if (!inIons)
                        throw new IOException(String.format("%s:%d END IONS without BEGIN IONS", f.getName(), lineC));
                    addSpectrum(title, scanNum, charge, precursorMZ, peaks);
                    inIons = false;
                } else if (!inIons) {
                    continue; // global header parameters
                } else if (Character.isDigit(cline.charAt(0))) {
                    String[] sp = cline.split("\\s+");
                    if (sp.length < 2)
                        throw new IOException(String.format("%s:%d malformed peak line: %s", f.getName(), lineC, cline));
                    try {
                        peaks.add(new double[]{Double.parseDouble(sp[0]), Double.parseDouble(sp[1])});
                    } catch (NumberFormatException e) {
                        throw new IOException(String.format("%s:%d malformed peak line: %s", f.getName(), lineC, cline), e);
                    }
                } else if (cline.indexOf('=') > 0) {
                    String key = cline.substring(0, cline.indexOf('=')).trim().toUpperCase();
                    String value = cline.substring(cline.indexOf('=') + 1).trim();
                    try {
                        switch (key) {
                            case "TITLE":
                                title = value;
                                break;
                            case "SCANS":
                                scanNum = parseScanNumber(value.split("-")[0]);
                                break;
                            case "CHARGE":
                                charge = parseCharge(value);
                                break;
                            case "PEPMASS":
                                precursorMZ = Double.parseDouble(value.split("\\s+")[0]);
                                break;
                            default:
                                break;
                        }
                    } catch (NumberFormatException e) {
                        throw new IOException(String.format("%s:%d malformed %s: %s", f.getName(), lineC, key, value), e);
                    }
                }
            }
            if (inIons)
                throw new IOException(String.format("%s ended inside an ion block", f.getName()));
        }
        log.info("Read {} spectra from {} ({} ms)", specs.size(), f.getName(), System.currentTimeMillis() - t1);
    }

    private void addSpectrum(String title, int scanNum, int charge, double precursorMZ, ArrayList<double[]> peaks) {
        if (title == null)
            title = "scan=" + scanNum;
        if (scanNum < 0)
            scanNum = parseScanNumber(title);
        double[] peakMZ = new double[peaks.size()];
        double[] peakInt = new double[peaks.size()];
        for (int i = 0; i < peaks.size(); i++) {
            peakMZ[i] = peaks.get(i)[0];
            peakInt[i] = peaks.get(i)[1];
        }
        Spectrum spec = new Spectrum(title, scanNum, charge, precursorMZ, peakMZ, peakInt);
        specs.add(spec);
        if (byTitle.put(title, spec) != null)
            log.warn("Duplicate spectrum title {} in {}, keeping the last one", title, f.getName());
        if (scanNum >= 0)
            byScanNum.put(scanNum, spec);
    }

    private static int parseCharge(String value) {
        String z = value.split("[,\\s]")[0].replace("+", "");
        if (z.endsWith("-"))
            return -Integer.parseInt(z.substring(0, z.length() - 1));
        return Integer.parseInt(z);
    }

    /**
     * Extract a scan number from the identifier formats seen in PSM tables:
     * native ids ("controllerType=0 controllerNumber=1 scan=1234"), bare numbers ("1234")
     * and dotted spectrum names ("run.1234.1234.2").
     * @return scan number, -1 if none can be found
     */
    public static int parseScanNumber(String scanId) {
        if (scanId == null)
            return -1;
        String s = scanId.trim();
        Matcher m = nativeScanPattern.matcher(s);
        if (m.find())
            return Integer.parseInt(m.group(1));
        if (numericPattern.matcher(s).matches())
            return Integer.parseInt(s);
        m = dottedScanPattern.matcher(s);
        if (m.matches())
            return Integer.parseInt(m.group(2));
        return -1;
    }

    @Override
    public Spectrum getSpectrum(String scanId) {
        Spectrum spec = byTitle.get(scanId);
        if (spec != null)
            return spec;
        int scanNum = parseScanNumber(scanId);
        if (scanNum < 0)
            return null;
        return byScanNum.get(scanNum);
    }

    public List<Spectrum> getSpectra() {
        return specs;
    }

    public int size() {
        return specs.size();
    }
}
