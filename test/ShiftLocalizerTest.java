import core.MXMLReaderTest;
import edu.umich.andykong.shiftlocalizer.ShiftLocalizer;
import edu.umich.andykong.shiftlocalizer.fragments.IonLadder;
import edu.umich.andykong.shiftlocalizer.fragments.Peptide;
import edu.umich.andykong.shiftlocalizer.paramhandling.ParameterGroup;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class ShiftLocalizerTest {

    @TempDir
    Path tmp;

    private Path write(String name, String content) throws IOException {
        Path p = tmp.resolve(name);
        Files.write(p, content.getBytes(StandardCharsets.UTF_8));
        return p;
    }

    private static double[] fragmentMZ(String modifiedPeptide, int charge) throws Exception {
        ImmutablePair<IonLadder, IonLadder> ladders = Peptide.fragment(modifiedPeptide, charge);
        ArrayList<Double> mz = new ArrayList<>();
        for (int c = 0; c < ladders.getLeft().getChargeCount(); c++) {
            for (double v : ladders.getLeft().getCharge(c))
                mz.add(v);
            for (double v : ladders.getRight().getCharge(c))
                mz.add(v);
        }
        mz.sort(null);
        double[] out = new double[mz.size()];
        for (int i = 0; i < out.length; i++)
            out[i] = mz.get(i);
        return out;
    }

    private String ionBlock(String title, String modifiedPeptide, int charge) throws Exception {
        double[] mz = fragmentMZ(modifiedPeptide, charge);
        StringBuilder sb = new StringBuilder();
        sb.append("BEGIN IONS\nTITLE=").append(title).append("\nCHARGE=").append(charge).append("+\n");
        for (double v : mz)
            sb.append(String.format(Locale.US, "%.6f 100.0\n", v));
        sb.append("END IONS\n");
        return sb.toString();
    }

    private Path writeInputs(String extraRows) throws Exception {
        write("run.mgf", ionBlock("run.1001.1001.2", "LES[+79]LIEK", 2)
                + ionBlock("run.1002.1002.2", "LESLIEK[+14]", 2));
        write("results.sage.pin", "SpecId\tscannr\texpmass\tcalcmass\tcharge\tpeptide\n" +
                "psm_a\trun.1001.1001.2\t909.47\t830.47\t2\tLESLIEK\n" +
                "psm_b\t1002\t844.47\t830.47\t2\tLESLIEK\n" +
                extraRows);
        return write("params.txt", "// test run\n" +
                "psm_file = " + tmp.resolve("results.sage.pin") + "\n" +
                "spectra_file = " + tmp.resolve("run.mgf") + "   // MGF\n" +
                "output_path = " + tmp.resolve("out") + "\n" +
                "threads = 2\n");
    }

    @Test
    void parameterFileAndOverrides() throws Exception {
        Path params = writeInputs("");
        ParameterGroup pg = ShiftLocalizer.init(new String[]{params.toString(),
                "--fragment_tol_lower_ppm", "-20", "--fail_fast", "true"});
        assertEquals(tmp.resolve("run.mgf").toString(), pg.getString("spectra_file"));
        assertEquals(2, pg.getInt("threads"));
        assertEquals(-20.0, pg.getDouble("fragment_tol_lower_ppm"), 0);
        assertEquals(10.0, pg.getDouble("fragment_tol_upper_ppm"), 0);
        assertTrue(pg.getBoolean("fail_fast"));
        assertEquals("scannr", pg.getString("pin_scanCol"));
    }

    @Test
    void badArguments() throws Exception {
        Path params = writeInputs("");
        assertThrows(IllegalArgumentException.class,
                () -> ShiftLocalizer.init(new String[]{params.toString(), "--no_such_key", "1"}));
        assertThrows(IllegalArgumentException.class,
                () -> ShiftLocalizer.init(new String[]{params.toString(), "--threads"}));
        assertThrows(IllegalArgumentException.class,
                () -> ShiftLocalizer.init(new String[]{params.toString(), "--fragment_tol_upper_ppm", "2e5"}));
        assertThrows(IllegalArgumentException.class,
                () -> ShiftLocalizer.init(new String[]{"--threads", "1"}));
        assertThrows(IOException.class,
                () -> ShiftLocalizer.init(new String[]{tmp.resolve("missing.txt").toString()}));
    }

    @Test
    void bundledParameterFileIsComplete() throws Exception {
        Path copy = tmp.resolve("defaults.txt");
        try (InputStream in = ShiftLocalizer.class.getResourceAsStream("/shiftlocalizer/default_params.txt")) {
            assertNotNull(in);
            Files.copy(in, copy);
        }
        ParameterGroup fromFile = ShiftLocalizer.defaultParams();
        ShiftLocalizer.parseParamFile(copy.toString(), fromFile);
        ParameterGroup defaults = ShiftLocalizer.defaultParams();
        for (String key : defaults.getKeys())
            assertEquals(defaults.getString(key), fromFile.getString(key), "Mismatch for " + key);
        String text = new String(Files.readAllBytes(copy), StandardCharsets.UTF_8);
        for (String key : defaults.getKeys())
            assertTrue(text.contains(key + " ="), "Missing " + key);
    }

    @Test
    void localizesTable() throws Exception {
        Path params = writeInputs("");
        int status = ShiftLocalizer.run(ShiftLocalizer.init(new String[]{params.toString()}));
        assertEquals(ShiftLocalizer.EXIT_OK, status);

        Path out = tmp.resolve("out").resolve("results.sage.localized.pin");
        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        assertEquals(Arrays.asList("mod_position", "shifted_hyperscore", "delta_shifted_hyperscore"),
                Arrays.asList(lines.get(0).split("\t")).subList(6, 9));
        assertEquals("2", lines.get(1).split("\t")[6]);
        assertEquals("6", lines.get(2).split("\t")[6]);
        assertFalse(Files.exists(tmp.resolve("out").resolve("results.sage.failed.tsv")));
    }

    @Test
    void localizesAgainstMzML() throws Exception {
        MXMLReaderTest.writeMzML(tmp.resolve("run.mzML"), new double[][]{
                fragmentMZ("LES[+79]LIEK", 2), fragmentMZ("LESLIEK[+14]", 2)}, 2);
        write("results.sage.pin", "SpecId\tscannr\texpmass\tcalcmass\tcharge\tpeptide\n" +
                "psm_a\tcontrollerType=0 controllerNumber=1 scan=2\t909.47\t830.47\t2\tLESLIEK\n" +
                "psm_b\tcontrollerType=0 controllerNumber=1 scan=3\t844.47\t830.47\t2\tLESLIEK\n");
        int status = ShiftLocalizer.run(ShiftLocalizer.init(new String[]{
                "--psm_file", tmp.resolve("results.sage.pin").toString(),
                "--spectra_file", tmp.resolve("run.mzML").toString(),
                "--output_path", tmp.resolve("out").toString(),
                "--threads", "1"}));
        assertEquals(ShiftLocalizer.EXIT_OK, status);

        List<String> lines = Files.readAllLines(tmp.resolve("out").resolve("results.sage.localized.pin"),
                StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        assertEquals("2", lines.get(1).split("\t")[6]);
        assertEquals("6", lines.get(2).split("\t")[6]);
    }

    @Test
    void unknownSpectraExtension() throws Exception {
        Path params = writeInputs("");
        Path raw = write("run.raw", "");
        assertThrows(IOException.class, () -> ShiftLocalizer.run(ShiftLocalizer.init(new String[]{params.toString(),
                "--spectra_file", raw.toString()})));
    }

    @Test
    void sageToleranceReplacesParameters() throws Exception {
        Path params = writeInputs("");
        // a window above every peak, so no fragment can match
        Path sage = write("config.json", "{\"fragment_tol\": {\"ppm\": [5, 10]}}");
        int status = ShiftLocalizer.run(ShiftLocalizer.init(new String[]{params.toString(),
                "--sage_config", sage.toString()}));
        assertEquals(ShiftLocalizer.EXIT_OK, status);
        List<String> lines = Files.readAllLines(tmp.resolve("out").resolve("results.sage.localized.pin"),
                StandardCharsets.UTF_8);
        assertEquals("0", lines.get(1).split("\t")[6]);
        assertEquals(0.0, Double.parseDouble(lines.get(1).split("\t")[7]), 0);
    }

    @Test
    void recordErrorsSetExitStatus() throws Exception {
        Path params = writeInputs("psm_c\t1003\t900.0\t800.0\t2\tLESLIEK\n" +
                "psm_d\t1001\t900.0\t800.0\t2\tLESLIEZ\n");
        int status = ShiftLocalizer.run(ShiftLocalizer.init(new String[]{params.toString()}));
        assertEquals(ShiftLocalizer.EXIT_RECORD_ERRORS, status);

        List<String> localized = Files.readAllLines(tmp.resolve("out").resolve("results.sage.localized.pin"),
                StandardCharsets.UTF_8);
        assertEquals(3, localized.size());
        List<String> failed = Files.readAllLines(tmp.resolve("out").resolve("results.sage.failed.tsv"),
                StandardCharsets.UTF_8);
        assertEquals(3, failed.size());
        assertTrue(failed.get(1).startsWith("psm_c\t1003\t"), failed.get(1));
        assertTrue(failed.get(2).startsWith("psm_d\t1001\t"), failed.get(2));
    }

    @Test
    void degenerateRecordsDoNotFailTheRun() throws Exception {
        Path params = writeInputs("psm_e\t1001\t200.0\t128.09\t1\tK\n");
        int status = ShiftLocalizer.run(ShiftLocalizer.init(new String[]{params.toString()}));
        assertEquals(ShiftLocalizer.EXIT_OK, status);
        assertTrue(Files.exists(tmp.resolve("out").resolve("results.sage.failed.tsv")));
    }
}
