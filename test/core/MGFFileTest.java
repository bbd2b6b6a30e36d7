package core;

import edu.umich.andykong.shiftlocalizer.core.MGFFile;
import edu.umich.andykong.shiftlocalizer.core.Spectrum;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MGFFileTest {

    @TempDir
    Path tmp;

    private Path write(String name, String content) throws IOException {
        Path p = tmp.resolve(name);
        Files.write(p, content.getBytes(StandardCharsets.UTF_8));
        return p;
    }

    @Test
    void readsIonBlocks() throws IOException {
        Path p = write("run.mgf", "MASS=Monoisotopic\n" +
                "BEGIN IONS\n" +
                "TITLE=run.1001.1001.2\n" +
                "PEPMASS=415.2 1200.5\n" +
                "CHARGE=2+\n" +
                "SCANS=1001\n" +
                "114.0913 10.0\n" +
                "147.1128\t20.0\n" +
                "END IONS\n" +
                "\n" +
                "BEGIN IONS\n" +
                "TITLE=controllerType=0 controllerNumber=1 scan=1002\n" +
                "CHARGE=3+\n" +
                "200.0 1.0\n" +
                "END IONS\n");
        MGFFile mgf = new MGFFile(p.toFile());

        assertEquals(2, mgf.size());
        Spectrum first = mgf.getSpectrum("run.1001.1001.2");
        assertNotNull(first);
        assertEquals(1001, first.scanNum);
        assertEquals(2, first.charge);
        assertEquals(415.2, first.precursorMZ, 1e-9);
        assertEquals(2, first.size());
        assertEquals(147.1128, first.getPeakMZ(1), 1e-9);
        assertEquals(20.0, first.getPeakInt(1), 1e-9);

        // falls back to the scan number when the title does not match
        assertSame(first, mgf.getSpectrum("1001"));
        assertSame(first, mgf.getSpectrum("controllerType=0 controllerNumber=1 scan=1001"));
        assertSame(mgf.getSpectra().get(1), mgf.getSpectrum("1002"));
        assertNull(mgf.getSpectrum("9999"));
        assertNull(mgf.getSpectrum("not a scan"));
    }

    @Test
    void parseScanNumber() {
        assertEquals(1234, MGFFile.parseScanNumber("controllerType=0 controllerNumber=1 scan=1234"));
        assertEquals(17, MGFFile.parseScanNumber("17"));
        assertEquals(500, MGFFile.parseScanNumber("my.run.500.500.3"));
        assertEquals(500, MGFFile.parseScanNumber("run.500.500"));
        assertEquals(-1, MGFFile.parseScanNumber("spectrum"));
        assertEquals(-1, MGFFile.parseScanNumber(null));
    }

    @Test
    void malformedFiles() throws IOException {
        Path badPeak = write("bad_peak.mgf", "BEGIN IONS\nTITLE=a\n100.0 abc\nEND IONS\n");
        IOException e = assertThrows(IOException.class, () -> new MGFFile(badPeak.toFile()));
        assertTrue(e.getMessage().contains("bad_peak.mgf:3"), e.getMessage());

        Path badCharge = write("bad_charge.mgf", "BEGIN IONS\nTITLE=a\nCHARGE=two\nEND IONS\n");
        assertThrows(IOException.class, () -> new MGFFile(badCharge.toFile()));

        Path unterminated = write("open.mgf", "BEGIN IONS\nTITLE=a\n100.0 1.0\n");
        assertThrows(IOException.class, () -> new MGFFile(unterminated.toFile()));

        Path strayEnd = write("stray.mgf", "END IONS\n");
        assertThrows(IOException.class, () -> new MGFFile(strayEnd.toFile()));
    }
}
