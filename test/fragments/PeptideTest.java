package fragments;

import edu.umich.andykong.shiftlocalizer.fragments.IonLadder;
import edu.umich.andykong.shiftlocalizer.fragments.IonSeries;
import edu.umich.andykong.shiftlocalizer.fragments.MalformedPeptideException;
import edu.umich.andykong.shiftlocalizer.fragments.Peptide;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PeptideTest {

    // Pyteomics reference values for LESLIEK
    private static final double[] B_PLUS_ONE = {114.09134044390001, 243.13393353187, 330.16596193614004,
            443.25002591327006, 556.3340898904, 685.37668297837};
    private static final double[] Y_PLUS_ONE = {147.11280416447, 276.15539725243997, 389.23946122957,
            502.3235252067, 589.3555536109699, 718.39814669894};
    private static final double[] B_PLUS_TWO = {57.54930845533501, 122.07060499932, 165.58661920145502,
            222.12865119002004, 278.670683178585, 343.19197972257};
    private static final double[] Y_PLUS_TWO = {74.06004031561999, 138.581336859605, 195.12336884817,
            251.66540083673502, 295.18141503886994, 359.702711582855};

    private static void assertLadder(double[] expected, double[] actual) {
        assertEquals(expected.length, actual.length);
        for (int i = 0; i < expected.length; i++)
            assertEquals(expected[i], actual[i], 1e-6, "Mismatch at index " + i);
    }

    @Test
    void singlyChargedLadders() throws MalformedPeptideException {
        ImmutablePair<IonLadder, IonLadder> ladders = Peptide.fragment("LESLIEK", 1);
        IonLadder b = ladders.getLeft();
        IonLadder y = ladders.getRight();

        assertEquals(IonSeries.PREFIX, b.getSeries());
        assertEquals(IonSeries.SUFFIX, y.getSeries());
        assertEquals(6, b.getFragmentCount());
        assertEquals(1, b.getChargeCount());
        assertLadder(B_PLUS_ONE, b.getCharge(0));
        assertLadder(Y_PLUS_ONE, y.getCharge(0));
    }

    @Test
    void fragmentChargeIsCappedAtTwo() throws MalformedPeptideException {
        for (int z = 2; z <= 5; z++) {
            ImmutablePair<IonLadder, IonLadder> ladders = Peptide.fragment("LESLIEK", z);
            assertEquals(2, ladders.getLeft().getChargeCount());
            assertLadder(B_PLUS_ONE, ladders.getLeft().getCharge(0));
            assertLadder(B_PLUS_TWO, ladders.getLeft().getCharge(1));
            assertLadder(Y_PLUS_TWO, ladders.getRight().getCharge(1));
        }
        assertThrows(IllegalArgumentException.class, () -> Peptide.fragment("LESLIEK", 0));
    }

    @Test
    void inlineModificationShiftsLadders() throws MalformedPeptideException {
        ImmutablePair<IonLadder, IonLadder> ladders = Peptide.fragment("LES[+79]LIEK", 1);
        double[] b = ladders.getLeft().getCharge(0);
        double[] y = ladders.getRight().getCharge(0);
        for (int i = 0; i < 6; i++) {
            assertEquals(B_PLUS_ONE[i] + (i >= 2 ? 79.0 : 0), b[i], 1e-6, "Mismatch at index " + i);
            assertEquals(Y_PLUS_ONE[i] + (i >= 4 ? 79.0 : 0), y[i], 1e-6, "Mismatch at index " + i);
        }
    }

    @Test
    void modificationNotations() throws MalformedPeptideException {
        Peptide bracketed = Peptide.parse("LES[+79.966]LIEK");
        Peptide bare = Peptide.parse("LES+79.966LIEK");
        Peptide unsigned = Peptide.parse("LES[79.966]LIEK");
        assertEquals("LESLIEK", bracketed.pepSeq);
        assertEquals(7, bracketed.length());
        assertArrayEquals(bracketed.getResidueMasses(), bare.getResidueMasses(), 1e-12);
        assertArrayEquals(bracketed.getResidueMasses(), unsigned.getResidueMasses(), 1e-12);
        assertEquals(79.966, bracketed.mods[2], 1e-12);

        Peptide negative = Peptide.parse("M[-18.0106]PEPTIDE");
        assertEquals(131.040484645 - 18.0106, negative.getResidueMass(0), 1e-9);

        // stacked modifications on one residue add up
        Peptide stacked = Peptide.parse("C[+57.021][+1.0]K");
        assertEquals(58.021, stacked.mods[0], 1e-9);
        assertEquals(0, stacked.mods[1], 0);
    }

    @Test
    void malformedSequences() {
        assertMalformed("PEPXIDE", 3);
        assertMalformed("PEPTIDE[+79", 7);
        assertMalformed("[+42]PEPTIDE", 0);
        assertMalformed("PEP[abc]TIDE", 3);
        assertMalformed("PEP-TIDE", 3);
        assertMalformed("pePTIDE", 0);
        assertMalformed("PEP TIDE", 3);
        assertMalformed("", 0);
    }

    private static void assertMalformed(String seq, int position) {
        MalformedPeptideException e = assertThrows(MalformedPeptideException.class, () -> Peptide.parse(seq));
        assertEquals(seq, e.getSequence());
        assertEquals(position, e.getPosition(), e.getMessage());
        assertNull(e.getRecordId());
    }

    @Test
    void failureCarriesRecordId() {
        MalformedPeptideException e = assertThrows(MalformedPeptideException.class, () -> Peptide.parse("PEPZ"));
        MalformedPeptideException tagged = e.forRecord("psm_12");
        assertEquals("psm_12", tagged.getRecordId());
        assertSame(e, tagged.getCause());
        assertTrue(tagged.getMessage().startsWith("[psm_12] "), tagged.getMessage());
        assertTrue(tagged.getMessage().contains("PEPZ"), tagged.getMessage());
    }

    @Test
    void singleResidueHasNoFragments() throws MalformedPeptideException {
        ImmutablePair<IonLadder, IonLadder> ladders = Peptide.fragment("K", 2);
        assertEquals(0, ladders.getLeft().getFragmentCount());
        assertEquals(0, ladders.getRight().getFragmentCount());
    }
}
