package edu.umich.andykong.shiftlocalizer.core;

import com.google.common.collect.ImmutableMap;

import java.util.Arrays;

public class ResidueMasses {

	public static final double H = 1.007825035;
	public static final double O = 15.99491463;
	public static final double H2O = 2 * H + O;
	public static final double PROTON = 1.00727646688;

	// C is unmodified, carbamidomethylation has to be written inline
	public static final ImmutableMap<Character, Double> monoisotopic = ImmutableMap.<Character, Double>builder()
			.put('G', 57.021463735)
			.put('A', 71.037113805)
			.put('S', 87.032028435)
			.put('P', 97.052763875)
			.put('V', 99.068413945)
			.put('T', 101.047678505)
			.put('C', 103.009184505)
			.put('L', 113.084064015)
			.put('I', 113.084064015)
			.put('N', 114.042927470)
			.put('D', 115.026943065)
			.put('Q', 128.058577540)
			.put('K', 128.094963050)
			.put('E', 129.042593135)
			.put('M', 131.040484645)
			.put('H', 137.058911875)
			.put('F', 147.068413945)
			.put('U', 150.953633405)
			.put('R', 156.101111050)
			.put('Y', 163.063328575)
			.put('W', 186.079312980)
			.put('O', 237.147726925)
			.build();

	// dense copy of the map for the parsing loop, NaN = not a residue
	private static final double[] massByLetter = new double[26];

	static {
		Arrays.fill(massByLetter, Double.NaN);
		for (Character aa : monoisotopic.keySet())
			massByLetter[aa - 'A'] = monoisotopic.get(aa);
	}

	private ResidueMasses() {
	}

	public static boolean isResidue(char aa) {
		return aa >= 'A' && aa <= 'Z' && !Double.isNaN(massByLetter[aa - 'A']);
	}

	/**
	 * Monoisotopic residue mass
	 * @param aa single uppercase residue code
	 * @return mass in Da
	 * @throws IllegalArgumentException if aa is not a known residue
	 */
	public static double getMass(char aa) {
		if (!isResidue(aa))
			throw new IllegalArgumentException("Unknown residue: " + aa);
		return massByLetter[aa - 'A'];
	}

	/**
	 * Convert neutral mass to m/z, where the fragment carries charge protons
	 * @param neutralMass neutral mass
	 * @param charge charge
	 * @return m/z
	 */
	public static double neutralMassToMZ(double neutralMass, int charge) {
		return (neutralMass / charge) + PROTON;
	}
}
