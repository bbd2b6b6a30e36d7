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

public class Spectrum {

	public final String scanName;
	public int scanNum;
	public int charge;
	public double precursorMZ;
	final double [] peakMZ;
	final double [] peakInt;

	public Spectrum(String scanName, double [] peakMZ, double [] peakInt) {
		if (peakMZ.length != peakInt.length)
			throw new IllegalArgumentException(String.format("Spectrum %s has %d m/z values but %d intensities",
					scanName, peakMZ.length, peakInt.length));
		this.scanName = scanName;
		this.peakMZ = peakMZ.clone();
		this.peakInt = peakInt.clone();
		for (int i = 0; i < this.peakInt.length; i++) {
			if (!(this.peakInt[i] >= 0))
				throw new IllegalArgumentException(String.format("Spectrum %s has negative intensity %f at peak %d",
						scanName, this.peakInt[i], i));
		}
	}

	public Spectrum(String scanName, int scanNum, int charge, double precursorMZ, double [] peakMZ, double [] peakInt) {
		this(scanName, peakMZ, peakInt);
		this.scanNum = scanNum;
		this.charge = charge;
		this.precursorMZ = precursorMZ;
	}

	public int size() {
		return peakMZ.length;
	}

	public double getPeakMZ(int i) {
		return peakMZ[i];
	}

	public double getPeakInt(int i) {
		return peakInt[i];
	}

	public double [] getPeakMZ() {
		return peakMZ.clone();
	}

	public double findBasePeakInt() {
		double bpInt = 0;
		for (int i = 0; i < peakInt.length; i++) {
			if (peakInt[i] > bpInt)
				bpInt = peakInt[i];
		}
		return bpInt;
	}

	public String toString() {
		StringBuffer sb = new StringBuffer();
		sb.append(scanName + " -");
		for (int i = 0; i < peakMZ.length; i++)
			sb.append(String.format(" [%.4f %.2f]", peakMZ[i], peakInt[i]));
		return sb.toString();
	}
}
