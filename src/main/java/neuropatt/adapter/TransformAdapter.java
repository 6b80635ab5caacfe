package neuropatt.adapter;

import neuropatt.ComplexRecording;
import neuropatt.Recording;

/**
 * Time-frequency decomposition of every channel of a recording.
 */
public interface TransformAdapter {

	/**
	 * @param centerFrequency in Hz
	 * @param bandwidthParam  shape parameter of the decomposition
	 * @param timeDim         axis holding time; always 3 (one based)
	 * @return coefficients with exactly the shape of {@code data}
	 */
	ComplexRecording transform(Recording data, double samplingRate, double centerFrequency, double bandwidthParam,
			int timeDim);
}
