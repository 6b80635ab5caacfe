package neuropatt.adapter;

import java.io.Serializable;
import java.util.BitSet;

import neuropatt.ComplexRecording;
import neuropatt.FlowResult;

/**
 * Motion estimation between consecutive snapshots of one trial. Instances are
 * shipped to workers, so they must be serializable.
 */
public interface OpticalFlowAdapter extends Serializable {

	/**
	 * @param trial        single trial coefficients
	 * @param badChannels  channels to exclude or interpolate over
	 * @param alpha        smoothness weight
	 * @param beta         robust penalty constant
	 * @param useAmplitude estimate from amplitude instead of phase
	 * @return velocities with one snapshot fewer than {@code trial} and one
	 *         iteration count per output snapshot
	 */
	FlowResult estimate(ComplexRecording trial, BitSet badChannels, double alpha, double beta, boolean useAmplitude);
}
