package neuropatt;

import java.util.BitSet;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import neuropatt.exception.InvalidShapeException;

/**
 * Baseline removal, z-scoring and detection of channels that cannot be used
 * for flow estimation.
 *
 * @author Ben
 *
 */
public class Preprocessor {

	private static final Logger logger = LogManager.getLogger(Preprocessor.class);

	/**
	 * Adjusted recording plus the set of invalid channels.
	 */
	public static class Result {
		private final Recording recording;
		private final BitSet badChannels;

		public Result(Recording recording, BitSet badChannels) {
			this.recording = recording;
			this.badChannels = badChannels;
		}

		public Recording getRecording() {
			return this.recording;
		}

		/**
		 * @return flat channel indices ({@code row * cols + col}), as a copy
		 */
		public BitSet getBadChannels() {
			return (BitSet) this.badChannels.clone();
		}
	}

	/**
	 * The input recording is not modified. When z-scoring, a channel that is
	 * flat in any single trial is flagged as well.
	 *
	 * @throws InvalidShapeException if there are fewer than two snapshots
	 */
	public Result preprocess(Recording data, Config config) throws InvalidShapeException {
		if (data.getTimesteps() < 2) {
			throw new InvalidShapeException("At least two time samples are needed to estimate velocity",
					data.getShape());
		}
		BitSet badChannels = findBadChannels(data);
		Recording adjusted = data.copy();

		if (config.zscoreChannels || config.subtractBaseline) {
			for (int trial = 0; trial < data.getTrials(); trial++) {
				for (int channel = 0; channel < data.getChannels(); channel++) {
					double[] series = adjusted.getTimeSeries(channel, trial);
					subtractMean(series);
					// a trial without variance cannot be normalised
					if (config.zscoreChannels && !divideByStd(series)) {
						badChannels.set(channel);
					}
					adjusted.setTimeSeries(channel, trial, series);
				}
			}
		}
		logger.debug("{} of {} channels flagged as bad", badChannels.cardinality(), data.getChannels());
		return new Result(adjusted, badChannels);
	}

	/**
	 * A channel is bad if any of its samples is NaN, or if it never changes
	 * over time within any trial (this includes all-zero channels).
	 */
	public static BitSet findBadChannels(Recording data) {
		BitSet bad = new BitSet(data.getChannels());
		for (int channel = 0; channel < data.getChannels(); channel++) {
			boolean hasNaN = false;
			boolean constant = true;
			for (int trial = 0; trial < data.getTrials(); trial++) {
				double[] series = data.getTimeSeries(channel, trial);
				for (double val : series) {
					if (Double.isNaN(val)) {
						hasNaN = true;
					} else if (val != series[0]) {
						constant = false;
					}
				}
			}
			if (hasNaN || constant) {
				bad.set(channel);
			}
		}
		return bad;
	}

	static void subtractMean(double[] series) {
		double mean = StatUtils.mean(series);
		for (int i = 0; i < series.length; i++) {
			series[i] -= mean;
		}
	}

	/**
	 * Divides by the bias-corrected standard deviation. Flat or undefined
	 * series are left as they are.
	 *
	 * @return false if the series could not be scaled
	 */
	static boolean divideByStd(double[] series) {
		double std = Math.sqrt(StatUtils.variance(series));
		if (std == 0 || Double.isNaN(std)) {
			return false;
		}
		for (int i = 0; i < series.length; i++) {
			series[i] /= std;
		}
		return true;
	}
}
