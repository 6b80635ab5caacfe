package neuropatt;

import java.util.BitSet;
import java.util.List;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import neuropatt.adapter.OpticalFlowAdapter;
import neuropatt.exception.AdapterFailureException;
import neuropatt.exception.AnalysisException;

/**
 * Runs optical flow estimation for every trial and assembles the velocity
 * field of the whole recording.
 *
 * @author Ben
 *
 */
public class VelocityFieldBuilder {

	private static final Logger logger = LogManager.getLogger(VelocityFieldBuilder.class);

	/**
	 * Velocity field plus convergence diagnostics.
	 */
	public static class Result {
		private final VelocityField field;
		private final double[] trialConvergenceSteps;
		private final double meanConvergenceSteps;

		Result(VelocityField field, double[] trialConvergenceSteps) {
			this.field = field;
			this.trialConvergenceSteps = trialConvergenceSteps;
			this.meanConvergenceSteps = StatUtils.mean(trialConvergenceSteps);
		}

		public VelocityField getField() {
			return this.field;
		}

		/**
		 * @return mean iteration count of each trial, as a copy
		 */
		public double[] getTrialConvergenceSteps() {
			return this.trialConvergenceSteps.clone();
		}

		/**
		 * Mean of the per-trial means. Unusually high values mean the solver
		 * is not converging and the field is suspect.
		 */
		public double getMeanConvergenceSteps() {
			return this.meanConvergenceSteps;
		}
	}

	private final OpticalFlowAdapter opticalFlow;
	private final TrialExecutor executor;

	public VelocityFieldBuilder(OpticalFlowAdapter opticalFlow, TrialExecutor executor) {
		this.opticalFlow = opticalFlow;
		this.executor = executor;
	}

	/**
	 * @throws AdapterFailureException if the estimation fails or returns an
	 *                                 invalid result for any trial
	 */
	public Result build(ComplexRecording coeffs, BitSet badChannels, Config config) throws AnalysisException {
		int channels = coeffs.getChannels();
		int timesteps = coeffs.getTimesteps();
		if (timesteps < 2) {
			throw new AdapterFailureException(Stage.OPTICAL_FLOW, AdapterFailureException.NO_TRIAL,
					"coefficients need at least two snapshots, got " + timesteps);
		}
		Shared<ComplexRecording> bcastCoeffs = executor.share(coeffs);
		Shared<BitSet> bcastBad = executor.share((BitSet) badChannels.clone());
		OpticalFlowAdapter flow = this.opticalFlow;
		double alpha = config.opAlpha;
		double beta = config.opBeta;
		boolean useAmplitude = config.useAmplitude;

		List<FlowResult> slices = executor.map(Stage.OPTICAL_FLOW, coeffs.getTrials(), trial -> {
			FlowResult result = flow.estimate(bcastCoeffs.value().trial(trial), bcastBad.value(), alpha, beta,
					useAmplitude);
			String problem = result == null ? "optical flow returned no result" : result.validate(channels, timesteps);
			if (problem != null) {
				throw new AdapterFailureException(Stage.OPTICAL_FLOW, trial, problem);
			}
			return result;
		});

		// barrier: every trial finished
		double[] trialSteps = new double[slices.size()];
		for (int trial = 0; trial < slices.size(); trial++) {
			trialSteps[trial] = slices.get(trial).getMeanConvergenceSteps();
			logger.debug("Processed trial {} ({} steps on average)", trial + 1, trialSteps[trial]);
		}
		VelocityField field = VelocityField.assemble(coeffs.getRows(), coeffs.getCols(), timesteps - 1, slices);
		return new Result(field, trialSteps);
	}
}
