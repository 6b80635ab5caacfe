package neuropatt;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.BitSet;

import org.junit.jupiter.api.Test;

import neuropatt.adapter.OpticalFlowAdapter;
import neuropatt.exception.AdapterFailureException;
import neuropatt.exception.AnalysisException;

public class VelocityFieldBuilderTest {

	/**
	 * Fills the velocity with the real part of the first coefficient of the
	 * trial, and reports ten times that many iterations.
	 */
	static class MarkerFlow implements OpticalFlowAdapter {
		private static final long serialVersionUID = 1L;

		@Override
		public FlowResult estimate(ComplexRecording trial, BitSet badChannels, double alpha, double beta,
				boolean useAmplitude) {
			double marker = trial.getReal(0, 0, 0, 0);
			int size = trial.getChannels() * (trial.getTimesteps() - 1);
			double[] vx = new double[size];
			double[] vy = new double[size];
			double[] steps = new double[trial.getTimesteps() - 1];
			Arrays.fill(vx, marker);
			Arrays.fill(vy, -marker);
			Arrays.fill(steps, 10 * marker);
			return new FlowResult(vx, vy, steps);
		}
	}

	static ComplexRecording markedCoefficients(int rows, int cols, int timesteps, int trials) {
		ComplexRecording coeffs = new ComplexRecording(rows, cols, timesteps, trials);
		for (int trial = 0; trial < trials; trial++) {
			coeffs.set(0, 0, 0, trial, trial + 1, 0);
		}
		return coeffs;
	}

	@Test
	void fieldHasOneSnapshotLessThanCoefficients() throws AnalysisException {
		ComplexRecording coeffs = markedCoefficients(2, 3, 5, 3);
		VelocityFieldBuilder builder = new VelocityFieldBuilder(new MarkerFlow(), new SequentialTrialExecutor());

		VelocityFieldBuilder.Result result = builder.build(coeffs, new BitSet(), new Config());
		VelocityField field = result.getField();

		assertEquals(4, field.getTimesteps());
		assertEquals(3, field.getTrials());
		assertEquals(2, field.getRows());
		assertEquals(3, field.getCols());
		for (int trial = 0; trial < 3; trial++) {
			assertEquals(new Velocity(trial + 1, -(trial + 1)), field.get(1, 2, 3, trial));
		}
		assertArrayEquals(new double[] { 10, 20, 30 }, result.getTrialConvergenceSteps(), 1e-12);
		assertEquals(20, result.getMeanConvergenceSteps(), 1e-12);
	}

	@Test
	void failingTrialIsNamed() {
		OpticalFlowAdapter failsOnSecond = (trial, bad, alpha, beta, useAmplitude) -> {
			if (trial.getReal(0, 0, 0, 0) == 2) {
				throw new IllegalStateException("singular system");
			}
			return new MarkerFlow().estimate(trial, bad, alpha, beta, useAmplitude);
		};
		VelocityFieldBuilder builder = new VelocityFieldBuilder(failsOnSecond, new SequentialTrialExecutor());

		AdapterFailureException e = assertThrows(AdapterFailureException.class,
				() -> builder.build(markedCoefficients(2, 2, 4, 3), new BitSet(), new Config()));
		assertEquals(1, e.getTrial());
		assertEquals(Stage.OPTICAL_FLOW, e.getStage());
		assertTrue(e.getCause() instanceof IllegalStateException);
	}

	@Test
	void resultOfWrongLengthIsRejected() {
		OpticalFlowAdapter tooShort = (trial, bad, alpha, beta, useAmplitude) -> new FlowResult(new double[1],
				new double[1], new double[trial.getTimesteps() - 1]);
		VelocityFieldBuilder builder = new VelocityFieldBuilder(tooShort, new SequentialTrialExecutor());

		AdapterFailureException e = assertThrows(AdapterFailureException.class,
				() -> builder.build(markedCoefficients(2, 2, 4, 2), new BitSet(), new Config()));
		assertEquals(0, e.getTrial());
	}

	@Test
	void divergedFlowIsRejected() {
		OpticalFlowAdapter diverges = (trial, bad, alpha, beta, useAmplitude) -> {
			FlowResult result = new MarkerFlow().estimate(trial, bad, alpha, beta, useAmplitude);
			result.getVx()[0] = Double.NaN;
			return result;
		};
		VelocityFieldBuilder builder = new VelocityFieldBuilder(diverges, new SequentialTrialExecutor());

		AdapterFailureException e = assertThrows(AdapterFailureException.class,
				() -> builder.build(markedCoefficients(2, 2, 4, 1), new BitSet(), new Config()));
		assertTrue(e.getMessage().contains("diverged"));
	}

	@Test
	void badChannelsReachTheAdapter() throws AnalysisException {
		BitSet bad = new BitSet();
		bad.set(3);
		OpticalFlowAdapter checksBad = (trial, badChannels, alpha, beta, useAmplitude) -> {
			if (!bad.equals(badChannels)) {
				throw new IllegalStateException("got " + badChannels);
			}
			return new MarkerFlow().estimate(trial, badChannels, alpha, beta, useAmplitude);
		};
		VelocityFieldBuilder builder = new VelocityFieldBuilder(checksBad, new SequentialTrialExecutor());

		builder.build(markedCoefficients(2, 2, 3, 2), bad, new Config());
	}
}
