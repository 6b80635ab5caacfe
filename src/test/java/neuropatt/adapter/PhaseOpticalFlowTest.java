package neuropatt.adapter;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.BitSet;

import org.junit.jupiter.api.Test;

import neuropatt.ComplexRecording;
import neuropatt.FlowResult;

public class PhaseOpticalFlowTest {

	private final PhaseOpticalFlow flow = new PhaseOpticalFlow(1000, 1e-4);

	/**
	 * Unit amplitude wave exp(i(omega t - k col)) travelling towards higher
	 * columns at omega / k cells per step.
	 */
	private static ComplexRecording planeWave(int rows, int cols, int timesteps, double omega, double k) {
		ComplexRecording wave = new ComplexRecording(rows, cols, timesteps, 1);
		for (int t = 0; t < timesteps; t++) {
			for (int row = 0; row < rows; row++) {
				for (int col = 0; col < cols; col++) {
					double phase = omega * t - k * col;
					wave.set(row, col, t, 0, Math.cos(phase), Math.sin(phase));
				}
			}
		}
		return wave;
	}

	@Test
	void zeroInputConvergesImmediately() {
		FlowResult result = flow.estimate(new ComplexRecording(4, 4, 3, 1), new BitSet(), 0.5, 1, false);

		assertEquals(4 * 4 * 2, result.getVx().length);
		assertArrayEquals(new double[32], result.getVx());
		assertArrayEquals(new double[32], result.getVy());
		assertArrayEquals(new double[] { 1, 1 }, result.getConvergenceSteps());
		assertNull(result.validate(16, 3));
	}

	@Test
	void planeWaveMovesAlongColumns() {
		FlowResult result = flow.estimate(planeWave(5, 6, 3, 0.3, 0.5), new BitSet(), 0.5, 1, false);

		for (int i = 0; i < result.getVx().length; i++) {
			assertEquals(0.6, result.getVx()[i], 1e-2);
			assertEquals(0, result.getVy()[i], 1e-12);
		}
		assertTrue(result.getConvergenceSteps()[0] > 1);
		assertTrue(result.getConvergenceSteps()[1] <= result.getConvergenceSteps()[0],
				"second pair starts from the first solution");
	}

	@Test
	void reversedWaveReversesVelocity() {
		FlowResult result = flow.estimate(planeWave(5, 6, 2, -0.3, 0.5), new BitSet(), 0.5, 0, false);

		assertEquals(-0.6, result.getVx()[7], 1e-2);
	}

	@Test
	void amplitudeModeIgnoresConstantAmplitude() {
		FlowResult result = flow.estimate(planeWave(4, 4, 3, 0.3, 0.5), new BitSet(), 0.5, 1, true);

		assertArrayEquals(new double[32], result.getVx(), 1e-9);
		assertArrayEquals(new double[] { 1, 1 }, result.getConvergenceSteps());
	}

	@Test
	void badChannelsTakeMeanOfValidNeighbours() {
		double[] re = { 9, 1, 9, 2, 100, 3, 9, 4, 9 };
		double[] im = new double[9];
		BitSet bad = new BitSet();
		bad.set(4);

		PhaseOpticalFlow.interpolateBadChannels(re, im, 3, 3, bad);

		assertEquals(2.5, re[4], 1e-12);
		assertEquals(1, re[1], 1e-12);
	}

	@Test
	void isolatedBadChannelsBecomeZero() {
		double[] re = { 5, 5, 5, 5 };
		double[] im = { 1, 1, 1, 1 };
		BitSet bad = new BitSet();
		bad.set(0, 4);

		PhaseOpticalFlow.interpolateBadChannels(re, im, 2, 2, bad);

		assertArrayEquals(new double[4], re);
		assertArrayEquals(new double[4], im);
	}

	@Test
	void iterationLimitsArePositive() {
		assertThrows(IllegalArgumentException.class, () -> new PhaseOpticalFlow(0, 1e-3));
		assertThrows(IllegalArgumentException.class, () -> new PhaseOpticalFlow(10, 0));
	}
}
