package neuropatt;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.BitSet;
import java.util.Random;

import org.apache.commons.math3.stat.StatUtils;
import org.junit.jupiter.api.Test;

import neuropatt.exception.InvalidShapeException;

public class PreprocessorTest {

	private static final double EPS = 1e-9;

	private static Recording randomRecording(int rows, int cols, int timesteps, int trials, long seed) {
		Random rand = new Random(seed);
		Recording recording = new Recording(rows, cols, timesteps, trials);
		for (int trial = 0; trial < trials; trial++) {
			for (int t = 0; t < timesteps; t++) {
				for (int row = 0; row < rows; row++) {
					for (int col = 0; col < cols; col++) {
						recording.set(row, col, t, trial, 5 + 3 * rand.nextGaussian());
					}
				}
			}
		}
		return recording;
	}

	@Test
	void subtractsMeanPerChannelAndTrial() throws InvalidShapeException {
		Recording data = randomRecording(3, 4, 20, 2, 1L);
		Preprocessor.Result result = new Preprocessor().preprocess(data, new Config());
		Recording centred = result.getRecording();
		for (int trial = 0; trial < 2; trial++) {
			for (int channel = 0; channel < centred.getChannels(); channel++) {
				assertEquals(0, StatUtils.mean(centred.getTimeSeries(channel, trial)), EPS);
			}
		}
		assertNotSame(data, centred);
		assertEquals(data.get(0, 0, 0, 0), randomRecording(3, 4, 20, 2, 1L).get(0, 0, 0, 0), "input must not change");
	}

	@Test
	void centringTwiceChangesNothing() throws InvalidShapeException {
		Preprocessor preprocessor = new Preprocessor();
		Config config = new Config();
		Recording once = preprocessor.preprocess(randomRecording(2, 2, 15, 3, 2L), config).getRecording();
		Recording twice = preprocessor.preprocess(once, config).getRecording();
		for (int trial = 0; trial < 3; trial++) {
			for (int channel = 0; channel < 4; channel++) {
				assertArrayEquals(once.getTimeSeries(channel, trial), twice.getTimeSeries(channel, trial), EPS);
			}
		}
	}

	@Test
	void zscoreGivesUnitVarianceOnValidChannels() throws InvalidShapeException {
		Recording data = randomRecording(2, 3, 30, 2, 3L);
		// flat channel
		for (int t = 0; t < 30; t++) {
			data.set(1, 2, t, 0, 4.0);
			data.set(1, 2, t, 1, 4.0);
		}
		Config config = new Config();
		config.zscoreChannels = true;
		Preprocessor.Result result = new Preprocessor().preprocess(data, config);
		Recording normalised = result.getRecording();
		int flat = data.getChannel(1, 2);
		assertTrue(result.getBadChannels().get(flat));
		for (int trial = 0; trial < 2; trial++) {
			for (int channel = 0; channel < data.getChannels(); channel++) {
				double[] series = normalised.getTimeSeries(channel, trial);
				assertEquals(0, StatUtils.mean(series), EPS);
				if (channel != flat) {
					assertEquals(1, Math.sqrt(StatUtils.variance(series)), EPS);
				} else {
					assertArrayEquals(new double[30], series, EPS);
				}
			}
		}
	}

	@Test
	void zscoreFlagsChannelFlatInOneTrial() throws InvalidShapeException {
		Recording data = randomRecording(2, 2, 20, 2, 6L);
		for (int t = 0; t < 20; t++) {
			data.set(0, 0, t, 0, 3.0);
		}
		Config config = new Config();
		config.zscoreChannels = true;
		Preprocessor.Result result = new Preprocessor().preprocess(data, config);
		BitSet bad = result.getBadChannels();
		assertTrue(bad.get(0));
		assertEquals(1, bad.cardinality());
		for (int trial = 0; trial < 2; trial++) {
			for (int channel = 1; channel < data.getChannels(); channel++) {
				double[] series = result.getRecording().getTimeSeries(channel, trial);
				assertEquals(1, Math.sqrt(StatUtils.variance(series)), EPS);
			}
		}

		config.zscoreChannels = false;
		assertFalse(new Preprocessor().preprocess(data, config).getBadChannels().get(0));
	}

	@Test
	void flagsConstantAndNaNChannels()throws InvalidShapeException {
		Recording data = randomRecording(2, 2, 10, 2, 4L);
		for (int trial = 0; trial < 2; trial++) {
			for (int t = 0; t < 10; t++) {
				data.set(0, 0, t, trial, trial); // constant within every trial
			}
		}
		data.set(0, 1, 7, 1, Double.NaN);
		// constant in one trial only
		for (int t = 0; t < 10; t++) {
			data.set(1, 0, t, 0, 2.0);
		}

		BitSet bad = new Preprocessor().preprocess(data, new Config()).getBadChannels();
		BitSet expected = new BitSet();
		expected.set(0);
		expected.set(1);
		assertEquals(expected, bad);
		assertFalse(bad.get(data.getChannel(1, 0)));
	}

	@Test
	void badChannelsAreFoundBeforeNormalisation() throws InvalidShapeException {
		Recording data = randomRecording(1, 2, 5, 1, 5L);
		for (int t = 0; t < 5; t++) {
			data.set(0, 1, t, 0, 0);
		}
		Config config = new Config();
		config.subtractBaseline = false;
		config.zscoreChannels = false;
		Preprocessor.Result result = new Preprocessor().preprocess(data, config);
		assertEquals(1, result.getBadChannels().cardinality());
		assertEquals(data.get(0, 0, 3, 0), result.getRecording().get(0, 0, 3, 0));
	}

	@Test
	void singleTimeSampleIsRejected() {
		Recording data = new Recording(2, 2, 1, 3);
		assertThrows(InvalidShapeException.class, () -> new Preprocessor().preprocess(data, new Config()));
	}

	@Test
	void recordingShapeIsChecked() throws InvalidShapeException {
		assertThrows(InvalidShapeException.class, () -> Recording.of(new int[] { 4, 4 }, new double[16]));
		assertThrows(InvalidShapeException.class, () -> Recording.of(new int[] { 2, 2, 2, 2, 2 }, new double[32]));
		assertThrows(InvalidShapeException.class, () -> Recording.of(new int[] { 2, 0, 3 }, new double[0]));
		assertThrows(InvalidShapeException.class, () -> Recording.of(new int[] { 2, 2, 3, 2 }, new double[12]));

		Recording single = Recording.of(new int[] { 2, 2, 3 }, new double[12]);
		assertEquals(1, single.getTrials());
		assertArrayEquals(new int[] { 2, 2, 3, 1 }, single.getShape());
	}
}
