package neuropatt.experiment;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import neuropatt.Recording;

public class WaveSimulatorTest {

	@Test
	void sameSeedGivesSameRecording() {
		Recording a = new WaveSimulator(4, 5, 250, 6, 0.1, 9L).generate(30, 2, 10);
		Recording b = new WaveSimulator(4, 5, 250, 6, 0.1, 9L).generate(30, 2, 10);

		assertArrayEquals(new int[] { 4, 5, 30, 2 }, a.getShape());
		for (int channel = 0; channel < a.getChannels(); channel++) {
			assertArrayEquals(a.getTimeSeries(channel, 1), b.getTimeSeries(channel, 1));
		}
	}

	@Test
	void noiselessSamplesStayWithinUnitAmplitude() {
		Recording recording = new WaveSimulator(3, 3, 100, 5, 0, 1L).generate(40, 1, 10);

		for (int t = 0; t < 40; t++) {
			for (int row = 0; row < 3; row++) {
				for (int col = 0; col < 3; col++) {
					assertTrue(Math.abs(recording.get(row, col, t, 0)) <= 1 + 1e-12);
				}
			}
		}
		// the plane wave runs along the columns, so rows agree outside rotating epochs
		int planeSteps = 0;
		for (int t = 0; t < 40; t++) {
			if (recording.get(0, 1, t, 0) == recording.get(2, 1, t, 0)) {
				planeSteps++;
			}
		}
		assertTrue(planeSteps > 0 && planeSteps < 40);
		assertEquals(recording.get(0, 0, 0, 0), new WaveSimulator(3, 3, 100, 5, 0, 1L).generate(40, 1, 10)
				.get(0, 0, 0, 0));
	}
}
