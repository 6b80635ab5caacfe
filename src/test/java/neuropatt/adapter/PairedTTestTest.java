package neuropatt.adapter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.commons.math3.stat.inference.TTest;
import org.junit.jupiter.api.Test;

public class PairedTTestTest {

	private final PairedTTest test = new PairedTTest();

	@Test
	void identicalSamplesGiveOne() {
		double[] sample = { 1, 4, 2, 8 };
		assertEquals(1.0, test.pValue(sample, sample.clone()));
	}

	@Test
	void constantShiftGivesZero() {
		assertEquals(0.0, test.pValue(new double[] { 3, 4, 5 }, new double[] { 1, 2, 3 }));
	}

	@Test
	void agreesWithTwoSidedPairedTTest() {
		double[] a = { 1.0, 2.0, 3.0, 4.0, 5.0 };
		double[] b = { 1.5, 2.1, 2.9, 4.6, 5.2 };
		double p = test.pValue(a, b);
		assertEquals(new TTest().pairedTTest(a, b), p, 1e-12);
		assertTrue(p > 0 && p < 1);
		assertEquals(p, test.pValue(b, a), 1e-12);
	}

	@Test
	void needsTwoPairsOfEqualLength() {
		assertThrows(IllegalArgumentException.class, () -> test.pValue(new double[] { 1 }, new double[] { 2 }));
		assertThrows(IllegalArgumentException.class,
				() -> test.pValue(new double[] { 1, 2 }, new double[] { 2, 3, 4 }));
	}
}
