package neuropatt.adapter;

/**
 * Two-sided test of paired samples.
 */
@FunctionalInterface
public interface PairedSignificanceTest {

	/**
	 * @return probability of the observed differences under the hypothesis of
	 *         no difference
	 */
	double pValue(double[] sampleA, double[] sampleB);
}
