package neuropatt;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Plain text summary of an analysis result.
 */
public final class AnalysisReport {

	private AnalysisReport() {
	}

	public static String format(AnalysisResult result) {
		StringBuilder sb = new StringBuilder();
		List<List<Pattern>> patterns = result.getPatterns();
		int total = 0;
		for (List<Pattern> trial : patterns) {
			total += trial.size();
		}
		sb.append("Bad channels: ").append(result.getBadChannels().cardinality()).append('\n');
		sb.append("Time steps: ").append(result.getNTimeSteps()).append(", trials: ").append(patterns.size())
				.append('\n');
		sb.append(String.format("Mean optical flow convergence steps: %.1f%n", result.getMeanConvergenceSteps()));
		sb.append("Patterns found: ").append(total).append('\n');
		sb.append(result.getVocabulary().legend()).append('\n');

		TransitionStatistics statistics = result.getStatistics();
		sb.append("Observed minus expected pattern transitions/sec\n");
		appendMatrix(sb, statistics.getMeanRateDiff());
		sb.append("Fractional change between observed and expected\n");
		appendMatrix(sb, statistics.getFractionalChange());
		if (statistics.isSignificanceTested()) {
			sb.append("Paired t-test p-values\n");
			appendMatrix(sb, statistics.getPValues());
			sb.append("Bonferroni corrected p-values\n");
			appendMatrix(sb, statistics.getCorrectedPValues());
		} else {
			sb.append("Single trial, no significance tests\n");
		}
		sb.append(String.format("Processing time: %.1f seconds%n", result.getProcessTime().toMillis() / 1e3));
		return sb.toString();
	}

	static void appendMatrix(StringBuilder sb, double[][] matrix) {
		for (double[] row : matrix) {
			for (double val : row) {
				sb.append(StringUtils.leftPad(String.format("%.4g", val), 12));
			}
			sb.append('\n');
		}
	}
}
