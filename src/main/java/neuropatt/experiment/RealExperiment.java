package neuropatt.experiment;

import java.util.Date;

import neuropatt.AnalysisReport;
import neuropatt.AnalysisResult;
import neuropatt.Config;
import neuropatt.ConsoleProgressSink;
import neuropatt.PatternAnalysis;
import neuropatt.Recording;
import neuropatt.RecordingFile;
import neuropatt.SparkTrialExecutor;
import neuropatt.exception.AnalysisException;
import neuropatt.exception.FileFormatNotCorrectException;

/**
 * The Driver class using Apache Spark.
 * <p>
 * Arguments: {@code recording samplingRate [config] [--only-patterns]}
 *
 * @author Ben
 *
 */
public class RealExperiment {

	public static void main(String[] args) throws AnalysisException, FileFormatNotCorrectException {
		if (args.length < 2) {
			System.err.println("Usage: RealExperiment <recording> <samplingRate> [config] [--only-patterns]");
			System.exit(2);
		}
		String recordingPath = args[0];
		double samplingRate = Double.parseDouble(args[1]);
		boolean onlyPatterns = false;
		String configPath = null;
		for (int i = 2; i < args.length; i++) {
			if ("--only-patterns".equals(args[i])) {
				onlyPatterns = true;
			} else {
				configPath = args[i];
			}
		}

		// load configuration and recording
		System.out.println("load configuration and recording");
		Config config = configPath != null ? Config.readFile(configPath) : Config.fromResource("neuropatt.properties");
		Recording recording = RecordingFile.read(recordingPath);
		System.out.println(new Date() + ": Successfully read " + recording);

		long start = System.nanoTime();
		try (SparkTrialExecutor executor = SparkTrialExecutor.create(config)) {
			PatternAnalysis analysis = PatternAnalysis.withDefaults(config, executor, new ConsoleProgressSink());
			AnalysisResult result = analysis.run(recording, samplingRate, config, onlyPatterns, false);
			System.out.println(AnalysisReport.format(result));
		}
		System.out.println("Total Execution Time: " + (System.nanoTime() - start) / 1e9 + " seconds.");
	}
}
