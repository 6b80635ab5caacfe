package neuropatt.experiment;

import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.text.SimpleDateFormat;
import java.util.Date;

import neuropatt.AnalysisReport;
import neuropatt.AnalysisResult;
import neuropatt.Config;
import neuropatt.ConsoleProgressSink;
import neuropatt.PatternAnalysis;
import neuropatt.Recording;
import neuropatt.SparkTrialExecutor;
import neuropatt.exception.AnalysisException;
import neuropatt.exception.FileFormatNotCorrectException;

/**
 * Runs the pattern analysis on simulated waves using Apache Spark.
 * <p>
 * Arguments: {@code trials timesteps [rows cols [config]]}
 *
 * @author Ben
 *
 */
public class Simulation {

	public static void main(String[] args) throws AnalysisException, FileFormatNotCorrectException {
		int trials = Integer.parseInt(args[0]);
		int timesteps = Integer.parseInt(args[1]);
		int rows = args.length > 3 ? Integer.parseInt(args[2]) : 10;
		int cols = args.length > 3 ? Integer.parseInt(args[3]) : 10;
		Config config = args.length > 4 ? Config.readFile(args[4]) : Config.fromResource("neuropatt.properties");
		double samplingRate = 250;

		PrintStream out;
		try {
			SimpleDateFormat formatter = new SimpleDateFormat("yyyy_MM_dd_HH_mm_ss");
			out = new PrintStream(new FileOutputStream("simulation_" + trials + "x" + timesteps + "_"
					+ formatter.format(new Date()) + ".txt"));
		} catch (FileNotFoundException e) {
			System.err.println("Cannot open output file, writing to the console: " + e.getMessage());
			out = System.out;
		}

		System.out.println("Generate " + trials + " simulated trials of " + rows + " x " + cols + " channels");
		WaveSimulator simulator = new WaveSimulator(rows, cols, samplingRate, config.morletCfreq, 0.1, 42L);
		Recording recording = simulator.generate(timesteps, trials, (int) (samplingRate / 2));

		try (SparkTrialExecutor executor = SparkTrialExecutor.create(config)) {
			PatternAnalysis analysis = PatternAnalysis.withDefaults(config, executor, new ConsoleProgressSink(out));
			AnalysisResult result = analysis.run(recording, samplingRate, config, true, false);
			out.println(AnalysisReport.format(result));
		} finally {
			if (out != System.out) {
				out.close();
			}
		}
	}
}
