package neuropatt;

import java.text.SimpleDateFormat;
import java.time.Duration;
import java.util.BitSet;
import java.util.Date;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import neuropatt.adapter.CriticalPointPatternExtractor;
import neuropatt.adapter.ModeVisualizer;
import neuropatt.adapter.MorletWaveletTransform;
import neuropatt.adapter.PairedTTest;
import neuropatt.adapter.PatternExtractor;
import neuropatt.adapter.PhaseOpticalFlow;
import neuropatt.adapter.SvdModeSummary;
import neuropatt.adapter.TransformAdapter;
import neuropatt.adapter.WindowedTransitionCounter;
import neuropatt.exception.AdapterFailureException;
import neuropatt.exception.AnalysisException;

/**
 * Filters a (row, column, time, trial) recording, computes velocity vector
 * fields, identifies all patterns in them and tests whether transitions
 * between pattern types happen more or less often than chance.
 *
 * @author Ben
 *
 */
public class PatternAnalysis {

	private static final Logger logger = LogManager.getLogger(PatternAnalysis.class);

	// time is always the third dimension
	private static final int TIME_DIM = 3;

	private final Preprocessor preprocessor;
	private final TransformAdapter transform;
	private final VelocityFieldBuilder velocityFieldBuilder;
	private final PatternDetection patternDetection;
	private final TransitionAnalyzer transitionAnalyzer;
	private final ModeVisualizer visualizer;
	private final ProgressSink progress;

	public PatternAnalysis(Preprocessor preprocessor, TransformAdapter transform,
			VelocityFieldBuilder velocityFieldBuilder, PatternDetection patternDetection,
			TransitionAnalyzer transitionAnalyzer, ModeVisualizer visualizer, ProgressSink progress) {
		this.preprocessor = preprocessor;
		this.transform = transform;
		this.velocityFieldBuilder = velocityFieldBuilder;
		this.patternDetection = patternDetection;
		this.transitionAnalyzer = transitionAnalyzer;
		this.visualizer = visualizer;
		this.progress = progress;
	}

	/**
	 * Wires the default collaborators.
	 */
	public static PatternAnalysis withDefaults(Config config, TrialExecutor executor, ProgressSink progress) {
		return withExtractor(config, executor, progress, new CriticalPointPatternExtractor());
	}

	public static PatternAnalysis withExtractor(Config config, TrialExecutor executor, ProgressSink progress,
			PatternExtractor extractor) {
		return new PatternAnalysis(new Preprocessor(), new MorletWaveletTransform(),
				new VelocityFieldBuilder(new PhaseOpticalFlow(config.opMaxIterations, config.opTolerance), executor),
				new PatternDetection(extractor, executor),
				new TransitionAnalyzer(new WindowedTransitionCounter(), new PairedTTest()), new SvdModeSummary(),
				progress);
	}

	/**
	 * @param data            recording; not modified
	 * @param samplingRate    in Hz
	 * @param onlyPatterns    leave the filtered signal and velocity fields out
	 *                        of the result
	 * @param suppressFigures skip the SVD mode summary
	 */
	public AnalysisResult run(Recording data, double samplingRate, Config config, boolean onlyPatterns,
			boolean suppressFigures) throws AnalysisException {
		long start = System.nanoTime();
		SimpleDateFormat formatter = new SimpleDateFormat("dd-MMM-yyyy HH:mm:ss");
		outputProgress("Beginning NeuroPatt pattern analysis at " + formatter.format(new Date()));

		// Pre-processing
		Preprocessor.Result preprocessed = preprocessor.preprocess(data, config);
		BitSet badChannels = preprocessed.getBadChannels();
		int nTimeSteps = data.getTimesteps() - 1;

		// Band-pass filter data
		outputProgress("Filtering waveforms...");
		long tic = System.nanoTime();
		ComplexRecording wvcfs = filter(preprocessed.getRecording(), samplingRate, config);
		toc(Stage.FILTERING, tic);

		// Velocity vector fields
		outputProgress("Calculating velocity vector fields...");
		tic = System.nanoTime();
		VelocityFieldBuilder.Result flow = velocityFieldBuilder.build(wvcfs, badChannels, config);
		VelocityField vfs = flow.getField();
		toc(Stage.OPTICAL_FLOW, tic);
		outputProgress(String.format("Optical flow took %.1f steps on average to converge.",
				flow.getMeanConvergenceSteps()));

		if (config.performSVD && !suppressFigures) {
			outputProgress("Performing SVD of velocity vector fields...");
			tic = System.nanoTime();
			try {
				visualizer.visualize(vfs, samplingRate, config, this::outputProgress);
			} catch (RuntimeException e) {
				throw new AdapterFailureException(Stage.SVD, AdapterFailureException.NO_TRIAL,
						"mode summary failed: " + e.getMessage(), e);
			}
			toc(Stage.SVD, tic);
		}

		// Find all patterns present
		outputProgress("Identifying all patterns in velocity fields...");
		tic = System.nanoTime();
		PatternDetection.Result patterns = patternDetection.detect(vfs, wvcfs, badChannels, samplingRate,
				config);
		toc(Stage.PATTERN_DETECTION, tic);

		// Evolution between patterns
		outputProgress("Analysing transitions between patterns...");
		tic = System.nanoTime();
		PatternVocabulary vocabulary = patterns.getVocabulary();
		TransitionCounts transitions = transitionAnalyzer.count(patterns.getTrials(), vocabulary.size(), nTimeSteps,
				samplingRate, config);
		TransitionStatistics statistics = transitionAnalyzer.analyze(transitions, nTimeSteps, samplingRate);
		toc(Stage.TRANSITION_ANALYSIS, tic);

		Duration processTime = Duration.ofNanos(System.nanoTime() - start);
		outputProgress(String.format("Pattern analysis complete in %.1f seconds.", processTime.toMillis() / 1e3));
		return new AnalysisResult(onlyPatterns ? null : wvcfs, onlyPatterns ? null : vfs, badChannels, nTimeSteps,
				vocabulary, patterns.getPatterns(), patterns.getLocations(), transitions, statistics,
				flow.getMeanConvergenceSteps(), config, samplingRate, processTime);
	}

	private ComplexRecording filter(Recording data, double samplingRate, Config config)
			throws AdapterFailureException {
		ComplexRecording wvcfs;
		try {
			wvcfs = transform.transform(data, samplingRate, config.morletCfreq, config.morletParam, TIME_DIM);
		} catch (RuntimeException e) {
			throw new AdapterFailureException(Stage.FILTERING, AdapterFailureException.NO_TRIAL,
					"wavelet transform failed: " + e.getMessage(), e);
		}
		if (wvcfs == null || wvcfs.getRows() != data.getRows() || wvcfs.getCols() != data.getCols()
				|| wvcfs.getTimesteps() != data.getTimesteps() || wvcfs.getTrials() != data.getTrials()) {
			throw new AdapterFailureException(Stage.FILTERING, AdapterFailureException.NO_TRIAL,
					"wavelet coefficients do not have the shape of the recording");
		}
		return wvcfs;
	}

	/**
	 * Progress reporting never interrupts the analysis.
	 */
	private void outputProgress(String message) {
		try {
			progress.report(message);
		} catch (RuntimeException e) {
			logger.warn("Progress sink failed on \"{}\"", message, e);
		}
	}

	private static void toc(Stage stage, long tic) {
		logger.info("{} took {} seconds", stage, (System.nanoTime() - tic) / 1e9);
	}
}
