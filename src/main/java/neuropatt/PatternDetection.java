package neuropatt;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import neuropatt.adapter.PatternExtractor;
import neuropatt.exception.AdapterFailureException;
import neuropatt.exception.AnalysisException;
import neuropatt.exception.VocabularyMismatchException;

/**
 * Runs the pattern extractor on every trial of a velocity field.
 *
 * @author Ben
 *
 */
public class PatternDetection {

	private static final Logger logger = LogManager.getLogger(PatternDetection.class);

	/**
	 * Trial-indexed patterns and locations, plus the vocabulary shared by all
	 * trials.
	 */
	public static class Result {
		private final PatternVocabulary vocabulary;
		private final List<TrialPatterns> trials;

		Result(PatternVocabulary vocabulary, List<TrialPatterns> trials) {
			this.vocabulary = vocabulary;
			this.trials = Collections.unmodifiableList(trials);
		}

		public PatternVocabulary getVocabulary() {
			return this.vocabulary;
		}

		public List<TrialPatterns> getTrials() {
			return this.trials;
		}

		public List<List<Pattern>> getPatterns() {
			List<List<Pattern>> ret = new ArrayList<>(trials.size());
			for (TrialPatterns trial : trials) {
				ret.add(trial.getPatterns());
			}
			return ret;
		}

		public List<List<PatternLocation>> getLocations() {
			List<List<PatternLocation>> ret = new ArrayList<>(trials.size());
			for (TrialPatterns trial : trials) {
				ret.add(trial.getLocations());
			}
			return ret;
		}

		public int countPatterns() {
			int count = 0;
			for (TrialPatterns trial : trials) {
				count += trial.getPatterns().size();
			}
			return count;
		}
	}

	private final PatternExtractor extractor;
	private final TrialExecutor executor;

	public PatternDetection(PatternExtractor extractor, TrialExecutor executor) {
		this.extractor = extractor;
		this.executor = executor;
	}

	/**
	 * Detection input per trial is the x and y velocity of the field and the
	 * phase of the transform coefficients of the same trial. Bad channels are
	 * passed on so that the extractor can leave them out.
	 *
	 * @throws VocabularyMismatchException if any trial reports pattern types
	 *                                     other than the declared ones
	 * @throws AdapterFailureException     if the extractor fails on any trial
	 */
	public Result detect(VelocityField field, ComplexRecording coeffs, BitSet badChannels, double samplingRate,
			Config config)
			throws AnalysisException {
		if (coeffs.getTrials() != field.getTrials() || coeffs.getTimesteps() != field.getTimesteps() + 1) {
			throw new AdapterFailureException(Stage.PATTERN_DETECTION, AdapterFailureException.NO_TRIAL,
					"velocity field does not match the transform coefficients");
		}
		PatternVocabulary declared = extractor.vocabulary();
		if (declared == null || declared.size() == 0) {
			throw new AdapterFailureException(Stage.PATTERN_DETECTION, AdapterFailureException.NO_TRIAL,
					"pattern extractor declared no pattern types");
		}
		Shared<VelocityField> bcastField = executor.share(field);
		Shared<ComplexRecording> bcastCoeffs = executor.share(coeffs);
		Shared<BitSet> bcastBad = executor.share((BitSet) badChannels.clone());
		PatternExtractor patternExtractor = this.extractor;

		List<TrialPatterns> trials = executor.map(Stage.PATTERN_DETECTION, field.getTrials(), trial -> {
			VelocityField vf = bcastField.value();
			TrialField trialField = new TrialField(vf.getRows(), vf.getCols(), vf.getTimesteps(), samplingRate,
					vf.real(trial), vf.imag(trial), bcastCoeffs.value().phase(trial), bcastBad.value());
			TrialPatterns found = patternExtractor.findAllPatterns(trialField, config);
			if (found == null) {
				throw new AdapterFailureException(Stage.PATTERN_DETECTION, trial, "pattern extractor returned no result");
			}
			if (!declared.equals(found.getVocabulary())) {
				throw new VocabularyMismatchException(trial, declared.getTypes(),
						found.getVocabulary() == null ? List.of() : found.getVocabulary().getTypes());
			}
			for (Pattern pattern : found.getPatterns()) {
				if (pattern.getType() < 0 || pattern.getType() >= declared.size()) {
					throw new AdapterFailureException(Stage.PATTERN_DETECTION, trial,
							"unknown pattern type index " + pattern.getType());
				}
			}
			return found;
		});

		Result result = new Result(declared, new ArrayList<>(trials));
		logger.debug("{} patterns found in {} trials", result.countPatterns(), trials.size());
		return result;
	}
}
