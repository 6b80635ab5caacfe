package neuropatt;

import java.io.Serializable;
import java.time.Duration;
import java.util.BitSet;
import java.util.List;

/**
 * Everything a pattern analysis run produces. In only-patterns mode the
 * filtered signal and the velocity fields are left out (null).
 *
 * @author Ben
 *
 */
public class AnalysisResult implements Serializable {

	private static final long serialVersionUID = 1L;

	private final ComplexRecording filteredSignal;
	private final VelocityField velocityFields;
	private final BitSet badChannels;
	private final int nTimeSteps;
	private final PatternVocabulary vocabulary;
	private final List<List<Pattern>> patterns;
	private final List<List<PatternLocation>> patternLocations;
	private final TransitionCounts transitions;
	private final TransitionStatistics statistics;
	private final double meanConvergenceSteps;
	private final Config params;
	private final double samplingRate;
	private final Duration processTime;

	public AnalysisResult(ComplexRecording filteredSignal, VelocityField velocityFields, BitSet badChannels,
			int nTimeSteps, PatternVocabulary vocabulary, List<List<Pattern>> patterns,
			List<List<PatternLocation>> patternLocations, TransitionCounts transitions,
			TransitionStatistics statistics, double meanConvergenceSteps, Config params, double samplingRate,
			Duration processTime) {
		this.filteredSignal = filteredSignal;
		this.velocityFields = velocityFields;
		this.badChannels = (BitSet) badChannels.clone();
		this.nTimeSteps = nTimeSteps;
		this.vocabulary = vocabulary;
		this.patterns = List.copyOf(patterns);
		this.patternLocations = List.copyOf(patternLocations);
		this.transitions = transitions;
		this.statistics = statistics;
		this.meanConvergenceSteps = meanConvergenceSteps;
		this.params = params;
		this.samplingRate = samplingRate;
		this.processTime = processTime;
	}

	/**
	 * @return transform coefficients, or null in only-patterns mode
	 */
	public ComplexRecording getFilteredSignal() {
		return this.filteredSignal;
	}

	/**
	 * @return velocity fields, or null in only-patterns mode
	 */
	public VelocityField getVelocityFields() {
		return this.velocityFields;
	}

	public BitSet getBadChannels() {
		return (BitSet) this.badChannels.clone();
	}

	/**
	 * Snapshots of the velocity fields, one fewer than the recording.
	 */
	public int getNTimeSteps() {
		return this.nTimeSteps;
	}

	public PatternVocabulary getVocabulary() {
		return this.vocabulary;
	}

	public List<String> getPatternTypes() {
		return this.vocabulary.getTypes();
	}

	public List<String> getPatternResultColumns() {
		return this.vocabulary.getColumnNames();
	}

	public List<List<Pattern>> getPatterns() {
		return this.patterns;
	}

	public List<List<PatternLocation>> getPatternLocations() {
		return this.patternLocations;
	}

	public TransitionCounts getTransitions() {
		return this.transitions;
	}

	public TransitionStatistics getStatistics() {
		return this.statistics;
	}

	public double getMeanConvergenceSteps() {
		return this.meanConvergenceSteps;
	}

	public Config getParams() {
		return this.params;
	}

	public double getSamplingRate() {
		return this.samplingRate;
	}

	public Duration getProcessTime() {
		return this.processTime;
	}
}
