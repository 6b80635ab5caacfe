package neuropatt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

import org.junit.jupiter.api.Test;

import neuropatt.adapter.PatternExtractor;
import neuropatt.exception.AdapterFailureException;
import neuropatt.exception.AnalysisException;
import neuropatt.exception.VocabularyMismatchException;

public class PatternDetectionTest {

	static final PatternVocabulary TYPES = new PatternVocabulary(List.of("up", "down"),
			List.of("type", "startTime", "endTime", "value"));

	/**
	 * Reports one pattern per trial holding the phase of the first cell, typed
	 * by the sign of the first velocity.
	 */
	static class PhaseProbe implements PatternExtractor {
		private static final long serialVersionUID = 1L;

		private final PatternVocabulary reported;

		PhaseProbe(PatternVocabulary reported) {
			this.reported = reported;
		}

		@Override
		public PatternVocabulary vocabulary() {
			return TYPES;
		}

		@Override
		public TrialPatterns findAllPatterns(TrialField field, Config params) {
			int type = field.vx(0, 0, 0) >= 0 ? 0 : 1;
			Pattern pattern = new Pattern(type, 0, field.getTimesteps() - 1,
					new double[] { type, 0, field.getTimesteps() - 1, field.phase(0, 0, 0) });
			PatternLocation location = new PatternLocation(new int[] { 0 }, new double[] { 0 }, new double[] { 0 });
			return new TrialPatterns(List.of(pattern), List.of(location), reported);
		}
	}

	static VelocityField field(int rows, int cols, int timesteps, double... trialVx) {
		List<FlowResult> slices = new ArrayList<>();
		for (double vx : trialVx) {
			double[] x = new double[rows * cols * timesteps];
			Arrays.fill(x, vx);
			slices.add(new FlowResult(x, new double[rows * cols * timesteps], new double[timesteps]));
		}
		return VelocityField.assemble(rows, cols, timesteps, slices);
	}

	@Test
	void extractorSeesVelocityAndCoefficientPhase() throws AnalysisException {
		VelocityField vf = field(2, 2, 3, 1.0, -1.0);
		ComplexRecording coeffs = new ComplexRecording(2, 2, 4, 2);
		coeffs.set(0, 0, 0, 0, 0, 1);
		coeffs.set(0, 0, 0, 1, -1, 0);
		PatternDetection detection = new PatternDetection(new PhaseProbe(TYPES), new SequentialTrialExecutor());

		PatternDetection.Result result = detection.detect(vf, coeffs, new BitSet(), 100, new Config());

		assertEquals(TYPES, result.getVocabulary());
		assertEquals(2, result.countPatterns());
		Pattern first = result.getPatterns().get(0).get(0);
		Pattern second = result.getPatterns().get(1).get(0);
		assertEquals(0, first.getType());
		assertEquals(1, second.getType());
		assertEquals(Math.PI / 2, first.getValues()[3], 1e-12);
		assertEquals(Math.PI, second.getValues()[3], 1e-12);
		assertEquals(3, first.getDuration());
		assertEquals(1, result.getLocations().get(1).size());
	}

	@Test
	void vocabularyMismatchIsFatal() {
		PatternVocabulary other = new PatternVocabulary(List.of("up", "sideways"),
				List.of("type", "startTime", "endTime", "value"));
		PatternDetection detection = new PatternDetection(new PhaseProbe(other), new SequentialTrialExecutor());

		VocabularyMismatchException e = assertThrows(VocabularyMismatchException.class,
				() -> detection.detect(field(2, 2, 3, 1.0), new ComplexRecording(2, 2, 4, 1), new BitSet(), 100,
						new Config()));
		assertEquals(0, e.getTrial());
		assertEquals(TYPES.getTypes(), e.getExpected());
		assertEquals(other.getTypes(), e.getReported());
		assertEquals(Stage.PATTERN_DETECTION, e.getStage());
	}

	@Test
	void unknownTypeIndexIsRejected() {
		PatternExtractor outOfRange = new PhaseProbe(TYPES) {
			private static final long serialVersionUID = 1L;

			@Override
			public TrialPatterns findAllPatterns(TrialField field, Config params) {
				return new TrialPatterns(List.of(new Pattern(5, 0, 1)),
						List.of(new PatternLocation(new int[0], new double[0], new double[0])), TYPES);
			}
		};
		PatternDetection detection = new PatternDetection(outOfRange, new SequentialTrialExecutor());

		AdapterFailureException e = assertThrows(AdapterFailureException.class,
				() -> detection.detect(field(2, 2, 3, 1.0), new ComplexRecording(2, 2, 4, 1), new BitSet(), 100,
						new Config()));
		assertEquals(0, e.getTrial());
	}

	@Test
	void coefficientsMustMatchField() {
		PatternDetection detection = new PatternDetection(new PhaseProbe(TYPES), new SequentialTrialExecutor());

		assertThrows(AdapterFailureException.class,
				() -> detection.detect(field(2, 2, 3, 1.0), new ComplexRecording(2, 2, 3, 1), new BitSet(), 100,
						new Config()));
	}
}
