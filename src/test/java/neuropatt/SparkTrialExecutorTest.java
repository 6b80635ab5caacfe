package neuropatt;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.BitSet;
import java.util.List;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import neuropatt.adapter.MorletWaveletTransform;
import neuropatt.adapter.PhaseOpticalFlow;
import neuropatt.exception.AdapterFailureException;
import neuropatt.exception.AnalysisException;
import neuropatt.experiment.WaveSimulator;

public class SparkTrialExecutorTest {

	private static SparkTrialExecutor spark;

	@BeforeAll
	static void startSpark() {
		Config config = new Config();
		config.sparkMaster = "local[2]";
		spark = SparkTrialExecutor.create(config);
	}

	@AfterAll
	static void stopSpark() {
		spark.close();
	}

	@Test
	void resultsAreCollectedInTrialOrder() throws AnalysisException {
		List<Integer> doubled = spark.map(Stage.OPTICAL_FLOW, 5, trial -> 2 * trial);

		assertEquals(List.of(0, 2, 4, 6, 8), doubled);
	}

	@Test
	void broadcastValueReachesTasks() throws AnalysisException {
		Shared<double[]> weights = spark.share(new double[] { 0.5, 1.5, 2.5 });

		List<Double> picked = spark.map(Stage.OPTICAL_FLOW, 3, trial -> weights.value()[trial]);

		assertEquals(List.of(0.5, 1.5, 2.5), picked);
	}

	@Test
	void failingTrialIsNamed() {
		AdapterFailureException e = assertThrows(AdapterFailureException.class,
				() -> spark.map(Stage.OPTICAL_FLOW, 4, trial -> {
					if (trial == 2) {
						throw new IllegalStateException("diverged");
					}
					return trial;
				}));

		assertEquals(2, e.getTrial());
		assertEquals(Stage.OPTICAL_FLOW, e.getStage());
	}

	@Test
	void velocityFieldsMatchSequentialRun() throws AnalysisException {
		Recording recording = new WaveSimulator(5, 5, 100, 6, 0.05, 3L).generate(12, 3, 6);
		Config config = new Config();
		Preprocessor.Result preprocessed = new Preprocessor().preprocess(recording, config);
		ComplexRecording coeffs = new MorletWaveletTransform().transform(
				preprocessed.getRecording(), 100, config.morletCfreq, config.morletParam, 3);
		PhaseOpticalFlow flow = new PhaseOpticalFlow(200, 1e-3);
		BitSet bad = preprocessed.getBadChannels();

		VelocityFieldBuilder.Result sequential = new VelocityFieldBuilder(flow, new SequentialTrialExecutor())
				.build(coeffs, bad, config);
		VelocityFieldBuilder.Result distributed = new VelocityFieldBuilder(flow, spark).build(coeffs, bad, config);

		for (int trial = 0; trial < 3; trial++) {
			assertArrayEquals(sequential.getField().real(trial), distributed.getField().real(trial));
			assertArrayEquals(sequential.getField().imag(trial), distributed.getField().imag(trial));
		}
		assertEquals(sequential.getMeanConvergenceSteps(), distributed.getMeanConvergenceSteps());
	}
}
