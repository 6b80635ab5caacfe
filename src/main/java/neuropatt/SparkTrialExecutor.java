package neuropatt;

import java.io.Closeable;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.spark.SparkConf;
import org.apache.spark.SparkContext;
import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.broadcast.Broadcast;

import neuropatt.exception.AnalysisException;

/**
 * Distributes trials over a Spark context. Shared inputs are broadcast once
 * instead of being serialized with every task.
 *
 * @author Ben
 *
 */
public class SparkTrialExecutor implements TrialExecutor, Closeable {

	private static final Logger logger = LogManager.getLogger(SparkTrialExecutor.class);

	private final JavaSparkContext sc;
	private final int numPartitions;
	private final boolean ownsContext;

	public SparkTrialExecutor(JavaSparkContext sc, int numPartitions) {
		this(sc, numPartitions, false);
	}

	private SparkTrialExecutor(JavaSparkContext sc, int numPartitions, boolean ownsContext) {
		this.sc = sc;
		this.numPartitions = numPartitions;
		this.ownsContext = ownsContext;
	}

	/**
	 * Creates (or joins) a context on {@link Config#sparkMaster}. The context is
	 * stopped when the executor is closed.
	 */
	public static SparkTrialExecutor create(Config config) {
		SparkConf sparkConf = new SparkConf().setAppName("NeuroPatt")
				.setIfMissing("spark.master", config.sparkMaster)
				.setIfMissing("spark.ui.enabled", "false")
				.setIfMissing("spark.driver.host", "127.0.0.1")
				.setIfMissing("spark.driver.bindAddress", "127.0.0.1");
		JavaSparkContext sc = JavaSparkContext.fromSparkContext(SparkContext.getOrCreate(sparkConf));
		logger.info("Spark context on {} with default parallelism {}", sc.master(), sc.defaultParallelism());
		return new SparkTrialExecutor(sc, config.numPartitions, true);
	}

	public JavaSparkContext getContext() {
		return this.sc;
	}

	@Override
	public <V extends Serializable> Shared<V> share(V value) {
		Broadcast<V> bcast = sc.broadcast(value);
		return bcast::value;
	}

	@Override
	public <T extends Serializable> List<T> map(Stage stage, int trials, TrialTask<T> task) throws AnalysisException {
		List<Integer> trialIndices = new ArrayList<>(trials);
		for (int trial = 0; trial < trials; trial++) {
			trialIndices.add(trial);
		}
		int slices = numPartitions > 0 ? Math.min(numPartitions, trials) : trials;
		JavaRDD<Integer> trialRDD = sc.parallelize(trialIndices, Math.max(1, slices));
		List<TrialOutcome<T>> outcomes = trialRDD.map(trial -> TrialOutcome.run(task, trial)).collect();
		return TrialOutcome.collect(stage, outcomes);
	}

	@Override
	public void close() {
		if (ownsContext) {
			sc.close();
		}
	}
}
