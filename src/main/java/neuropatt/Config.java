package neuropatt;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;

import org.apache.commons.lang3.StringUtils;

import neuropatt.exception.FileFormatNotCorrectException;

/**
 * Handles all configurable parameters.
 *
 * @author Ben
 *
 */
public class Config implements Serializable {

	private static final long serialVersionUID = 1L;

	// pre-processing
	public boolean zscoreChannels = false; // per-location unit-variance normalization
	public boolean subtractBaseline = true; // per-location mean removal

	// Morlet wavelet filtering
	public double morletCfreq = 6; // centre frequency (Hz)
	public double morletParam = 5; // cycles of the mother wavelet

	// optical flow
	public double opAlpha = 0.5; // smoothness weight
	public double opBeta = 1; // Charbonnier constant of the data penalty
	public boolean useAmplitude = false; // amplitude instead of phase drives the estimate
	public int opMaxIterations = 1000;
	public double opTolerance = 1e-3; // largest velocity change counted as converged

	// SVD of velocity fields
	public boolean performSVD = true;
	public int nSVDmodes = 6;
	public boolean useComplexSVD = false;

	// pattern detection
	public int minCritRadius = 2; // simultaneous critical points of one type closer than this are merged
	public int minEdgeDistance = 2; // critical points closer to the border are ignored
	public int maxTimeGap = 0; // missed steps tolerated inside one pattern
	public double minDurationSpiral = 0.02; // seconds
	public double minDurationNonSpiral = 0.02; // seconds
	public double planeWaveThreshold = 0.85;
	public double synchronyThreshold = 0.85;
	public double maxDisplacement = 1; // cells a critical point may move per step
	public double minVelocity = 1e-6; // mean speed below which no plane wave is reported

	// transitions, as fractions of the sampling rate
	public double transitionAfterFraction = 0.05;
	public double transitionBeforeFraction = 0.01;

	// execution
	public String sparkMaster = "local[*]";
	public int numPartitions = 0; // 0 = one partition per trial

	public Config() {
	}

	/**
	 * Reads {@code key = value} lines; {@code #} starts a comment.
	 */
	public static Config readFile(String path) throws FileFormatNotCorrectException {
		try (BufferedReader reader = new BufferedReader(new FileReader(path, StandardCharsets.UTF_8))) {
			return read(reader, path);
		} catch (IOException e) {
			throw new FileFormatNotCorrectException("Cannot read configuration " + path, e);
		}
	}

	public static Config fromResource(String name) throws FileFormatNotCorrectException {
		InputStream in = Config.class.getClassLoader().getResourceAsStream(name);
		if (in == null) {
			throw new FileFormatNotCorrectException("Configuration resource not found: " + name);
		}
		try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
			return read(new BufferedReader(reader), name);
		} catch (IOException e) {
			throw new FileFormatNotCorrectException("Cannot read configuration " + name, e);
		}
	}

	private static Config read(BufferedReader reader, String source) throws IOException, FileFormatNotCorrectException {
		Config config = new Config();
		String line = reader.readLine();
		int lineNumber = 1;
		while (line != null) {
			String content = StringUtils.substringBefore(line, "#").trim();
			if (!content.isEmpty()) {
				if (!content.contains("=")) {
					throw new FileFormatNotCorrectException(source, lineNumber, "expected key = value");
				}
				String key = StringUtils.substringBefore(content, "=").trim();
				String value = StringUtils.substringAfter(content, "=").trim();
				try {
					config.set(key, value);
				} catch (NumberFormatException e) {
					throw new FileFormatNotCorrectException(source, lineNumber, "bad value for " + key + ": " + value);
				} catch (IllegalArgumentException e) {
					throw new FileFormatNotCorrectException(source, lineNumber, e.getMessage());
				}
			}
			line = reader.readLine();
			lineNumber++;
		}
		return config;
	}

	public void set(String key, String value) {
		switch (key) {
		case "zscoreChannels":
			this.zscoreChannels = parseBoolean(value);
			break;
		case "subtractBaseline":
			this.subtractBaseline = parseBoolean(value);
			break;
		case "morletCfreq":
			this.morletCfreq = Double.parseDouble(value);
			break;
		case "morletParam":
			this.morletParam = Double.parseDouble(value);
			break;
		case "opAlpha":
			this.opAlpha = Double.parseDouble(value);
			break;
		case "opBeta":
			this.opBeta = Double.parseDouble(value);
			break;
		case "useAmplitude":
			this.useAmplitude = parseBoolean(value);
			break;
		case "opMaxIterations":
			this.opMaxIterations = Integer.parseInt(value);
			break;
		case "opTolerance":
			this.opTolerance = Double.parseDouble(value);
			break;
		case "performSVD":
			this.performSVD = parseBoolean(value);
			break;
		case "nSVDmodes":
			this.nSVDmodes = Integer.parseInt(value);
			break;
		case "useComplexSVD":
			this.useComplexSVD = parseBoolean(value);
			break;
		case "minCritRadius":
			this.minCritRadius = Integer.parseInt(value);
			break;
		case "minEdgeDistance":
			this.minEdgeDistance = Integer.parseInt(value);
			break;
		case "maxTimeGap":
			this.maxTimeGap = Integer.parseInt(value);
			break;
		case "minDurationSpiral":
			this.minDurationSpiral = Double.parseDouble(value);
			break;
		case "minDurationNonSpiral":
			this.minDurationNonSpiral = Double.parseDouble(value);
			break;
		case "planeWaveThreshold":
			this.planeWaveThreshold = Double.parseDouble(value);
			break;
		case "synchronyThreshold":
			this.synchronyThreshold = Double.parseDouble(value);
			break;
		case "maxDisplacement":
			this.maxDisplacement = Double.parseDouble(value);
			break;
		case "minVelocity":
			this.minVelocity = Double.parseDouble(value);
			break;
		case "transitionAfterFraction":
			this.transitionAfterFraction = Double.parseDouble(value);
			break;
		case "transitionBeforeFraction":
			this.transitionBeforeFraction = Double.parseDouble(value);
			break;
		case "sparkMaster":
			this.sparkMaster = value;
			break;
		case "numPartitions":
			this.numPartitions = Integer.parseInt(value);
			break;
		default:
			throw new IllegalArgumentException("unknown option " + key);
		}
	}

	private static boolean parseBoolean(String value) {
		if ("true".equalsIgnoreCase(value)) {
			return true;
		} else if ("false".equalsIgnoreCase(value)) {
			return false;
		}
		throw new NumberFormatException(value);
	}

	/**
	 * Samples searched after a pattern ends for the next pattern.
	 */
	public int transitionWindowAfter(double samplingRate) {
		return (int) Math.round(transitionAfterFraction * samplingRate);
	}

	/**
	 * Samples searched before a pattern ends for the next pattern start.
	 */
	public int transitionWindowBefore(double samplingRate) {
		return (int) Math.round(transitionBeforeFraction * samplingRate);
	}

	public int minSteps(double durationSeconds, double samplingRate) {
		return Math.max(1, (int) Math.round(durationSeconds * samplingRate));
	}
}
