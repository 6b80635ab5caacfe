package neuropatt;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.commons.lang3.StringUtils;

import neuropatt.exception.FileFormatNotCorrectException;

/**
 * Reads and writes recordings as text. The first line holds the shape, e.g.
 * {@code (8, 8, 500, 10)}; every following line holds one row of one snapshot
 * as comma separated values, snapshots ordered by trial and then by time.
 * Blank lines and {@code Snapshot} header lines are skipped.
 *
 * @author Ben
 *
 */
public class RecordingFile {

	private RecordingFile() {
	}

	// read in file after getting the path
	public static Recording read(String path) throws FileFormatNotCorrectException {
		try (BufferedReader reader = new BufferedReader(new FileReader(path, StandardCharsets.UTF_8))) {
			String line = reader.readLine();
			if (line == null || !line.contains("(")) {
				throw new FileFormatNotCorrectException(path, 1, "first line must hold the recording shape");
			}
			int[] shape = dimensionParser(line, path);
			int rows = shape[0];
			int cols = shape[1];
			int trials = shape.length == 4 ? shape[3] : 1;
			double[] samples = new double[rows * cols * shape[2] * trials];
			int lineNumber = 1;
			int pos = 0;
			line = reader.readLine();
			while (line != null) {
				lineNumber++;
				if (StringUtils.isBlank(line) || line.contains("Snapshot")) { // pass this line
					line = reader.readLine();
					continue;
				}
				double[] array;
				try {
					array = Arrays.stream(line.split(",")).map(String::trim).mapToDouble(Double::parseDouble)
							.toArray();
				} catch (NumberFormatException e) {
					throw new FileFormatNotCorrectException(path, lineNumber, "not a number: " + e.getMessage());
				}
				if (array.length != cols) {
					throw new FileFormatNotCorrectException(path, lineNumber,
							"expected " + cols + " values, got " + array.length);
				}
				if (pos + cols > samples.length) {
					throw new FileFormatNotCorrectException(path, lineNumber, "more samples than the shape allows");
				}
				System.arraycopy(array, 0, samples, pos, cols);
				pos += cols;
				line = reader.readLine();
			}
			if (pos != samples.length) {
				throw new FileFormatNotCorrectException(
						path + ": expected " + samples.length + " samples, found " + pos);
			}
			return new Recording(rows, cols, shape[2], trials, samples);
		} catch (IOException e) {
			throw new FileFormatNotCorrectException("Cannot read recording " + path, e);
		}
	}

	static int[] dimensionParser(String line, String path) throws FileFormatNotCorrectException {
		int[] array;
		try {
			array = Arrays.stream(line.replaceAll("[()]", "").split(",")).map(String::trim)
					.mapToInt(Integer::parseInt).toArray();
		} catch (NumberFormatException e) {
			throw new FileFormatNotCorrectException(path, 1, "cannot parse shape " + line);
		}
		if (array.length < 3 || array.length > 4) {
			throw new FileFormatNotCorrectException(path, 1, "shape must be (rows, cols, time[, trials])");
		}
		for (int dim : array) {
			if (dim <= 0) {
				throw new FileFormatNotCorrectException(path, 1, "Dimensions information cannot be 0");
			}
		}
		return array;
	}

	public static void write(Recording recording, String path) throws IOException {
		try (BufferedWriter writer = new BufferedWriter(new FileWriter(path, StandardCharsets.UTF_8))) {
			writer.write("(" + recording.getRows() + ", " + recording.getCols() + ", " + recording.getTimesteps()
					+ ", " + recording.getTrials() + ")\n");
			for (int trial = 0; trial < recording.getTrials(); trial++) {
				for (int t = 0; t < recording.getTimesteps(); t++) {
					writer.write("Snapshot " + (t + 1) + " trial " + (trial + 1) + "\n");
					for (int row = 0; row < recording.getRows(); row++) {
						StringBuilder sb = new StringBuilder();
						for (int col = 0; col < recording.getCols(); col++) {
							if (col > 0) {
								sb.append(", ");
							}
							sb.append(recording.get(row, col, t, trial));
						}
						writer.write(sb.append('\n').toString());
					}
				}
			}
		}
	}
}
