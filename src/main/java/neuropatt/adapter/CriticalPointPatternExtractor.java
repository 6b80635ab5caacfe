package neuropatt.adapter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.lang3.ArrayUtils;

import neuropatt.Config;
import neuropatt.Pattern;
import neuropatt.PatternLocation;
import neuropatt.PatternVocabulary;
import neuropatt.TrialField;
import neuropatt.TrialPatterns;
import neuropatt.Velocity;

/**
 * Detects plane waves, synchrony and critical points (sinks, sources, spirals
 * and saddles) in the velocity field of one trial.
 * <p>
 * Plane waves and synchrony are global states found from order parameters of
 * the velocity vectors and of the phase. Critical points sit in 2x2 cell
 * blocks where both velocity components change sign; the Jacobian of the
 * block decides the type. Detections of consecutive steps are linked into
 * one pattern while they stay within {@link Config#maxDisplacement} cells per
 * step, and patterns shorter than the configured minimum durations are
 * dropped.
 *
 * @author Ben
 *
 */
public class CriticalPointPatternExtractor implements PatternExtractor {

	private static final long serialVersionUID = 1L;

	public static final int PLANE_WAVE = 0;
	public static final int SYNCHRONOUS = 1;
	public static final int SINK = 2;
	public static final int SOURCE = 3;
	public static final int SPIRAL_IN = 4;
	public static final int SPIRAL_OUT = 5;
	public static final int SADDLE = 6;

	public static final PatternVocabulary VOCABULARY = new PatternVocabulary(
			List.of("planeWave", "synchronous", "sink", "source", "spiralIn", "spiralOut", "saddle"),
			List.of("type", "startTime", "endTime", "duration", "startRow", "startCol", "endRow", "endCol"));

	@Override
	public PatternVocabulary vocabulary() {
		return VOCABULARY;
	}

	@Override
	public TrialPatterns findAllPatterns(TrialField field, Config params) {
		List<Track> tracks = new ArrayList<>();
		tracks.addAll(findGlobalPatterns(field, params, PLANE_WAVE));
		tracks.addAll(findGlobalPatterns(field, params, SYNCHRONOUS));
		tracks.addAll(findCriticalPointPatterns(field, params));

		double samplingRate = field.getSamplingRate();
		int minSpiral = params.minSteps(params.minDurationSpiral, samplingRate);
		int minOther = params.minSteps(params.minDurationNonSpiral, samplingRate);
		tracks.removeIf(track -> track.duration() < (isSpiral(track.type) ? minSpiral : minOther));
		tracks.sort(Comparator.comparingInt((Track track) -> track.start()).thenComparingInt(track -> track.type));

		List<Pattern> patterns = new ArrayList<>(tracks.size());
		List<PatternLocation> locations = new ArrayList<>(tracks.size());
		for (Track track : tracks) {
			patterns.add(track.toPattern());
			locations.add(track.toLocation());
		}
		return new TrialPatterns(patterns, locations, VOCABULARY);
	}

	static boolean isSpiral(int type) {
		return type == SPIRAL_IN || type == SPIRAL_OUT;
	}

	/**
	 * Order parameter of the velocity directions: length of the summed vectors
	 * over the summed lengths.
	 */
	static double velocityOrder(TrialField field, int t) {
		double sumX = 0;
		double sumY = 0;
		double sumLength = 0;
		for (int row = 0; row < field.getRows(); row++) {
			for (int col = 0; col < field.getCols(); col++) {
				if (!field.isUsable(row, col)) {
					continue;
				}
				Velocity velocity = field.velocity(row, col, t);
				sumX += velocity.real();
				sumY += velocity.imag();
				sumLength += velocity.magnitude();
			}
		}
		return sumLength == 0 ? 0 : Math.hypot(sumX, sumY) / sumLength;
	}

	static double meanSpeed(TrialField field, int t) {
		double sum = 0;
		int count = 0;
		for (int row = 0; row < field.getRows(); row++) {
			for (int col = 0; col < field.getCols(); col++) {
				if (field.isUsable(row, col)) {
					sum += field.velocity(row, col, t).magnitude();
					count++;
				}
			}
		}
		return sum / count;
	}

	/**
	 * Kuramoto order parameter of the phases of one snapshot. Bad channels
	 * are left out.
	 */
	static double phaseOrder(TrialField field, int t) {
		double sumCos = 0;
		double sumSin = 0;
		int count = 0;
		for (int row = 0; row < field.getRows(); row++) {
			for (int col = 0; col < field.getCols(); col++) {
				if (!field.isUsable(row, col)) {
					continue;
				}
				double phase = field.phase(row, col, t);
				sumCos += Math.cos(phase);
				sumSin += Math.sin(phase);
				count++;
			}
		}
		return Math.hypot(sumCos, sumSin) / count;
	}

	private List<Track> findGlobalPatterns(TrialField field, Config params, int type) {
		List<Track> tracks = new ArrayList<>();
		Track current = null;
		for (int t = 0; t < field.getTimesteps(); t++) {
			boolean active;
			if (type == PLANE_WAVE) {
				active = meanSpeed(field, t) > params.minVelocity
						&& velocityOrder(field, t) >= params.planeWaveThreshold;
			} else {
				active = phaseOrder(field, t) >= params.synchronyThreshold;
			}
			if (!active) {
				continue;
			}
			if (current != null && t - current.end() - 1 <= params.maxTimeGap) {
				current.add(t, Double.NaN, Double.NaN);
			} else {
				current = new Track(type);
				current.add(t, Double.NaN, Double.NaN);
				tracks.add(current);
			}
		}
		return tracks;
	}

	private List<Track> findCriticalPointPatterns(TrialField field, Config params) {
		List<Track> finished = new ArrayList<>();
		List<Track> open = new ArrayList<>();
		for (int t = 0; t < field.getTimesteps(); t++) {
			List<double[]> points = findCriticalPoints(field, t, params);
			List<Track> extended = new ArrayList<>();
			for (double[] point : points) {
				int type = (int) point[0];
				Track best = null;
				double bestDistance = Double.POSITIVE_INFINITY;
				for (Track track : open) {
					if (track.type != type || extended.contains(track)) {
						continue;
					}
					double distance = track.distanceTo(point[1], point[2]);
					if (distance <= params.maxDisplacement * (t - track.end()) && distance < bestDistance) {
						best = track;
						bestDistance = distance;
					}
				}
				if (best == null) {
					best = new Track(type);
					open.add(best);
				}
				best.add(t, point[1], point[2]);
				extended.add(best);
			}
			// close tracks that can no longer be continued
			for (int i = open.size() - 1; i >= 0; i--) {
				if (t - open.get(i).end() > params.maxTimeGap) {
					finished.add(open.remove(i));
				}
			}
		}
		finished.addAll(open);
		return finished;
	}

	/**
	 * @return {type, row, col} of every critical point at step {@code t}
	 */
	static List<double[]> findCriticalPoints(TrialField field, int t, Config params) {
		List<double[]> points = new ArrayList<>();
		for (int row = 0; row < field.getRows() - 1; row++) {
			for (int col = 0; col < field.getCols() - 1; col++) {
				double centreRow = row + 0.5;
				double centreCol = col + 0.5;
				if (centreRow < params.minEdgeDistance || centreCol < params.minEdgeDistance
						|| centreRow > field.getRows() - 1 - params.minEdgeDistance
						|| centreCol > field.getCols() - 1 - params.minEdgeDistance) {
					continue;
				}
				double[] vx = { field.vx(row, col, t), field.vx(row, col + 1, t), field.vx(row + 1, col, t),
						field.vx(row + 1, col + 1, t) };
				double[] vy = { field.vy(row, col, t), field.vy(row, col + 1, t), field.vy(row + 1, col, t),
						field.vy(row + 1, col + 1, t) };
				if (!changesSign(vx) || !changesSign(vy)) {
					continue;
				}
				// Jacobian of the block: x along columns, y along rows
				double dvxdx = ((vx[1] - vx[0]) + (vx[3] - vx[2])) / 2;
				double dvxdy = ((vx[2] - vx[0]) + (vx[3] - vx[1])) / 2;
				double dvydx = ((vy[1] - vy[0]) + (vy[3] - vy[2])) / 2;
				double dvydy = ((vy[2] - vy[0]) + (vy[3] - vy[1])) / 2;
				int type = classify(dvxdx, dvxdy, dvydx, dvydy);
				if (type < 0 || isDuplicate(points, type, centreRow, centreCol, params.minCritRadius)) {
					continue;
				}
				points.add(new double[] { type, centreRow, centreCol });
			}
		}
		return points;
	}

	static boolean changesSign(double[] values) {
		boolean positive = false;
		boolean negative = false;
		for (double val : values) {
			positive |= val > 0;
			negative |= val < 0;
		}
		return positive && negative;
	}

	/**
	 * Classifies a critical point from its Jacobian.
	 *
	 * @return vocabulary index, or -1 for a degenerate Jacobian
	 */
	static int classify(double a, double b, double c, double d) {
		double det = a * d - b * c;
		double trace = a + d;
		if (det == 0) {
			return -1;
		}
		if (det < 0) {
			return SADDLE;
		}
		if (trace * trace - 4 * det < 0) {
			return trace <= 0 ? SPIRAL_IN : SPIRAL_OUT;
		}
		return trace < 0 ? SINK : SOURCE;
	}

	private static boolean isDuplicate(List<double[]> points, int type, double row, double col, double radius) {
		for (double[] point : points) {
			if ((int) point[0] == type && Math.hypot(point[1] - row, point[2] - col) < radius) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Steps and positions of one pattern while it is being built.
	 */
	private static final class Track {
		private final int type;
		private final List<Integer> times = new ArrayList<>();
		private final List<Double> rows = new ArrayList<>();
		private final List<Double> cols = new ArrayList<>();

		Track(int type) {
			this.type = type;
		}

		void add(int t, double row, double col) {
			times.add(t);
			rows.add(row);
			cols.add(col);
		}

		int start() {
			return times.get(0);
		}

		int end() {
			return times.get(times.size() - 1);
		}

		int duration() {
			return end() - start() + 1;
		}

		double distanceTo(double row, double col) {
			return Math.hypot(rows.get(rows.size() - 1) - row, cols.get(cols.size() - 1) - col);
		}

		Pattern toPattern() {
			int last = times.size() - 1;
			double[] values = { type, start(), end(), duration(), rows.get(0), cols.get(0), rows.get(last),
					cols.get(last) };
			return new Pattern(type, start(), end(), values);
		}

		PatternLocation toLocation() {
			return new PatternLocation(ArrayUtils.toPrimitive(times.toArray(new Integer[0])),
					ArrayUtils.toPrimitive(rows.toArray(new Double[0])),
					ArrayUtils.toPrimitive(cols.toArray(new Double[0])));
		}
	}
}
