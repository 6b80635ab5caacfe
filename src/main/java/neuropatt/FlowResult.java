package neuropatt;

import java.io.Serializable;

import org.apache.commons.math3.stat.StatUtils;

/**
 * Optical flow output of one trial: velocity components for every snapshot
 * pair and the number of iterations the solver needed per pair.
 *
 * @author Ben
 *
 */
public class FlowResult implements Serializable {

	private static final long serialVersionUID = 1L;

	private final double[] vx;
	private final double[] vy;
	private final double[] convergenceSteps;

	public FlowResult(double[] vx, double[] vy, double[] convergenceSteps) {
		this.vx = vx;
		this.vy = vy;
		this.convergenceSteps = convergenceSteps;
	}

	public double[] getVx() {
		return this.vx;
	}

	public double[] getVy() {
		return this.vy;
	}

	public double[] getConvergenceSteps() {
		return this.convergenceSteps;
	}

	public double getMeanConvergenceSteps() {
		return StatUtils.mean(convergenceSteps);
	}

	/**
	 * Checks the result against the slice it was estimated from.
	 *
	 * @param channels   rows * columns of the recording
	 * @param timesteps  snapshots of the input slice
	 * @return a description of the first problem found, or null if valid
	 */
	public String validate(int channels, int timesteps) {
		int expected = channels * (timesteps - 1);
		if (vx == null || vy == null || convergenceSteps == null) {
			return "optical flow returned no result";
		}
		if (vx.length != expected || vy.length != expected) {
			return "expected " + expected + " velocity values, got " + vx.length + " / " + vy.length;
		}
		if (convergenceSteps.length != timesteps - 1) {
			return "expected " + (timesteps - 1) + " convergence counts, got " + convergenceSteps.length;
		}
		for (int i = 0; i < expected; i++) {
			if (!Double.isFinite(vx[i]) || !Double.isFinite(vy[i])) {
				return "optical flow diverged (non-finite velocity at cell " + i + ")";
			}
		}
		for (double step : convergenceSteps) {
			if (!(step >= 0) || Double.isInfinite(step)) {
				return "invalid convergence count " + step;
			}
		}
		return null;
	}
}
