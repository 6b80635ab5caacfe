package neuropatt;

import java.io.Serializable;

/**
 * Two component velocity vector. {@code x} plays the role of the real part and
 * {@code y} of the imaginary part of a complex velocity.
 */
public final class Velocity implements Serializable {

	private static final long serialVersionUID = 1L;

	public final double x;
	public final double y;

	public Velocity(double x, double y) {
		this.x = x;
		this.y = y;
	}

	public double real() {
		return this.x;
	}

	public double imag() {
		return this.y;
	}

	public double magnitude() {
		return Math.hypot(x, y);
	}

	public double angle() {
		return Math.atan2(y, x);
	}

	@Override
	public String toString() {
		return String.format("(%f %s %fi)", x, (y < 0 ? "-" : "+"), Math.abs(y));
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof Velocity)) return false;
		Velocity other = (Velocity) obj;
		return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
	}

	@Override
	public int hashCode() {
		return Double.hashCode(x) * 31 + Double.hashCode(y);
	}
}
