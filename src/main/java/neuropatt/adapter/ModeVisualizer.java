package neuropatt.adapter;

import neuropatt.Config;
import neuropatt.ProgressSink;
import neuropatt.VelocityField;

/**
 * Optional summary of the dominant modes of the velocity fields.
 */
public interface ModeVisualizer {

	void visualize(VelocityField field, double samplingRate, Config config, ProgressSink progress);
}
