package ca.gc.cra.uvcalc.domain.measurement;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> A header plus its ordered samples, the unit of work of one correction job.
 * <p><strong>Thread-safety:</strong> Immutable; the sample list is copied on construction and accessor arrays are
 * fresh copies.</p>
 *
 * @param header acquisition metadata
 * @param samples samples in file order (ascending, unique wavelengths after a duplicate merge)
 * @since 0.1.0
 */
public record Section(RawHeader header, List<RawSample> samples) {

  public Section {
    Objects.requireNonNull(header, "header");
    samples = List.copyOf(Objects.requireNonNull(samples, "samples"));
  }

  public int size() {
    return samples.size();
  }

  public double[] wavelengths() {
    double[] out = new double[samples.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = samples.get(i).wavelength();
    }
    return out;
  }

  public double[] events() {
    double[] out = new double[samples.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = samples.get(i).events();
    }
    return out;
  }

  public double[] times() {
    double[] out = new double[samples.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = samples.get(i).time();
    }
    return out;
  }

  /**
   * @return time of the first sample in minutes since midnight
   * @throws IllegalStateException when the section has no samples
   */
  public double firstTime() {
    if (samples.isEmpty()) {
      throw new IllegalStateException("Section has no samples");
    }
    return samples.get(0).time();
  }
}
