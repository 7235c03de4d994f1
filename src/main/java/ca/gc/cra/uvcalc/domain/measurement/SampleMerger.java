package ca.gc.cra.uvcalc.domain.measurement;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Averages samples that share a wavelength. Used for network-sourced sections, which repeat
 * wavelengths across scans.
 */
public final class SampleMerger {

  private SampleMerger() {}

  /**
   * Groups samples by wavelength and averages time, step and event count within each group.
   *
   * @param samples samples in any order
   * @return one sample per distinct wavelength, sorted by ascending wavelength
   */
  public static List<RawSample> mergeDuplicates(List<RawSample> samples) {
    Objects.requireNonNull(samples, "samples");
    List<RawSample> sorted = new ArrayList<>(samples);
    sorted.sort(Comparator.comparingDouble(RawSample::wavelength));

    List<RawSample> merged = new ArrayList<>();
    int start = 0;
    while (start < sorted.size()) {
      double wavelength = sorted.get(start).wavelength();
      int end = start + 1;
      while (end < sorted.size() && sorted.get(end).wavelength() == wavelength) {
        end++;
      }
      merged.add(end - start == 1 ? sorted.get(start) : average(sorted.subList(start, end)));
      start = end;
    }
    return merged;
  }

  private static RawSample average(List<RawSample> group) {
    double time = 0;
    double step = 0;
    double events = 0;
    for (RawSample sample : group) {
      time += sample.time();
      step += sample.step();
      events += sample.events();
    }
    int n = group.size();
    return new RawSample(time / n, group.get(0).wavelength(), step / n, events / n);
  }
}
