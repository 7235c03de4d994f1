package ca.gc.cra.uvcalc.application.pipeline;

import ca.gc.cra.uvcalc.application.input.CalculationInput;
import ca.gc.cra.uvcalc.domain.result.Spectrum;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of correcting one section.
 *
 * @param index section index within its input
 * @param input originating input; its {@link CalculationInput#warnings()} lists the defaults that were used
 * @param sza solar zenith angle in degrees at the first sample
 * @param airMass relative air mass for {@code sza}
 * @param temperatureCorrection multiplicative temperature correction applied to the spectrum
 * @param spectrum per-wavelength values
 * @since 0.1.0
 */
public record Result(
    int index,
    CalculationInput input,
    double sza,
    double airMass,
    double temperatureCorrection,
    Spectrum spectrum) {

  public Result {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(spectrum, "spectrum");
  }

  /** Warnings of the originating input. */
  public List<String> warnings() {
    return input.warnings();
  }
}
