package ca.gc.cra.uvcalc.application.pipeline;

import ca.gc.cra.uvcalc.application.input.CalculationInput;
import ca.gc.cra.uvcalc.application.port.RadiativeTransferPort;
import ca.gc.cra.uvcalc.config.CalculationSettings;
import ca.gc.cra.uvcalc.domain.ancillary.Angstrom;
import ca.gc.cra.uvcalc.domain.ancillary.AngularResponse;
import ca.gc.cra.uvcalc.domain.ancillary.Calibration;
import ca.gc.cra.uvcalc.domain.ancillary.CosCorrectionMode;
import ca.gc.cra.uvcalc.domain.ancillary.StraylightCorrection;
import ca.gc.cra.uvcalc.domain.error.SolverException;
import ca.gc.cra.uvcalc.domain.error.ValidationException;
import ca.gc.cra.uvcalc.domain.measurement.RawHeader;
import ca.gc.cra.uvcalc.domain.measurement.RawSample;
import ca.gc.cra.uvcalc.domain.measurement.Section;
import ca.gc.cra.uvcalc.domain.result.Spectrum;
import ca.gc.cra.uvcalc.domain.solver.SolverDirective;
import ca.gc.cra.uvcalc.domain.solver.SolverRequest;
import ca.gc.cra.uvcalc.domain.solver.SolverResult;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns the raw counts of one section into a calibrated, cosine-corrected spectrum.
 * <p><strong>Steps:</strong>
 * <ol>
 *   <li>Subtract the dark count, then the mean count below {@value #STRAYLIGHT_LIMIT_NM} nm when the instrument
 *   needs stray-light correction.</li>
 *   <li>Convert to a photon rate and apply {@value #DEAD_TIME_ITERATIONS} fixed-point dead-time iterations.</li>
 *   <li>Clamp negative rates, divide by the interpolated calibration and apply the temperature correction.</li>
 *   <li>Multiply by the cosine correction chosen for the sky state; NaN factors leave the value unchanged.</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared, immutable input; one instance serves every
 * section of its input concurrently.</p>
 * <p><strong>Error handling:</strong> failures are logged with the input and section index and rethrown.</p>
 *
 * @since 0.1.0
 */
public final class CorrectionPipeline {
  private static final Logger log = LoggerFactory.getLogger(CorrectionPipeline.class);

  static final double STRAYLIGHT_LIMIT_NM = 292;
  static final int DEAD_TIME_ITERATIONS = 25;
  static final List<String> SOLVER_OUTPUTS = List.of(
      CosineCorrection.SZA, CosineCorrection.DIRECT, CosineCorrection.DIFFUSE, CosineCorrection.GLOBAL);

  private final CalculationInput input;
  private final RadiativeTransferPort solver;

  public CorrectionPipeline(CalculationInput input, RadiativeTransferPort solver) {
    this.input = Objects.requireNonNull(input, "input");
    this.solver = Objects.requireNonNull(solver, "solver");
  }

  public CalculationInput input() {
    return input;
  }

  /**
   * Corrects one section of the input.
   *
   * @param index section index in {@link CalculationInput#sections()}
   * @return corrected result
   * @throws ValidationException when the section or calibration is too small to process
   * @throws SolverException when the solver fails or returns the wrong number of rows
   */
  public Result calculate(int index) {
    try {
      log.debug("Starting calculation for section {} of {}", index, input);
      Section section = input.sections().get(index);
      if (section.size() < 2) {
        throw new ValidationException("Section " + index + " has " + section.size()
            + " samples; at least 2 are needed to define the wavelength step");
      }
      SolverResult modelled = solver.solve(solverRequest(section));
      if (modelled.rowCount() != section.size()) {
        throw new SolverException("Solver returned " + modelled.rowCount() + " rows for " + section.size()
            + " wavelengths");
      }

      RawHeader header = section.header();
      double temperatureCorrection = input.settings().temperatureCorrection(header.temperature());
      log.debug("Temperature is {} C, correction factor {}", header.temperature(), temperatureCorrection);
      double[] calibrated = calibratedSpectrum(section, input.calibration());
      for (int i = 0; i < calibrated.length; i++) {
        calibrated[i] *= temperatureCorrection;
      }

      double[] cosCorrection = cosCorrection(section.firstTime(), modelled);
      double[] cosCorrected = new double[calibrated.length];
      for (int i = 0; i < calibrated.length; i++) {
        double factor = Double.isNaN(cosCorrection[i]) ? 1 : cosCorrection[i];
        cosCorrected[i] = calibrated[i] * factor;
      }

      Spectrum spectrum = new Spectrum(
          section.wavelengths(), section.times(), section.events(), calibrated, cosCorrected, cosCorrection);
      double sza = modelled.column(CosineCorrection.SZA)[0];
      log.debug("Finished calculation for section {} of {}", index, input);
      return new Result(index, input, sza, AirMass.of(sza), temperatureCorrection, spectrum);
    } catch (RuntimeException ex) {
      log.error("Calculation failed for section {} of {}", index, input, ex);
      throw ex;
    }
  }

  /**
   * Steps 1 to 6: dark and stray-light subtraction, photon rate, dead-time correction, clamping and calibration.
   */
  double[] calibratedSpectrum(Section section, Calibration calibration) {
    if (calibration.isEmpty()) {
      throw new ValidationException("Calibration needs at least 2 points, found " + calibration.size());
    }
    RawHeader header = section.header();
    double[] events = section.events();
    double[] corrected = new double[events.length];
    for (int i = 0; i < events.length; i++) {
      corrected[i] = events[i] - header.dark();
    }

    if (input.straylightCorrection() == StraylightCorrection.APPLIED) {
      double sum = 0;
      int count = 0;
      for (RawSample sample : section.samples()) {
        if (sample.wavelength() < STRAYLIGHT_LIMIT_NM) {
          sum += sample.events();
          count++;
        }
      }
      if (count > 0) {
        double straylight = sum / count;
        log.debug("Applying straylight correction of {} counts", straylight);
        for (int i = 0; i < corrected.length; i++) {
          corrected[i] -= straylight;
        }
      }
    }

    double[] rate = photonRate(corrected, header);
    double[] sensitivity = calibration.interpolate(section.wavelengths());
    for (int i = 0; i < rate.length; i++) {
      rate[i] = Math.max(0, rate[i]) / sensitivity[i];
    }
    return rate;
  }

  /** Count-to-rate conversion followed by the fixed dead-time iteration. */
  static double[] photonRate(double[] counts, RawHeader header) {
    double[] rate0 = new double[counts.length];
    for (int i = 0; i < counts.length; i++) {
      rate0[i] = counts[i] * 4 / (header.cycles() * header.integrationTime());
    }
    double[] rate = rate0.clone();
    for (int iteration = 0; iteration < DEAD_TIME_ITERATIONS; iteration++) {
      for (int i = 0; i < rate.length; i++) {
        rate[i] = rate0[i] * Math.exp(rate[i] * header.deadTime());
      }
    }
    return rate;
  }

  private double[] cosCorrection(double time, SolverResult modelled) {
    int size = modelled.rowCount();
    CosCorrectionMode mode = input.cosCorrectionMode(time);
    return switch (mode) {
      case DIFFUSE -> {
        log.debug("Using diffuse correction for time {}", time);
        yield CosineCorrection.diffuseFactors(requireArf(), size);
      }
      case CLEAR_SKY -> {
        log.debug("Using clear sky correction for time {}", time);
        yield CosineCorrection.clearSkyFactors(requireArf(), modelled);
      }
      case NONE -> {
        log.debug("Using no cos correction");
        double[] ones = new double[size];
        Arrays.fill(ones, 1);
        yield ones;
      }
    };
  }

  private AngularResponse requireArf() {
    return input.arf().orElseThrow(() -> new IllegalStateException("Cosine correction requires an ARF"));
  }

  SolverRequest solverRequest(Section section) {
    RawHeader header = section.header();
    CalculationSettings settings = input.settings();
    double[] wavelengths = section.wavelengths();
    double first = wavelengths[0];
    double last = wavelengths[wavelengths.length - 1];
    double minutes = section.firstTime();
    long seconds = Math.floorMod((long) Math.floor(minutes * 60), 86_400L);
    LocalDate date = header.date();
    int dayOfYear = date.getDayOfYear();
    double longitude = header.position().longitude();
    Angstrom aerosol = input.parameters().interpolateAerosol(dayOfYear, settings.defaultAerosol());

    return SolverRequest.builder()
        .put(SolverDirective.WAVELENGTH, first, last)
        .put(SolverDirective.LATITUDE, "N", header.position().latitude())
        .put(SolverDirective.LONGITUDE, longitude < 0 ? "E" : "W", Math.abs(longitude))
        .put(SolverDirective.SPLINE, first, last, wavelengths[1] - first)
        .put(SolverDirective.OZONE, input.ozone().interpolate(minutes, settings.defaultOzone()))
        .put(SolverDirective.TIME, date.getYear(), date.getMonthValue(), date.getDayOfMonth(),
            (int) (seconds / 3600), (int) (seconds % 3600 / 60), (int) (seconds % 60))
        .put(SolverDirective.PRESSURE, header.pressure())
        .put(SolverDirective.ALBEDO, input.parameters().interpolateAlbedo(dayOfYear, settings.defaultAlbedo()))
        .put(SolverDirective.AEROSOL, aerosol.alpha(), aerosol.beta())
        .outputs(SOLVER_OUTPUTS.toArray(new String[0]))
        .build();
  }
}
