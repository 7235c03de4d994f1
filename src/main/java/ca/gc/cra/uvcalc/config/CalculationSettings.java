package ca.gc.cra.uvcalc.config;

import ca.gc.cra.uvcalc.domain.ancillary.Angstrom;
import ca.gc.cra.uvcalc.domain.ancillary.StraylightCorrection;
import ca.gc.cra.uvcalc.domain.error.ValidationException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Physical settings and defaults applied by the correction pipeline.
 * <p><strong>Why:</strong> Operators tune temperature correction, ancillary defaults and data origins per campaign
 * without code changes.</p>
 * <p><strong>Role:</strong> Shared, immutable input of every calculation input and section job.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param arfColumn zero-based field index of the ARF file holding the response values (field 0 is the angle)
 * @param noCoscor disables the cosine correction entirely
 * @param temperatureCorrectionFactor coefficient {@code c} of {@code 1 + c*(T - Tref)}
 * @param temperatureCorrectionReference reference temperature {@code Tref} in degrees Celsius
 * @param defaultAlbedo albedo used when no parameter file is available
 * @param defaultAerosol Ångström parameters used when no parameter file is available
 * @param defaultOzone ozone column in DU used when no ozone data is available
 * @param defaultStraylight stray-light behaviour for unknown instrument models
 * @param uvDataSource origin of UV sections
 * @param ozoneDataSource origin of ozone data
 * @param uvrDataSource origin of calibration data
 * @param brewerModelDataSource origin of the instrument model
 * @since 0.1.0
 */
public record CalculationSettings(
    int arfColumn,
    boolean noCoscor,
    double temperatureCorrectionFactor,
    double temperatureCorrectionReference,
    double defaultAlbedo,
    Angstrom defaultAerosol,
    double defaultOzone,
    StraylightCorrection defaultStraylight,
    DataSourceKind uvDataSource,
    DataSourceKind ozoneDataSource,
    DataSourceKind uvrDataSource,
    DataSourceKind brewerModelDataSource) {

  public CalculationSettings {
    if (arfColumn < 1) {
      throw new ValidationException("arfColumn must be at least 1 (was " + arfColumn + ")");
    }
    Objects.requireNonNull(defaultAerosol, "defaultAerosol");
    defaultStraylight = Objects.requireNonNullElse(defaultStraylight, StraylightCorrection.APPLIED);
    if (defaultStraylight == StraylightCorrection.UNDEFINED) {
      throw new ValidationException("defaultStraylight must be APPLIED or NOT_APPLIED");
    }
    uvDataSource = Objects.requireNonNullElse(uvDataSource, DataSourceKind.FILES);
    ozoneDataSource = Objects.requireNonNullElse(ozoneDataSource, DataSourceKind.FILES);
    uvrDataSource = Objects.requireNonNullElse(uvrDataSource, DataSourceKind.FILES);
    brewerModelDataSource = Objects.requireNonNullElse(brewerModelDataSource, DataSourceKind.FILES);
    if (brewerModelDataSource != DataSourceKind.FILES) {
      throw new ValidationException("brewerModelDataSource only supports FILES");
    }
  }

  public static CalculationSettings defaults() {
    return new CalculationSettings(
        3,
        false,
        0.0,
        0.0,
        0.04,
        new Angstrom(1.3, 0.1),
        300,
        StraylightCorrection.APPLIED,
        DataSourceKind.FILES,
        DataSourceKind.FILES,
        DataSourceKind.FILES,
        DataSourceKind.FILES);
  }

  /**
   * Builds settings from flattened configuration keys, falling back to {@link #defaults()}.
   *
   * @param options flattened keys such as {@code defaults.ozone} or {@code sources.uv}
   * @return validated settings
   * @throws ValidationException when a value cannot be parsed
   */
  public static CalculationSettings fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    CalculationSettings d = defaults();
    return new CalculationSettings(
        ConfigValues.integer(options, "arfColumn", d.arfColumn()),
        ConfigValues.bool(options, "noCoscor", d.noCoscor()),
        ConfigValues.decimal(options, "temperatureCorrection.factor", d.temperatureCorrectionFactor()),
        ConfigValues.decimal(options, "temperatureCorrection.reference", d.temperatureCorrectionReference()),
        ConfigValues.decimal(options, "defaults.albedo", d.defaultAlbedo()),
        new Angstrom(
            ConfigValues.decimal(options, "defaults.aerosol.alpha", d.defaultAerosol().alpha()),
            ConfigValues.decimal(options, "defaults.aerosol.beta", d.defaultAerosol().beta())),
        ConfigValues.decimal(options, "defaults.ozone", d.defaultOzone()),
        parseStraylight(options.get("defaults.straylight"), d.defaultStraylight()),
        DataSourceKind.parse("sources.uv", options.get("sources.uv"), d.uvDataSource()),
        DataSourceKind.parse("sources.ozone", options.get("sources.ozone"), d.ozoneDataSource()),
        DataSourceKind.parse("sources.uvr", options.get("sources.uvr"), d.uvrDataSource()),
        DataSourceKind.parse("sources.brewerModel", options.get("sources.brewerModel"), d.brewerModelDataSource()));
  }

  /**
   * @param measuredTemperature instrument temperature in degrees Celsius
   * @return multiplicative temperature correction {@code 1 + c*(T - Tref)}
   */
  public double temperatureCorrection(double measuredTemperature) {
    return 1 + temperatureCorrectionFactor * (measuredTemperature - temperatureCorrectionReference);
  }

  private static StraylightCorrection parseStraylight(String raw, StraylightCorrection defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
    return switch (normalized) {
      case "APPLIED" -> StraylightCorrection.APPLIED;
      case "NOT_APPLIED" -> StraylightCorrection.NOT_APPLIED;
      default -> throw new ValidationException(
          "defaults.straylight must be APPLIED or NOT_APPLIED (was " + raw + ")");
    };
  }
}
