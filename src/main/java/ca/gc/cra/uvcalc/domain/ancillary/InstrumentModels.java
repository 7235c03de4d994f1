package ca.gc.cra.uvcalc.domain.ancillary;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps instrument model identifiers (as written in the instrument constants) to their stray-light
 * behaviour.
 */
public final class InstrumentModels {
  private static final Map<String, StraylightCorrection> MODELS = Map.of(
      "mki", StraylightCorrection.APPLIED,
      "mkii", StraylightCorrection.APPLIED,
      "mkiii", StraylightCorrection.NOT_APPLIED,
      "mkiv", StraylightCorrection.APPLIED);

  private InstrumentModels() {}

  /**
   * @param modelType model identifier such as {@code mkiii}; empty when unknown
   * @return the model's correction, {@link StraylightCorrection#UNDEFINED} for unknown models
   */
  public static StraylightCorrection straylightFor(Optional<String> modelType) {
    return modelType
        .map(type -> MODELS.get(type.trim().toLowerCase(Locale.ROOT)))
        .orElse(StraylightCorrection.UNDEFINED);
  }

  /**
   * Resolves the correction to apply, falling back to {@code configuredDefault} for unknown models.
   */
  public static StraylightCorrection resolve(Optional<String> modelType, StraylightCorrection configuredDefault) {
    StraylightCorrection correction = straylightFor(modelType);
    return correction == StraylightCorrection.UNDEFINED ? configuredDefault : correction;
  }
}
