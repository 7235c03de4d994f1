package ca.gc.cra.uvcalc.infrastructure.file;

import ca.gc.cra.uvcalc.application.port.DataSource;
import ca.gc.cra.uvcalc.domain.ancillary.Angstrom;
import ca.gc.cra.uvcalc.domain.ancillary.DayParameters;
import ca.gc.cra.uvcalc.domain.ancillary.ParameterSeries;
import ca.gc.cra.uvcalc.domain.error.FormatException;
import ca.gc.cra.uvcalc.domain.warning.WarningSink;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads the yearly parameter file ({@code par_yy.id}).
 * <p><strong>Format:</strong> one line per day, {@code day;albedo;alpha;beta;cloudCover}. A blank albedo, or a
 * blank alpha or beta, repeats the previous line's value, so the first line must define both. A blank cloud
 * cover means no observation for that day.</p>
 * <p><strong>Missing or empty file:</strong> yields {@link ParameterSeries#empty()} and a warning; configured
 * defaults apply downstream.</p>
 *
 * @since 0.1.0
 */
public final class ParameterFileSource implements DataSource<ParameterSeries> {
  private static final Logger log = LoggerFactory.getLogger(ParameterFileSource.class);

  static final String MISSING_WARNING = "Parameter File not found. Using default parameter values";
  private static final int FIELD_COUNT = 5;

  private final Optional<Path> path;

  public ParameterFileSource(Optional<Path> path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  @Override
  public ParameterSeries fetch(WarningSink warnings) throws IOException {
    if (path.isEmpty() || !Files.isRegularFile(path.get())) {
      log.warn(MISSING_WARNING);
      warnings.warn(MISSING_WARNING);
      return ParameterSeries.empty();
    }
    Path file = path.get();
    String source = file.getFileName().toString();
    List<DayParameters> days = new ArrayList<>();
    Double previousAlbedo = null;
    Angstrom previousAerosol = null;
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.ISO_8859_1)) {
      String raw;
      while ((raw = reader.readLine()) != null) {
        String line = raw.strip();
        if (line.isEmpty()) {
          continue;
        }
        String[] fields = line.split(";", -1);
        if (fields.length != FIELD_COUNT) {
          throw new FormatException(source, line,
              "Each line of the parameter file must contain " + FIELD_COUNT + " values");
        }
        try {
          int day = Integer.parseInt(fields[0].strip());

          String albedo = fields[1].strip();
          if (!albedo.isEmpty()) {
            previousAlbedo = Double.parseDouble(albedo);
          } else if (previousAlbedo == null) {
            throw new FormatException(source, line, "The albedo must be defined in the first line of the file");
          }

          String alpha = fields[2].strip();
          String beta = fields[3].strip();
          if (!alpha.isEmpty() && !beta.isEmpty()) {
            previousAerosol = new Angstrom(Double.parseDouble(alpha), Double.parseDouble(beta));
          } else if (previousAerosol == null) {
            throw new FormatException(source, line, "The aerosol must be defined in the first line of the file");
          }

          String cloudCover = fields[4].strip();
          OptionalDouble cover = cloudCover.isEmpty()
              ? OptionalDouble.empty()
              : OptionalDouble.of(Double.parseDouble(cloudCover));
          days.add(new DayParameters(day, previousAlbedo, previousAerosol, cover));
        } catch (NumberFormatException ex) {
          throw new FormatException(source, line, "An error occurred while parsing the parameter file", ex);
        }
      }
    }
    if (days.isEmpty()) {
      String warning = emptyFileWarning(source);
      log.warn(warning);
      warnings.warn(warning);
      return ParameterSeries.empty();
    }
    log.debug("Loaded parameters for {} days from '{}'", days.size(), source);
    return new ParameterSeries(days);
  }

  static String emptyFileWarning(String fileName) {
    return "Parameter file " + fileName + " has no data. Using default parameter values";
  }

  @Override
  public String toString() {
    return "ParameterFileSource[" + path.map(Path::toString).orElse("<none>") + "]";
  }
}
