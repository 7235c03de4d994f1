package ca.gc.cra.uvcalc.infrastructure.file;

import ca.gc.cra.uvcalc.application.port.DataSource;
import ca.gc.cra.uvcalc.domain.ancillary.AngularResponse;
import ca.gc.cra.uvcalc.domain.error.FormatException;
import ca.gc.cra.uvcalc.domain.error.ValidationException;
import ca.gc.cra.uvcalc.domain.warning.WarningSink;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads the angular response function of an instrument from its {@code arf_*.dat} file.
 * <p><strong>Format:</strong> lines starting with {@code %} are comments; every data line holds the solar zenith
 * angle in field 0 followed by one response column per measurement setup. The configured zero-based column is
 * read; lines too short for it fall back to their last column.</p>
 * <p><strong>Result:</strong> the table always ends with the synthetic point (90&deg;, 0). A missing file is not an
 * error: it yields {@link Optional#empty()} and a warning, and cosine correction is skipped downstream.</p>
 *
 * @since 0.1.0
 */
public final class ArfFileSource implements DataSource<Optional<AngularResponse>> {
  private static final Logger log = LoggerFactory.getLogger(ArfFileSource.class);

  static final String MISSING_WARNING = "ARF file was not found. Cos correction has not been applied";

  private final Optional<Path> path;
  private final int column;

  /**
   * @param path ARF file, or empty when discovery found none
   * @param column zero-based field index of the response value
   */
  public ArfFileSource(Optional<Path> path, int column) {
    this.path = Objects.requireNonNull(path, "path");
    if (column < 1) {
      throw new ValidationException("ARF column must be >= 1 (field 0 is the angle), got " + column);
    }
    this.column = column;
  }

  @Override
  public Optional<AngularResponse> fetch(WarningSink warnings) throws IOException {
    if (path.isEmpty() || !Files.isRegularFile(path.get())) {
      log.warn(MISSING_WARNING);
      warnings.warn(MISSING_WARNING);
      return Optional.empty();
    }
    Path file = path.get();
    String source = file.getFileName().toString();
    DoubleColumns table = new DoubleColumns(2);
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.ISO_8859_1)) {
      String line;
      while ((line = reader.readLine()) != null) {
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.startsWith("%")) {
          continue;
        }
        String[] fields = trimmed.split("\\s+");
        if (fields.length < 2) {
          throw new FormatException(source, trimmed, "ARF line needs an angle and at least one value");
        }
        int index = column;
        if (fields.length <= column) {
          index = fields.length - 1;
          if (table.isEmpty()) {
            String message = "Could not read column " + column + " from arf file, file has only "
                + fields.length + " columns. Used last column instead.";
            log.warn(message);
            warnings.warn(message);
          }
        }
        double sza;
        double value;
        try {
          sza = Double.parseDouble(fields[0]);
          value = Double.parseDouble(fields[index]);
        } catch (NumberFormatException ex) {
          throw new FormatException(source, trimmed, "Non-numeric ARF value", ex);
        }
        if (sza < 0 || sza > 90) {
          throw new FormatException(source, trimmed, "Solar zenith angle must be within [0, 90]");
        }
        table.add(sza, value);
      }
    }
    table.add(90, 0);
    try {
      AngularResponse response = new AngularResponse(table.column(0), table.column(1));
      log.debug("Loaded {} ARF points from '{}' (column {})", response.size(), source, column);
      return Optional.of(response);
    } catch (ValidationException ex) {
      throw new FormatException(source, "", "Invalid ARF table: " + ex.getMessage(), ex);
    }
  }

  @Override
  public String toString() {
    return "ArfFileSource[" + path.map(Path::toString).orElse("<none>") + ", column=" + column + "]";
  }
}
