package ca.gc.cra.uvcalc.infrastructure.file;

import ca.gc.cra.uvcalc.application.port.DataSource;
import ca.gc.cra.uvcalc.domain.ancillary.Calibration;
import ca.gc.cra.uvcalc.domain.error.FormatException;
import ca.gc.cra.uvcalc.domain.warning.WarningSink;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a UVR calibration file: one {@code wavelength sensitivity} pair per line, wavelength in tenths of a
 * nanometre.
 *
 * <p>Any line that does not hold exactly two numeric fields is fatal. Blank lines are skipped.</p>
 *
 * @since 0.1.0
 */
public final class CalibrationFileSource implements DataSource<Calibration> {
  private static final Logger log = LoggerFactory.getLogger(CalibrationFileSource.class);

  private final Path path;

  public CalibrationFileSource(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  @Override
  public Calibration fetch(WarningSink warnings) throws IOException {
    String source = path.getFileName().toString();
    DoubleColumns columns = new DoubleColumns(2);
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.ISO_8859_1)) {
      String line;
      while ((line = reader.readLine()) != null) {
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
          continue;
        }
        String[] fields = trimmed.split("\\s+");
        if (fields.length != 2) {
          throw new FormatException(source, trimmed, "Expected 2 fields in calibration line, found " + fields.length);
        }
        try {
          columns.add(Double.parseDouble(fields[0]) / 10, Double.parseDouble(fields[1]));
        } catch (NumberFormatException ex) {
          throw new FormatException(source, trimmed, "Non-numeric calibration value", ex);
        }
      }
    }
    log.debug("Loaded {} calibration points from '{}'", columns.size(), source);
    return new Calibration(columns.column(0), columns.column(1));
  }

  @Override
  public String toString() {
    return "CalibrationFileSource[" + path + "]";
  }
}
