package ca.gc.cra.uvcalc.infrastructure.file;

import ca.gc.cra.uvcalc.domain.ancillary.OzoneSeries;
import ca.gc.cra.uvcalc.domain.error.FormatException;
import ca.gc.cra.uvcalc.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scans a daily B file for its ozone {@code summary} records and the instrument constants ({@code inst}) line.
 *
 * <p>Summary records whose air mass exceeds {@value #MAX_AIR_MASS} or whose ozone standard deviation exceeds
 * {@value #MAX_OZONE_STD} are dropped. A file without an {@code inst} line is rejected.</p>
 */
final class BFileReader {
  private static final Logger log = LoggerFactory.getLogger(BFileReader.class);

  static final double MAX_AIR_MASS = 3.5;
  static final double MAX_OZONE_STD = 2.5;

  static final Pattern SUMMARY = Pattern.compile(
      "summary (?<hours>\\d\\d):(?<minutes>\\d\\d):(?<seconds>\\d\\d)\\s+"
          + "[A-Z]{3}\\s+\\d\\d/\\s*\\d\\d\\s+"
          + "\\S+\\s+"
          + "(?<airMass>\\S+)\\s+"
          + "\\S+\\s+"
          + "ds\\s+"
          + "(?:\\S+\\s+){8}"
          + "(?<ozone>\\S+)\\s+"
          + "(?:\\S+\\s+){7}"
          + "(?<ozoneStd>\\S+)");

  static final Pattern INSTRUMENT = Pattern.compile("inst\\s+(?:\\S+\\s+){22}(?<brewerType>\\S+)\\s+");

  /** Ozone records and instrument type read from one B file. */
  record Contents(OzoneSeries ozone, String brewerType) {}

  private BFileReader() {
    // Utility
  }

  static Contents read(Path path) throws IOException {
    String source = path.getFileName().toString();
    log.debug("Parsing B file '{}'", source);
    DoubleColumns ozone = new DoubleColumns(2);
    String brewerType = null;
    int rejected = 0;
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.ISO_8859_1)) {
      String raw;
      while ((raw = reader.readLine()) != null) {
        String line = raw.replace('\r', ' ').strip();
        Matcher summary = SUMMARY.matcher(line);
        if (summary.lookingAt()) {
          try {
            if (Double.parseDouble(summary.group("airMass")) > MAX_AIR_MASS
                || Double.parseDouble(summary.group("ozoneStd")) > MAX_OZONE_STD) {
              rejected++;
              continue;
            }
            double minutes = (Integer.parseInt(summary.group("hours")) * 3600
                + Integer.parseInt(summary.group("minutes")) * 60
                + Integer.parseInt(summary.group("seconds"))) / 60.0;
            ozone.add(minutes, Double.parseDouble(summary.group("ozone")));
          } catch (NumberFormatException ex) {
            throw new FormatException(source, excerpt(line), "An error occurred while parsing the B file", ex);
          }
          continue;
        }
        Matcher instrument = INSTRUMENT.matcher(line);
        if (instrument.lookingAt()) {
          brewerType = instrument.group("brewerType");
        }
      }
    }
    if (brewerType == null) {
      throw new FormatException(source, "", "No brewer type found in B file");
    }
    log.debug("Read {} ozone records from '{}' ({} rejected), brewer type {}",
        ozone.size(), source, rejected, brewerType);
    return new Contents(new OzoneSeries(ozone.column(0), ozone.column(1)), brewerType);
  }

  private static String excerpt(String line) {
    return Logs.truncate(line, 200);
  }
}
