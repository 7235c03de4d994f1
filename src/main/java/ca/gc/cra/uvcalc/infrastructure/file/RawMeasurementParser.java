package ca.gc.cra.uvcalc.infrastructure.file;

import ca.gc.cra.uvcalc.domain.error.FormatException;
import ca.gc.cra.uvcalc.domain.measurement.Position;
import ca.gc.cra.uvcalc.domain.measurement.RawHeader;
import ca.gc.cra.uvcalc.domain.measurement.RawSample;
import ca.gc.cra.uvcalc.domain.measurement.Section;
import ca.gc.cra.uvcalc.domain.warning.WarningSink;
import ca.gc.cra.uvcalc.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Parses a raw UV measurement file into its ordered sections.
 * <p><strong>Why:</strong> The instrument writes a stateful, line-oriented format: header, samples, an optional
 * {@code dark} line followed by a second pass of samples, and an optional {@code end} sentinel.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Match each header against the strict header grammar and convert tenths of nanometres to nanometres.</li>
 *   <li>Average the dark value and pair second-pass samples with the first pass in reverse order.</li>
 *   <li>Start a new section at the next header when a section has no {@code end} sentinel.</li>
 *   <li>Stop at end of input, a blank line or the {@code 0x1A} guard byte.</li>
 *   <li>Fail with {@link FormatException} on any malformed header or sample line.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the source label; one instance may parse several
 * readers sequentially.</p>
 * <p><strong>Observability:</strong> Logs section counts at DEBUG and raises a warning for the suspicious
 * 0.1147&nbsp;s integration time.</p>
 *
 * @since 0.1.0
 */
public final class RawMeasurementParser {
  private static final Logger log = LoggerFactory.getLogger(RawMeasurementParser.class);
  private static final int EXCERPT_CHARS = 200;
  private static final String GUARD = "\u001A";
  private static final double SUSPICIOUS_INTEGRATION_TIME = 0.1147;

  static final Pattern HEADER = Pattern.compile(
      "^(?<type>[a-z]{2})\\s+"
          + "Integration time is (?<integrationTime>\\S+) seconds.+"
          + "dt\\s+(?<deadTime>\\S+).+"
          + "cy\\s+(?<cycles>\\d+).+"
          + "dh\\s+(?<day>\\d+) (?<month>\\d+) (?<year>\\d+)\\s+"
          + "(?<place>(?: ?[a-zA-Z])+)\\s+"
          + "(?<latitude>\\S+) +(?<longitude>\\S+) +(?<temperature>\\S+)\\s+"
          + "pr\\s*(?<pressure>\\d+).*"
          + "dark\\s*(?<dark>\\S+)\\s*$");

  static final Pattern SAMPLE = Pattern.compile(
      "^\\s*(?<time>\\S+)\\s+(?<wavelength>\\S+)\\s+(?<step>\\d+)\\s+(?<events>\\S+)\\s*$");

  private static final Pattern DARK = Pattern.compile("^dark\\s+(?<dark>\\S+)\\s*$");

  private final String source;

  /**
   * @param source file name or label used in diagnostics
   */
  public RawMeasurementParser(String source) {
    this.source = Objects.requireNonNull(source, "source");
  }

  /**
   * Parses every section of the input.
   *
   * @param reader line source positioned at the first header
   * @param warnings sink for suspicious but valid headers
   * @return sections in file order; empty when the input holds no header
   * @throws IOException when reading fails
   * @throws FormatException when a header, sample or dark line is malformed
   */
  public List<Section> parse(BufferedReader reader, WarningSink warnings) throws IOException {
    Objects.requireNonNull(reader, "reader");
    Objects.requireNonNull(warnings, "warnings");
    List<Section> sections = new ArrayList<>();
    String headerLine = reader.readLine();
    while (headerLine != null && !headerLine.strip().isEmpty() && !headerLine.strip().equals(GUARD)) {
      RawHeader header = parseHeader(headerLine, warnings);

      List<RawSample> samples = new ArrayList<>();
      String next = reader.readLine();
      while (next != null && !next.contains("dark") && !next.contains("end")) {
        samples.add(parseSample(next));
        next = reader.readLine();
      }

      String pendingHeader = null;
      Matcher dark = next == null ? null : DARK.matcher(next);
      if (dark != null && dark.matches()) {
        header = header.withDark((header.dark() + parseDouble(dark.group("dark"), next, "dark")) / 2);
        next = reader.readLine();
        for (int i = samples.size() - 1; i >= 0; i--) {
          if (next == null) {
            throw new FormatException(source, "", "Input ended during the dark correction pass");
          }
          RawSample first = samples.get(i);
          RawSample second = parseSample(next);
          samples.set(i, new RawSample(
              (first.time() + second.time()) / 2,
              first.wavelength(),
              (first.step() + second.step()) / 2,
              (first.events() + second.events()) / 2));
          next = reader.readLine();
        }
        if (next != null && !next.contains("end")) {
          throw new FormatException(
              source, excerpt(next), "Failed parsing uv section. Expected 'end' after the dark correction pass");
        }
      } else if (next != null && HEADER.matcher(next).matches()) {
        pendingHeader = next;
      } else if (next != null && !next.contains("end")) {
        throw new FormatException(source, excerpt(next), "Unable to parse dark line");
      }

      sections.add(new Section(header, samples));
      log.debug("Parsed section {} of {} with {} samples", sections.size(), source, samples.size());
      headerLine = pendingHeader != null ? pendingHeader : reader.readLine();
    }
    log.debug("Parsed {} sections from '{}'", sections.size(), source);
    return sections;
  }

  /**
   * Parses one header line.
   *
   * @throws FormatException when the line does not follow the header grammar
   */
  RawHeader parseHeader(String line, WarningSink warnings) {
    Matcher m = HEADER.matcher(line);
    if (!m.matches()) {
      throw new FormatException(source, excerpt(line), "Unable to parse header");
    }
    double integrationTime = parseDouble(m.group("integrationTime"), line, "integration time");
    if (integrationTime == SUSPICIOUS_INTEGRATION_TIME) {
      String message = "Integration time is 0.1147 in " + source
          + ". This might be correct but there is a high chance that the intended value is 0.2294.";
      log.warn(message);
      warnings.warn(message);
    }
    LocalDate date;
    try {
      date = LocalDate.of(
          2000 + Integer.parseInt(m.group("year")),
          Integer.parseInt(m.group("month")),
          Integer.parseInt(m.group("day")));
    } catch (DateTimeException | NumberFormatException ex) {
      throw new FormatException(source, excerpt(line), "Invalid header date", ex);
    }
    return new RawHeader(
        m.group("type"),
        integrationTime,
        parseDouble(m.group("deadTime"), line, "dead time"),
        parseInt(m.group("cycles"), line, "cycles"),
        date,
        m.group("place"),
        new Position(
            parseDouble(m.group("latitude"), line, "latitude"),
            parseDouble(m.group("longitude"), line, "longitude")),
        parseDouble(m.group("temperature"), line, "temperature"),
        parseDouble(m.group("pressure"), line, "pressure"),
        parseDouble(m.group("dark"), line, "dark"),
        line.strip());
  }

  /**
   * Parses one four-field sample line; the wavelength is converted from tenths of nanometres.
   *
   * @throws FormatException when the line does not hold exactly the expected fields
   */
  RawSample parseSample(String line) {
    Matcher m = SAMPLE.matcher(line);
    if (!m.matches()) {
      throw new FormatException(source, excerpt(line), "Unable to parse value line");
    }
    return new RawSample(
        parseDouble(m.group("time"), line, "time"),
        parseDouble(m.group("wavelength"), line, "wavelength") / 10,
        parseDouble(m.group("step"), line, "step"),
        parseDouble(m.group("events"), line, "events"));
  }

  private double parseDouble(String raw, String line, String field) {
    try {
      return Double.parseDouble(raw);
    } catch (NumberFormatException ex) {
      throw new FormatException(source, excerpt(line), "Invalid " + field + " '" + raw + "'", ex);
    }
  }

  private int parseInt(String raw, String line, String field) {
    try {
      return Integer.parseInt(raw);
    } catch (NumberFormatException ex) {
      throw new FormatException(source, excerpt(line), "Invalid " + field + " '" + raw + "'", ex);
    }
  }

  private static String excerpt(String line) {
    return Logs.truncate(Logs.printable(line), EXCERPT_CHARS);
  }
}
