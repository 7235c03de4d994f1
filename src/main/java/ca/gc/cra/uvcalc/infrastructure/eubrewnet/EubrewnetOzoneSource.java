package ca.gc.cra.uvcalc.infrastructure.eubrewnet;

import ca.gc.cra.uvcalc.application.port.DataSource;
import ca.gc.cra.uvcalc.domain.ancillary.OzoneSeries;
import ca.gc.cra.uvcalc.domain.error.DataSourceException;
import ca.gc.cra.uvcalc.domain.warning.WarningSink;
import ca.gc.cra.uvcalc.validation.Strings;
import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Level 1.5 ozone observations from the EUBREWNET {@code O3L1_5} endpoint (HTTP basic authentication).
 *
 * <p>The first row is a column header. In data rows, field 1 is a UTC timestamp such as
 * {@code 20190611T123456Z} and field 9 the ozone column. A response without data rows is recorded as a warning
 * and yields an empty series.</p>
 *
 * @since 0.1.0
 */
public final class EubrewnetOzoneSource implements DataSource<OzoneSeries> {
  private static final Logger log = LoggerFactory.getLogger(EubrewnetOzoneSource.class);
  private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

  private final EubrewnetClient client;
  private final String brewerId;
  private final LocalDate date;

  public EubrewnetOzoneSource(EubrewnetClient client, String brewerId, LocalDate date) {
    this.client = Objects.requireNonNull(client, "client");
    this.brewerId = Strings.requireNonBlank("brewerId", brewerId);
    this.date = Objects.requireNonNull(date, "date");
  }

  @Override
  public OzoneSeries fetch(WarningSink warnings) throws IOException {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("brewerid", brewerId);
    query.put("date", date.toString());
    Object data = client.getJson("/data/get/O3L1_5", query, true);
    try {
      List<?> rows = JsonSupport.list(data, "ozone");
      int count = Math.max(0, rows.size() - 1);
      double[] times = new double[count];
      double[] values = new double[count];
      for (int i = 0; i < count; i++) {
        List<?> row = JsonSupport.list(rows.get(i + 1), "ozone row");
        String stamp = JsonSupport.text(row.get(1), "timestamp");
        LocalDateTime time = LocalDateTime.parse(stamp.substring(0, stamp.length() - 1), TIMESTAMP);
        times[i] = time.getHour() * 60 + time.getMinute() + time.getSecond() / 60.0;
        values[i] = JsonSupport.number(row.get(9), "ozone");
      }
      if (count == 0) {
        String warning = noOzoneWarning(brewerId, date);
        log.warn(warning);
        warnings.warn(warning);
      }
      return new OzoneSeries(times, values);
    } catch (IllegalArgumentException | IndexOutOfBoundsException | DateTimeParseException ex) {
      throw new DataSourceException(
          "Unexpected ozone data returned by " + client.uri("/data/get/O3L1_5", query) + ": " + ex.getMessage(), ex);
    }
  }

  static String noOzoneWarning(String brewerId, LocalDate date) {
    return "No ozone measurement on EUBREWNET for brewer " + brewerId + " on " + date
        + ". Default ozone value is used.";
  }

  @Override
  public String toString() {
    return "EubrewnetOzoneSource[" + brewerId + ", " + date + "]";
  }
}
