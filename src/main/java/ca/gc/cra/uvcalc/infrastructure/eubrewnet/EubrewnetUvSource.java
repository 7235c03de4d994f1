package ca.gc.cra.uvcalc.infrastructure.eubrewnet;

import ca.gc.cra.uvcalc.application.port.DataSource;
import ca.gc.cra.uvcalc.domain.error.DataSourceException;
import ca.gc.cra.uvcalc.domain.measurement.Position;
import ca.gc.cra.uvcalc.domain.measurement.RawHeader;
import ca.gc.cra.uvcalc.domain.measurement.RawSample;
import ca.gc.cra.uvcalc.domain.measurement.SampleMerger;
import ca.gc.cra.uvcalc.domain.measurement.Section;
import ca.gc.cra.uvcalc.domain.warning.WarningSink;
import ca.gc.cra.uvcalc.validation.Strings;
import java.io.IOException;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fetches the UV scans of one instrument and day from EUBREWNET.
 * <p><strong>Protocol:</strong> {@code getUVAvailableScanTypes} lists the scan types of the day; each type is
 * then fetched with {@code getUV}. The response is a flat array of five-element groups: header fields, times,
 * wavelengths (tenths of a nanometre), steps and counts.</p>
 * <p><strong>Result:</strong> one {@link Section} per group, with duplicate wavelengths averaged.</p>
 *
 * @since 0.1.0
 */
public final class EubrewnetUvSource implements DataSource<List<Section>> {
  private static final Logger log = LoggerFactory.getLogger(EubrewnetUvSource.class);
  private static final int GROUP_SIZE = 5;

  private final EubrewnetClient client;
  private final String brewerId;
  private final LocalDate date;

  public EubrewnetUvSource(EubrewnetClient client, String brewerId, LocalDate date) {
    this.client = Objects.requireNonNull(client, "client");
    this.brewerId = Strings.requireNonBlank("brewerId", brewerId);
    this.date = Objects.requireNonNull(date, "date");
  }

  @Override
  public List<Section> fetch(WarningSink warnings) throws IOException {
    Map<String, String> dayQuery = new LinkedHashMap<>();
    dayQuery.put("brewerid", brewerId);
    dayQuery.put("date", date.toString());
    Object scanTypes = client.getJson("/getdataold/getUVAvailableScanTypes", dayQuery, false);

    List<Section> sections = new ArrayList<>();
    for (Object rawType : JsonSupport.list(scanTypes, "scan types")) {
      String scanType = JsonSupport.text(rawType, "scan type");
      Map<String, String> query = new LinkedHashMap<>();
      query.put("scantype", scanType);
      query.putAll(dayQuery);
      String label = client.uri("/getdataold/getUV", query).toString();
      Object data = client.getJson("/getdataold/getUV", query, false);
      try {
        sections.addAll(toSections(scanType, JsonSupport.list(data, "UV data"), label));
      } catch (IllegalArgumentException | IndexOutOfBoundsException | DateTimeException ex) {
        throw new DataSourceException("Unexpected UV data returned by " + label + ": " + ex.getMessage(), ex);
      }
    }
    log.debug("Fetched {} UV sections for brewer {} on {}", sections.size(), brewerId, date);
    return sections;
  }

  static List<Section> toSections(String scanType, List<?> data, String label) {
    if (data.size() % GROUP_SIZE != 0) {
      throw new IllegalArgumentException("UV data length " + data.size() + " is not a multiple of " + GROUP_SIZE);
    }
    List<Section> sections = new ArrayList<>();
    for (int offset = 0; offset < data.size(); offset += GROUP_SIZE) {
      List<?> header = JsonSupport.list(data.get(offset), "header");
      double[] times = JsonSupport.numbers(data.get(offset + 1), "times");
      double[] wavelengths = JsonSupport.numbers(data.get(offset + 2), "wavelengths");
      double[] steps = JsonSupport.numbers(data.get(offset + 3), "steps");
      double[] counts = JsonSupport.numbers(data.get(offset + 4), "counts");
      if (wavelengths.length != times.length || steps.length != times.length || counts.length != times.length) {
        throw new IllegalArgumentException("UV data columns have different lengths");
      }
      RawHeader rawHeader = new RawHeader(
          scanType,
          JsonSupport.number(header.get(2), "integration time"),
          JsonSupport.number(header.get(3), "dead time"),
          (int) JsonSupport.number(header.get(4), "cycles"),
          LocalDate.parse(JsonSupport.text(header.get(5), "date")),
          JsonSupport.text(header.get(6), "place"),
          new Position(JsonSupport.number(header.get(7), "latitude"), JsonSupport.number(header.get(8), "longitude")),
          JsonSupport.number(header.get(9), "temperature"),
          JsonSupport.number(header.get(10), "pressure"),
          JsonSupport.number(header.get(11), "dark"),
          label);
      List<RawSample> samples = new ArrayList<>(times.length);
      for (int i = 0; i < times.length; i++) {
        samples.add(new RawSample(times[i], wavelengths[i] / 10, steps[i], counts[i]));
      }
      sections.add(new Section(rawHeader, SampleMerger.mergeDuplicates(samples)));
    }
    return sections;
  }

  @Override
  public String toString() {
    return "EubrewnetUvSource[" + brewerId + ", " + date + "]";
  }
}
