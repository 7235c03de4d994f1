package ca.gc.cra.uvcalc.infrastructure.eubrewnet;

import ca.gc.cra.uvcalc.application.port.DataSource;
import ca.gc.cra.uvcalc.domain.ancillary.Calibration;
import ca.gc.cra.uvcalc.domain.error.DataSourceException;
import ca.gc.cra.uvcalc.domain.warning.WarningSink;
import ca.gc.cra.uvcalc.validation.Strings;
import java.io.IOException;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Calibration of one instrument valid on a given day, fetched from the EUBREWNET {@code getUVR} endpoint.
 *
 * <p>Element 1 of the response holds wavelengths in tenths of a nanometre, element 2 the sensitivities.</p>
 *
 * @since 0.1.0
 */
public final class EubrewnetCalibrationSource implements DataSource<Calibration> {
  private final EubrewnetClient client;
  private final String brewerId;
  private final LocalDate date;

  public EubrewnetCalibrationSource(EubrewnetClient client, String brewerId, LocalDate date) {
    this.client = Objects.requireNonNull(client, "client");
    this.brewerId = Strings.requireNonBlank("brewerId", brewerId);
    this.date = Objects.requireNonNull(date, "date");
  }

  @Override
  public Calibration fetch(WarningSink warnings) throws IOException {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("brewerid", brewerId);
    query.put("date", date.toString());
    Object data = client.getJson("/getdataold/getUVR", query, false);
    try {
      List<?> rows = JsonSupport.list(data, "calibration");
      double[] wavelengths = JsonSupport.numbers(rows.get(1), "wavelengths");
      for (int i = 0; i < wavelengths.length; i++) {
        wavelengths[i] /= 10;
      }
      return new Calibration(wavelengths, JsonSupport.numbers(rows.get(2), "values"));
    } catch (IllegalArgumentException | IndexOutOfBoundsException ex) {
      throw new DataSourceException(
          "Unexpected calibration data returned by " + client.uri("/getdataold/getUVR", query) + ": "
              + ex.getMessage(), ex);
    }
  }

  @Override
  public String toString() {
    return "EubrewnetCalibrationSource[" + brewerId + ", " + date + "]";
  }
}
