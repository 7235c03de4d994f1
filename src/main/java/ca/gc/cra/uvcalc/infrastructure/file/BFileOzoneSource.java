package ca.gc.cra.uvcalc.infrastructure.file;

import ca.gc.cra.uvcalc.application.port.DataSource;
import ca.gc.cra.uvcalc.domain.ancillary.OzoneSeries;
import ca.gc.cra.uvcalc.domain.warning.WarningSink;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ozone column measurements taken from the daily B file ({@code Bdddyy.id}).
 *
 * <p>Without a B file, or when no summary record passes the quality filter, the series is empty so the configured
 * default ozone applies, and a warning is recorded.</p>
 *
 * @since 0.1.0
 */
public final class BFileOzoneSource implements DataSource<OzoneSeries> {
  private static final Logger log = LoggerFactory.getLogger(BFileOzoneSource.class);

  static final String MISSING_WARNING =
      "Corresponding B file not found. Default ozone value is used and straylight correction is applied.";

  private final BFile bFile;

  public BFileOzoneSource(BFile bFile) {
    this.bFile = Objects.requireNonNull(bFile, "bFile");
  }

  public BFileOzoneSource(Optional<Path> path) {
    this(new BFile(path));
  }

  @Override
  public OzoneSeries fetch(WarningSink warnings) throws IOException {
    Optional<BFileReader.Contents> contents = bFile.contents();
    if (contents.isEmpty()) {
      log.warn(MISSING_WARNING);
      warnings.warn(MISSING_WARNING);
      return OzoneSeries.empty();
    }
    OzoneSeries ozone = contents.get().ozone();
    if (ozone.isEmpty()) {
      String warning = noValidOzoneWarning(bFile.name());
      log.warn(warning);
      warnings.warn(warning);
    }
    return ozone;
  }

  static String noValidOzoneWarning(String fileName) {
    return "No valid ozone measurement in " + fileName + ". Default ozone value is used.";
  }

  @Override
  public String toString() {
    return "BFileOzoneSource[" + bFile + "]";
  }
}
