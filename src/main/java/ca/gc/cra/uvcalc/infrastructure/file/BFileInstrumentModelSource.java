package ca.gc.cra.uvcalc.infrastructure.file;

import ca.gc.cra.uvcalc.application.port.DataSource;
import ca.gc.cra.uvcalc.domain.warning.WarningSink;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Instrument model (for example {@code mkiii}) read from the {@code inst} line of the daily B file.
 *
 * <p>A missing B file yields {@link Optional#empty()}; the ozone source already records the warning for it.</p>
 *
 * @since 0.1.0
 */
public final class BFileInstrumentModelSource implements DataSource<Optional<String>> {
  private final BFile bFile;

  public BFileInstrumentModelSource(BFile bFile) {
    this.bFile = Objects.requireNonNull(bFile, "bFile");
  }

  public BFileInstrumentModelSource(Optional<Path> path) {
    this(new BFile(path));
  }

  @Override
  public Optional<String> fetch(WarningSink warnings) throws IOException {
    return bFile.contents().map(BFileReader.Contents::brewerType);
  }

  @Override
  public String toString() {
    return "BFileInstrumentModelSource[" + bFile + "]";
  }
}
