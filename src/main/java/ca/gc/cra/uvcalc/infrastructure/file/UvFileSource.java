package ca.gc.cra.uvcalc.infrastructure.file;

import ca.gc.cra.uvcalc.application.port.DataSource;
import ca.gc.cra.uvcalc.domain.measurement.Section;
import ca.gc.cra.uvcalc.domain.warning.WarningSink;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads the sections of a raw UV file ({@code UVdddyy.id}) from disk.
 *
 * <p>The instrument writes Latin-1 text; decoding with UTF-8 would reject the occasional stray byte in place
 * names.</p>
 *
 * @since 0.1.0
 */
public final class UvFileSource implements DataSource<List<Section>> {
  private final Path path;

  public UvFileSource(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  @Override
  public List<Section> fetch(WarningSink warnings) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.ISO_8859_1)) {
      return new RawMeasurementParser(path.getFileName().toString()).parse(reader, warnings);
    }
  }

  public Path path() {
    return path;
  }

  @Override
  public String toString() {
    return "UvFileSource[" + path + "]";
  }
}
