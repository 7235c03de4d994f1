package ca.gc.cra.uvcalc.infrastructure.file;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Access to the instrument files under {@code src/test/resources/fixtures}.
 */
final class FileFixtures {
  static final List<String> ALL = List.of("UV17119.033", "UVR17319.033", "arf_033.dat", "B17119.033", "par_19.033");

  private FileFixtures() {}

  static Path fixture(String name) {
    URL url = FileFixtures.class.getResource("/fixtures/" + name);
    if (url == null) {
      throw new IllegalStateException("Missing fixture " + name);
    }
    try {
      return Path.of(url.toURI());
    } catch (URISyntaxException ex) {
      throw new IllegalStateException(ex);
    }
  }

  /** Copies the named fixtures into {@code directory} and returns it. */
  static Path copy(Path directory, List<String> names) throws IOException {
    for (String name : names) {
      Files.copy(fixture(name), directory.resolve(name));
    }
    return directory;
  }
}
