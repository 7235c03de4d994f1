package ca.gc.cra.uvcalc.infrastructure.file;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Daily B file ({@code Bdddyy.id}) shared by the ozone and instrument model sources of one input.
 *
 * <p>The file is scanned at most once. A failed scan is remembered and rethrown to every later caller.</p>
 *
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; the scan runs under the instance lock.</p>
 *
 * @since 0.1.0
 */
public final class BFile {
  private final Optional<Path> path;
  private boolean scanned;
  private Optional<BFileReader.Contents> contents = Optional.empty();
  private IOException ioFailure;
  private RuntimeException failure;

  public BFile(Optional<Path> path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  /**
   * @return parsed contents, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   */
  synchronized Optional<BFileReader.Contents> contents() throws IOException {
    if (!scanned) {
      scanned = true;
      if (path.isPresent() && Files.isRegularFile(path.get())) {
        try {
          contents = Optional.of(BFileReader.read(path.get()));
        } catch (IOException ex) {
          ioFailure = ex;
        } catch (RuntimeException ex) {
          failure = ex;
        }
      }
    }
    if (ioFailure != null) {
      throw ioFailure;
    }
    if (failure != null) {
      throw failure;
    }
    return contents;
  }

  String name() {
    return path.map(p -> p.getFileName().toString()).orElse("<none>");
  }

  @Override
  public String toString() {
    return path.map(Path::toString).orElse("<none>");
  }
}
