package ca.gc.cra.uvcalc.infrastructure.file;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Discovers instrument files under a directory tree and groups them per brewer id.
 * <p><strong>Recognised names:</strong> {@code UVdddyy.id} (raw UV), {@code Bdddyy.id} (ozone), {@code UVR*.id}
 * (calibration), {@code arf_*id.dat} (angular response) and {@code par_yy.id} (parameters). Other files are
 * ignored.</p>
 * <p><strong>Output:</strong> one {@link DailyFiles} per UV file, with the matching B and parameter files by
 * day and year, and the first calibration and ARF file of the instrument in name order. Instruments without a
 * UV or a calibration file are skipped with a warning in the log.</p>
 * <p><strong>Thread-safety:</strong> immutable after {@link #scan(Path)}.</p>
 *
 * @since 0.1.0
 */
public final class InstrumentFileIndex {
  private static final Logger log = LoggerFactory.getLogger(InstrumentFileIndex.class);

  static final Pattern UV_FILE = Pattern.compile("UV(?<days>\\d{3})(?<year>\\d{2})\\.(?<brewerId>\\d+)");
  static final Pattern B_FILE = Pattern.compile("B(?<days>\\d{3})(?<year>\\d{2})\\.(?<brewerId>\\d+)");
  static final Pattern ARF_FILE = Pattern.compile("arf_[a-zA-Z]*(?<brewerId>\\d+)\\.dat");
  static final Pattern UVR_FILE = Pattern.compile("(?:UVR|uvr)\\S+\\.(?<brewerId>\\d+)");
  static final Pattern PARAMETER_FILE = Pattern.compile("par_(?<year>\\d{2})\\.(?<brewerId>\\d+)");

  /** Files needed to process one day of one instrument. */
  public record DailyFiles(
      String brewerId,
      LocalDate date,
      Path uvFile,
      Optional<Path> bFile,
      Optional<Path> calibrationFile,
      Optional<Path> arfFile,
      Optional<Path> parameterFile) {
    public DailyFiles {
      Objects.requireNonNull(brewerId, "brewerId");
      Objects.requireNonNull(date, "date");
      Objects.requireNonNull(uvFile, "uvFile");
      Objects.requireNonNull(bFile, "bFile");
      Objects.requireNonNull(calibrationFile, "calibrationFile");
      Objects.requireNonNull(arfFile, "arfFile");
      Objects.requireNonNull(parameterFile, "parameterFile");
    }
  }

  private static final class InstrumentFiles {
    final List<Path> uv = new ArrayList<>();
    final Map<String, Path> b = new TreeMap<>();
    final List<Path> uvr = new ArrayList<>();
    final List<Path> arf = new ArrayList<>();
    final Map<String, Path> parameters = new TreeMap<>();
  }

  private final Map<String, InstrumentFiles> instruments;

  private InstrumentFileIndex(Map<String, InstrumentFiles> instruments) {
    this.instruments = instruments;
  }

  /**
   * Walks {@code root} recursively and classifies every regular file by name.
   *
   * @param root directory to scan
   * @return index over the discovered instruments
   * @throws IOException if the tree cannot be walked
   */
  public static InstrumentFileIndex scan(Path root) throws IOException {
    Objects.requireNonNull(root, "root");
    long start = System.nanoTime();
    Map<String, InstrumentFiles> found = new TreeMap<>();
    List<Path> files;
    try (Stream<Path> walk = Files.walk(root)) {
      files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
    }
    for (Path file : files) {
      classify(file, found);
    }
    found.entrySet().removeIf(entry -> {
      if (entry.getValue().uvr.isEmpty()) {
        log.warn("No UVR file exists for brewer id {}, skipping", entry.getKey());
        return true;
      }
      if (entry.getValue().uv.isEmpty()) {
        log.warn("No UV file exists for brewer id {}, skipping", entry.getKey());
        return true;
      }
      return false;
    });
    log.info("Scanned {} files under '{}' in {} ms, found {} instruments",
        files.size(), root, (System.nanoTime() - start) / 1_000_000, found.size());
    return new InstrumentFileIndex(found);
  }

  private static void classify(Path file, Map<String, InstrumentFiles> found) {
    String name = file.getFileName().toString();
    Matcher m = UV_FILE.matcher(name);
    if (m.matches()) {
      instrument(found, m).uv.add(file);
      return;
    }
    m = B_FILE.matcher(name);
    if (m.matches()) {
      instrument(found, m).b.put(m.group("days") + m.group("year"), file);
      return;
    }
    m = UVR_FILE.matcher(name);
    if (m.matches()) {
      instrument(found, m).uvr.add(file);
      return;
    }
    m = ARF_FILE.matcher(name);
    if (m.matches()) {
      instrument(found, m).arf.add(file);
      return;
    }
    m = PARAMETER_FILE.matcher(name);
    if (m.matches()) {
      instrument(found, m).parameters.put(m.group("year"), file);
      return;
    }
    log.debug("Ignoring unrecognised file {}", file);
  }

  private static InstrumentFiles instrument(Map<String, InstrumentFiles> found, Matcher m) {
    return found.computeIfAbsent(m.group("brewerId"), id -> new InstrumentFiles());
  }

  /** Brewer ids with at least one UV and one calibration file, in ascending order. */
  public List<String> brewerIds() {
    return List.copyOf(instruments.keySet());
  }

  /**
   * Files for every UV measurement day of one instrument, in file-name order.
   *
   * @param brewerId instrument id as it appears in file names
   * @return daily file sets; empty for an unknown id
   */
  public List<DailyFiles> dailyFiles(String brewerId) {
    InstrumentFiles files = instruments.get(brewerId);
    if (files == null) {
      return List.of();
    }
    List<DailyFiles> out = new ArrayList<>();
    files.uv.stream()
        .sorted(Comparator.comparing(p -> p.getFileName().toString()))
        .forEach(uv -> {
          Matcher m = UV_FILE.matcher(uv.getFileName().toString());
          if (!m.matches()) {
            throw new IllegalStateException("Unknown UV file name " + uv);
          }
          String days = m.group("days");
          String year = m.group("year");
          out.add(new DailyFiles(
              brewerId,
              toDate(Integer.parseInt(days), Integer.parseInt(year)),
              uv,
              Optional.ofNullable(files.b.get(days + year)),
              files.uvr.stream().findFirst(),
              files.arf.stream().findFirst(),
              Optional.ofNullable(files.parameters.get(year))));
        });
    return out;
  }

  /** Files for every instrument, grouped in ascending brewer id order. */
  public List<DailyFiles> allDailyFiles() {
    List<DailyFiles> out = new ArrayList<>();
    for (String brewerId : instruments.keySet()) {
      out.addAll(dailyFiles(brewerId));
    }
    return out;
  }

  static LocalDate toDate(int dayOfYear, int twoDigitYear) {
    return LocalDate.ofYearDay(2000 + twoDigitYear, dayOfYear);
  }
}
