package ca.gc.cra.uvcalc.application.input;

import ca.gc.cra.uvcalc.application.port.DataSource;
import ca.gc.cra.uvcalc.config.CalculationSettings;
import ca.gc.cra.uvcalc.domain.ancillary.AngularResponse;
import ca.gc.cra.uvcalc.domain.ancillary.Calibration;
import ca.gc.cra.uvcalc.domain.ancillary.CloudCover;
import ca.gc.cra.uvcalc.domain.ancillary.CosCorrectionMode;
import ca.gc.cra.uvcalc.domain.ancillary.InstrumentModels;
import ca.gc.cra.uvcalc.domain.ancillary.OzoneSeries;
import ca.gc.cra.uvcalc.domain.ancillary.ParameterSeries;
import ca.gc.cra.uvcalc.domain.ancillary.StraylightCorrection;
import ca.gc.cra.uvcalc.domain.measurement.Section;
import ca.gc.cra.uvcalc.domain.warning.WarningSink;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Everything needed to correct the measurements of one instrument on one day.
 * <p><strong>Why:</strong> Sections of the same day share their calibration, angular response, ozone and
 * parameters; each value is loaded once and then read concurrently by every job of the day.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load each ancillary value lazily from its {@link DataSource} and cache it for the lifetime of the
 *   input.</li>
 *   <li>Merge warnings raised while loading into one ordered, duplicate-free list.</li>
 *   <li>Decide the stray-light and cosine-correction treatment of the day.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use. Each cached value is computed at most once under the
 * instance lock. A failed load is cached too, and every later access rethrows the same exception.</p>
 * <p><strong>Error handling:</strong> an {@link IOException} from a source is rethrown as
 * {@link UncheckedIOException} naming the source; format and data-source exceptions propagate unchanged.</p>
 *
 * @since 0.1.0
 */
public final class CalculationInput {
  private static final Logger log = LoggerFactory.getLogger(CalculationInput.class);

  private final String brewerId;
  private final LocalDate date;
  private final CalculationSettings settings;
  private final Cached<List<Section>> sections;
  private final Cached<OzoneSeries> ozone;
  private final Cached<Optional<String>> brewerType;
  private final Cached<Calibration> calibration;
  private final Cached<Optional<AngularResponse>> arf;
  private final Cached<ParameterSeries> parameters;
  private final Cached<CloudCover> cloudCover;

  private final Object warningLock = new Object();
  private final Set<String> warnings = new LinkedHashSet<>();

  private CalculationInput(Builder builder) {
    this.brewerId = builder.brewerId;
    this.date = builder.date;
    this.settings = builder.settings;
    WarningSink sink = this::addWarning;
    this.sections = new Cached<>("UV data", Objects.requireNonNull(builder.uv, "uv"), sink);
    this.ozone = new Cached<>("ozone", Objects.requireNonNull(builder.ozone, "ozone"), sink);
    this.brewerType = new Cached<>("instrument model", builder.instrumentModel, sink);
    this.calibration = new Cached<>("calibration", Objects.requireNonNull(builder.calibration, "calibration"), sink);
    this.arf = new Cached<>("ARF", Objects.requireNonNull(builder.arf, "arf"), sink);
    this.parameters = new Cached<>("parameters", builder.parameters, sink);
    this.cloudCover = new Cached<>("cloud cover", this::loadCloudCover, sink);
  }

  public static Builder builder(String brewerId, LocalDate date, CalculationSettings settings) {
    return new Builder(brewerId, date, settings);
  }

  public String brewerId() {
    return brewerId;
  }

  public LocalDate date() {
    return date;
  }

  public CalculationSettings settings() {
    return settings;
  }

  /** Parsed sections of the day, in acquisition order. */
  public List<Section> sections() {
    return sections.get();
  }

  public OzoneSeries ozone() {
    return ozone.get();
  }

  /** Instrument model such as {@code mkiii}, when known. */
  public Optional<String> brewerType() {
    return brewerType.get();
  }

  public Calibration calibration() {
    return calibration.get();
  }

  /** Angular response of the instrument; empty when no ARF is available. */
  public Optional<AngularResponse> arf() {
    return arf.get();
  }

  public ParameterSeries parameters() {
    return parameters.get();
  }

  public CloudCover cloudCover() {
    return cloudCover.get();
  }

  /** Stray-light treatment for this instrument, falling back to the configured default for unknown models. */
  public StraylightCorrection straylightCorrection() {
    return InstrumentModels.resolve(brewerType(), settings.defaultStraylight());
  }

  /**
   * @param time minutes since midnight of the measurement
   * @return {@code NONE} when disabled or without ARF, {@code DIFFUSE} under heavy cloud, else {@code CLEAR_SKY}
   */
  public CosCorrectionMode cosCorrectionMode(double time) {
    if (settings.noCoscor() || arf().isEmpty()) {
      return CosCorrectionMode.NONE;
    }
    if (cloudCover().isDiffuse(time)) {
      return CosCorrectionMode.DIFFUSE;
    }
    return CosCorrectionMode.CLEAR_SKY;
  }

  /**
   * Loads every cached value so that jobs only read. Stops after the sections when the day has none.
   */
  public void initialize() {
    List<Section> loaded = sections();
    if (loaded.isEmpty()) {
      log.info("No sections for {}; skipping ancillary data", this);
      return;
    }
    ozone();
    brewerType();
    calibration();
    arf();
    cosCorrectionMode(0);
    parameters();
    log.debug("Initialized {} with {} sections", this, loaded.size());
  }

  /** Snapshot of the distinct warnings raised so far, in first-seen order. */
  public List<String> warnings() {
    synchronized (warningLock) {
      return List.copyOf(warnings);
    }
  }

  /** Records a warning unless an identical one was already recorded. */
  public void addWarning(String message) {
    Objects.requireNonNull(message, "message");
    synchronized (warningLock) {
      warnings.add(message);
    }
  }

  private CloudCover loadCloudCover(WarningSink sink) {
    List<Section> loaded = sections();
    if (loaded.isEmpty()) {
      return CloudCover.clearSkyDefault();
    }
    int day = loaded.get(0).header().date().getDayOfYear();
    OptionalDouble observed = parameters().cloudCover(day);
    if (observed.isPresent()) {
      return CloudCover.observed(observed.getAsDouble());
    }
    String message = "No cloud cover data for day " + day + " of " + brewerId + ". Clear sky is assumed.";
    log.warn(message);
    sink.warn(message);
    return CloudCover.clearSkyDefault();
  }

  @Override
  public String toString() {
    return "CalculationInput[brewer=" + brewerId + ", date=" + date + "]";
  }

  private static final class Cached<T> {
    private final String name;
    private final DataSource<T> source;
    private final WarningSink sink;
    private volatile T value;
    private volatile RuntimeException failure;
    private volatile boolean loaded;

    Cached(String name, DataSource<T> source, WarningSink sink) {
      this.name = name;
      this.source = source;
      this.sink = sink;
    }

    T get() {
      if (!loaded) {
        synchronized (this) {
          if (!loaded) {
            load();
            loaded = true;
          }
        }
      }
      if (failure != null) {
        throw failure;
      }
      return value;
    }

    private void load() {
      try {
        value = Objects.requireNonNull(source.fetch(sink), name);
      } catch (IOException ex) {
        failure = new UncheckedIOException("Unable to load " + name + " from " + source, ex);
      } catch (RuntimeException ex) {
        failure = ex;
      }
    }
  }

  /** Assembles an input from its data sources. */
  public static final class Builder {
    private final String brewerId;
    private final LocalDate date;
    private final CalculationSettings settings;
    private DataSource<List<Section>> uv;
    private DataSource<OzoneSeries> ozone;
    private DataSource<Optional<String>> instrumentModel = sink -> Optional.empty();
    private DataSource<Calibration> calibration;
    private DataSource<Optional<AngularResponse>> arf;
    private DataSource<ParameterSeries> parameters = sink -> ParameterSeries.empty();

    private Builder(String brewerId, LocalDate date, CalculationSettings settings) {
      this.brewerId = Objects.requireNonNull(brewerId, "brewerId");
      this.date = Objects.requireNonNull(date, "date");
      this.settings = Objects.requireNonNull(settings, "settings");
    }

    public Builder uv(DataSource<List<Section>> source) {
      this.uv = Objects.requireNonNull(source, "source");
      return this;
    }

    public Builder ozone(DataSource<OzoneSeries> source) {
      this.ozone = Objects.requireNonNull(source, "source");
      return this;
    }

    public Builder instrumentModel(DataSource<Optional<String>> source) {
      this.instrumentModel = Objects.requireNonNull(source, "source");
      return this;
    }

    public Builder calibration(DataSource<Calibration> source) {
      this.calibration = Objects.requireNonNull(source, "source");
      return this;
    }

    public Builder arf(DataSource<Optional<AngularResponse>> source) {
      this.arf = Objects.requireNonNull(source, "source");
      return this;
    }

    public Builder parameters(DataSource<ParameterSeries> source) {
      this.parameters = Objects.requireNonNull(source, "source");
      return this;
    }

    /**
     * @throws NullPointerException when the UV, ozone, calibration or ARF source is missing
     */
    public CalculationInput build() {
      return new CalculationInput(this);
    }
  }
}
