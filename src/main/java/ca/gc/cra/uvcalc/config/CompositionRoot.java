package ca.gc.cra.uvcalc.config;

import ca.gc.cra.uvcalc.application.input.CalculationInput;
import ca.gc.cra.uvcalc.application.pipeline.JobScheduler;
import ca.gc.cra.uvcalc.application.port.ClockPort;
import ca.gc.cra.uvcalc.application.port.DataSource;
import ca.gc.cra.uvcalc.application.port.MetricsPort;
import ca.gc.cra.uvcalc.application.port.RadiativeTransferPort;
import ca.gc.cra.uvcalc.domain.ancillary.Calibration;
import ca.gc.cra.uvcalc.domain.ancillary.OzoneSeries;
import ca.gc.cra.uvcalc.domain.error.DataSourceException;
import ca.gc.cra.uvcalc.domain.measurement.Section;
import ca.gc.cra.uvcalc.infrastructure.eubrewnet.EubrewnetCalibrationSource;
import ca.gc.cra.uvcalc.infrastructure.eubrewnet.EubrewnetClient;
import ca.gc.cra.uvcalc.infrastructure.eubrewnet.EubrewnetOzoneSource;
import ca.gc.cra.uvcalc.infrastructure.eubrewnet.EubrewnetUvSource;
import ca.gc.cra.uvcalc.infrastructure.file.ArfFileSource;
import ca.gc.cra.uvcalc.infrastructure.file.BFile;
import ca.gc.cra.uvcalc.infrastructure.file.BFileInstrumentModelSource;
import ca.gc.cra.uvcalc.infrastructure.file.BFileOzoneSource;
import ca.gc.cra.uvcalc.infrastructure.file.CalibrationFileSource;
import ca.gc.cra.uvcalc.infrastructure.file.InstrumentFileIndex;
import ca.gc.cra.uvcalc.infrastructure.file.InstrumentFileIndex.DailyFiles;
import ca.gc.cra.uvcalc.infrastructure.file.ParameterFileSource;
import ca.gc.cra.uvcalc.infrastructure.file.UvFileSource;
import ca.gc.cra.uvcalc.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.uvcalc.infrastructure.solver.LibradtranProcessClient;
import ca.gc.cra.uvcalc.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the UVCALC scheduler and inputs to concrete adapters.
 * <p><strong>Why:</strong> Translates one {@link UvcalcConfig} into runnable objects in a single place.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the shared metrics adapter, solver client and EUBREWNET client.</li>
 *   <li>Build a {@link JobScheduler} over those adapters.</li>
 *   <li>Choose file or network data sources for every {@link CalculationInput}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Shared adapters are created lazily under the instance lock; factory methods
 * may be called from any thread.</p>
 * <p><strong>Observability:</strong> Closing the root flushes and shuts down the metrics exporter.</p>
 *
 * @since 0.1.0
 * @see JobScheduler
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final UvcalcConfig config;
  private final ClockPort clock;
  private OpenTelemetryMetricsAdapter metrics;
  private RadiativeTransferPort solver;
  private EubrewnetClient eubrewnet;

  public CompositionRoot(UvcalcConfig config) {
    this(config, ClockPort.SYSTEM);
  }

  CompositionRoot(UvcalcConfig config, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    LoggingConfigurator.apply(config.verbose());
  }

  public UvcalcConfig config() {
    return config;
  }

  public synchronized MetricsPort metrics() {
    if (metrics == null) {
      metrics = new OpenTelemetryMetricsAdapter(config.metricsExporter(), config.otlpEndpoint());
    }
    return metrics;
  }

  public synchronized RadiativeTransferPort solver() {
    if (solver == null) {
      solver = new LibradtranProcessClient(config.solver(), metrics());
    }
    return solver;
  }

  synchronized EubrewnetClient eubrewnet() {
    if (eubrewnet == null) {
      eubrewnet = new EubrewnetClient(config.eubrewnet());
    }
    return eubrewnet;
  }

  public JobScheduler jobScheduler() {
    return jobScheduler(solver());
  }

  /** Scheduler over a caller-supplied solver, for runs that do not launch {@code uvspec}. */
  public JobScheduler jobScheduler(RadiativeTransferPort radiativeTransfer) {
    return new JobScheduler(config.scheduler(), radiativeTransfer, metrics(), clock);
  }

  /**
   * Builds one input per UV file found under {@code root}, ordered by brewer id then day.
   *
   * @param root directory holding instrument files
   * @return inputs ready for {@link JobScheduler#schedule}
   * @throws IOException when the directory cannot be scanned
   */
  public List<CalculationInput> calculationInputs(Path root) throws IOException {
    List<DailyFiles> days = InstrumentFileIndex.scan(root).allDailyFiles();
    List<CalculationInput> inputs = new ArrayList<>(days.size());
    for (DailyFiles files : days) {
      inputs.add(calculationInput(files));
    }
    log.info("Prepared {} calculation inputs from '{}'", inputs.size(), root);
    return inputs;
  }

  /**
   * Builds the input of one instrument day. UV, ozone and calibration data come from files or EUBREWNET as
   * configured; the instrument model, ARF and parameters always come from files.
   */
  public CalculationInput calculationInput(DailyFiles files) {
    Objects.requireNonNull(files, "files");
    CalculationSettings settings = config.calculation();
    BFile bFile = new BFile(files.bFile());
    return CalculationInput.builder(files.brewerId(), files.date(), settings)
        .uv(uvSource(settings.uvDataSource(), files))
        .ozone(ozoneSource(settings.ozoneDataSource(), files, bFile))
        .instrumentModel(new BFileInstrumentModelSource(bFile))
        .calibration(calibrationSource(settings.uvrDataSource(), files))
        .arf(new ArfFileSource(files.arfFile(), settings.arfColumn()))
        .parameters(new ParameterFileSource(files.parameterFile()))
        .build();
  }

  private DataSource<List<Section>> uvSource(DataSourceKind kind, DailyFiles files) {
    return switch (kind) {
      case FILES -> new UvFileSource(files.uvFile());
      case EUBREWNET -> new EubrewnetUvSource(eubrewnet(), files.brewerId(), files.date());
    };
  }

  private DataSource<OzoneSeries> ozoneSource(DataSourceKind kind, DailyFiles files, BFile bFile) {
    return switch (kind) {
      case FILES -> new BFileOzoneSource(bFile);
      case EUBREWNET -> new EubrewnetOzoneSource(eubrewnet(), files.brewerId(), files.date());
    };
  }

  private DataSource<Calibration> calibrationSource(DataSourceKind kind, DailyFiles files) {
    return switch (kind) {
      case FILES -> files.calibrationFile()
          .<DataSource<Calibration>>map(CalibrationFileSource::new)
          .orElseGet(() -> sink -> {
            throw new DataSourceException("No UVR file for brewer id " + files.brewerId());
          });
      case EUBREWNET -> new EubrewnetCalibrationSource(eubrewnet(), files.brewerId(), files.date());
    };
  }

  @Override
  public synchronized void close() {
    if (metrics != null) {
      metrics.close();
      metrics = null;
    }
  }
}
