package ca.gc.cra.uvcalc.config;

import ca.gc.cra.uvcalc.domain.error.ValidationException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * How the external radiative-transfer solver is launched.
 *
 * @param command executable and arguments; the generated input is fed on standard input
 * @param workDirectory directory receiving generated input files
 * @param dataPath solver data directory written into the input preamble
 * @since 0.1.0
 */
public record SolverSettings(List<String> command, Path workDirectory, String dataPath) {

  public SolverSettings {
    command = List.copyOf(Objects.requireNonNull(command, "command"));
    if (command.isEmpty()) {
      throw new ValidationException("solver.command must not be empty");
    }
    Objects.requireNonNull(workDirectory, "workDirectory");
    Objects.requireNonNull(dataPath, "dataPath");
    if (!dataPath.endsWith("/")) {
      dataPath = dataPath + "/";
    }
  }

  public static SolverSettings defaults() {
    return new SolverSettings(
        List.of("uvspec"),
        Path.of(System.getProperty("java.io.tmpdir"), "uvcalc"),
        "/opt/libRadtran/data/");
  }

  public static SolverSettings fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    SolverSettings d = defaults();
    String rawCommand = ConfigValues.string(options, "solver.command", null);
    List<String> command = rawCommand == null ? d.command() : Arrays.asList(rawCommand.split("\\s+"));
    String rawWorkDir = ConfigValues.string(options, "solver.workDirectory", null);
    Path workDir = d.workDirectory();
    if (rawWorkDir != null) {
      try {
        workDir = Path.of(rawWorkDir);
      } catch (InvalidPathException ex) {
        throw new ValidationException("solver.workDirectory is not a valid path: " + rawWorkDir, ex);
      }
    }
    return new SolverSettings(command, workDir, ConfigValues.string(options, "solver.dataPath", d.dataPath()));
  }
}
