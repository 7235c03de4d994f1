package ca.gc.cra.uvcalc.domain.solver;

import ca.gc.cra.uvcalc.domain.error.SolverException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Columnar solver output keyed by requested column name.
 */
public final class SolverResult {
  private final Map<String, double[]> columns;
  private final int rows;

  /**
   * @param columns column name to values; all columns must have the same length
   */
  public SolverResult(Map<String, double[]> columns) {
    Objects.requireNonNull(columns, "columns");
    Map<String, double[]> copy = new LinkedHashMap<>();
    int expected = -1;
    for (Map.Entry<String, double[]> entry : columns.entrySet()) {
      double[] values = entry.getValue().clone();
      if (expected >= 0 && values.length != expected) {
        throw new IllegalArgumentException("column " + entry.getKey() + " has " + values.length
            + " rows, expected " + expected);
      }
      expected = values.length;
      copy.put(entry.getKey(), values);
    }
    this.columns = copy;
    this.rows = Math.max(expected, 0);
  }

  /**
   * Parses whitespace-separated rows, one value per requested column.
   *
   * @param columnNames requested columns in output order
   * @param stdout solver standard output
   * @return parsed result
   * @throws SolverException when a row has the wrong number of columns or a non-numeric value
   */
  public static SolverResult parse(List<String> columnNames, String stdout) {
    Objects.requireNonNull(columnNames, "columnNames");
    Objects.requireNonNull(stdout, "stdout");
    List<String> lines = stdout.lines().map(String::strip).filter(line -> !line.isEmpty()).toList();
    Map<String, double[]> parsed = new LinkedHashMap<>();
    for (String name : columnNames) {
      parsed.put(name, new double[lines.size()]);
    }
    for (int row = 0; row < lines.size(); row++) {
      String[] values = lines.get(row).split("\\s+");
      if (values.length != columnNames.size()) {
        throw new SolverException("Solver didn't produce the correct amount of columns. Expected: "
            + columnNames.size() + ", actual: " + values.length + " (row " + row + ")");
      }
      for (int col = 0; col < values.length; col++) {
        try {
          parsed.get(columnNames.get(col))[row] = Double.parseDouble(values[col]);
        } catch (NumberFormatException ex) {
          throw new SolverException("Solver produced a non-numeric value '" + values[col] + "' in column "
              + columnNames.get(col), ex);
        }
      }
    }
    return new SolverResult(parsed);
  }

  /**
   * @throws SolverException when the column was not requested
   */
  public double[] column(String name) {
    double[] values = columns.get(name);
    if (values == null) {
      throw new SolverException("Solver result has no column '" + name + "'");
    }
    return values.clone();
  }

  public int rowCount() {
    return rows;
  }
}
