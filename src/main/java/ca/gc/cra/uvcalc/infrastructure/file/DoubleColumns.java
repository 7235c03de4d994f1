package ca.gc.cra.uvcalc.infrastructure.file;

import java.util.Arrays;

/** Growable column store used while reading numeric tables. */
final class DoubleColumns {
  private final double[][] columns;
  private int size;

  DoubleColumns(int width) {
    this.columns = new double[width][16];
  }

  void add(double... row) {
    if (row.length != columns.length) {
      throw new IllegalArgumentException("Expected " + columns.length + " values, got " + row.length);
    }
    if (size == columns[0].length) {
      for (int c = 0; c < columns.length; c++) {
        columns[c] = Arrays.copyOf(columns[c], size * 2);
      }
    }
    for (int c = 0; c < columns.length; c++) {
      columns[c][size] = row[c];
    }
    size++;
  }

  int size() {
    return size;
  }

  boolean isEmpty() {
    return size == 0;
  }

  double[] column(int index) {
    return Arrays.copyOf(columns[index], size);
  }
}
