package ca.gc.cra.uvcalc.domain.solver;

import ca.gc.cra.uvcalc.domain.error.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> One radiative-transfer invocation: ordered input directives plus requested output columns.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject directives given the wrong number of values.</li>
 *   <li>Require a wavelength range and at least one output column.</li>
 *   <li>Render directive lines in insertion order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once built; the builder is not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class SolverRequest {
  private final Map<SolverDirective, List<String>> directives;
  private final List<String> outputs;

  private SolverRequest(Map<SolverDirective, List<String>> directives, List<String> outputs) {
    this.directives = Collections.unmodifiableMap(new LinkedHashMap<>(directives));
    this.outputs = List.copyOf(outputs);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return directive lines in insertion order, without trailing newlines
   */
  public List<String> directiveLines() {
    List<String> lines = new ArrayList<>(directives.size());
    for (Map.Entry<SolverDirective, List<String>> entry : directives.entrySet()) {
      lines.add(entry.getKey().format(entry.getValue().toArray()));
    }
    return lines;
  }

  /**
   * @return the {@code output_user} line listing requested columns
   */
  public String outputLine() {
    return "output_user " + String.join(" ", outputs);
  }

  public List<String> outputs() {
    return outputs;
  }

  public List<String> values(SolverDirective directive) {
    return directives.getOrDefault(directive, List.of());
  }

  @Override
  public String toString() {
    return "SolverRequest" + directives + " -> " + outputs;
  }

  /** Collects directives and outputs before validation. */
  public static final class Builder {
    private final Map<SolverDirective, List<String>> directives = new LinkedHashMap<>();
    private final Set<String> outputs = new LinkedHashSet<>();

    private Builder() {}

    /**
     * Sets a directive, replacing earlier values for the same directive.
     *
     * @throws ValidationException when the value count does not match the directive
     */
    public Builder put(SolverDirective directive, Object... values) {
      Objects.requireNonNull(directive, "directive");
      Objects.requireNonNull(values, "values");
      if (values.length != directive.valueCount()) {
        throw new ValidationException("Wrong number of values for input " + directive.name()
            + ". Expected " + directive.valueCount() + " but received " + values.length);
      }
      List<String> rendered = new ArrayList<>(values.length);
      for (Object value : values) {
        rendered.add(render(value));
      }
      directives.put(directive, List.copyOf(rendered));
      return this;
    }

    /** Adds output columns, ignoring duplicates. */
    public Builder outputs(String... columns) {
      for (String column : columns) {
        outputs.add(Objects.requireNonNull(column, "column"));
      }
      return this;
    }

    /**
     * @throws ValidationException when no wavelength range or no output column was set
     */
    public SolverRequest build() {
      if (!directives.containsKey(SolverDirective.WAVELENGTH)) {
        throw new ValidationException("At least wavelength needs to be set as input");
      }
      if (outputs.isEmpty()) {
        throw new ValidationException("At least one output must be set");
      }
      return new SolverRequest(directives, new ArrayList<>(outputs));
    }

    private static String render(Object value) {
      Objects.requireNonNull(value, "value");
      if (value instanceof Double d) {
        return Double.toString(d);
      }
      return String.valueOf(value);
    }
  }
}
