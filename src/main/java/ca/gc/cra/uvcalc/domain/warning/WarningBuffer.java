package ca.gc.cra.uvcalc.domain.warning;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only warning collector owned by a single thread until it is drained.
 */
public final class WarningBuffer implements WarningSink {
  private final List<String> messages = new ArrayList<>();

  @Override
  public void warn(String message) {
    messages.add(Objects.requireNonNull(message, "message"));
  }

  /**
   * @return copy of the collected messages in insertion order
   */
  public List<String> messages() {
    return List.copyOf(messages);
  }

  public boolean isEmpty() {
    return messages.isEmpty();
  }
}
