package ca.gc.cra.uvcalc.domain.error;

import java.util.Objects;

/**
 * <strong>What:</strong> Signals a structurally invalid instrument or ancillary file.
 * <p><strong>Why:</strong> Malformed input must stop processing loudly rather than be skipped line by line.</p>
 * <p><strong>Role:</strong> Domain error raised by parsers and file-backed data sources.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public class FormatException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String source;
  private final String content;

  /**
   * Creates a format error naming the offending source and content.
   *
   * @param source file name or URL that produced the content
   * @param content offending line or field; may be empty when the error concerns the whole document
   * @param message human-readable description
   */
  public FormatException(String source, String content, String message) {
    this(source, content, message, null);
  }

  /**
   * Creates a format error with an underlying cause.
   *
   * @param source file name or URL that produced the content
   * @param content offending line or field
   * @param message human-readable description
   * @param cause root cause such as a {@link NumberFormatException}; may be {@code null}
   */
  public FormatException(String source, String content, String message, Throwable cause) {
    super(message + " [source=" + source + ", content='" + content + "']", cause);
    this.source = Objects.requireNonNullElse(source, "<unknown>");
    this.content = Objects.requireNonNullElse(content, "");
  }

  /**
   * @return file name or URL of the malformed input
   */
  public String source() {
    return source;
  }

  /**
   * @return offending content as read from the input
   */
  public String content() {
    return content;
  }
}
