package bytedfa.ucd;

import java.io.IOException;

/**
 * Malformed line in a Unicode Character Database file.
 */
public class UcdParseException extends IOException {

  @java.io.Serial
  private static final long serialVersionUID = -3021876148330187650L;

  public final String source;
  public final int lineNumber;

  public UcdParseException(String message, String source, int lineNumber) {
    super(source + ":" + lineNumber + ": " + message);
    this.source = source;
    this.lineNumber = lineNumber;
  }

  public UcdParseException(String message, String source, int lineNumber, Throwable cause) {
    super(source + ":" + lineNumber + ": " + message, cause);
    this.source = source;
    this.lineNumber = lineNumber;
  }
}
