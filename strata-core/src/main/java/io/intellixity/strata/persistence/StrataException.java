package io.intellixity.strata.persistence;

/** Root of every error raised by the query and storage layers. Backend transport errors are not wrapped. */
public class StrataException extends RuntimeException {
  public StrataException(String message) {
    super(message);
  }

  public StrataException(String message, Throwable cause) {
    super(message, cause);
  }
}
