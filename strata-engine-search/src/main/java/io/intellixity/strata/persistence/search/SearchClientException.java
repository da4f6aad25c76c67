package io.intellixity.strata.persistence.search;

/** Transport or server failure talking to the search engine. */
public final class SearchClientException extends RuntimeException {
  private final int status;

  public SearchClientException(int status, String message) {
    super(message);
    this.status = status;
  }

  public SearchClientException(String message) {
    this(-1, message);
  }

  public SearchClientException(String message, Throwable cause) {
    super(message, cause);
    this.status = -1;
  }

  /** HTTP status, or -1 when no response was received. */
  public int status() { return status; }
}
