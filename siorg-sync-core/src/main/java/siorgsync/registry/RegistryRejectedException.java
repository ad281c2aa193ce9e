package siorgsync.registry;

/**
 * The registry refused the request (4xx other than 404, 408 and 429) or returned a body
 * that cannot be decoded. Retrying will not help, so items fail terminally.
 */
public class RegistryRejectedException extends RegistryException {
  private final int statusCode;

  public RegistryRejectedException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public RegistryRejectedException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  /** HTTP status of the rejection, or {@code -1} when the body was undecodable. */
  public int statusCode() {
    return statusCode;
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
