package siorgsync.registry;

/**
 * The registry could not be reached or answered with a transient error (timeouts, 408,
 * 429, 5xx). Items failing with this exception are retried with backoff.
 */
public class RegistryUnavailableException extends RegistryException {

  public RegistryUnavailableException(String message) {
    super(message);
  }

  public RegistryUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
