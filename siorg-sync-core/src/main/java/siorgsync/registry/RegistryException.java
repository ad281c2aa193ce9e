package siorgsync.registry;

/**
 * Base class for failures talking to the registry.
 *
 * @see RegistryUnavailableException
 * @see RegistryRejectedException
 */
public abstract class RegistryException extends Exception {

  protected RegistryException(String message) {
    super(message);
  }

  protected RegistryException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Whether a later attempt with the same request may succeed.
   */
  public abstract boolean isRetryable();
}
