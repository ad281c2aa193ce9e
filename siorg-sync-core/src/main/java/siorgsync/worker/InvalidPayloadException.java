package siorgsync.worker;

/**
 * The queued payload cannot be processed and never will be: malformed JSON, or a code
 * the registry does not know. Items failing with this exception go straight to FAILED.
 */
public class InvalidPayloadException extends RuntimeException {

  public InvalidPayloadException(String message) {
    super(message);
  }

  public InvalidPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
