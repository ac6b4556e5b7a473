package exm.thorc.common.exceptions;

/**
 * A configuration property has a missing or malformed value
 */
public class InvalidOptionException extends Exception {
  private static final long serialVersionUID = 1L;

  public InvalidOptionException(String message) {
    super(message);
  }
}
