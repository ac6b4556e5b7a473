package exm.thorc.common.exceptions;

/**
 * Used to signal that program should quit.
 */
public class ThorFatal extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public final int exitCode;

  public ThorFatal(int exitCode) {
    super();
    this.exitCode = exitCode;
  }

}
