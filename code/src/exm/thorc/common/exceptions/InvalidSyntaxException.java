package exm.thorc.common.exceptions;

import exm.thorc.ast.FilePosition;

public class InvalidSyntaxException extends UserException {

  /**
   *
   */
  private static final long serialVersionUID = 1060914609057739598L;

  public InvalidSyntaxException(FilePosition pos, String message) {
    super(pos, message);
  }

}
