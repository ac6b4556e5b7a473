package exm.thorc.common.exceptions;

import exm.thorc.ast.FilePosition;

/**
 * A value is used in a way its type does not allow, or its type
 * could not be determined where one is needed.
 */
public class TypeMismatchException extends UserException {
  private static final long serialVersionUID = 1L;

  public TypeMismatchException(FilePosition pos, String message) {
    super(pos, message);
  }
}
