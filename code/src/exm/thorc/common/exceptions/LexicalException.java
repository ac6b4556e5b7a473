package exm.thorc.common.exceptions;

import exm.thorc.ast.FilePosition;

/**
 * Input could not be split into tokens, e.g. a string literal that is
 * never closed.  Always fatal.
 */
public class LexicalException extends UserException {
  private static final long serialVersionUID = 1L;

  public LexicalException(FilePosition pos, String message) {
    super(pos, message);
  }
}
