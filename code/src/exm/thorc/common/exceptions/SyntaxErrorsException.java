package exm.thorc.common.exceptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All syntax errors found while parsing one module.  The parser recovers
 * after each error, so a single parse can report several.
 */
public class SyntaxErrorsException extends UserException {
  private static final long serialVersionUID = 1L;

  private final List<InvalidSyntaxException> errors;

  public SyntaxErrorsException(String file,
                               List<InvalidSyntaxException> errors) {
    super(buildMessage(file, errors));
    assert(!errors.isEmpty());
    this.errors = new ArrayList<InvalidSyntaxException>(errors);
  }

  public List<InvalidSyntaxException> getErrors() {
    return Collections.unmodifiableList(errors);
  }

  private static String buildMessage(String file,
                                     List<InvalidSyntaxException> errors) {
    StringBuilder sb = new StringBuilder();
    sb.append(errors.size());
    sb.append(errors.size() == 1 ? " syntax error" : " syntax errors");
    sb.append(" in ");
    sb.append(file);
    for (InvalidSyntaxException e: errors) {
      sb.append("\n  ");
      sb.append(e.getMessage());
    }
    return sb.toString();
  }
}
