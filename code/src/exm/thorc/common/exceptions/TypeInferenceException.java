package exm.thorc.common.exceptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects every type error found in one pass over the merged program.
 */
public class TypeInferenceException extends UserException {
  private static final long serialVersionUID = 1L;

  private final List<TypeMismatchException> errors;

  public TypeInferenceException(List<TypeMismatchException> errors) {
    super(buildMessage(errors));
    assert(!errors.isEmpty());
    this.errors = new ArrayList<TypeMismatchException>(errors);
  }

  public List<TypeMismatchException> getErrors() {
    return Collections.unmodifiableList(errors);
  }

  private static String buildMessage(List<TypeMismatchException> errors) {
    StringBuilder sb = new StringBuilder();
    sb.append(errors.size());
    sb.append(errors.size() == 1 ? " type error" : " type errors");
    for (TypeMismatchException e: errors) {
      sb.append("\n  ");
      sb.append(e.getMessage());
    }
    return sb.toString();
  }
}
