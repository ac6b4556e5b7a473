/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.thorc.ui;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.thorc.common.Diagnostic;

/**
 * Outcome of compiling one program: either C source or errors,
 * never both.
 */
public class CompileResult {
  private final String output;
  private final List<Diagnostic> errors;
  private final List<Diagnostic> warnings;
  private final ExitCode exitCode;

  private CompileResult(String output, List<Diagnostic> errors,
                        List<Diagnostic> warnings, ExitCode exitCode) {
    this.output = output;
    this.errors = Collections.unmodifiableList(
                              new ArrayList<Diagnostic>(errors));
    this.warnings = Collections.unmodifiableList(
                              new ArrayList<Diagnostic>(warnings));
    this.exitCode = exitCode;
  }

  public static CompileResult success(String output,
                                      List<Diagnostic> warnings) {
    assert(output != null);
    return new CompileResult(output, new ArrayList<Diagnostic>(), warnings,
                             ExitCode.SUCCESS);
  }

  public static CompileResult failure(List<Diagnostic> errors,
                          List<Diagnostic> warnings, ExitCode exitCode) {
    assert(!errors.isEmpty());
    assert(exitCode != ExitCode.SUCCESS);
    return new CompileResult(null, errors, warnings, exitCode);
  }

  public boolean succeeded() {
    return output != null;
  }

  /**
   * @return generated C source, or null if compilation failed
   */
  public String output() {
    return output;
  }

  public List<Diagnostic> errors() {
    return errors;
  }

  public List<Diagnostic> warnings() {
    return warnings;
  }

  /**
   * @return exit code the command line tool should use
   */
  public ExitCode exitCode() {
    return exitCode;
  }
}
