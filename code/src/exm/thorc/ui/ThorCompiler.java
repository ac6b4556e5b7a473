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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.thorc.ast.AstPrinter;
import exm.thorc.ast.Program;
import exm.thorc.cbackend.CGenerator;
import exm.thorc.common.Diagnostic;
import exm.thorc.common.Settings;
import exm.thorc.common.exceptions.InvalidOptionException;
import exm.thorc.common.exceptions.InvalidSyntaxException;
import exm.thorc.common.exceptions.LexicalException;
import exm.thorc.common.exceptions.SyntaxErrorsException;
import exm.thorc.common.exceptions.TypeInferenceException;
import exm.thorc.common.exceptions.TypeMismatchException;
import exm.thorc.common.exceptions.UserException;
import exm.thorc.frontend.FunctionTable;
import exm.thorc.frontend.ImportResolver;
import exm.thorc.frontend.ParsedModule;
import exm.thorc.frontend.TypeInference;

/**
 * This is the main entry point to the compiler.  Each call to compile()
 * runs the whole pipeline with fresh state: parse, resolve imports,
 * infer types, generate C.
 */
public class ThorCompiler {

  private final Logger logger;

  public ThorCompiler(Logger logger) {
    this.logger = logger;
  }

  /**
   * Compile a Thor file read from disk
   * @param file
   * @return
   */
  public CompileResult compile(File file) {
    String source;
    try {
      source = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      List<Diagnostic> errors = new ArrayList<Diagnostic>();
      errors.add(Diagnostic.error(new UserException(file.getPath(), 0, 0,
                          "Could not read input file: " + e.getMessage())));
      return CompileResult.failure(errors, new ArrayList<Diagnostic>(),
                                   ExitCode.ERROR_IO);
    }
    return compile(source, file);
  }

  /**
   * Compile in-memory source
   * @param source Thor source text
   * @param file nominal path of source: used in diagnostics and as base
   *             directory for imports
   * @return
   */
  public CompileResult compile(String source, File file) {
    String path = file.getPath();
    List<Diagnostic> warnings = new ArrayList<Diagnostic>();
    List<Diagnostic> errors = new ArrayList<Diagnostic>();
    logger.debug("thorc starting: " + path);
    try {
      String output = compileOnce(source, path, warnings);
      logger.debug("thorc done: " + path);
      return CompileResult.success(output, warnings);
    } catch (SyntaxErrorsException e) {
      for (InvalidSyntaxException err: e.getErrors()) {
        errors.add(Diagnostic.error(err));
      }
      return CompileResult.failure(errors, warnings, ExitCode.ERROR_SYNTAX);
    } catch (LexicalException e) {
      errors.add(Diagnostic.error(e));
      return CompileResult.failure(errors, warnings, ExitCode.ERROR_SYNTAX);
    } catch (TypeInferenceException e) {
      for (TypeMismatchException err: e.getErrors()) {
        errors.add(Diagnostic.error(err));
      }
      return CompileResult.failure(errors, warnings, ExitCode.ERROR_USER);
    } catch (UserException e) {
      errors.add(Diagnostic.error(e));
      return CompileResult.failure(errors, warnings, ExitCode.ERROR_USER);
    } catch (InvalidOptionException e) {
      errors.add(Diagnostic.error(new UserException(e.getMessage())));
      return CompileResult.failure(errors, warnings,
                                   ExitCode.ERROR_COMMAND);
    }
  }

  private String compileOnce(String source, String path,
                             List<Diagnostic> warnings)
          throws UserException, InvalidOptionException {
    ParsedModule parsed = ParsedModule.parse(path, source);

    ImportResolver resolver = new ImportResolver(Settings.getModulePath(),
                                          Settings.get(Settings.LIB_DIR));
    Program merged;
    try {
      merged = resolver.resolve(parsed.program, path);
    } finally {
      warnings.addAll(resolver.warnings());
    }
    dumpAst(merged);

    TypeInference typing = new TypeInference();
    FunctionTable functions;
    try {
      functions = typing.infer(merged);
    } finally {
      warnings.addAll(typing.warnings());
    }

    CGenerator codeGen = new CGenerator(logger, Settings.pruneRuntime());
    String output = codeGen.generate(merged, functions);
    warnings.addAll(codeGen.warnings());
    return output;
  }

  private void dumpAst(Program merged) {
    String astFile = Settings.get(Settings.AST_OUTPUT_FILE);
    boolean toFile = astFile != null && astFile.length() > 0;
    if (!toFile && !logger.isTraceEnabled()) {
      return;
    }
    String dump = AstPrinter.print(merged);
    logger.trace("Merged AST:\n" + dump);
    if (toFile) {
      try {
        FileUtils.writeStringToFile(new File(astFile), dump,
                                    StandardCharsets.UTF_8);
      } catch (IOException e) {
        logger.warn("Could not write AST to " + astFile + ": " +
                    e.getMessage());
      }
    }
  }

  public static void reportInternalError(Logger logger, Throwable e) {
    System.err.println("THORC INTERNAL ERROR");
    System.err.println("Please report this");
    logger.error("Internal error", e);
    e.printStackTrace();
  }
}
