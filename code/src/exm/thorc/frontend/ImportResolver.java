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
package exm.thorc.frontend;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.io.FilenameUtils;
import org.apache.log4j.Logger;

import exm.thorc.ast.FilePosition;
import exm.thorc.ast.FunctionDecl;
import exm.thorc.ast.FunctionSignature;
import exm.thorc.ast.ImportDecl;
import exm.thorc.ast.PackageDecl;
import exm.thorc.ast.Parameter;
import exm.thorc.ast.Program;
import exm.thorc.ast.Statement;
import exm.thorc.common.Diagnostic;
import exm.thorc.common.Logging;
import exm.thorc.common.exceptions.LexicalException;
import exm.thorc.common.exceptions.ModuleLoadException;
import exm.thorc.common.exceptions.SyntaxErrorsException;
import exm.thorc.common.lang.Builtins;
import exm.thorc.common.lang.Builtins.BuiltinFunction;
import exm.thorc.common.lang.Types.Type;

/**
 * Loads every module imported by a program, directly or transitively,
 * and splices their statements into one program with no imports.
 *
 * Modules are merged depth-first: a module's imports come before its
 * own statements, and the main program comes last.  Each module is
 * merged at most once; a repeated or circular import is dropped with a
 * warning.
 *
 * One resolver may be reused, but all loaded state is discarded at the
 * start of each {@link #resolve(Program, String)} call.
 */
public class ImportResolver {
  private static final Logger logger = Logging.getThorLogger();

  public static final String THOR_EXTENSION = ".thor";

  /** Modules with this package name are not name-mangled */
  public static final String MAIN_PACKAGE = "main";

  private final List<String> searchPaths;
  private final String libDir;

  /** Canonical paths of modules being loaded or already loaded */
  private final Set<String> visited = new HashSet<String>();

  /** Canonical paths of modules that have been fully merged */
  private final Set<String> completed = new HashSet<String>();

  /** Synthesized built-in modules by logical name */
  private final Map<String, Program> builtinCache =
                                      new HashMap<String, Program>();

  private final List<Diagnostic> warnings = new ArrayList<Diagnostic>();

  private List<Statement> merged;

  /**
   * @param searchPaths directories searched after the importing file's
   *                    directory, in order
   * @param libDir default library directory searched last, may be null
   */
  public ImportResolver(List<String> searchPaths, String libDir) {
    this.searchPaths = new ArrayList<String>(searchPaths);
    this.libDir = libDir;
  }

  public List<Diagnostic> warnings() {
    return Collections.unmodifiableList(warnings);
  }

  /**
   * @param mainProgram parsed entry module
   * @param mainFile path of entry module, used as base for relative
   *                 imports
   * @return merged program with no import declarations
   * @throws ModuleLoadException if an import can't be found or read
   * @throws LexicalException if an imported module fails to lex
   * @throws SyntaxErrorsException if an imported module fails to parse
   */
  public Program resolve(Program mainProgram, String mainFile)
      throws ModuleLoadException, LexicalException, SyntaxErrorsException {
    visited.clear();
    completed.clear();
    builtinCache.clear();
    warnings.clear();
    merged = new ArrayList<Statement>();

    String mainCanonical = canonicalPath(new File(mainFile));
    visited.add(mainCanonical);

    String mainName = moduleName(mainProgram, new File(mainFile));
    mainProgram.setModuleName(mainName);
    LogHelper.debug(0, "Resolving imports of " + mainFile);

    mergeImports(mainProgram, parentDir(new File(mainFile)), 1);
    // Entry module functions keep their own names
    mergeStatements(mainProgram, null);
    completed.add(mainCanonical);

    Program result = new Program(mainProgram.getFile(),
          mainProgram.getPackageDecl(), new ArrayList<ImportDecl>(), merged);
    result.setModuleName(mainName);
    merged = null;
    return result;
  }

  private void mergeImports(Program program, File dir, int depth)
      throws ModuleLoadException, LexicalException, SyntaxErrorsException {
    for (ImportDecl imp: program.getImports()) {
      String name = imp.getModuleName();
      if (Builtins.isBuiltinModule(name)) {
        if (builtinCache.containsKey(name)) {
          LogHelper.trace(depth, "Built-in module " + name +
                                 " already loaded");
        } else {
          Program builtin = builtinModule(name);
          builtinCache.put(name, builtin);
          LogHelper.debug(depth, "Loaded built-in module " + name);
          mergeStatements(builtin, builtin.getModuleName());
        }
        continue;
      }

      File located = locate(imp, dir);
      String canonical = canonicalPath(located);
      if (visited.contains(canonical)) {
        if (completed.contains(canonical)) {
          warn(imp.getPosition(), "Module " + name + " (" + located.getPath()
                + ") was already imported, skipping duplicate import");
        } else {
          warn(imp.getPosition(), "Circular import of module " + name +
                " (" + located.getPath() + "), skipping");
        }
        continue;
      }
      visited.add(canonical);

      ParsedModule parsed;
      try {
        parsed = ParsedModule.parse(located.getPath());
      } catch (IOException e) {
        throw new ModuleLoadException(imp.getPosition(), name,
                                      located.getPath(), e);
      }
      Program module = parsed.program;
      String moduleName = moduleName(module, located);
      module.setModuleName(moduleName);
      LogHelper.debug(depth, "Loaded module " + moduleName + " from " +
                             located.getPath());

      mergeImports(module, parentDir(located), depth + 1);
      mergeStatements(module,
                      MAIN_PACKAGE.equals(moduleName) ? null : moduleName);
      completed.add(canonical);
    }
  }

  /**
   * Append statements of module to merged program, recording owner
   * module of functions
   * @param module
   * @param owner module name for mangling, null if unmangled
   */
  private void mergeStatements(Program module, String owner) {
    for (Statement stmt: module.getStatements()) {
      if (stmt instanceof FunctionSignature) {
        ((FunctionSignature)stmt).setModule(owner);
      }
      merged.add(stmt);
    }
  }

  /**
   * Probe D/M, D/M.thor, then the same under each search path and
   * finally the library directory
   * @return first regular file found
   * @throws ModuleLoadException if none found
   */
  private File locate(ImportDecl imp, File dir) throws ModuleLoadException {
    String name = imp.getModuleName();
    List<File> dirs = new ArrayList<File>();
    dirs.add(dir);
    for (String path: searchPaths) {
      if (path.length() > 0) {
        dirs.add(new File(path));
      }
    }
    if (libDir != null && libDir.length() > 0) {
      dirs.add(new File(libDir));
    }

    List<String> tried = new ArrayList<String>();
    for (File d: dirs) {
      File candidates[] = new File[] { new File(d, name),
                                       new File(d, name + THOR_EXTENSION) };
      for (File candidate: candidates) {
        tried.add(candidate.getPath());
        if (candidate.isFile()) {
          LogHelper.trace(imp.getPosition(), "Resolved " + name + " to " +
                                             candidate.getPath());
          return candidate;
        }
      }
    }
    throw new ModuleLoadException(imp.getPosition(), name, tried);
  }

  /**
   * Build program of body-less signatures for a built-in module
   */
  private static Program builtinModule(String name) {
    FilePosition pos = new FilePosition(name, 1, 1);
    List<Statement> decls = new ArrayList<Statement>();
    for (BuiltinFunction fn: Builtins.moduleFunctions(name)) {
      List<Parameter> params = new ArrayList<Parameter>();
      List<Type> inputs = fn.type.getInputs();
      for (int i = 0; i < inputs.size(); i++) {
        params.add(new Parameter(pos, inputs.get(i), fn.paramNames[i]));
      }
      decls.add(new FunctionDecl(pos, fn.type.getOutput(), fn.name,
                                 params, null));
    }
    Program program = new Program(name,
        new PackageDecl(pos, Builtins.STD_PACKAGE),
        new ArrayList<ImportDecl>(), decls);
    program.setModuleName(Builtins.STD_PACKAGE);
    return program;
  }

  /**
   * @return declared package, otherwise the file name without extension
   */
  private static String moduleName(Program program, File file) {
    String pkg = program.getPackageName();
    if (pkg != null) {
      return pkg;
    }
    return FilenameUtils.getBaseName(file.getName());
  }

  private static File parentDir(File file) {
    File parent = file.getAbsoluteFile().getParentFile();
    return parent != null ? parent : new File(".");
  }

  /**
   * Falls back to the absolute path if the file system can't
   * canonicalize it, e.g. for in-memory sources
   */
  private static String canonicalPath(File file) {
    try {
      return file.getCanonicalPath();
    } catch (IOException e) {
      logger.debug("Could not canonicalize " + file + ": " + e.getMessage());
      return file.getAbsolutePath();
    }
  }

  private void warn(FilePosition pos, String msg) {
    warnings.add(Diagnostic.warning(pos, msg));
    Logging.uniqueWarn(pos + ": " + msg);
  }
}
