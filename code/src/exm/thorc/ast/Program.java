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
package exm.thorc.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed contents of one module, or the merged program after import
 * resolution.  Statement order is execution and declaration order.
 */
public class Program {
  private final String file;
  private String moduleName;
  private final PackageDecl packageDecl;
  private final List<ImportDecl> imports;
  private final List<Statement> statements;

  public Program(String file, PackageDecl packageDecl,
                 List<ImportDecl> imports, List<Statement> statements) {
    this.file = file;
    this.packageDecl = packageDecl;
    this.imports = new ArrayList<ImportDecl>(imports);
    this.statements = new ArrayList<Statement>(statements);
  }

  /** @return source file, or a logical name for built-in modules */
  public String getFile() {
    return file;
  }

  public String getModuleName() {
    return moduleName;
  }

  public void setModuleName(String moduleName) {
    this.moduleName = moduleName;
  }

  public PackageDecl getPackageDecl() {
    return packageDecl;
  }

  /** @return declared package name or null */
  public String getPackageName() {
    return packageDecl == null ? null : packageDecl.getName();
  }

  public List<ImportDecl> getImports() {
    return Collections.unmodifiableList(imports);
  }

  public List<Statement> getStatements() {
    return Collections.unmodifiableList(statements);
  }
}
