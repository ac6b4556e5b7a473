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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.thorc.ast.ExternDecl;
import exm.thorc.ast.FunctionDecl;
import exm.thorc.ast.FunctionSignature;
import exm.thorc.ast.Program;
import exm.thorc.ast.Statement;
import exm.thorc.common.lang.Builtins;
import exm.thorc.common.lang.Builtins.BuiltinFunction;
import exm.thorc.common.lang.Types.FunctionType;
import exm.thorc.common.util.Pair;

/**
 * All functions visible in a merged program, and the rules for
 * resolving a call to one of them.
 */
public class FunctionTable {

  public static enum FunctionKind {
    /** Thor function, possibly only a prototype */
    DEFINED,
    /** C function declared with extern */
    EXTERN,
    /** Runtime support function */
    BUILTIN;
  }

  public static class FunctionEntry {
    /** null for the entry module */
    public final String module;
    public final String name;
    public final FunctionType type;
    public final FunctionKind kind;
    /** declaration, null for builtins not declared in the program */
    public final FunctionSignature decl;

    public FunctionEntry(String module, String name, FunctionType type,
                         FunctionKind kind, FunctionSignature decl) {
      this.module = module;
      this.name = name;
      this.type = type;
      this.kind = kind;
      this.decl = decl;
    }

    @Override
    public String toString() {
      return (module == null ? "" : module + "::") + name + " " + type;
    }
  }

  /** All entries with a name, in program order */
  private final Map<String, List<FunctionEntry>> byName =
                      new LinkedHashMap<String, List<FunctionEntry>>();

  private final Map<Pair<String, String>, FunctionEntry> byModule =
                      new LinkedHashMap<Pair<String, String>, FunctionEntry>();

  public static FunctionTable build(Program merged) {
    FunctionTable table = new FunctionTable();
    for (Statement stmt: merged.getStatements()) {
      if (stmt instanceof FunctionSignature) {
        table.add((FunctionSignature)stmt);
      }
    }
    return table;
  }

  private void add(FunctionSignature decl) {
    FunctionKind kind;
    if (decl instanceof ExternDecl) {
      kind = FunctionKind.EXTERN;
    } else if (Builtins.STD_PACKAGE.equals(decl.getModule()) &&
        Builtins.lookup(decl.getModule(), decl.getName()) != null) {
      kind = FunctionKind.BUILTIN;
    } else {
      kind = FunctionKind.DEFINED;
    }
    FunctionEntry entry = new FunctionEntry(decl.getModule(), decl.getName(),
                                            decl.functionType(), kind, decl);

    Pair<String, String> key = Pair.create(decl.getModule(), decl.getName());
    FunctionEntry prev = byModule.get(key);
    if (prev != null) {
      // A definition replaces an earlier prototype
      if (hasBody(decl) && !hasBody(prev.decl)) {
        byModule.put(key, entry);
        List<FunctionEntry> list = byName.get(decl.getName());
        list.set(list.indexOf(prev), entry);
      }
      return;
    }
    byModule.put(key, entry);
    List<FunctionEntry> list = byName.get(decl.getName());
    if (list == null) {
      list = new ArrayList<FunctionEntry>();
      byName.put(decl.getName(), list);
    }
    list.add(entry);
  }

  private static boolean hasBody(FunctionSignature decl) {
    return decl instanceof FunctionDecl && ((FunctionDecl)decl).hasBody();
  }

  /**
   * Resolve a module-qualified call such as std::println
   * @param qualifier
   * @param name
   * @return entry, or null if unknown
   */
  public FunctionEntry lookupQualified(String qualifier, String name) {
    FunctionEntry entry = byModule.get(Pair.create(qualifier, name));
    if (entry != null) {
      return entry;
    }
    BuiltinFunction builtin = Builtins.lookup(qualifier, name);
    if (builtin != null) {
      return new FunctionEntry(Builtins.STD_PACKAGE, builtin.name,
                               builtin.type, FunctionKind.BUILTIN, null);
    }
    return null;
  }

  /**
   * Resolve an unqualified call.  Looks in the caller's module,
   * then the entry module and externs, then any other module that
   * is the only one defining the name.
   * @param name
   * @param callerModule module of calling function, null for entry
   * @return entry, or null if unknown or ambiguous
   */
  public FunctionEntry lookup(String name, String callerModule) {
    List<FunctionEntry> candidates = byName.get(name);
    if (candidates == null) {
      return null;
    }
    FunctionEntry own = byModule.get(Pair.create(callerModule, name));
    if (own != null) {
      return own;
    }
    for (FunctionEntry e: candidates) {
      if (e.module == null || e.kind == FunctionKind.EXTERN) {
        return e;
      }
    }
    if (candidates.size() == 1) {
      return candidates.get(0);
    }
    return null;
  }

  /**
   * @param name
   * @param callerModule
   * @return true if lookup fails only because several modules define name
   */
  public boolean isAmbiguous(String name, String callerModule) {
    List<FunctionEntry> candidates = byName.get(name);
    return candidates != null && candidates.size() > 1 &&
           lookup(name, callerModule) == null;
  }

  /**
   * @return modules defining name, for error messages
   */
  public List<String> definingModules(String name) {
    List<String> modules = new ArrayList<String>();
    List<FunctionEntry> candidates = byName.get(name);
    if (candidates != null) {
      for (FunctionEntry e: candidates) {
        modules.add(e.module == null ? "<main>" : e.module);
      }
    }
    return modules;
  }
}
