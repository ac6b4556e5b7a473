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
package exm.thorc.common.lang;

import java.util.Arrays;
import java.util.Collection;

import com.google.common.collect.ImmutableMap;

import exm.thorc.common.lang.Types.FunctionType;
import exm.thorc.common.lang.Types.Type;

/**
 * The built-in modules.  The import resolver builds signatures from
 * this table and the C backend maps calls to runtime symbols through it,
 * so the two can't disagree.
 */
public class Builtins {

  /** Name used in import declarations */
  public static final String STD_IO_MODULE = "std.io";

  /** Package of the standard I/O module, used to qualify calls */
  public static final String STD_PACKAGE = "std";

  public static class BuiltinFunction {
    public final String name;
    public final FunctionType type;
    /** Symbol in the generated runtime support section */
    public final String runtimeSymbol;
    public final String[] paramNames;

    private BuiltinFunction(String name, FunctionType type,
                            String runtimeSymbol, String... paramNames) {
      assert(type.getInputs().size() == paramNames.length);
      this.name = name;
      this.type = type;
      this.runtimeSymbol = runtimeSymbol;
      this.paramNames = paramNames;
    }
  }

  public static final BuiltinFunction PRINTLN = new BuiltinFunction(
      "println", fn(Types.VOID, Types.STRING), "thor_println", "str");

  public static final BuiltinFunction INPUT = new BuiltinFunction(
      "input", fn(Types.STRING, Types.STRING), "thor_input", "prompt");

  private static final ImmutableMap<String, BuiltinFunction> stdFunctions =
      ImmutableMap.<String, BuiltinFunction>builder()
        .put(PRINTLN.name, PRINTLN)
        .put(INPUT.name, INPUT)
        .build();

  /**
   * @param importName
   * @return true if import name refers to a virtual built-in module
   */
  public static boolean isBuiltinModule(String importName) {
    return STD_IO_MODULE.equals(importName);
  }

  /**
   * @param importName
   * @return functions of the built-in module, in declaration order
   */
  public static Collection<BuiltinFunction> moduleFunctions(
                                                String importName) {
    assert(isBuiltinModule(importName));
    return stdFunctions.values();
  }

  /**
   * Look up a qualified built-in call like std.println
   * @param qualifier
   * @param name
   * @return the function, or null if not a built-in
   */
  public static BuiltinFunction lookup(String qualifier, String name) {
    if (!STD_PACKAGE.equals(qualifier)) {
      return null;
    }
    return stdFunctions.get(name);
  }

  private static FunctionType fn(Type output, Type... inputs) {
    return new FunctionType(Arrays.asList(inputs), output);
  }
}
