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
package exm.thorc.cbackend;

import java.util.Arrays;
import java.util.List;

import exm.thorc.cbackend.tree.CTree;
import exm.thorc.cbackend.tree.Call;
import exm.thorc.cbackend.tree.Expression;
import exm.thorc.cbackend.tree.Function;
import exm.thorc.cbackend.tree.Sequence;
import exm.thorc.cbackend.tree.Text;
import exm.thorc.common.lang.Builtins;

/**
 * Runtime support functions emitted at the top of every generated file,
 * and builders for calls to them.
 */
public class CRuntime {

  public static final List<String> INCLUDES = Arrays.asList(
      "stdio.h", "stdlib.h", "string.h", "stdbool.h", "stdarg.h");

  /** Size of buffers allocated by input and format strings */
  public static final int BUFFER_SIZE = 1024;

  /**
   * Helpers in the order they are emitted
   */
  public static enum Helper {
    INPUT(Builtins.INPUT.runtimeSymbol),
    PRINTLN(Builtins.PRINTLN.runtimeSymbol),
    STRING_EQUALS("thor_string_equals"),
    FORMAT_STRING("thor_format_string");

    public final String symbol;

    private Helper(String symbol) {
      this.symbol = symbol;
    }

    /**
     * @param symbol
     * @return helper, or null if symbol doesn't name one
     */
    public static Helper fromSymbol(String symbol) {
      for (Helper h: values()) {
        if (h.symbol.equals(symbol)) {
          return h;
        }
      }
      return null;
    }
  }

  public static Sequence includes() {
    Sequence result = new Sequence();
    for (String header: INCLUDES) {
      result.add(new Text("#include <" + header + ">"));
    }
    return result;
  }

  public static CTree definition(Helper helper) {
    switch (helper) {
      case INPUT:
        return new Function(CTypes.C_STRING, helper.symbol,
            Arrays.asList("const char* prompt"), new Sequence(new Text(
              "printf(\"%s\", prompt);",
              "fflush(stdout);",
              "char* buffer = malloc(" + BUFFER_SIZE + ");",
              "if (fgets(buffer, " + BUFFER_SIZE + ", stdin) == NULL) {",
              "    buffer[0] = '\\0';",
              "}",
              "// Remove newline",
              "int len = strlen(buffer);",
              "if (len > 0 && buffer[len-1] == '\\n') {",
              "    buffer[len-1] = '\\0';",
              "}",
              "return buffer;")), false);
      case PRINTLN:
        return new Function(CTypes.C_VOID, helper.symbol,
            Arrays.asList("const char* str"), new Sequence(new Text(
              "printf(\"%s\\n\", str);")), false);
      case STRING_EQUALS:
        return new Function(CTypes.C_BOOL, helper.symbol,
            Arrays.asList("const char* a", "const char* b"),
            new Sequence(new Text(
              "return strcmp(a, b) == 0;")), false);
      case FORMAT_STRING:
        return new Function(CTypes.C_STRING, helper.symbol,
            Arrays.asList("const char* format", "..."),
            new Sequence(new Text(
              "va_list args;",
              "va_start(args, format);",
              "char* buffer = malloc(" + BUFFER_SIZE + ");",
              "vsnprintf(buffer, " + BUFFER_SIZE + ", format, args);",
              "va_end(args);",
              "return buffer;")), false);
      default:
        throw new IllegalArgumentException("Unknown helper " + helper);
    }
  }

  public static Expression stringEquals(Expression a, Expression b) {
    return new Call(Helper.STRING_EQUALS.symbol, a, b);
  }

  public static Expression formatString(List<Expression> formatAndArgs) {
    return new Call(Helper.FORMAT_STRING.symbol, formatAndArgs);
  }
}
