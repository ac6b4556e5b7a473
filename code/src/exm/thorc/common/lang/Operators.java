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

import com.google.common.collect.ImmutableMap;

public class Operators {

  public static enum OpKind {
    ARITHMETIC,
    COMPARISON,
    EQUALITY,
    LOGICAL,
    ASSIGN;
  }

  /**
   * Binary operators.  The symbol is the same in Thor and C.
   */
  public static enum BuiltinOpcode {
    PLUS("+", OpKind.ARITHMETIC),
    MINUS("-", OpKind.ARITHMETIC),
    MULTIPLY("*", OpKind.ARITHMETIC),
    DIVIDE("/", OpKind.ARITHMETIC),
    MOD("%", OpKind.ARITHMETIC),
    EQ("==", OpKind.EQUALITY),
    NEQ("!=", OpKind.EQUALITY),
    LT("<", OpKind.COMPARISON),
    LTE("<=", OpKind.COMPARISON),
    GT(">", OpKind.COMPARISON),
    GTE(">=", OpKind.COMPARISON),
    AND("&&", OpKind.LOGICAL),
    OR("||", OpKind.LOGICAL),
    ASSIGN("=", OpKind.ASSIGN);

    private final String symbol;
    private final OpKind kind;

    private BuiltinOpcode(String symbol, OpKind kind) {
      this.symbol = symbol;
      this.kind = kind;
    }

    public String symbol() {
      return symbol;
    }

    public OpKind kind() {
      return kind;
    }
  }

  public static enum UnaryOpcode {
    NOT("!"),
    NEGATE("-");

    private final String symbol;

    private UnaryOpcode(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  private static final ImmutableMap<String, BuiltinOpcode> bySymbol;

  static {
    ImmutableMap.Builder<String, BuiltinOpcode> b = ImmutableMap.builder();
    for (BuiltinOpcode op: BuiltinOpcode.values()) {
      b.put(op.symbol(), op);
    }
    bySymbol = b.build();
  }

  /**
   * @param symbol
   * @return the binary operator, or null if none has this symbol
   */
  public static BuiltinOpcode fromSymbol(String symbol) {
    return bySymbol.get(symbol);
  }
}
