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

import exm.thorc.common.lang.Types;
import exm.thorc.common.lang.Types.Type;

/**
 * Integer, float, string or boolean literal.  For strings the value is
 * the unescaped text; for numbers it is the text as written.
 */
public class Literal extends Expression {
  public static enum LiteralKind {
    INT(Types.INT),
    FLOAT(Types.FLOAT),
    STRING(Types.STRING),
    BOOL(Types.BOOL);

    private final Type type;

    private LiteralKind(Type type) {
      this.type = type;
    }

    public Type type() {
      return type;
    }
  }

  private final LiteralKind kind;
  private final String value;

  public Literal(FilePosition pos, LiteralKind kind, String value) {
    super(pos, kind.type());
    this.kind = kind;
    this.value = value;
  }

  public LiteralKind getKind() {
    return kind;
  }

  public String getValue() {
    return value;
  }

  public boolean boolValue() {
    assert(kind == LiteralKind.BOOL);
    return Boolean.parseBoolean(value);
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitLiteral(this);
  }
}
