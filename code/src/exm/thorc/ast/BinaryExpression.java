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

import exm.thorc.common.lang.Operators.BuiltinOpcode;

public class BinaryExpression extends Expression {
  private final BuiltinOpcode op;
  private final Expression left;
  private final Expression right;

  public BinaryExpression(FilePosition pos, BuiltinOpcode op,
                          Expression left, Expression right) {
    super(pos);
    this.op = op;
    this.left = left;
    this.right = right;
  }

  public BuiltinOpcode getOp() {
    return op;
  }

  public Expression getLeft() {
    return left;
  }

  public Expression getRight() {
    return right;
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitBinary(this);
  }
}
