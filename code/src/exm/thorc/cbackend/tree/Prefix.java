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
package exm.thorc.cbackend.tree;

/**
 * Prefix operator: (!x), (-x), (*p), or &x when taking an address
 */
public class Prefix extends Expression
{
  private final String op;
  private final Expression operand;
  private final boolean parenthesize;

  private Prefix(String op, Expression operand, boolean parenthesize)
  {
    this.op = op;
    this.operand = operand;
    this.parenthesize = parenthesize;
  }

  public static Prefix unary(String op, Expression operand) {
    return new Prefix(op, operand, true);
  }

  public static Prefix deref(Expression pointer) {
    return new Prefix("*", pointer, true);
  }

  public static Prefix addressOf(Expression lvalue) {
    return new Prefix("&", lvalue, false);
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    if (parenthesize)
      sb.append('(');
    sb.append(op);
    operand.appendTo(sb);
    if (parenthesize)
      sb.append(')');
  }
}
