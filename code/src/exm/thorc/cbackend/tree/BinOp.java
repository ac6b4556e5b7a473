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
 * Parenthesized binary operation, e.g. (a + b)
 */
public class BinOp extends Expression
{
  private final String op;
  private final Expression left;
  private final Expression right;

  public BinOp(String op, Expression left, Expression right)
  {
    this.op = op;
    this.left = left;
    this.right = right;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    sb.append('(');
    left.appendTo(sb);
    sb.append(' ');
    sb.append(op);
    sb.append(' ');
    right.appendTo(sb);
    sb.append(')');
  }
}
