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

public interface ExprVisitor<R> {
  public R visitLiteral(Literal e);
  public R visitIdentifier(Identifier e);
  public R visitBinary(BinaryExpression e);
  public R visitUnary(UnaryExpression e);
  public R visitCall(CallExpression e);
  public R visitMemberAccess(MemberAccess e);
  public R visitArrayLiteral(ArrayLiteral e);
  public R visitFormatString(FormatString e);
}
