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

public interface StmtVisitor<R> {
  public R visitExpressionStatement(ExpressionStatement s);
  public R visitVariableDeclaration(VariableDeclaration s);
  public R visitAssignment(Assignment s);
  public R visitBlock(Block s);
  public R visitIf(IfStatement s);
  public R visitWhile(WhileStatement s);
  public R visitReturn(ReturnStatement s);
  public R visitFunctionDecl(FunctionDecl s);
  public R visitExternDecl(ExternDecl s);
  public R visitImport(ImportDecl s);
  public R visitPackage(PackageDecl s);
}
