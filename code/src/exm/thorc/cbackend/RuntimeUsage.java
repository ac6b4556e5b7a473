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

import java.util.EnumSet;
import java.util.Set;

import exm.thorc.ast.ArrayLiteral;
import exm.thorc.ast.Assignment;
import exm.thorc.ast.BinaryExpression;
import exm.thorc.ast.Block;
import exm.thorc.ast.CallExpression;
import exm.thorc.ast.ExprVisitor;
import exm.thorc.ast.Expression;
import exm.thorc.ast.ExpressionStatement;
import exm.thorc.ast.ExternDecl;
import exm.thorc.ast.FormatString;
import exm.thorc.ast.FunctionDecl;
import exm.thorc.ast.Identifier;
import exm.thorc.ast.IfStatement;
import exm.thorc.ast.ImportDecl;
import exm.thorc.ast.Literal;
import exm.thorc.ast.MemberAccess;
import exm.thorc.ast.PackageDecl;
import exm.thorc.ast.Program;
import exm.thorc.ast.ReturnStatement;
import exm.thorc.ast.Statement;
import exm.thorc.ast.StmtVisitor;
import exm.thorc.ast.UnaryExpression;
import exm.thorc.ast.VariableDeclaration;
import exm.thorc.ast.WhileStatement;
import exm.thorc.cbackend.CRuntime.Helper;
import exm.thorc.frontend.FunctionTable;
import exm.thorc.frontend.FunctionTable.FunctionEntry;
import exm.thorc.frontend.FunctionTable.FunctionKind;

/**
 * Finds the runtime helpers a typed program refers to.
 */
public class RuntimeUsage implements ExprVisitor<Void>, StmtVisitor<Void> {

  private final FunctionTable functions;
  private final Set<Helper> used = EnumSet.noneOf(Helper.class);
  private String currentModule = null;

  private RuntimeUsage(FunctionTable functions) {
    this.functions = functions;
  }

  /**
   * @param program merged program after type inference
   * @param functions
   * @return helpers used, iterating in emission order
   */
  public static Set<Helper> find(Program program, FunctionTable functions) {
    RuntimeUsage usage = new RuntimeUsage(functions);
    for (Statement stmt: program.getStatements()) {
      usage.currentModule = null;
      stmt.accept(usage);
    }
    return usage.used;
  }

  private void walk(Expression e) {
    if (e != null) {
      e.accept(this);
    }
  }

  private void walk(Statement s) {
    if (s != null) {
      s.accept(this);
    }
  }

  @Override
  public Void visitLiteral(Literal e) {
    return null;
  }

  @Override
  public Void visitIdentifier(Identifier e) {
    return null;
  }

  @Override
  public Void visitBinary(BinaryExpression e) {
    walk(e.getLeft());
    walk(e.getRight());
    if (CGenerator.isStringComparison(e)) {
      used.add(Helper.STRING_EQUALS);
    }
    return null;
  }

  @Override
  public Void visitUnary(UnaryExpression e) {
    walk(e.getOperand());
    return null;
  }

  @Override
  public Void visitCall(CallExpression e) {
    FunctionEntry fn = CGenerator.resolveCallee(functions, e.getCallee(),
                                                currentModule);
    if (fn != null && fn.kind == FunctionKind.BUILTIN) {
      Helper h = CGenerator.builtinHelper(fn);
      if (h != null) {
        used.add(h);
      }
    }
    for (Expression arg: e.getArgs()) {
      walk(arg);
    }
    return null;
  }

  @Override
  public Void visitMemberAccess(MemberAccess e) {
    walk(e.getObject());
    return null;
  }

  @Override
  public Void visitArrayLiteral(ArrayLiteral e) {
    for (Expression x: e.getElements()) {
      walk(x);
    }
    return null;
  }

  @Override
  public Void visitFormatString(FormatString e) {
    used.add(Helper.FORMAT_STRING);
    for (Expression arg: e.getArgs()) {
      walk(arg);
    }
    return null;
  }

  @Override
  public Void visitExpressionStatement(ExpressionStatement s) {
    walk(s.getExpr());
    return null;
  }

  @Override
  public Void visitVariableDeclaration(VariableDeclaration s) {
    walk(s.getInitializer());
    return null;
  }

  @Override
  public Void visitAssignment(Assignment s) {
    walk(s.getValue());
    return null;
  }

  @Override
  public Void visitBlock(Block s) {
    for (Statement stmt: s.getStatements()) {
      walk(stmt);
    }
    return null;
  }

  @Override
  public Void visitIf(IfStatement s) {
    walk(s.getCondition());
    walk(s.getThenBranch());
    walk(s.getElseBranch());
    return null;
  }

  @Override
  public Void visitWhile(WhileStatement s) {
    walk(s.getCondition());
    walk(s.getBody());
    return null;
  }

  @Override
  public Void visitReturn(ReturnStatement s) {
    walk(s.getValue());
    return null;
  }

  @Override
  public Void visitFunctionDecl(FunctionDecl s) {
    if (s.hasBody()) {
      currentModule = s.getModule();
      walk(s.getBody());
      currentModule = null;
    }
    return null;
  }

  @Override
  public Void visitExternDecl(ExternDecl s) {
    return null;
  }

  @Override
  public Void visitImport(ImportDecl s) {
    return null;
  }

  @Override
  public Void visitPackage(PackageDecl s) {
    return null;
  }
}
