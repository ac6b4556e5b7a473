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

import org.apache.commons.lang3.StringUtils;

import exm.thorc.ast.Literal.LiteralKind;

/**
 * Renders a program as an indented tree, one node per line,
 * two spaces per level.
 */
public class AstPrinter implements ExprVisitor<Void>, StmtVisitor<Void> {
  private static final int INDENT_WIDTH = 2;

  private final StringBuilder sb = new StringBuilder();
  private int indent = 0;

  public static String print(Program program) {
    AstPrinter p = new AstPrinter();
    p.line("Program: " + program.getModuleName());
    p.indent++;
    if (program.getPackageDecl() != null) {
      program.getPackageDecl().accept(p);
    }
    for (ImportDecl imp: program.getImports()) {
      imp.accept(p);
    }
    for (Statement stmt: program.getStatements()) {
      stmt.accept(p);
    }
    p.indent--;
    return p.sb.toString();
  }

  public static String print(Statement stmt) {
    AstPrinter p = new AstPrinter();
    stmt.accept(p);
    return p.sb.toString();
  }

  public static String print(Expression expr) {
    AstPrinter p = new AstPrinter();
    expr.accept(p);
    return p.sb.toString();
  }

  private void line(String text) {
    sb.append(StringUtils.repeat(' ', indent * INDENT_WIDTH));
    sb.append(text);
    sb.append('\n');
  }

  private void child(Expression e) {
    indent++;
    e.accept(this);
    indent--;
  }

  private void child(Statement s) {
    indent++;
    s.accept(this);
    indent--;
  }

  private void signature(String label, FunctionSignature f) {
    String module = f.getModule() == null ? "" : " [" + f.getModule() + "]";
    line(label + ": " + f.getReturnType().typeName() + " " + f.getName()
          + module);
    indent++;
    for (Parameter p: f.getParams()) {
      line("Parameter: " + p.getType().typeName() + " " + p.getName());
    }
    indent--;
  }

  @Override
  public Void visitLiteral(Literal e) {
    if (e.getKind() == LiteralKind.STRING) {
      line("StringLiteral: \"" + e.getValue() + "\"");
    } else if (e.getKind() == LiteralKind.INT) {
      line("IntegerLiteral: " + e.getValue());
    } else if (e.getKind() == LiteralKind.FLOAT) {
      line("FloatLiteral: " + e.getValue());
    } else {
      line("BooleanLiteral: " + e.getValue());
    }
    return null;
  }

  @Override
  public Void visitIdentifier(Identifier e) {
    line("Identifier: " + e.fullName());
    return null;
  }

  @Override
  public Void visitBinary(BinaryExpression e) {
    line("BinaryExpression: " + e.getOp().symbol());
    child(e.getLeft());
    child(e.getRight());
    return null;
  }

  @Override
  public Void visitUnary(UnaryExpression e) {
    line("UnaryExpression: " + e.getOp().symbol());
    child(e.getOperand());
    return null;
  }

  @Override
  public Void visitCall(CallExpression e) {
    line("CallExpression");
    child(e.getCallee());
    for (Expression arg: e.getArgs()) {
      child(arg);
    }
    return null;
  }

  @Override
  public Void visitMemberAccess(MemberAccess e) {
    line("MemberAccess: ." + e.getMember());
    child(e.getObject());
    return null;
  }

  @Override
  public Void visitArrayLiteral(ArrayLiteral e) {
    line("ArrayLiteral");
    for (Expression elem: e.getElements()) {
      child(elem);
    }
    return null;
  }

  @Override
  public Void visitFormatString(FormatString e) {
    line("FormatString: \"" + e.getFormat() + "\"");
    for (Expression arg: e.getArgs()) {
      child(arg);
    }
    return null;
  }

  @Override
  public Void visitExpressionStatement(ExpressionStatement s) {
    line("ExpressionStatement");
    child(s.getExpr());
    return null;
  }

  @Override
  public Void visitVariableDeclaration(VariableDeclaration s) {
    line("VariableDeclaration: " + s.getDeclType().typeName() + " " +
         s.getName());
    if (s.getInitializer() != null) {
      child(s.getInitializer());
    }
    return null;
  }

  @Override
  public Void visitAssignment(Assignment s) {
    line("Assignment: " + s.getTarget().fullName());
    child(s.getValue());
    return null;
  }

  @Override
  public Void visitBlock(Block s) {
    line("Block");
    for (Statement stmt: s.getStatements()) {
      child(stmt);
    }
    return null;
  }

  @Override
  public Void visitIf(IfStatement s) {
    line("IfStatement");
    child(s.getCondition());
    child(s.getThenBranch());
    if (s.getElseBranch() != null) {
      indent++;
      line("Else");
      child(s.getElseBranch());
      indent--;
    }
    return null;
  }

  @Override
  public Void visitWhile(WhileStatement s) {
    line("WhileStatement");
    child(s.getCondition());
    child(s.getBody());
    return null;
  }

  @Override
  public Void visitReturn(ReturnStatement s) {
    line("ReturnStatement");
    if (s.getValue() != null) {
      child(s.getValue());
    }
    return null;
  }

  @Override
  public Void visitFunctionDecl(FunctionDecl s) {
    signature("FunctionDeclaration", s);
    if (s.hasBody()) {
      child(s.getBody());
    }
    return null;
  }

  @Override
  public Void visitExternDecl(ExternDecl s) {
    signature("ExternDeclaration", s);
    return null;
  }

  @Override
  public Void visitImport(ImportDecl s) {
    line("Import: " + s.getModuleName());
    return null;
  }

  @Override
  public Void visitPackage(PackageDecl s) {
    line("Package: " + s.getName());
    return null;
  }
}
