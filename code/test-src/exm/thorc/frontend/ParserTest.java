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
package exm.thorc.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import exm.thorc.ast.AstPrinter;
import exm.thorc.ast.BinaryExpression;
import exm.thorc.ast.Block;
import exm.thorc.ast.Expression;
import exm.thorc.ast.ExpressionStatement;
import exm.thorc.ast.ExternDecl;
import exm.thorc.ast.FormatString;
import exm.thorc.ast.FunctionDecl;
import exm.thorc.ast.Identifier;
import exm.thorc.ast.IfStatement;
import exm.thorc.ast.Program;
import exm.thorc.ast.Statement;
import exm.thorc.ast.VariableDeclaration;
import exm.thorc.ast.WhileStatement;
import exm.thorc.common.exceptions.InvalidSyntaxException;
import exm.thorc.common.lang.Operators.BuiltinOpcode;
import exm.thorc.common.lang.Types;
import exm.thorc.common.lang.Types.ArrayType;
import exm.thorc.common.lang.Types.RefType;
import exm.thorc.lexer.Lexer;

public class ParserTest {

  private static Parser parser(String src) {
    return new Parser("test.thor", new Lexer("test.thor", src).tokenize());
  }

  private static Program parse(String src) {
    Parser p = parser(src);
    Program program = p.parse();
    assertFalse("Unexpected errors: " + p.errors(), p.hasErrors());
    return program;
  }

  private static Expression expr(String src) throws InvalidSyntaxException {
    return parser(src).expression();
  }

  @Test
  public void testPrecedence() throws InvalidSyntaxException {
    assertEquals(
        "BinaryExpression: +\n" +
        "  IntegerLiteral: 1\n" +
        "  BinaryExpression: *\n" +
        "    IntegerLiteral: 2\n" +
        "    IntegerLiteral: 3\n",
        AstPrinter.print(expr("1 + 2 * 3")));

    assertEquals(
        "BinaryExpression: ||\n" +
        "  Identifier: a\n" +
        "  BinaryExpression: &&\n" +
        "    Identifier: b\n" +
        "    BinaryExpression: ==\n" +
        "      Identifier: c\n" +
        "      BinaryExpression: <\n" +
        "        Identifier: d\n" +
        "        Identifier: e\n",
        AstPrinter.print(expr("a || b && c == d < e")));
  }

  @Test
  public void testLeftAssociative() throws InvalidSyntaxException {
    assertEquals(
        "BinaryExpression: -\n" +
        "  BinaryExpression: -\n" +
        "    IntegerLiteral: 10\n" +
        "    IntegerLiteral: 3\n" +
        "  IntegerLiteral: 2\n",
        AstPrinter.print(expr("10 - 3 - 2")));
  }

  @Test
  public void testUnaryAndParens() throws InvalidSyntaxException {
    assertEquals(
        "BinaryExpression: *\n" +
        "  UnaryExpression: -\n" +
        "    Identifier: x\n" +
        "  BinaryExpression: +\n" +
        "    IntegerLiteral: 1\n" +
        "    UnaryExpression: !\n" +
        "      Identifier: y\n",
        AstPrinter.print(expr("-x * (1 + !y)")));
  }

  @Test
  public void testAssignmentRightAssociative() throws InvalidSyntaxException {
    Expression e = expr("a = b = 3");
    assertTrue(e instanceof BinaryExpression);
    BinaryExpression outer = (BinaryExpression)e;
    assertEquals(BuiltinOpcode.ASSIGN, outer.getOp());
    assertTrue(outer.getLeft() instanceof Identifier);
    assertEquals(BuiltinOpcode.ASSIGN,
                 ((BinaryExpression)outer.getRight()).getOp());
  }

  @Test(expected=InvalidSyntaxException.class)
  public void testInvalidAssignmentTarget() throws InvalidSyntaxException {
    expr("1 + 2 = 3");
  }

  @Test
  public void testAssignmentStatement() {
    Program p = parse("x = 5;\nx = y = 2;");
    assertEquals("Assignment: x\n  IntegerLiteral: 5\n",
                 AstPrinter.print(p.getStatements().get(0)));
    // Chained assignment is an Assignment whose value is an expression
    assertEquals(
        "Assignment: x\n" +
        "  BinaryExpression: =\n" +
        "    Identifier: y\n" +
        "    IntegerLiteral: 2\n",
        AstPrinter.print(p.getStatements().get(1)));
  }

  @Test
  public void testDeclarations() {
    Program p = parse(
        "int x = 1;\n" +
        "float[] values;\n" +
        "int add(int a, int& b) { return a + b; }\n" +
        "void proto(string s);\n" +
        "extern int abs(int v);\n");
    List<Statement> stmts = p.getStatements();
    assertEquals(5, stmts.size());

    VariableDeclaration x = (VariableDeclaration)stmts.get(0);
    assertEquals(Types.INT, x.getDeclType());
    VariableDeclaration values = (VariableDeclaration)stmts.get(1);
    assertEquals(new ArrayType(Types.FLOAT), values.getDeclType());
    assertNull(values.getInitializer());

    FunctionDecl add = (FunctionDecl)stmts.get(2);
    assertTrue(add.hasBody());
    assertEquals(2, add.getParams().size());
    assertEquals(new RefType(Types.INT), add.getParams().get(1).getType());
    assertTrue(add.getParams().get(1).isReference());

    FunctionDecl proto = (FunctionDecl)stmts.get(3);
    assertFalse(proto.hasBody());

    ExternDecl abs = (ExternDecl)stmts.get(4);
    assertEquals("abs", abs.getName());
    assertEquals(Types.INT, abs.getReturnType());
  }

  @Test
  public void testPackageAndImports() {
    Program p = parse("package geometry;\nimport \"util\";\n" +
                      "import std.io;\nint x;");
    assertEquals("geometry", p.getPackageName());
    assertEquals(2, p.getImports().size());
    assertEquals("util", p.getImports().get(0).getModuleName());
    assertEquals("std.io", p.getImports().get(1).getModuleName());
    assertEquals(1, p.getStatements().size());
  }

  @Test
  public void testQualifiedNames() throws InvalidSyntaxException {
    assertEquals(
        "CallExpression\n" +
        "  Identifier: std::println\n" +
        "  StringLiteral: \"hi\"\n",
        AstPrinter.print(expr("std::println(\"hi\")")));
    assertEquals(
        "CallExpression\n" +
        "  MemberAccess: .square\n" +
        "    Identifier: math\n" +
        "  IntegerLiteral: 3\n",
        AstPrinter.print(expr("math.square(3)")));
  }

  @Test
  public void testFormatString() throws InvalidSyntaxException {
    Expression e = expr("\"%s is %s\" % [name, 42]");
    assertTrue(e instanceof FormatString);
    FormatString fs = (FormatString)e;
    assertEquals("%s is %s", fs.getFormat());
    assertEquals(2, fs.getArgs().size());

    // Modulo without a bracket is still arithmetic
    assertTrue(expr("a % b") instanceof BinaryExpression);
  }

  @Test
  public void testForDesugaring() {
    Program p = parse("for (int i = 0; i < 3; i = i + 1) { f(i); }");
    assertEquals(1, p.getStatements().size());
    Block outer = (Block)p.getStatements().get(0);
    assertEquals(2, outer.getStatements().size());
    assertTrue(outer.getStatements().get(0) instanceof VariableDeclaration);
    WhileStatement loop = (WhileStatement)outer.getStatements().get(1);
    Block body = (Block)loop.getBody();
    assertEquals(2, body.getStatements().size());
    assertTrue(body.getStatements().get(0) instanceof Block);
    assertEquals("Assignment: i\n" +
                 "  BinaryExpression: +\n" +
                 "    Identifier: i\n" +
                 "    IntegerLiteral: 1\n",
                 AstPrinter.print(body.getStatements().get(1)));
  }

  @Test
  public void testForWithoutCondition() {
    Program p = parse("for (;;) { f(); }");
    Block outer = (Block)p.getStatements().get(0);
    assertEquals(1, outer.getStatements().size());
    WhileStatement loop = (WhileStatement)outer.getStatements().get(0);
    assertEquals("BooleanLiteral: true\n",
                 AstPrinter.print(loop.getCondition()));
  }

  @Test
  public void testDanglingElse() {
    Program p = parse("if (a) if (b) f(); else g();");
    IfStatement outer = (IfStatement)p.getStatements().get(0);
    assertNull(outer.getElseBranch());
    IfStatement inner = (IfStatement)outer.getThenBranch();
    assertTrue(inner.getElseBranch() instanceof ExpressionStatement);
  }

  @Test
  public void testErrorRecovery() {
    Parser p = parser("int x = ;\nint y = 2;\nfoo(;\nint z = 3;");
    Program program = p.parse();
    assertEquals(2, p.errors().size());
    assertEquals(1, p.errors().get(0).getLine());
    assertEquals(3, p.errors().get(1).getLine());
    // Statements after errors are still parsed
    assertEquals(2, program.getStatements().size());
  }

  @Test
  public void testErrorsInsideBlock() {
    Parser p = parser("void f() {\n  int = 1;\n  g();\n}\nint after;");
    Program program = p.parse();
    assertEquals(1, p.errors().size());
    assertEquals(2, program.getStatements().size());
    FunctionDecl f = (FunctionDecl)program.getStatements().get(0);
    assertEquals(1, f.getBody().getStatements().size());
  }

  @Test
  public void testStrayCloseBrace() {
    Parser p = parser("}\nint x;");
    Program program = p.parse();
    assertEquals(1, p.errors().size());
    assertEquals(1, program.getStatements().size());
  }

  @Test
  public void testInvalidDeclarations() {
    Parser p = parser("int& r;\nvoid v;\nvoid f() { int g() { } }\n");
    p.parse();
    assertTrue(p.errors().size() >= 3);
    assertTrue(p.errors().get(0).getMessage().contains("reference type"));
    assertTrue(p.errors().get(1).getMessage().contains("void"));
    assertTrue(p.errors().get(2).getMessage().contains("top level"));
  }

  @Test
  public void testArrayLiteral() throws InvalidSyntaxException {
    assertEquals(
        "ArrayLiteral\n" +
        "  IntegerLiteral: 1\n" +
        "  IntegerLiteral: 2\n",
        AstPrinter.print(expr("[1, 2]")));
    assertEquals("ArrayLiteral\n", AstPrinter.print(expr("[]")));
  }
}
