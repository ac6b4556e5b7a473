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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import org.junit.Test;

import exm.thorc.frontend.Parser;
import exm.thorc.lexer.Lexer;

public class AstPrinterTest {

  private static Program parse(String src) {
    Parser p = new Parser("test.thor", new Lexer("test.thor", src).tokenize());
    Program program = p.parse();
    assertFalse("Unexpected errors: " + p.errors(), p.hasErrors());
    return program;
  }

  @Test
  public void testFunction() {
    Program program = parse(
        "int add(int a, int& b) { return a + b; }");
    assertEquals(
        "FunctionDeclaration: int add\n" +
        "  Parameter: int a\n" +
        "  Parameter: int& b\n" +
        "  Block\n" +
        "    ReturnStatement\n" +
        "      BinaryExpression: +\n" +
        "        Identifier: a\n" +
        "        Identifier: b\n",
        AstPrinter.print(program.getStatements().get(0)));
  }

  @Test
  public void testModuleShownOnceResolved() {
    Program program = parse("extern void puts(string s);");
    FunctionSignature sig = (FunctionSignature)program.getStatements().get(0);
    sig.setModule("util");
    assertEquals(
        "ExternDeclaration: void puts [util]\n" +
        "  Parameter: string s\n",
        AstPrinter.print(program.getStatements().get(0)));
  }

  @Test
  public void testProgram() {
    Program program = parse(
        "package demo;\n" +
        "import std.io;\n" +
        "bool done = false;\n" +
        "if (!done) std.println(\"%s\" % [1.5]); else { done = true; }\n");
    program.setModuleName("demo");
    assertEquals(
        "Program: demo\n" +
        "  Package: demo\n" +
        "  Import: std.io\n" +
        "  VariableDeclaration: bool done\n" +
        "    BooleanLiteral: false\n" +
        "  IfStatement\n" +
        "    UnaryExpression: !\n" +
        "      Identifier: done\n" +
        "    ExpressionStatement\n" +
        "      CallExpression\n" +
        "        MemberAccess: .println\n" +
        "          Identifier: std\n" +
        "        FormatString: \"%s\"\n" +
        "          FloatLiteral: 1.5\n" +
        "    Else\n" +
        "      Block\n" +
        "        Assignment: done\n" +
        "          BooleanLiteral: true\n",
        AstPrinter.print(program));
  }
}
