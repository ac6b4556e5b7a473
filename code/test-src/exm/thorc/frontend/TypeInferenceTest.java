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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.thorc.ast.BinaryExpression;
import exm.thorc.ast.Block;
import exm.thorc.ast.ExpressionStatement;
import exm.thorc.ast.FunctionDecl;
import exm.thorc.ast.Program;
import exm.thorc.ast.ReturnStatement;
import exm.thorc.ast.VariableDeclaration;
import exm.thorc.common.Diagnostic;
import exm.thorc.common.Logging;
import exm.thorc.common.exceptions.TypeInferenceException;
import exm.thorc.common.exceptions.UserException;
import exm.thorc.common.lang.Types;
import exm.thorc.common.lang.Types.ArrayType;
import exm.thorc.frontend.FunctionTable.FunctionKind;

public class TypeInferenceTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  private static Program parse(String src) throws UserException {
    return ParsedModule.parse("test.thor", src).program;
  }

  private static boolean hasWarning(TypeInference ti, String text) {
    for (Diagnostic d: ti.warnings()) {
      if (d.message.contains(text)) {
        return true;
      }
    }
    return false;
  }

  @Test
  public void testArithmeticPromotion() throws UserException {
    Program p = parse("int a = 1;\nfloat b = a + 2.5;\nint c = a * 2;\n");
    new TypeInference().infer(p);
    VariableDeclaration b = (VariableDeclaration)p.getStatements().get(1);
    VariableDeclaration c = (VariableDeclaration)p.getStatements().get(2);
    assertEquals(Types.FLOAT, b.getInitializer().getType());
    assertEquals(Types.INT, c.getInitializer().getType());
  }

  @Test
  public void testComparisonIsBool() throws UserException {
    Program p = parse("int a = 1;\nbool t = a < 2 && !false;\n");
    new TypeInference().infer(p);
    VariableDeclaration t = (VariableDeclaration)p.getStatements().get(1);
    assertEquals(Types.BOOL, t.getInitializer().getType());
  }

  @Test
  public void testReferenceParamReadsValue() throws UserException {
    Program p = parse("int inc(int& x) { return x + 1; }\n");
    new TypeInference().infer(p);
    FunctionDecl f = (FunctionDecl)p.getStatements().get(0);
    ReturnStatement ret = (ReturnStatement)f.getBody().getStatements().get(0);
    BinaryExpression sum = (BinaryExpression)ret.getValue();
    assertEquals(Types.INT, sum.getLeft().getType());
    assertEquals(Types.INT, sum.getType());
  }

  @Test
  public void testGlobalsVisibleBeforeDeclaration() throws UserException {
    Program p = parse("int next() { return n + 1; }\nint n = 2;\n");
    TypeInference ti = new TypeInference();
    ti.infer(p);
    assertTrue(ti.warnings().isEmpty());
  }

  @Test
  public void testBuiltinCall() throws UserException {
    Program p = parse("std.println(\"x\");\nstring s = std::input(\"> \");\n");
    TypeInference ti = new TypeInference();
    FunctionTable functions = ti.infer(p);
    ExpressionStatement call = (ExpressionStatement)p.getStatements().get(0);
    assertEquals(Types.VOID, call.getExpr().getType());
    VariableDeclaration s = (VariableDeclaration)p.getStatements().get(1);
    assertEquals(Types.STRING, s.getInitializer().getType());
    assertEquals(FunctionKind.BUILTIN,
                 functions.lookupQualified("std", "println").kind);
  }

  @Test
  public void testUnknownOperand() throws UserException {
    Program p = parse("int x = foo() + 1;\n");
    TypeInference ti = new TypeInference();
    try {
      ti.infer(p);
      fail("Expected TypeInferenceException");
    } catch (TypeInferenceException e) {
      assertEquals(1, e.getErrors().size());
      assertTrue(e.getErrors().get(0).getMessage().contains(
                 "Could not determine type of operand of +"));
    }
    assertTrue(hasWarning(ti, "Call to unknown function foo"));
  }

  @Test
  public void testReferenceResultMustOutliveCall() throws UserException {
    String[] bad = {
      "int& f() { int y = 3; return y; }\n",
      "int& h(int& x) { return x + 1; }\n",
      "int& v(int x) { return x; }\n",
      // Local shadowing a global
      "int n = 1;\nint& s() { int n = 2; return n; }\n",
    };
    for (String src: bad) {
      try {
        new TypeInference().infer(parse(src));
        fail("Expected TypeInferenceException for " + src);
      } catch (TypeInferenceException e) {
        assertEquals(1, e.getErrors().size());
        assertTrue(e.getErrors().get(0).getMessage().contains("reference"));
      }
    }
  }

  @Test
  public void testReferenceResultFromParamOrGlobal() throws UserException {
    TypeInference ti = new TypeInference();
    ti.infer(parse("int& pick(int& a) { return a; }\n" +
                   "int& global() { if (true) { return n; } return n; }\n" +
                   "int n = 1;\nint v = pick(n);\nint w = global();\n"));
    assertTrue(ti.warnings().isEmpty());
  }

  @Test
  public void testBlockScope() throws UserException {
    Program p = parse("{ int y = 1; }\nint z = y + 1;\n");
    TypeInference ti = new TypeInference();
    try {
      ti.infer(p);
      fail("Expected TypeInferenceException");
    } catch (TypeInferenceException e) {
      assertEquals(1, e.getErrors().size());
    }
    assertTrue(hasWarning(ti, "Unresolved identifier y"));
  }

  @Test
  public void testArityWarning() throws UserException {
    Program p = parse("int two(int a, int b) { return a; }\n" +
                      "int r = two(1);\n");
    TypeInference ti = new TypeInference();
    ti.infer(p);
    assertTrue(hasWarning(ti, "expects 2 argument(s) but got 1"));
  }

  @Test
  public void testAmbiguousCall() throws UserException {
    Program p = parse("int g() { return 1; }\nint g() { return 2; }\n" +
                      "int r = g();\n");
    ((FunctionDecl)p.getStatements().get(0)).setModule("left");
    ((FunctionDecl)p.getStatements().get(1)).setModule("right");
    try {
      new TypeInference().infer(p);
      fail("Expected TypeInferenceException");
    } catch (TypeInferenceException e) {
      assertTrue(e.getErrors().get(0).getMessage().contains(
                 "ambiguous: defined in modules left, right"));
    }
  }

  @Test
  public void testOwnModulePreferred() throws UserException {
    Program p = parse("int g() { return 1; }\nint g() { return 2; }\n" +
                      "int h() { return g() + 1; }\n");
    ((FunctionDecl)p.getStatements().get(0)).setModule("left");
    ((FunctionDecl)p.getStatements().get(1)).setModule("right");
    ((FunctionDecl)p.getStatements().get(2)).setModule("right");
    TypeInference ti = new TypeInference();
    ti.infer(p);
    assertFalse(hasWarning(ti, "unknown function"));
  }

  @Test
  public void testArrayLiteral() throws UserException {
    Program p = parse("int[] a = [1, 2];\nint[] e = [];\n");
    new TypeInference().infer(p);
    VariableDeclaration a = (VariableDeclaration)p.getStatements().get(0);
    VariableDeclaration e = (VariableDeclaration)p.getStatements().get(1);
    assertEquals(new ArrayType(Types.INT), a.getInitializer().getType());
    assertEquals(new ArrayType(Types.INT), e.getInitializer().getType());
  }

  @Test
  public void testFormatArgumentMustBeTyped() throws UserException {
    Program p = parse("string s = \"%s\" % [missing];\n");
    try {
      new TypeInference().infer(p);
      fail("Expected TypeInferenceException");
    } catch (TypeInferenceException e) {
      assertTrue(e.getErrors().get(0).getMessage().contains(
                 "format argument 1"));
    }
  }

  @Test
  public void testNestedBlockInFunction() throws UserException {
    Program p = parse("void f(int n) { while (n > 0) { int m = n - 1; " +
                      "n = m; } }\n");
    TypeInference ti = new TypeInference();
    ti.infer(p);
    FunctionDecl f = (FunctionDecl)p.getStatements().get(0);
    Block body = f.getBody();
    assertEquals(1, body.getStatements().size());
    assertTrue(ti.warnings().isEmpty());
  }
}
