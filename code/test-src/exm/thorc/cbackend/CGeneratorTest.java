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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.thorc.ast.Program;
import exm.thorc.common.Diagnostic;
import exm.thorc.common.Logging;
import exm.thorc.common.exceptions.UserException;
import exm.thorc.frontend.FunctionTable;
import exm.thorc.frontend.ImportResolver;
import exm.thorc.frontend.ParsedModule;
import exm.thorc.frontend.TypeInference;

public class CGeneratorTest {

  private static Logger logger;

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private CGenerator lastGenerator;

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging(null, false);
  }

  private File write(String name, String text) throws IOException {
    File f = new File(tmp.getRoot(), name);
    FileUtils.writeStringToFile(f, text, StandardCharsets.UTF_8);
    return f;
  }

  private String generate(String src) throws IOException, UserException {
    return generate(src, true);
  }

  private String generate(String src, boolean prune)
      throws IOException, UserException {
    File main = write("main.thor", src);
    Program parsed = ParsedModule.parse(main.getPath()).program;
    Program merged = new ImportResolver(new ArrayList<String>(), null)
                                        .resolve(parsed, main.getPath());
    FunctionTable functions = new TypeInference().infer(merged);
    lastGenerator = new CGenerator(logger, prune);
    return lastGenerator.generate(merged, functions);
  }

  private boolean warned(String text) {
    for (Diagnostic d: lastGenerator.warnings()) {
      if (d.message.contains(text)) {
        return true;
      }
    }
    return false;
  }

  private static void assertContains(String expected, String output) {
    assertTrue("Expected <" + expected + "> in:\n" + output,
               output.contains(expected));
  }

  @Test
  public void testHelloWorld() throws Exception {
    String c = generate("import std.io;\n" +
                        "std.println(\"Hello, world!\");\n");
    assertTrue(c.startsWith("/* Generated by thorc from module main */\n" +
                            "\n#include <stdio.h>\n"));
    assertContains("#include <stdbool.h>\n", c);
    assertContains("/* Runtime support */\n", c);
    assertContains("void thor_println(const char* str) {\n" +
                   "    printf(\"%s\\n\", str);\n}\n", c);
    assertContains("int main(void) {\n" +
                   "    thor_println(\"Hello, world!\");\n" +
                   "    return 0;\n}\n", c);
    assertTrue(c.endsWith("}\n"));
    assertFalse(c.endsWith("\n\n"));
  }

  @Test
  public void testRuntimePruning() throws Exception {
    String pruned = generate("std.println(\"x\");\n");
    assertFalse(pruned.contains("thor_input"));
    assertFalse(pruned.contains("thor_string_equals"));
    assertFalse(pruned.contains("thor_format_string"));

    String full = generate("std.println(\"x\");\n", false);
    assertContains("char* thor_input(const char* prompt) {", full);
    assertContains("void thor_println(const char* str) {", full);
    assertContains("bool thor_string_equals(const char* a, const char* b) {",
                   full);
    assertContains("char* thor_format_string(const char* format, ...) {",
                   full);
  }

  @Test
  public void testNoHelpersNeeded() throws Exception {
    String c = generate("int x = 1;\n");
    assertFalse(c.contains("Runtime support"));
    assertContains("/* Globals */\nint x = 1;\n", c);
  }

  @Test
  public void testFormatString() throws Exception {
    String c = generate("import std.io;\n" +
        "string name = \"Ann\";\nint age = 30;\n" +
        "std.println(\"Hello, %s! You are %s.\" % [name, age]);\n");
    assertContains("char* name = \"Ann\";\n", c);
    assertContains("int age = 30;\n", c);
    assertContains("thor_println(thor_format_string(" +
        "\"Hello, %s! You are %g.\", name, (double)(age)));", c);
    assertContains("va_start(args, format);", c);
  }

  @Test
  public void testFormatBoolAndMismatch() throws Exception {
    String c = generate("bool b = true;\nstring s = \"%s\" % [b];\n" +
                        "string t = \"%s %s\" % [1];\n" +
                        "string u = \"%s\" % [1, 2];\n");
    assertContains("s = thor_format_string(\"%s\", " +
                   "(b ? \"true\" : \"false\"));", c);
    assertContains("t = thor_format_string(\"%g %%s\", (double)(1));", c);
    assertContains("u = thor_format_string(\"%g\", (double)(1), " +
                   "(double)(2));", c);
    assertTrue(warned("2 placeholder(s) but 1 argument(s)"));
    assertTrue(warned("1 placeholder(s) but 2 argument(s)"));
  }

  @Test
  public void testSurplusFormatArgumentEvaluated() throws Exception {
    String c = generate("import std.io;\n" +
                        "string s = \"%s\" % [1, std.input(\"x\")];\n");
    assertContains("s = thor_format_string(\"%g\", (double)(1), " +
                   "thor_input(\"x\"));", c);
    assertTrue(warned("1 placeholder(s) but 2 argument(s)"));
  }

  @Test
  public void testReferenceParameters() throws Exception {
    String c = generate("void inc(int& x) { x = x + 1; }\n" +
                        "int n = 1;\ninc(n);\n");
    assertContains("/* Forward declarations */\nvoid inc(int* x);\n", c);
    assertContains("void inc(int* x) {\n    *x = ((*x) + 1);\n}\n", c);
    assertContains("    inc(&n);\n", c);
  }

  @Test
  public void testReferenceIncrement() throws Exception {
    String c = generate("int& inc(int& x) { x = x + 1; return x; }\n" +
                        "int n = 0;\nint m = inc(n);\n");
    assertContains("int* inc(int* x) {\n    *x = ((*x) + 1);\n" +
                   "    return x;\n}\n", c);
    assertContains("    m = (*inc(&n));\n", c);
  }

  @Test
  public void testReferenceParameterPassedOn() throws Exception {
    String c = generate("void inc(int& x) { x = x + 1; }\n" +
                        "void twice(int& y) { inc(y); inc(y); }\n");
    assertContains("void twice(int* y) {\n    inc(y);\n    inc(y);\n}\n", c);
  }

  @Test
  public void testReferenceTemporary() throws Exception {
    String c = generate("void inc(int& x) { x = x + 1; }\ninc(5);\n");
    assertContains("inc(&(int){5});", c);
    assertTrue(warned("Reference argument is not a variable"));
  }

  @Test
  public void testReferenceReturn() throws Exception {
    String c = generate("int& pick(int& a) { return a; }\n" +
                        "int& global() { return n; }\n" +
                        "int n = 1;\nint v = pick(n);\n");
    assertContains("int* pick(int* a) {\n    return a;\n}\n", c);
    assertContains("int* global(void) {\n    return &n;\n}\n", c);
    assertContains("v = (*pick(&n));", c);
  }

  @Test
  public void testStringEquality() throws Exception {
    String c = generate("string a = \"x\";\nbool e = a == \"y\";\n" +
                        "bool ne = a != \"y\";\nbool i = 1 == 2;\n");
    assertContains("bool e;\n", c);
    assertContains("    e = thor_string_equals(a, \"y\");\n", c);
    assertContains("    ne = (!thor_string_equals(a, \"y\"));\n", c);
    assertContains("    i = (1 == 2);\n", c);
    assertContains("bool thor_string_equals(", c);
  }

  @Test
  public void testModuleMangling() throws Exception {
    write("math.thor", "package math;\n" +
                       "int square(int x) { return x * x; }\n");
    String c = generate("import \"math\";\nint r = math.square(3);\n");
    assertContains("int math_square(int x);\n", c);
    assertContains("int math_square(int x) {\n" +
                   "    return (x * x);\n}\n", c);
    assertContains("int r;\n", c);
    assertContains("    r = math_square(3);\n", c);
  }

  @Test
  public void testUserMain() throws Exception {
    String c = generate("int main() { return 0; }\n" +
                        "std.println(\"top\");\n");
    assertContains("static void thor_toplevel(void);\n", c);
    assertContains("int main(void) {\n    thor_toplevel();\n" +
                   "    return 0;\n}\n", c);
    assertContains("static void thor_toplevel(void) {\n" +
                   "    thor_println(\"top\");\n}\n", c);
  }

  @Test
  public void testUserMainWithoutToplevel() throws Exception {
    String c = generate("int main() { return 3; }\n");
    assertFalse(c.contains("thor_toplevel"));
    assertContains("int main(void) {\n    return 3;\n}\n", c);
  }

  @Test
  public void testToplevelReturn() throws Exception {
    String c = generate("int x = 2;\nreturn x;\n");
    assertContains("    return x;\n", c);

    c = generate("int main() { return 0; }\nreturn 1;\n");
    assertContains("static void thor_toplevel(void) {\n" +
                   "    1;\n    return;\n}\n", c);
    assertTrue(warned("Return value ignored"));
  }

  @Test
  public void testArrays() throws Exception {
    String c = generate("int[] a = [1, 2, 3];\n" +
                        "int sum(int[] xs, int n) { int[] b = [n, n];" +
                        " return n; }\n");
    assertContains("int* a = (int[]){1, 2, 3};\n", c);
    assertContains("int sum(int* xs, int n) {", c);
    assertContains("    int* b = (int[]){n, n};\n", c);
  }

  @Test
  public void testArrayReassigned() throws Exception {
    String c = generate("void g() { int[] a = [1, 2]; a = [3, 4]; }\n" +
                        "string[] e = [];\n");
    assertContains("void g(void) {\n    int* a = (int[]){1, 2};\n" +
                   "    a = (int[]){3, 4};\n}\n", c);
    assertContains("char** e = NULL;\n", c);
    assertTrue(lastGenerator.warnings().isEmpty());
  }

  @Test
  public void testNonConstantGlobalArray() throws Exception {
    String c = generate("int n = 2;\nint[] a = [n, 1];\n");
    assertContains("int n = 2;\nint* a;\n", c);
    assertContains("    a = (int[]){n, 1};\n", c);
  }

  @Test
  public void testControlFlow() throws Exception {
    String c = generate("int i = 0;\n" +
        "while (i < 3) { i = i + 1; }\n" +
        "if (i == 3) std.println(\"ok\"); else { std.println(\"no\"); }\n" +
        "{ int j = -i; }\n");
    assertContains("    while ((i < 3)) {\n        i = (i + 1);\n    }\n",
                   c);
    assertContains("    if ((i == 3)) {\n        thor_println(\"ok\");\n" +
                   "    } else {\n        thor_println(\"no\");\n    }\n",
                   c);
    assertContains("    {\n        int j = (-i);\n    }\n", c);
  }

  @Test
  public void testForLoop() throws Exception {
    String c = generate("int total = 0;\n" +
        "for (int i = 0; i < 3; i = i + 1) { total = total + i; }\n");
    assertContains("int i = 0;", c);
    assertContains("while ((i < 3)) {", c);
    assertContains("total = (total + i);", c);
    assertContains("i = (i + 1);", c);
  }

  @Test
  public void testExterns() throws Exception {
    String c = generate("extern int clamp(int x);\n" +
                        "extern int abs(int x);\n" +
                        "extern int strlen(string s);\n" +
                        "int z = clamp(-3) + abs(1) + strlen(\"ab\");\n");
    assertContains("/* External functions */\nint clamp(int x);\n", c);
    assertFalse(c.contains("int abs(int x);"));
    assertFalse(c.contains("int strlen(char* s);"));
    assertContains("z = ((clamp((-3)) + abs(1)) + strlen(\"ab\"));", c);
  }

  @Test
  public void testReservedNames() throws Exception {
    String c = generate("int free(int x) { return x; }\n" +
                        "int y = free(1);\n");
    assertContains("int free_(int x) {", c);
    assertContains("y = free_(1);", c);
  }

  @Test
  public void testLibraryFunctionNamesEscaped() throws Exception {
    String c = generate("void exit(int code) { }\n" +
                        "int puts(string s) { return 0; }\n" +
                        "int atoi = 4;\nexit(atoi);\n");
    assertContains("void exit_(int code) {", c);
    assertContains("int puts_(char* s) {", c);
    assertContains("int atoi_ = 4;\n", c);
    assertContains("    exit_(atoi_);\n", c);
  }

  @Test
  public void testPrototypeThenDefinition() throws Exception {
    String c = generate("int later(int x);\nint y = later(1);\n" +
                        "int later(int x) { return x; }\n");
    assertFalse(c.contains("External functions"));
    assertContains("/* Forward declarations */\nint later(int x);\n", c);
  }

  @Test
  public void testStringEscapes() throws Exception {
    String c = generate("std.println(\"tab\\tquote\\\"\");\n");
    assertContains("thor_println(\"tab\\tquote\\\"\");", c);
  }

  @Test
  public void testDeterministic() throws Exception {
    String src = "import std.io;\n" +
                 "string s = std.input(\"name? \");\n" +
                 "if (s == \"x\") std.println(\"%s\" % [s]);\n";
    assertEquals(generate(src), generate(src));
  }
}
