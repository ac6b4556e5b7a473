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
package exm.thorc.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.thorc.common.Diagnostic;
import exm.thorc.common.Logging;
import exm.thorc.common.Settings;

public class ThorCompilerTest {

  private static Logger logger;

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging(null, false);
  }

  @After
  public void resetSettings() {
    Settings.set(Settings.CODEGEN_RUNTIME, Settings.RUNTIME_REFERENCED);
    Settings.set(Settings.AST_OUTPUT_FILE, "");
    Settings.clearModulePath();
  }

  private File write(File dir, String name, String text) throws IOException {
    File f = new File(dir, name);
    FileUtils.writeStringToFile(f, text, StandardCharsets.UTF_8);
    return f;
  }

  private CompileResult compile(String src) throws IOException {
    return new ThorCompiler(logger).compile(
                    write(tmp.getRoot(), "main.thor", src));
  }

  private static boolean mentions(Iterable<Diagnostic> ds, String text) {
    for (Diagnostic d: ds) {
      if (d.message.contains(text)) {
        return true;
      }
    }
    return false;
  }

  @Test
  public void testSuccess() throws IOException {
    CompileResult r = compile("import std.io;\n" +
        "string name = std.input(\"Name: \");\n" +
        "std.println(\"Hi %s\" % [name]);\n");
    assertTrue(r.succeeded());
    assertEquals(ExitCode.SUCCESS, r.exitCode());
    assertTrue(r.errors().isEmpty());
    assertTrue(r.warnings().isEmpty());
    assertTrue(r.output().contains("name = thor_input(\"Name: \");"));
  }

  @Test
  public void testDeterministic() throws IOException {
    String src = "import std.io;\nint f(int& x) { return x; }\n" +
                 "int n = 3;\nstd.println(\"%s\" % [f(n)]);\n";
    assertEquals(compile(src).output(), compile(src).output());
  }

  @Test
  public void testReferenceToLocalRejected() throws IOException {
    CompileResult r = compile("int& f() { int y = 3; return y; }\n");
    assertFalse(r.succeeded());
    assertNull(r.output());
    assertEquals(ExitCode.ERROR_USER, r.exitCode());
    assertTrue(mentions(r.errors(), "returns a reference to y"));
  }

  @Test
  public void testMissingImport() throws IOException {
    CompileResult r = compile("import \"nope\";\n");
    assertFalse(r.succeeded());
    assertNull(r.output());
    assertEquals(ExitCode.ERROR_USER, r.exitCode());
    assertTrue(mentions(r.errors(), "Could not find module nope"));
  }

  @Test
  public void testSyntaxErrors() throws IOException {
    CompileResult r = compile("int x = ;\nint y = 2;\nfoo(;\n");
    assertEquals(ExitCode.ERROR_SYNTAX, r.exitCode());
    assertEquals(2, r.errors().size());
    assertEquals(1, r.errors().get(0).line);
    assertEquals(3, r.errors().get(1).line);
    assertNull(r.output());
  }

  @Test
  public void testUnterminatedString() throws IOException {
    CompileResult r = compile("string s = \"oops;\n");
    assertEquals(ExitCode.ERROR_SYNTAX, r.exitCode());
    assertTrue(mentions(r.errors(), "Unterminated string literal"));
  }

  @Test
  public void testTypeErrors() throws IOException {
    CompileResult r = compile("int x = foo() + 1;\n");
    assertEquals(ExitCode.ERROR_USER, r.exitCode());
    assertTrue(mentions(r.errors(), "Could not determine type"));
    assertTrue(mentions(r.warnings(), "Call to unknown function foo"));
  }

  @Test
  public void testUnreadableInput() {
    CompileResult r = new ThorCompiler(logger).compile(
                        new File(tmp.getRoot(), "absent.thor"));
    assertEquals(ExitCode.ERROR_IO, r.exitCode());
  }

  @Test
  public void testImportWarningsReported() throws IOException {
    write(tmp.getRoot(), "a.thor", "import \"b\";\nint fa() { return 1; }\n");
    write(tmp.getRoot(), "b.thor", "import \"a\";\nint fb() { return 2; }\n");
    CompileResult r = compile("import \"a\";\nint v = fa() + fb();\n");
    assertTrue(r.succeeded());
    assertTrue(mentions(r.warnings(), "Circular import"));
    assertTrue(r.output().contains("v = (a_fa() + b_fb());"));
  }

  @Test
  public void testModulePathSetting() throws IOException {
    File lib = tmp.newFolder("modules");
    write(lib, "shapes.thor",
          "float area(float r) { return 3.14 * r * r; }\n");
    Settings.addModulePath(lib.getPath());
    CompileResult r = compile("import shapes;\nfloat a = shapes.area(2.0);\n");
    assertTrue(r.succeeded());
    assertTrue(r.output().contains("float shapes_area(float r) {"));
  }

  @Test
  public void testRuntimeSetting() throws IOException {
    Settings.set(Settings.CODEGEN_RUNTIME, Settings.RUNTIME_ALWAYS);
    CompileResult r = compile("int x = 1;\n");
    assertTrue(r.output().contains("char* thor_input(const char* prompt)"));

    Settings.set(Settings.CODEGEN_RUNTIME, "sometimes");
    r = compile("int x = 1;\n");
    assertEquals(ExitCode.ERROR_COMMAND, r.exitCode());
  }

  @Test
  public void testAstOutputFile() throws IOException {
    File astFile = new File(tmp.getRoot(), "ast.txt");
    Settings.set(Settings.AST_OUTPUT_FILE, astFile.getPath());
    CompileResult r = compile("int x = 1;\n");
    assertTrue(r.succeeded());
    String dump = FileUtils.readFileToString(astFile, StandardCharsets.UTF_8);
    assertEquals("Program: main\n" +
                 "  VariableDeclaration: int x\n" +
                 "    IntegerLiteral: 1\n", dump);
  }

  @Test
  public void testSelectOutputFile() {
    assertEquals(new File("dir/prog.c"), Main.selectOutputFile(
                 new Main.Args("dir/prog.thor", null, false)));
    assertEquals(new File("prog.c"), Main.selectOutputFile(
                 new Main.Args("prog", null, false)));
    assertEquals(new File("out.c"), Main.selectOutputFile(
                 new Main.Args("prog.thor", "out.c", false)));
  }
}
