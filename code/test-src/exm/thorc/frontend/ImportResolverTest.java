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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.thorc.ast.FunctionDecl;
import exm.thorc.ast.Program;
import exm.thorc.ast.Statement;
import exm.thorc.ast.VariableDeclaration;
import exm.thorc.common.Logging;
import exm.thorc.common.exceptions.ModuleLoadException;
import exm.thorc.common.exceptions.UserException;

public class ImportResolverTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging(null, false);
  }

  private File write(File dir, String name, String text) throws IOException {
    File f = new File(dir, name);
    FileUtils.writeStringToFile(f, text, StandardCharsets.UTF_8);
    return f;
  }

  private Program resolve(File main, String... searchPaths)
      throws IOException, UserException {
    return resolver(searchPaths).resolve(
        ParsedModule.parse(main.getPath()).program, main.getPath());
  }

  private static ImportResolver resolver(String... searchPaths) {
    return new ImportResolver(Arrays.asList(searchPaths), null);
  }

  private static List<String> functionNames(Program p) {
    List<String> names = new ArrayList<String>();
    for (Statement s: p.getStatements()) {
      if (s instanceof FunctionDecl) {
        FunctionDecl f = (FunctionDecl)s;
        names.add(f.getModule() + ":" + f.getName());
      }
    }
    return names;
  }

  @Test
  public void testMergeOrder() throws Exception {
    File dir = tmp.getRoot();
    write(dir, "util.thor", "package util;\n" +
                            "int square(int x) { return x * x; }\n");
    File main = write(dir, "prog.thor", "import \"util\";\n" +
                                        "int r = util.square(3);\n");
    Program merged = resolve(main);
    assertEquals("prog", merged.getModuleName());
    assertTrue(merged.getImports().isEmpty());
    assertEquals(2, merged.getStatements().size());
    assertEquals(Arrays.asList("util:square"), functionNames(merged));
    assertTrue(merged.getStatements().get(1) instanceof VariableDeclaration);
  }

  @Test
  public void testDiamondMergedOnce() throws Exception {
    File dir = tmp.getRoot();
    write(dir, "base.thor", "int one() { return 1; }\n");
    write(dir, "left.thor", "import \"base\";\nint two() { return 2; }\n");
    write(dir, "right.thor", "import \"base\";\nint three() { return 3; }\n");
    File main = write(dir, "top.thor",
                      "import \"left\";\nimport \"right\";\n");
    ImportResolver r = resolver();
    Program merged = r.resolve(ParsedModule.parse(main.getPath()).program,
                               main.getPath());
    assertEquals(Arrays.asList("base:one", "left:two", "right:three"),
                 functionNames(merged));
    assertEquals(1, r.warnings().size());
    assertTrue(r.warnings().get(0).message.contains("already imported"));
  }

  @Test
  public void testCircularImportWarns() throws Exception {
    File dir = tmp.getRoot();
    write(dir, "a.thor", "import \"b\";\nint fa() { return 1; }\n");
    write(dir, "b.thor", "import \"a\";\nint fb() { return 2; }\n");
    File main = write(dir, "main.thor", "import \"a\";\n");
    ImportResolver r = resolver();
    Program merged = r.resolve(ParsedModule.parse(main.getPath()).program,
                               main.getPath());
    assertEquals(Arrays.asList("b:fb", "a:fa"), functionNames(merged));
    assertEquals(1, r.warnings().size());
    assertTrue(r.warnings().get(0).message.contains("Circular import"));
  }

  @Test
  public void testBuiltinModule() throws Exception {
    File main = write(tmp.getRoot(), "hello.thor",
        "import std.io;\nimport std.io;\nstd.println(\"hi\");\n");
    Program merged = resolve(main);
    assertEquals(Arrays.asList("std:println", "std:input"),
                 functionNames(merged));
    for (Statement s: merged.getStatements()) {
      if (s instanceof FunctionDecl) {
        assertTrue(!((FunctionDecl)s).hasBody());
      }
    }
  }

  @Test
  public void testMissingModule() throws Exception {
    File main = write(tmp.getRoot(), "main.thor", "import \"nope\";\n");
    try {
      resolve(main);
      fail("Expected ModuleLoadException");
    } catch (ModuleLoadException e) {
      assertEquals("nope", e.getModuleName());
    }
  }

  @Test
  public void testSearchPath() throws Exception {
    File lib = tmp.newFolder("lib");
    File src = tmp.newFolder("src");
    write(lib, "geometry.thor", "package shapes;\n" +
                                "float area(float r) { return r * r; }\n");
    File main = write(src, "main.thor", "import geometry;\n");
    Program merged = resolve(main, lib.getPath());
    assertEquals(Arrays.asList("shapes:area"), functionNames(merged));
  }

  @Test
  public void testMainPackageUnmangled() throws Exception {
    File dir = tmp.getRoot();
    write(dir, "helpers.thor", "package main;\nint help() { return 0; }\n");
    File main = write(dir, "entry.thor", "import \"helpers\";\n" +
                                         "int local() { return 1; }\n");
    Program merged = resolve(main);
    FunctionDecl help = (FunctionDecl)merged.getStatements().get(0);
    FunctionDecl local = (FunctionDecl)merged.getStatements().get(1);
    assertNull(help.getModule());
    assertNull(local.getModule());
  }
}
