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

import org.junit.Test;

import exm.thorc.common.lang.Types;
import exm.thorc.common.lang.Types.ArrayType;
import exm.thorc.common.lang.Types.RefType;

public class CNamerTest {

  @Test
  public void testFunctionNames() {
    assertEquals("square", CNamer.functionName(null, "square"));
    assertEquals("math_square", CNamer.functionName("math", "square"));
    assertEquals("my_lib_f", CNamer.functionName("my-lib", "f"));
    assertEquals("_d_area", CNamer.functionName("2d", "area"));
  }

  @Test
  public void testReservedNames() {
    assertEquals("free_", CNamer.functionName(null, "free"));
    assertEquals("thor_toplevel_",
                 CNamer.functionName(null, CGenerator.TOPLEVEL_PROC));
    assertEquals("thor_println_", CNamer.functionName(null, "thor_println"));
    assertEquals("double_", CNamer.varName("double"));
    assertEquals("count", CNamer.varName("count"));
    // Mangled names can't clash with reserved ones
    assertEquals("std_free", CNamer.functionName("std", "free"));
  }

  @Test
  public void testLibraryNames() {
    assertTrue(CNamer.isLibraryName("printf"));
    assertTrue(CNamer.isLibraryName("strlen"));
    assertTrue(CNamer.isLibraryName("abs"));
    assertTrue(CNamer.isLibraryName("exit"));
    assertTrue(CNamer.isLibraryName("memcpy"));
    assertTrue(CNamer.isLibraryName("va_start"));
    assertFalse(CNamer.isLibraryName("clamp"));
    assertEquals("atoi_", CNamer.varName("atoi"));
    assertEquals("_Noreturn_", CNamer.varName("_Noreturn"));
  }

  @Test
  public void testCTypes() {
    assertEquals("char*", CTypes.cType(Types.STRING));
    assertEquals("bool", CTypes.cType(Types.BOOL));
    assertEquals("int*", CTypes.cType(new ArrayType(Types.INT)));
    assertEquals("float*", CTypes.cType(new RefType(Types.FLOAT)));
    assertEquals("char**", CTypes.cType(new ArrayType(Types.STRING)));
    assertEquals("void", CTypes.cType(Types.UNKNOWN));
    assertEquals("int* xs", CTypes.declarator(new ArrayType(Types.INT), "xs"));
  }
}
