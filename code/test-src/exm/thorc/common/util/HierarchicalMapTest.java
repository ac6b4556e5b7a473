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
package exm.thorc.common.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class HierarchicalMapTest {

  @Test
  public void testShadowing() {
    HierarchicalMap<String, Boolean> globals =
                              new HierarchicalMap<String, Boolean>();
    globals.put("x", false);

    HierarchicalMap<String, Boolean> fn = globals.makeChildMap();
    // Reference parameter with same name as global
    fn.put("x", true);
    assertTrue(fn.get("x"));
    assertFalse(globals.get("x"));
    assertEquals(0, fn.getDepth("x"));

    HierarchicalMap<String, Boolean> block = fn.makeChildMap();
    assertTrue(block.get("x"));
    assertEquals(1, block.getDepth("x"));
    assertFalse(block.containsLocal("x"));
    assertTrue(block.containsKey("x"));

    block.put("y", false);
    assertTrue(block.getParent() == fn);
    assertNull(fn.get("y"));
    assertEquals(-1, fn.getDepth("y"));
  }

  @Test
  public void testEmpty() {
    HierarchicalMap<String, Integer> m = new HierarchicalMap<String, Integer>();
    assertTrue(m.isEmpty());
    assertTrue(m.makeChildMap().isEmpty());
    m.put("a", 1);
    assertFalse(m.makeChildMap().isEmpty());
    assertEquals("{a:1}", m.makeChildMap().toString());
  }
}
