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

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import exm.thorc.cbackend.tree.Token;
import exm.thorc.common.exceptions.ThorRuntimeError;
import exm.thorc.common.lang.Types;
import exm.thorc.common.lang.Types.Type;

public class FormatStringsTest {

  @Test
  public void testPlaceholdersFollowArgumentTypes() {
    assertEquals("Hello, %s! You are %g.",
        FormatStrings.convert("Hello, %s! You are %s.",
                              Arrays.<Type>asList(Types.STRING, Types.INT)));
    assertEquals("%g and %s",
        FormatStrings.convert("%s and %s",
                              Arrays.<Type>asList(Types.FLOAT, Types.BOOL)));
  }

  @Test
  public void testEscaping() {
    // Other percent signs are literal in Thor
    assertEquals("100%% %g",
        FormatStrings.convert("100% %s",
                              Arrays.<Type>asList(Types.INT)));
    assertEquals("%%d", FormatStrings.convert("%d",
                                  Collections.<Type>emptyList()));
    // Missing argument: placeholder printed verbatim
    assertEquals("%s %%s", FormatStrings.convert("%s %s",
                                  Arrays.<Type>asList(Types.STRING)));
  }

  @Test
  public void testCountPlaceholders() {
    assertEquals(0, FormatStrings.countPlaceholders("no args"));
    assertEquals(2, FormatStrings.countPlaceholders("%s-%s"));
    assertEquals(1, FormatStrings.countPlaceholders("%%s"));
  }

  @Test
  public void testArguments() {
    Token x = new Token("x");
    assertEquals("(double)(x)",
                 FormatStrings.argument(x, Types.INT).toString());
    assertEquals("(x ? \"true\" : \"false\")",
                 FormatStrings.argument(x, Types.BOOL).toString());
    assertEquals("x", FormatStrings.argument(x, Types.STRING).toString());
  }

  @Test(expected=ThorRuntimeError.class)
  public void testUnknownArgument() {
    FormatStrings.argument(new Token("x"), Types.UNKNOWN);
  }
}
