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

import java.util.ArrayList;
import java.util.List;

import exm.thorc.cbackend.tree.CString;
import exm.thorc.cbackend.tree.Cast;
import exm.thorc.cbackend.tree.Expression;
import exm.thorc.cbackend.tree.Ternary;
import exm.thorc.common.exceptions.ThorRuntimeError;
import exm.thorc.common.lang.Types;
import exm.thorc.common.lang.Types.Type;

/**
 * Rewrites Thor format strings into printf format strings.
 *
 * Thor only has the %s placeholder.  The n-th placeholder becomes %g
 * if the n-th argument is numeric, and stays %s otherwise.  Placeholders
 * without an argument and any other percent sign are escaped.
 */
public class FormatStrings {

  public static final String PLACEHOLDER = "%s";

  /**
   * @param format Thor format string, unescaped
   * @param argTypes
   * @return printf format string, unescaped
   */
  public static String convert(String format, List<Type> argTypes) {
    StringBuilder sb = new StringBuilder(format.length() + 8);
    int n = 0;
    int i = 0;
    while (i < format.length()) {
      char c = format.charAt(i);
      if (c == '%' && format.startsWith(PLACEHOLDER, i)) {
        if (n >= argTypes.size()) {
          // No argument: print the placeholder as written
          sb.append("%%s");
        } else if (Types.isNumeric(argTypes.get(n))) {
          sb.append("%g");
        } else {
          sb.append(PLACEHOLDER);
        }
        n++;
        i += PLACEHOLDER.length();
      } else if (c == '%') {
        sb.append("%%");
        i++;
      } else {
        sb.append(c);
        i++;
      }
    }
    return sb.toString();
  }

  /**
   * @param format
   * @return number of %s placeholders
   */
  public static int countPlaceholders(String format) {
    int count = 0;
    int i = format.indexOf(PLACEHOLDER);
    while (i >= 0) {
      count++;
      i = format.indexOf(PLACEHOLDER, i + PLACEHOLDER.length());
    }
    return count;
  }

  /**
   * Convert an argument to match the specifier chosen by convert():
   * numbers are promoted to double and bools printed as words
   * @param arg generated argument
   * @param type Thor type of argument
   */
  public static Expression argument(Expression arg, Type type) {
    if (Types.isUnknown(type)) {
      throw new ThorRuntimeError("Format argument with unknown type");
    }
    if (Types.isNumeric(type)) {
      return new Cast("double", arg);
    } else if (Types.isBool(type)) {
      return new Ternary(arg, new CString("true"), new CString("false"));
    }
    return arg;
  }

  public static List<Type> types(List<exm.thorc.ast.Expression> args) {
    List<Type> result = new ArrayList<Type>(args.size());
    for (exm.thorc.ast.Expression arg: args) {
      result.add(arg.getType());
    }
    return result;
  }
}
