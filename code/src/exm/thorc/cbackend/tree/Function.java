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
package exm.thorc.cbackend.tree;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.thorc.common.exceptions.ThorRuntimeError;

/**
 * C function definition, or a prototype if there is no body
 */
public class Function extends CTree
{
  private final String returnType;
  private final String name;
  /** Declarators such as "int* x" */
  private final List<String> params;
  private final Sequence body;
  private final boolean isStatic;

  public Function(String returnType, String name, List<String> params,
                  Sequence body, boolean isStatic)
  {
    checkCFunctionName(name);
    this.returnType = returnType;
    this.name = name;
    this.params = new ArrayList<String>(params);
    this.body = body;
    this.isStatic = isStatic;
  }

  public static Function prototype(String returnType, String name,
                                   List<String> params)
  {
    return new Function(returnType, name, params, null, false);
  }

  public String name() {
    return name;
  }

  public Sequence getBody() {
    return body;
  }

  /**
   * Check that there are no invalid characters
   */
  private static void checkCFunctionName(String name) {
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (!(Character.isLetter(c) || c == '_' ||
            (i > 0 && Character.isDigit(c)))) {
        throw new ThorRuntimeError("Bad character '" + c +
                                  "' in C function name " + name);
      }
    }
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    if (isStatic)
      sb.append("static ");
    sb.append(returnType);
    sb.append(' ');
    sb.append(name);
    sb.append('(');
    if (params.isEmpty()) {
      sb.append("void");
    } else {
      sb.append(StringUtils.join(params, ", "));
    }
    sb.append(')');
    if (body == null) {
      sb.append(";\n");
    } else {
      sb.append(' ');
      body.setIndentation(indentation);
      body.appendToAsBlock(sb);
      sb.append("\n\n");
    }
  }
}
