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

/**
 * Variable declaration, e.g. int x = 1;
 */
public class Declaration extends CTree
{
  private final String type;
  private final String name;
  private final Expression init;

  /**
   * @param type C type
   * @param name
   * @param init initializer or null
   */
  public Declaration(String type, String name, Expression init)
  {
    this.type = type;
    this.name = name;
    this.init = init;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    sb.append(type);
    sb.append(' ');
    sb.append(name);
    if (init != null) {
      sb.append(" = ");
      init.appendTo(sb);
    }
    sb.append(";\n");
  }
}
