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
import java.util.Iterator;
import java.util.List;

/**
 * Compound literal, e.g. (int[]){1, 2, 3} or (int){5}
 */
public class InitList extends Expression
{
  /** Type of compound literal, e.g. "int[]" */
  private final String type;
  private final List<Expression> items;

  private InitList(String type, List<? extends Expression> items)
  {
    this.type = type;
    this.items = new ArrayList<Expression>(items);
  }

  /**
   * @return (elemType[]){items}
   */
  public static InitList arrayLiteral(String elemType,
                                      List<? extends Expression> items)
  {
    return new InitList(elemType + "[]", items);
  }

  /**
   * @return (type){value}, an anonymous lvalue holding value
   */
  public static InitList scalarLiteral(String type, Expression value)
  {
    List<Expression> items = new ArrayList<Expression>(1);
    items.add(value);
    return new InitList(type, items);
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    sb.append('(');
    sb.append(type);
    sb.append(')');
    sb.append('{');
    Iterator<Expression> it = items.iterator();
    while (it.hasNext())
    {
      it.next().appendTo(sb);
      if (it.hasNext())
        sb.append(", ");
    }
    sb.append('}');
  }
}
