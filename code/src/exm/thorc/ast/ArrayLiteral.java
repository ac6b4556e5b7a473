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
package exm.thorc.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ArrayLiteral extends Expression {
  private final List<Expression> elements;

  public ArrayLiteral(FilePosition pos, List<Expression> elements) {
    super(pos);
    this.elements = new ArrayList<Expression>(elements);
  }

  public List<Expression> getElements() {
    return Collections.unmodifiableList(elements);
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitArrayLiteral(this);
  }
}
