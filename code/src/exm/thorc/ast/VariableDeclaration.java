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

import exm.thorc.common.lang.Types.Type;

public class VariableDeclaration extends Statement {
  private final Type declType;
  private final String name;
  /** null if no initializer */
  private final Expression initializer;

  public VariableDeclaration(FilePosition pos, Type declType, String name,
                             Expression initializer) {
    super(pos);
    this.declType = declType;
    this.name = name;
    this.initializer = initializer;
  }

  public Type getDeclType() {
    return declType;
  }

  public String getName() {
    return name;
  }

  public Expression getInitializer() {
    return initializer;
  }

  @Override
  public <R> R accept(StmtVisitor<R> visitor) {
    return visitor.visitVariableDeclaration(this);
  }
}
