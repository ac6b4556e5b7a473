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

import java.util.List;

import exm.thorc.common.lang.Types.Type;

/**
 * Function definition, or a prototype if the body is null.
 */
public class FunctionDecl extends FunctionSignature {
  private final Block body;

  public FunctionDecl(FilePosition pos, Type returnType, String name,
                      List<Parameter> params, Block body) {
    super(pos, returnType, name, params);
    this.body = body;
  }

  public Block getBody() {
    return body;
  }

  public boolean hasBody() {
    return body != null;
  }

  @Override
  public <R> R accept(StmtVisitor<R> visitor) {
    return visitor.visitFunctionDecl(this);
  }
}
