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

import exm.thorc.common.lang.Types.FunctionType;
import exm.thorc.common.lang.Types.Type;

/**
 * Shared parts of function and extern declarations.
 */
public abstract class FunctionSignature extends Statement {
  private final Type returnType;
  private final String name;
  private final List<Parameter> params;

  /**
   * Owning module, or null for the entry module.  Set when the
   * declaration is merged into the program.
   */
  private String module;

  protected FunctionSignature(FilePosition pos, Type returnType, String name,
                              List<Parameter> params) {
    super(pos);
    this.returnType = returnType;
    this.name = name;
    this.params = new ArrayList<Parameter>(params);
  }

  public Type getReturnType() {
    return returnType;
  }

  public String getName() {
    return name;
  }

  public List<Parameter> getParams() {
    return Collections.unmodifiableList(params);
  }

  public String getModule() {
    return module;
  }

  public void setModule(String module) {
    this.module = module;
  }

  public FunctionType functionType() {
    List<Type> inputs = new ArrayList<Type>(params.size());
    for (Parameter p: params) {
      inputs.add(p.getType());
    }
    return new FunctionType(inputs, returnType);
  }
}
