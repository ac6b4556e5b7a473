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

import exm.thorc.common.lang.Types;
import exm.thorc.common.lang.Types.Type;

public class Parameter {
  private final FilePosition pos;
  private final Type type;
  private final String name;

  public Parameter(FilePosition pos, Type type, String name) {
    this.pos = pos;
    this.type = type;
    this.name = name;
  }

  public FilePosition getPosition() {
    return pos;
  }

  public Type getType() {
    return type;
  }

  public String getName() {
    return name;
  }

  public boolean isReference() {
    return Types.isRef(type);
  }
}
