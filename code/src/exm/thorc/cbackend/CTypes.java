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

import exm.thorc.common.exceptions.ThorRuntimeError;
import exm.thorc.common.lang.Types;
import exm.thorc.common.lang.Types.FunctionType;
import exm.thorc.common.lang.Types.Type;

/**
 * Mapping from Thor types to C type names.
 */
public class CTypes {

  public static final String C_VOID = "void";
  public static final String C_INT = "int";
  public static final String C_FLOAT = "float";
  public static final String C_STRING = "char*";
  public static final String C_BOOL = "bool";

  /**
   * Arrays and references both become pointers to the member type.
   * Unknown types map to void: callers should warn before relying on it.
   * @param t
   * @return C type name
   */
  public static String cType(Type t) {
    if (Types.isUnknown(t)) {
      return C_VOID;
    }
    if (Types.isArray(t) || Types.isRef(t)) {
      return cType(t.memberType()) + "*";
    }
    if (t instanceof FunctionType) {
      throw new ThorRuntimeError("No C type for function type " + t);
    }
    switch (t.primType()) {
      case VOID:
        return C_VOID;
      case INT:
        return C_INT;
      case FLOAT:
        return C_FLOAT;
      case STRING:
        return C_STRING;
      case BOOL:
        return C_BOOL;
      default:
        throw new ThorRuntimeError("Unexpected type " + t);
    }
  }

  /**
   * @param t
   * @param name
   * @return declarator such as "int* x"
   */
  public static String declarator(Type t, String name) {
    return cType(t) + " " + name;
  }
}
