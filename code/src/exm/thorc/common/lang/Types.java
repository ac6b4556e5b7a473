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
package exm.thorc.common.lang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import exm.thorc.common.exceptions.ThorRuntimeError;

/**
 * Semantic types of Thor values.
 *
 * The base class for types is Type.  All types are immutable and
 * compare structurally, so shared instances like {@link #INT} and freshly
 * built types can be mixed freely.
 */
public class Types {

  public static enum PrimType {
    VOID("void"),
    INT("int"),
    FLOAT("float"),
    STRING("string"),
    BOOL("bool");

    private final String keyword;

    private PrimType(String keyword) {
      this.keyword = keyword;
    }

    /** @return Thor keyword naming this type */
    public String keyword() {
      return keyword;
    }
  }

  public abstract static class Type {

    public PrimType primType() {
      throw new ThorRuntimeError("primType() not implemented " +
          "for class " + getClass().getName());
    }

    /**
     * @return element type of array or reference
     */
    public Type memberType() {
      throw new ThorRuntimeError("memberType() not implemented " +
          "for class " + getClass().getName());
    }

    /**
     * @return type name as written in Thor source
     */
    public abstract String typeName();

    @Override
    public String toString() {
      return typeName();
    }

    @Override
    public abstract boolean equals(Object other);

    @Override
    public abstract int hashCode();
  }

  /**
   * void, int, float, string and bool
   */
  public static class ScalarType extends Type {
    private final PrimType primType;

    private ScalarType(PrimType primType) {
      this.primType = primType;
    }

    @Override
    public PrimType primType() {
      return primType;
    }

    @Override
    public String typeName() {
      return primType.keyword();
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof ScalarType)) {
        return false;
      }
      return ((ScalarType)other).primType == primType;
    }

    @Override
    public int hashCode() {
      return primType.hashCode();
    }
  }

  public static class ArrayType extends Type {
    private final Type memberType;

    public ArrayType(Type memberType) {
      assert(memberType != null);
      this.memberType = memberType;
    }

    @Override
    public Type memberType() {
      return memberType;
    }

    @Override
    public String typeName() {
      return memberType.typeName() + "[]";
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof ArrayType)) {
        return false;
      }
      return memberType.equals(((ArrayType)other).memberType);
    }

    @Override
    public int hashCode() {
      return memberType.hashCode() * 17 + 1;
    }
  }

  /**
   * Pass-by-address type, written T& in source.
   */
  public static class RefType extends Type {
    private final Type referencedType;

    public RefType(Type referencedType) {
      assert(referencedType != null);
      this.referencedType = referencedType;
    }

    @Override
    public Type memberType() {
      return referencedType;
    }

    @Override
    public String typeName() {
      return referencedType.typeName() + "&";
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof RefType)) {
        return false;
      }
      return referencedType.equals(((RefType)other).referencedType);
    }

    @Override
    public int hashCode() {
      return referencedType.hashCode() * 17 + 2;
    }
  }

  public static class FunctionType extends Type {
    private final ArrayList<Type> inputs = new ArrayList<Type>();
    private final Type output;

    public FunctionType(List<Type> inputs, Type output) {
      this.inputs.addAll(inputs);
      this.output = output;
    }

    public List<Type> getInputs() {
      return Collections.unmodifiableList(inputs);
    }

    public Type getOutput() {
      return output;
    }

    @Override
    public String typeName() {
      StringBuilder sb = new StringBuilder(64);
      sb.append('(');
      for (Iterator<Type> it = inputs.iterator(); it.hasNext(); ) {
        sb.append(it.next().typeName());
        if (it.hasNext())
          sb.append(", ");
      }
      sb.append(") -> ");
      sb.append(output.typeName());
      return sb.toString();
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof FunctionType)) {
        return false;
      }
      FunctionType otherF = (FunctionType)other;
      return inputs.equals(otherF.inputs) && output.equals(otherF.output);
    }

    @Override
    public int hashCode() {
      return inputs.hashCode() * 31 + output.hashCode();
    }
  }

  /**
   * Placeholder before the typing pass has run.
   */
  public static class UnknownType extends Type {
    private UnknownType() {
    }

    @Override
    public String typeName() {
      return "<unknown>";
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof UnknownType;
    }

    @Override
    public int hashCode() {
      return 0;
    }
  }

  public static final Type VOID = new ScalarType(PrimType.VOID);
  public static final Type INT = new ScalarType(PrimType.INT);
  public static final Type FLOAT = new ScalarType(PrimType.FLOAT);
  public static final Type STRING = new ScalarType(PrimType.STRING);
  public static final Type BOOL = new ScalarType(PrimType.BOOL);
  public static final Type UNKNOWN = new UnknownType();

  public static Type scalar(PrimType primType) {
    switch (primType) {
      case VOID:
        return VOID;
      case INT:
        return INT;
      case FLOAT:
        return FLOAT;
      case STRING:
        return STRING;
      case BOOL:
        return BOOL;
      default:
        throw new ThorRuntimeError("Unknown prim type " + primType);
    }
  }

  public static boolean isPrim(PrimType primType, Type t) {
    return t instanceof ScalarType && t.primType() == primType;
  }

  public static boolean isInt(Type t) {
    return isPrim(PrimType.INT, t);
  }

  public static boolean isFloat(Type t) {
    return isPrim(PrimType.FLOAT, t);
  }

  public static boolean isString(Type t) {
    return isPrim(PrimType.STRING, t);
  }

  public static boolean isBool(Type t) {
    return isPrim(PrimType.BOOL, t);
  }

  public static boolean isVoid(Type t) {
    return isPrim(PrimType.VOID, t);
  }

  public static boolean isNumeric(Type t) {
    return isInt(t) || isFloat(t);
  }

  public static boolean isArray(Type t) {
    return t instanceof ArrayType;
  }

  public static boolean isRef(Type t) {
    return t instanceof RefType;
  }

  public static boolean isUnknown(Type t) {
    return t == null || t instanceof UnknownType;
  }

  /**
   * @return the referenced type if t is a reference, otherwise t
   */
  public static Type derefResult(Type t) {
    if (isRef(t)) {
      return t.memberType();
    }
    return t;
  }
}
