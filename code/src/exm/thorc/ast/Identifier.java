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

/**
 * A name, optionally qualified with one module prefix, e.g. std::println
 */
public class Identifier extends Expression {
  /** null if unqualified */
  private final String qualifier;
  private final String name;

  public Identifier(FilePosition pos, String name) {
    this(pos, null, name);
  }

  public Identifier(FilePosition pos, String qualifier, String name) {
    super(pos);
    this.qualifier = qualifier;
    this.name = name;
  }

  public String getQualifier() {
    return qualifier;
  }

  public String getName() {
    return name;
  }

  public boolean isQualified() {
    return qualifier != null;
  }

  /**
   * @return name as written, using :: for the qualifier
   */
  public String fullName() {
    return qualifier == null ? name : qualifier + "::" + name;
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitIdentifier(this);
  }
}
