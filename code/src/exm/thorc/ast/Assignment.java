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
 * name = value; at statement level
 */
public class Assignment extends Statement {
  private final Identifier target;
  private final Expression value;

  public Assignment(FilePosition pos, Identifier target, Expression value) {
    super(pos);
    this.target = target;
    this.value = value;
  }

  public Identifier getTarget() {
    return target;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public <R> R accept(StmtVisitor<R> visitor) {
    return visitor.visitAssignment(this);
  }
}
