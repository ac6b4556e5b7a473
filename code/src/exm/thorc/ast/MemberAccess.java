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
 * object.member.  Only used to qualify names with a module.
 */
public class MemberAccess extends Expression {
  private final Expression object;
  private final String member;

  public MemberAccess(FilePosition pos, Expression object, String member) {
    super(pos);
    this.object = object;
    this.member = member;
  }

  public Expression getObject() {
    return object;
  }

  public String getMember() {
    return member;
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitMemberAccess(this);
  }
}
