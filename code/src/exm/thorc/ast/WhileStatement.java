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

public class WhileStatement extends Statement {
  private final Expression condition;
  private final Statement body;

  public WhileStatement(FilePosition pos, Expression condition,
                        Statement body) {
    super(pos);
    this.condition = condition;
    this.body = body;
  }

  public Expression getCondition() {
    return condition;
  }

  public Statement getBody() {
    return body;
  }

  @Override
  public <R> R accept(StmtVisitor<R> visitor) {
    return visitor.visitWhile(this);
  }
}
