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

/**
 * "text with %s placeholders" % [arg, ...]
 */
public class FormatString extends Expression {
  /** Unescaped format text */
  private final String format;
  private final List<Expression> args;

  public FormatString(FilePosition pos, String format,
                      List<Expression> args) {
    super(pos);
    this.format = format;
    this.args = new ArrayList<Expression>(args);
  }

  public String getFormat() {
    return format;
  }

  public List<Expression> getArgs() {
    return Collections.unmodifiableList(args);
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitFormatString(this);
  }
}
