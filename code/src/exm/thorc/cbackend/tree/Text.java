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
package exm.thorc.cbackend.tree;

/**
 * Fixed lines of C, e.g. #include directives.  Each line is indented
 * to the current level; blank lines stay blank.
 */
public class Text extends CTree
{
  private final String[] lines;

  public Text(String... lines)
  {
    this.lines = lines;
  }

  /**
   * @return an empty line
   */
  public static Text blank()
  {
    return new Text("");
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    for (String line: lines)
    {
      if (line.length() > 0)
        indent(sb);
      sb.append(line);
      sb.append('\n');
    }
  }
}
