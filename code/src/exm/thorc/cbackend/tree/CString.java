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
 * Double-quoted C string literal
 */
public class CString extends Expression
{
  private final String escaped;

  /**
   * @param unescaped string value
   */
  public CString(String unescaped)
  {
    this.escaped = cEscapeString(unescaped);
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    sb.append('"');
    sb.append(escaped);
    sb.append('"');
  }

  public static String cEscapeString(String unescaped) {
    StringBuilder escaped = new StringBuilder();
    for (int i = 0; i < unescaped.length(); i++) {
      char c = unescaped.charAt(i);
      switch (c) {
      case '\007':
        escaped.append("\\a");
        break;
      case '\b':
        escaped.append("\\b");
        break;
      case '\f':
        escaped.append("\\f");
        break;
      case '\n':
        escaped.append("\\n");
        break;
      case '\r':
        escaped.append("\\r");
        break;
      case '\t':
        escaped.append("\\t");
        break;
      case '\013':
        escaped.append("\\v");
        break;
      case '\\':
        escaped.append("\\\\");
        break;
      case '"':
        escaped.append("\\\"");
        break;
      default:
        if (Character.isISOControl(c)) {
          // Three digits so following digits aren't absorbed
          escaped.append(String.format("\\%03o", (int)c));
        } else {
          escaped.append(c);
        }
      }
    }
    return escaped.toString();
  }
}
