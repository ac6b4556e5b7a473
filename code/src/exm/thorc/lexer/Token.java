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
package exm.thorc.lexer;

/**
 * Immutable lexical token.  For string literals the lexeme is the
 * unescaped value, without quotes.
 */
public class Token {
  public final TokenType type;
  public final String lexeme;
  public final int line;
  public final int column;

  public Token(TokenType type, String lexeme, int line, int column) {
    this.type = type;
    this.lexeme = lexeme;
    this.line = line;
    this.column = column;
  }

  public boolean is(TokenType t) {
    return type == t;
  }

  /**
   * @return description for error messages
   */
  public String describe() {
    switch (type) {
      case IDENTIFIER:
        return "identifier '" + lexeme + "'";
      case INT_LITERAL:
      case FLOAT_LITERAL:
        return "number '" + lexeme + "'";
      case STRING_LITERAL:
        return "string \"" + lexeme + "\"";
      case INVALID:
        return "invalid token '" + lexeme + "'";
      default:
        return type.displayName();
    }
  }

  @Override
  public String toString() {
    return type.name() + "(" + lexeme + ")@" + line + ":" + column;
  }
}
