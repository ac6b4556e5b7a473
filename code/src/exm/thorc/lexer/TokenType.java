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

public enum TokenType {
  // Literals
  INT_LITERAL(null),
  FLOAT_LITERAL(null),
  STRING_LITERAL(null),
  IDENTIFIER(null),

  // Keywords: spelling lives in Keywords
  INT(null),
  FLOAT(null),
  STRING(null),
  BOOL(null),
  VOID(null),
  IF(null),
  ELSE(null),
  WHILE(null),
  FOR(null),
  RETURN(null),
  TRUE(null),
  FALSE(null),
  IMPORT(null),
  EXTERN(null),
  PACKAGE(null),

  // Operators
  PLUS("+"),
  MINUS("-"),
  MULTIPLY("*"),
  DIVIDE("/"),
  MODULO("%"),
  ASSIGN("="),
  EQUAL("=="),
  NOT_EQUAL("!="),
  LESS("<"),
  LESS_EQUAL("<="),
  GREATER(">"),
  GREATER_EQUAL(">="),
  AND("&&"),
  OR("||"),
  NOT("!"),
  AMPERSAND("&"),
  DOUBLE_COLON("::"),
  ARROW("->"),
  DOT("."),

  // Delimiters
  LPAREN("("),
  RPAREN(")"),
  LBRACE("{"),
  RBRACE("}"),
  LBRACKET("["),
  RBRACKET("]"),
  SEMICOLON(";"),
  COMMA(","),
  COLON(":"),

  EOF(null),
  INVALID(null);

  /** Fixed spelling of operators and delimiters, null otherwise */
  private final String symbol;

  private TokenType(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  public boolean isKeyword() {
    return Keywords.isKeyword(this);
  }

  /**
   * @return name for use in messages, e.g. 'while' or ';'
   */
  public String displayName() {
    if (symbol != null) {
      return "'" + symbol + "'";
    }
    String kw = Keywords.spelling(this);
    if (kw != null) {
      return "'" + kw + "'";
    }
    switch (this) {
      case INT_LITERAL:
        return "integer literal";
      case FLOAT_LITERAL:
        return "float literal";
      case STRING_LITERAL:
        return "string literal";
      case IDENTIFIER:
        return "identifier";
      case EOF:
        return "end of input";
      default:
        return "invalid token";
    }
  }
}
