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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.thorc.ast.FilePosition;
import exm.thorc.common.exceptions.LexicalException;

/**
 * Single-pass scanner turning Thor source text into tokens.
 *
 * The lexer never throws: unrecognized characters become INVALID tokens
 * for the parser to report, and unterminated strings are also recorded
 * in {@link #errors()} so the caller can abort.
 */
public class Lexer {
  private final String file;
  private final String source;

  private final List<Token> tokens = new ArrayList<Token>();
  private final List<LexicalException> errors =
                                    new ArrayList<LexicalException>();

  private int pos = 0;
  private int line = 1;
  private int column = 1;

  /**
   * @param file name used in error positions
   * @param source
   */
  public Lexer(String file, String source) {
    this.file = file;
    this.source = source;
  }

  /**
   * @return tokens, ending with exactly one EOF token
   */
  public List<Token> tokenize() {
    tokens.clear();
    errors.clear();
    pos = 0;
    line = 1;
    column = 1;

    while (true) {
      skipWhitespaceAndComments();
      if (isAtEnd()) {
        break;
      }
      int startLine = line;
      int startCol = column;
      char c = peek();

      if (isDigit(c)) {
        number(startLine, startCol);
      } else if (isAlpha(c)) {
        identifier(startLine, startCol);
      } else if (c == '"') {
        string(startLine, startCol);
      } else {
        operator(startLine, startCol);
      }
    }

    tokens.add(new Token(TokenType.EOF, "", line, column));
    return Collections.unmodifiableList(tokens);
  }

  /**
   * @return lexical errors found by the last tokenize() call
   */
  public List<LexicalException> errors() {
    return Collections.unmodifiableList(errors);
  }

  private void skipWhitespaceAndComments() {
    while (!isAtEnd()) {
      char c = peek();
      if (Character.isWhitespace(c)) {
        advance();
      } else if (c == '/' && peekNext() == '/') {
        while (!isAtEnd() && peek() != '\n') {
          advance();
        }
      } else if (c == '/' && peekNext() == '*') {
        advance();
        advance();
        while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
          advance();
        }
        if (!isAtEnd()) {
          advance();
          advance();
        }
      } else {
        return;
      }
    }
  }

  /**
   * A second decimal point ends the literal
   */
  private void number(int startLine, int startCol) {
    StringBuilder sb = new StringBuilder();
    boolean hasDecimal = false;
    while (!isAtEnd() && (isDigit(peek()) || (peek() == '.' && !hasDecimal))) {
      if (peek() == '.') {
        hasDecimal = true;
      }
      sb.append(advance());
    }
    add(hasDecimal ? TokenType.FLOAT_LITERAL : TokenType.INT_LITERAL,
        sb.toString(), startLine, startCol);
  }

  private void identifier(int startLine, int startCol) {
    StringBuilder sb = new StringBuilder();
    while (!isAtEnd() && isAlphaNumeric(peek())) {
      sb.append(advance());
    }
    String text = sb.toString();
    TokenType kw = Keywords.lookup(text);
    add(kw != null ? kw : TokenType.IDENTIFIER, text, startLine, startCol);
  }

  private void string(int startLine, int startCol) {
    StringBuilder sb = new StringBuilder();
    advance(); // opening quote
    while (!isAtEnd() && peek() != '"') {
      char c = advance();
      if (c == '\\') {
        if (isAtEnd()) {
          break;
        }
        char esc = advance();
        switch (esc) {
          case 'n':
            sb.append('\n');
            break;
          case 't':
            sb.append('\t');
            break;
          case 'r':
            sb.append('\r');
            break;
          default:
            // covers \\ and \" too
            sb.append(esc);
            break;
        }
      } else {
        sb.append(c);
      }
    }

    if (isAtEnd()) {
      errors.add(new LexicalException(
          new FilePosition(file, startLine, startCol),
          "Unterminated string literal starting on line " + startLine));
      add(TokenType.INVALID, "\"" + sb.toString(), startLine, startCol);
      return;
    }
    advance(); // closing quote
    add(TokenType.STRING_LITERAL, sb.toString(), startLine, startCol);
  }

  private void operator(int startLine, int startCol) {
    char c = advance();
    switch (c) {
      case '+':
        add(TokenType.PLUS, startLine, startCol);
        break;
      case '-':
        addOneOrTwo('>', TokenType.ARROW, TokenType.MINUS,
                    startLine, startCol);
        break;
      case '*':
        add(TokenType.MULTIPLY, startLine, startCol);
        break;
      case '/':
        add(TokenType.DIVIDE, startLine, startCol);
        break;
      case '%':
        add(TokenType.MODULO, startLine, startCol);
        break;
      case '=':
        addOneOrTwo('=', TokenType.EQUAL, TokenType.ASSIGN,
                    startLine, startCol);
        break;
      case '!':
        addOneOrTwo('=', TokenType.NOT_EQUAL, TokenType.NOT,
                    startLine, startCol);
        break;
      case '<':
        addOneOrTwo('=', TokenType.LESS_EQUAL, TokenType.LESS,
                    startLine, startCol);
        break;
      case '>':
        addOneOrTwo('=', TokenType.GREATER_EQUAL, TokenType.GREATER,
                    startLine, startCol);
        break;
      case '&':
        addOneOrTwo('&', TokenType.AND, TokenType.AMPERSAND,
                    startLine, startCol);
        break;
      case '|':
        addOneOrTwo('|', TokenType.OR, TokenType.INVALID,
                    startLine, startCol);
        break;
      case ':':
        addOneOrTwo(':', TokenType.DOUBLE_COLON, TokenType.COLON,
                    startLine, startCol);
        break;
      case '.':
        add(TokenType.DOT, startLine, startCol);
        break;
      case '(':
        add(TokenType.LPAREN, startLine, startCol);
        break;
      case ')':
        add(TokenType.RPAREN, startLine, startCol);
        break;
      case '{':
        add(TokenType.LBRACE, startLine, startCol);
        break;
      case '}':
        add(TokenType.RBRACE, startLine, startCol);
        break;
      case '[':
        add(TokenType.LBRACKET, startLine, startCol);
        break;
      case ']':
        add(TokenType.RBRACKET, startLine, startCol);
        break;
      case ';':
        add(TokenType.SEMICOLON, startLine, startCol);
        break;
      case ',':
        add(TokenType.COMMA, startLine, startCol);
        break;
      default:
        add(TokenType.INVALID, String.valueOf(c), startLine, startCol);
        break;
    }
  }

  /**
   * Match two-character operator before its one-character prefix
   */
  private void addOneOrTwo(char second, TokenType twoChar, TokenType oneChar,
                           int startLine, int startCol) {
    if (!isAtEnd() && peek() == second) {
      advance();
      add(twoChar, startLine, startCol);
    } else if (oneChar == TokenType.INVALID) {
      add(TokenType.INVALID, source.substring(pos - 1, pos),
          startLine, startCol);
    } else {
      add(oneChar, startLine, startCol);
    }
  }

  private void add(TokenType type, int startLine, int startCol) {
    add(type, type.symbol(), startLine, startCol);
  }

  private void add(TokenType type, String lexeme, int startLine,
                   int startCol) {
    tokens.add(new Token(type, lexeme, startLine, startCol));
  }

  private boolean isAtEnd() {
    return pos >= source.length();
  }

  private char peek() {
    return source.charAt(pos);
  }

  private char peekNext() {
    if (pos + 1 >= source.length()) {
      return '\0';
    }
    return source.charAt(pos + 1);
  }

  private char advance() {
    char c = source.charAt(pos++);
    if (c == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    return c;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isAlpha(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isAlphaNumeric(char c) {
    return isAlpha(c) || isDigit(c);
  }
}
