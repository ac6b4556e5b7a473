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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class LexerTest {

  private static List<Token> lex(String src) {
    Lexer lexer = new Lexer("test.thor", src);
    List<Token> tokens = lexer.tokenize();
    assertTrue("Unexpected lexical errors: " + lexer.errors(),
               lexer.errors().isEmpty());
    return tokens;
  }

  private static List<TokenType> types(List<Token> tokens) {
    List<TokenType> result = new ArrayList<TokenType>();
    for (Token t: tokens) {
      result.add(t.type);
    }
    return result;
  }

  @Test
  public void testEmptyInput() {
    List<Token> tokens = lex("");
    assertEquals(1, tokens.size());
    assertEquals(TokenType.EOF, tokens.get(0).type);
  }

  @Test
  public void testKeywordsAndIdentifiers() {
    assertEquals(Arrays.asList(TokenType.INT, TokenType.IDENTIFIER,
          TokenType.ASSIGN, TokenType.INT_LITERAL, TokenType.SEMICOLON,
          TokenType.EOF),
        types(lex("int count = 10;")));

    List<Token> tokens = lex("while whilst _x1");
    assertEquals(TokenType.WHILE, tokens.get(0).type);
    assertEquals(TokenType.IDENTIFIER, tokens.get(1).type);
    assertEquals("whilst", tokens.get(1).lexeme);
    assertEquals(TokenType.IDENTIFIER, tokens.get(2).type);
    assertEquals("_x1", tokens.get(2).lexeme);
  }

  @Test
  public void testNumbers() {
    List<Token> tokens = lex("42 3.14 1.2.3");
    assertEquals(TokenType.INT_LITERAL, tokens.get(0).type);
    assertEquals("42", tokens.get(0).lexeme);
    assertEquals(TokenType.FLOAT_LITERAL, tokens.get(1).type);
    assertEquals("3.14", tokens.get(1).lexeme);
    // Second decimal point ends the literal
    assertEquals(TokenType.FLOAT_LITERAL, tokens.get(2).type);
    assertEquals("1.2", tokens.get(2).lexeme);
    assertEquals(TokenType.DOT, tokens.get(3).type);
    assertEquals(TokenType.INT_LITERAL, tokens.get(4).type);
  }

  @Test
  public void testStringEscapes() {
    List<Token> tokens = lex("\"a\\tb\\n\\\"q\\\"\\\\\"");
    assertEquals(TokenType.STRING_LITERAL, tokens.get(0).type);
    assertEquals("a\tb\n\"q\"\\", tokens.get(0).lexeme);
  }

  @Test
  public void testTwoCharOperators() {
    assertEquals(Arrays.asList(TokenType.EQUAL, TokenType.NOT_EQUAL,
          TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL, TokenType.AND,
          TokenType.OR, TokenType.DOUBLE_COLON, TokenType.ARROW,
          TokenType.EOF),
        types(lex("== != <= >= && || :: ->")));
    assertEquals(Arrays.asList(TokenType.ASSIGN, TokenType.NOT,
          TokenType.LESS, TokenType.GREATER, TokenType.AMPERSAND,
          TokenType.COLON, TokenType.MINUS, TokenType.EOF),
        types(lex("= ! < > & : -")));
  }

  @Test
  public void testCommentsSkipped() {
    List<Token> tokens = lex("a // line comment\n/* block\n comment */ b");
    assertEquals(Arrays.asList(TokenType.IDENTIFIER, TokenType.IDENTIFIER,
                               TokenType.EOF), types(tokens));
    assertEquals(3, tokens.get(1).line);
  }

  @Test
  public void testPositions() {
    List<Token> tokens = lex("int x;\n  x = 1;");
    Token x2 = tokens.get(3);
    assertEquals("x", x2.lexeme);
    assertEquals(2, x2.line);
    assertEquals(3, x2.column);
    assertEquals(1, tokens.get(0).column);
  }

  @Test
  public void testInvalidCharacters() {
    List<Token> tokens = lex("a | b @");
    assertEquals(TokenType.INVALID, tokens.get(1).type);
    assertEquals("|", tokens.get(1).lexeme);
    assertEquals(TokenType.INVALID, tokens.get(3).type);
    assertEquals("@", tokens.get(3).lexeme);
  }

  @Test
  public void testUnterminatedString() {
    Lexer lexer = new Lexer("test.thor", "x = \"abc\ny = 1;");
    List<Token> tokens = lexer.tokenize();
    assertEquals(1, lexer.errors().size());
    assertTrue(lexer.errors().get(0).getMessage().contains(
                  "Unterminated string literal starting on line 1"));
    assertEquals(1, lexer.errors().get(0).getLine());
    assertEquals(5, lexer.errors().get(0).getColumn());
    assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type);
  }

  @Test
  public void testDisplayNames() {
    assertEquals("'while'", TokenType.WHILE.displayName());
    assertEquals("';'", TokenType.SEMICOLON.displayName());
    assertEquals("end of input", TokenType.EOF.displayName());
    assertTrue(TokenType.RETURN.isKeyword());
    assertTrue(!TokenType.PLUS.isKeyword());
  }
}
