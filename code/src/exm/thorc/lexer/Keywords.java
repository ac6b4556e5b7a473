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

import com.google.common.collect.ImmutableBiMap;

/**
 * Reserved words of Thor.  Both the lexer and token display names
 * read this table.
 */
public class Keywords {

  private static final ImmutableBiMap<String, TokenType> keywords =
      ImmutableBiMap.<String, TokenType>builder()
        .put("int", TokenType.INT)
        .put("float", TokenType.FLOAT)
        .put("string", TokenType.STRING)
        .put("bool", TokenType.BOOL)
        .put("void", TokenType.VOID)
        .put("if", TokenType.IF)
        .put("else", TokenType.ELSE)
        .put("while", TokenType.WHILE)
        .put("for", TokenType.FOR)
        .put("return", TokenType.RETURN)
        .put("true", TokenType.TRUE)
        .put("false", TokenType.FALSE)
        .put("import", TokenType.IMPORT)
        .put("extern", TokenType.EXTERN)
        .put("package", TokenType.PACKAGE)
        .build();

  /**
   * @param word
   * @return keyword token type, or null if not reserved
   */
  public static TokenType lookup(String word) {
    return keywords.get(word);
  }

  public static boolean isKeyword(TokenType type) {
    return keywords.containsValue(type);
  }

  /**
   * @param type
   * @return source spelling, or null if not a keyword
   */
  public static String spelling(TokenType type) {
    return keywords.inverse().get(type);
  }
}
