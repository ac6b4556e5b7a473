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
package exm.thorc.frontend;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.thorc.ast.Program;
import exm.thorc.common.Logging;
import exm.thorc.common.exceptions.InvalidSyntaxException;
import exm.thorc.common.exceptions.LexicalException;
import exm.thorc.common.exceptions.SyntaxErrorsException;
import exm.thorc.lexer.Lexer;
import exm.thorc.lexer.Token;

/**
 * Represents a parsed Thor source file
 */
public class ParsedModule {
  private static final Logger logger = Logging.getThorLogger();

  public final Program program;

  private ParsedModule(Program program) {
    this.program = program;
  }

  /**
   * Read and parse the specified file
   * @param path
   * @return
   * @throws IOException if file couldn't be read
   * @throws LexicalException
   * @throws SyntaxErrorsException
   */
  public static ParsedModule parse(String path) throws IOException,
                          LexicalException, SyntaxErrorsException {
    String source = FileUtils.readFileToString(new File(path),
                                               StandardCharsets.UTF_8);
    return parse(path, source);
  }

  /**
   * Parse in-memory source text
   * @param path nominal path for diagnostics
   * @param source
   * @return
   * @throws LexicalException on the first unterminated string
   * @throws SyntaxErrorsException if any statement failed to parse
   */
  public static ParsedModule parse(String path, String source)
                  throws LexicalException, SyntaxErrorsException {
    Lexer lexer = new Lexer(path, source);
    List<Token> tokens = lexer.tokenize();
    if (!lexer.errors().isEmpty()) {
      throw lexer.errors().get(0);
    }
    logger.trace("Lexed " + path + ": " + tokens.size() + " tokens");

    Parser parser = new Parser(path, tokens);
    Program program = parser.parse();
    if (parser.hasErrors()) {
      for (InvalidSyntaxException e: parser.errors()) {
        logger.debug("Syntax error: " + e.getMessage());
      }
      throw new SyntaxErrorsException(path, parser.errors());
    }
    return new ParsedModule(program);
  }
}
