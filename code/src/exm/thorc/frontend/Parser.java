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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.thorc.ast.ArrayLiteral;
import exm.thorc.ast.Assignment;
import exm.thorc.ast.BinaryExpression;
import exm.thorc.ast.Block;
import exm.thorc.ast.CallExpression;
import exm.thorc.ast.Expression;
import exm.thorc.ast.ExpressionStatement;
import exm.thorc.ast.ExternDecl;
import exm.thorc.ast.FilePosition;
import exm.thorc.ast.FormatString;
import exm.thorc.ast.FunctionDecl;
import exm.thorc.ast.Identifier;
import exm.thorc.ast.IfStatement;
import exm.thorc.ast.ImportDecl;
import exm.thorc.ast.Literal;
import exm.thorc.ast.Literal.LiteralKind;
import exm.thorc.ast.MemberAccess;
import exm.thorc.ast.PackageDecl;
import exm.thorc.ast.Parameter;
import exm.thorc.ast.Program;
import exm.thorc.ast.ReturnStatement;
import exm.thorc.ast.Statement;
import exm.thorc.ast.UnaryExpression;
import exm.thorc.ast.VariableDeclaration;
import exm.thorc.ast.WhileStatement;
import exm.thorc.common.exceptions.InvalidSyntaxException;
import exm.thorc.common.lang.Operators;
import exm.thorc.common.lang.Operators.BuiltinOpcode;
import exm.thorc.common.lang.Operators.UnaryOpcode;
import exm.thorc.common.lang.Types;
import exm.thorc.common.lang.Types.ArrayType;
import exm.thorc.common.lang.Types.RefType;
import exm.thorc.common.lang.Types.Type;
import exm.thorc.lexer.Token;
import exm.thorc.lexer.TokenType;

/**
 * Recursive descent parser for Thor.
 *
 * Expressions are parsed with one method per precedence level, lowest
 * first: assignment, ||, &&, equality, relational, additive,
 * multiplicative, unary, postfix (call and member access), primary.
 * All binary levels are left-associative apart from assignment.
 *
 * Each statement is parsed under a recovery guard: after a syntax error
 * we skip past the next ';' or up to the next '}' and carry on, so that
 * one pass reports as many errors as possible.  Errors are available
 * from {@link #errors()} after {@link #parse()}.
 */
public class Parser {
  private final String file;
  private final List<Token> tokens;
  private int current = 0;

  private final List<InvalidSyntaxException> errors =
                          new ArrayList<InvalidSyntaxException>();

  /**
   * @param file name used in error positions
   * @param tokens token stream ending in EOF
   */
  public Parser(String file, List<Token> tokens) {
    assert(tokens.size() > 0 &&
           tokens.get(tokens.size() - 1).type == TokenType.EOF);
    this.file = file;
    this.tokens = tokens;
  }

  public List<InvalidSyntaxException> errors() {
    return Collections.unmodifiableList(errors);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /**
   * Parse whole token stream.  Never throws for user errors: check
   * errors() afterwards.
   * @return program containing everything that parsed successfully
   */
  public Program parse() {
    PackageDecl packageDecl = null;
    List<ImportDecl> imports = new ArrayList<ImportDecl>();
    List<Statement> statements = new ArrayList<Statement>();

    while (!check(TokenType.EOF)) {
      if (check(TokenType.RBRACE)) {
        errors.add(error(peek(), "Unexpected '}' at top level"));
        advance();
        continue;
      }
      try {
        if (check(TokenType.PACKAGE)) {
          PackageDecl decl = packageDeclaration();
          if (packageDecl != null) {
            throw new InvalidSyntaxException(decl.getPosition(),
                "Duplicate package declaration: already declared package " +
                packageDecl.getName());
          }
          packageDecl = decl;
        } else if (check(TokenType.IMPORT)) {
          imports.add(importDeclaration());
        } else {
          statements.add(statement(true));
        }
      } catch (InvalidSyntaxException e) {
        errors.add(e);
        synchronize();
      }
    }
    return new Program(file, packageDecl, imports, statements);
  }

  /**
   * Skip to a point where parsing can resume: just after ';',
   * or just before '}'
   */
  private void synchronize() {
    while (!check(TokenType.EOF)) {
      if (check(TokenType.SEMICOLON)) {
        advance();
        return;
      }
      if (check(TokenType.RBRACE)) {
        return;
      }
      advance();
    }
  }

  private PackageDecl packageDeclaration() throws InvalidSyntaxException {
    Token kw = consume(TokenType.PACKAGE, "Expected 'package'");
    Token name = consume(TokenType.IDENTIFIER,
                         "Expected package name after 'package'");
    consume(TokenType.SEMICOLON, "Expected ';' after package declaration");
    return new PackageDecl(pos(kw), name.lexeme);
  }

  /**
   * import "name";  or  import a.b;
   */
  private ImportDecl importDeclaration() throws InvalidSyntaxException {
    Token kw = consume(TokenType.IMPORT, "Expected 'import'");
    String moduleName;
    if (check(TokenType.STRING_LITERAL)) {
      moduleName = advance().lexeme;
    } else if (check(TokenType.IDENTIFIER)) {
      StringBuilder sb = new StringBuilder(advance().lexeme);
      while (match(TokenType.DOT)) {
        sb.append('.');
        sb.append(consume(TokenType.IDENTIFIER,
                          "Expected identifier in import path").lexeme);
      }
      moduleName = sb.toString();
    } else {
      throw error(peek(), "Expected module name after 'import', found "
                          + peek().describe());
    }
    consume(TokenType.SEMICOLON, "Expected ';' after import");
    return new ImportDecl(pos(kw), moduleName);
  }

  private Statement statement(boolean topLevel)
                              throws InvalidSyntaxException {
    Token start = peek();
    switch (start.type) {
      case EXTERN:
        if (!topLevel) {
          throw error(start, "extern declarations are only allowed " +
                             "at top level");
        }
        return externDeclaration();
      case IMPORT:
      case PACKAGE:
        throw error(start, start.type.displayName() +
                           " is only allowed at top level");
      case IF:
        return ifStatement();
      case WHILE:
        return whileStatement();
      case FOR:
        return forStatement();
      case RETURN:
        return returnStatement();
      case LBRACE:
        return block();
      default:
        break;
    }

    if (isTypeStart(start)) {
      return declaration(topLevel);
    }

    if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ASSIGN)) {
      Assignment a = assignmentStatement();
      consume(TokenType.SEMICOLON, "Expected ';' after assignment");
      return a;
    }

    Expression expr = expression();
    consume(TokenType.SEMICOLON, "Expected ';' after expression");
    return new ExpressionStatement(pos(start), expr);
  }

  /**
   * IDENT = expression, without the terminator
   */
  private Assignment assignmentStatement() throws InvalidSyntaxException {
    Token name = consume(TokenType.IDENTIFIER, "Expected identifier");
    consume(TokenType.ASSIGN, "Expected '='");
    Expression value = expression();
    return new Assignment(pos(name), new Identifier(pos(name), name.lexeme),
                          value);
  }

  /**
   * type name ( ... ) is a function, anything else a variable
   */
  private Statement declaration(boolean topLevel)
                                throws InvalidSyntaxException {
    Token start = peek();
    Type type = type();
    Token name = consume(TokenType.IDENTIFIER,
                         "Expected name after type " + type.typeName());
    if (check(TokenType.LPAREN)) {
      if (!topLevel) {
        throw error(name, "Function " + name.lexeme +
                          " must be declared at top level");
      }
      List<Parameter> params = parameters();
      Block body = null;
      if (!match(TokenType.SEMICOLON)) {
        if (!check(TokenType.LBRACE)) {
          throw error(peek(), "Expected function body or ';' after " +
                    "parameters of " + name.lexeme + ", found " +
                    peek().describe());
        }
        body = block();
      }
      return new FunctionDecl(pos(start), type, name.lexeme, params, body);
    }

    if (Types.isRef(type)) {
      throw error(start, "Variable " + name.lexeme + " can't have " +
                "reference type " + type.typeName() +
                ": references are only allowed for parameters and returns");
    }
    if (Types.isVoid(type)) {
      throw error(start, "Variable " + name.lexeme + " can't have type void");
    }
    Expression init = null;
    if (match(TokenType.ASSIGN)) {
      init = expression();
    }
    consume(TokenType.SEMICOLON, "Expected ';' after declaration of " +
                                 name.lexeme);
    return new VariableDeclaration(pos(start), type, name.lexeme, init);
  }

  private ExternDecl externDeclaration() throws InvalidSyntaxException {
    Token kw = consume(TokenType.EXTERN, "Expected 'extern'");
    Type type = type();
    Token name = consume(TokenType.IDENTIFIER,
                         "Expected function name in extern declaration");
    List<Parameter> params = parameters();
    consume(TokenType.SEMICOLON, "Expected ';' after extern declaration");
    return new ExternDecl(pos(kw), type, name.lexeme, params);
  }

  private List<Parameter> parameters() throws InvalidSyntaxException {
    consume(TokenType.LPAREN, "Expected '('");
    List<Parameter> params = new ArrayList<Parameter>();
    if (!check(TokenType.RPAREN)) {
      do {
        Token start = peek();
        Type type = type();
        Token name = consume(TokenType.IDENTIFIER, "Expected parameter name");
        params.add(new Parameter(pos(start), type, name.lexeme));
      } while (match(TokenType.COMMA));
    }
    consume(TokenType.RPAREN, "Expected ')' after parameters");
    return params;
  }

  /**
   * base ('[' ']')* '&'?
   */
  private Type type() throws InvalidSyntaxException {
    Token t = peek();
    Type result;
    switch (t.type) {
      case INT:
        result = Types.INT;
        break;
      case FLOAT:
        result = Types.FLOAT;
        break;
      case STRING:
        result = Types.STRING;
        break;
      case BOOL:
        result = Types.BOOL;
        break;
      case VOID:
        result = Types.VOID;
        break;
      default:
        throw error(t, "Expected type, found " + t.describe());
    }
    advance();
    while (match(TokenType.LBRACKET)) {
      consume(TokenType.RBRACKET, "Expected ']' in array type");
      result = new ArrayType(result);
    }
    if (match(TokenType.AMPERSAND)) {
      result = new RefType(result);
    }
    return result;
  }

  private Block block() throws InvalidSyntaxException {
    Token open = consume(TokenType.LBRACE, "Expected '{'");
    List<Statement> stmts = new ArrayList<Statement>();
    while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
      try {
        stmts.add(statement(false));
      } catch (InvalidSyntaxException e) {
        errors.add(e);
        synchronize();
      }
    }
    consume(TokenType.RBRACE, "Expected '}' to close block opened on line "
                              + open.line);
    return new Block(pos(open), stmts);
  }

  private IfStatement ifStatement() throws InvalidSyntaxException {
    Token kw = consume(TokenType.IF, "Expected 'if'");
    consume(TokenType.LPAREN, "Expected '(' after 'if'");
    Expression cond = expression();
    consume(TokenType.RPAREN, "Expected ')' after if condition");
    Statement thenBranch = statement(false);
    Statement elseBranch = null;
    // Binds to nearest if
    if (match(TokenType.ELSE)) {
      elseBranch = statement(false);
    }
    return new IfStatement(pos(kw), cond, thenBranch, elseBranch);
  }

  private WhileStatement whileStatement() throws InvalidSyntaxException {
    Token kw = consume(TokenType.WHILE, "Expected 'while'");
    consume(TokenType.LPAREN, "Expected '(' after 'while'");
    Expression cond = expression();
    consume(TokenType.RPAREN, "Expected ')' after while condition");
    Statement body = statement(false);
    return new WhileStatement(pos(kw), cond, body);
  }

  /**
   * for (init; cond; step) body  is rewritten to
   * { init; while (cond) { body; step; } }
   */
  private Statement forStatement() throws InvalidSyntaxException {
    Token kw = consume(TokenType.FOR, "Expected 'for'");
    FilePosition forPos = pos(kw);
    consume(TokenType.LPAREN, "Expected '(' after 'for'");

    Statement init = null;
    if (!match(TokenType.SEMICOLON)) {
      Token start = peek();
      if (isTypeStart(start)) {
        init = declaration(false);
      } else if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ASSIGN)) {
        init = assignmentStatement();
        consume(TokenType.SEMICOLON, "Expected ';' after for initializer");
      } else {
        init = new ExpressionStatement(pos(start), expression());
        consume(TokenType.SEMICOLON, "Expected ';' after for initializer");
      }
    }

    Expression cond;
    if (check(TokenType.SEMICOLON)) {
      cond = new Literal(pos(peek()), LiteralKind.BOOL, "true");
    } else {
      cond = expression();
    }
    consume(TokenType.SEMICOLON, "Expected ';' after for condition");

    Statement step = null;
    if (!check(TokenType.RPAREN)) {
      Token start = peek();
      if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ASSIGN)) {
        step = assignmentStatement();
      } else {
        step = new ExpressionStatement(pos(start), expression());
      }
    }
    consume(TokenType.RPAREN, "Expected ')' after for clauses");

    Statement body = statement(false);

    List<Statement> loopBody = new ArrayList<Statement>();
    loopBody.add(body);
    if (step != null) {
      loopBody.add(step);
    }
    WhileStatement loop = new WhileStatement(forPos, cond,
                                  new Block(body.getPosition(), loopBody));
    List<Statement> outer = new ArrayList<Statement>();
    if (init != null) {
      outer.add(init);
    }
    outer.add(loop);
    return new Block(forPos, outer);
  }

  private ReturnStatement returnStatement() throws InvalidSyntaxException {
    Token kw = consume(TokenType.RETURN, "Expected 'return'");
    Expression value = null;
    if (!check(TokenType.SEMICOLON)) {
      value = expression();
    }
    consume(TokenType.SEMICOLON, "Expected ';' after return");
    return new ReturnStatement(pos(kw), value);
  }

  public Expression expression() throws InvalidSyntaxException {
    return assignment();
  }

  /**
   * Right-associative, target must be a plain identifier
   */
  private Expression assignment() throws InvalidSyntaxException {
    Expression left = logicalOr();
    if (check(TokenType.ASSIGN)) {
      Token eq = advance();
      if (!(left instanceof Identifier)) {
        throw error(eq, "Invalid assignment target: only variables " +
                        "can be assigned to");
      }
      Expression right = assignment();
      return new BinaryExpression(pos(eq), BuiltinOpcode.ASSIGN, left, right);
    }
    return left;
  }

  private Expression logicalOr() throws InvalidSyntaxException {
    Expression expr = logicalAnd();
    while (check(TokenType.OR)) {
      Token op = advance();
      expr = new BinaryExpression(pos(op), BuiltinOpcode.OR, expr,
                                  logicalAnd());
    }
    return expr;
  }

  private Expression logicalAnd() throws InvalidSyntaxException {
    Expression expr = equality();
    while (check(TokenType.AND)) {
      Token op = advance();
      expr = new BinaryExpression(pos(op), BuiltinOpcode.AND, expr,
                                  equality());
    }
    return expr;
  }

  private Expression equality() throws InvalidSyntaxException {
    Expression expr = relational();
    while (check(TokenType.EQUAL) || check(TokenType.NOT_EQUAL)) {
      Token op = advance();
      expr = new BinaryExpression(pos(op), binaryOp(op), expr, relational());
    }
    return expr;
  }

  private Expression relational() throws InvalidSyntaxException {
    Expression expr = additive();
    while (check(TokenType.LESS) || check(TokenType.LESS_EQUAL) ||
           check(TokenType.GREATER) || check(TokenType.GREATER_EQUAL)) {
      Token op = advance();
      expr = new BinaryExpression(pos(op), binaryOp(op), expr, additive());
    }
    return expr;
  }

  private Expression additive() throws InvalidSyntaxException {
    Expression expr = multiplicative();
    while (check(TokenType.PLUS) || check(TokenType.MINUS)) {
      Token op = advance();
      expr = new BinaryExpression(pos(op), binaryOp(op), expr,
                                  multiplicative());
    }
    return expr;
  }

  private Expression multiplicative() throws InvalidSyntaxException {
    Expression expr = unary();
    while (check(TokenType.MULTIPLY) || check(TokenType.DIVIDE) ||
           check(TokenType.MODULO)) {
      Token op = advance();
      expr = new BinaryExpression(pos(op), binaryOp(op), expr, unary());
    }
    return expr;
  }

  private Expression unary() throws InvalidSyntaxException {
    if (check(TokenType.NOT)) {
      Token op = advance();
      return new UnaryExpression(pos(op), UnaryOpcode.NOT, unary());
    } else if (check(TokenType.MINUS)) {
      Token op = advance();
      return new UnaryExpression(pos(op), UnaryOpcode.NEGATE, unary());
    }
    return postfix();
  }

  private Expression postfix() throws InvalidSyntaxException {
    Expression expr = primary();
    while (true) {
      if (check(TokenType.LPAREN)) {
        Token open = advance();
        List<Expression> args = expressionList(TokenType.RPAREN);
        consume(TokenType.RPAREN, "Expected ')' after arguments");
        expr = new CallExpression(pos(open), expr, args);
      } else if (check(TokenType.DOT)) {
        Token dot = advance();
        Token member = consume(TokenType.IDENTIFIER,
                               "Expected member name after '.'");
        expr = new MemberAccess(pos(dot), expr, member.lexeme);
      } else {
        return expr;
      }
    }
  }

  private Expression primary() throws InvalidSyntaxException {
    Token t = peek();
    switch (t.type) {
      case INT_LITERAL:
        advance();
        return new Literal(pos(t), LiteralKind.INT, t.lexeme);
      case FLOAT_LITERAL:
        advance();
        return new Literal(pos(t), LiteralKind.FLOAT, t.lexeme);
      case TRUE:
      case FALSE:
        advance();
        return new Literal(pos(t), LiteralKind.BOOL, t.lexeme);
      case STRING_LITERAL:
        advance();
        if (check(TokenType.MODULO) && checkNext(TokenType.LBRACKET)) {
          advance();
          advance();
          List<Expression> args = expressionList(TokenType.RBRACKET);
          consume(TokenType.RBRACKET, "Expected ']' after format arguments");
          return new FormatString(pos(t), t.lexeme, args);
        }
        return new Literal(pos(t), LiteralKind.STRING, t.lexeme);
      case IDENTIFIER: {
        advance();
        if (match(TokenType.DOUBLE_COLON)) {
          Token name = consume(TokenType.IDENTIFIER,
                               "Expected name after '::'");
          return new Identifier(pos(t), t.lexeme, name.lexeme);
        }
        return new Identifier(pos(t), t.lexeme);
      }
      case LPAREN: {
        advance();
        Expression inner = expression();
        consume(TokenType.RPAREN, "Expected ')' after expression");
        return inner;
      }
      case LBRACKET: {
        advance();
        List<Expression> elems = expressionList(TokenType.RBRACKET);
        consume(TokenType.RBRACKET, "Expected ']' after array elements");
        return new ArrayLiteral(pos(t), elems);
      }
      default:
        throw error(t, "Expected expression, found " + t.describe());
    }
  }

  /**
   * Possibly empty comma-separated list, not consuming the terminator
   */
  private List<Expression> expressionList(TokenType terminator)
                                          throws InvalidSyntaxException {
    List<Expression> exprs = new ArrayList<Expression>();
    if (!check(terminator)) {
      do {
        exprs.add(expression());
      } while (match(TokenType.COMMA));
    }
    return exprs;
  }

  private static BuiltinOpcode binaryOp(Token t) {
    BuiltinOpcode op = Operators.fromSymbol(t.lexeme);
    assert(op != null) : t;
    return op;
  }

  private static boolean isTypeStart(Token t) {
    switch (t.type) {
      case INT:
      case FLOAT:
      case STRING:
      case BOOL:
      case VOID:
        return true;
      default:
        return false;
    }
  }

  private Token peek() {
    return tokens.get(current);
  }

  private boolean check(TokenType type) {
    return peek().type == type;
  }

  private boolean checkNext(TokenType type) {
    if (current + 1 >= tokens.size()) {
      return false;
    }
    return tokens.get(current + 1).type == type;
  }

  /**
   * Never moves past EOF
   */
  private Token advance() {
    Token t = peek();
    if (t.type != TokenType.EOF) {
      current++;
    }
    return t;
  }

  private boolean match(TokenType type) {
    if (check(type)) {
      advance();
      return true;
    }
    return false;
  }

  private Token consume(TokenType type, String message)
                        throws InvalidSyntaxException {
    if (check(type)) {
      return advance();
    }
    throw error(peek(), message + ", found " + peek().describe());
  }

  private InvalidSyntaxException error(Token t, String message) {
    return new InvalidSyntaxException(pos(t), message);
  }

  private FilePosition pos(Token t) {
    return new FilePosition(file, t.line, t.column);
  }
}
