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

import org.apache.commons.lang3.StringUtils;

import exm.thorc.ast.ArrayLiteral;
import exm.thorc.ast.Assignment;
import exm.thorc.ast.BinaryExpression;
import exm.thorc.ast.Block;
import exm.thorc.ast.CallExpression;
import exm.thorc.ast.ExprVisitor;
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
import exm.thorc.ast.MemberAccess;
import exm.thorc.ast.PackageDecl;
import exm.thorc.ast.Parameter;
import exm.thorc.ast.Program;
import exm.thorc.ast.ReturnStatement;
import exm.thorc.ast.Statement;
import exm.thorc.ast.StmtVisitor;
import exm.thorc.ast.UnaryExpression;
import exm.thorc.ast.VariableDeclaration;
import exm.thorc.ast.WhileStatement;
import exm.thorc.common.Diagnostic;
import exm.thorc.common.Logging;
import exm.thorc.common.exceptions.ThorRuntimeError;
import exm.thorc.common.exceptions.TypeInferenceException;
import exm.thorc.common.exceptions.TypeMismatchException;
import exm.thorc.common.lang.Operators.BuiltinOpcode;
import exm.thorc.common.lang.Operators.UnaryOpcode;
import exm.thorc.common.lang.Types;
import exm.thorc.common.lang.Types.ArrayType;
import exm.thorc.common.lang.Types.Type;
import exm.thorc.common.util.HierarchicalMap;
import exm.thorc.frontend.FunctionTable.FunctionEntry;

/**
 * Fills in the type of every expression in a merged program.
 *
 * This is not a type checker: it works out just enough for the C
 * backend to pick C types, format specifiers and string comparison.
 * The one hard requirement is that no operand of arithmetic, a
 * comparison or a format argument is left with an unknown type.
 */
public class TypeInference implements ExprVisitor<Type>, StmtVisitor<Void> {

  private final List<TypeMismatchException> errors =
                                new ArrayList<TypeMismatchException>();
  private final List<Diagnostic> warnings = new ArrayList<Diagnostic>();

  private FunctionTable functions;

  /** Variable types in the current scope */
  private HierarchicalMap<String, Type> scope;

  /** Top-level variables, the root of every scope */
  private HierarchicalMap<String, Type> globals;

  /** Module of function being processed, null for entry module */
  private String currentModule;

  /** Function being processed, null for top-level code */
  private FunctionDecl currentFunction;

  public List<Diagnostic> warnings() {
    return Collections.unmodifiableList(warnings);
  }

  /**
   * @param program merged program
   * @return function table built for the program
   * @throws TypeInferenceException if any operand type stayed unknown
   */
  public FunctionTable infer(Program program) throws TypeInferenceException {
    errors.clear();
    warnings.clear();
    functions = FunctionTable.build(program);

    globals = new HierarchicalMap<String, Type>();
    // Globals are visible in every function regardless of order
    for (Statement stmt: program.getStatements()) {
      if (stmt instanceof VariableDeclaration) {
        VariableDeclaration decl = (VariableDeclaration)stmt;
        globals.put(decl.getName(), decl.getDeclType());
      }
    }

    scope = globals;
    for (Statement stmt: program.getStatements()) {
      currentModule = null;
      stmt.accept(this);
    }
    scope = null;

    if (!errors.isEmpty()) {
      throw new TypeInferenceException(errors);
    }
    return functions;
  }

  private void error(FilePosition pos, String msg) {
    errors.add(new TypeMismatchException(pos, msg));
  }

  private void warn(FilePosition pos, String msg) {
    warnings.add(Diagnostic.warning(pos, msg));
    Logging.uniqueWarn(pos + ": " + msg);
  }

  /**
   * Record error if operand type couldn't be inferred
   * @param operand
   * @param context e.g. "operand of +"
   * @return true if ok
   */
  private boolean checkKnown(Expression operand, String context) {
    if (Types.isUnknown(operand.getType())) {
      error(operand.getPosition(), "Could not determine type of " + context);
      return false;
    }
    return true;
  }

  private Type infer(Expression e) {
    Type t = e.accept(this);
    e.setType(t);
    return t;
  }

  private void enterScope() {
    scope = scope.makeChildMap();
  }

  private void exitScope() {
    scope = scope.getParent();
  }

  @Override
  public Type visitLiteral(Literal e) {
    return e.getKind().type();
  }

  @Override
  public Type visitIdentifier(Identifier e) {
    if (!e.isQualified()) {
      Type t = scope.get(e.getName());
      if (t != null) {
        // Reads of reference parameters see the referenced value
        return Types.derefResult(t);
      }
      FunctionEntry fn = functions.lookup(e.getName(), currentModule);
      if (fn != null) {
        return fn.type;
      }
    } else {
      FunctionEntry fn = functions.lookupQualified(e.getQualifier(),
                                                   e.getName());
      if (fn != null) {
        return fn.type;
      }
    }
    warn(e.getPosition(), "Unresolved identifier " + e.fullName());
    return Types.UNKNOWN;
  }

  @Override
  public Type visitBinary(BinaryExpression e) {
    BuiltinOpcode op = e.getOp();
    Type left = infer(e.getLeft());
    Type right = infer(e.getRight());
    String ctx = "operand of " + op.symbol();
    switch (op.kind()) {
      case ASSIGN:
        return left;
      case LOGICAL:
        return Types.BOOL;
      case ARITHMETIC: {
        boolean ok = checkKnown(e.getLeft(), ctx);
        ok = checkKnown(e.getRight(), ctx) && ok;
        if (!ok) {
          return Types.UNKNOWN;
        }
        if (Types.isNumeric(left) && Types.isNumeric(right)) {
          if (Types.isFloat(left) || Types.isFloat(right)) {
            return Types.FLOAT;
          }
          return Types.INT;
        }
        return left;
      }
      case COMPARISON:
      case EQUALITY:
        checkKnown(e.getLeft(), ctx);
        checkKnown(e.getRight(), ctx);
        return Types.BOOL;
      default:
        throw new ThorRuntimeError("Unexpected op kind " + op.kind());
    }
  }

  @Override
  public Type visitUnary(UnaryExpression e) {
    Type operand = infer(e.getOperand());
    if (e.getOp() == UnaryOpcode.NOT) {
      return Types.BOOL;
    }
    assert(e.getOp() == UnaryOpcode.NEGATE);
    checkKnown(e.getOperand(), "operand of unary -");
    return operand;
  }

  @Override
  public Type visitCall(CallExpression e) {
    for (Expression arg: e.getArgs()) {
      infer(arg);
    }

    Expression callee = e.getCallee();
    FunctionEntry fn = null;
    String displayName;
    if (callee instanceof Identifier) {
      Identifier id = (Identifier)callee;
      displayName = id.fullName();
      if (id.isQualified()) {
        fn = functions.lookupQualified(id.getQualifier(), id.getName());
      } else {
        fn = functions.lookup(id.getName(), currentModule);
        if (fn == null && functions.isAmbiguous(id.getName(),
                                                currentModule)) {
          error(e.getPosition(), "Call to " + id.getName() +
              " is ambiguous: defined in modules " +
              StringUtils.join(functions.definingModules(id.getName()),
                               ", "));
        }
      }
    } else if (callee instanceof MemberAccess &&
          ((MemberAccess)callee).getObject() instanceof Identifier) {
      MemberAccess ma = (MemberAccess)callee;
      String qualifier = ((Identifier)ma.getObject()).getName();
      displayName = qualifier + "." + ma.getMember();
      fn = functions.lookupQualified(qualifier, ma.getMember());
    } else {
      infer(callee);
      warn(e.getPosition(), "Call target is not a function name");
      return Types.UNKNOWN;
    }

    if (fn == null) {
      callee.setType(Types.UNKNOWN);
      warn(e.getPosition(), "Call to unknown function " + displayName);
      return Types.UNKNOWN;
    }
    callee.setType(fn.type);
    if (fn.type.getInputs().size() != e.getArgs().size()) {
      warn(e.getPosition(), "Function " + displayName + " expects " +
           fn.type.getInputs().size() + " argument(s) but got " +
           e.getArgs().size());
    }
    return Types.derefResult(fn.type.getOutput());
  }

  @Override
  public Type visitMemberAccess(MemberAccess e) {
    if (e.getObject() instanceof Identifier) {
      String qualifier = ((Identifier)e.getObject()).getName();
      FunctionEntry fn = functions.lookupQualified(qualifier, e.getMember());
      if (fn != null) {
        return fn.type;
      }
    } else {
      infer(e.getObject());
    }
    warn(e.getPosition(), "Unresolved member access ." + e.getMember());
    return Types.UNKNOWN;
  }

  @Override
  public Type visitArrayLiteral(ArrayLiteral e) {
    Type elem = Types.UNKNOWN;
    for (Expression x: e.getElements()) {
      Type t = infer(x);
      if (Types.isUnknown(elem)) {
        elem = t;
      }
    }
    return new ArrayType(elem);
  }

  @Override
  public Type visitFormatString(FormatString e) {
    int i = 1;
    for (Expression arg: e.getArgs()) {
      infer(arg);
      checkKnown(arg, "format argument " + i);
      i++;
    }
    return Types.STRING;
  }

  @Override
  public Void visitExpressionStatement(ExpressionStatement s) {
    infer(s.getExpr());
    return null;
  }

  @Override
  public Void visitVariableDeclaration(VariableDeclaration s) {
    if (s.getInitializer() != null) {
      infer(s.getInitializer());
      if (s.getInitializer() instanceof ArrayLiteral) {
        // Empty literals get element type from declaration
        s.getInitializer().setType(s.getDeclType());
      }
    }
    scope.put(s.getName(), s.getDeclType());
    return null;
  }

  @Override
  public Void visitAssignment(Assignment s) {
    infer(s.getTarget());
    infer(s.getValue());
    return null;
  }

  @Override
  public Void visitBlock(Block s) {
    enterScope();
    for (Statement stmt: s.getStatements()) {
      stmt.accept(this);
    }
    exitScope();
    return null;
  }

  @Override
  public Void visitIf(IfStatement s) {
    infer(s.getCondition());
    branch(s.getThenBranch());
    if (s.getElseBranch() != null) {
      branch(s.getElseBranch());
    }
    return null;
  }

  @Override
  public Void visitWhile(WhileStatement s) {
    infer(s.getCondition());
    branch(s.getBody());
    return null;
  }

  /**
   * A single statement branch gets its own scope, like in C
   */
  private void branch(Statement stmt) {
    enterScope();
    stmt.accept(this);
    exitScope();
  }

  @Override
  public Void visitReturn(ReturnStatement s) {
    if (s.getValue() != null) {
      infer(s.getValue());
      if (currentFunction != null &&
          Types.isRef(currentFunction.getReturnType())) {
        checkReferenceResult(s.getValue());
      }
    }
    return null;
  }

  /**
   * A reference result must outlive the call: only a reference
   * parameter or a global qualifies.
   */
  private void checkReferenceResult(Expression value) {
    String fn = currentFunction.getName();
    if (!(value instanceof Identifier) ||
        ((Identifier)value).isQualified()) {
      error(value.getPosition(), "Function " + fn + " returns a " +
            "reference: return a reference parameter or a global variable");
      return;
    }
    String name = ((Identifier)value).getName();
    if (!Types.isRef(scope.get(name)) && !isGlobal(name)) {
      error(value.getPosition(), "Function " + fn + " returns a " +
            "reference to " + name + ", which is neither a reference " +
            "parameter nor a global variable");
    }
  }

  /**
   * @return true if name refers to a global, not shadowed locally
   */
  private boolean isGlobal(String name) {
    HierarchicalMap<String, Type> curr = scope;
    while (curr != globals) {
      if (curr.containsLocal(name)) {
        return false;
      }
      curr = curr.getParent();
    }
    return globals.containsLocal(name);
  }

  @Override
  public Void visitFunctionDecl(FunctionDecl s) {
    if (!s.hasBody()) {
      return null;
    }
    currentModule = s.getModule();
    currentFunction = s;
    enterScope();
    for (Parameter p: s.getParams()) {
      scope.put(p.getName(), p.getType());
    }
    s.getBody().accept(this);
    exitScope();
    currentModule = null;
    currentFunction = null;
    return null;
  }

  @Override
  public Void visitExternDecl(ExternDecl s) {
    return null;
  }

  @Override
  public Void visitImport(ImportDecl s) {
    return null;
  }

  @Override
  public Void visitPackage(PackageDecl s) {
    return null;
  }
}
