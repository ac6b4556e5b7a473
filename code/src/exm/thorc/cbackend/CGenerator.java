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
package exm.thorc.cbackend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.thorc.ast.ArrayLiteral;
import exm.thorc.ast.Assignment;
import exm.thorc.ast.BinaryExpression;
import exm.thorc.ast.CallExpression;
import exm.thorc.ast.ExprVisitor;
import exm.thorc.ast.ExpressionStatement;
import exm.thorc.ast.ExternDecl;
import exm.thorc.ast.FilePosition;
import exm.thorc.ast.FormatString;
import exm.thorc.ast.FunctionDecl;
import exm.thorc.ast.FunctionSignature;
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
import exm.thorc.cbackend.CRuntime.Helper;
import exm.thorc.cbackend.tree.BinOp;
import exm.thorc.cbackend.tree.Block;
import exm.thorc.cbackend.tree.CString;
import exm.thorc.cbackend.tree.Call;
import exm.thorc.cbackend.tree.Comment;
import exm.thorc.cbackend.tree.Declaration;
import exm.thorc.cbackend.tree.ExprStatement;
import exm.thorc.cbackend.tree.Expression;
import exm.thorc.cbackend.tree.Function;
import exm.thorc.cbackend.tree.If;
import exm.thorc.cbackend.tree.InitList;
import exm.thorc.cbackend.tree.Prefix;
import exm.thorc.cbackend.tree.Return;
import exm.thorc.cbackend.tree.Sequence;
import exm.thorc.cbackend.tree.Text;
import exm.thorc.cbackend.tree.Token;
import exm.thorc.cbackend.tree.WhileLoop;
import exm.thorc.common.Diagnostic;
import exm.thorc.common.Logging;
import exm.thorc.common.exceptions.ThorRuntimeError;
import exm.thorc.common.lang.Builtins;
import exm.thorc.common.lang.Builtins.BuiltinFunction;
import exm.thorc.common.lang.Operators.BuiltinOpcode;
import exm.thorc.common.lang.Operators.OpKind;
import exm.thorc.common.lang.Operators.UnaryOpcode;
import exm.thorc.common.lang.Types;
import exm.thorc.common.lang.Types.Type;
import exm.thorc.common.util.HierarchicalMap;
import exm.thorc.frontend.FunctionTable;
import exm.thorc.frontend.FunctionTable.FunctionEntry;
import exm.thorc.frontend.FunctionTable.FunctionKind;

/**
 * Generates a single C translation unit from a merged, typed program.
 *
 * The file is laid out as: header comment, includes, runtime helpers,
 * extern prototypes, forward declarations, globals, function
 * definitions and finally the code that runs top-level statements.
 *
 * Reference parameters are passed as pointers.  Inside the callee every
 * read of a reference parameter is dereferenced and every write goes
 * through the pointer; at the call site the address of the argument
 * is taken.
 */
public class CGenerator implements ExprVisitor<Expression>,
                                   StmtVisitor<Void> {

  public static final String MAIN_FUNCTION = "main";

  /** Holds top-level statements if the program defines main itself */
  public static final String TOPLEVEL_PROC = "thor_toplevel";

  private final Logger logger;
  private final boolean pruneRuntime;

  private final List<Diagnostic> warnings = new ArrayList<Diagnostic>();

  private FunctionTable functions;

  /** Global variable names, mapped to false */
  private HierarchicalMap<String, Boolean> globals;

  /**
   * Variables visible at the current point, mapped to true if they
   * are reference parameters
   */
  private HierarchicalMap<String, Boolean> scope;

  /** Where generated statements are added */
  private Sequence current;

  /** Function being generated, null for top-level code */
  private FunctionSignature currentFunction;

  /** Module of current function, null for the entry module */
  private String currentModule;

  /** True if top-level code goes in main, false if in thor_toplevel */
  private boolean toplevelInMain;

  /**
   * @param logger
   * @param pruneRuntime if true, only emit runtime helpers that
   *                     the program refers to
   */
  public CGenerator(Logger logger, boolean pruneRuntime) {
    this.logger = logger;
    this.pruneRuntime = pruneRuntime;
  }

  public List<Diagnostic> warnings() {
    return Collections.unmodifiableList(warnings);
  }

  /**
   * Generate from a program whose types have already been inferred
   */
  public String generate(Program program) {
    return generate(program, FunctionTable.build(program));
  }

  /**
   * @param program merged program after type inference
   * @param functions function table produced by type inference
   * @return C source text
   */
  public String generate(Program program, FunctionTable functions) {
    warnings.clear();
    this.functions = functions;
    this.globals = new HierarchicalMap<String, Boolean>();
    this.scope = globals;
    this.currentFunction = null;
    this.currentModule = null;

    List<ExternDecl> externs = new ArrayList<ExternDecl>();
    List<FunctionDecl> prototypes = new ArrayList<FunctionDecl>();
    List<FunctionDecl> definitions = new ArrayList<FunctionDecl>();
    List<VariableDeclaration> globalDecls =
                              new ArrayList<VariableDeclaration>();
    // Executable top-level code, including global initialization
    List<Statement> toplevel = new ArrayList<Statement>();
    FunctionDecl userMain = null;

    for (Statement stmt: program.getStatements()) {
      if (stmt instanceof ExternDecl) {
        externs.add((ExternDecl)stmt);
      } else if (stmt instanceof FunctionDecl) {
        FunctionDecl fd = (FunctionDecl)stmt;
        if (isBuiltinDecl(fd)) {
          continue;
        } else if (!fd.hasBody()) {
          prototypes.add(fd);
        } else {
          definitions.add(fd);
          if (fd.getModule() == null &&
              fd.getName().equals(MAIN_FUNCTION)) {
            userMain = fd;
          }
        }
      } else if (stmt instanceof ImportDecl ||
                 stmt instanceof PackageDecl) {
        // Resolved before code generation
        continue;
      } else {
        if (stmt instanceof VariableDeclaration) {
          VariableDeclaration decl = (VariableDeclaration)stmt;
          globalDecls.add(decl);
          globals.put(decl.getName(), false);
        }
        toplevel.add(stmt);
      }
    }

    Sequence file = new Sequence();
    file.add(new Comment("Generated by thorc from module " +
                         program.getModuleName()));
    file.add(Text.blank());
    file.add(CRuntime.includes());
    file.add(Text.blank());

    Set<Helper> helpers;
    if (pruneRuntime) {
      helpers = RuntimeUsage.find(program, functions);
    } else {
      helpers = EnumSet.allOf(Helper.class);
    }
    logger.debug("Runtime helpers: " + helpers);
    if (!helpers.isEmpty()) {
      file.add(new Comment("Runtime support"));
      for (Helper helper: helpers) {
        file.add(CRuntime.definition(helper));
      }
    }

    Set<String> defined = new HashSet<String>();
    for (FunctionDecl fd: definitions) {
      defined.add(cFunctionName(fd));
    }

    Sequence decls = new Sequence();
    Set<String> declared = new HashSet<String>();
    for (ExternDecl ed: externs) {
      if (CNamer.isLibraryName(ed.getName())) {
        logger.debug("Declaration of " + ed.getName() +
                     " comes from included headers");
      } else if (declared.add(ed.getName())) {
        decls.add(prototype(ed, ed.getName()));
      }
    }
    for (FunctionDecl fd: prototypes) {
      String name = cFunctionName(fd);
      if (!defined.contains(name) && declared.add(name)) {
        decls.add(prototype(fd, name));
      }
    }
    addSection(file, "External functions", decls);

    toplevelInMain = userMain == null;
    // Generate top-level code now so that we know if it is empty
    Sequence toplevelCode = new Sequence();
    current = toplevelCode;
    for (Statement stmt: toplevel) {
      if (stmt instanceof VariableDeclaration) {
        initGlobal((VariableDeclaration)stmt);
      } else {
        stmt.accept(this);
      }
    }
    boolean needToplevelProc = userMain != null && !toplevelCode.isEmpty();

    Sequence forward = new Sequence();
    for (FunctionDecl fd: definitions) {
      forward.add(prototype(fd, cFunctionName(fd)));
    }
    if (needToplevelProc) {
      forward.add(new Text("static void " + TOPLEVEL_PROC + "(void);"));
    }
    addSection(file, "Forward declarations", forward);

    Sequence globalCode = new Sequence();
    for (VariableDeclaration decl: globalDecls) {
      globalCode.add(globalDeclaration(decl));
    }
    addSection(file, "Globals", globalCode);

    for (FunctionDecl fd: definitions) {
      file.add(function(fd, fd == userMain && needToplevelProc));
    }

    if (userMain == null) {
      toplevelCode.add(new Return(new Token("0")));
      file.add(new Function(CTypes.C_INT, MAIN_FUNCTION,
                            new ArrayList<String>(), toplevelCode, false));
    } else if (needToplevelProc) {
      file.add(new Function(CTypes.C_VOID, TOPLEVEL_PROC,
                            new ArrayList<String>(), toplevelCode, true));
    }

    String result = file.toString();
    // Exactly one trailing newline
    while (result.endsWith("\n\n")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }

  private static void addSection(Sequence file, String title,
                                 Sequence contents) {
    if (!contents.isEmpty()) {
      file.add(new Comment(title));
      file.add(contents);
      file.add(Text.blank());
    }
  }

  private void warn(FilePosition pos, String msg) {
    Diagnostic d = Diagnostic.warning(pos, msg);
    if (!warnings.contains(d)) {
      warnings.add(d);
    }
    Logging.uniqueWarn(pos + ": " + msg);
  }

  /**
   * @return C type, warning if the type is unknown
   */
  private String cType(Type t, FilePosition pos) {
    if (Types.isUnknown(t)) {
      warn(pos, "Could not determine type, using void");
    }
    return CTypes.cType(t);
  }

  /**
   * Internal check: type inference should have rejected the program
   */
  private static void checkTyped(exm.thorc.ast.Expression e,
                                 String context) {
    if (Types.isUnknown(e.getType())) {
      throw new ThorRuntimeError(e.getPosition() + ": " + context +
                                 " has unknown type");
    }
  }

  private boolean isBuiltinDecl(FunctionDecl fd) {
    if (fd.getModule() == null) {
      return false;
    }
    FunctionEntry fn = functions.lookupQualified(fd.getModule(),
                                                 fd.getName());
    return fn != null && fn.kind == FunctionKind.BUILTIN;
  }

  private static String cFunctionName(FunctionSignature sig) {
    return CNamer.functionName(sig.getModule(), sig.getName());
  }

  private List<String> paramDeclarators(FunctionSignature sig) {
    List<String> result = new ArrayList<String>(sig.getParams().size());
    for (Parameter p: sig.getParams()) {
      result.add(cType(p.getType(), p.getPosition()) + " " +
                 CNamer.varName(p.getName()));
    }
    return result;
  }

  private Function prototype(FunctionSignature sig, String cName) {
    return Function.prototype(cType(sig.getReturnType(), sig.getPosition()),
                              cName, paramDeclarators(sig));
  }

  private Function function(FunctionDecl fd, boolean callToplevel) {
    logger.trace("Generating function " + fd.getName());
    currentFunction = fd;
    currentModule = fd.getModule();
    scope = globals.makeChildMap();
    List<String> params = paramDeclarators(fd);
    for (Parameter p: fd.getParams()) {
      scope.put(p.getName(), p.isReference());
    }

    Sequence body = new Sequence();
    if (callToplevel) {
      body.add(new ExprStatement(new Call(TOPLEVEL_PROC)));
    }
    // Function body shares the scope of the parameters, as in C
    statements(fd.getBody().getStatements(), body);

    Function result = new Function(cType(fd.getReturnType(),
                                         fd.getPosition()),
                                   cFunctionName(fd), params, body, false);
    currentFunction = null;
    currentModule = null;
    scope = globals;
    return result;
  }

  private void statements(List<Statement> stmts, Sequence target) {
    Sequence saved = current;
    current = target;
    for (Statement stmt: stmts) {
      stmt.accept(this);
    }
    current = saved;
  }

  /**
   * Globals with a constant initializer are initialized in place.
   * Others are initialized where the declaration appears in top-level
   * code, since C requires constant initializers at file scope.
   */
  private Declaration globalDeclaration(VariableDeclaration decl) {
    exm.thorc.ast.Expression init = decl.getInitializer();
    if (init == null || isConstant(init)) {
      return declaration(decl);
    }
    return new Declaration(cType(decl.getDeclType(), decl.getPosition()),
                           CNamer.varName(decl.getName()), null);
  }

  private void initGlobal(VariableDeclaration decl) {
    exm.thorc.ast.Expression init = decl.getInitializer();
    if (init == null || isConstant(init)) {
      return;
    }
    Expression value;
    if (init instanceof ArrayLiteral) {
      value = arrayLiteral((ArrayLiteral)init, decl.getDeclType());
    } else {
      value = expr(init);
    }
    current.add(ExprStatement.assign(
                  new Token(CNamer.varName(decl.getName())), value));
  }

  private static boolean isConstant(exm.thorc.ast.Expression e) {
    if (e instanceof Literal) {
      return true;
    } else if (e instanceof UnaryExpression) {
      UnaryExpression u = (UnaryExpression)e;
      return u.getOp() == UnaryOpcode.NEGATE &&
             u.getOperand() instanceof Literal;
    } else if (e instanceof ArrayLiteral) {
      for (exm.thorc.ast.Expression elem:
                                  ((ArrayLiteral)e).getElements()) {
        if (!isConstant(elem)) {
          return false;
        }
      }
      return true;
    }
    return false;
  }

  /**
   * Declaration of local, or global with constant initializer.
   * Array variables are pointers so they can be reassigned: an array
   * literal initializer points them at a compound literal.
   */
  private Declaration declaration(VariableDeclaration s) {
    String name = CNamer.varName(s.getName());
    Type t = s.getDeclType();
    exm.thorc.ast.Expression init = s.getInitializer();
    Expression value;
    if (init == null) {
      value = null;
    } else if (init instanceof ArrayLiteral) {
      value = arrayLiteral((ArrayLiteral)init, t);
    } else {
      value = expr(init);
    }
    return new Declaration(cType(t, s.getPosition()), name, value);
  }

  private Expression expr(exm.thorc.ast.Expression e) {
    return e.accept(this);
  }

  private List<Expression> exprs(List<exm.thorc.ast.Expression> es) {
    List<Expression> result = new ArrayList<Expression>(es.size());
    for (exm.thorc.ast.Expression e: es) {
      result.add(expr(e));
    }
    return result;
  }

  private boolean isRefVar(Identifier id) {
    if (id.isQualified()) {
      return false;
    }
    Boolean isRef = scope.get(id.getName());
    return isRef != null && isRef;
  }

  /**
   * @return assignable expression for variable
   */
  private Expression lvalue(Identifier id) {
    String name = CNamer.varName(id.getName());
    if (isRefVar(id)) {
      return new Token("*" + name);
    }
    return new Token(name);
  }

  /**
   * Pointer to pass for a reference parameter
   */
  private Expression reference(exm.thorc.ast.Expression arg,
                               Type refType) {
    if (arg instanceof Identifier && !((Identifier)arg).isQualified()) {
      Identifier id = (Identifier)arg;
      Token name = new Token(CNamer.varName(id.getName()));
      if (isRefVar(id)) {
        // Already a pointer
        return name;
      }
      return Prefix.addressOf(name);
    }
    warn(arg.getPosition(),
         "Reference argument is not a variable: passing a temporary");
    return Prefix.addressOf(InitList.scalarLiteral(
        cType(refType.memberType(), arg.getPosition()), expr(arg)));
  }

  /**
   * Compound literal of array, or NULL if empty since C has no empty
   * initializer list
   */
  private Expression arrayLiteral(ArrayLiteral e, Type arrayType) {
    if (e.getElements().isEmpty()) {
      return new Token("NULL");
    }
    Type elem = Types.isArray(arrayType) ? arrayType.memberType()
                                         : Types.UNKNOWN;
    return InitList.arrayLiteral(cType(elem, e.getPosition()),
                                 exprs(e.getElements()));
  }

  /**
   * @return true if comparison must be done with strcmp
   */
  static boolean isStringComparison(BinaryExpression e) {
    return e.getOp().kind() == OpKind.EQUALITY &&
           (Types.isString(e.getLeft().getType()) ||
            Types.isString(e.getRight().getType()));
  }

  /**
   * Resolve the target of a call the same way type inference does
   * @return entry, or null if not resolved
   */
  static FunctionEntry resolveCallee(FunctionTable functions,
          exm.thorc.ast.Expression callee, String callerModule) {
    if (callee instanceof Identifier) {
      Identifier id = (Identifier)callee;
      if (id.isQualified()) {
        return functions.lookupQualified(id.getQualifier(), id.getName());
      }
      return functions.lookup(id.getName(), callerModule);
    } else if (callee instanceof MemberAccess &&
               ((MemberAccess)callee).getObject() instanceof Identifier) {
      MemberAccess ma = (MemberAccess)callee;
      String qualifier = ((Identifier)ma.getObject()).getName();
      return functions.lookupQualified(qualifier, ma.getMember());
    }
    return null;
  }

  /**
   * @return runtime helper implementing a builtin, or null
   */
  static Helper builtinHelper(FunctionEntry fn) {
    assert(fn.kind == FunctionKind.BUILTIN);
    BuiltinFunction builtin = Builtins.lookup(Builtins.STD_PACKAGE,
                                              fn.name);
    if (builtin == null) {
      return null;
    }
    return Helper.fromSymbol(builtin.runtimeSymbol);
  }

  private String calleeName(FunctionEntry fn,
                            exm.thorc.ast.Expression callee) {
    if (fn != null) {
      switch (fn.kind) {
        case BUILTIN: {
          Helper h = builtinHelper(fn);
          if (h != null) {
            return h.symbol;
          }
          return fn.name;
        }
        case EXTERN:
          return fn.name;
        case DEFINED:
          return CNamer.functionName(fn.module, fn.name);
        default:
          throw new ThorRuntimeError("Unexpected function kind " + fn.kind);
      }
    }

    // Unresolved: assume it will be found at link time
    if (callee instanceof Identifier) {
      Identifier id = (Identifier)callee;
      if (id.isQualified()) {
        return CNamer.functionName(id.getQualifier(), id.getName());
      }
      return CNamer.varName(id.getName());
    } else if (callee instanceof MemberAccess &&
               ((MemberAccess)callee).getObject() instanceof Identifier) {
      MemberAccess ma = (MemberAccess)callee;
      return CNamer.functionName(((Identifier)ma.getObject()).getName(),
                                 ma.getMember());
    }
    throw new ThorRuntimeError(callee.getPosition() +
                               ": call target is not a function name");
  }

  @Override
  public Expression visitLiteral(Literal e) {
    switch (e.getKind()) {
      case INT:
      case FLOAT:
        return new Token(e.getValue());
      case BOOL:
        return new Token(e.boolValue() ? "true" : "false");
      case STRING:
        return new CString(e.getValue());
      default:
        throw new ThorRuntimeError("Unexpected literal " + e.getKind());
    }
  }

  @Override
  public Expression visitIdentifier(Identifier e) {
    if (e.isQualified()) {
      return new Token(CNamer.functionName(e.getQualifier(), e.getName()));
    }
    Token name = new Token(CNamer.varName(e.getName()));
    if (isRefVar(e)) {
      return Prefix.deref(name);
    }
    return name;
  }

  @Override
  public Expression visitBinary(BinaryExpression e) {
    BuiltinOpcode op = e.getOp();
    if (op == BuiltinOpcode.ASSIGN) {
      if (!(e.getLeft() instanceof Identifier)) {
        throw new ThorRuntimeError(e.getPosition() +
                                   ": assignment target is not a variable");
      }
      return new BinOp(op.symbol(), lvalue((Identifier)e.getLeft()),
                       expr(e.getRight()));
    }

    if (op.kind() != OpKind.LOGICAL) {
      checkTyped(e.getLeft(), "operand of " + op.symbol());
      checkTyped(e.getRight(), "operand of " + op.symbol());
    }
    Expression left = expr(e.getLeft());
    Expression right = expr(e.getRight());
    if (isStringComparison(e)) {
      Expression eq = CRuntime.stringEquals(left, right);
      if (op == BuiltinOpcode.NEQ) {
        return Prefix.unary(UnaryOpcode.NOT.symbol(), eq);
      }
      return eq;
    }
    return new BinOp(op.symbol(), left, right);
  }

  @Override
  public Expression visitUnary(UnaryExpression e) {
    if (e.getOp() == UnaryOpcode.NEGATE) {
      checkTyped(e.getOperand(), "operand of unary -");
    }
    return Prefix.unary(e.getOp().symbol(), expr(e.getOperand()));
  }

  @Override
  public Expression visitCall(CallExpression e) {
    FunctionEntry fn = resolveCallee(functions, e.getCallee(),
                                     currentModule);
    String name = calleeName(fn, e.getCallee());
    List<Type> inputs;
    if (fn != null) {
      inputs = fn.type.getInputs();
    } else {
      inputs = Collections.<Type>emptyList();
    }

    List<Expression> args = new ArrayList<Expression>(e.getArgs().size());
    for (int i = 0; i < e.getArgs().size(); i++) {
      exm.thorc.ast.Expression arg = e.getArgs().get(i);
      if (i < inputs.size() && Types.isRef(inputs.get(i))) {
        args.add(reference(arg, inputs.get(i)));
      } else {
        args.add(expr(arg));
      }
    }

    Expression call = new Call(name, args);
    if (fn != null && Types.isRef(fn.type.getOutput())) {
      return Prefix.deref(call);
    }
    return call;
  }

  @Override
  public Expression visitMemberAccess(MemberAccess e) {
    if (e.getObject() instanceof Identifier) {
      String qualifier = ((Identifier)e.getObject()).getName();
      return new Token(CNamer.functionName(qualifier, e.getMember()));
    }
    throw new ThorRuntimeError(e.getPosition() +
                    ": member access on expression is not supported");
  }

  @Override
  public Expression visitArrayLiteral(ArrayLiteral e) {
    return arrayLiteral(e, e.getType());
  }

  @Override
  public Expression visitFormatString(FormatString e) {
    int placeholders = FormatStrings.countPlaceholders(e.getFormat());
    if (placeholders != e.getArgs().size()) {
      warn(e.getPosition(), "Format string has " + placeholders +
           " placeholder(s) but " + e.getArgs().size() + " argument(s)");
    }

    List<Expression> args = new ArrayList<Expression>();
    args.add(new CString(FormatStrings.convert(e.getFormat(),
                                  FormatStrings.types(e.getArgs()))));
    // Surplus arguments are still evaluated, vsnprintf ignores them
    int i = 1;
    for (exm.thorc.ast.Expression arg: e.getArgs()) {
      checkTyped(arg, "format argument " + i);
      args.add(FormatStrings.argument(expr(arg), arg.getType()));
      i++;
    }
    return CRuntime.formatString(args);
  }

  @Override
  public Void visitExpressionStatement(ExpressionStatement s) {
    current.add(new ExprStatement(expr(s.getExpr())));
    return null;
  }

  @Override
  public Void visitVariableDeclaration(VariableDeclaration s) {
    current.add(declaration(s));
    scope.put(s.getName(), false);
    return null;
  }

  @Override
  public Void visitAssignment(Assignment s) {
    current.add(ExprStatement.assign(lvalue(s.getTarget()),
                                     expr(s.getValue())));
    return null;
  }

  @Override
  public Void visitBlock(exm.thorc.ast.Block s) {
    scope = scope.makeChildMap();
    Sequence body = new Sequence();
    statements(s.getStatements(), body);
    scope = scope.getParent();
    current.add(new Block(body));
    return null;
  }

  /**
   * Branch of if or while, in its own scope.  Blocks are flattened
   * into the braces that C requires anyway.
   */
  private Sequence branch(Statement stmt) {
    scope = scope.makeChildMap();
    Sequence body = new Sequence();
    if (stmt instanceof exm.thorc.ast.Block) {
      statements(((exm.thorc.ast.Block)stmt).getStatements(), body);
    } else {
      statements(Collections.singletonList(stmt), body);
    }
    scope = scope.getParent();
    return body;
  }

  @Override
  public Void visitIf(IfStatement s) {
    Expression cond = expr(s.getCondition());
    Sequence thenBlock = branch(s.getThenBranch());
    if (s.getElseBranch() == null) {
      current.add(new If(cond, thenBlock));
    } else {
      current.add(new If(cond, thenBlock, branch(s.getElseBranch())));
    }
    return null;
  }

  @Override
  public Void visitWhile(WhileStatement s) {
    Expression cond = expr(s.getCondition());
    current.add(new WhileLoop(cond, branch(s.getBody())));
    return null;
  }

  @Override
  public Void visitReturn(ReturnStatement s) {
    exm.thorc.ast.Expression value = s.getValue();
    if (value == null) {
      current.add(new Return(null));
    } else if (currentFunction == null) {
      topLevelReturn(s);
    } else if (Types.isRef(currentFunction.getReturnType())) {
      current.add(new Return(referenceResult(value)));
    } else {
      current.add(new Return(expr(value)));
    }
    return null;
  }

  /**
   * Return at top level ends the program.  In a synthesized main the
   * value becomes the exit status.
   */
  private void topLevelReturn(ReturnStatement s) {
    if (toplevelInMain) {
      current.add(new Return(expr(s.getValue())));
    } else {
      warn(s.getPosition(), "Return value ignored in top-level code");
      current.add(new ExprStatement(expr(s.getValue())));
      current.add(new Return(null));
    }
  }

  /**
   * Value returned from function with reference return type.  Type
   * inference has checked it is a reference parameter or a global.
   */
  private Expression referenceResult(exm.thorc.ast.Expression value) {
    if (!(value instanceof Identifier) ||
        ((Identifier)value).isQualified()) {
      throw new ThorRuntimeError(value.getPosition() +
                    ": reference result is not a variable");
    }
    Identifier id = (Identifier)value;
    Token name = new Token(CNamer.varName(id.getName()));
    if (isRefVar(id)) {
      return name;
    }
    return Prefix.addressOf(name);
  }

  @Override
  public Void visitFunctionDecl(FunctionDecl s) {
    throw new ThorRuntimeError(s.getPosition() +
                               ": nested function declaration");
  }

  @Override
  public Void visitExternDecl(ExternDecl s) {
    throw new ThorRuntimeError(s.getPosition() +
                               ": nested extern declaration");
  }

  @Override
  public Void visitImport(ImportDecl s) {
    throw new ThorRuntimeError(s.getPosition() + ": unresolved import");
  }

  @Override
  public Void visitPackage(PackageDecl s) {
    throw new ThorRuntimeError(s.getPosition() +
                               ": package declaration in statements");
  }
}
