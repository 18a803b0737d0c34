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
package exm.sfc.ast.parser;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import exm.sfc.ast.Expr;
import exm.sfc.ast.Expr.Constant;
import exm.sfc.ast.Expr.Constant.ConstType;
import exm.sfc.ast.FunctionDef;
import exm.sfc.ast.Module;
import exm.sfc.ast.SourceLocation;
import exm.sfc.ast.Stmt;
import exm.sfc.ast.Stmt.ExceptHandler;
import exm.sfc.ast.Stmt.IfBranch;
import exm.sfc.ast.parser.Token.TokenType;
import exm.sfc.common.exceptions.InvalidSyntaxException;
import exm.sfc.frontend.LogHelper;

/**
 * Recursive descent parser for the source dialect.  Produces an immutable
 * AST or fails with an InvalidSyntaxException at the first error.
 */
public class Parser {
  private static final Set<String> AUG_OPS = new HashSet<String>(
      Arrays.asList("+=", "-=", "*=", "/=", "//=", "%="));

  private static final Set<String> COMPARE_OPS = new HashSet<String>(
      Arrays.asList("<", ">", "==", ">=", "<=", "!="));

  /** Keywords starting constructs outside the dialect */
  private static final Set<String> UNSUPPORTED = new HashSet<String>(
      Arrays.asList("for", "with", "class", "lambda", "async", "await",
                    "yield", "global", "nonlocal", "del", "assert", "raise"));

  private final String file;
  private final List<Token> tokens;
  /** Source lines, for recovering function text */
  private final String[] lines;
  private int pos = 0;

  private Parser(String file, List<Token> tokens, String src) {
    this.file = file;
    this.tokens = tokens;
    this.lines = src.split("\r?\n", -1);
  }

  /**
   * Parse a complete source file
   * @param file file name for error messages
   * @param src source text
   * @return parsed module
   * @throws InvalidSyntaxException
   */
  public static Module parse(String file, String src)
                                  throws InvalidSyntaxException {
    List<Token> tokens = new Lexer(file, src).tokenize();
    LogHelper.debug(0, "Lexed " + file + ": " + tokens.size() + " tokens");
    return new Parser(file, tokens, src).module();
  }

  private Module module() throws InvalidSyntaxException {
    List<Stmt.Import> imports = new ArrayList<Stmt.Import>();
    List<FunctionDef> functions = new ArrayList<FunctionDef>();
    Set<String> names = new HashSet<String>();

    while (peek().type != TokenType.EOF) {
      Token tok = peek();
      if (tok.type == TokenType.NEWLINE) {
        next();
      } else if (tok.isKeyword("def")) {
        FunctionDef fn = functionDef();
        if (!names.add(fn.name)) {
          throw error(tok, "duplicate definition of function " + fn.name);
        }
        functions.add(fn);
      } else if (tok.isKeyword("import") || tok.isKeyword("from")) {
        imports.add(importStmt());
        expectNewline();
      } else if (tok.isOp("@")) {
        throw error(tok, "decorators are not supported");
      } else if (tok.type == TokenType.INDENT) {
        throw error(tok, "unexpected indent");
      } else {
        throw error(tok, "only imports and function definitions are " +
                         "allowed at module level");
      }
    }
    LogHelper.debug(0, "Parsed " + file + ": " + functions.size() +
                       " function(s)");
    return new Module(file, imports, functions);
  }

  private FunctionDef functionDef() throws InvalidSyntaxException {
    Token def = expectKeyword("def");
    String name = expectName().text;
    expectOp("(");
    List<String> params = new ArrayList<String>();
    if (!peek().isOp(")")) {
      while (true) {
        Token param = peek();
        if (param.isOp("*") || param.isOp("**")) {
          throw error(param, "variadic parameters are not supported");
        }
        String pname = expectName().text;
        if (peek().isOp("=")) {
          throw error(peek(), "default parameter values are not supported");
        }
        if (params.contains(pname)) {
          throw error(param, "duplicate parameter " + pname);
        }
        params.add(pname);
        if (!acceptOp(",") || peek().isOp(")")) {
          break;
        }
      }
    }
    expectOp(")");
    if (peek().isOp("->")) {
      throw error(peek(), "return annotations are not supported");
    }
    expectOp(":");
    List<Stmt> body = suite();
    return new FunctionDef(loc(def), name, params, body,
                           sourceText(def.line, nextContentLine() - 1));
  }

  /**
   * @return line of next token that isn't layout, or one past the last
   *         line at end of input
   */
  private int nextContentLine() {
    for (int i = pos; i < tokens.size(); i++) {
      Token tok = tokens.get(i);
      if (tok.type == TokenType.EOF) {
        break;
      } else if (tok.type != TokenType.NEWLINE &&
                 tok.type != TokenType.INDENT &&
                 tok.type != TokenType.DEDENT) {
        return tok.line;
      }
    }
    return lines.length + 1;
  }

  /**
   * Source lines first to last inclusive, without trailing blank lines
   */
  private String sourceText(int first, int last) {
    last = Math.min(last, lines.length);
    while (last > first && lines[last - 1].trim().isEmpty()) {
      last--;
    }
    StringBuilder sb = new StringBuilder();
    for (int line = first; line <= last; line++) {
      sb.append(lines[line - 1]).append('\n');
    }
    return sb.toString();
  }

  /**
   * Indented block or statements on same line after ':'
   */
  private List<Stmt> suite() throws InvalidSyntaxException {
    if (peek().type != TokenType.NEWLINE) {
      return simpleStatements();
    }
    next();
    Token indent = next();
    if (indent.type != TokenType.INDENT) {
      throw error(indent, "expected an indented block");
    }
    List<Stmt> stmts = new ArrayList<Stmt>();
    while (peek().type != TokenType.DEDENT) {
      stmts.addAll(statement());
    }
    next();
    return stmts;
  }

  private List<Stmt> statement() throws InvalidSyntaxException {
    Token tok = peek();
    if (tok.type == TokenType.KEYWORD) {
      if (tok.text.equals("if")) {
        return single(ifStmt());
      } else if (tok.text.equals("while")) {
        return single(whileStmt());
      } else if (tok.text.equals("try")) {
        return single(tryStmt());
      } else if (tok.text.equals("def")) {
        throw error(tok, "nested function definitions are not supported");
      }
    } else if (tok.type == TokenType.INDENT) {
      throw error(tok, "unexpected indent");
    } else if (tok.isOp("@")) {
      throw error(tok, "decorators are not supported");
    }
    return simpleStatements();
  }

  private static List<Stmt> single(Stmt stmt) {
    List<Stmt> result = new ArrayList<Stmt>(1);
    result.add(stmt);
    return result;
  }

  private List<Stmt> simpleStatements() throws InvalidSyntaxException {
    List<Stmt> stmts = new ArrayList<Stmt>();
    stmts.add(smallStatement());
    while (acceptOp(";")) {
      if (peek().type == TokenType.NEWLINE) {
        break;
      }
      stmts.add(smallStatement());
    }
    expectNewline();
    return stmts;
  }

  private Stmt smallStatement() throws InvalidSyntaxException {
    Token tok = peek();
    if (tok.type == TokenType.KEYWORD) {
      if (tok.text.equals("pass")) {
        next();
        return new Stmt.Pass(loc(tok));
      } else if (tok.text.equals("break")) {
        next();
        return new Stmt.Break(loc(tok));
      } else if (tok.text.equals("continue")) {
        next();
        return new Stmt.Continue(loc(tok));
      } else if (tok.text.equals("return")) {
        next();
        Expr value = null;
        if (peek().type != TokenType.NEWLINE && !peek().isOp(";")) {
          value = exprList();
        }
        return new Stmt.Return(loc(tok), value);
      } else if (tok.text.equals("import") || tok.text.equals("from")) {
        return importStmt();
      } else if (UNSUPPORTED.contains(tok.text)) {
        throw error(tok, "'" + tok.text + "' is not supported");
      } else if (tok.text.equals("elif") || tok.text.equals("else") ||
                 tok.text.equals("except") || tok.text.equals("finally")) {
        throw error(tok, "'" + tok.text + "' without matching statement");
      }
    }

    Expr expr = exprList();
    Token op = peek();
    if (op.isOp("=")) {
      next();
      checkTarget(expr);
      Expr value = exprList();
      if (peek().isOp("=")) {
        throw error(peek(), "chained assignment is not supported");
      }
      return new Stmt.Assign(expr.loc(), expr, value);
    } else if (op.type == TokenType.OP && AUG_OPS.contains(op.text)) {
      next();
      checkTarget(expr);
      Expr value = exprList();
      String binop = op.text.substring(0, op.text.length() - 1);
      return new Stmt.AugAssign(expr.loc(), expr, binop, value);
    } else if (op.type == TokenType.OP && op.text.endsWith("=") &&
               op.text.length() > 1 && !COMPARE_OPS.contains(op.text)) {
      throw error(op, "operator '" + op.text + "' is not supported");
    }
    return new Stmt.ExprStmt(expr.loc(), expr);
  }

  private void checkTarget(Expr target) throws InvalidSyntaxException {
    switch (target.type()) {
      case NAME:
      case ATTRIBUTE:
      case SUBSCRIPT:
        return;
      case TUPLE:
      case LIST:
        throw new InvalidSyntaxException(target.loc(),
                        "unpacking assignment is not supported");
      default:
        throw new InvalidSyntaxException(target.loc(),
                        "cannot assign to expression");
    }
  }

  private Stmt.Import importStmt() throws InvalidSyntaxException {
    Token first = next();
    StringBuilder text = new StringBuilder();
    if (first.isKeyword("import")) {
      text.append("import ");
      importNames(text, true);
    } else {
      text.append("from ");
      while (peek().isOp(".")) {
        next();
        text.append('.');
      }
      if (!peek().isKeyword("import")) {
        text.append(dottedName());
      }
      expectKeyword("import");
      text.append(" import ");
      if (acceptOp("*")) {
        text.append('*');
      } else {
        boolean paren = acceptOp("(");
        importNames(text, false);
        if (paren) {
          acceptOp(",");
          expectOp(")");
        }
      }
    }
    return new Stmt.Import(loc(first), text.toString());
  }

  private void importNames(StringBuilder text, boolean dotted)
                                          throws InvalidSyntaxException {
    boolean firstName = true;
    do {
      if (!firstName) {
        text.append(", ");
      }
      firstName = false;
      text.append(dotted ? dottedName() : expectName().text);
      if (peek().isKeyword("as")) {
        next();
        text.append(" as ").append(expectName().text);
      }
    } while (acceptOp(",") && peek().type == TokenType.NAME);
  }

  private String dottedName() throws InvalidSyntaxException {
    StringBuilder sb = new StringBuilder(expectName().text);
    while (acceptOp(".")) {
      sb.append('.').append(expectName().text);
    }
    return sb.toString();
  }

  private Stmt ifStmt() throws InvalidSyntaxException {
    Token ifTok = expectKeyword("if");
    List<IfBranch> branches = new ArrayList<IfBranch>();
    Expr cond = expr();
    expectOp(":");
    branches.add(new IfBranch(cond, suite()));

    List<Stmt> orelse = new ArrayList<Stmt>();
    while (true) {
      if (peek().isKeyword("elif")) {
        next();
        Expr elifCond = expr();
        expectOp(":");
        branches.add(new IfBranch(elifCond, suite()));
      } else if (peek().isKeyword("else")) {
        next();
        expectOp(":");
        orelse = suite();
        break;
      } else {
        break;
      }
    }
    return new Stmt.If(loc(ifTok), branches, orelse);
  }

  private Stmt whileStmt() throws InvalidSyntaxException {
    Token whileTok = expectKeyword("while");
    Expr cond = expr();
    expectOp(":");
    List<Stmt> body = suite();
    if (peek().isKeyword("else")) {
      throw error(peek(), "while ... else is not supported");
    }
    return new Stmt.While(loc(whileTok), new ArrayList<Stmt>(), cond, body);
  }

  private Stmt tryStmt() throws InvalidSyntaxException {
    Token tryTok = expectKeyword("try");
    expectOp(":");
    List<Stmt> body = suite();
    List<ExceptHandler> handlers = new ArrayList<ExceptHandler>();
    while (peek().isKeyword("except")) {
      handlers.add(exceptClause(handlers));
    }
    if (peek().isKeyword("finally")) {
      throw error(peek(), "finally clauses are not supported");
    }
    if (peek().isKeyword("else")) {
      throw error(peek(), "try ... else is not supported");
    }
    if (handlers.isEmpty()) {
      throw error(peek(), "expected 'except' after try block");
    }
    return new Stmt.Try(loc(tryTok), body, handlers);
  }

  private ExceptHandler exceptClause(List<ExceptHandler> previous)
                                          throws InvalidSyntaxException {
    Token exceptTok = expectKeyword("except");
    for (ExceptHandler prev: previous) {
      if (prev.kinds.isEmpty()) {
        throw error(exceptTok, "default 'except:' must be last");
      }
    }
    List<String> kinds = new ArrayList<String>();
    String name = null;
    if (!peek().isOp(":")) {
      if (acceptOp("(")) {
        do {
          kinds.add(dottedName());
        } while (acceptOp(",") && !peek().isOp(")"));
        expectOp(")");
      } else {
        kinds.add(dottedName());
      }
      if (peek().isKeyword("as")) {
        next();
        name = expectName().text;
      }
    }
    expectOp(":");
    List<Stmt> body = suite();
    return new ExceptHandler(loc(exceptTok), kinds, name, body);
  }

  /**
   * Comma-separated expressions, making a tuple if more than one
   */
  private Expr exprList() throws InvalidSyntaxException {
    Expr first = expr();
    if (!peek().isOp(",")) {
      return first;
    }
    List<Expr> elts = new ArrayList<Expr>();
    elts.add(first);
    while (acceptOp(",")) {
      if (!startsExpr(peek())) {
        break;
      }
      elts.add(expr());
    }
    return new Expr.TupleExpr(first.loc(), elts);
  }

  private Expr expr() throws InvalidSyntaxException {
    Token tok = peek();
    if (tok.type == TokenType.KEYWORD && UNSUPPORTED.contains(tok.text)) {
      throw error(tok, "'" + tok.text + "' is not supported");
    }
    Expr e = orTest();
    if (peek().isKeyword("if")) {
      throw error(peek(), "conditional expressions are not supported");
    }
    return e;
  }

  private Expr orTest() throws InvalidSyntaxException {
    Expr first = andTest();
    if (!peek().isKeyword("or")) {
      return first;
    }
    List<Expr> values = new ArrayList<Expr>();
    values.add(first);
    while (peek().isKeyword("or")) {
      next();
      values.add(andTest());
    }
    return new Expr.BoolOp(first.loc(), "or", values);
  }

  private Expr andTest() throws InvalidSyntaxException {
    Expr first = notTest();
    if (!peek().isKeyword("and")) {
      return first;
    }
    List<Expr> values = new ArrayList<Expr>();
    values.add(first);
    while (peek().isKeyword("and")) {
      next();
      values.add(notTest());
    }
    return new Expr.BoolOp(first.loc(), "and", values);
  }

  private Expr notTest() throws InvalidSyntaxException {
    Token tok = peek();
    if (tok.isKeyword("not")) {
      next();
      return new Expr.UnaryOp(loc(tok), "not", notTest());
    }
    return comparison();
  }

  private Expr comparison() throws InvalidSyntaxException {
    Expr left = arith();
    List<String> ops = new ArrayList<String>();
    List<Expr> comparators = new ArrayList<Expr>();
    while (true) {
      String op = compareOp();
      if (op == null) {
        break;
      }
      ops.add(op);
      comparators.add(arith());
    }
    if (ops.isEmpty()) {
      return left;
    }
    return new Expr.Compare(left.loc(), left, ops, comparators);
  }

  /**
   * @return comparison operator consumed from input, or null
   */
  private String compareOp() {
    Token tok = peek();
    if (tok.type == TokenType.OP && COMPARE_OPS.contains(tok.text)) {
      next();
      return tok.text;
    } else if (tok.isKeyword("in")) {
      next();
      return "in";
    } else if (tok.isKeyword("not") && peek(1).isKeyword("in")) {
      next();
      next();
      return "not in";
    } else if (tok.isKeyword("is")) {
      next();
      if (peek().isKeyword("not")) {
        next();
        return "is not";
      }
      return "is";
    }
    return null;
  }

  private Expr arith() throws InvalidSyntaxException {
    Expr left = term();
    while (peek().isOp("+") || peek().isOp("-")) {
      String op = next().text;
      left = new Expr.BinOp(left.loc(), op, left, term());
    }
    return left;
  }

  private Expr term() throws InvalidSyntaxException {
    Expr left = factor();
    while (peek().isOp("*") || peek().isOp("/") || peek().isOp("//") ||
           peek().isOp("%")) {
      String op = next().text;
      left = new Expr.BinOp(left.loc(), op, left, factor());
    }
    return left;
  }

  private Expr factor() throws InvalidSyntaxException {
    Token tok = peek();
    if (tok.isOp("-") || tok.isOp("+")) {
      next();
      return new Expr.UnaryOp(loc(tok), tok.text, factor());
    } else if (tok.isOp("~")) {
      throw error(tok, "bitwise operators are not supported");
    }
    return power();
  }

  private Expr power() throws InvalidSyntaxException {
    Expr base = atomExpr();
    if (peek().isOp("**")) {
      next();
      // Right associative, binds tighter than unary minus on the left
      return new Expr.BinOp(base.loc(), "**", base, factor());
    }
    return base;
  }

  private Expr atomExpr() throws InvalidSyntaxException {
    Expr e = atom();
    while (true) {
      Token tok = peek();
      if (tok.isOp("(")) {
        next();
        e = callArgs(e);
      } else if (tok.isOp("[")) {
        next();
        if (peek().isOp(":")) {
          throw error(peek(), "slices are not supported");
        }
        Expr index = exprList();
        if (peek().isOp(":")) {
          throw error(peek(), "slices are not supported");
        }
        expectOp("]");
        e = new Expr.Subscript(e.loc(), e, index);
      } else if (tok.isOp(".")) {
        next();
        e = new Expr.Attribute(e.loc(), e, expectName().text);
      } else {
        return e;
      }
    }
  }

  private Expr callArgs(Expr func) throws InvalidSyntaxException {
    List<Expr> args = new ArrayList<Expr>();
    List<Expr.Keyword> keywords = new ArrayList<Expr.Keyword>();
    Set<String> kwNames = new HashSet<String>();
    while (!peek().isOp(")")) {
      Token tok = peek();
      if (tok.isOp("*") || tok.isOp("**")) {
        throw error(tok, "argument unpacking is not supported");
      }
      if (tok.type == TokenType.NAME && peek(1).isOp("=")) {
        next();
        next();
        if (!kwNames.add(tok.text)) {
          throw error(tok, "keyword argument repeated: " + tok.text);
        }
        keywords.add(new Expr.Keyword(tok.text, expr()));
      } else {
        if (!keywords.isEmpty()) {
          throw error(tok, "positional argument follows keyword argument");
        }
        args.add(expr());
      }
      if (!acceptOp(",")) {
        break;
      }
    }
    expectOp(")");
    return new Expr.Call(func.loc(), func, args, keywords);
  }

  private Expr atom() throws InvalidSyntaxException {
    Token tok = next();
    switch (tok.type) {
      case NAME:
        return new Expr.Name(loc(tok), tok.text);
      case NUMBER:
        return number(tok);
      case STRING:
        return strings(tok);
      case KEYWORD:
        if (tok.text.equals("True") || tok.text.equals("False")) {
          return Constant.bool(loc(tok), tok.text.equals("True"));
        } else if (tok.text.equals("None")) {
          return new Constant(loc(tok), ConstType.NONE, "None", null);
        } else if (UNSUPPORTED.contains(tok.text)) {
          throw error(tok, "'" + tok.text + "' is not supported");
        }
        break;
      case OP:
        if (tok.text.equals("(")) {
          return parenthesized(tok);
        } else if (tok.text.equals("[")) {
          return list(tok);
        } else if (tok.text.equals("{")) {
          return dict(tok);
        }
        break;
      default:
        break;
    }
    throw error(tok, "unexpected " + tok.describe());
  }

  private Expr number(Token tok) throws InvalidSyntaxException {
    String text = tok.text.replace("_", "");
    int radix = 10;
    if (text.length() > 1 && text.charAt(0) == '0') {
      radix = radix(text.charAt(1));
    }
    try {
      if (radix != 10) {
        return new Constant(loc(tok), ConstType.INT, tok.text,
              Constant.intValue(new BigInteger(text.substring(2), radix)));
      } else if (text.contains(".") || text.contains("e") ||
                 text.contains("E")) {
        return new Constant(loc(tok), ConstType.FLOAT, tok.text,
                            Double.parseDouble(text));
      } else {
        return new Constant(loc(tok), ConstType.INT, tok.text,
                            Constant.intValue(new BigInteger(text)));
      }
    } catch (NumberFormatException e) {
      throw error(tok, "malformed number literal: " + tok.text);
    }
  }

  private static int radix(char prefix) {
    switch (Character.toLowerCase(prefix)) {
      case 'x':
        return 16;
      case 'o':
        return 8;
      case 'b':
        return 2;
      default:
        return 10;
    }
  }

  /**
   * Adjacent string literals are concatenated
   */
  private Expr strings(Token first) {
    StringBuilder text = new StringBuilder(first.text);
    StringBuilder value = new StringBuilder(first.value);
    while (peek().type == TokenType.STRING) {
      Token tok = next();
      text.append(' ').append(tok.text);
      value.append(tok.value);
    }
    return new Constant(loc(first), ConstType.STRING, text.toString(),
                        value.toString());
  }

  private Expr parenthesized(Token open) throws InvalidSyntaxException {
    if (acceptOp(")")) {
      return new Expr.TupleExpr(loc(open), new ArrayList<Expr>());
    }
    Expr first = expr();
    if (acceptOp(")")) {
      return first;
    }
    List<Expr> elts = new ArrayList<Expr>();
    elts.add(first);
    while (acceptOp(",")) {
      if (peek().isOp(")")) {
        break;
      }
      elts.add(expr());
    }
    expectOp(")");
    return new Expr.TupleExpr(loc(open), elts);
  }

  private Expr list(Token open) throws InvalidSyntaxException {
    List<Expr> elts = new ArrayList<Expr>();
    while (!peek().isOp("]")) {
      elts.add(expr());
      if (peek().isKeyword("for")) {
        throw error(peek(), "comprehensions are not supported");
      }
      if (!acceptOp(",")) {
        break;
      }
    }
    expectOp("]");
    return new Expr.ListExpr(loc(open), elts);
  }

  private Expr dict(Token open) throws InvalidSyntaxException {
    List<Expr> keys = new ArrayList<Expr>();
    List<Expr> values = new ArrayList<Expr>();
    while (!peek().isOp("}")) {
      keys.add(expr());
      if (!peek().isOp(":")) {
        throw error(peek(), "set displays are not supported");
      }
      next();
      values.add(expr());
      if (peek().isKeyword("for")) {
        throw error(peek(), "comprehensions are not supported");
      }
      if (!acceptOp(",")) {
        break;
      }
    }
    expectOp("}");
    return new Expr.DictExpr(loc(open), keys, values);
  }

  private static boolean startsExpr(Token tok) {
    switch (tok.type) {
      case NAME:
      case NUMBER:
      case STRING:
        return true;
      case KEYWORD:
        return tok.text.equals("True") || tok.text.equals("False") ||
               tok.text.equals("None") || tok.text.equals("not");
      case OP:
        return tok.text.equals("(") || tok.text.equals("[") ||
               tok.text.equals("{") || tok.text.equals("-") ||
               tok.text.equals("+");
      default:
        return false;
    }
  }

  private Token peek() {
    return tokens.get(pos);
  }

  private Token peek(int offset) {
    int i = Math.min(pos + offset, tokens.size() - 1);
    return tokens.get(i);
  }

  private Token next() {
    Token tok = tokens.get(pos);
    if (tok.type != TokenType.EOF) {
      pos++;
    }
    return tok;
  }

  private boolean acceptOp(String op) {
    if (peek().isOp(op)) {
      next();
      return true;
    }
    return false;
  }

  private Token expectOp(String op) throws InvalidSyntaxException {
    Token tok = next();
    if (!tok.isOp(op)) {
      throw error(tok, "expected '" + op + "' but found " + tok.describe());
    }
    return tok;
  }

  private Token expectKeyword(String kw) throws InvalidSyntaxException {
    Token tok = next();
    if (!tok.isKeyword(kw)) {
      throw error(tok, "expected '" + kw + "' but found " + tok.describe());
    }
    return tok;
  }

  private Token expectName() throws InvalidSyntaxException {
    Token tok = next();
    if (tok.type != TokenType.NAME) {
      throw error(tok, "expected name but found " + tok.describe());
    }
    return tok;
  }

  private void expectNewline() throws InvalidSyntaxException {
    Token tok = next();
    if (tok.type != TokenType.NEWLINE) {
      throw error(tok, "unexpected " + tok.describe());
    }
  }

  private SourceLocation loc(Token tok) {
    return new SourceLocation(file, tok.line, tok.column);
  }

  private InvalidSyntaxException error(Token tok, String msg) {
    return new InvalidSyntaxException(file, tok.line, tok.column, msg);
  }
}
