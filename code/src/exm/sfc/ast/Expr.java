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
package exm.sfc.ast;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Expression nodes of the source dialect.  Immutable.
 */
public abstract class Expr {

  public static enum ExprType {
    NAME,
    CONSTANT,
    ATTRIBUTE,
    SUBSCRIPT,
    CALL,
    BINOP,
    BOOLOP,
    UNARYOP,
    COMPARE,
    LIST,
    TUPLE,
    DICT,
  }

  private final SourceLocation loc;

  protected Expr(SourceLocation loc) {
    this.loc = loc;
  }

  public SourceLocation loc() {
    return loc;
  }

  public abstract ExprType type();

  /**
   * @return direct subexpressions in evaluation order
   */
  public abstract List<Expr> children();

  /**
   * @param e
   * @return "a.b.c" if expression is a chain of attribute lookups
   *         on a name, otherwise null
   */
  public static String dottedName(Expr e) {
    if (e.type() == ExprType.NAME) {
      return ((Name)e).id;
    } else if (e.type() == ExprType.ATTRIBUTE) {
      Attribute attr = (Attribute)e;
      String prefix = dottedName(attr.value);
      return prefix == null ? null : prefix + "." + attr.attr;
    } else {
      return null;
    }
  }

  /**
   * @param e
   * @return all expressions in tree rooted at e, in pre-order
   */
  public static List<Expr> preorder(Expr e) {
    List<Expr> result = new ArrayList<Expr>();
    preorder(e, result);
    return result;
  }

  private static void preorder(Expr e, List<Expr> acc) {
    acc.add(e);
    for (Expr child: e.children()) {
      preorder(child, acc);
    }
  }

  public static class Name extends Expr {
    public final String id;

    public Name(SourceLocation loc, String id) {
      super(loc);
      this.id = id;
    }

    @Override
    public ExprType type() {
      return ExprType.NAME;
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return id;
    }
  }

  public static class Constant extends Expr {
    public static enum ConstType {
      INT, FLOAT, STRING, BOOL, NONE
    }

    public final ConstType constType;
    /** Literal as written in the source */
    public final String text;
    /**
     * Long, Double, String, Boolean or null for None.  Integers outside
     * the range of a long are BigInteger.
     */
    public final Object value;

    public Constant(SourceLocation loc, ConstType constType, String text,
                    Object value) {
      super(loc);
      this.constType = constType;
      this.text = text;
      this.value = value;
    }

    public static Constant bool(SourceLocation loc, boolean val) {
      return new Constant(loc, ConstType.BOOL, val ? "True" : "False", val);
    }

    public boolean isTrue() {
      return constType == ConstType.BOOL && Boolean.TRUE.equals(value);
    }

    /**
     * @return value of an integer literal that fits in a long, else null
     */
    public Long longValue() {
      if (constType == ConstType.INT && value instanceof Long) {
        return (Long)value;
      }
      return null;
    }

    public BigInteger bigIntegerValue() {
      assert(constType == ConstType.INT);
      if (value instanceof BigInteger) {
        return (BigInteger)value;
      }
      return BigInteger.valueOf((Long)value);
    }

    /**
     * @param v
     * @return v as a Long if in range, otherwise v
     */
    public static Object intValue(BigInteger v) {
      if (v.bitLength() < 64) {
        return Long.valueOf(v.longValue());
      }
      return v;
    }

    @Override
    public ExprType type() {
      return ExprType.CONSTANT;
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return text;
    }
  }

  public static class Attribute extends Expr {
    public final Expr value;
    public final String attr;

    public Attribute(SourceLocation loc, Expr value, String attr) {
      super(loc);
      this.value = value;
      this.attr = attr;
    }

    @Override
    public ExprType type() {
      return ExprType.ATTRIBUTE;
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.of(value);
    }
  }

  public static class Subscript extends Expr {
    public final Expr value;
    public final Expr index;

    public Subscript(SourceLocation loc, Expr value, Expr index) {
      super(loc);
      this.value = value;
      this.index = index;
    }

    @Override
    public ExprType type() {
      return ExprType.SUBSCRIPT;
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.of(value, index);
    }
  }

  public static class Keyword {
    public final String name;
    public final Expr value;

    public Keyword(String name, Expr value) {
      this.name = name;
      this.value = value;
    }
  }

  public static class Call extends Expr {
    public final Expr func;
    public final ImmutableList<Expr> args;
    public final ImmutableList<Keyword> keywords;

    public Call(SourceLocation loc, Expr func, List<Expr> args,
                List<Keyword> keywords) {
      super(loc);
      this.func = func;
      this.args = ImmutableList.copyOf(args);
      this.keywords = ImmutableList.copyOf(keywords);
    }

    /**
     * @return name of called function, e.g. "json.loads", or null if callee
     *         is not a simple name
     */
    public String calleeName() {
      return dottedName(func);
    }

    @Override
    public ExprType type() {
      return ExprType.CALL;
    }

    @Override
    public List<Expr> children() {
      ImmutableList.Builder<Expr> result = ImmutableList.builder();
      result.add(func);
      result.addAll(args);
      for (Keyword kw: keywords) {
        result.add(kw.value);
      }
      return result.build();
    }
  }

  /** Arithmetic operators: + - * / // % ** */
  public static class BinOp extends Expr {
    public final String op;
    public final Expr left;
    public final Expr right;

    public BinOp(SourceLocation loc, String op, Expr left, Expr right) {
      super(loc);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public ExprType type() {
      return ExprType.BINOP;
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.of(left, right);
    }
  }

  /** Short-circuit and/or over two or more operands */
  public static class BoolOp extends Expr {
    public final String op;
    public final ImmutableList<Expr> values;

    public BoolOp(SourceLocation loc, String op, List<Expr> values) {
      super(loc);
      this.op = op;
      this.values = ImmutableList.copyOf(values);
    }

    @Override
    public ExprType type() {
      return ExprType.BOOLOP;
    }

    @Override
    public List<Expr> children() {
      return values;
    }
  }

  /** not, unary + and - */
  public static class UnaryOp extends Expr {
    public final String op;
    public final Expr operand;

    public UnaryOp(SourceLocation loc, String op, Expr operand) {
      super(loc);
      this.op = op;
      this.operand = operand;
    }

    @Override
    public ExprType type() {
      return ExprType.UNARYOP;
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.of(operand);
    }
  }

  /**
   * Possibly chained comparison: left ops[0] comparators[0] ops[1] ...
   */
  public static class Compare extends Expr {
    public final Expr left;
    public final ImmutableList<String> ops;
    public final ImmutableList<Expr> comparators;

    public Compare(SourceLocation loc, Expr left, List<String> ops,
                   List<Expr> comparators) {
      super(loc);
      assert(ops.size() == comparators.size());
      this.left = left;
      this.ops = ImmutableList.copyOf(ops);
      this.comparators = ImmutableList.copyOf(comparators);
    }

    @Override
    public ExprType type() {
      return ExprType.COMPARE;
    }

    @Override
    public List<Expr> children() {
      return ImmutableList.<Expr>builder().add(left)
                          .addAll(comparators).build();
    }
  }

  public static class ListExpr extends Expr {
    public final ImmutableList<Expr> elts;

    public ListExpr(SourceLocation loc, List<Expr> elts) {
      super(loc);
      this.elts = ImmutableList.copyOf(elts);
    }

    @Override
    public ExprType type() {
      return ExprType.LIST;
    }

    @Override
    public List<Expr> children() {
      return elts;
    }
  }

  public static class TupleExpr extends Expr {
    public final ImmutableList<Expr> elts;

    public TupleExpr(SourceLocation loc, List<Expr> elts) {
      super(loc);
      this.elts = ImmutableList.copyOf(elts);
    }

    @Override
    public ExprType type() {
      return ExprType.TUPLE;
    }

    @Override
    public List<Expr> children() {
      return elts;
    }
  }

  public static class DictExpr extends Expr {
    public final ImmutableList<Expr> keys;
    public final ImmutableList<Expr> values;

    public DictExpr(SourceLocation loc, List<Expr> keys, List<Expr> values) {
      super(loc);
      assert(keys.size() == values.size());
      this.keys = ImmutableList.copyOf(keys);
      this.values = ImmutableList.copyOf(values);
    }

    @Override
    public ExprType type() {
      return ExprType.DICT;
    }

    @Override
    public List<Expr> children() {
      ImmutableList.Builder<Expr> result = ImmutableList.builder();
      for (int i = 0; i < keys.size(); i++) {
        result.add(keys.get(i));
        result.add(values.get(i));
      }
      return result.build();
    }
  }
}
