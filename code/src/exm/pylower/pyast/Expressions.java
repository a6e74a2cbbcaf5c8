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

package exm.pylower.pyast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.pylower.ast.SourceRange;
import exm.pylower.pyast.Operators.BinaryOperator;
import exm.pylower.pyast.Operators.BoolOperator;
import exm.pylower.pyast.Operators.CompareOperator;
import exm.pylower.pyast.Operators.UnaryOperator;

/**
 * Concrete expression variants, in the order of the reference schema
 */
public class Expressions {

  /**
   * Copy a list that may hold nulls, e.g. dict keys
   */
  private static <T> List<T> copyWithNulls(List<? extends T> list) {
    return Collections.unmodifiableList(new ArrayList<T>(list));
  }

  public static final class BoolOp extends Expression {
    public final BoolOperator op;
    public final ImmutableList<Expression> values;

    public BoolOp(SourceRange range, BoolOperator op,
                  List<? extends Expression> values) {
      super(range);
      this.op = op;
      this.values = ImmutableList.copyOf(values);
    }

    @Override
    public Kind kind() {
      return Kind.BOOL_OP;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("op", op), field("values", values));
    }
  }

  public static final class NamedExpr extends Expression {
    public final Name target;
    public final Expression value;

    public NamedExpr(SourceRange range, Name target, Expression value) {
      super(range);
      this.target = target;
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.NAMED_EXPR;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("target", target), field("value", value));
    }
  }

  public static final class BinOp extends Expression {
    public final Expression left;
    public final BinaryOperator op;
    public final Expression right;

    public BinOp(SourceRange range, Expression left, BinaryOperator op,
                 Expression right) {
      super(range);
      this.left = left;
      this.op = op;
      this.right = right;
    }

    @Override
    public Kind kind() {
      return Kind.BIN_OP;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("left", left), field("op", op),
                              field("right", right));
    }
  }

  public static final class UnaryOp extends Expression {
    public final UnaryOperator op;
    public final Expression operand;

    public UnaryOp(SourceRange range, UnaryOperator op, Expression operand) {
      super(range);
      this.op = op;
      this.operand = operand;
    }

    @Override
    public Kind kind() {
      return Kind.UNARY_OP;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("op", op), field("operand", operand));
    }
  }

  public static final class Lambda extends Expression {
    public final Arguments args;
    public final Expression body;

    public Lambda(SourceRange range, Arguments args, Expression body) {
      super(range);
      this.args = args;
      this.body = body;
    }

    @Override
    public Kind kind() {
      return Kind.LAMBDA;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("args", args), field("body", body));
    }
  }

  public static final class IfExp extends Expression {
    public final Expression test;
    public final Expression body;
    public final Expression orelse;

    public IfExp(SourceRange range, Expression test, Expression body,
                 Expression orelse) {
      super(range);
      this.test = test;
      this.body = body;
      this.orelse = orelse;
    }

    @Override
    public Kind kind() {
      return Kind.IF_EXP;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("test", test), field("body", body),
                              field("orelse", orelse));
    }
  }

  public static final class DictExpr extends Expression {
    /** Null key for a <code>**mapping</code> entry */
    public final List<Expression> keys;
    public final ImmutableList<Expression> values;

    public DictExpr(SourceRange range, List<? extends Expression> keys,
                    List<? extends Expression> values) {
      super(range);
      assert(keys.size() == values.size());
      this.keys = copyWithNulls(keys);
      this.values = ImmutableList.copyOf(values);
    }

    @Override
    public Kind kind() {
      return Kind.DICT;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("keys", keys), field("values", values));
    }
  }

  public static final class SetExpr extends Expression {
    public final ImmutableList<Expression> elts;

    public SetExpr(SourceRange range, List<? extends Expression> elts) {
      super(range);
      this.elts = ImmutableList.copyOf(elts);
    }

    @Override
    public Kind kind() {
      return Kind.SET;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("elts", elts));
    }
  }

  public static final class ListComp extends Expression {
    public final Expression elt;
    public final ImmutableList<Comprehension> generators;

    public ListComp(SourceRange range, Expression elt,
                    List<Comprehension> generators) {
      super(range);
      this.elt = elt;
      this.generators = ImmutableList.copyOf(generators);
    }

    @Override
    public Kind kind() {
      return Kind.LIST_COMP;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("elt", elt),
                              field("generators", generators));
    }
  }

  public static final class SetComp extends Expression {
    public final Expression elt;
    public final ImmutableList<Comprehension> generators;

    public SetComp(SourceRange range, Expression elt,
                   List<Comprehension> generators) {
      super(range);
      this.elt = elt;
      this.generators = ImmutableList.copyOf(generators);
    }

    @Override
    public Kind kind() {
      return Kind.SET_COMP;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("elt", elt),
                              field("generators", generators));
    }
  }

  public static final class DictComp extends Expression {
    public final Expression key;
    public final Expression value;
    public final ImmutableList<Comprehension> generators;

    public DictComp(SourceRange range, Expression key, Expression value,
                    List<Comprehension> generators) {
      super(range);
      this.key = key;
      this.value = value;
      this.generators = ImmutableList.copyOf(generators);
    }

    @Override
    public Kind kind() {
      return Kind.DICT_COMP;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("key", key), field("value", value),
                              field("generators", generators));
    }
  }

  public static final class GeneratorExp extends Expression {
    public final Expression elt;
    public final ImmutableList<Comprehension> generators;

    public GeneratorExp(SourceRange range, Expression elt,
                        List<Comprehension> generators) {
      super(range);
      this.elt = elt;
      this.generators = ImmutableList.copyOf(generators);
    }

    @Override
    public Kind kind() {
      return Kind.GENERATOR_EXP;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("elt", elt),
                              field("generators", generators));
    }
  }

  public static final class Await extends Expression {
    public final Expression value;

    public Await(SourceRange range, Expression value) {
      super(range);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.AWAIT;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("value", value));
    }
  }

  public static final class Compare extends Expression {
    public final Expression left;
    public final ImmutableList<CompareOperator> ops;
    public final ImmutableList<Expression> comparators;

    public Compare(SourceRange range, Expression left,
                   List<CompareOperator> ops,
                   List<? extends Expression> comparators) {
      super(range);
      assert(ops.size() == comparators.size());
      this.left = left;
      this.ops = ImmutableList.copyOf(ops);
      this.comparators = ImmutableList.copyOf(comparators);
    }

    @Override
    public Kind kind() {
      return Kind.COMPARE;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("left", left), field("ops", ops),
                              field("comparators", comparators));
    }
  }

  public static final class Call extends Expression {
    public final Expression func;
    public final ImmutableList<Expression> args;
    public final ImmutableList<Keyword> keywords;

    public Call(SourceRange range, Expression func,
                List<? extends Expression> args, List<Keyword> keywords) {
      super(range);
      this.func = func;
      this.args = ImmutableList.copyOf(args);
      this.keywords = ImmutableList.copyOf(keywords);
    }

    @Override
    public Kind kind() {
      return Kind.CALL;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("func", func), field("args", args),
                              field("keywords", keywords));
    }
  }

  /**
   * A literal value: BigInteger, Double, Imaginary, String, Bytes,
   * Boolean or a ConstantSingleton
   */
  public static final class Constant extends Expression {
    public final Object value;
    /** "u" for a u-prefixed string, otherwise null */
    public final String stringKind;

    public Constant(SourceRange range, Object value, String stringKind) {
      super(range);
      assert(value != null);
      this.value = value;
      this.stringKind = stringKind;
    }

    public Constant(SourceRange range, Object value) {
      this(range, value, null);
    }

    @Override
    public Kind kind() {
      return Kind.CONSTANT;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("value", value),
                              field("kind", stringKind));
    }
  }

  public static final class Attribute extends Expression {
    public final Expression value;
    public final String attr;
    public final ExprContext ctx;

    public Attribute(SourceRange range, Expression value, String attr,
                     ExprContext ctx) {
      super(range);
      this.value = value;
      this.attr = attr;
      this.ctx = ctx;
    }

    @Override
    public Kind kind() {
      return Kind.ATTRIBUTE;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("value", value), field("attr", attr),
                              field("ctx", ctx));
    }
  }

  public static final class Subscript extends Expression {
    public final Expression value;
    public final Expression slice;
    public final ExprContext ctx;

    public Subscript(SourceRange range, Expression value, Expression slice,
                     ExprContext ctx) {
      super(range);
      this.value = value;
      this.slice = slice;
      this.ctx = ctx;
    }

    @Override
    public Kind kind() {
      return Kind.SUBSCRIPT;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("value", value), field("slice", slice),
                              field("ctx", ctx));
    }
  }

  public static final class Starred extends Expression {
    public final Expression value;
    public final ExprContext ctx;

    public Starred(SourceRange range, Expression value, ExprContext ctx) {
      super(range);
      this.value = value;
      this.ctx = ctx;
    }

    @Override
    public Kind kind() {
      return Kind.STARRED;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("value", value), field("ctx", ctx));
    }
  }

  public static final class Name extends Expression {
    public final String id;
    public final ExprContext ctx;

    public Name(SourceRange range, String id, ExprContext ctx) {
      super(range);
      this.id = id;
      this.ctx = ctx;
    }

    @Override
    public Kind kind() {
      return Kind.NAME;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("id", id), field("ctx", ctx));
    }
  }

  public static final class ListExpr extends Expression {
    public final ImmutableList<Expression> elts;
    public final ExprContext ctx;

    public ListExpr(SourceRange range, List<? extends Expression> elts,
                    ExprContext ctx) {
      super(range);
      this.elts = ImmutableList.copyOf(elts);
      this.ctx = ctx;
    }

    @Override
    public Kind kind() {
      return Kind.LIST;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("elts", elts), field("ctx", ctx));
    }
  }

  public static final class TupleExpr extends Expression {
    public final ImmutableList<Expression> elts;
    public final ExprContext ctx;

    public TupleExpr(SourceRange range, List<? extends Expression> elts,
                     ExprContext ctx) {
      super(range);
      this.elts = ImmutableList.copyOf(elts);
      this.ctx = ctx;
    }

    @Override
    public Kind kind() {
      return Kind.TUPLE;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("elts", elts), field("ctx", ctx));
    }
  }

  /**
   * Slice in a subscript; any bound may be null
   */
  public static final class Slice extends Expression {
    public final Expression lower;
    public final Expression upper;
    public final Expression step;

    public Slice(SourceRange range, Expression lower, Expression upper,
                 Expression step) {
      super(range);
      this.lower = lower;
      this.upper = upper;
      this.step = step;
    }

    @Override
    public Kind kind() {
      return Kind.SLICE;
    }

    @Override
    public List<Field> fields() {
      return ImmutableList.of(field("lower", lower), field("upper", upper),
                              field("step", step));
    }
  }
}
