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

package exm.pylower.frontend;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.google.common.collect.ImmutableList;

import exm.pylower.ast.Cst;
import exm.pylower.ast.CstLeaf;
import exm.pylower.ast.CstNode;
import exm.pylower.ast.PositionTracker;
import exm.pylower.ast.SourceRange;
import exm.pylower.ast.Symbol;
import exm.pylower.ast.TokenKind;
import exm.pylower.common.exceptions.InvalidLiteralException;
import exm.pylower.common.exceptions.InvalidSyntaxException;
import exm.pylower.common.exceptions.MalformedTreeException;
import exm.pylower.common.exceptions.UnsupportedSyntaxException;
import exm.pylower.common.exceptions.UserException;
import exm.pylower.common.lang.Feature;
import exm.pylower.common.lang.LiteralEvaluator;
import exm.pylower.common.lang.VersionGate;
import exm.pylower.frontend.tree.ArgumentList;
import exm.pylower.frontend.tree.Consumer;
import exm.pylower.pyast.Arg;
import exm.pylower.pyast.Arguments;
import exm.pylower.pyast.Bytes;
import exm.pylower.pyast.ConstantSingleton;
import exm.pylower.pyast.ExprContext;
import exm.pylower.pyast.Expression;
import exm.pylower.pyast.Expressions.Attribute;
import exm.pylower.pyast.Expressions.Await;
import exm.pylower.pyast.Expressions.BinOp;
import exm.pylower.pyast.Expressions.BoolOp;
import exm.pylower.pyast.Expressions.Call;
import exm.pylower.pyast.Expressions.Compare;
import exm.pylower.pyast.Expressions.Constant;
import exm.pylower.pyast.Expressions.IfExp;
import exm.pylower.pyast.Expressions.Lambda;
import exm.pylower.pyast.Expressions.Name;
import exm.pylower.pyast.Expressions.NamedExpr;
import exm.pylower.pyast.Expressions.Slice;
import exm.pylower.pyast.Expressions.Starred;
import exm.pylower.pyast.Expressions.Subscript;
import exm.pylower.pyast.Expressions.TupleExpr;
import exm.pylower.pyast.Expressions.UnaryOp;
import exm.pylower.pyast.Keyword;
import exm.pylower.pyast.Operators;
import exm.pylower.pyast.Operators.BinaryOperator;
import exm.pylower.pyast.Operators.BoolOperator;
import exm.pylower.pyast.Operators.CompareOperator;
import exm.pylower.pyast.Operators.UnaryOperator;

/**
 * Lowers operators, primaries and leaves to expressions.
 *
 * Operands are always lowered under Load.  The context of the caller
 * only reaches names, attributes, subscripts and starred expressions at
 * the top of the tree, which is what makes them assignment targets.
 */
class ExprWalker {

  private final CstWalker walker;
  private final LiteralEvaluator literals;

  ExprWalker(CstWalker walker, LiteralEvaluator literals) {
    this.walker = walker;
    this.literals = literals;
  }

  /**
   * <code>a + b - c</code>: operators group to the left
   */
  Expression binaryOperation(LoweringContext context, CstNode tree)
                                            throws UserException {
    LoweringContext load = context.load();
    Cst first = tree.child(0);
    Expression result = walker.lowerExpr(load, first);
    for (int i = 1; i < tree.childCount(); i += 2) {
      Cst opTree = tree.child(i);
      if (i + 1 >= tree.childCount()) {
        throw new MalformedTreeException(tree, "operator without operand");
      }
      BinaryOperator op = opTree.isLeaf() ?
              Operators.binaryOperator(opTree.asLeaf().kind()) : null;
      if (op == null) {
        throw new MalformedTreeException(opTree, "not a binary operator: " +
                                         opTree.kindName());
      }
      if (op == BinaryOperator.MAT_MULT) {
        VersionGate.require(context, opTree, Feature.MATRIX_MULTIPLICATION);
      }
      Cst rightTree = tree.child(i + 1);
      Expression right = walker.lowerExpr(load, rightTree);
      result = new BinOp(PositionTracker.unify(first, rightTree),
                         result, op, right);
    }
    return result;
  }

  /**
   * <code>a &lt; b &lt;= c</code>: one node for the whole chain
   */
  Expression comparison(LoweringContext context, CstNode tree)
                                            throws UserException {
    LoweringContext load = context.load();
    Expression left = walker.lowerExpr(load, tree.child(0));
    List<CompareOperator> ops = new ArrayList<CompareOperator>();
    List<Expression> comparators = new ArrayList<Expression>();
    for (int i = 1; i < tree.childCount(); i += 2) {
      if (i + 1 >= tree.childCount()) {
        throw new MalformedTreeException(tree, "comparison without operand");
      }
      ops.add(compareOperator(tree.child(i)));
      comparators.add(walker.lowerExpr(load, tree.child(i + 1)));
    }
    return new Compare(PositionTracker.rangeOf(tree), left, ops,
                       comparators);
  }

  private static CompareOperator compareOperator(Cst opTree) {
    CompareOperator op = null;
    if (opTree.is(TokenKind.NAME)) {
      op = Operators.compareKeyword(opTree.asLeaf().text());
    } else if (opTree.isLeaf()) {
      op = Operators.compareOperator(opTree.asLeaf().kind());
    } else if (opTree.is(Symbol.COMP_OP) && opTree.childCount() == 2) {
      // "not in" or "is not"
      String first = opTree.child(0).asLeaf().text();
      String second = opTree.child(1).asLeaf().text();
      if (first.equals("not") && second.equals("in")) {
        op = CompareOperator.NOT_IN;
      } else if (first.equals("is") && second.equals("not")) {
        op = CompareOperator.IS_NOT;
      }
    }
    if (op == null) {
      throw new MalformedTreeException(opTree, "not a comparison operator: " +
                                       opTree.kindName());
    }
    return op;
  }

  /**
   * <code>a or b or c</code>: one node with all operands
   */
  Expression boolOperation(LoweringContext context, CstNode tree)
                                            throws UserException {
    BoolOperator op = tree.is(Symbol.OR_TEST) ?
                        BoolOperator.OR : BoolOperator.AND;
    List<Expression> values = new ArrayList<Expression>();
    for (int i = 0; i < tree.childCount(); i += 2) {
      values.add(walker.lowerExpr(context.load(), tree.child(i)));
    }
    return new BoolOp(PositionTracker.rangeOf(tree), op, values);
  }

  Expression not(LoweringContext context, CstNode tree)
                                            throws UserException {
    if (tree.childCount() != 2) {
      throw new MalformedTreeException(tree, "malformed not_test");
    }
    Expression operand = walker.lowerExpr(context.load(), tree.child(1));
    return new UnaryOp(PositionTracker.rangeOf(tree), UnaryOperator.NOT,
                       operand);
  }

  /**
   * Unary <code>+</code>, <code>-</code> and <code>~</code>
   */
  Expression factor(LoweringContext context, CstNode tree)
                                            throws UserException {
    Cst opTree = tree.child(0);
    UnaryOperator op = opTree.isLeaf() ?
              Operators.unaryOperator(opTree.asLeaf().kind()) : null;
    if (op == null || tree.childCount() != 2) {
      throw new MalformedTreeException(tree, "malformed factor");
    }
    Expression operand = walker.lowerExpr(context.load(), tree.child(1));
    return new UnaryOp(PositionTracker.rangeOf(tree), op, operand);
  }

  /**
   * <code>[await] atom trailer* [** factor]</code>
   */
  Expression power(LoweringContext context, CstNode tree)
                                            throws UserException {
    List<Cst> children = tree.children();
    int n = children.size();
    if (n > 2 && children.get(n - 2).is(TokenKind.DOUBLESTAR)) {
      Expression left = awaitPrimary(context.load(), children.subList(0, n - 2));
      Expression right = walker.lowerExpr(context.load(), children.get(n - 1));
      return new BinOp(PositionTracker.rangeOf(tree), left,
                       BinaryOperator.POW, right);
    }
    return awaitPrimary(context, children);
  }

  private Expression awaitPrimary(LoweringContext context,
                        List<Cst> children) throws UserException {
    if (children.isEmpty()) {
      throw new MalformedTreeException("power without operand");
    }
    Cst first = children.get(0);
    if (!first.is(TokenKind.AWAIT)) {
      return primary(context, children);
    }
    VersionGate.require(context, first, Feature.AWAIT_EXPRESSION);
    if (children.size() < 2) {
      throw new MalformedTreeException(first, "await without operand");
    }
    Expression value = primary(context.load(),
                               children.subList(1, children.size()));
    SourceRange range = PositionTracker.unify(first,
                                      children.get(children.size() - 1));
    return new Await(range, value);
  }

  /**
   * An atom followed by calls, subscripts and attribute accesses.
   * Only the outermost access takes the context of the caller.
   */
  private Expression primary(LoweringContext context, List<Cst> children)
                                            throws UserException {
    Cst base = children.get(0);
    if (children.size() == 1) {
      return walker.lowerExpr(context, base);
    }
    LoweringContext load = context.load();
    Expression result = walker.lowerExpr(load, base);
    for (int i = 1; i < children.size(); i++) {
      Cst trailer = children.get(i);
      boolean last = (i == children.size() - 1);
      ExprContext exprContext = last ? context.getExprContext()
                                     : ExprContext.LOAD;
      result = trailer(load, base, result, trailer, exprContext);
    }
    return result;
  }

  private Expression trailer(LoweringContext load, Cst base,
      Expression value, Cst trailer, ExprContext exprContext)
          throws UserException {
    if (!trailer.is(Symbol.TRAILER) || trailer.childCount() < 2) {
      throw new MalformedTreeException(trailer, "expected trailer, got " +
                                       trailer.kindName());
    }
    SourceRange range = PositionTracker.unify(base, trailer);
    Cst open = trailer.child(0);
    if (open.is(TokenKind.LPAR)) {
      ArgumentList args;
      if (trailer.childCount() == 2) {
        args = ArgumentList.empty();
      } else {
        args = ArgumentList.lower(walker, load, trailer.child(1), trailer);
      }
      return new Call(range, value, args.args, args.keywords);
    } else if (open.is(TokenKind.LSQB)) {
      if (trailer.childCount() != 3) {
        throw new MalformedTreeException(trailer, "empty subscript");
      }
      Expression index = index(load, trailer.child(1));
      return new Subscript(range, value, index, exprContext);
    } else if (open.is(TokenKind.DOT)) {
      Cst attr = trailer.child(1);
      if (!attr.is(TokenKind.NAME)) {
        throw new MalformedTreeException(trailer, "attribute is not a name");
      }
      return new Attribute(range, value, attr.asLeaf().text(), exprContext);
    }
    throw new MalformedTreeException(trailer, "unknown trailer " +
                                     open.kindName());
  }

  /**
   * The part of a subscript between brackets
   */
  private Expression index(LoweringContext load, Cst tree)
                                            throws UserException {
    if (tree.is(Symbol.STAR_EXPR)) {
      // a[*b] is a one-element tuple
      Starred starred = subscriptStar(load, tree);
      return new TupleExpr(starred.range(),
                 ImmutableList.<Expression>of(starred), ExprContext.LOAD);
    }
    return walker.lowerExpr(load, tree);
  }

  private Starred subscriptStar(LoweringContext load, Cst tree)
                                            throws UserException {
    VersionGate.require(load, tree, Feature.STARRED_SUBSCRIPT);
    Expression value = walker.lowerExpr(load, tree.child(1));
    return new Starred(PositionTracker.rangeOf(tree), value,
                       ExprContext.LOAD);
  }

  /**
   * <code>a[x, y:z]</code>: several indices form a tuple
   */
  Expression subscriptList(LoweringContext context, CstNode tree)
                                            throws UserException {
    LoweringContext load = context.load();
    List<Expression> elts = new ArrayList<Expression>();
    for (Cst child: tree.children()) {
      if (child.is(TokenKind.COMMA)) {
        continue;
      } else if (child.is(Symbol.STAR_EXPR)) {
        elts.add(subscriptStar(load, child));
      } else {
        elts.add(walker.lowerExpr(load, child));
      }
    }
    return new TupleExpr(PositionTracker.rangeOf(tree), elts,
                         ExprContext.LOAD);
  }

  /**
   * A slice, or <code>a[x := y]</code>
   */
  Expression subscript(LoweringContext context, CstNode tree)
                                            throws UserException {
    LoweringContext load = context.load();
    if (tree.childCount() == 3 && tree.child(1).is(TokenKind.COLONEQUAL)) {
      VersionGate.require(context, tree.child(1), Feature.NAMED_EXPRESSION);
      VersionGate.require(context, tree.child(1),
                  Feature.UNPARENTHESIZED_SUBSCRIPT_NAMED_EXPRESSION);
      return namedExpr(context, tree.child(0), tree.child(2));
    }

    Consumer consumer = new Consumer(tree.children());
    Expression lower = null;
    if (consumer.consumeIf(TokenKind.COLON) == null) {
      lower = walker.lowerExpr(load, consumer.consumeIf());
      if (consumer.consumeIf(TokenKind.COLON) == null) {
        throw new MalformedTreeException(tree, "expected ':' in slice");
      }
    }
    Expression upper = null;
    Cst next = consumer.peek();
    if (next != null && !next.is(Symbol.SLICEOP) &&
        !next.is(TokenKind.COLON)) {
      upper = walker.lowerExpr(load, consumer.consumeIf());
    }
    Expression step = null;
    Cst sliceop = consumer.consumeIf(Symbol.SLICEOP);
    if (sliceop != null) {
      if (sliceop.childCount() != 2) {
        throw new MalformedTreeException(sliceop, "malformed sliceop");
      }
      step = walker.lowerExpr(load, sliceop.child(1));
    } else {
      // A sliceop of a lone ':' is collapsed to the colon
      consumer.consumeIf(TokenKind.COLON);
    }
    if (!consumer.atEnd()) {
      throw new MalformedTreeException(consumer.peek(),
                                       "unexpected child of subscript");
    }
    return new Slice(PositionTracker.rangeOf(tree), lower, upper, step);
  }

  /**
   * <code>a if b else c</code>
   */
  Expression conditional(LoweringContext context, CstNode tree)
                                            throws UserException {
    if (tree.childCount() != 5 || !tree.child(1).asLeaf().isName("if") ||
        !tree.child(3).asLeaf().isName("else")) {
      throw new MalformedTreeException(tree, "malformed conditional");
    }
    LoweringContext load = context.load();
    Expression body = walker.lowerExpr(load, tree.child(0));
    Expression test = walker.lowerExpr(load, tree.child(2));
    Expression orelse = walker.lowerExpr(load, tree.child(4));
    return new IfExp(PositionTracker.rangeOf(tree), test, body, orelse);
  }

  Expression namedExprTest(LoweringContext context, CstNode tree)
                                            throws UserException {
    if (tree.childCount() != 3 || !tree.child(1).is(TokenKind.COLONEQUAL)) {
      throw new MalformedTreeException(tree, "malformed namedexpr_test");
    }
    return namedExpr(context, tree.child(0), tree.child(2));
  }

  /**
   * <code>target := value</code>
   */
  NamedExpr namedExpr(LoweringContext context, Cst targetTree,
                      Cst valueTree) throws UserException {
    VersionGate.require(context, targetTree, Feature.NAMED_EXPRESSION);
    Expression target = walker.lowerExpr(
                 context.withExprContext(ExprContext.STORE), targetTree);
    if (target.kind() != Expression.Kind.NAME) {
      throw new UnsupportedSyntaxException(context, targetTree,
          Feature.NAMED_EXPRESSION.displayName(),
          "assignment expression target must be a name");
    }
    Expression value = walker.lowerExpr(context.load(), valueTree);
    return new NamedExpr(PositionTracker.unify(targetTree, valueTree),
                         (Name)target, value);
  }

  /**
   * <code>*value</code> in a display or assignment target
   */
  Expression starred(LoweringContext context, CstNode tree)
                                            throws UserException {
    if (tree.childCount() != 2 || !tree.child(0).is(TokenKind.STAR)) {
      throw new MalformedTreeException(tree, "malformed star_expr");
    }
    if (context.getExprContext() == ExprContext.LOAD) {
      VersionGate.require(context, tree, Feature.DISPLAY_UNPACKING);
    }
    Expression value = walker.lowerExpr(context, tree.child(1));
    return new Starred(PositionTracker.rangeOf(tree), value,
                       context.getExprContext());
  }

  /**
   * <code>lambda params: body</code>
   */
  Expression lambda(LoweringContext context, CstNode tree)
                                            throws UserException {
    int n = tree.childCount();
    if (n < 3 || !tree.child(n - 2).is(TokenKind.COLON)) {
      throw new MalformedTreeException(tree, "malformed lambdef");
    }
    Arguments args;
    if (n == 3) {
      args = Arguments.empty();
    } else if (n == 4) {
      args = parameters(context, tree.child(1));
    } else {
      throw new MalformedTreeException(tree, "malformed lambdef");
    }
    Expression body = walker.lowerExpr(context.load(), tree.child(n - 1));
    return new Lambda(PositionTracker.rangeOf(tree), args, body);
  }

  /**
   * @param params a varargslist, or a single parameter or marker
   */
  private Arguments parameters(LoweringContext context, Cst params)
                                            throws UserException {
    List<Cst> items = params.is(Symbol.VARARGSLIST) ? params.children()
                                          : ImmutableList.of(params);
    LoweringContext load = context.load();
    List<Arg> posonlyargs = new ArrayList<Arg>();
    List<Arg> args = new ArrayList<Arg>();
    List<Expression> defaults = new ArrayList<Expression>();
    List<Arg> kwonlyargs = new ArrayList<Arg>();
    List<Expression> kwDefaults = new ArrayList<Expression>();
    Arg vararg = null;
    Arg kwarg = null;
    boolean seenStar = false;
    boolean seenSlash = false;
    Cst bareStar = null;

    Consumer consumer = new Consumer(items);
    while (!consumer.atEnd()) {
      Cst item = consumer.consumeIf();
      if (kwarg != null) {
        throw new UnsupportedSyntaxException(context, item, "lambda",
                          "arguments cannot follow var-keyword argument");
      }
      if (item.is(TokenKind.NAME)) {
        Arg arg = arg(item);
        Expression defaultValue = null;
        if (consumer.consumeIf(TokenKind.EQUAL) != null) {
          Cst valueTree = consumer.consumeIf();
          if (valueTree == null) {
            throw new MalformedTreeException(params, "missing default value");
          }
          defaultValue = walker.lowerExpr(load, valueTree);
        }
        if (seenStar) {
          kwonlyargs.add(arg);
          kwDefaults.add(defaultValue);
        } else {
          if (defaultValue != null) {
            defaults.add(defaultValue);
          } else if (!defaults.isEmpty()) {
            throw new UnsupportedSyntaxException(context, item, "lambda",
                          "non-default argument follows default argument");
          }
          args.add(arg);
        }
      } else if (item.is(TokenKind.STAR)) {
        if (seenStar) {
          throw new UnsupportedSyntaxException(context, item, "lambda",
                          "* argument may appear only once");
        }
        seenStar = true;
        Cst name = consumer.consumeIf(TokenKind.NAME);
        if (name != null) {
          vararg = arg(name);
        } else {
          bareStar = item;
        }
      } else if (item.is(TokenKind.DOUBLESTAR)) {
        Cst name = consumer.consumeIf(TokenKind.NAME);
        if (name == null) {
          throw new MalformedTreeException(params, "** without name");
        }
        kwarg = arg(name);
      } else if (item.is(TokenKind.SLASH)) {
        VersionGate.require(context, item,
                            Feature.POSITIONAL_ONLY_PARAMETERS);
        if (seenSlash) {
          throw new UnsupportedSyntaxException(context, item, "lambda",
                          "/ may appear only once");
        } else if (seenStar) {
          throw new UnsupportedSyntaxException(context, item, "lambda",
                          "/ must be ahead of *");
        } else if (args.isEmpty()) {
          throw new UnsupportedSyntaxException(context, item, "lambda",
                          "at least one argument must precede /");
        }
        seenSlash = true;
        posonlyargs.addAll(args);
        args.clear();
      } else {
        throw new MalformedTreeException(item, "unexpected " +
                                         item.kindName() + " in parameters");
      }
      if (!consumer.atEnd() && consumer.consumeIf(TokenKind.COMMA) == null) {
        throw new MalformedTreeException(params,
                                         "missing ',' between parameters");
      }
    }
    if (bareStar != null && kwonlyargs.isEmpty()) {
      throw new UnsupportedSyntaxException(context, bareStar, "lambda",
                      "named arguments must follow bare *");
    }
    return new Arguments(posonlyargs, args, vararg, kwonlyargs, kwDefaults,
                         kwarg, defaults);
  }

  private static Arg arg(Cst name) {
    return new Arg(PositionTracker.rangeOf(name), name.asLeaf().text());
  }

  /**
   * A name, or one of the constants spelled like a name
   */
  Expression name(LoweringContext context, CstLeaf leaf) {
    SourceRange range = PositionTracker.rangeOf(leaf);
    String text = leaf.text();
    if (text.equals("True")) {
      return new Constant(range, Boolean.TRUE);
    } else if (text.equals("False")) {
      return new Constant(range, Boolean.FALSE);
    } else if (text.equals("None")) {
      return new Constant(range, ConstantSingleton.NONE);
    }
    return new Name(range, text, context.getExprContext());
  }

  Expression number(LoweringContext context, CstLeaf leaf)
                                            throws UserException {
    String text = leaf.text();
    if (text.indexOf('_') >= 0) {
      VersionGate.require(context, leaf, Feature.NUMERIC_UNDERSCORES);
    }
    Object value;
    try {
      value = literals.evalNumber(text);
    } catch (InvalidLiteralException e) {
      throw new InvalidSyntaxException(context, leaf, e.getMessage());
    }
    return new Constant(PositionTracker.rangeOf(leaf), value);
  }

  /**
   * Adjacent string literals are concatenated into one constant
   * @param rangeTree tree whose range the constant takes
   */
  Expression strings(LoweringContext context, List<Cst> leaves,
                     Cst rangeTree) throws UserException {
    StringBuilder text = null;
    Bytes bytes = null;
    for (Cst leaf: leaves) {
      if (!leaf.is(TokenKind.STRING)) {
        throw new MalformedTreeException(leaf, "expected string, got " +
                                         leaf.kindName());
      }
      String prefix = stringPrefix(leaf.asLeaf().text());
      if (prefix.indexOf('f') >= 0) {
        throw new UnsupportedSyntaxException(context, leaf, "f-string");
      }
      Object value;
      try {
        value = literals.evalString(leaf.asLeaf().text());
      } catch (InvalidLiteralException e) {
        throw new InvalidSyntaxException(context, leaf, e.getMessage());
      }
      if (value instanceof Bytes) {
        if (text != null) {
          throw mixedStrings(context, leaf);
        }
        bytes = (bytes == null) ? (Bytes)value : bytes.concat((Bytes)value);
      } else {
        if (bytes != null) {
          throw mixedStrings(context, leaf);
        }
        if (text == null) {
          text = new StringBuilder();
        }
        text.append((String)value);
      }
    }
    SourceRange range = PositionTracker.rangeOf(rangeTree);
    if (bytes != null) {
      return new Constant(range, bytes);
    }
    if (text == null) {
      throw new MalformedTreeException(rangeTree, "no string literals");
    }
    String kind = null;
    if (stringPrefix(leaves.get(0).asLeaf().text()).indexOf('u') >= 0) {
      kind = "u";
    }
    return new Constant(range, text.toString(), kind);
  }

  private static UnsupportedSyntaxException mixedStrings(
                            LoweringContext context, Cst leaf) {
    return new UnsupportedSyntaxException(context, leaf,
        "string concatenation", "cannot mix bytes and nonbytes literals");
  }

  private static String stringPrefix(String literal) {
    int i = 0;
    while (i < literal.length() && literal.charAt(i) != '\'' &&
           literal.charAt(i) != '"') {
      i++;
    }
    return literal.substring(0, i).toLowerCase(Locale.ROOT);
  }

  /**
   * <code>`x`</code> is shorthand for <code>repr(x)</code>
   */
  Expression backquote(LoweringContext context, CstNode atom)
                                            throws UserException {
    if (atom.childCount() != 3 || !atom.child(2).is(TokenKind.BACKQUOTE)) {
      throw new MalformedTreeException(atom, "malformed backquote");
    }
    LogHelper.uniqueWarn(context, atom,
                         "backquotes are lowered to a call to repr()");
    SourceRange range = PositionTracker.rangeOf(atom);
    Expression value = walker.lowerExpr(context.load(), atom.child(1));
    return new Call(range, new Name(range, "repr", ExprContext.LOAD),
                    ImmutableList.of(value), ImmutableList.<Keyword>of());
  }

  Expression ellipsis(CstNode atom) {
    if (atom.childCount() != 3 || !atom.child(1).is(TokenKind.DOT) ||
        !atom.child(2).is(TokenKind.DOT)) {
      throw new MalformedTreeException(atom, "malformed ellipsis");
    }
    return new Constant(PositionTracker.rangeOf(atom),
                        ConstantSingleton.ELLIPSIS);
  }
}
