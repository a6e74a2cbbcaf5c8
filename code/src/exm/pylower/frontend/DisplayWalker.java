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

import com.google.common.collect.ImmutableList;

import exm.pylower.ast.Cst;
import exm.pylower.ast.CstNode;
import exm.pylower.ast.PositionTracker;
import exm.pylower.ast.SourceRange;
import exm.pylower.ast.Symbol;
import exm.pylower.ast.TokenKind;
import exm.pylower.common.exceptions.MalformedTreeException;
import exm.pylower.common.exceptions.UnsupportedSyntaxException;
import exm.pylower.common.exceptions.UserException;
import exm.pylower.common.lang.Feature;
import exm.pylower.common.lang.VersionGate;
import exm.pylower.frontend.LValWalker.TargetKind;
import exm.pylower.frontend.tree.Consumer;
import exm.pylower.pyast.Comprehension;
import exm.pylower.pyast.ExprContext;
import exm.pylower.pyast.Expression;
import exm.pylower.pyast.Expressions.DictComp;
import exm.pylower.pyast.Expressions.DictExpr;
import exm.pylower.pyast.Expressions.GeneratorExp;
import exm.pylower.pyast.Expressions.ListComp;
import exm.pylower.pyast.Expressions.ListExpr;
import exm.pylower.pyast.Expressions.SetComp;
import exm.pylower.pyast.Expressions.SetExpr;
import exm.pylower.pyast.Expressions.TupleExpr;

/**
 * Lowers bracketed displays, tuples and comprehensions
 */
class DisplayWalker {

  private static enum Display {
    TUPLE, LIST
  }

  private final CstWalker walker;

  DisplayWalker(CstWalker walker) {
    this.walker = walker;
  }

  /**
   * An atom opened by a bracket
   */
  Expression atom(LoweringContext context, CstNode atom)
                                        throws UserException {
    Cst open = atom.child(0);
    int n = atom.childCount();
    if (n != 2 && n != 3) {
      throw new MalformedTreeException(atom, "malformed atom");
    }
    SourceRange range = PositionTracker.rangeOf(atom);
    ExprContext exprContext = context.getExprContext();
    if (open.is(TokenKind.LPAR)) {
      if (n == 2) {
        return new TupleExpr(range, ImmutableList.<Expression>of(),
                             exprContext);
      }
      return parenthesized(context, atom.child(1), atom);
    } else if (open.is(TokenKind.LSQB)) {
      if (n == 2) {
        return new ListExpr(range, ImmutableList.<Expression>of(),
                            exprContext);
      }
      Cst inner = atom.child(1);
      if (inner.is(Symbol.LISTMAKER)) {
        return sequence(context, inner, Display.LIST, atom);
      }
      return new ListExpr(range, ImmutableList.of(
                 walker.lowerExpr(context, inner)), exprContext);
    } else if (open.is(TokenKind.LBRACE)) {
      if (n == 2) {
        return new DictExpr(range, ImmutableList.<Expression>of(),
                            ImmutableList.<Expression>of());
      }
      Cst inner = atom.child(1);
      if (inner.is(Symbol.DICTSETMAKER)) {
        return dictOrSet(context, inner, atom);
      }
      return new SetExpr(range, ImmutableList.of(
                 walker.lowerExpr(context.load(), inner)));
    }
    throw new MalformedTreeException(atom, "unexpected " + open.kindName() +
                                     " in atom");
  }

  /**
   * Parentheses around an expression add nothing; around a
   * testlist_gexp they make a tuple or generator expression.
   * @param rangeTree tree whose range the tuple or generator takes
   */
  Expression parenthesized(LoweringContext context, Cst inner,
                           Cst rangeTree) throws UserException {
    if (inner.is(Symbol.TESTLIST_GEXP)) {
      return sequence(context, inner, Display.TUPLE, rangeTree);
    }
    return walker.lowerExpr(context, inner);
  }

  /**
   * An unbracketed tuple such as <code>a, b</code>
   */
  Expression tuple(LoweringContext context, CstNode tree)
                                        throws UserException {
    return sequence(context, tree, Display.TUPLE, tree);
  }

  /**
   * Elements separated by commas, or one element followed by
   * comprehension clauses
   */
  private Expression sequence(LoweringContext context, Cst tree,
        Display display, Cst rangeTree) throws UserException {
    SourceRange range = PositionTracker.rangeOf(rangeTree);
    Consumer consumer = new Consumer(tree.children());
    Cst first = consumer.consumeIf();
    Cst clause = consumer.peek();
    if (clause != null && isComprehension(clause)) {
      consumer.consumeIf();
      if (!consumer.atEnd()) {
        throw new MalformedTreeException(tree, "unexpected child after " +
                                         "comprehension");
      }
      checkNotUnpacking(context, first);
      Expression elt = walker.lowerExpr(context.load(), first);
      List<Comprehension> generators = comprehension(context, clause);
      if (display == Display.LIST) {
        return new ListComp(range, elt, generators);
      }
      return new GeneratorExp(range, elt, generators);
    }

    List<Expression> elts = new ArrayList<Expression>();
    Cst element = first;
    while (element != null) {
      if (element.is(TokenKind.COMMA) || isComprehension(element)) {
        throw new MalformedTreeException(element, "unexpected " +
                                   element.kindName() + " in sequence");
      }
      elts.add(walker.lowerExpr(context, element));
      if (consumer.atEnd()) {
        break;
      }
      if (consumer.consumeIf(TokenKind.COMMA) == null) {
        throw new MalformedTreeException(tree, "missing ',' in sequence");
      }
      element = consumer.consumeIf();
    }
    if (display == Display.LIST) {
      return new ListExpr(range, elts, context.getExprContext());
    }
    return new TupleExpr(range, elts, context.getExprContext());
  }

  /**
   * Braces holding dictionary entries, set elements or a comprehension
   */
  private Expression dictOrSet(LoweringContext context, Cst maker,
                               Cst atom) throws UserException {
    LoweringContext load = context.load();
    SourceRange range = PositionTracker.rangeOf(atom);
    List<Expression> keys = new ArrayList<Expression>();
    List<Expression> values = new ArrayList<Expression>();
    List<Expression> elts = new ArrayList<Expression>();
    Consumer consumer = new Consumer(maker.children());

    while (!consumer.atEnd()) {
      Cst item = consumer.consumeIf();
      boolean unpacking = false;
      if (item.is(TokenKind.DOUBLESTAR)) {
        VersionGate.require(context, item, Feature.DISPLAY_UNPACKING);
        Cst valueTree = consumer.consumeIf();
        if (valueTree == null) {
          throw new MalformedTreeException(maker, "** without operand");
        }
        keys.add(null);
        values.add(walker.lowerExpr(load, valueTree));
        unpacking = true;
      } else if (item.is(Symbol.STAR_EXPR)) {
        elts.add(walker.lowerExpr(load, item));
        unpacking = true;
      } else if (consumer.consumeIf(TokenKind.COLON) != null) {
        Cst valueTree = consumer.consumeIf();
        if (valueTree == null) {
          throw new MalformedTreeException(maker, "dictionary key without " +
                                           "value");
        }
        keys.add(walker.lowerExpr(load, item));
        values.add(walker.lowerExpr(load, valueTree));
      } else if (consumer.consumeIf(TokenKind.COLONEQUAL) != null) {
        Cst valueTree = consumer.consumeIf();
        if (valueTree == null) {
          throw new MalformedTreeException(maker, "':=' without value");
        }
        elts.add(walker.lowerNamedExpr(load, item, valueTree));
      } else {
        elts.add(walker.lowerExpr(load, item));
      }

      if (!keys.isEmpty() && !elts.isEmpty()) {
        throw new UnsupportedSyntaxException(context, item, "display",
            "dictionary entries and set elements cannot be mixed");
      }

      Cst clause = consumer.consumeIf(Symbol.COMP_FOR);
      if (clause != null) {
        if (unpacking) {
          throw new UnsupportedSyntaxException(context, item,
              "comprehension", keys.isEmpty() ?
              "iterable unpacking cannot be used in comprehension" :
              "dict unpacking cannot be used in dict comprehension");
        }
        if (keys.size() + elts.size() != 1 || !consumer.atEnd()) {
          throw new MalformedTreeException(maker, "comprehension must " +
                                           "follow a single item");
        }
        List<Comprehension> generators = comprehension(context, clause);
        if (!keys.isEmpty()) {
          return new DictComp(range, keys.get(0), values.get(0), generators);
        }
        return new SetComp(range, elts.get(0), generators);
      }
      if (!consumer.atEnd() && consumer.consumeIf(TokenKind.COMMA) == null) {
        throw new MalformedTreeException(maker, "missing ',' in display");
      }
    }
    if (!keys.isEmpty()) {
      return new DictExpr(range, keys, values);
    }
    return new SetExpr(range, elts);
  }

  /**
   * Lower a chain of <code>for</code> and <code>if</code> clauses.
   * Each <code>for</code> starts a comprehension; the conditions after
   * it up to the next <code>for</code> are its filters.
   */
  List<Comprehension> comprehension(LoweringContext context, Cst clause)
                                        throws UserException {
    LoweringContext load = context.load();
    List<Comprehension> result = new ArrayList<Comprehension>();
    Cst next = clause;
    while (next != null) {
      if (!isComprehension(next)) {
        throw new MalformedTreeException(next, "expected comprehension, got " +
                                         next.kindName());
      }
      Consumer consumer = new Consumer(next.children());
      Cst async = consumer.consumeIf(TokenKind.ASYNC);
      if (async != null) {
        VersionGate.require(context, async, Feature.ASYNC_COMPREHENSION);
      }
      Cst forKeyword = consumer.consumeIf(TokenKind.NAME);
      Cst targetTree = consumer.consumeIf();
      Cst inKeyword = consumer.consumeIf(TokenKind.NAME);
      Cst iterTree = consumer.consumeIf();
      if (forKeyword == null || !forKeyword.asLeaf().isName("for") ||
          inKeyword == null || !inKeyword.asLeaf().isName("in") ||
          targetTree == null || iterTree == null) {
        throw new MalformedTreeException(next, "malformed for clause");
      }
      Expression target = walker.lowerExpr(
                    context.withExprContext(ExprContext.STORE), targetTree);
      LValWalker.checkTarget(context, targetTree, target, TargetKind.ASSIGN);
      Expression iter = walker.lowerExpr(load, iterTree);

      List<Expression> ifs = new ArrayList<Expression>();
      next = consumer.consumeIf();
      while (next != null && isCondition(next)) {
        if (next.childCount() < 2 || !next.child(0).asLeaf().isName("if")) {
          throw new MalformedTreeException(next, "malformed if clause");
        }
        ifs.add(walker.lowerExpr(load, next.child(1)));
        next = (next.childCount() == 3) ? next.child(2) : null;
      }
      result.add(new Comprehension(target, iter, ifs, async != null));
    }
    return result;
  }

  private static boolean isComprehension(Cst tree) {
    return tree.is(Symbol.COMP_FOR) || tree.is(Symbol.OLD_COMP_FOR);
  }

  private static boolean isCondition(Cst tree) {
    return tree.is(Symbol.COMP_IF) || tree.is(Symbol.OLD_COMP_IF);
  }

  private static void checkNotUnpacking(LoweringContext context, Cst element)
                                    throws UnsupportedSyntaxException {
    if (element.is(Symbol.STAR_EXPR)) {
      throw new UnsupportedSyntaxException(context, element, "comprehension",
          "iterable unpacking cannot be used in comprehension");
    }
  }
}
