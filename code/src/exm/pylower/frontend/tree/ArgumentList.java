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

package exm.pylower.frontend.tree;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.pylower.ast.Cst;
import exm.pylower.ast.CstLeaf;
import exm.pylower.ast.PositionTracker;
import exm.pylower.ast.Symbol;
import exm.pylower.ast.TokenKind;
import exm.pylower.common.exceptions.MalformedTreeException;
import exm.pylower.common.exceptions.UnsupportedSyntaxException;
import exm.pylower.common.exceptions.UserException;
import exm.pylower.common.lang.TargetVersion;
import exm.pylower.frontend.CstWalker;
import exm.pylower.frontend.LoweringContext;
import exm.pylower.pyast.Comprehension;
import exm.pylower.pyast.ExprContext;
import exm.pylower.pyast.Expression;
import exm.pylower.pyast.Expressions.GeneratorExp;
import exm.pylower.pyast.Expressions.NamedExpr;
import exm.pylower.pyast.Expressions.Starred;
import exm.pylower.pyast.Keyword;

/**
 * Arguments of a call, split into positional arguments and keywords
 */
public class ArgumentList {
  private static final TargetVersion BARE_GENERATOR_COMMA_REMOVED =
                                                TargetVersion.of(3, 7);

  public final ImmutableList<Expression> args;
  public final ImmutableList<Keyword> keywords;

  private ArgumentList(List<Expression> args, List<Keyword> keywords) {
    this.args = ImmutableList.copyOf(args);
    this.keywords = ImmutableList.copyOf(keywords);
  }

  public static ArgumentList empty() {
    return new ArgumentList(ImmutableList.<Expression>of(),
                            ImmutableList.<Keyword>of());
  }

  /**
   * Lower the contents of a call's parentheses
   * @param argTree an arglist, or a single argument or expression
   * @param trailer the enclosing call trailer, whose range a bare
   *                generator argument takes
   */
  public static ArgumentList lower(CstWalker walker, LoweringContext context,
                                   Cst argTree, Cst trailer)
                                       throws UserException {
    LoweringContext load = context.load();
    List<Cst> arguments = argumentTrees(argTree);
    List<Expression> args = new ArrayList<Expression>();
    List<Keyword> keywords = new ArrayList<Keyword>();

    // Ordering rules: positionals may not follow a keyword or **
    Cst keywordSeen = null;
    Cst doubleStarSeen = null;

    for (Cst arg: arguments) {
      if (!arg.is(Symbol.ARGUMENT)) {
        checkPositional(context, arg, keywordSeen, doubleStarSeen);
        args.add(walker.lowerExpr(load, arg));
        continue;
      }

      Cst head = arg.child(0);
      if (head.is(TokenKind.STAR)) {
        if (doubleStarSeen != null) {
          throw new UnsupportedSyntaxException(context, arg,
              "argument unpacking", "iterable argument unpacking follows " +
              "keyword argument unpacking");
        }
        args.add(new Starred(PositionTracker.rangeOf(arg),
                    walker.lowerExpr(load, arg.child(1)), ExprContext.LOAD));
      } else if (head.is(TokenKind.DOUBLESTAR)) {
        doubleStarSeen = arg;
        keywords.add(new Keyword(PositionTracker.rangeOf(arg), null,
                                 walker.lowerExpr(load, arg.child(1))));
      } else if (arg.childCount() == 2) {
        // f(x for x in y)
        checkSoleGenerator(context, arg, arguments, argTree);
        Expression elt = walker.lowerExpr(load, head);
        List<Comprehension> generators =
                          walker.lowerComprehension(context, arg.child(1));
        args.add(new GeneratorExp(PositionTracker.rangeOf(trailer), elt,
                                  generators));
      } else if (arg.childCount() >= 3 && arg.child(1).is(TokenKind.COLONEQUAL)) {
        checkPositional(context, arg, keywordSeen, doubleStarSeen);
        NamedExpr named = walker.lowerNamedExpr(load, head, arg.child(2));
        if (arg.childCount() == 4) {
          checkSoleGenerator(context, arg, arguments, argTree);
          List<Comprehension> generators =
                          walker.lowerComprehension(context, arg.child(3));
          args.add(new GeneratorExp(PositionTracker.rangeOf(trailer), named,
                                    generators));
        } else {
          args.add(named);
        }
      } else if (arg.childCount() == 3 && arg.child(1).is(TokenKind.EQUAL)) {
        keywordSeen = arg;
        keywords.add(new Keyword(PositionTracker.rangeOf(arg),
                                 keywordName(context, head),
                                 walker.lowerExpr(load, arg.child(2))));
      } else {
        throw new MalformedTreeException(arg, "unrecognised argument shape");
      }
    }
    return new ArgumentList(args, keywords);
  }

  /**
   * @return the arguments, without separating commas
   */
  private static List<Cst> argumentTrees(Cst argTree) {
    if (!argTree.is(Symbol.ARGLIST)) {
      return ImmutableList.of(argTree);
    }
    List<Cst> result = new ArrayList<Cst>();
    Consumer consumer = new Consumer(argTree.children());
    while (!consumer.atEnd()) {
      Cst arg = consumer.consumeIf();
      if (arg.is(TokenKind.COMMA)) {
        throw new MalformedTreeException(argTree, "missing argument");
      }
      result.add(arg);
      if (!consumer.atEnd() && consumer.consumeIf(TokenKind.COMMA) == null) {
        throw new MalformedTreeException(argTree,
                                         "missing ',' between arguments");
      }
    }
    return result;
  }

  private static void checkPositional(LoweringContext context, Cst arg,
        Cst keywordSeen, Cst doubleStarSeen)
            throws UnsupportedSyntaxException {
    if (doubleStarSeen != null) {
      throw new UnsupportedSyntaxException(context, arg, "argument order",
          "positional argument follows keyword argument unpacking");
    } else if (keywordSeen != null) {
      throw new UnsupportedSyntaxException(context, arg, "argument order",
          "positional argument follows keyword argument");
    }
  }

  /**
   * A generator argument must be the only argument.  From 3.7 it may
   * not have a trailing comma either.
   */
  private static void checkSoleGenerator(LoweringContext context, Cst arg,
      List<Cst> arguments, Cst argTree) throws UnsupportedSyntaxException {
    boolean trailingComma = argTree.is(Symbol.ARGLIST) &&
                            argTree.lastChild().is(TokenKind.COMMA);
    if (arguments.size() != 1 ||
        (trailingComma && context.getTargetVersion().atLeast(
                                        BARE_GENERATOR_COMMA_REMOVED))) {
      throw new UnsupportedSyntaxException(context, arg,
          "generator argument", "Generator expression must be parenthesized");
    }
  }

  private static String keywordName(LoweringContext context, Cst target)
                                    throws UnsupportedSyntaxException {
    if (!target.is(TokenKind.NAME)) {
      throw new UnsupportedSyntaxException(context, target,
          "keyword argument", "keyword argument target must be a name");
    }
    CstLeaf name = target.asLeaf();
    if (name.isName("True") || name.isName("False") || name.isName("None")) {
      throw new UnsupportedSyntaxException(context, target,
          "keyword argument", "cannot assign to " + name.text());
    }
    return name.text();
  }
}
