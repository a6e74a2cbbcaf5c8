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

import exm.pylower.ast.Cst;
import exm.pylower.ast.PositionTracker;
import exm.pylower.ast.Symbol;
import exm.pylower.ast.TokenKind;
import exm.pylower.common.exceptions.MalformedTreeException;
import exm.pylower.common.exceptions.UnsupportedSyntaxException;
import exm.pylower.common.exceptions.UserException;
import exm.pylower.common.lang.Feature;
import exm.pylower.common.lang.VersionGate;
import exm.pylower.frontend.tree.Consumer;
import exm.pylower.pyast.Expression;
import exm.pylower.pyast.TypeParam;
import exm.pylower.pyast.TypeParam.ParamSpec;
import exm.pylower.pyast.TypeParam.TypeVar;
import exm.pylower.pyast.TypeParam.TypeVarTuple;

/**
 * Lowers the type parameters of a type alias:
 * <code>T</code>, <code>T: bound</code>, <code>**P</code> and
 * <code>*Ts</code>, each with an optional default.
 */
class TypeParamWalker {

  private final CstWalker walker;

  TypeParamWalker(CstWalker walker) {
    this.walker = walker;
  }

  /**
   * @param typeParams the bracketed typeparams node
   */
  List<TypeParam> lowerList(LoweringContext context, Cst typeParams)
                                          throws UserException {
    if (!typeParams.is(Symbol.TYPEPARAMS) ||
        !typeParams.child(0).is(TokenKind.LSQB) ||
        !typeParams.lastChild().is(TokenKind.RSQB)) {
      throw new MalformedTreeException(typeParams, "expected typeparams");
    }
    List<TypeParam> result = new ArrayList<TypeParam>();
    TypeParam withDefault = null;
    for (Cst child: typeParams.children()) {
      if (child.is(TokenKind.LSQB) || child.is(TokenKind.RSQB) ||
          child.is(TokenKind.COMMA)) {
        continue;
      }
      TypeParam param = lower(context, child);
      if (param.defaultValue != null) {
        withDefault = param;
      } else if (withDefault != null) {
        throw new UnsupportedSyntaxException(context, child,
            "type parameter default", "non-default type parameter '" +
            param.name + "' follows default type parameter");
      }
      result.add(param);
    }
    return result;
  }

  TypeParam lower(LoweringContext context, Cst tree)
                                          throws UserException {
    if (tree.is(TokenKind.NAME)) {
      VersionGate.require(context, tree, Feature.TYPE_VAR);
      return new TypeVar(PositionTracker.rangeOf(tree),
                         tree.asLeaf().text(), null, null);
    } else if (tree.is(Symbol.TYPEVAR)) {
      return typeVar(context, tree);
    } else if (tree.is(Symbol.PARAMSPEC)) {
      VersionGate.require(context, tree, Feature.PARAM_SPEC);
      checkPrefixed(tree, TokenKind.DOUBLESTAR);
      Expression defaultValue = defaultValue(context, tree,
                                  Feature.PARAM_SPEC_DEFAULT);
      return new ParamSpec(PositionTracker.rangeOf(tree),
                           tree.child(1).asLeaf().text(), defaultValue);
    } else if (tree.is(Symbol.TYPEVARTUPLE)) {
      VersionGate.require(context, tree, Feature.TYPE_VAR_TUPLE);
      checkPrefixed(tree, TokenKind.STAR);
      Expression defaultValue = defaultValue(context, tree,
                                  Feature.TYPE_VAR_TUPLE_DEFAULT);
      return new TypeVarTuple(PositionTracker.rangeOf(tree),
                              tree.child(1).asLeaf().text(), defaultValue);
    }
    throw new MalformedTreeException(tree, "not a type parameter: " +
                                     tree.kindName());
  }

  private TypeParam typeVar(LoweringContext context, Cst tree)
                                          throws UserException {
    VersionGate.require(context, tree, Feature.TYPE_VAR);
    Consumer consumer = new Consumer(tree.children());
    Cst name = consumer.consumeIf(TokenKind.NAME);
    if (name == null) {
      throw new MalformedTreeException(tree, "type variable without name");
    }
    Expression bound = null;
    if (consumer.consumeIf(TokenKind.COLON) != null) {
      bound = walker.lowerExpr(context.load(), required(tree, consumer));
    }
    Expression defaultValue = null;
    Cst equal = consumer.consumeIf(TokenKind.EQUAL);
    if (equal != null) {
      VersionGate.require(context, equal, Feature.TYPE_VAR_DEFAULT);
      defaultValue = walker.lowerExpr(context.load(),
                                      required(tree, consumer));
    }
    if (!consumer.atEnd()) {
      throw new MalformedTreeException(tree, "unexpected child of typevar");
    }
    return new TypeVar(PositionTracker.rangeOf(tree), name.asLeaf().text(),
                       bound, defaultValue);
  }

  /**
   * @return default after <code>=</code> in child 2, or null
   */
  private Expression defaultValue(LoweringContext context, Cst tree,
                      Feature feature) throws UserException {
    if (tree.childCount() == 2) {
      return null;
    }
    if (tree.childCount() != 4 || !tree.child(2).is(TokenKind.EQUAL)) {
      throw new MalformedTreeException(tree, "malformed " + tree.kindName());
    }
    VersionGate.require(context, tree.child(2), feature);
    return walker.lowerExpr(context.load(), tree.child(3));
  }

  private static void checkPrefixed(Cst tree, TokenKind prefix) {
    if (tree.childCount() < 2 || !tree.child(0).is(prefix) ||
        !tree.child(1).is(TokenKind.NAME)) {
      throw new MalformedTreeException(tree, "malformed " + tree.kindName());
    }
  }

  private static Cst required(Cst tree, Consumer consumer) {
    Cst child = consumer.consumeIf();
    if (child == null) {
      throw new MalformedTreeException(tree, "missing expression in " +
                                       tree.kindName());
    }
    return child;
  }
}
