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

import exm.pylower.ast.Cst;
import exm.pylower.common.exceptions.UnsupportedSyntaxException;
import exm.pylower.pyast.ConstantSingleton;
import exm.pylower.pyast.ExprContext;
import exm.pylower.pyast.Expression;
import exm.pylower.pyast.Expressions.Constant;
import exm.pylower.pyast.Expressions.ListExpr;
import exm.pylower.pyast.Expressions.Starred;
import exm.pylower.pyast.Expressions.TupleExpr;

/**
 * Checks that lowered assignment and deletion targets can be assigned
 * to.  Targets are lowered like any other expression under a Store or
 * Del context, so anything the grammar accepts arrives here.
 */
public class LValWalker {

  public static enum TargetKind {
    /** <code>a = ...</code>, for loops of comprehensions */
    ASSIGN(ExprContext.STORE),
    /** <code>a += ...</code> */
    AUGMENTED(ExprContext.STORE),
    /** <code>del a</code> */
    DELETE(ExprContext.DEL);

    private final ExprContext exprContext;

    private TargetKind(ExprContext exprContext) {
      this.exprContext = exprContext;
    }

    public ExprContext exprContext() {
      return exprContext;
    }
  }

  /**
   * @param at tree to report errors against
   * @throws UnsupportedSyntaxException if target cannot be assigned to
   */
  public static void checkTarget(LoweringContext context, Cst at,
        Expression target, TargetKind kind)
            throws UnsupportedSyntaxException {
    switch (target.kind()) {
      case NAME:
      case ATTRIBUTE:
      case SUBSCRIPT:
        return;
      case STARRED:
        // Placement and count of starred targets are checked when compiling
        if (kind == TargetKind.DELETE) {
          throw error(context, at, "cannot delete starred");
        } else if (kind == TargetKind.AUGMENTED) {
          throw new UnsupportedSyntaxException(context, at,
              "augmented assignment",
              "'starred' is an illegal expression for augmented assignment");
        }
        checkTarget(context, at, ((Starred)target).value, kind);
        return;
      case TUPLE:
        checkSequence(context, at, ((TupleExpr)target).elts, kind, "tuple");
        return;
      case LIST:
        checkSequence(context, at, ((ListExpr)target).elts, kind, "list");
        return;
      case CONSTANT:
        Object value = ((Constant)target).value;
        if (value instanceof Boolean || value == ConstantSingleton.NONE) {
          throw error(context, at, verb(kind) + " " +
                      (value instanceof Boolean ?
                       (((Boolean)value) ? "True" : "False") : "None"));
        }
        throw error(context, at, verb(kind) + " literal");
      default:
        throw error(context, at, verb(kind) + " " + describe(target));
    }
  }

  private static void checkSequence(LoweringContext context, Cst at,
      Iterable<Expression> elts, TargetKind kind, String what)
          throws UnsupportedSyntaxException {
    if (kind == TargetKind.AUGMENTED) {
      throw new UnsupportedSyntaxException(context, at, "augmented assignment",
          "'" + what + "' is an illegal expression for augmented assignment");
    }
    for (Expression elt: elts) {
      checkTarget(context, at, elt, kind);
    }
  }

  private static String verb(TargetKind kind) {
    return kind == TargetKind.DELETE ? "cannot delete" : "cannot assign to";
  }

  /**
   * Describe expressions the way error messages name them
   */
  private static String describe(Expression target) {
    switch (target.kind()) {
      case CALL:
        return "function call";
      case BIN_OP:
      case UNARY_OP:
      case BOOL_OP:
        return "expression";
      case COMPARE:
        return "comparison";
      case LAMBDA:
        return "lambda";
      case IF_EXP:
        return "conditional expression";
      case NAMED_EXPR:
        return "named expression";
      case AWAIT:
        return "await expression";
      case DICT:
        return "dict literal";
      case SET:
        return "set display";
      case LIST_COMP:
        return "list comprehension";
      case SET_COMP:
        return "set comprehension";
      case DICT_COMP:
        return "dict comprehension";
      case GENERATOR_EXP:
        return "generator expression";
      default:
        return target.typeName();
    }
  }

  private static UnsupportedSyntaxException error(LoweringContext context,
                                                  Cst at, String message) {
    return new UnsupportedSyntaxException(context, at, "assignment target",
                                          message);
  }
}
