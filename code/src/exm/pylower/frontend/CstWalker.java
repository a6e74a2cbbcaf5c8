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

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import exm.pylower.ast.Cst;
import exm.pylower.ast.CstLeaf;
import exm.pylower.ast.CstNode;
import exm.pylower.ast.PositionTracker;
import exm.pylower.ast.Symbol;
import exm.pylower.ast.TokenKind;
import exm.pylower.common.Logging;
import exm.pylower.common.exceptions.MalformedTreeException;
import exm.pylower.common.exceptions.UnimplementedConstructException;
import exm.pylower.common.exceptions.UnsupportedSyntaxException;
import exm.pylower.common.exceptions.UserException;
import exm.pylower.common.lang.Feature;
import exm.pylower.common.lang.LiteralEvaluator;
import exm.pylower.common.lang.VersionGate;
import exm.pylower.frontend.LValWalker.TargetKind;
import exm.pylower.pyast.Comprehension;
import exm.pylower.pyast.ExprContext;
import exm.pylower.pyast.Expression;
import exm.pylower.pyast.Expressions.Name;
import exm.pylower.pyast.Expressions.NamedExpr;
import exm.pylower.pyast.Expressions.Slice;
import exm.pylower.pyast.Module;
import exm.pylower.pyast.Operators;
import exm.pylower.pyast.Operators.BinaryOperator;
import exm.pylower.pyast.PyNode;
import exm.pylower.pyast.Statement;
import exm.pylower.pyast.Statements.AnnAssign;
import exm.pylower.pyast.Statements.Assign;
import exm.pylower.pyast.Statements.AugAssign;
import exm.pylower.pyast.Statements.Delete;
import exm.pylower.pyast.Statements.ExprStmt;
import exm.pylower.pyast.Statements.Pass;
import exm.pylower.pyast.Statements.TypeAlias;
import exm.pylower.pyast.TypeIgnore;
import exm.pylower.pyast.TypeParam;

/**
 * Lowers a parse tree to an abstract syntax tree.
 *
 * {@link #lower(LoweringContext, Cst)} selects the routine for each kind
 * of tree with a switch on its token kind or production.  Statements
 * and modules are lowered here; expressions by {@link ExprWalker},
 * displays and comprehensions by {@link DisplayWalker} and type
 * parameters by {@link TypeParamWalker}.
 *
 * Walkers keep no state between calls, so one instance may lower any
 * number of trees.
 */
public class CstWalker {

  private static final Logger logger = Logging.getPyLowerLogger();

  private final ExprWalker exprWalker;
  private final DisplayWalker displayWalker;
  private final TypeParamWalker typeParamWalker;

  public CstWalker(LiteralEvaluator literals) {
    this.exprWalker = new ExprWalker(this, literals);
    this.displayWalker = new DisplayWalker(this);
    this.typeParamWalker = new TypeParamWalker(this);
  }

  /**
   * Lower any parse tree.
   * @throws UserException if the tree uses syntax that the target
   *        version lacks or that no target allows
   * @throws UnimplementedConstructException if there is no lowering for
   *        the kind of tree, including kinds only meaningful inside a
   *        parent such as trailer or comp_for
   * @throws MalformedTreeException if the tree lacks a child that its
   *        production always has
   */
  public PyNode lower(LoweringContext context, Cst tree)
                                            throws UserException {
    if (LogHelper.isTraceEnabled()) {
      LogHelper.trace(context, tree, "lower " + tree.kindName());
    }
    if (tree.isLeaf()) {
      return lowerLeaf(context, tree.asLeaf());
    }
    CstNode node = (CstNode)tree;
    switch (node.symbol()) {
      case FILE_INPUT:
        return lowerModule(context, node);
      case SIMPLE_STMT:
        return lowerSingleStatement(context, node);
      case EXPR_STMT:
        return lowerExprStmt(context, node);
      case DEL_STMT:
        return lowerDelete(context, node);
      case TYPE_STMT:
        return lowerTypeAlias(context, node);

      case TYPEVAR:
      case PARAMSPEC:
      case TYPEVARTUPLE:
        return typeParamWalker.lower(context, node);

      case EXPR:
      case XOR_EXPR:
      case AND_EXPR:
      case SHIFT_EXPR:
      case ARITH_EXPR:
      case TERM:
        return exprWalker.binaryOperation(context, node);
      case COMPARISON:
        return exprWalker.comparison(context, node);
      case OR_TEST:
      case AND_TEST:
        return exprWalker.boolOperation(context, node);
      case NOT_TEST:
        return exprWalker.not(context, node);
      case FACTOR:
        return exprWalker.factor(context, node);
      case POWER:
        return exprWalker.power(context, node);
      case TEST:
        return exprWalker.conditional(context, node);
      case NAMEDEXPR_TEST:
        return exprWalker.namedExprTest(context, node);
      case LAMBDEF:
        return exprWalker.lambda(context, node);
      case STAR_EXPR:
        return exprWalker.starred(context, node);
      case SUBSCRIPT:
        return exprWalker.subscript(context, node);
      case SUBSCRIPTLIST:
        return exprWalker.subscriptList(context, node);

      case ATOM:
        return lowerAtom(context, node);
      case TESTLIST_GEXP:
        return displayWalker.parenthesized(context, node, node);
      case TESTLIST_STAR_EXPR:
      case TESTLIST:
      case EXPRLIST:
      case TESTLIST1:
        return displayWalker.tuple(context, node);

      // Lowered as part of their parent
      case ANNASSIGN:
      case TYPEPARAMS:
      case VARARGSLIST:
      case COMP_OP:
      case TRAILER:
      case LISTMAKER:
      case DICTSETMAKER:
      case SLICEOP:
      case ARGLIST:
      case ARGUMENT:
      case COMP_FOR:
      case COMP_IF:
      case OLD_COMP_FOR:
      case OLD_COMP_IF:
        throw new UnimplementedConstructException(node.kindName());
      default:
        throw new UnimplementedConstructException(node.kindName());
    }
  }

  private PyNode lowerLeaf(LoweringContext context, CstLeaf leaf)
                                          throws UserException {
    switch (leaf.kind()) {
      case NAME:
        return exprWalker.name(context, leaf);
      case NUMBER:
        return exprWalker.number(context, leaf);
      case STRING:
        return exprWalker.strings(context, ImmutableList.<Cst>of(leaf),
                                  leaf);
      case COLON:
        // Subscript consisting of a lone ':'
        return new Slice(PositionTracker.rangeOf(leaf), null, null, null);
      default:
        throw new UnimplementedConstructException(leaf.kindName());
    }
  }

  private PyNode lowerAtom(LoweringContext context, CstNode atom)
                                          throws UserException {
    Cst first = atom.child(0);
    if (first.is(TokenKind.STRING)) {
      return exprWalker.strings(context, atom.children(), atom);
    } else if (first.is(TokenKind.BACKQUOTE)) {
      return exprWalker.backquote(context, atom);
    } else if (first.is(TokenKind.DOT)) {
      return exprWalker.ellipsis(atom);
    }
    return displayWalker.atom(context, atom);
  }

  /**
   * Lower a tree that must produce an expression
   */
  public Expression lowerExpr(LoweringContext context, Cst tree)
                                          throws UserException {
    PyNode result = lower(context, tree);
    if (!(result instanceof Expression)) {
      throw new MalformedTreeException(tree, "expected an expression, got " +
                                       result.typeName());
    }
    return (Expression)result;
  }

  /**
   * Lower <code>target := value</code>
   */
  public NamedExpr lowerNamedExpr(LoweringContext context, Cst target,
                                  Cst value) throws UserException {
    return exprWalker.namedExpr(context, target, value);
  }

  /**
   * Lower a chain of comprehension clauses
   * @param clause a comp_for or old_comp_for
   */
  public List<Comprehension> lowerComprehension(LoweringContext context,
                                     Cst clause) throws UserException {
    return displayWalker.comprehension(context, clause);
  }

  /**
   * Lower a whole file.  Type ignores are left empty.
   */
  public Module lowerModule(LoweringContext context, Cst root)
                                          throws UserException {
    if (!root.is(Symbol.FILE_INPUT)) {
      throw new MalformedTreeException(root, "expected file_input");
    }
    List<Cst> children = root.children();
    if (children.isEmpty() ||
        !children.get(children.size() - 1).is(TokenKind.ENDMARKER)) {
      throw new MalformedTreeException(root, "file_input must end with " +
                                       "ENDMARKER");
    }
    List<Statement> body = new ArrayList<Statement>();
    for (Cst child: children.subList(0, children.size() - 1)) {
      if (child.is(TokenKind.NEWLINE)) {
        continue;
      }
      lowerStatements(context, child, body);
    }
    logger.debug("Lowered " + body.size() + " statements from " +
                 context.getInputFile());
    return new Module(body, ImmutableList.<TypeIgnore>of());
  }

  /**
   * Lower a statement line, which may hold several statements separated
   * by semicolons, appending to body
   */
  private void lowerStatements(LoweringContext context, Cst stmt,
                      List<Statement> body) throws UserException {
    if (!stmt.is(Symbol.SIMPLE_STMT)) {
      body.add(lowerSmallStatement(context, stmt));
      return;
    }
    for (Cst child: stmt.children()) {
      if (child.is(TokenKind.SEMI) || child.is(TokenKind.NEWLINE)) {
        continue;
      }
      body.add(lowerSmallStatement(context, child));
    }
  }

  private Statement lowerSingleStatement(LoweringContext context,
                              CstNode stmt) throws UserException {
    List<Statement> body = new ArrayList<Statement>(1);
    lowerStatements(context, stmt, body);
    if (body.size() != 1) {
      throw new MalformedTreeException(stmt, "expected one statement, found " +
                                       body.size());
    }
    return body.get(0);
  }

  /**
   * Lower a statement that is not a statement line
   */
  private Statement lowerSmallStatement(LoweringContext context, Cst stmt)
                                          throws UserException {
    if (stmt.isLeaf() && stmt.asLeaf().isName("pass")) {
      return new Pass(PositionTracker.rangeOf(stmt));
    }
    PyNode lowered = lower(context.load(), stmt);
    if (lowered instanceof Statement) {
      return (Statement)lowered;
    } else if (lowered instanceof Expression) {
      return new ExprStmt(PositionTracker.rangeOf(stmt),
                          (Expression)lowered);
    } else {
      throw new MalformedTreeException(stmt, "not a statement: " +
                                       lowered.typeName());
    }
  }

  private Statement lowerExprStmt(LoweringContext context, CstNode stmt)
                                          throws UserException {
    if (stmt.childCount() < 2) {
      throw new MalformedTreeException(stmt, "expression statement without " +
                                       "assignment");
    }
    Cst second = stmt.child(1);
    if (second.is(Symbol.ANNASSIGN)) {
      return lowerAnnAssign(context, stmt);
    } else if (second.is(TokenKind.EQUAL)) {
      return lowerAssign(context, stmt);
    } else if (second.isLeaf() &&
               Operators.augmentedOperator(second.asLeaf().kind()) != null) {
      return lowerAugAssign(context, stmt);
    }
    throw new MalformedTreeException(stmt, "unexpected " + second.kindName());
  }

  /**
   * <code>a = b = value</code>: every child before the last is a target
   */
  private Statement lowerAssign(LoweringContext context, CstNode stmt)
                                          throws UserException {
    int n = stmt.childCount();
    if (n % 2 == 0) {
      throw new MalformedTreeException(stmt, "assignment without value");
    }
    List<Expression> targets = new ArrayList<Expression>();
    for (int i = 0; i < n - 1; i += 2) {
      if (!stmt.child(i + 1).is(TokenKind.EQUAL)) {
        throw new MalformedTreeException(stmt, "expected '=' in assignment");
      }
      targets.add(lowerTarget(context, stmt.child(i), TargetKind.ASSIGN));
    }
    Expression value = lowerExpr(context.load(), stmt.child(n - 1));
    return new Assign(PositionTracker.rangeOf(stmt), targets, value);
  }

  private Statement lowerAugAssign(LoweringContext context, CstNode stmt)
                                          throws UserException {
    if (stmt.childCount() != 3) {
      throw new MalformedTreeException(stmt, "augmented assignment must " +
                                       "have three children");
    }
    BinaryOperator op = Operators.augmentedOperator(
                                       stmt.child(1).asLeaf().kind());
    if (op == BinaryOperator.MAT_MULT) {
      VersionGate.require(context, stmt.child(1),
                          Feature.MATRIX_MULTIPLICATION);
    }
    Expression target = lowerTarget(context, stmt.child(0),
                                    TargetKind.AUGMENTED);
    Expression value = lowerExpr(context.load(), stmt.child(2));
    return new AugAssign(PositionTracker.rangeOf(stmt), target, op, value);
  }

  /**
   * <code>target: annotation [= value]</code>
   */
  private Statement lowerAnnAssign(LoweringContext context, CstNode stmt)
                                          throws UserException {
    VersionGate.require(context, stmt, Feature.ANNOTATED_ASSIGNMENT);
    Cst targetTree = stmt.child(0);
    Cst annassign = stmt.child(1);
    if (stmt.childCount() != 2 || annassign.childCount() < 2 ||
        !annassign.child(0).is(TokenKind.COLON)) {
      throw new MalformedTreeException(stmt, "malformed annotation");
    }

    Expression target = lowerExpr(context.withExprContext(ExprContext.STORE),
                                  targetTree);
    switch (target.kind()) {
      case NAME:
      case ATTRIBUTE:
      case SUBSCRIPT:
        break;
      case TUPLE:
        throw new UnsupportedSyntaxException(context, targetTree,
            "annotated assignment",
            "only single target (not tuple) can be annotated");
      case LIST:
        throw new UnsupportedSyntaxException(context, targetTree,
            "annotated assignment",
            "only single target (not list) can be annotated");
      default:
        throw new UnsupportedSyntaxException(context, targetTree,
            "annotated assignment", "illegal target for annotation");
    }
    // Only an unparenthesized name is "simple"
    boolean simple = targetTree.is(TokenKind.NAME);

    Expression annotation = lowerExpr(context.load(), annassign.child(1));
    Expression value = null;
    if (annassign.childCount() == 4) {
      if (!annassign.child(2).is(TokenKind.EQUAL)) {
        throw new MalformedTreeException(annassign, "expected '='");
      }
      value = lowerExpr(context.load(), annassign.child(3));
    } else if (annassign.childCount() != 2) {
      throw new MalformedTreeException(annassign, "unexpected children");
    }
    return new AnnAssign(PositionTracker.rangeOf(stmt), target, annotation,
                         value, simple);
  }

  /**
   * <code>del a, b[0]</code>: a target list becomes several targets
   */
  private Statement lowerDelete(LoweringContext context, CstNode stmt)
                                          throws UserException {
    if (stmt.childCount() != 2 || !stmt.child(0).asLeaf().isName("del")) {
      throw new MalformedTreeException(stmt, "malformed del statement");
    }
    Cst targetList = stmt.child(1);
    List<Cst> targetTrees = new ArrayList<Cst>();
    if (targetList.is(Symbol.EXPRLIST)) {
      for (Cst child: targetList.children()) {
        if (!child.is(TokenKind.COMMA)) {
          targetTrees.add(child);
        }
      }
    } else {
      targetTrees.add(targetList);
    }
    List<Expression> targets = new ArrayList<Expression>();
    for (Cst targetTree: targetTrees) {
      targets.add(lowerTarget(context, targetTree, TargetKind.DELETE));
    }
    return new Delete(PositionTracker.rangeOf(stmt), targets);
  }

  /**
   * <code>type Name[params] = value</code>
   */
  private Statement lowerTypeAlias(LoweringContext context, CstNode stmt)
                                          throws UserException {
    VersionGate.require(context, stmt, Feature.TYPE_ALIAS);
    int n = stmt.childCount();
    if (n < 4 || !stmt.child(0).asLeaf().isName("type") ||
        !stmt.child(1).is(TokenKind.NAME) ||
        !stmt.child(n - 2).is(TokenKind.EQUAL)) {
      throw new MalformedTreeException(stmt, "malformed type alias");
    }
    CstLeaf nameLeaf = stmt.child(1).asLeaf();
    Name name = new Name(PositionTracker.rangeOf(nameLeaf), nameLeaf.text(),
                         ExprContext.STORE);
    List<TypeParam> params = new ArrayList<TypeParam>();
    if (n == 5) {
      params = typeParamWalker.lowerList(context, stmt.child(2));
    } else if (n != 4) {
      throw new MalformedTreeException(stmt, "malformed type alias");
    }
    Expression value = lowerExpr(context.load(), stmt.child(n - 1));
    return new TypeAlias(PositionTracker.rangeOf(stmt), name, params, value);
  }

  /**
   * Lower an assignment or deletion target under the matching context
   * and check that it can be assigned to
   */
  private Expression lowerTarget(LoweringContext context, Cst tree,
                        TargetKind kind) throws UserException {
    Expression target = lowerExpr(
                  context.withExprContext(kind.exprContext()), tree);
    LValWalker.checkTarget(context, tree, target, kind);
    return target;
  }
}
