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

package exm.pylower.ast;

import java.util.List;

import exm.pylower.common.exceptions.MalformedTreeException;

/**
 * A parse tree: either a {@link CstLeaf} token or a {@link CstNode}
 * production.  Parse trees are immutable and strictly tree shaped.
 */
public abstract class Cst {

  /**
   * @return token number for leaves, {@link Symbol#NT_OFFSET} or more
   *         for nodes
   */
  public abstract int type();

  /**
   * @return token name for leaves (e.g. "NAME") or production name
   *          for nodes (e.g. "arith_expr")
   */
  public abstract String kindName();

  public abstract boolean isLeaf();

  public abstract List<Cst> children();

  /**
   * @return leftmost leaf, or null for a node without children
   */
  public abstract CstLeaf firstLeaf();

  public boolean is(TokenKind kind) {
    return type() == kind.type();
  }

  public boolean is(Symbol symbol) {
    return type() == symbol.type();
  }

  /**
   * Shorter alternative to children().size()
   */
  public int childCount() {
    return children().size();
  }

  /**
   * @throws MalformedTreeException if there is no such child
   */
  public Cst child(int i) {
    List<Cst> children = children();
    if (i < 0 || i >= children.size()) {
      throw new MalformedTreeException(this, "no child " + i + " in " +
                                       kindName());
    }
    return children.get(i);
  }

  public Cst lastChild() {
    return child(childCount() - 1);
  }

  public CstLeaf asLeaf() {
    if (!isLeaf()) {
      throw new MalformedTreeException(this, "expected a token, got " +
                                       kindName());
    }
    return (CstLeaf)this;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb);
    return sb.toString();
  }

  /**
   * Single-line rendering for logs, e.g.
   * <code>arith_expr(NAME 'a', PLUS '+', NAME 'b')</code>
   */
  public abstract void prettyPrint(StringBuilder sb);
}
