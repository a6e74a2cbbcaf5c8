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

import com.google.common.collect.ImmutableList;

/**
 * A grammar production with its ordered children
 */
public final class CstNode extends Cst {
  private final Symbol symbol;
  private final ImmutableList<Cst> children;

  public CstNode(Symbol symbol, List<? extends Cst> children) {
    assert(symbol != null);
    this.symbol = symbol;
    this.children = ImmutableList.copyOf(children);
  }

  public Symbol symbol() {
    return symbol;
  }

  @Override
  public int type() {
    return symbol.type();
  }

  @Override
  public String kindName() {
    return symbol.grammarName();
  }

  @Override
  public boolean isLeaf() {
    return false;
  }

  @Override
  public List<Cst> children() {
    return children;
  }

  @Override
  public CstLeaf firstLeaf() {
    if (children.isEmpty()) {
      return null;
    }
    return children.get(0).firstLeaf();
  }

  @Override
  public void prettyPrint(StringBuilder sb) {
    sb.append(symbol.grammarName()).append('(');
    boolean first = true;
    for (Cst child: children) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      child.prettyPrint(sb);
    }
    sb.append(')');
  }
}
