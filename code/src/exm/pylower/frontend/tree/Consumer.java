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

import java.util.List;

import exm.pylower.ast.Cst;
import exm.pylower.ast.Symbol;
import exm.pylower.ast.TokenKind;

/**
 * Scans the children of a parse tree node left to right, taking optional
 * children only when they match.  Never throws: a caller that needs a
 * child which is absent decides how to fail.
 */
public class Consumer {
  private final List<Cst> children;
  private int index = 0;

  public Consumer(List<Cst> children) {
    this.children = children;
  }

  /**
   * @return next child, or null at the end
   */
  public Cst consumeIf() {
    if (atEnd()) {
      return null;
    }
    return children.get(index++);
  }

  /**
   * @return next child if it is a token of the given kind, otherwise null
   */
  public Cst consumeIf(TokenKind kind) {
    if (atEnd() || !children.get(index).is(kind)) {
      return null;
    }
    return children.get(index++);
  }

  /**
   * @return next child if it is a production of the given kind,
   *         otherwise null
   */
  public Cst consumeIf(Symbol symbol) {
    if (atEnd() || !children.get(index).is(symbol)) {
      return null;
    }
    return children.get(index++);
  }

  /**
   * @return next child without consuming it, or null at the end
   */
  public Cst peek() {
    if (atEnd()) {
      return null;
    }
    return children.get(index);
  }

  public boolean atEnd() {
    return index >= children.size();
  }
}
