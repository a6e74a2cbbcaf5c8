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

import java.util.Collections;
import java.util.List;

/**
 * A token in the parse tree.
 * Line numbers start at 1, columns at 0.
 */
public final class CstLeaf extends Cst {
  private final TokenKind kind;
  private final String text;
  private final int line;
  private final int column;

  public CstLeaf(TokenKind kind, String text, int line, int column) {
    assert(kind != null);
    assert(text != null);
    this.kind = kind;
    this.text = text;
    this.line = line;
    this.column = column;
  }

  public TokenKind kind() {
    return kind;
  }

  public String text() {
    return text;
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  /**
   * @return true if this is a NAME leaf with the given text, which is
   *         how keywords are recognised
   */
  public boolean isName(String name) {
    return kind == TokenKind.NAME && text.equals(name);
  }

  @Override
  public int type() {
    return kind.type();
  }

  @Override
  public String kindName() {
    return kind.name();
  }

  @Override
  public boolean isLeaf() {
    return true;
  }

  @Override
  public List<Cst> children() {
    return Collections.emptyList();
  }

  @Override
  public CstLeaf firstLeaf() {
    return this;
  }

  @Override
  public void prettyPrint(StringBuilder sb) {
    sb.append(kind.name()).append(" '").append(text).append('\'');
  }
}
